/*-
 * #%L
 * This file is part of Pixl.
 * %%
 * Copyright (C) 2026 Pixl developers
 * %%
 * Pixl is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Pixl is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Pixl.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixl.lib.common;

/**
 * Static functions to help work with RGB colors using packed ints.
 * <p>
 * Packed values follow the layout of {@link java.awt.Color#getRGB()}: alpha in the top byte, then red, green and blue.
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Packed int representing white.
	 */
	public static final int WHITE = packRGB(255, 255, 255);

	/**
	 * Packed int representing black.
	 */
	public static final int BLACK = packRGB(0, 0, 0);

	/**
	 * Packed int representing red.
	 */
	public static final int RED = packRGB(255, 0, 0);

	/**
	 * Packed int representing green.
	 */
	public static final int GREEN = packRGB(0, 255, 0);

	/**
	 * Packed int representing blue.
	 */
	public static final int BLUE = packRGB(0, 0, 255);

	/**
	 * Packed int representing yellow.
	 */
	public static final int YELLOW = packRGB(255, 255, 0);
	
	/**
	 * Make a packed RGB value from specified input values.
	 * The alpha value is 255.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packRGB(int r, int g, int b) {
		return ((255 & 0xff)<<24) + 
			   ((r & 0xff)<<16) + 
			   ((g & 0xff)<<8) + 
			    (b & 0xff);
	}
	
	/**
	 * Round an input value and clip it to be an integer in the range 0-255.
	 * 
	 * @param v
	 * @return
	 */
	public static int roundTo8Bit(double v) {
		return v < 0 ? 0 : (v > 255 ? 255 : (int)Math.round(v));
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}
	
	/**
	 * Parse a hex color string, with or without a leading '#', e.g. "ff0000" for red.
	 * 
	 * @param hex
	 * @return packed RGB value with alpha 255
	 * @throws IllegalArgumentException if the string is not a 6-digit hex value
	 */
	public static int parseHexRGB(String hex) {
		String s = hex.startsWith("#") ? hex.substring(1) : hex;
		if (s.length() != 6)
			throw new IllegalArgumentException("Expected a 6-digit hex color, but got '" + hex + "'");
		try {
			return 0xff000000 | Integer.parseInt(s, 16);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Expected a 6-digit hex color, but got '" + hex + "'", e);
		}
	}

}
