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

package pixl.lib.color;

import java.awt.Color;

import pixl.lib.common.ColorTools;

/**
 * Static methods for converting packed RGB values to and from other color spaces.
 * <p>
 * HSV uses {@link Color#RGBtoHSB(int, int, int, float[])}, with all components in the range 0-1.
 * CIELAB assumes sRGB input with a D65 white point; L is in the range 0-100, a and b are approximately -128 to 127.
 */
public class ColorTransformer {
	
	// D65 reference white
	private static final double XN = 0.95047;
	private static final double YN = 1.0;
	private static final double ZN = 1.08883;
	
	private static final double DELTA = 6.0 / 29.0;
	private static final double DELTA_CUBED = DELTA * DELTA * DELTA;
	
	// Suppressed default constructor for non-instantiability
	private ColorTransformer() {
		throw new AssertionError();
	}
	
	/**
	 * Convert 8-bit RGB values to hue, saturation and value.
	 * @param r
	 * @param g
	 * @param b
	 * @param hsv optional array to store the output; a new array is created if this is null
	 * @return array containing hue, saturation and value
	 */
	public static float[] rgbToHSV(int r, int g, int b, float[] hsv) {
		return Color.RGBtoHSB(r, g, b, hsv);
	}
	
	/**
	 * Convert hue, saturation and value to a packed RGB value.
	 * @param h
	 * @param s
	 * @param v
	 * @return
	 */
	public static int hsvToRGB(float h, float s, float v) {
		return Color.HSBtoRGB(h, s, v) | 0xff000000;
	}
	
	/**
	 * Convert 8-bit sRGB values to CIELAB.
	 * @param r
	 * @param g
	 * @param b
	 * @param lab optional array to store the output; a new array is created if this is null or too short
	 * @return array containing L, a and b
	 */
	public static double[] rgbToLab(int r, int g, int b, double[] lab) {
		if (lab == null || lab.length < 3)
			lab = new double[3];
		double rl = srgbToLinear(r / 255.0);
		double gl = srgbToLinear(g / 255.0);
		double bl = srgbToLinear(b / 255.0);
		
		double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
		double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
		double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;
		
		double fx = labF(x / XN);
		double fy = labF(y / YN);
		double fz = labF(z / ZN);
		
		lab[0] = 116.0 * fy - 16.0;
		lab[1] = 500.0 * (fx - fy);
		lab[2] = 200.0 * (fy - fz);
		return lab;
	}
	
	/**
	 * Convert CIELAB to a packed sRGB value, clipping to the displayable range.
	 * @param l
	 * @param a
	 * @param b
	 * @return
	 */
	public static int labToRGB(double l, double a, double b) {
		double fy = (l + 16.0) / 116.0;
		double fx = fy + a / 500.0;
		double fz = fy - b / 200.0;
		
		double x = XN * labFInverse(fx);
		double y = YN * labFInverse(fy);
		double z = ZN * labFInverse(fz);
		
		double rl =  3.2404542 * x - 1.5371385 * y - 0.4985314 * z;
		double gl = -0.9692660 * x + 1.8760108 * y + 0.0415560 * z;
		double bl =  0.0556434 * x - 0.2040259 * y + 1.0572252 * z;
		
		return ColorTools.packRGB(
				ColorTools.roundTo8Bit(linearToSRGB(rl) * 255.0),
				ColorTools.roundTo8Bit(linearToSRGB(gl) * 255.0),
				ColorTools.roundTo8Bit(linearToSRGB(bl) * 255.0));
	}
	
	private static double srgbToLinear(double c) {
		return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
	}
	
	private static double linearToSRGB(double c) {
		if (c <= 0)
			return 0;
		return c <= 0.0031308 ? c * 12.92 : 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
	}
	
	private static double labF(double t) {
		return t > DELTA_CUBED ? Math.cbrt(t) : t / (3 * DELTA * DELTA) + 4.0 / 29.0;
	}
	
	private static double labFInverse(double t) {
		return t > DELTA ? t * t * t : 3 * DELTA * DELTA * (t - 4.0 / 29.0);
	}

}
