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

package pixl.lib.images;

import java.util.Arrays;
import java.util.Objects;

import pixl.lib.common.ColorTools;

/**
 * A single channel of an image, stored as unsigned 8-bit values in row-major order.
 * <p>
 * Each plane owns its storage; the copy constructor creates an independent deep copy.
 * Windowed operations should use {@link #getMirroredValue(int, int)}, which reflects coordinates 
 * that fall outside the plane rather than clamping them.
 */
public class ImagePlane {
	
	private final int width;
	private final int height;
	private final byte[] pixels;
	
	/**
	 * Create a new plane filled with zeros.
	 * @param width plane width, must be &gt; 0
	 * @param height plane height, must be &gt; 0
	 */
	public ImagePlane(int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Plane dimensions must be > 0, but got " + width + "x" + height);
		this.width = width;
		this.height = height;
		this.pixels = new byte[width * height];
	}
	
	/**
	 * Create a deep copy of an existing plane.
	 * @param plane
	 */
	public ImagePlane(ImagePlane plane) {
		Objects.requireNonNull(plane, "Plane must not be null");
		this.width = plane.width;
		this.height = plane.height;
		this.pixels = plane.pixels.clone();
	}
	
	/**
	 * Create a plane by extracting one channel from interleaved byte data.
	 * 
	 * @param width
	 * @param height
	 * @param data interleaved pixel data
	 * @param offset index of the first sample for this channel
	 * @param step number of bytes between consecutive samples of this channel
	 * @return
	 */
	public static ImagePlane createFromInterleaved(int width, int height, byte[] data, int offset, int step) {
		var plane = new ImagePlane(width, height);
		int n = width * height;
		if (offset < 0 || step < 1 || offset + (long)(n - 1) * step >= data.length)
			throw new IllegalArgumentException("Interleaved data too short for " + width + "x" + height + " plane (offset=" + offset + ", step=" + step + ")");
		for (int i = 0; i < n; i++)
			plane.pixels[i] = data[offset + i * step];
		return plane;
	}
	
	/**
	 * Create a plane from values in the range 0-1, scaling by 255 and rounding.
	 * Values outside the range are clipped.
	 * 
	 * @param values row-major values, length width * height
	 * @param width
	 * @param height
	 * @return
	 */
	public static ImagePlane fromDoubles(double[] values, int width, int height) {
		var plane = new ImagePlane(width, height);
		if (values.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " values, but got " + values.length);
		for (int i = 0; i < values.length; i++)
			plane.pixels[i] = (byte)ColorTools.roundTo8Bit(values[i] * 255.0);
		return plane;
	}
	
	/**
	 * Get all values scaled to the range 0-1, in row-major order.
	 * @return
	 */
	public double[] toDoubles() {
		double[] values = new double[pixels.length];
		for (int i = 0; i < pixels.length; i++)
			values[i] = (pixels[i] & 0xff) / 255.0;
		return values;
	}
	
	/**
	 * Plane width in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Plane height in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the value at a pixel location, in the range 0-255.
	 * @param x
	 * @param y
	 * @return
	 */
	public int getValue(int x, int y) {
		return pixels[y * width + x] & 0xff;
	}
	
	/**
	 * Set the value at a pixel location. Only the lowest 8 bits are retained.
	 * @param x
	 * @param y
	 * @param value
	 */
	public void setValue(int x, int y, int value) {
		pixels[y * width + x] = (byte)value;
	}
	
	/**
	 * Get the value at a pixel location, reflecting coordinates outside the plane.
	 * <p>
	 * An index {@code i < 0} is read from {@code -1 - i}, an index {@code i >= n} from {@code 2n - i - 1}.
	 * Coordinates further away keep reflecting with period {@code 2n}.
	 * 
	 * @param x
	 * @param y
	 * @return
	 */
	public int getMirroredValue(int x, int y) {
		return pixels[mirrorIndex(y, height) * width + mirrorIndex(x, width)] & 0xff;
	}
	
	static int mirrorIndex(int i, int n) {
		if (i >= 0 && i < n)
			return i;
		int ind = Math.floorMod(i, 2 * n);
		return ind < n ? ind : 2 * n - ind - 1;
	}
	
	/**
	 * Copy all values from another plane of the same size.
	 * @param plane
	 * @throws IllegalArgumentException if the plane dimensions differ
	 */
	public void setPixels(ImagePlane plane) {
		if (plane.width != width || plane.height != height)
			throw new IllegalArgumentException("Cannot copy " + plane.width + "x" + plane.height + " plane into " + width + "x" + height + " plane");
		System.arraycopy(plane.pixels, 0, pixels, 0, pixels.length);
	}
	
	/**
	 * Set every pixel to the same value.
	 * @param value
	 */
	public void fill(int value) {
		Arrays.fill(pixels, (byte)value);
	}
	
	/**
	 * Check whether another plane has the same size and identical values.
	 * @param plane
	 * @return
	 */
	public boolean hasSamePixels(ImagePlane plane) {
		return plane.width == width && plane.height == height && Arrays.equals(pixels, plane.pixels);
	}
	
	@Override
	public String toString() {
		return "ImagePlane [" + width + "x" + height + "]";
	}

}
