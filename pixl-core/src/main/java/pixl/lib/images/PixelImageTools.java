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

import java.util.List;
import java.util.Objects;

import pixl.lib.color.ColorTransformer;
import pixl.lib.common.ColorTools;

/**
 * Static methods for color conversion and simple rendering on {@link PixelImage}s.
 */
public class PixelImageTools {
	
	// Suppressed default constructor for non-instantiability
	private PixelImageTools() {
		throw new AssertionError();
	}
	
	/**
	 * Copy one plane onto all other color planes (those with index {@code < min(nPlanes, 3)}).
	 * Any alpha plane is left unchanged.
	 * @param image
	 * @param planeIndex
	 */
	public static void applyPlaneToColorPlanes(PixelImage image, int planeIndex) {
		var source = image.getPlane(planeIndex);
		int n = Math.min(image.nPlanes(), 3);
		for (int i = 0; i < n; i++) {
			if (i != planeIndex)
				image.getPlane(i).setPixels(source);
		}
	}
	
	/**
	 * Create an RGB copy of an image.
	 * <p>
	 * Images with at least 3 planes are copied (dropping any alpha plane). Single-plane images with a palette 
	 * are converted using the palette; other images use plane 0 for red, green and blue.
	 * Metadata is copied.
	 * @param image
	 * @return a new image with exactly 3 planes
	 */
	public static PixelImage toRGB(PixelImage image) {
		Objects.requireNonNull(image, "Image must not be null");
		int w = image.getWidth();
		int h = image.getHeight();
		var rgb = new PixelImage(List.of(new ImagePlane(w, h), new ImagePlane(w, h), new ImagePlane(w, h)), null, new ImageMetadata(image.getMetadata()));
		if (image.nPlanes() >= 3) {
			for (int i = 0; i < 3; i++)
				rgb.getPlane(i).setPixels(image.getPlane(i));
			return rgb;
		}
		int[] palette = image.nPlanes() == 1 ? image.getPalette() : null;
		var plane = image.getPlane(0);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int v = plane.getValue(x, y);
				if (palette != null && v < palette.length)
					rgb.setRGB(x, y, palette[v]);
				else
					rgb.setRGB(x, y, ColorTools.packRGB(v, v, v));
			}
		}
		return rgb;
	}
	
	/**
	 * Convert an image to HSV.
	 * @param image image with at least 3 planes
	 * @return hue, saturation and value arrays, each in row-major order with values 0-1
	 */
	public static double[][] toHSV(PixelImage image) {
		checkColor(image);
		int w = image.getWidth();
		int h = image.getHeight();
		double[][] hsv = new double[3][w * h];
		float[] temp = new float[3];
		var r = image.getPlane(0);
		var g = image.getPlane(1);
		var b = image.getPlane(2);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int i = y * w + x;
				ColorTransformer.rgbToHSV(r.getValue(x, y), g.getValue(x, y), b.getValue(x, y), temp);
				hsv[0][i] = temp[0];
				hsv[1][i] = temp[1];
				hsv[2][i] = temp[2];
			}
		}
		return hsv;
	}
	
	/**
	 * Set the color planes of an image from HSV values.
	 * @param image image with at least 3 planes
	 * @param hsv hue, saturation and value arrays as returned by {@link #toHSV(PixelImage)}
	 */
	public static void setPixelsFromHSV(PixelImage image, double[][] hsv) {
		checkColor(image);
		int w = image.getWidth();
		int h = image.getHeight();
		if (hsv.length < 3 || hsv[0].length != w * h || hsv[1].length != w * h || hsv[2].length != w * h)
			throw new IllegalArgumentException("HSV arrays must have length " + (w * h));
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int i = y * w + x;
				image.setRGB(x, y, ColorTransformer.hsvToRGB((float)hsv[0][i], (float)hsv[1][i], (float)hsv[2][i]));
			}
		}
	}
	
	/**
	 * Convert an image to CIELAB.
	 * Images with fewer than 3 planes are treated as gray, using plane 0 for red, green and blue.
	 * @param image
	 * @return L, a and b arrays, each in row-major order
	 */
	public static double[][] toCIELAB(PixelImage image) {
		int w = image.getWidth();
		int h = image.getHeight();
		boolean color = image.nPlanes() >= 3;
		var r = image.getPlane(0);
		var g = color ? image.getPlane(1) : r;
		var b = color ? image.getPlane(2) : r;
		double[][] lab = new double[3][w * h];
		double[] temp = new double[3];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int i = y * w + x;
				ColorTransformer.rgbToLab(r.getValue(x, y), g.getValue(x, y), b.getValue(x, y), temp);
				lab[0][i] = temp[0];
				lab[1][i] = temp[1];
				lab[2][i] = temp[2];
			}
		}
		return lab;
	}
	
	/**
	 * Paint every pixel with the color of its segment.
	 * Pixels with label -1 (unassigned) are painted black.
	 * @param image image with at least 3 planes, modified in place
	 * @param labels labels indexed as {@code labels[y][x]}
	 * @param colors packed RGB color per label
	 */
	public static void applySegments(PixelImage image, int[][] labels, int[] colors) {
		checkColor(image);
		Objects.requireNonNull(labels, "Labels must not be null");
		Objects.requireNonNull(colors, "Colors must not be null");
		if (labels.length != image.getHeight())
			throw new IllegalArgumentException("Label grid has " + labels.length + " rows, but image height is " + image.getHeight());
		for (int y = 0; y < image.getHeight(); y++) {
			if (labels[y].length != image.getWidth())
				throw new IllegalArgumentException("Label grid row " + y + " has length " + labels[y].length + ", but image width is " + image.getWidth());
			for (int x = 0; x < image.getWidth(); x++) {
				int label = labels[y][x];
				image.setRGB(x, y, label < 0 ? ColorTools.BLACK : colors[label]);
			}
		}
	}
	
	/**
	 * Draw squares centered on a list of points, for example to show cluster centers.
	 * Squares are clipped to the image bounds.
	 * @param image image with at least 3 planes, modified in place
	 * @param centers points as {@code (y, x)} pairs
	 * @param sideLength side length of each square, in pixels
	 * @param fill packed RGB fill color
	 * @param border packed RGB border color
	 */
	public static void drawSquares(PixelImage image, int[][] centers, int sideLength, int fill, int border) {
		checkColor(image);
		if (sideLength < 1)
			throw new IllegalArgumentException("Square side length must be >= 1, but got " + sideLength);
		for (int[] center : centers) {
			int y0 = center[0] - sideLength / 2;
			int x0 = center[1] - sideLength / 2;
			int y1 = y0 + sideLength - 1;
			int x1 = x0 + sideLength - 1;
			for (int y = Math.max(y0, 0); y <= Math.min(y1, image.getHeight() - 1); y++) {
				for (int x = Math.max(x0, 0); x <= Math.min(x1, image.getWidth() - 1); x++) {
					boolean edge = y == y0 || y == y1 || x == x0 || x == x1;
					image.setRGB(x, y, edge ? border : fill);
				}
			}
		}
	}
	
	private static void checkColor(PixelImage image) {
		Objects.requireNonNull(image, "Image must not be null");
		if (image.nPlanes() < 3)
			throw new IllegalArgumentException("Operation requires an image with at least 3 planes, but got " + image.nPlanes());
	}

}
