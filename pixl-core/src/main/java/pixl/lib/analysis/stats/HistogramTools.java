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

package pixl.lib.analysis.stats;

import pixl.lib.images.ImagePlane;

/**
 * Static methods to compute and modify 256-bin histograms of 8-bit planes.
 * <p>
 * Windows may extend beyond the plane; values outside are read with mirrored boundary handling.
 */
public class HistogramTools {
	
	/**
	 * Number of bins in every histogram.
	 */
	public static final int N_BINS = 256;
	
	// Suppressed default constructor for non-instantiability
	private HistogramTools() {
		throw new AssertionError();
	}
	
	/**
	 * Compute the histogram of a full plane.
	 * @param plane
	 * @return
	 */
	public static int[] getHistogram(ImagePlane plane) {
		return getHistogram(plane, 0, 0, plane.getWidth(), plane.getHeight());
	}
	
	/**
	 * Compute the histogram of a rectangular window.
	 * @param plane
	 * @param x left of the window; may be negative
	 * @param y top of the window; may be negative
	 * @param width window width
	 * @param height window height
	 * @return 256 counts, summing to {@code width * height}
	 */
	public static int[] getHistogram(ImagePlane plane, int x, int y, int width, int height) {
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Histogram window must have non-negative size, but got " + width + "x" + height);
		int[] hist = new int[N_BINS];
		for (int yy = y; yy < y + height; yy++) {
			for (int xx = x; xx < x + width; xx++)
				hist[plane.getMirroredValue(xx, yy)]++;
		}
		return hist;
	}
	
	/**
	 * Compute the histogram of a window centered on a pixel.
	 * The top left of the window is {@code (cx - width/2, cy - height/2)}.
	 * @param plane
	 * @param cx
	 * @param cy
	 * @param width
	 * @param height
	 * @return
	 */
	public static int[] getHistogramFromCenter(ImagePlane plane, int cx, int cy, int width, int height) {
		return getHistogram(plane, cx - width / 2, cy - height / 2, width, height);
	}
	
	/**
	 * Clip a histogram in place and redistribute the excess counts evenly over all bins.
	 * <p>
	 * Does nothing if {@code clipLimit <= 0}. Otherwise bins are capped at 
	 * {@code round(clipLimit * pixelCount / 256)}, and {@code round(excess / 256)} is added to every bin.
	 * Redistribution is applied once, so some bins may again exceed the clip level afterwards.
	 * 
	 * @param hist histogram to modify
	 * @param clipLimit
	 * @param pixelCount number of pixels the histogram describes
	 */
	public static void clipHistogram(int[] hist, double clipLimit, long pixelCount) {
		if (clipLimit <= 0)
			return;
		long clipLevel = Math.round(clipLimit * pixelCount / hist.length);
		long excess = 0;
		for (int i = 0; i < hist.length; i++) {
			if (hist[i] > clipLevel) {
				excess += hist[i] - clipLevel;
				hist[i] = (int)clipLevel;
			}
		}
		int increment = (int)Math.round(excess / (double)hist.length);
		if (increment == 0)
			return;
		for (int i = 0; i < hist.length; i++)
			hist[i] += increment;
	}
	
	/**
	 * Sum of all counts.
	 * @param hist
	 * @return
	 */
	public static long sum(int[] hist) {
		long total = 0;
		for (int h : hist)
			total += h;
		return total;
	}
	
	/**
	 * Compute the equalized output for an input value, given a histogram.
	 * <p>
	 * The first value with a nonzero count maps to 0; later values map to 
	 * {@code round((cdf(v) - cdfMin) / (total - cdfMin) * 255)}, clipped to 0-255.
	 * The walk stops at {@code value}, so only bins up to it are visited.
	 * 
	 * @param hist
	 * @param value
	 * @param total sum of the histogram counts
	 * @return
	 */
	public static int equalizedValue(int[] hist, int value, long total) {
		long cdf = 0;
		long cdfMin = -1;
		for (int v = 0; v <= value; v++) {
			if (hist[v] <= 0)
				continue;
			cdf += hist[v];
			if (cdfMin < 0)
				cdfMin = cdf;
		}
		return mapCDF(cdf, cdfMin, total);
	}
	
	/**
	 * Compute a full 256-entry equalization lookup table from a histogram.
	 * @param hist
	 * @return
	 * @see #equalizedValue(int[], int, long)
	 */
	public static int[] equalizationTable(int[] hist) {
		long total = sum(hist);
		int[] table = new int[N_BINS];
		long cdf = 0;
		long cdfMin = -1;
		for (int v = 0; v < N_BINS; v++) {
			if (hist[v] > 0) {
				cdf += hist[v];
				if (cdfMin < 0)
					cdfMin = cdf;
			}
			table[v] = mapCDF(cdf, cdfMin, total);
		}
		return table;
	}
	
	private static int mapCDF(long cdf, long cdfMin, long total) {
		if (cdfMin < 0 || cdf == cdfMin)
			return 0;
		long denominator = total - cdfMin;
		if (denominator <= 0)
			return 0;
		long value = Math.round((cdf - cdfMin) * 255.0 / denominator);
		return value < 0 ? 0 : (value > 255 ? 255 : (int)value);
	}

}
