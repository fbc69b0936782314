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

package pixl.lib.algorithms.contrast;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixl.lib.analysis.stats.HistogramTools;
import pixl.lib.images.ImagePlane;
import pixl.lib.images.PixelImage;
import pixl.lib.images.PixelImageTools;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

/**
 * Adaptive histogram equalization (AHE), or contrast-limited AHE (CLAHE) if a clip limit is given.
 * <p>
 * Every pixel is equalized using the histogram of a square window centered on it, with mirrored 
 * boundaries. The window slides over the plane in serpentine order (left to right, then right to left 
 * on the next row) so that each step only needs to remove one column or row and add another.
 * <p>
 * The same plane policy as {@link HistogramEqualization} applies. Images are modified in place, 
 * and may be left partially modified if the operation is cancelled.
 */
public class AdaptiveHistogramEqualization {
	
	private static final Logger logger = LoggerFactory.getLogger(AdaptiveHistogramEqualization.class);
	
	/**
	 * Parameter key for the window size.
	 */
	public static final String KEY_TILE_SIZE = "tileSize";
	
	/**
	 * Parameter key for the clip limit.
	 */
	public static final String KEY_CLIP_LIMIT = "clipLimit";
	
	/**
	 * Default window size.
	 */
	public static final int DEFAULT_TILE_SIZE = 128;
	
	// Suppressed default constructor for non-instantiability
	private AdaptiveHistogramEqualization() {
		throw new AssertionError();
	}
	
	/**
	 * Get the parameters supported by {@link #adaptiveEqualize(PixelImage, ParameterList, CancellationContext)}.
	 * @return
	 */
	public static ParameterList getDefaultParameterList() {
		return new ParameterList()
				.addIntParameter(KEY_TILE_SIZE, "Tile size", DEFAULT_TILE_SIZE, "px", 1, Integer.MAX_VALUE, 
						"Side length of the square window used to compute each local histogram")
				.addDoubleParameter(KEY_CLIP_LIMIT, "Clip limit", 0, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 
						"Limit each local histogram bin to this multiple of the mean bin count; values <= 0 give plain AHE");
	}
	
	/**
	 * Equalize an image using values from a parameter list.
	 * @param image
	 * @param params
	 * @param cancellation
	 * @return true if the image was fully equalized, false if cancelled
	 * @see #getDefaultParameterList()
	 */
	public static boolean adaptiveEqualize(PixelImage image, ParameterList params, CancellationContext cancellation) {
		return adaptiveEqualize(image, params.getIntParameterValue(KEY_TILE_SIZE), params.getDoubleParameterValue(KEY_CLIP_LIMIT), cancellation);
	}
	
	/**
	 * Apply adaptive histogram equalization to an image in place.
	 * @param image the image to modify
	 * @param tileSize side length of the window, must be at least 1
	 * @param clipLimit clip limit; values {@code <= 0} mean no clipping
	 * @param cancellation
	 * @return true if the image was fully equalized, false if cancelled
	 */
	public static boolean adaptiveEqualize(PixelImage image, int tileSize, double clipLimit, CancellationContext cancellation) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(cancellation, "Cancellation context must not be null");
		checkTileSize(tileSize);
		
		long startTime = System.currentTimeMillis();
		boolean completed;
		if (image.isGrayscale()) {
			completed = equalizePlane(image.getPlane(0), tileSize, clipLimit, cancellation);
			PixelImageTools.applyPlaneToColorPlanes(image, 0);
		} else {
			double[][] hsv = PixelImageTools.toHSV(image);
			var value = ImagePlane.fromDoubles(hsv[2], image.getWidth(), image.getHeight());
			completed = equalizePlane(value, tileSize, clipLimit, cancellation);
			hsv[2] = value.toDoubles();
			PixelImageTools.setPixelsFromHSV(image, hsv);
		}
		long endTime = System.currentTimeMillis();
		if (completed)
			logger.info("Adaptive equalization of {} (tile size {}, clip limit {}) completed in {} ms", image, tileSize, clipLimit, endTime - startTime);
		else
			logger.info("Adaptive equalization of {} cancelled", image);
		return completed;
	}
	
	/**
	 * Apply adaptive histogram equalization to a single plane in place.
	 * <p>
	 * Histograms are always computed from an unmodified copy of the input. 
	 * Cancellation is checked once per pixel.
	 * 
	 * @param plane the plane to modify
	 * @param tileSize side length of the window, must be at least 1
	 * @param clipLimit clip limit; values {@code <= 0} mean no clipping
	 * @param cancellation
	 * @return true if the plane was fully equalized, false if cancelled
	 */
	public static boolean equalizePlane(ImagePlane plane, int tileSize, double clipLimit, CancellationContext cancellation) {
		Objects.requireNonNull(plane, "Plane must not be null");
		checkTileSize(tileSize);
		
		var source = new ImagePlane(plane);
		int width = plane.getWidth();
		int height = plane.getHeight();
		long pixelCount = (long)tileSize * tileSize;
		boolean doClip = clipLimit > 0;
		
		// Window edges (inclusive) for pixel (0, 0)
		int left = -(tileSize / 2);
		int right = left + tileSize - 1;
		int top = -(tileSize / 2);
		int bottom = top + tileSize - 1;
		
		int[] hist = HistogramTools.getHistogram(source, left, top, tileSize, tileSize);
		int[] histClipped = doClip ? new int[hist.length] : null;
		
		for (int y = 0; y < height; y++) {
			boolean leftToRight = y % 2 == 0;
			if (y > 0) {
				// Move down one row
				for (int xx = left; xx <= right; xx++) {
					hist[source.getMirroredValue(xx, top)]--;
					hist[source.getMirroredValue(xx, bottom + 1)]++;
				}
				top++;
				bottom++;
			}
			for (int i = 0; i < width; i++) {
				int x = leftToRight ? i : width - 1 - i;
				if (i > 0) {
					if (leftToRight) {
						for (int yy = top; yy <= bottom; yy++) {
							hist[source.getMirroredValue(left, yy)]--;
							hist[source.getMirroredValue(right + 1, yy)]++;
						}
						left++;
						right++;
					} else {
						for (int yy = top; yy <= bottom; yy++) {
							hist[source.getMirroredValue(right, yy)]--;
							hist[source.getMirroredValue(left - 1, yy)]++;
						}
						left--;
						right--;
					}
				}
				
				if (cancellation.isCancelled())
					return false;
				
				int value = source.getValue(x, y);
				if (doClip) {
					System.arraycopy(hist, 0, histClipped, 0, hist.length);
					HistogramTools.clipHistogram(histClipped, clipLimit, pixelCount);
					plane.setValue(x, y, HistogramTools.equalizedValue(histClipped, value, HistogramTools.sum(histClipped)));
				} else
					plane.setValue(x, y, HistogramTools.equalizedValue(hist, value, pixelCount));
			}
		}
		return true;
	}
	
	private static void checkTileSize(int tileSize) {
		if (tileSize < 1)
			throw new IllegalArgumentException("Tile size must be >= 1, but got " + tileSize);
	}

}
