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

package pixl.lib.algorithms.superpixels;

import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixl.lib.color.ColorTransformer;
import pixl.lib.common.GeneralTools;
import pixl.lib.images.PixelImage;
import pixl.lib.images.PixelImageTools;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

/**
 * Superpixel segmentation using Simple Linear Iterative Clustering (SLIC).
 * <p>
 * Pixels are clustered in CIELAB color and (x, y) position, starting from seeds on a regular grid.
 * See Achanta et al., <i>SLIC Superpixels Compared to State-of-the-Art Superpixel Methods</i>, 
 * IEEE TPAMI 2012.
 * <p>
 * Clusters that have no assigned pixels after an assignment step keep their previous mean, 
 * and are not reseeded. Pixels that end up outside every search window after the last round 
 * are given the label of the nearest center over all clusters, so every label is in the range 0 to k-1.
 */
public class SLICSuperpixels {
	
	private static final Logger logger = LoggerFactory.getLogger(SLICSuperpixels.class);
	
	/**
	 * Parameter key for the number of superpixels.
	 */
	public static final String KEY_K = "k";
	
	/**
	 * Parameter key for the compactness.
	 */
	public static final String KEY_COMPACTNESS = "compactness";
	
	/**
	 * Number of assignment/update rounds.
	 */
	public static final int N_ITERATIONS = 10;
	
	// Suppressed default constructor for non-instantiability
	private SLICSuperpixels() {
		throw new AssertionError();
	}
	
	/**
	 * Get the parameters supported by {@link #segment(PixelImage, ParameterList, CancellationContext)}.
	 * @return
	 */
	public static ParameterList getDefaultParameterList() {
		return new ParameterList()
				.addIntParameter(KEY_K, "Number of superpixels", 100, null, 1, Integer.MAX_VALUE, 
						"Desired number of approximately equally-sized superpixels")
				.addDoubleParameter(KEY_COMPACTNESS, "Compactness", 10, null, Double.MIN_VALUE, Double.MAX_VALUE, 
						"Weight of spatial proximity relative to color similarity, usually in the range 1-40; higher values give more compact superpixels");
	}
	
	/**
	 * Segment an image using values from a parameter list.
	 * @param image
	 * @param params
	 * @param cancellation
	 * @return the segmentation, or null if cancelled
	 * @see #getDefaultParameterList()
	 */
	public static SuperpixelResult segment(PixelImage image, ParameterList params, CancellationContext cancellation) {
		return segment(image, params.getIntParameterValue(KEY_K), params.getDoubleParameterValue(KEY_COMPACTNESS), cancellation);
	}
	
	/**
	 * Segment an image into superpixels.
	 * <p>
	 * Images with fewer than 3 planes are treated as gray. The image itself is not modified.
	 * 
	 * @param image
	 * @param k desired number of superpixels
	 * @param compactness relative weight of spatial distance, must be finite and &gt; 0
	 * @param cancellation
	 * @return the segmentation, or null if cancelled
	 * @throws IllegalArgumentException if k is too large for the image, or parameters are invalid
	 */
	public static SuperpixelResult segment(PixelImage image, int k, double compactness, CancellationContext cancellation) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(cancellation, "Cancellation context must not be null");
		if (k < 1)
			throw new IllegalArgumentException("Number of superpixels must be >= 1, but got " + k);
		if (!Double.isFinite(compactness) || compactness <= 0)
			throw new IllegalArgumentException("Compactness must be finite and > 0, but got " + compactness);
		
		int width = image.getWidth();
		int height = image.getHeight();
		long nPixels = (long)width * height;
		int s = (int)Math.round(Math.sqrt(nPixels / (double)k));
		if (s == 0)
			throw new IllegalArgumentException("Cannot create " + k + " superpixels for " + width + "x" + height + " image");
		
		long startTime = System.currentTimeMillis();
		
		double[][] lab = PixelImageTools.toCIELAB(image);
		double[][] centerColors = new double[k][3];
		int[][] centers = new int[k][2];
		
		if (!initializeCenters(lab, width, height, k, s, centerColors, centers, cancellation))
			return null;
		
		int[][] labels = new int[height][width];
		double[][] distances = new double[height][width];
		double m2 = compactness * compactness;
		double[][] sumColors = new double[k][3];
		long[][] sumPositions = new long[k][2];
		int[] counts = new int[k];
		
		for (int iter = 0; iter < N_ITERATIONS; iter++) {
			for (int y = 0; y < height; y++) {
				Arrays.fill(labels[y], -1);
				Arrays.fill(distances[y], Double.POSITIVE_INFINITY);
			}
			
			if (cancellation.isCancelled())
				return null;
			
			// Assign each pixel to the nearest center within a 2S x 2S window
			for (int j = k - 1; j >= 0; j--) {
				int cy = centers[j][0];
				int cx = centers[j][1];
				double cl = centerColors[j][0];
				double ca = centerColors[j][1];
				double cb = centerColors[j][2];
				int yStart = Math.min(cy + s - 1, height - 1);
				int yEnd = Math.max(cy - s, 0);
				int xStart = Math.min(cx + s - 1, width - 1);
				int xEnd = Math.max(cx - s, 0);
				for (int y = yStart; y >= yEnd; y--) {
					for (int x = xStart; x >= xEnd; x--) {
						int ind = y * width + x;
						double dl = cl - lab[0][ind];
						double da = ca - lab[1][ind];
						double db = cb - lab[2][ind];
						double dc2 = dl*dl + da*da + db*db;
						double dx = cx - x;
						double dy = cy - y;
						double ds2 = (dx*dx + dy*dy) / ((double)s * s);
						double d = Math.sqrt(dc2 + ds2 * m2);
						if (d < distances[y][x]) {
							distances[y][x] = d;
							labels[y][x] = j;
						}
					}
				}
			}
			
			if (cancellation.isCancelled())
				return null;
			
			// Update centers to the mean of their assigned pixels
			for (int j = 0; j < k; j++) {
				Arrays.fill(sumColors[j], 0);
				Arrays.fill(sumPositions[j], 0);
				counts[j] = 0;
			}
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					int label = labels[y][x];
					if (label < 0)
						continue;
					int ind = y * width + x;
					sumColors[label][0] += lab[0][ind];
					sumColors[label][1] += lab[1][ind];
					sumColors[label][2] += lab[2][ind];
					sumPositions[label][0] += y;
					sumPositions[label][1] += x;
					counts[label]++;
				}
			}
			int nEmpty = 0;
			for (int j = 0; j < k; j++) {
				int n = counts[j];
				if (n == 0) {
					nEmpty++;
					continue;
				}
				centerColors[j][0] = sumColors[j][0] / n;
				centerColors[j][1] = sumColors[j][1] / n;
				centerColors[j][2] = sumColors[j][2] / n;
				centers[j][0] = (int)(sumPositions[j][0] / n);
				centers[j][1] = (int)(sumPositions[j][1] / n);
			}
			if (nEmpty > 0)
				logger.warn("{} superpixel cluster(s) without pixels after iteration {}, keeping previous centers", nEmpty, iter + 1);
			else
				logger.trace("Completed SLIC iteration {}", iter + 1);
		}
		
		int nUnassigned = assignUnlabeledPixels(lab, width, height, s, m2, centerColors, centers, labels);
		if (nUnassigned > 0)
			logger.debug("Assigned {} pixel(s) outside every search window to their nearest center", nUnassigned);
		
		int[] colors = new int[k];
		for (int j = 0; j < k; j++)
			colors[j] = ColorTransformer.labToRGB(centerColors[j][0], centerColors[j][1], centerColors[j][2]);
		
		long endTime = System.currentTimeMillis();
		logger.info("SLIC segmentation of {} into {} superpixels (S={}, m={}) completed in {} ms", image, k, s, compactness, endTime - startTime);
		return new SuperpixelResult(labels, colors, centers);
	}
	
	/**
	 * Give every pixel still labeled -1 the label of the nearest center, searching all centers with the same distance measure.
	 * @return the number of pixels that were relabeled
	 */
	private static int assignUnlabeledPixels(double[][] lab, int width, int height, int s, double m2,
			double[][] centerColors, int[][] centers, int[][] labels) {
		int count = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (labels[y][x] >= 0)
					continue;
				int ind = y * width + x;
				double minDistance = Double.POSITIVE_INFINITY;
				int best = 0;
				for (int j = 0; j < centers.length; j++) {
					double dl = centerColors[j][0] - lab[0][ind];
					double da = centerColors[j][1] - lab[1][ind];
					double db = centerColors[j][2] - lab[2][ind];
					double dx = centers[j][1] - x;
					double dy = centers[j][0] - y;
					double d = Math.sqrt(dl*dl + da*da + db*db + (dx*dx + dy*dy) / ((double)s * s) * m2);
					if (d < minDistance) {
						minDistance = d;
						best = j;
					}
				}
				labels[y][x] = best;
				count++;
			}
		}
		return count;
	}
	
	/**
	 * Place k seeds on a grid with spacing s, moving each to the lowest gradient position in its 3x3 neighborhood.
	 * @return false if cancelled
	 */
	private static boolean initializeCenters(double[][] lab, int width, int height, int k, int s,
			double[][] centerColors, int[][] centers, CancellationContext cancellation) {
		
		// Shrink margins if a grid with half-spacing margins would not give k seeds
		int verticalMargin = s / 2;
		int horizontalMargin = s / 2;
		int rows = height / s;
		int cols = width / s;
		if ((long)rows * cols < k) {
			long countHorizontal = (long)rows * (cols + 1);
			long countVertical = (long)(rows + 1) * cols;
			long countBoth = (long)(rows + 1) * (cols + 1);
			int newHorizontalMargin = (width % s) / 2;
			int newVerticalMargin = (height % s) / 2;
			if (countHorizontal >= k && (countVertical < k || newHorizontalMargin > newVerticalMargin)) {
				horizontalMargin = newHorizontalMargin;
			} else if (countVertical >= k) {
				verticalMargin = newVerticalMargin;
			} else if (countBoth >= k) {
				horizontalMargin = newHorizontalMargin;
				verticalMargin = newVerticalMargin;
			} else
				throw new IllegalArgumentException("Cannot place " + k + " superpixel seeds in " + width + "x" + height + " image; the image is too small or k is too large");
			logger.debug("Seed grid margins adjusted to {} (horizontal), {} (vertical)", horizontalMargin, verticalMargin);
		}
		
		int xFirst = width - Math.max(horizontalMargin, 1);
		int xLast = horizontalMargin == 0 ? -1 : horizontalMargin;
		int yFirst = height - Math.max(verticalMargin, 1);
		int yLast = verticalMargin == 0 ? -1 : verticalMargin;
		
		int i = 0;
		seeding:
		for (int y = yFirst; y >= yLast; y -= s) {
			int ySafe = Math.max(y, 0);
			for (int x = xFirst; x >= xLast; x -= s) {
				if (cancellation.isCancelled())
					return false;
				if (i == k)
					break seeding;
				int xSafe = Math.max(x, 0);
				int ind = lowestGradientIndex(lab, width, height, xSafe, ySafe);
				centerColors[i][0] = lab[0][ind];
				centerColors[i][1] = lab[1][ind];
				centerColors[i][2] = lab[2][ind];
				centers[i][0] = ind / width;
				centers[i][1] = ind % width;
				i++;
			}
		}
		if (i < k)
			throw new IllegalArgumentException("Only " + i + " of " + k + " superpixel seeds could be placed in " + width + "x" + height + " image");
		return true;
	}
	
	private static int lowestGradientIndex(double[][] lab, int width, int height, int x, int y) {
		double minGradient = Double.POSITIVE_INFINITY;
		int best = -1;
		for (int ny = y + 1; ny >= y - 1; ny--) {
			for (int nx = x + 1; nx >= x - 1; nx--) {
				int nySafe = GeneralTools.clipValue(ny, 0, height - 1);
				int nxSafe = GeneralTools.clipValue(nx, 0, width - 1);
				int ind = nySafe * width + nxSafe;
				int indAbove = Math.min(ny + 1, height - 1) * width + nxSafe;
				int indRight = nySafe * width + Math.min(nx + 1, width - 1);
				double intensity = luminance(lab, ind);
				double gradient = Math.abs(luminance(lab, indAbove) - intensity) + Math.abs(luminance(lab, indRight) - intensity);
				if (gradient < minGradient) {
					minGradient = gradient;
					best = ind;
				}
			}
		}
		return best;
	}
	
	private static double luminance(double[][] lab, int ind) {
		return lab[0][ind] * 0.11 + lab[1][ind] * 0.59 + lab[2][ind] * 0.3;
	}

}
