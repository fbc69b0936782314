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

package pixl.lib.analysis.images;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pixl.lib.images.PixelImage;

/**
 * Extract boundaries between regions of a label grid.
 * <p>
 * A pixel is a contour pixel if at least two of its 8 neighbors have a different label and have not 
 * already been marked as contour pixels. Because the result depends upon the order in which pixels are 
 * visited, the scan order is fixed: rows from bottom to top, columns from right to left, and neighbors 
 * in the reverse order of {@link #DX}/{@link #DY}.
 */
public class ContourTracing {
	
	private static final Logger logger = LoggerFactory.getLogger(ContourTracing.class);
	
	/**
	 * Neighbor x offsets.
	 */
	static final int[] DX = {-1, -1,  0,  1, 1, 1, 0, -1};
	
	/**
	 * Neighbor y offsets.
	 */
	static final int[] DY = { 0, -1, -1, -1, 0, 1, 1,  1};
	
	// Suppressed default constructor for non-instantiability
	private ContourTracing() {
		throw new AssertionError();
	}
	
	/**
	 * Compute a mask identifying contour pixels in a label grid.
	 * @param labels labels indexed as {@code labels[y][x]}; all rows must have the same length
	 * @return mask indexed as {@code mask[y][x]}
	 */
	public static boolean[][] computeContourMask(int[][] labels) {
		Objects.requireNonNull(labels, "Labels must not be null");
		int height = labels.length;
		int width = height == 0 ? 0 : labels[0].length;
		for (int[] row : labels) {
			if (row.length != width)
				throw new IllegalArgumentException("Label rows must all have length " + width);
		}
		
		boolean[][] mask = new boolean[height][width];
		for (int y = height - 1; y >= 0; y--) {
			for (int x = width - 1; x >= 0; x--) {
				int label = labels[y][x];
				int count = 0;
				for (int i = DX.length - 1; i >= 0; i--) {
					int xx = x + DX[i];
					int yy = y + DY[i];
					if (xx < 0 || yy < 0 || xx >= width || yy >= height)
						continue;
					if (!mask[yy][xx] && labels[yy][xx] != label)
						count++;
				}
				if (count >= 2)
					mask[y][x] = true;
			}
		}
		return mask;
	}
	
	/**
	 * Paint the contours of a label grid onto an image.
	 * @param image image to modify in place; must have at least 3 planes
	 * @param labels labels indexed as {@code labels[y][x]}, with the same size as the image
	 * @param rgb packed RGB color for contour pixels
	 * @return the contour mask
	 */
	public static boolean[][] drawContours(PixelImage image, int[][] labels, int rgb) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(labels, "Labels must not be null");
		if (image.nPlanes() < 3)
			throw new IllegalArgumentException("Drawing contours requires an image with at least 3 planes, but got " + image.nPlanes());
		if (labels.length != image.getHeight() || (labels.length > 0 && labels[0].length != image.getWidth()))
			throw new IllegalArgumentException("Label grid size does not match " + image);
		
		boolean[][] mask = computeContourMask(labels);
		int count = 0;
		for (int y = 0; y < mask.length; y++) {
			for (int x = 0; x < mask[y].length; x++) {
				if (mask[y][x]) {
					image.setRGB(x, y, rgb);
					count++;
				}
			}
		}
		logger.debug("Painted {} contour pixels", count);
		return mask;
	}

}
