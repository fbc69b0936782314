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

import pixl.lib.images.PixelImage;
import pixl.lib.images.PixelImageTools;

/**
 * Output of a superpixel segmentation.
 */
public class SuperpixelResult {
	
	private final int[][] labels;
	private final int[] colors;
	private final int[][] centers;
	
	SuperpixelResult(int[][] labels, int[] colors, int[][] centers) {
		this.labels = labels;
		this.colors = colors;
		this.centers = centers;
	}
	
	/**
	 * Get the label grid, indexed as {@code labels[y][x]}.
	 * Labels are in the range 0 to {@code nClusters() - 1}.
	 * @return the label grid (not copied)
	 */
	public int[][] getLabels() {
		return labels;
	}
	
	/**
	 * Get the representative packed RGB color of each cluster.
	 * @return the cluster colors (not copied)
	 */
	public int[] getColors() {
		return colors;
	}
	
	/**
	 * Get the center of each cluster, as a {@code (y, x)} pair.
	 * @return the cluster centers (not copied)
	 */
	public int[][] getCenters() {
		return centers;
	}
	
	/**
	 * Number of clusters.
	 * @return
	 */
	public int nClusters() {
		return colors.length;
	}
	
	/**
	 * Paint every pixel of an image with the color of its cluster (black if unassigned).
	 * @param image image of the same size as the label grid, with at least 3 planes
	 */
	public void applyTo(PixelImage image) {
		PixelImageTools.applySegments(image, labels, colors);
	}

}
