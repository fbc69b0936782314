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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import pixl.lib.common.ColorTools;

/**
 * An image made up of one or more {@link ImagePlane}s of identical size.
 * <p>
 * Planes 0, 1 and 2 are interpreted as red, green and blue where at least 3 planes are present; 
 * a 4th plane is treated as alpha. Single-plane images may carry an indexed color palette.
 * <p>
 * Note that {@link #isGrayscale()} and {@link #isRGB()} are computed on first request and cached.
 * Changing pixel values afterwards does not update them.
 */
public class PixelImage {
	
	private final List<ImagePlane> planes;
	private final int width;
	private final int height;
	private int[] palette;
	private final ImageMetadata metadata;
	
	private boolean colorTypeInitialized = false;
	private boolean grayscale;
	
	/**
	 * Create an image from a list of planes.
	 * @param planes non-empty list of planes with identical dimensions
	 * @throws IllegalArgumentException if the list is empty or the planes differ in size
	 */
	public PixelImage(List<ImagePlane> planes) {
		this(planes, null, new ImageMetadata());
	}
	
	/**
	 * Create an image from a list of planes, with an optional palette and metadata.
	 * @param planes non-empty list of planes with identical dimensions
	 * @param palette packed ARGB palette for indexed images, or null
	 * @param metadata metadata to use (not copied)
	 */
	public PixelImage(List<ImagePlane> planes, int[] palette, ImageMetadata metadata) {
		Objects.requireNonNull(planes, "Plane list must not be null");
		if (planes.isEmpty())
			throw new IllegalArgumentException("An image requires at least one plane");
		var first = planes.get(0);
		this.width = first.getWidth();
		this.height = first.getHeight();
		for (var plane : planes) {
			if (plane.getWidth() != width || plane.getHeight() != height)
				throw new IllegalArgumentException("All planes must be " + width + "x" + height + ", but found " + plane);
		}
		this.planes = new ArrayList<>(planes);
		this.palette = palette == null ? null : palette.clone();
		this.metadata = metadata == null ? new ImageMetadata() : metadata;
	}
	
	/**
	 * Create a deep copy of an image, including its palette and metadata.
	 * @param image
	 */
	public PixelImage(PixelImage image) {
		Objects.requireNonNull(image, "Image must not be null");
		this.width = image.width;
		this.height = image.height;
		this.planes = new ArrayList<>();
		for (var plane : image.planes)
			this.planes.add(new ImagePlane(plane));
		this.palette = image.palette == null ? null : image.palette.clone();
		this.metadata = new ImageMetadata(image.metadata);
	}
	
	/**
	 * Create an image with all pixels set to zero.
	 * @param width
	 * @param height
	 * @param nPlanes
	 * @return
	 */
	public static PixelImage createEmpty(int width, int height, int nPlanes) {
		if (nPlanes < 1)
			throw new IllegalArgumentException("Number of planes must be >= 1, but got " + nPlanes);
		List<ImagePlane> list = new ArrayList<>();
		for (int i = 0; i < nPlanes; i++)
			list.add(new ImagePlane(width, height));
		return new PixelImage(list);
	}
	
	/**
	 * Create an image filled with uniformly-distributed random values.
	 * @param width
	 * @param height
	 * @param nPlanes
	 * @param random
	 * @return
	 */
	public static PixelImage createRandom(int width, int height, int nPlanes, Random random) {
		var image = createEmpty(width, height, nPlanes);
		for (var plane : image.planes) {
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++)
					plane.setValue(x, y, random.nextInt(256));
			}
		}
		return image;
	}
	
	/**
	 * Image width in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Image height in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Number of planes.
	 * @return
	 */
	public int nPlanes() {
		return planes.size();
	}
	
	/**
	 * Get a plane by index. The returned plane is live: changes are reflected in the image.
	 * @param ind
	 * @return
	 */
	public ImagePlane getPlane(int ind) {
		return planes.get(ind);
	}
	
	/**
	 * Get an unmodifiable view of the planes.
	 * @return
	 */
	public List<ImagePlane> getPlanes() {
		return Collections.unmodifiableList(planes);
	}
	
	/**
	 * Get a copy of the palette, or null if none is set.
	 * @return
	 */
	public int[] getPalette() {
		return palette == null ? null : palette.clone();
	}
	
	/**
	 * Set the palette for an indexed image.
	 * @param palette packed ARGB values, or null to remove
	 */
	public void setPalette(int[] palette) {
		this.palette = palette == null ? null : palette.clone();
	}
	
	/**
	 * Get the metadata associated with this image.
	 * @return
	 */
	public ImageMetadata getMetadata() {
		return metadata;
	}
	
	/**
	 * Returns true if there are fewer than 3 planes, or planes 0, 1 and 2 are identical.
	 * @return
	 */
	public boolean isGrayscale() {
		ensureColorType();
		return grayscale;
	}
	
	/**
	 * Returns true if there are at least 3 planes and the image is not grayscale.
	 * @return
	 */
	public boolean isRGB() {
		ensureColorType();
		return planes.size() >= 3 && !grayscale;
	}
	
	private void ensureColorType() {
		if (colorTypeInitialized)
			return;
		if (planes.size() < 3)
			grayscale = true;
		else {
			var p0 = planes.get(0);
			grayscale = p0.hasSamePixels(planes.get(1)) && p0.hasSamePixels(planes.get(2));
		}
		colorTypeInitialized = true;
	}
	
	/**
	 * Get a packed RGB value from planes 0, 1 and 2.
	 * @param x
	 * @param y
	 * @return
	 * @throws IllegalStateException if there are fewer than 3 planes
	 */
	public int getRGB(int x, int y) {
		checkColorPlanes();
		return ColorTools.packRGB(
				planes.get(0).getValue(x, y),
				planes.get(1).getValue(x, y),
				planes.get(2).getValue(x, y));
	}
	
	/**
	 * Set planes 0, 1 and 2 from a packed RGB value.
	 * @param x
	 * @param y
	 * @param rgb
	 * @throws IllegalStateException if there are fewer than 3 planes
	 */
	public void setRGB(int x, int y, int rgb) {
		checkColorPlanes();
		planes.get(0).setValue(x, y, ColorTools.red(rgb));
		planes.get(1).setValue(x, y, ColorTools.green(rgb));
		planes.get(2).setValue(x, y, ColorTools.blue(rgb));
	}
	
	private void checkColorPlanes() {
		if (planes.size() < 3)
			throw new IllegalStateException("RGB access requires at least 3 planes, but image has " + planes.size());
	}
	
	@Override
	public String toString() {
		return "PixelImage [" + width + "x" + height + ", " + planes.size() + " planes]";
	}

}
