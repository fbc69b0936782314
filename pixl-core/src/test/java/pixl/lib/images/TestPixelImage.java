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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import pixl.lib.common.ColorTools;

@SuppressWarnings("javadoc")
public class TestPixelImage {
	
	@Test
	public void test_constructorChecks() {
		assertThrows(IllegalArgumentException.class, () -> new PixelImage(Collections.emptyList()));
		assertThrows(IllegalArgumentException.class, () -> new PixelImage(List.of(new ImagePlane(4, 4), new ImagePlane(4, 5))));
		assertThrows(NullPointerException.class, () -> new PixelImage((List<ImagePlane>)null));
		var image = new PixelImage(List.of(new ImagePlane(4, 5)));
		assertEquals(4, image.getWidth());
		assertEquals(5, image.getHeight());
		assertEquals(1, image.nPlanes());
		assertNull(image.getPalette());
	}
	
	@Test
	public void test_grayscale() {
		assertTrue(PixelImage.createEmpty(3, 3, 1).isGrayscale());
		assertFalse(PixelImage.createEmpty(3, 3, 1).isRGB());
		assertTrue(PixelImage.createEmpty(3, 3, 2).isGrayscale());
		
		var gray = PixelImage.createEmpty(3, 3, 3);
		gray.setRGB(1, 1, ColorTools.packRGB(50, 50, 50));
		assertTrue(gray.isGrayscale());
		assertFalse(gray.isRGB());
		
		var rgb = PixelImage.createEmpty(3, 3, 4);
		rgb.setRGB(1, 1, ColorTools.packRGB(50, 51, 50));
		assertFalse(rgb.isGrayscale());
		assertTrue(rgb.isRGB());
	}
	
	@Test
	public void test_grayscaleIsCached() {
		var image = PixelImage.createEmpty(2, 2, 3);
		assertTrue(image.isGrayscale());
		// Changes after the first request are not reflected
		image.setRGB(0, 0, ColorTools.RED);
		assertTrue(image.isGrayscale());
		// A copy computes its own value
		assertFalse(new PixelImage(image).isGrayscale());
	}
	
	@Test
	public void test_rgb() {
		var image = PixelImage.createEmpty(2, 2, 3);
		int rgb = ColorTools.packRGB(10, 20, 30);
		image.setRGB(1, 0, rgb);
		assertEquals(rgb, image.getRGB(1, 0));
		assertEquals(10, image.getPlane(0).getValue(1, 0));
		assertEquals(20, image.getPlane(1).getValue(1, 0));
		assertEquals(30, image.getPlane(2).getValue(1, 0));
		
		var single = PixelImage.createEmpty(2, 2, 1);
		assertThrows(IllegalStateException.class, () -> single.getRGB(0, 0));
		assertThrows(IllegalStateException.class, () -> single.setRGB(0, 0, rgb));
	}
	
	@Test
	public void test_deepCopy() {
		var image = PixelImage.createRandom(5, 4, 3, new Random(42));
		image.setPalette(new int[] {ColorTools.RED, ColorTools.GREEN});
		image.getMetadata().putDouble(ImageMetadata.EXPOSURE_TIME, 0.01);
		
		var copy = new PixelImage(image);
		for (int i = 0; i < 3; i++)
			assertTrue(copy.getPlane(i).hasSamePixels(image.getPlane(i)));
		assertEquals(0.01, copy.getMetadata().getDouble(ImageMetadata.EXPOSURE_TIME).getAsDouble());
		
		copy.getPlane(0).setValue(0, 0, image.getPlane(0).getValue(0, 0) + 1);
		copy.getMetadata().putDouble(ImageMetadata.EXPOSURE_TIME, 0.02);
		assertFalse(copy.getPlane(0).hasSamePixels(image.getPlane(0)));
		assertEquals(0.01, image.getMetadata().getDouble(ImageMetadata.EXPOSURE_TIME).getAsDouble());
		assertEquals(2, copy.getPalette().length);
	}
	
	@Test
	public void test_metadata() {
		var metadata = new ImageMetadata();
		assertTrue(metadata.getDouble(ImageMetadata.EXPOSURE_TIME).isEmpty());
		assertFalse(metadata.containsKey(ImageMetadata.EXPOSURE_TIME));
		metadata.putDouble(ImageMetadata.EXPOSURE_TIME, 0.5).putDouble("Other", 2);
		assertEquals(List.of(ImageMetadata.EXPOSURE_TIME, "Other"), List.copyOf(metadata.keys()));
		assertTrue(metadata.remove("Other"));
		assertEquals(1, metadata.keys().size());
	}

}
