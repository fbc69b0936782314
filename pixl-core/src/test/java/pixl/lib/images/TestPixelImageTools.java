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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import pixl.lib.common.ColorTools;

@SuppressWarnings("javadoc")
public class TestPixelImageTools {
	
	@Test
	public void test_applyPlaneToColorPlanes() {
		var image = PixelImage.createRandom(4, 4, 4, new Random(1L));
		var alpha = new ImagePlane(image.getPlane(3));
		PixelImageTools.applyPlaneToColorPlanes(image, 0);
		assertTrue(image.getPlane(1).hasSamePixels(image.getPlane(0)));
		assertTrue(image.getPlane(2).hasSamePixels(image.getPlane(0)));
		assertTrue(image.getPlane(3).hasSamePixels(alpha));
	}
	
	@Test
	public void test_toRGBGray() {
		var image = PixelImage.createRandom(4, 3, 1, new Random(2L));
		image.getMetadata().putDouble(ImageMetadata.EXPOSURE_TIME, 0.1);
		var rgb = PixelImageTools.toRGB(image);
		assertEquals(3, rgb.nPlanes());
		for (int i = 0; i < 3; i++)
			assertTrue(rgb.getPlane(i).hasSamePixels(image.getPlane(0)));
		assertTrue(rgb.getMetadata().containsKey(ImageMetadata.EXPOSURE_TIME));
	}
	
	@Test
	public void test_toRGBPalette() {
		var plane = new ImagePlane(2, 1);
		plane.setValue(1, 0, 1);
		var image = new PixelImage(List.of(plane), new int[] {ColorTools.BLUE, ColorTools.YELLOW}, null);
		var rgb = PixelImageTools.toRGB(image);
		assertEquals(ColorTools.BLUE, rgb.getRGB(0, 0));
		assertEquals(ColorTools.YELLOW, rgb.getRGB(1, 0));
	}
	
	@Test
	public void test_toRGBCopies() {
		var image = PixelImage.createRandom(3, 3, 4, new Random(3L));
		var rgb = PixelImageTools.toRGB(image);
		assertEquals(3, rgb.nPlanes());
		rgb.setRGB(0, 0, ColorTools.packRGB(image.getPlane(0).getValue(0, 0) ^ 1, 0, 0));
		assertEquals(image.getRGB(1, 1), rgb.getRGB(1, 1));
		assertTrue(image.getPlane(0).getValue(0, 0) != rgb.getPlane(0).getValue(0, 0));
	}
	
	@Test
	public void test_hsvRoundTrip() {
		var image = PixelImage.createRandom(8, 8, 3, new Random(4L));
		var copy = new PixelImage(image);
		double[][] hsv = PixelImageTools.toHSV(image);
		assertEquals(3, hsv.length);
		assertEquals(64, hsv[2].length);
		PixelImageTools.setPixelsFromHSV(copy, hsv);
		for (int i = 0; i < 3; i++) {
			for (int y = 0; y < 8; y++) {
				for (int x = 0; x < 8; x++)
					assertEquals(image.getPlane(i).getValue(x, y), copy.getPlane(i).getValue(x, y), 1);
			}
		}
		
		assertThrows(IllegalArgumentException.class, () -> PixelImageTools.toHSV(PixelImage.createEmpty(2, 2, 1)));
		assertThrows(IllegalArgumentException.class, () -> PixelImageTools.setPixelsFromHSV(copy, new double[3][10]));
	}
	
	@Test
	public void test_toCIELABGray() {
		var image = PixelImage.createEmpty(2, 2, 1);
		image.getPlane(0).fill(255);
		double[][] lab = PixelImageTools.toCIELAB(image);
		for (int i = 0; i < 4; i++) {
			assertEquals(100.0, lab[0][i], 0.01);
			assertEquals(0.0, lab[1][i], 0.01);
		}
	}
	
	@Test
	public void test_applySegments() {
		var image = PixelImage.createEmpty(2, 2, 3);
		int[][] labels = {{0, 1}, {-1, 1}};
		PixelImageTools.applySegments(image, labels, new int[] {ColorTools.RED, ColorTools.GREEN});
		assertEquals(ColorTools.RED, image.getRGB(0, 0));
		assertEquals(ColorTools.GREEN, image.getRGB(1, 0));
		assertEquals(ColorTools.BLACK, image.getRGB(0, 1));
		assertEquals(ColorTools.GREEN, image.getRGB(1, 1));
		assertThrows(IllegalArgumentException.class, () -> PixelImageTools.applySegments(image, new int[][] {{0, 1}}, new int[] {0, 0}));
	}
	
	@Test
	public void test_drawSquares() {
		var image = PixelImage.createEmpty(10, 10, 3);
		image.getPlane(0).fill(7);
		image.getPlane(1).fill(7);
		image.getPlane(2).fill(7);
		int background = ColorTools.packRGB(7, 7, 7);
		// One square in the middle, one clipped at a corner
		PixelImageTools.drawSquares(image, new int[][] {{5, 5}, {0, 9}}, 3, ColorTools.RED, ColorTools.BLACK);
		assertEquals(ColorTools.RED, image.getRGB(5, 5));
		assertEquals(ColorTools.BLACK, image.getRGB(4, 4));
		assertEquals(ColorTools.BLACK, image.getRGB(6, 5));
		assertEquals(background, image.getRGB(7, 5));
		assertEquals(ColorTools.RED, image.getRGB(9, 0));
		assertEquals(ColorTools.BLACK, image.getRGB(8, 0));
		assertEquals(ColorTools.BLACK, image.getRGB(9, 1));
		assertEquals(background, image.getRGB(7, 0));
	}

}
