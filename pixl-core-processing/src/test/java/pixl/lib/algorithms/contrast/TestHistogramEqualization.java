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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;

import pixl.lib.algorithms.CancelAfterPolls;
import pixl.lib.common.ColorTools;
import pixl.lib.images.ImagePlane;
import pixl.lib.images.PixelImage;
import pixl.lib.plugins.CancellationContext;
import pixl.lib.plugins.parameters.ParameterList;

@SuppressWarnings("javadoc")
public class TestHistogramEqualization {
	
	@Test
	public void test_twoLevels() {
		var image = PixelImage.createEmpty(4, 4, 1);
		var plane = image.getPlane(0);
		for (int y = 0; y < 4; y++) {
			for (int x = 0; x < 4; x++)
				plane.setValue(x, y, x < 2 ? 50 : 100);
		}
		assertTrue(HistogramEqualization.equalizeHistogram(image, 0, CancellationContext.none()));
		for (int y = 0; y < 4; y++) {
			for (int x = 0; x < 4; x++)
				assertEquals(x < 2 ? 0 : 255, plane.getValue(x, y));
		}
	}
	
	@Test
	public void test_uniformRampUnchanged() {
		var plane = new ImagePlane(16, 16);
		for (int i = 0; i < 256; i++)
			plane.setValue(i % 16, i / 16, i);
		var original = new ImagePlane(plane);
		assertTrue(HistogramEqualization.equalizePlane(plane, 0, CancellationContext.none()));
		assertTrue(plane.hasSamePixels(original));
	}
	
	@Test
	public void test_constantImage() {
		var image = PixelImage.createEmpty(5, 5, 1);
		image.getPlane(0).fill(80);
		assertTrue(HistogramEqualization.equalizeHistogram(image, 0, CancellationContext.none()));
		for (int y = 0; y < 5; y++) {
			for (int x = 0; x < 5; x++)
				assertEquals(0, image.getPlane(0).getValue(x, y));
		}
	}
	
	@Test
	public void test_monotonic() {
		var image = PixelImage.createRandom(32, 32, 1, new Random(1L));
		var original = new ImagePlane(image.getPlane(0));
		HistogramEqualization.equalizeHistogram(image, 0, CancellationContext.none());
		var plane = image.getPlane(0);
		int[] mapping = new int[256];
		Arrays.fill(mapping, -1);
		for (int y = 0; y < 32; y++) {
			for (int x = 0; x < 32; x++) {
				int v = original.getValue(x, y);
				int out = plane.getValue(x, y);
				// Equal inputs give equal outputs
				if (mapping[v] >= 0)
					assertEquals(mapping[v], out);
				mapping[v] = out;
			}
		}
		int last = -1;
		for (int m : mapping) {
			if (m < 0)
				continue;
			assertTrue(m >= last);
			last = m;
		}
		assertEquals(255, last);
	}
	
	@Test
	public void test_grayRGBStaysGray() {
		var gray = PixelImage.createRandom(16, 16, 1, new Random(2L)).getPlane(0);
		var image = PixelImage.createEmpty(16, 16, 3);
		for (int i = 0; i < 3; i++)
			image.getPlane(i).setPixels(gray);
		HistogramEqualization.equalizeHistogram(image, 0, CancellationContext.none());
		assertTrue(image.getPlane(0).hasSamePixels(image.getPlane(1)));
		assertTrue(image.getPlane(0).hasSamePixels(image.getPlane(2)));
		
		HistogramEqualization.equalizePlane(gray, 0, CancellationContext.none());
		assertTrue(image.getPlane(0).hasSamePixels(gray));
	}
	
	@Test
	public void test_colorKeepsHue() {
		var image = PixelImage.createEmpty(2, 1, 3);
		image.setRGB(0, 0, ColorTools.packRGB(50, 0, 0));
		image.setRGB(1, 0, ColorTools.packRGB(0, 0, 100));
		assertTrue(HistogramEqualization.equalizeHistogram(image, 0, CancellationContext.none()));
		// Value is stretched, hue and saturation are preserved
		assertEquals(ColorTools.BLACK, image.getRGB(0, 0));
		assertEquals(ColorTools.BLUE, image.getRGB(1, 0));
	}
	
	@Test
	public void test_clipLimitReducesContrast() {
		var image = PixelImage.createEmpty(16, 16, 1);
		var plane = image.getPlane(0);
		// Mostly dark background with a few bright pixels
		for (int y = 0; y < 16; y++) {
			for (int x = 0; x < 16; x++)
				plane.setValue(x, y, (x + y) % 7 == 0 ? 200 + x : 20 + (x % 3));
		}
		var unclipped = new ImagePlane(plane);
		var clipped = new ImagePlane(plane);
		HistogramEqualization.equalizePlane(unclipped, 0, CancellationContext.none());
		HistogramEqualization.equalizePlane(clipped, 1.5, CancellationContext.none());
		assertFalse(clipped.hasSamePixels(unclipped));
		// The dominant background value gets a smaller boost when clipped
		assertTrue(clipped.getValue(2, 0) <= unclipped.getValue(2, 0));
	}
	
	@Test
	public void test_parameters() {
		var params = HistogramEqualization.getDefaultParameterList();
		assertEquals(0.0, params.getDoubleParameterValue(HistogramEqualization.KEY_CLIP_LIMIT));
		ParameterList.updateParameterList(params, Map.of(HistogramEqualization.KEY_CLIP_LIMIT, "3"), Locale.US);
		
		var image = PixelImage.createRandom(8, 8, 1, new Random(3L));
		var expected = new ImagePlane(image.getPlane(0));
		HistogramEqualization.equalizePlane(expected, 3, CancellationContext.none());
		assertTrue(HistogramEqualization.equalizeHistogram(image, params, CancellationContext.none()));
		assertTrue(image.getPlane(0).hasSamePixels(expected));
	}
	
	@Test
	public void test_cancelled() {
		var image = PixelImage.createRandom(8, 8, 3, new Random(4L));
		var original = new PixelImage(image);
		var cancellation = new CancellationContext();
		cancellation.cancel();
		assertFalse(HistogramEqualization.equalizeHistogram(image, 0, cancellation));
		assertFalse(HistogramEqualization.equalizePlane(image.getPlane(0), 0, cancellation));
		// Nothing was equalized, so only HSV rounding can change the pixels
		for (int i = 0; i < 3; i++) {
			for (int y = 0; y < 8; y++) {
				for (int x = 0; x < 8; x++)
					assertEquals(original.getPlane(i).getValue(x, y), image.getPlane(i).getValue(x, y), 1);
			}
		}
	}

	@Test
	public void test_cancelledWhileApplying() {
		var plane = new ImagePlane(6, 8);
		for (int y = 0; y < 8; y++) {
			for (int x = 0; x < 6; x++)
				plane.setValue(x, y, x % 2 == 0 ? 100 : 200);
		}
		// One poll before the table is built, then one per row
		var cancellation = new CancelAfterPolls(4);
		assertFalse(HistogramEqualization.equalizePlane(plane, 0, cancellation));
		assertEquals(5, cancellation.getPollCount());
		for (int y = 0; y < 8; y++) {
			for (int x = 0; x < 6; x++) {
				if (y < 3)
					assertEquals(x % 2 == 0 ? 0 : 255, plane.getValue(x, y));
				else
					assertEquals(x % 2 == 0 ? 100 : 200, plane.getValue(x, y));
			}
		}
	}

}
