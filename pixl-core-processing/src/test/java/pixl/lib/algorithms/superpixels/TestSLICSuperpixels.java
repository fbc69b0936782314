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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import pixl.lib.algorithms.CancelAfterPolls;
import pixl.lib.common.ColorTools;
import pixl.lib.images.PixelImage;
import pixl.lib.plugins.CancellationContext;

@SuppressWarnings("javadoc")
public class TestSLICSuperpixels {
	
	private static PixelImage createTwoTone(int width, int height) {
		var image = PixelImage.createEmpty(width, height, 3);
		for (int y = 0; y < height; y++) {
			for (int x = width / 2; x < width; x++)
				image.setRGB(x, y, ColorTools.WHITE);
		}
		return image;
	}
	
	private static void assertLabelsInRange(int[][] labels, int k, int width, int height) {
		assertEquals(height, labels.length);
		for (int[] row : labels) {
			assertEquals(width, row.length);
			for (int label : row)
				assertTrue(label >= 0 && label < k, "Label out of range: " + label);
		}
	}
	
	@Test
	public void test_twoTone() {
		var image = createTwoTone(64, 64);
		var result = SLICSuperpixels.segment(image, 16, 10, CancellationContext.none());
		assertNotNull(result);
		assertEquals(16, result.nClusters());
		assertEquals(16, result.getColors().length);
		assertEquals(16, result.getCenters().length);
		assertLabelsInRange(result.getLabels(), 16, 64, 64);
		
		// Superpixels never straddle the edge, so each takes the color of its pixels
		int[][] labels = result.getLabels();
		boolean[] used = new boolean[16];
		for (int y = 0; y < 64; y++) {
			for (int x = 0; x < 64; x++) {
				int label = labels[y][x];
				used[label] = true;
				int expected = image.getRGB(x, y);
				int actual = result.getColors()[label];
				assertEquals(ColorTools.red(expected), ColorTools.red(actual), 1);
				assertEquals(ColorTools.blue(expected), ColorTools.blue(actual), 1);
			}
		}
		for (boolean b : used)
			assertTrue(b);
		
		for (int[] center : result.getCenters()) {
			assertTrue(center[0] >= 0 && center[0] < 64);
			assertTrue(center[1] >= 0 && center[1] < 64);
		}
	}
	
	@Test
	public void test_applyTo() {
		var image = createTwoTone(32, 16);
		var result = SLICSuperpixels.segment(image, 8, 10, CancellationContext.none());
		var output = new PixelImage(image);
		result.applyTo(output);
		int[][] labels = result.getLabels();
		for (int y = 0; y < 16; y++) {
			for (int x = 0; x < 32; x++) {
				assertEquals(result.getColors()[labels[y][x]], output.getRGB(x, y));
			}
		}
	}
	
	@Test
	public void test_nonSquareGrid() {
		var image = PixelImage.createRandom(60, 40, 3, new Random(1L));
		var result = SLICSuperpixels.segment(image, 24, 20, CancellationContext.none());
		assertEquals(24, result.nClusters());
		assertLabelsInRange(result.getLabels(), 24, 60, 40);
	}
	
	@Test
	public void test_adjustedMargins() {
		// A 3x3 seed grid is needed, which requires dropping the margins
		var image = PixelImage.createRandom(10, 10, 3, new Random(2L));
		var result = SLICSuperpixels.segment(image, 7, 10, CancellationContext.none());
		assertEquals(7, result.nClusters());
		assertLabelsInRange(result.getLabels(), 7, 10, 10);
	}
	
	@Test
	public void test_grayscaleInput() {
		var image = PixelImage.createRandom(20, 20, 1, new Random(3L));
		var result = SLICSuperpixels.segment(image, 4, 10, CancellationContext.none());
		assertEquals(4, result.nClusters());
		for (int color : result.getColors())
			assertEquals(ColorTools.red(color), ColorTools.green(color), 1);
	}
	
	@Test
	public void test_parameters() {
		var params = SLICSuperpixels.getDefaultParameterList();
		assertEquals(100, params.getIntParameterValue(SLICSuperpixels.KEY_K));
		assertEquals(10.0, params.getDoubleParameterValue(SLICSuperpixels.KEY_COMPACTNESS));
		var image = PixelImage.createRandom(50, 50, 3, new Random(4L));
		var result = SLICSuperpixels.segment(image, params, CancellationContext.none());
		assertEquals(100, result.nClusters());
		assertLabelsInRange(result.getLabels(), 100, 50, 50);
	}
	
	@ParameterizedTest
	@ValueSource(longs = {0L, 1L, 2L, 3L, 4L})
	public void test_everyPixelLabeled(long seed) {
		// Random images let clusters drift so that some pixels fall outside every search window
		var image = PixelImage.createRandom(50, 50, 3, new Random(seed));
		var result = SLICSuperpixels.segment(image, 100, 10, CancellationContext.none());
		assertLabelsInRange(result.getLabels(), 100, 50, 50);
		
		var small = PixelImage.createRandom(10, 10, 3, new Random(seed));
		assertLabelsInRange(SLICSuperpixels.segment(small, 7, 10, CancellationContext.none()).getLabels(), 7, 10, 10);
		
		var loose = PixelImage.createRandom(128, 96, 3, new Random(seed));
		assertLabelsInRange(SLICSuperpixels.segment(loose, 48, 1, CancellationContext.none()).getLabels(), 48, 128, 96);
	}
	
	@Test
	public void test_invalidInput() {
		var image = PixelImage.createEmpty(4, 4, 3);
		assertThrows(IllegalArgumentException.class, () -> SLICSuperpixels.segment(image, 0, 10, CancellationContext.none()));
		assertThrows(IllegalArgumentException.class, () -> SLICSuperpixels.segment(image, 100, 10, CancellationContext.none()));
		assertThrows(IllegalArgumentException.class, () -> SLICSuperpixels.segment(image, 2, 0, CancellationContext.none()));
		assertThrows(IllegalArgumentException.class, () -> SLICSuperpixels.segment(image, 2, Double.NaN, CancellationContext.none()));
	}
	
	@Test
	public void test_cancelled() {
		var image = PixelImage.createRandom(16, 16, 3, new Random(5L));
		var cancellation = new CancellationContext();
		cancellation.cancel();
		assertNull(SLICSuperpixels.segment(image, 4, 10, cancellation));
	}

	@Test
	public void test_cancelledDuringIterations() {
		var image = PixelImage.createRandom(24, 24, 3, new Random(6L));
		var counting = CancelAfterPolls.counting();
		assertNotNull(SLICSuperpixels.segment(image, 9, 10, counting));
		int nPolls = counting.getPollCount();
		// Every round polls before assignment and before the update
		assertTrue(nPolls >= 20);
		
		// Before the last update step
		assertNull(SLICSuperpixels.segment(image, 9, 10, new CancelAfterPolls(nPolls - 1)));
		// Before the last assignment sweep
		assertNull(SLICSuperpixels.segment(image, 9, 10, new CancelAfterPolls(nPolls - 2)));
		// Partway through the rounds
		assertNull(SLICSuperpixels.segment(image, 9, 10, new CancelAfterPolls(nPolls - 10)));
		assertNotNull(SLICSuperpixels.segment(image, 9, 10, new CancelAfterPolls(nPolls)));
	}

}
