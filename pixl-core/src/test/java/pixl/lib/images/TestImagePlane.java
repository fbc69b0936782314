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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestImagePlane {
	
	private static ImagePlane createRamp(int width, int height) {
		var plane = new ImagePlane(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				plane.setValue(x, y, y * width + x);
		}
		return plane;
	}
	
	@Test
	public void test_getSetValue() {
		var plane = new ImagePlane(3, 2);
		plane.setValue(2, 1, 200);
		assertEquals(200, plane.getValue(2, 1));
		// Only the lower 8 bits are kept
		plane.setValue(0, 0, 257);
		assertEquals(1, plane.getValue(0, 0));
		assertThrows(IllegalArgumentException.class, () -> new ImagePlane(0, 5));
	}
	
	@Test
	public void test_copyIsIndependent() {
		var plane = createRamp(4, 4);
		var copy = new ImagePlane(plane);
		assertTrue(copy.hasSamePixels(plane));
		copy.setValue(0, 0, 99);
		assertEquals(0, plane.getValue(0, 0));
		assertFalse(copy.hasSamePixels(plane));
	}
	
	static Stream<Arguments> mirroredIndices() {
		return Stream.of(
				Arguments.of(0, 5, 0),
				Arguments.of(4, 5, 4),
				Arguments.of(-1, 5, 0),
				Arguments.of(-2, 5, 1),
				Arguments.of(-5, 5, 4),
				Arguments.of(5, 5, 4),
				Arguments.of(6, 5, 3),
				Arguments.of(9, 5, 0),
				// Further out keeps reflecting
				Arguments.of(10, 5, 0),
				Arguments.of(-6, 5, 4),
				Arguments.of(-11, 5, 0),
				Arguments.of(-1, 1, 0),
				Arguments.of(7, 1, 0)
				);
	}
	
	@ParameterizedTest
	@MethodSource("mirroredIndices")
	public void test_mirrorIndex(int i, int n, int expected) {
		assertEquals(expected, ImagePlane.mirrorIndex(i, n));
	}
	
	@Test
	public void test_getMirroredValue() {
		var plane = createRamp(4, 3);
		assertEquals(plane.getValue(0, 0), plane.getMirroredValue(-1, -1));
		assertEquals(plane.getValue(3, 2), plane.getMirroredValue(4, 3));
		assertEquals(plane.getValue(1, 2), plane.getMirroredValue(-2, 3));
		assertEquals(plane.getValue(2, 1), plane.getMirroredValue(2, 1));
	}
	
	@Test
	public void test_setPixels() {
		var plane = new ImagePlane(4, 4);
		plane.setPixels(createRamp(4, 4));
		assertEquals(15, plane.getValue(3, 3));
		assertThrows(IllegalArgumentException.class, () -> plane.setPixels(new ImagePlane(4, 3)));
	}
	
	@Test
	public void test_createFromInterleaved() {
		byte[] data = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};
		var green = ImagePlane.createFromInterleaved(2, 2, data, 1, 3);
		assertEquals(2, green.getValue(0, 0));
		assertEquals(5, green.getValue(1, 0));
		assertEquals(8, green.getValue(0, 1));
		assertEquals(11, green.getValue(1, 1));
		assertThrows(IllegalArgumentException.class, () -> ImagePlane.createFromInterleaved(2, 2, data, 3, 3));
	}
	
	@Test
	public void test_doubles() {
		var plane = ImagePlane.fromDoubles(new double[] {0, 0.5, 1.0, 2.0, -1.0, 1.0/255.0}, 3, 2);
		assertEquals(0, plane.getValue(0, 0));
		assertEquals(128, plane.getValue(1, 0));
		assertEquals(255, plane.getValue(2, 0));
		assertEquals(255, plane.getValue(0, 1));
		assertEquals(0, plane.getValue(1, 1));
		assertEquals(1, plane.getValue(2, 1));
		
		double[] values = plane.toDoubles();
		assertEquals(6, values.length);
		assertEquals(1.0, values[2]);
		assertArrayEquals(values, ImagePlane.fromDoubles(values, 3, 2).toDoubles());
	}

}
