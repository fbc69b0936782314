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

package pixl.lib.algorithms.hdr;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestSVDLeastSquaresSolver {
	
	private final LeastSquaresSolver solver = new SVDLeastSquaresSolver();
	
	@Test
	public void test_exactLine() {
		double[][] a = {{1, 0}, {1, 1}, {1, 2}};
		double[] b = {1, 3, 5};
		assertArrayEquals(new double[] {1, 2}, solver.solve(a, b), 1e-10);
	}
	
	@Test
	public void test_leastSquares() {
		// Best fit of a constant is the mean
		double[][] a = {{1}, {1}, {1}, {1}};
		double[] b = {1, 2, 3, 6};
		assertEquals(3.0, solver.solve(a, b)[0], 1e-10);
	}
	
	@Test
	public void test_rankDeficient() {
		// The second unknown is never constrained, and gets the minimum-norm value of 0
		double[][] a = {{2, 0}, {2, 0}};
		double[] b = {4, 4};
		assertArrayEquals(new double[] {2, 0}, solver.solve(a, b), 1e-10);
	}
	
	@Test
	public void test_sizeMismatch() {
		assertThrows(IllegalArgumentException.class, () -> solver.solve(new double[][] {{1}, {1}}, new double[] {1}));
	}

}
