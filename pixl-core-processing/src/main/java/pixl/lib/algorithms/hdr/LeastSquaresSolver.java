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

/**
 * Solves (possibly over-determined) linear systems in the least-squares sense.
 * <p>
 * Implementations must be safe to call concurrently from different threads with different inputs.
 */
@FunctionalInterface
public interface LeastSquaresSolver {
	
	/**
	 * Find x minimizing {@code ||A x - b||}.
	 * @param a system matrix, as rows
	 * @param b right-hand side, with one entry per row of a
	 * @return solution vector, with one entry per column of a
	 */
	public double[] solve(double[][] a, double[] b);

}
