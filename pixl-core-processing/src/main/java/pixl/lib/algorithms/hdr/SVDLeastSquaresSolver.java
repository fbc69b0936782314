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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * {@link LeastSquaresSolver} using the singular value decomposition from Apache Commons Math.
 * <p>
 * Rank-deficient systems are handled through the pseudo-inverse, giving the minimum-norm solution.
 */
public class SVDLeastSquaresSolver implements LeastSquaresSolver {

	@Override
	public double[] solve(double[][] a, double[] b) {
		if (a.length != b.length)
			throw new IllegalArgumentException("Matrix has " + a.length + " rows, but right-hand side has " + b.length + " entries");
		RealMatrix mat = MatrixUtils.createRealMatrix(a);
		var svd = new SingularValueDecomposition(mat);
		return svd.getSolver().solve(new ArrayRealVector(b, false)).toArray();
	}

}
