/*
 * Copyright (c) 2013-2014 Massachusetts Institute of Technology
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package edu.mit.batchfilter.api;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import edu.mit.batchfilter.api.ContinuousDynamics.Derivative;
import edu.mit.batchfilter.api.MeasurementModel.Prediction;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Constant-matrix models for linear-Gaussian problems.  The matrices are
 * copied when the model is created.
 * @since 10/11/2026
 */
public final class LinearModels {
	private LinearModels() {}

	/**
	 * x(k+1) = F x(k) + Gamma v(k)
	 */
	public static DiscreteDynamics discrete(DMatrixRMaj f, DMatrixRMaj gamma) {
		return discrete(f, null, gamma);
	}

	/**
	 * x(k+1) = F x(k) + B u(k) + Gamma v(k)
	 * @param b the control matrix, or null if there is no control
	 */
	public static DiscreteDynamics discrete(DMatrixRMaj f, DMatrixRMaj b, DMatrixRMaj gamma) {
		final DMatrixRMaj F = checkSquare(f, "F").copy();
		final DMatrixRMaj B = b != null ? checkRows(b, F, "B").copy() : null;
		final DMatrixRMaj G = checkRows(gamma, F, "Gamma").copy();
		return (x, u, v, sample) -> new Transition(affine(F, x, B, u, G, v), F.copy(), G.copy());
	}

	/**
	 * xdot = A x + D v
	 */
	public static ContinuousDynamics continuous(DMatrixRMaj a, DMatrixRMaj d) {
		return continuous(a, null, d);
	}

	/**
	 * xdot = A x + B u + D v
	 * @param b the control matrix, or null if there is no control
	 */
	public static ContinuousDynamics continuous(DMatrixRMaj a, DMatrixRMaj b, DMatrixRMaj d) {
		final DMatrixRMaj A = checkSquare(a, "A").copy();
		final DMatrixRMaj B = b != null ? checkRows(b, A, "B").copy() : null;
		final DMatrixRMaj D = checkRows(d, A, "D").copy();
		return (t, x, u, v, jacobians) -> {
			DMatrixRMaj xdot = affine(A, x, B, u, D, v);
			return jacobians ? new Derivative(xdot, A.copy(), D.copy()) : new Derivative(xdot);
		};
	}

	/**
	 * z = H x
	 */
	public static MeasurementModel measurement(DMatrixRMaj h) {
		final DMatrixRMaj H = checkNotNull(h, "H").copy();
		return (x, sample) -> {
			DMatrixRMaj z = new DMatrixRMaj(H.getNumRows(), 1);
			CommonOps_DDRM.mult(H, x, z);
			return new Prediction(z, H.copy());
		};
	}

	private static DMatrixRMaj affine(DMatrixRMaj m, DMatrixRMaj x, DMatrixRMaj b, DMatrixRMaj u, DMatrixRMaj g, DMatrixRMaj v) {
		DMatrixRMaj y = new DMatrixRMaj(m.getNumRows(), 1);
		CommonOps_DDRM.mult(m, x, y);
		if (b != null) {
			if (u.getNumRows() != b.getNumCols())
				throw new ModelEvaluationException(String.format("control has %d rows, control matrix has %d columns",
						u.getNumRows(), b.getNumCols()));
			CommonOps_DDRM.multAdd(b, u, y);
		}
		CommonOps_DDRM.multAdd(g, v, y);
		return y;
	}

	private static DMatrixRMaj checkSquare(DMatrixRMaj m, String name) {
		checkNotNull(m, name);
		checkArgument(m.getNumRows() == m.getNumCols(), "%s is %sx%s, not square", name, m.getNumRows(), m.getNumCols());
		return m;
	}

	private static DMatrixRMaj checkRows(DMatrixRMaj m, DMatrixRMaj square, String name) {
		checkNotNull(m, name);
		checkArgument(m.getNumRows() == square.getNumRows(), "%s has %s rows, expected %s", name, m.getNumRows(), square.getNumRows());
		return m;
	}
}
