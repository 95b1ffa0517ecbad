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
package edu.mit.batchfilter.impl;

import static com.google.common.base.Preconditions.checkArgument;
import edu.mit.batchfilter.api.NumericalPreconditionException;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.decomposition.TriangularSolver_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.dense.row.mult.VectorVectorMult_DDRM;
import org.ejml.interfaces.decomposition.CholeskyDecomposition_F64;
import org.ejml.interfaces.decomposition.LUDecomposition_F64;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * Dense matrix helpers shared by the estimators.  Nothing here forms an
 * explicit inverse of a general matrix: triangular systems go to EJML's
 * substitution routines and general systems to LU.  Failures are reported as
 * {@link NumericalPreconditionException}s carrying the sample index.
 * @since 10/8/2026
 */
public final class MatrixOps {
	private MatrixOps() {}

	/**
	 * Largest asymmetry accepted in a covariance, relative to its largest
	 * element.
	 */
	public static final double SYMMETRY_TOLERANCE = 1e-10;

	public static DMatrixRMaj column(double... values) {
		return new DMatrixRMaj(values.length, 1, true, values);
	}

	public static DMatrixRMaj zeros(int rows) {
		return new DMatrixRMaj(rows, 1);
	}

	public static void checkSymmetric(DMatrixRMaj a, String what, int sample) {
		//isSymmetric scales by the largest element, so an all-zero matrix is 0/0
		boolean symmetric = CommonOps_DDRM.elementMaxAbs(a) == 0 ? a.getNumRows() == a.getNumCols()
				: MatrixFeatures_DDRM.isSymmetric(a, SYMMETRY_TOLERANCE);
		if (!symmetric)
			throw new NumericalPreconditionException(what + " is not symmetric", sample);
	}

	/**
	 * Returns the upper-triangular Cholesky factor C of a symmetric positive
	 * definite matrix, A = C'C.
	 * @throws NumericalPreconditionException if A is not symmetric positive
	 * definite
	 */
	public static DMatrixRMaj choleskyUpper(DMatrixRMaj a, String what, int sample) {
		checkSymmetric(a, what, sample);
		CholeskyDecomposition_F64<DMatrixRMaj> chol = DecompositionFactory_DDRM.chol(a.getNumRows(), false);
		if (!chol.decompose(a.copy()))
			throw new NumericalPreconditionException(what + " is not positive definite", sample);
		DMatrixRMaj c = chol.getT(null);
		for (int i = 0; i < c.getNumRows(); ++i)
			if (!(c.get(i, i) > 0))
				throw new NumericalPreconditionException(what + " is not positive definite", sample);
		return c;
	}

	/**
	 * Returns (C')^-1 for an upper-triangular C, by forward substitution
	 * against the identity.  The result is lower triangular.
	 */
	public static DMatrixRMaj inverseTransposeOfUpper(DMatrixRMaj c, String what, int sample) {
		DMatrixRMaj ct = CommonOps_DDRM.transpose(c, null);
		return solveTriangular(ct, false, CommonOps_DDRM.identity(c.getNumRows()), what, sample);
	}

	private static void checkDiagonal(DMatrixRMaj t, String what, int sample) {
		for (int i = 0; i < t.getNumRows(); ++i)
			if (t.get(i, i) == 0 || !Double.isFinite(t.get(i, i)))
				throw new NumericalPreconditionException(what + " is singular", sample);
	}

	/**
	 * Solves T X = B for square triangular T, one column of B at a time.
	 * @param upper whether T is upper (back substitution) or lower (forward
	 * substitution) triangular; the other triangle is ignored
	 * @throws NumericalPreconditionException if T has a zero on its diagonal
	 */
	public static DMatrixRMaj solveTriangular(DMatrixRMaj t, boolean upper, DMatrixRMaj b, String what, int sample) {
		int n = t.getNumRows();
		checkArgument(t.getNumCols() == n && b.getNumRows() == n, "%sx%s system with %s rows", n, t.getNumCols(), b.getNumRows());
		checkDiagonal(t, what, sample);
		DMatrixRMaj x = new DMatrixRMaj(n, b.getNumCols());
		for (int col = 0; col < b.getNumCols(); ++col) {
			DMatrixRMaj v = CommonOps_DDRM.extractColumn(b, col, null);
			if (upper)
				TriangularSolver_DDRM.solveU(t.data, v.data, n);
			else
				TriangularSolver_DDRM.solveL(t.data, v.data, n);
			CommonOps_DDRM.insert(v, x, 0, col);
		}
		return x;
	}

	/**
	 * Recovers the covariance R^-1 R^-T from a triangular square-root
	 * information factor with two triangular solves.
	 */
	public static DMatrixRMaj informationToCovariance(DMatrixRMaj r, int sample) {
		boolean upper = MatrixFeatures_DDRM.isUpperTriangle(r, 0, 0.0);
		checkArgument(upper || MatrixFeatures_DDRM.isLowerTriangle(r, 0, 0.0), "information factor is not triangular");
		int n = r.getNumRows();
		//R' Y = I, then R P = Y
		DMatrixRMaj y = solveTriangular(CommonOps_DDRM.transpose(r, null), !upper, CommonOps_DDRM.identity(n), "information factor", sample);
		return solveTriangular(r, upper, y, "information factor", sample);
	}

	/**
	 * Solves A X = B for square A by LU decomposition.  A is singular when
	 * LU meets a zero pivot; badly scaled but invertible matrices are accepted
	 * as long as the solution stays finite.
	 * @throws NumericalPreconditionException if A is singular
	 */
	public static DMatrixRMaj solve(DMatrixRMaj a, DMatrixRMaj b, String what, int sample) {
		LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(a.getNumRows());
		if (!solver.setA(a.copy()))
			throw new NumericalPreconditionException(what + " is singular", sample);
		LUDecomposition_F64<DMatrixRMaj> lu = solver.getDecomposition();
		if (lu.isSingular())
			throw new NumericalPreconditionException(what + " is singular", sample);
		DMatrixRMaj x = new DMatrixRMaj(a.getNumCols(), b.getNumCols());
		solver.solve(b.copy(), x);
		if (MatrixFeatures_DDRM.hasUncountable(x))
			throw new NumericalPreconditionException(what + " is singular", sample);
		return x;
	}

	public static DMatrixRMaj stack(DMatrixRMaj top, DMatrixRMaj bottom) {
		checkArgument(top.getNumCols() == bottom.getNumCols(), "cannot stack %sx%s on %sx%s",
				top.getNumRows(), top.getNumCols(), bottom.getNumRows(), bottom.getNumCols());
		DMatrixRMaj s = new DMatrixRMaj(top.getNumRows() + bottom.getNumRows(), top.getNumCols());
		CommonOps_DDRM.insert(top, s, 0, 0);
		CommonOps_DDRM.insert(bottom, s, top.getNumRows(), 0);
		return s;
	}

	public static double squaredNorm(DMatrixRMaj v) {
		return VectorVectorMult_DDRM.innerProd(v, v);
	}
}
