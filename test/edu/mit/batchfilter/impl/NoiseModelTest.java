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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import edu.mit.batchfilter.api.NumericalPreconditionException;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.junit.jupiter.api.Test;

public class NoiseModelTest {
	private static final DMatrixRMaj Q = new DMatrixRMaj(new double[][]{{2, 0.5}, {0.5, 1}});
	private static final DMatrixRMaj R = new DMatrixRMaj(new double[][]{{4, 1, 0}, {1, 3, -0.5}, {0, -0.5, 2}});

	@Test
	public void whiteningRoundTrip() {
		NoiseModel noise = new NoiseModel(Q, R, 0);
		DMatrixRMaj z = MatrixOps.column(1.5, -2, 0.25);
		DMatrixRMaj back = noise.unwhiten(noise.whiten(z));
		assertArrayEquals(z.getData(), back.getData(), 1e-12);
	}

	@Test
	public void whitenedNoiseHasIdentityCovariance() {
		NoiseModel noise = new NoiseModel(Q, R, 0);
		//Ra^-T R Ra^-1
		DMatrixRMaj left = noise.whiten(R);
		DMatrixRMaj white = noise.whiten(CommonOps_DDRM.transpose(left, null));
		assertTrue(MatrixFeatures_DDRM.isIdentity(white, 1e-12));
	}

	@Test
	public void processSqrtInformationInvertsQ() {
		NoiseModel noise = new NoiseModel(Q, R, 0);
		DMatrixRMaj rvv = noise.processSqrtInformation();
		assertTrue(MatrixFeatures_DDRM.isLowerTriangle(rvv, 0, 0.0));
		DMatrixRMaj info = new DMatrixRMaj(2, 2), product = new DMatrixRMaj(2, 2);
		CommonOps_DDRM.multTransA(rvv, rvv, info);
		CommonOps_DDRM.mult(info, Q, product);
		assertTrue(MatrixFeatures_DDRM.isIdentity(product, 1e-12));
	}

	@Test
	public void whiteningFactorSquaresToR() {
		NoiseModel noise = new NoiseModel(Q, R, 0);
		DMatrixRMaj ra = noise.whitening();
		assertTrue(MatrixFeatures_DDRM.isUpperTriangle(ra, 0, 0.0));
		DMatrixRMaj rr = new DMatrixRMaj(3, 3);
		CommonOps_DDRM.multTransA(ra, ra, rr);
		assertTrue(MatrixFeatures_DDRM.isIdentical(R, rr, 1e-12));
	}

	@Test
	public void indefiniteProcessNoiseRejected() {
		DMatrixRMaj indefinite = new DMatrixRMaj(new double[][]{{1, 2}, {2, 1}});
		NumericalPreconditionException ex = assertThrows(NumericalPreconditionException.class,
				() -> new NoiseModel(indefinite, R, 7));
		assertEquals(7, ex.getSample());
	}

	@Test
	public void asymmetricMeasurementNoiseRejected() {
		DMatrixRMaj asymmetric = new DMatrixRMaj(new double[][]{{1, 0.1}, {0, 1}});
		assertThrows(NumericalPreconditionException.class, () -> new NoiseModel(Q, asymmetric, 0));
	}

	@Test
	public void singularMeasurementNoiseRejected() {
		DMatrixRMaj singular = new DMatrixRMaj(new double[][]{{1, 1}, {1, 1}});
		assertThrows(NumericalPreconditionException.class, () -> new NoiseModel(Q, singular, 0));
	}
}
