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

import edu.mit.batchfilter.api.NumericalPreconditionException;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Process and measurement noise covariances with their square-root
 * transforms.  Construction checks that both covariances are symmetric
 * positive definite; the transforms are computed once and never change.
 * <p/>
 * With Q = Cq'Cq and R = Ra'Ra (upper-triangular Cholesky factors):
 * <ul>
 * <li>the process square-root information factor is Rvv = (Cq')^-1, so
 * Rvv'Rvv = Q^-1;</li>
 * <li>the whitening transform is Ra, and measurements are whitened by
 * (Ra')^-1, which maps R to the identity.</li>
 * </ul>
 * @since 10/8/2026
 */
public final class NoiseModel {
	private final DMatrixRMaj processNoise, measurementNoise;
	private final DMatrixRMaj processSqrtInformation;
	private final DMatrixRMaj whitening, whiteningInverseTranspose;

	/**
	 * @param sample the sample index reported if a covariance is rejected
	 * @throws NumericalPreconditionException if Q or R is not symmetric
	 * positive definite
	 */
	public NoiseModel(DMatrixRMaj processNoise, DMatrixRMaj measurementNoise, int sample) {
		this.processNoise = processNoise.copy();
		this.measurementNoise = measurementNoise.copy();
		DMatrixRMaj cq = MatrixOps.choleskyUpper(processNoise, "process noise covariance", sample);
		this.processSqrtInformation = MatrixOps.inverseTransposeOfUpper(cq, "process noise covariance", sample);
		this.whitening = MatrixOps.choleskyUpper(measurementNoise, "measurement noise covariance", sample);
		this.whiteningInverseTranspose = MatrixOps.inverseTransposeOfUpper(whitening, "measurement noise covariance", sample);
	}

	public int processNoiseDimension() {
		return processNoise.getNumRows();
	}

	public int measurementDimension() {
		return measurementNoise.getNumRows();
	}

	public DMatrixRMaj processNoise() {
		return processNoise.copy();
	}

	public DMatrixRMaj measurementNoise() {
		return measurementNoise.copy();
	}

	/**
	 * @return Rvv, the square-root information factor of Q (lower triangular)
	 */
	public DMatrixRMaj processSqrtInformation() {
		return processSqrtInformation.copy();
	}

	/**
	 * @return Ra, the upper-triangular Cholesky factor of R
	 */
	public DMatrixRMaj whitening() {
		return whitening.copy();
	}

	/**
	 * @return (Ra')^-1
	 */
	public DMatrixRMaj whiteningInverseTranspose() {
		return whiteningInverseTranspose.copy();
	}

	/**
	 * Transforms a measurement (or a measurement Jacobian, column by column)
	 * into the space where the measurement noise has identity covariance.
	 */
	public DMatrixRMaj whiten(DMatrixRMaj z) {
		DMatrixRMaj za = new DMatrixRMaj(z.getNumRows(), z.getNumCols());
		CommonOps_DDRM.mult(whiteningInverseTranspose, z, za);
		return za;
	}

	/**
	 * Inverts {@link #whiten(DMatrixRMaj)}.
	 */
	public DMatrixRMaj unwhiten(DMatrixRMaj za) {
		DMatrixRMaj z = new DMatrixRMaj(za.getNumRows(), za.getNumCols());
		CommonOps_DDRM.multTransA(whitening, za, z);
		return z;
	}
}
