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

import org.ejml.data.DMatrixRMaj;

/**
 * The running state of {@link SquareRootInformationFilter}: a square-root
 * information factor R (R'R is the inverse covariance), the information
 * vector zeta = R x, and the mean x the next step linearizes about.
 * <p/>
 * R is upper triangular except at initialization, where it is the lower
 * triangular inverse transpose of the initial covariance's Cholesky factor.
 * @since 10/10/2026
 */
public final class InformationState {
	private final int sample;
	private final DMatrixRMaj factor, vector, mean;

	InformationState(int sample, DMatrixRMaj factor, DMatrixRMaj vector, DMatrixRMaj mean) {
		this.sample = sample;
		this.factor = factor;
		this.vector = vector;
		this.mean = mean;
	}

	/**
	 * @return the sample this state describes
	 */
	public int sample() {
		return sample;
	}

	public DMatrixRMaj factor() {
		return factor.copy();
	}

	public DMatrixRMaj vector() {
		return vector.copy();
	}

	public DMatrixRMaj mean() {
		return mean.copy();
	}

	DMatrixRMaj factorRef() {
		return factor;
	}

	DMatrixRMaj vectorRef() {
		return vector;
	}

	DMatrixRMaj meanRef() {
		return mean;
	}
}
