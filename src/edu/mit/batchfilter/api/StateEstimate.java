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
import java.util.Optional;
import org.ejml.data.DMatrixRMaj;

/**
 * A mean and covariance snapshot at one sample.  Snapshots produced by the
 * square-root information filter also carry the information factor they were
 * recovered from.
 * @since 10/7/2026
 */
public final class StateEstimate {
	private final DMatrixRMaj mean, covariance, informationFactor;

	private StateEstimate(DMatrixRMaj mean, DMatrixRMaj covariance, DMatrixRMaj informationFactor) {
		checkNotNull(mean);
		checkNotNull(covariance);
		checkArgument(mean.getNumCols() == 1, "mean is not a column vector");
		checkArgument(covariance.getNumRows() == mean.getNumRows() && covariance.getNumCols() == mean.getNumRows(),
				"covariance does not match mean");
		this.mean = mean.copy();
		this.covariance = covariance.copy();
		this.informationFactor = informationFactor != null ? informationFactor.copy() : null;
	}

	public static StateEstimate of(DMatrixRMaj mean, DMatrixRMaj covariance) {
		return new StateEstimate(mean, covariance, null);
	}

	public static StateEstimate of(DMatrixRMaj mean, DMatrixRMaj covariance, DMatrixRMaj informationFactor) {
		return new StateEstimate(mean, covariance, checkNotNull(informationFactor));
	}

	public DMatrixRMaj mean() {
		return mean.copy();
	}

	public DMatrixRMaj covariance() {
		return covariance.copy();
	}

	/**
	 * @return the square-root information factor R with R'R = inverse of the
	 * covariance, if this estimate came from an information-form filter
	 */
	public Optional<DMatrixRMaj> informationFactor() {
		return Optional.ofNullable(informationFactor).map(DMatrixRMaj::copy);
	}
}
