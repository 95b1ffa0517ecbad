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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;

/**
 * The output of one filter run: a state estimate for each sample 0..kmax and
 * an innovation statistic for each sample 1..kmax.  The buffers are sized when
 * the run is initialized and each slot is written exactly once.  Slots before
 * a warm-start sample are never written; they read as null estimates and NaN
 * statistics.
 * @since 10/7/2026
 */
public final class FilterHistory {
	private final int stateDimension, firstSample;
	private final StateEstimate[] estimates;
	private final double[] innovationStatistics;

	FilterHistory(int stateDimension, int sampleCount, int firstSample) {
		checkArgument(firstSample >= 0 && firstSample <= sampleCount);
		this.stateDimension = stateDimension;
		this.firstSample = firstSample;
		this.estimates = new StateEstimate[sampleCount + 1];
		this.innovationStatistics = new double[sampleCount];
		Arrays.fill(innovationStatistics, Double.NaN);
	}

	void record(int sample, StateEstimate estimate) {
		checkElementIndex(sample, estimates.length, "sample");
		checkState(estimates[sample] == null, "estimate at sample %s already recorded", sample);
		estimates[sample] = checkNotNull(estimate);
	}

	void recordInnovation(int sample, double statistic) {
		checkElementIndex(sample - 1, innovationStatistics.length, "sample");
		checkState(Double.isNaN(innovationStatistics[sample - 1]), "innovation statistic at sample %s already recorded", sample);
		innovationStatistics[sample - 1] = statistic;
	}

	/**
	 * @return kmax, the number of measurement samples
	 */
	public int sampleCount() {
		return innovationStatistics.length;
	}

	/**
	 * @return the sample the run started from
	 */
	public int firstSample() {
		return firstSample;
	}

	public int stateDimension() {
		return stateDimension;
	}

	/**
	 * @return true if every sample from the first sample on has an estimate
	 */
	public boolean isComplete() {
		for (int k = firstSample; k < estimates.length; ++k)
			if (estimates[k] == null)
				return false;
		return true;
	}

	/**
	 * @param sample 0..kmax
	 * @return the estimate at the sample, or null if it was not written
	 */
	public StateEstimate estimate(int sample) {
		checkElementIndex(sample, estimates.length, "sample");
		return estimates[sample];
	}

	/**
	 * @param sample 0..kmax
	 * @throws IllegalStateException if no estimate was written at the sample
	 */
	public DMatrixRMaj mean(int sample) {
		return written(sample).mean();
	}

	/**
	 * @param sample 0..kmax
	 * @throws IllegalStateException if no estimate was written at the sample
	 */
	public DMatrixRMaj covariance(int sample) {
		return written(sample).covariance();
	}

	private StateEstimate written(int sample) {
		StateEstimate e = estimate(sample);
		checkState(e != null, "no estimate recorded at sample %s", sample);
		return e;
	}

	/**
	 * @param sample 1..kmax
	 * @return the normalized squared innovation at the sample, or NaN if it
	 * was not written
	 */
	public double innovationStatistic(int sample) {
		checkElementIndex(sample - 1, innovationStatistics.length, "sample");
		return innovationStatistics[sample - 1];
	}

	/**
	 * @return a copy of the innovation statistics; element i belongs to
	 * sample i+1
	 */
	public double[] innovationStatistics() {
		return innovationStatistics.clone();
	}

	/**
	 * @return the means as the columns of an nx x (kmax+1) matrix; unwritten
	 * columns are NaN
	 */
	public DMatrixRMaj meanHistory() {
		DMatrixRMaj m = new DMatrixRMaj(stateDimension, estimates.length);
		m.fill(Double.NaN);
		for (int k = 0; k < estimates.length; ++k) {
			if (estimates[k] == null) continue;
			DMatrixRMaj mean = estimates[k].mean();
			for (int i = 0; i < stateDimension; ++i)
				m.set(i, k, mean.get(i, 0));
		}
		return m;
	}

	/**
	 * @return the covariances by sample (kmax+1 entries); unwritten entries
	 * are null
	 */
	public DMatrixRMaj[] covarianceHistory() {
		DMatrixRMaj[] p = new DMatrixRMaj[estimates.length];
		for (int k = 0; k < estimates.length; ++k)
			if (estimates[k] != null)
				p[k] = estimates[k].covariance();
		return p;
	}
}
