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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The two-phase per-sample recurrence shared by all batch estimators.  The
 * running state type S is private to each estimator; {@link BatchFilter}
 * threads it from one sample to the next and records a snapshot of each
 * posterior.
 * <p/>
 * Estimators hold only read-only setup data, so one instance can serve any
 * number of runs, including concurrent ones.
 * @param <S> the estimator's running state
 * @since 7/8/2026
 */
public interface Estimator<S> {

	String name();

	/**
	 * Creates the running state for the configured initial mean and
	 * covariance, which are the posterior at the given sample.
	 */
	S initialize(int sample);

	/**
	 * Propagates the posterior at sample k to the a priori state at k+1.
	 */
	S propagate(S posterior, int sample);

	/**
	 * Folds the measurement at sample k+1 into the a priori state.
	 */
	Update<S> update(S prior, int sample);

	/**
	 * Recovers the mean and covariance represented by a state.
	 */
	StateEstimate readout(S state);

	final class Update<S> {
		private final S posterior;
		private final double innovationStatistic;

		public Update(S posterior, double innovationStatistic) {
			this.posterior = checkNotNull(posterior);
			this.innovationStatistic = innovationStatistic;
		}

		public S posterior() {
			return posterior;
		}

		/**
		 * @return the normalized squared innovation of the folded measurement
		 */
		public double innovationStatistic() {
			return innovationStatistic;
		}
	}
}
