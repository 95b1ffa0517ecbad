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
import com.google.common.base.Stopwatch;
import edu.mit.batchfilter.impl.CovarianceFilter;
import edu.mit.batchfilter.impl.CovarianceState;
import edu.mit.batchfilter.impl.InformationState;
import edu.mit.batchfilter.impl.SquareRootInformationFilter;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives an {@link Estimator} over a whole measurement history: starting
 * from the configured initial condition at the start sample, each sample's
 * posterior is propagated to the next sample, updated with that sample's
 * measurement and recorded.
 * <p/>
 * A BatchFilter holds no per-run state, so it can be run repeatedly and from
 * several threads at once.
 * @param <S> the estimator's running state
 * @since 7/8/2026
 */
public final class BatchFilter<S> {
	private static final Logger LOG = LoggerFactory.getLogger(BatchFilter.class);
	private final FilterConfig config;
	private final Estimator<S> estimator;

	public BatchFilter(FilterConfig config, Estimator<S> estimator) {
		this.config = checkNotNull(config);
		this.estimator = checkNotNull(estimator);
	}

	/**
	 * Creates a filter using the covariance-form (extended) Kalman recursion.
	 * @throws NumericalPreconditionException if the noise covariances are not
	 * symmetric positive definite
	 */
	public static BatchFilter<CovarianceState> linearKalman(FilterConfig config) {
		return new BatchFilter<>(config, new CovarianceFilter(config));
	}

	/**
	 * Creates a filter using the extended square-root information recursion.
	 * @throws NumericalPreconditionException if the noise covariances are not
	 * symmetric positive definite
	 */
	public static BatchFilter<InformationState> squareRootInformation(FilterConfig config) {
		return new BatchFilter<>(config, new SquareRootInformationFilter(config));
	}

	public FilterConfig config() {
		return config;
	}

	public Estimator<S> estimator() {
		return estimator;
	}

	/**
	 * Allocates the output history and records the initial estimate at the
	 * start sample.
	 */
	public FilterHistory initialize() {
		return begin(estimator.initialize(config.startSample()));
	}

	private FilterHistory begin(S initial) {
		FilterHistory history = new FilterHistory(config.stateDimension(), config.sampleCount(), config.startSample());
		history.record(config.startSample(), estimator.readout(initial));
		return history;
	}

	/**
	 * Runs the recurrence from the start sample through the last sample.
	 * Exceptions thrown by the models propagate unchanged and end the run.
	 * @return the filled history
	 * @throws NumericalPreconditionException if a numerical precondition
	 * fails at some sample
	 */
	public FilterHistory run() {
		Stopwatch stopwatch = Stopwatch.createStarted();
		int start = config.startSample(), kmax = config.sampleCount();
		S state = estimator.initialize(start);
		FilterHistory history = begin(state);
		for (int k = start; k < kmax; ++k) {
			S prior = estimator.propagate(state, k);
			Estimator.Update<S> update = estimator.update(prior, k + 1);
			state = update.posterior();
			history.record(k + 1, estimator.readout(state));
			history.recordInnovation(k + 1, update.innovationStatistic());
		}
		LOG.info("{} processed samples {}..{} in {} ms", estimator.name(), start, kmax,
				stopwatch.elapsed(TimeUnit.MILLISECONDS));
		return history;
	}
}
