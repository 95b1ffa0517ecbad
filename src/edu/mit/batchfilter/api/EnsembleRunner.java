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
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent batch filters in parallel, as in Monte Carlo studies.
 * Runs share nothing but their read-only inputs, so the only requirement is
 * that the model callables are reentrant.  The executor is owned by the
 * caller.
 * @since 10/12/2026
 */
public final class EnsembleRunner {
	private static final Logger LOG = LoggerFactory.getLogger(EnsembleRunner.class);
	private final ListeningExecutorService executor;

	public EnsembleRunner(ExecutorService executor) {
		this.executor = MoreExecutors.listeningDecorator(checkNotNull(executor));
	}

	/**
	 * Runs each filter and returns their histories in the same order.
	 * @throws RuntimeException the first failure of any run, rethrown
	 * unchanged if it is unchecked
	 */
	public List<FilterHistory> runAll(List<? extends BatchFilter<?>> filters) {
		List<ListenableFuture<FilterHistory>> futures = new ArrayList<>(filters.size());
		for (BatchFilter<?> filter : filters)
			futures.add(executor.submit(filter::run));
		ListenableFuture<List<FilterHistory>> all = Futures.allAsList(futures);
		try {
			List<FilterHistory> histories = ImmutableList.copyOf(all.get());
			LOG.info("Completed {} ensemble runs", histories.size());
			return histories;
		} catch (InterruptedException ex) {
			all.cancel(true);
			Thread.currentThread().interrupt();
			throw new IllegalStateException("interrupted waiting for ensemble runs", ex);
		} catch (ExecutionException ex) {
			for (ListenableFuture<FilterHistory> f : futures)
				f.cancel(true);
			Throwables.throwIfUnchecked(ex.getCause());
			throw new IllegalStateException(ex.getCause());
		}
	}

	/**
	 * Builds a filter for each configuration with the given factory (for
	 * example {@code BatchFilter::squareRootInformation}) and runs them all.
	 */
	public List<FilterHistory> runAll(List<FilterConfig> configs, Function<FilterConfig, ? extends BatchFilter<?>> factory) {
		List<BatchFilter<?>> filters = new ArrayList<>(configs.size());
		for (FilterConfig config : configs)
			filters.add(factory.apply(config));
		return runAll(filters);
	}
}
