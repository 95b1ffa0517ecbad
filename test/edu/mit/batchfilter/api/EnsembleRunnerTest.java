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

import static edu.mit.batchfilter.api.Scenarios.column;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EnsembleRunnerTest {
	private static final int RUNS = 200, SAMPLES = 50;
	private static final double Q = 0.01, R_POSITION = 1, R_VELOCITY = 0.25;
	private ExecutorService executor;

	@BeforeEach
	public void setUp() {
		executor = Executors.newFixedThreadPool(4);
	}

	@AfterEach
	public void tearDown() {
		executor.shutdownNow();
	}

	/**
	 * Simulates the constant-velocity target with both position and velocity
	 * measured (nz = 2), drawing the initial state from the filter's prior.
	 */
	private static FilterConfig simulatedRun(Random random) {
		DMatrixRMaj x = column(random.nextGaussian(), 1 + random.nextGaussian());
		TimeHistory.Builder history = TimeHistory.builder();
		for (int k = 1; k <= SAMPLES; ++k) {
			DMatrixRMaj next = new DMatrixRMaj(2, 1);
			CommonOps_DDRM.mult(Scenarios.CV_F, x, next);
			CommonOps_DDRM.multAdd(Scenarios.CV_GAMMA, column(Math.sqrt(Q) * random.nextGaussian()), next);
			x = next;
			history.add(k, column(x.get(0) + Math.sqrt(R_POSITION) * random.nextGaussian(),
					x.get(1) + Math.sqrt(R_VELOCITY) * random.nextGaussian()));
		}
		return Scenarios.constantVelocity(history.build())
				.measurementModel(LinearModels.measurement(CommonOps_DDRM.identity(2)))
				.measurementNoise(CommonOps_DDRM.diag(R_POSITION, R_VELOCITY))
				.build();
	}

	@Test
	public void innovationStatisticsAreChiSquare() {
		Random random = new Random(20260614);
		List<FilterConfig> configs = new ArrayList<>(RUNS);
		for (int i = 0; i < RUNS; ++i)
			configs.add(simulatedRun(random));
		List<FilterHistory> histories = new EnsembleRunner(executor).runAll(configs, BatchFilter::squareRootInformation);
		assertEquals(RUNS, histories.size());

		double sum = 0, sumSquares = 0;
		int n = 0;
		for (FilterHistory h : histories)
			for (double eta : h.innovationStatistics()) {
				sum += eta;
				sumSquares += eta * eta;
				++n;
			}
		assertEquals(RUNS * SAMPLES, n);
		double mean = sum / n, variance = sumSquares / n - mean * mean;
		//chi-square with 2 degrees of freedom: mean 2, variance 4
		assertEquals(2, mean, 0.15);
		assertEquals(4, variance, 0.5);
	}

	@Test
	public void historiesKeepSubmissionOrder() {
		FilterConfig base = Scenarios.constantVelocity().build();
		List<BatchFilter<?>> filters = new ArrayList<>();
		for (int i = 0; i < 6; ++i)
			filters.add(BatchFilter.linearKalman(base.toBuilder().initialMean(column(i, 1)).build()));
		List<FilterHistory> histories = new EnsembleRunner(executor).runAll(filters);
		for (int i = 0; i < 6; ++i)
			assertEquals(i, histories.get(i).mean(0).get(0), 0);
	}

	@Test
	public void firstFailureIsRethrownUnchanged() {
		ArithmeticException failure = new ArithmeticException("diverged");
		MeasurementModel failing = (x, sample) -> {
			throw failure;
		};
		List<FilterConfig> configs = new ArrayList<>();
		configs.add(Scenarios.constantVelocity().build());
		configs.add(Scenarios.constantVelocity().measurementModel(failing).build());
		EnsembleRunner runner = new EnsembleRunner(executor);
		assertSame(failure, assertThrows(ArithmeticException.class,
				() -> runner.runAll(configs, BatchFilter::linearKalman)));
	}
}
