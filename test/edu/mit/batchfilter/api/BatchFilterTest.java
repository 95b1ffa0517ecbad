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

import static edu.mit.batchfilter.api.Scenarios.assertRelativelyClose;
import static edu.mit.batchfilter.api.Scenarios.column;
import static edu.mit.batchfilter.api.Scenarios.matrix;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import edu.mit.batchfilter.impl.InformationState;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

public class BatchFilterTest {
	@Test
	public void constantVelocityFirstUpdate() {
		FilterConfig config = Scenarios.constantVelocity().build();
		for (BatchFilter<?> filter : new BatchFilter<?>[]{BatchFilter.linearKalman(config), BatchFilter.squareRootInformation(config)}) {
			FilterHistory history = filter.run();
			//Pbar = [[2.0025, 1.005], [1.005, 1.01]], S = 3.0025, nu = 0.2
			double s = 3.0025, nu = 0.2;
			assertEquals(nu * nu / s, history.innovationStatistic(1), 1e-12, filter.estimator().name());
			DMatrixRMaj mean = history.mean(1);
			assertEquals(1 + 2.0025 / s * nu, mean.get(0), 1e-12, filter.estimator().name());
			assertEquals(1 + 1.005 / s * nu, mean.get(1), 1e-12, filter.estimator().name());
			DMatrixRMaj p = history.covariance(1);
			assertEquals(2.0025 - 2.0025 * 2.0025 / s, p.get(0, 0), 1e-12);
			assertEquals(1.01 - 1.005 * 1.005 / s, p.get(1, 1), 1e-12);
			assertEquals(1.005 - 2.0025 * 1.005 / s, p.get(0, 1), 1e-12);
		}
	}

	@Test
	public void constantVelocityEstimatorsAgree() {
		FilterConfig config = Scenarios.constantVelocity().build();
		FilterHistory lkf = BatchFilter.linearKalman(config).run();
		FilterHistory srif = BatchFilter.squareRootInformation(config).run();
		assertEquals(10, lkf.sampleCount());
		assertEquals(10, srif.innovationStatistics().length);
		assertTrue(lkf.isComplete());
		assertTrue(srif.isComplete());
		for (int k = 0; k <= 10; ++k) {
			assertRelativelyClose(lkf.mean(k), srif.mean(k), 1e-8, "mean at " + k);
			assertRelativelyClose(lkf.covariance(k), srif.covariance(k), 1e-8, "covariance at " + k);
		}
		for (int k = 1; k <= 10; ++k) {
			assertTrue(lkf.innovationStatistic(k) >= 0);
			assertEquals(lkf.innovationStatistic(k), srif.innovationStatistic(k),
					1e-8 * Math.max(1, lkf.innovationStatistic(k)), "innovation at " + k);
		}
		//the velocity estimate settles near the measured slope
		assertEquals(1.0, lkf.mean(10).get(1), 0.15);
	}

	@Test
	public void multiRateTransitionEstimatorsAgree() {
		//six fast-decaying states and one random walk; F is well conditioned despite tiny LU pivots
		DMatrixRMaj f = CommonOps_DDRM.diag(1e-3, 1e-3, 1e-3, 1e-3, 1e-3, 1e-3, 1);
		DMatrixRMaj h = new DMatrixRMaj(1, 7);
		h.set(0, 6, 1);
		FilterConfig config = FilterConfig.builder()
				.discreteDynamics(LinearModels.discrete(f, CommonOps_DDRM.identity(7)))
				.measurementModel(LinearModels.measurement(h))
				.initialMean(new DMatrixRMaj(7, 1))
				.initialCovariance(CommonOps_DDRM.identity(7))
				.processNoise(CommonOps_DDRM.identity(7))
				.measurementNoise(matrix(new double[][]{{1}}))
				.history(TimeHistory.builder().add(1, column(1)).add(2, column(2)).add(3, column(3)).build())
				.build();
		FilterHistory lkf = BatchFilter.linearKalman(config).run();
		FilterHistory srif = BatchFilter.squareRootInformation(config).run();
		for (int k = 0; k <= 3; ++k) {
			assertRelativelyClose(lkf.mean(k), srif.mean(k), 1e-8, "mean at " + k);
			assertRelativelyClose(lkf.covariance(k), srif.covariance(k), 1e-8, "covariance at " + k);
		}
		//scalar random walk with P0 = Q = R = 1: gains 2/3, 5/8, 13/21
		assertEquals(17.0 / 7, srif.mean(3).get(6), 1e-12);
	}

	@Test
	public void nonlinearRangeEstimatorsAgree() {
		FilterConfig config = Scenarios.planarRanges(17, 25).build();
		FilterHistory lkf = BatchFilter.linearKalman(config).run();
		FilterHistory srif = BatchFilter.squareRootInformation(config).run();
		for (int k = 0; k <= 25; ++k) {
			assertRelativelyClose(lkf.mean(k), srif.mean(k), 1e-8, "mean at " + k);
			assertRelativelyClose(lkf.covariance(k), srif.covariance(k), 1e-8, "covariance at " + k);
		}
		for (int k = 1; k <= 25; ++k)
			assertEquals(lkf.innovationStatistic(k), srif.innovationStatistic(k),
					1e-8 * Math.max(1, lkf.innovationStatistic(k)), "innovation at " + k);
	}

	@Test
	public void informationFactorIsDualToCovariance() {
		FilterConfig config = Scenarios.planarRanges(3, 15).build();
		FilterHistory history = BatchFilter.squareRootInformation(config).run();
		for (int k = 0; k <= 15; ++k) {
			StateEstimate e = history.estimate(k);
			DMatrixRMaj r = e.informationFactor().get();
			DMatrixRMaj info = new DMatrixRMaj(4, 4);
			CommonOps_DDRM.multTransA(r, r, info);
			DMatrixRMaj product = new DMatrixRMaj(4, 4);
			CommonOps_DDRM.mult(info, e.covariance(), product);
			assertRelativelyClose(CommonOps_DDRM.identity(4), product, 1e-9, "R'R P at " + k);
		}
	}

	@Test
	public void continuousAndDiscreteTimingAgreeForLinearModel() {
		FilterConfig discrete = Scenarios.constantVelocity().build();
		FilterConfig continuous = discrete.toBuilder()
				.timing(ModelTiming.CONTINUOUS_DISCRETE)
				.continuousDynamics(LinearModels.continuous(matrix(new double[][]{{0, 1}, {0, 0}}), matrix(new double[][]{{0}, {1}})))
				.build();
		FilterHistory a = BatchFilter.linearKalman(discrete).run(), b = BatchFilter.squareRootInformation(continuous).run();
		for (int k = 0; k <= 10; ++k) {
			assertRelativelyClose(a.mean(k), b.mean(k), 1e-9, "mean at " + k);
			assertRelativelyClose(a.covariance(k), b.covariance(k), 1e-9, "covariance at " + k);
		}
	}

	@Test
	public void zeroSamplesLeavesOnlyInitialEstimate() {
		FilterConfig config = Scenarios.constantVelocity(TimeHistory.empty()).build();
		for (BatchFilter<?> filter : new BatchFilter<?>[]{BatchFilter.linearKalman(config), BatchFilter.squareRootInformation(config)}) {
			FilterHistory history = filter.run();
			assertEquals(0, history.sampleCount());
			assertEquals(0, history.innovationStatistics().length);
			assertRelativelyClose(column(0, 1), history.mean(0), 1e-15, "initial mean");
			assertRelativelyClose(CommonOps_DDRM.identity(2), history.covariance(0), 1e-12, "initial covariance");
			assertEquals(1, history.meanHistory().getNumCols());
		}
	}

	@Test
	public void initializeRecordsOnlyTheStartSample() {
		FilterConfig config = Scenarios.constantVelocity().startSample(2).build();
		FilterHistory history = BatchFilter.squareRootInformation(config).initialize();
		assertEquals(2, history.firstSample());
		assertRelativelyClose(column(0, 1), history.mean(2), 1e-15, "initial mean");
		assertNull(history.estimate(3));
		assertFalse(history.isComplete());
	}

	@Test
	public void warmStartFillsFromStartSample() {
		FilterConfig config = Scenarios.constantVelocity()
				.initialMean(column(4, 1))
				.startSample(4)
				.build();
		for (BatchFilter<?> filter : new BatchFilter<?>[]{BatchFilter.linearKalman(config), BatchFilter.squareRootInformation(config)}) {
			FilterHistory history = filter.run();
			for (int k = 0; k < 4; ++k)
				assertNull(history.estimate(k));
			for (int k = 1; k <= 4; ++k)
				assertTrue(Double.isNaN(history.innovationStatistic(k)));
			assertRelativelyClose(column(4, 1), history.mean(4), 1e-15, "warm-start mean");
			for (int k = 5; k <= 10; ++k) {
				assertTrue(history.estimate(k) != null);
				assertFalse(Double.isNaN(history.innovationStatistic(k)));
			}
			assertTrue(Double.isNaN(history.meanHistory().get(0, 3)));
			assertTrue(history.isComplete());
		}
	}

	@Test
	public void warmStartMatchesFullRunGivenSamePosterior() {
		FilterConfig full = Scenarios.constantVelocity().build();
		FilterHistory reference = BatchFilter.linearKalman(full).run();
		FilterConfig warm = full.toBuilder()
				.initialMean(reference.mean(6))
				.initialCovariance(reference.covariance(6))
				.startSample(6)
				.build();
		FilterHistory resumed = BatchFilter.squareRootInformation(warm).run();
		for (int k = 6; k <= 10; ++k)
			assertRelativelyClose(reference.mean(k), resumed.mean(k), 1e-8, "mean at " + k);
	}

	@Test
	public void singularTransitionReportsSample() {
		DMatrixRMaj gamma = matrix(new double[][]{{0.5}, {1}});
		DiscreteDynamics collapsing = (x, u, v, sample) -> {
			DMatrixRMaj f = sample == 3 ? new DMatrixRMaj(2, 2) : Scenarios.CV_F.copy();
			DMatrixRMaj next = new DMatrixRMaj(2, 1);
			CommonOps_DDRM.mult(f, x, next);
			return new Transition(next, f, gamma.copy());
		};
		FilterConfig config = Scenarios.constantVelocity().discreteDynamics(collapsing).build();
		BatchFilter<InformationState> filter = BatchFilter.squareRootInformation(config);
		NumericalPreconditionException ex = assertThrows(NumericalPreconditionException.class, filter::run);
		assertEquals(3, ex.getSample());
	}

	@Test
	public void modelExceptionPropagatesUnchanged() {
		IllegalStateException failure = new IllegalStateException("sensor offline");
		MeasurementModel failing = (x, sample) -> {
			if (sample == 4)
				throw failure;
			return LinearModels.measurement(Scenarios.CV_H).predict(x, sample);
		};
		FilterConfig config = Scenarios.constantVelocity().measurementModel(failing).build();
		assertSame(failure, assertThrows(IllegalStateException.class, () -> BatchFilter.linearKalman(config).run()));
		assertSame(failure, assertThrows(IllegalStateException.class, () -> BatchFilter.squareRootInformation(config).run()));
	}

	@Test
	public void wrongShapedModelOutputIsRejected() {
		MeasurementModel wide = (x, sample) -> new MeasurementModel.Prediction(column(0, 0), new DMatrixRMaj(2, 2));
		FilterConfig config = Scenarios.constantVelocity().measurementModel(wide).build();
		assertThrows(ModelEvaluationException.class, () -> BatchFilter.linearKalman(config).run());
	}

	@Test
	public void nonPositiveDefiniteNoiseRejectedAtSetup() {
		FilterConfig badQ = Scenarios.constantVelocity().processNoise(matrix(new double[][]{{-1}})).build();
		assertThrows(NumericalPreconditionException.class, () -> BatchFilter.linearKalman(badQ));
		assertThrows(NumericalPreconditionException.class, () -> BatchFilter.squareRootInformation(badQ));
		FilterConfig badR = Scenarios.constantVelocity().measurementNoise(matrix(new double[][]{{0}})).startSample(2).build();
		NumericalPreconditionException ex = assertThrows(NumericalPreconditionException.class,
				() -> BatchFilter.squareRootInformation(badR));
		assertEquals(2, ex.getSample());
	}

	@Test
	public void nonSymmetricInitialCovarianceRejected() {
		FilterConfig config = Scenarios.constantVelocity()
				.initialCovariance(matrix(new double[][]{{1, 0.5}, {0, 1}}))
				.build();
		assertThrows(NumericalPreconditionException.class, () -> BatchFilter.linearKalman(config).run());
		assertThrows(NumericalPreconditionException.class, () -> BatchFilter.squareRootInformation(config).run());
	}

	@Test
	public void informationGainIsMonotonicWithoutProcessNoise() {
		FilterConfig config = Scenarios.constantVelocity()
				.discreteDynamics(LinearModels.discrete(CommonOps_DDRM.identity(2), new DMatrixRMaj(2, 1)))
				.build();
		for (BatchFilter<?> filter : new BatchFilter<?>[]{BatchFilter.linearKalman(config), BatchFilter.squareRootInformation(config)}) {
			FilterHistory history = filter.run();
			for (int k = 1; k <= 10; ++k)
				assertTrue(Scenarios.trace(history.covariance(k)) <= Scenarios.trace(history.covariance(k - 1)) + 1e-12,
						filter.estimator().name() + " trace grew at " + k);
		}
	}

	@Test
	public void filterCanBeRunRepeatedly() {
		BatchFilter<InformationState> filter = BatchFilter.squareRootInformation(Scenarios.constantVelocity().build());
		FilterHistory first = filter.run(), second = filter.run();
		assertRelativelyClose(first.mean(10), second.mean(10), 0, "repeated run");
	}
}
