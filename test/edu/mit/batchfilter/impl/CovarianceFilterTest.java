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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import edu.mit.batchfilter.api.Estimator.Update;
import edu.mit.batchfilter.api.FilterConfig;
import edu.mit.batchfilter.api.LinearModels;
import edu.mit.batchfilter.api.NumericalPreconditionException;
import edu.mit.batchfilter.api.TimeHistory;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

public class CovarianceFilterTest {
	static DMatrixRMaj scalar(double v) {
		return new DMatrixRMaj(new double[][]{{v}});
	}

	/**
	 * A random walk observed directly: F = Gamma = H = 1, Q = R = P0 = 1,
	 * x0 = 0, one measurement z1 = 2.
	 */
	static FilterConfig.Builder randomWalk() {
		return FilterConfig.builder()
				.discreteDynamics(LinearModels.discrete(scalar(1), scalar(1)))
				.measurementModel(LinearModels.measurement(scalar(1)))
				.initialMean(MatrixOps.column(0))
				.initialCovariance(scalar(1))
				.processNoise(scalar(1))
				.measurementNoise(scalar(1))
				.history(TimeHistory.builder().add(1, MatrixOps.column(2)).build());
	}

	@Test
	public void scalarStep() {
		CovarianceFilter filter = new CovarianceFilter(randomWalk().build());
		CovarianceState prior = filter.propagate(filter.initialize(0), 0);
		assertEquals(0, prior.mean().get(0), 0);
		assertEquals(2, prior.covariance().get(0), 1e-15);

		//S = 3, W = 2/3
		Update<CovarianceState> update = filter.update(prior, 1);
		assertEquals(4.0 / 3, update.posterior().mean().get(0), 1e-15);
		assertEquals(2.0 / 3, update.posterior().covariance().get(0), 1e-15);
		assertEquals(4.0 / 3, update.innovationStatistic(), 1e-15);
	}

	@Test
	public void defaultSubsteps() {
		assertEquals(CovarianceFilter.DEFAULT_RUNGE_KUTTA_STEPS, new CovarianceFilter(randomWalk().build()).rungeKuttaSteps());
		assertEquals(7, new CovarianceFilter(randomWalk().rungeKuttaSteps(7).build()).rungeKuttaSteps());
		assertEquals("LKF", new CovarianceFilter(randomWalk().build()).name());
	}

	@Test
	public void readoutCopiesState() {
		CovarianceFilter filter = new CovarianceFilter(randomWalk().build());
		CovarianceState state = filter.initialize(0);
		filter.readout(state).mean().set(0, 0, 99);
		state.mean().set(0, 0, 99);
		assertEquals(0, filter.readout(state).mean().get(0), 0);
	}

	@Test
	public void nonSymmetricInitialCovarianceReportsStartSample() {
		FilterConfig config = randomWalk()
				.discreteDynamics(LinearModels.discrete(new DMatrixRMaj(new double[][]{{1, 0}, {0, 1}}), new DMatrixRMaj(2, 1)))
				.measurementModel(LinearModels.measurement(new DMatrixRMaj(new double[][]{{1, 0}})))
				.initialMean(MatrixOps.column(0, 0))
				.initialCovariance(new DMatrixRMaj(new double[][]{{1, 0.3}, {0.2, 1}}))
				.build();
		NumericalPreconditionException ex = assertThrows(NumericalPreconditionException.class,
				() -> new CovarianceFilter(config).initialize(1));
		assertEquals(1, ex.getSample());
	}
}
