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

import edu.mit.batchfilter.api.Estimator;
import edu.mit.batchfilter.api.FilterConfig;
import edu.mit.batchfilter.api.MeasurementModel.Prediction;
import edu.mit.batchfilter.api.NumericalPreconditionException;
import edu.mit.batchfilter.api.StateEstimate;
import edu.mit.batchfilter.api.Transition;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.dense.row.mult.VectorVectorMult_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;
import org.ejml.simple.SimpleMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The baseline linear (extended) Kalman filter in covariance form, using the
 * classical Riccati propagation and update.
 * @since 7/8/2026
 */
public final class CovarianceFilter implements Estimator<CovarianceState> {
	private static final Logger LOG = LoggerFactory.getLogger(CovarianceFilter.class);
	public static final int DEFAULT_RUNGE_KUTTA_STEPS = 10;
	private final FilterConfig config;
	// noise description (constant)
	private final SimpleMatrix Q, R;
	private final DynamicsAdapter dynamics;
	private final MeasurementAdapter measurements;

	/**
	 * @throws NumericalPreconditionException if the noise covariances are not
	 * symmetric positive definite
	 */
	public CovarianceFilter(FilterConfig config) {
		this.config = config;
		NoiseModel noise = new NoiseModel(config.processNoise(), config.measurementNoise(), config.startSample());
		this.Q = new SimpleMatrix(noise.processNoise());
		this.R = new SimpleMatrix(noise.measurementNoise());
		this.dynamics = new DynamicsAdapter(config, config.rungeKuttaSteps(DEFAULT_RUNGE_KUTTA_STEPS));
		this.measurements = new MeasurementAdapter(config);
		LOG.info("Instantiated batch covariance filter: nx={} nv={} nz={} kmax={} timing={} rk={}",
				config.stateDimension(), config.processNoiseDimension(), config.measurementDimension(),
				config.sampleCount(), config.timing(), dynamics.rungeKuttaSteps());
	}

	@Override
	public String name() {
		return "LKF";
	}

	public int rungeKuttaSteps() {
		return dynamics.rungeKuttaSteps();
	}

	@Override
	public CovarianceState initialize(int sample) {
		DMatrixRMaj p = config.initialCovariance();
		MatrixOps.checkSymmetric(p, "initial covariance", sample);
		return new CovarianceState(config.initialMean(), p);
	}

	@Override
	public CovarianceState propagate(CovarianceState posterior, int sample) {
		Transition t = dynamics.transition(posterior.meanRef(), sample);
		SimpleMatrix F = SimpleMatrix.wrap(t.stateJacobian());
		SimpleMatrix G = SimpleMatrix.wrap(t.noiseJacobian());
		SimpleMatrix P = SimpleMatrix.wrap(posterior.covarianceRef());

		// P = F P F' + G Q G'
		SimpleMatrix Pbar = F.mult(P).mult(F.transpose()).plus(G.mult(Q).mult(G.transpose()));
		return new CovarianceState(t.state().copy(), Pbar.getDDRM());
	}

	@Override
	public Update<CovarianceState> update(CovarianceState prior, int sample) {
		// linearized at the a priori estimate
		Prediction p = measurements.predict(prior.meanRef(), sample);
		SimpleMatrix xbar = SimpleMatrix.wrap(prior.meanRef());
		SimpleMatrix Pbar = SimpleMatrix.wrap(prior.covarianceRef());
		SimpleMatrix H = SimpleMatrix.wrap(p.jacobian());
		SimpleMatrix z = SimpleMatrix.wrap(config.history().measurementAt(sample));

		// nu = z - h(xbar)
		SimpleMatrix nu = z.minus(SimpleMatrix.wrap(p.measurement()));

		// S = H P H' + R
		SimpleMatrix S = H.mult(Pbar).mult(H.transpose()).plus(R);
		LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.symmPosDef(S.getNumRows());
		if (!solver.setA(S.copy().getDDRM()))
			throw new NumericalPreconditionException("innovation covariance is not positive definite", sample);

		// W = P H' S^-1, as the solution of S W' = H P'
		DMatrixRMaj Wt = new DMatrixRMaj(S.getNumRows(), Pbar.getNumRows());
		solver.solve(H.mult(Pbar.transpose()).getDDRM(), Wt);
		SimpleMatrix W = SimpleMatrix.wrap(Wt).transpose();

		// x = x + W nu
		SimpleMatrix x = xbar.plus(W.mult(nu));

		// P = P - W S W'
		SimpleMatrix P = Pbar.minus(W.mult(S).mult(W.transpose()));

		// eta = nu' S^-1 nu
		DMatrixRMaj Sinvnu = new DMatrixRMaj(nu.getNumRows(), 1);
		solver.solve(nu.getDDRM(), Sinvnu);
		double eta = VectorVectorMult_DDRM.innerProd(nu.getDDRM(), Sinvnu);
		LOG.debug("LKF sample {}: innovation statistic {}", sample, eta);
		return new Update<>(new CovarianceState(x.getDDRM(), P.getDDRM()), eta);
	}

	@Override
	public StateEstimate readout(CovarianceState state) {
		return StateEstimate.of(state.meanRef(), state.covarianceRef());
	}
}
