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

import com.google.common.collect.ImmutableList;
import edu.mit.batchfilter.api.Estimator;
import edu.mit.batchfilter.api.FilterConfig;
import edu.mit.batchfilter.api.MeasurementModel.Prediction;
import edu.mit.batchfilter.api.NumericalPreconditionException;
import edu.mit.batchfilter.api.StateEstimate;
import edu.mit.batchfilter.api.Transition;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.QRDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The extended square-root information filter.  Uncertainty is carried as a
 * triangular factor R of the inverse covariance together with the
 * information vector zeta = R x.  Process noise, prior information and
 * measurements are fused only through orthogonal (QR) transforms, and the
 * covariance is never formed or inverted inside the recurrence.
 * <p/>
 * Propagation from k to k+1 triangularizes
 * <pre>
 *   [ Rvv          0      ] [ v      ]   [ 0           ]
 *   [ -Rxx F^-1 G  Rxx F^-1 ] [ x(k+1) ] = [ Rxx F^-1 xbar ]
 * </pre>
 * and keeps the bottom-right block.  The update triangularizes the a priori
 * factor stacked on the whitened measurement Jacobian; the part of the
 * transformed right-hand side below the factor is the residual whose squared
 * norm is the innovation statistic.
 * @since 10/10/2026
 */
public final class SquareRootInformationFilter implements Estimator<InformationState> {
	private static final Logger LOG = LoggerFactory.getLogger(SquareRootInformationFilter.class);
	public static final int DEFAULT_RUNGE_KUTTA_STEPS = 20;
	private final FilterConfig config;
	private final NoiseModel noise;
	private final DMatrixRMaj processSqrtInformation;
	/**
	 * Measurements transformed to identity noise covariance; element i
	 * belongs to sample i+1.
	 */
	private final ImmutableList<DMatrixRMaj> whitenedMeasurements;
	private final DynamicsAdapter dynamics;
	private final MeasurementAdapter measurements;

	/**
	 * @throws NumericalPreconditionException if the noise covariances are not
	 * symmetric positive definite
	 */
	public SquareRootInformationFilter(FilterConfig config) {
		this.config = config;
		this.noise = new NoiseModel(config.processNoise(), config.measurementNoise(), config.startSample());
		this.processSqrtInformation = noise.processSqrtInformation();
		ImmutableList.Builder<DMatrixRMaj> whitened = ImmutableList.builder();
		for (int k = 1; k <= config.sampleCount(); ++k)
			whitened.add(noise.whiten(config.history().measurementAt(k)));
		this.whitenedMeasurements = whitened.build();
		this.dynamics = new DynamicsAdapter(config, config.rungeKuttaSteps(DEFAULT_RUNGE_KUTTA_STEPS));
		this.measurements = new MeasurementAdapter(config);
		LOG.info("Instantiated batch square-root information filter: nx={} nv={} nz={} kmax={} timing={} rk={}",
				config.stateDimension(), config.processNoiseDimension(), config.measurementDimension(),
				config.sampleCount(), config.timing(), dynamics.rungeKuttaSteps());
	}

	@Override
	public String name() {
		return "ESRIF";
	}

	public int rungeKuttaSteps() {
		return dynamics.rungeKuttaSteps();
	}

	public NoiseModel noiseModel() {
		return noise;
	}

	/**
	 * @param sample 1..kmax
	 * @return the whitened measurement at the sample
	 */
	public DMatrixRMaj whitenedMeasurement(int sample) {
		return whitenedMeasurements.get(sample - 1).copy();
	}

	@Override
	public InformationState initialize(int sample) {
		DMatrixRMaj x0 = config.initialMean();
		DMatrixRMaj c = MatrixOps.choleskyUpper(config.initialCovariance(), "initial covariance", sample);
		DMatrixRMaj r0 = MatrixOps.inverseTransposeOfUpper(c, "initial covariance", sample);
		DMatrixRMaj zeta0 = new DMatrixRMaj(x0.getNumRows(), 1);
		CommonOps_DDRM.mult(r0, x0, zeta0);
		return new InformationState(sample, r0, zeta0, x0);
	}

	@Override
	public InformationState propagate(InformationState posterior, int sample) {
		int nx = config.stateDimension(), nv = config.processNoiseDimension();
		Transition t = dynamics.transition(posterior.meanRef(), sample);
		DMatrixRMaj xbar = t.state();
		DMatrixRMaj rxx = posterior.factorRef();

		//Rxx F^-1 as the solution of F' X' = Rxx'
		DMatrixRMaj rxxFinv = CommonOps_DDRM.transpose(MatrixOps.solve(
				CommonOps_DDRM.transpose(t.stateJacobian(), null),
				CommonOps_DDRM.transpose(rxx, null),
				"state transition matrix", sample), null);
		DMatrixRMaj rxxFinvGamma = new DMatrixRMaj(nx, nv);
		CommonOps_DDRM.mult(rxxFinv, t.noiseJacobian(), rxxFinvGamma);
		CommonOps_DDRM.changeSign(rxxFinvGamma);

		DMatrixRMaj big = new DMatrixRMaj(nv + nx, nv + nx);
		CommonOps_DDRM.insert(processSqrtInformation, big, 0, 0);
		CommonOps_DDRM.insert(rxxFinvGamma, big, nv, 0);
		CommonOps_DDRM.insert(rxxFinv, big, nv, nv);
		DMatrixRMaj rhs = new DMatrixRMaj(nv + nx, 1);
		DMatrixRMaj rxxFinvXbar = new DMatrixRMaj(nx, 1);
		CommonOps_DDRM.mult(rxxFinv, xbar, rxxFinvXbar);
		CommonOps_DDRM.insert(rxxFinvXbar, rhs, nv, 0);

		Triangularized tri = triangularize(big, rhs, sample);
		DMatrixRMaj rbar = CommonOps_DDRM.extract(tri.r, nv, nv + nx, nv, nv + nx);
		DMatrixRMaj zetabar = CommonOps_DDRM.extract(tri.qtb, nv, nv + nx, 0, 1);
		return new InformationState(sample + 1, rbar, zetabar, xbar.copy());
	}

	@Override
	public Update<InformationState> update(InformationState prior, int sample) {
		int nx = config.stateDimension(), nz = config.measurementDimension();
		DMatrixRMaj xbar = prior.meanRef();
		Prediction p = measurements.predict(xbar, sample);

		//whitened Jacobian and the pseudo-linear measurement za - Ra^-T h(xbar) + Ha xbar
		DMatrixRMaj ha = noise.whiten(p.jacobian());
		DMatrixRMaj zekf = whitenedMeasurements.get(sample - 1).copy();
		CommonOps_DDRM.subtractEquals(zekf, noise.whiten(p.measurement()));
		CommonOps_DDRM.multAdd(ha, xbar, zekf);

		Triangularized tri = triangularize(MatrixOps.stack(prior.factorRef(), ha),
				MatrixOps.stack(prior.vectorRef(), zekf), sample);
		DMatrixRMaj rxx = CommonOps_DDRM.extract(tri.r, 0, nx, 0, nx);
		DMatrixRMaj zeta = CommonOps_DDRM.extract(tri.qtb, 0, nx, 0, 1);
		DMatrixRMaj residual = CommonOps_DDRM.extract(tri.qtb, nx, nx + nz, 0, 1);

		DMatrixRMaj mean = MatrixOps.solveTriangular(rxx, true, zeta, "information factor", sample);
		double eta = MatrixOps.squaredNorm(residual);
		LOG.debug("ESRIF sample {}: innovation statistic {}", sample, eta);
		return new Update<>(new InformationState(sample, rxx, zeta, mean), eta);
	}

	@Override
	public StateEstimate readout(InformationState state) {
		DMatrixRMaj covariance = MatrixOps.informationToCovariance(state.factorRef(), state.sample());
		return StateEstimate.of(state.meanRef(), covariance, state.factorRef());
	}

	private static final class Triangularized {
		/**
		 * The upper-triangular factor of the stacked matrix.
		 */
		final DMatrixRMaj r;
		/**
		 * The right-hand side with the same orthogonal transform applied.
		 */
		final DMatrixRMaj qtb;
		Triangularized(DMatrixRMaj r, DMatrixRMaj qtb) {
			this.r = r;
			this.qtb = qtb;
		}
	}

	/**
	 * QR-factors A = Q T and applies Q' to b.
	 */
	private static Triangularized triangularize(DMatrixRMaj a, DMatrixRMaj b, int sample) {
		QRDecomposition<DMatrixRMaj> qr = DecompositionFactory_DDRM.qr(a.getNumRows(), a.getNumCols());
		if (!qr.decompose(a.copy()))
			throw new NumericalPreconditionException("QR factorization failed", sample);
		DMatrixRMaj q = qr.getQ(null, false);
		DMatrixRMaj r = qr.getR(null, false);
		DMatrixRMaj qtb = new DMatrixRMaj(a.getNumRows(), 1);
		CommonOps_DDRM.multTransA(q, b, qtb);
		return new Triangularized(r, qtb);
	}
}
