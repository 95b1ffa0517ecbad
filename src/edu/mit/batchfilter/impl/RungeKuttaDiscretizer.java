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

import static com.google.common.base.Preconditions.checkArgument;
import edu.mit.batchfilter.api.ContinuousDynamics;
import edu.mit.batchfilter.api.ContinuousDynamics.Derivative;
import edu.mit.batchfilter.api.Discretizer;
import edu.mit.batchfilter.api.ModelEvaluationException;
import edu.mit.batchfilter.api.Transition;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Fixed-step classical fourth-order Runge-Kutta discretization.  The state is
 * integrated together with its sensitivities,
 * <pre>
 *   dF/dt     = A F,           F(t0)     = I
 *   dGamma/dt = A Gamma + D,   Gamma(t0) = 0
 * </pre>
 * where A = df/dx and D = df/dv are evaluated along the trajectory.
 * @since 10/9/2026
 */
public final class RungeKuttaDiscretizer implements Discretizer {
	@Override
	public Transition discretize(ContinuousDynamics dynamics, DMatrixRMaj x, DMatrixRMaj u, DMatrixRMaj v,
			double t0, double t1, int steps, boolean sensitivities) {
		checkArgument(steps > 0, "%s steps", steps);
		int nx = x.getNumRows(), nv = v.getNumRows();
		DMatrixRMaj[] y = sensitivities ?
				new DMatrixRMaj[]{x.copy(), CommonOps_DDRM.identity(nx), new DMatrixRMaj(nx, nv)} :
				new DMatrixRMaj[]{x.copy()};
		double h = (t1 - t0) / steps;
		for (int i = 0; i < steps; ++i) {
			double t = t0 + i * h;
			DMatrixRMaj[] k1 = slope(dynamics, t, y, u, v);
			DMatrixRMaj[] k2 = slope(dynamics, t + h / 2, offset(y, k1, h / 2), u, v);
			DMatrixRMaj[] k3 = slope(dynamics, t + h / 2, offset(y, k2, h / 2), u, v);
			DMatrixRMaj[] k4 = slope(dynamics, t + h, offset(y, k3, h), u, v);
			for (int j = 0; j < y.length; ++j) {
				//y += h/6 (k1 + 2 k2 + 2 k3 + k4)
				CommonOps_DDRM.addEquals(y[j], h / 6, k1[j]);
				CommonOps_DDRM.addEquals(y[j], h / 3, k2[j]);
				CommonOps_DDRM.addEquals(y[j], h / 3, k3[j]);
				CommonOps_DDRM.addEquals(y[j], h / 6, k4[j]);
			}
		}
		return sensitivities ? new Transition(y[0], y[1], y[2]) : new Transition(y[0], null, null);
	}

	private static DMatrixRMaj[] slope(ContinuousDynamics dynamics, double t, DMatrixRMaj[] y, DMatrixRMaj u, DMatrixRMaj v) {
		boolean sensitivities = y.length == 3;
		Derivative d = dynamics.evaluate(t, y[0], u, v, sensitivities);
		int nx = y[0].getNumRows();
		if (!MatrixDimension.column(nx).matches(d.stateDerivative()))
			throw new ModelEvaluationException("dynamics returned a " + MatrixDimension.describe(d.stateDerivative())
					+ " derivative for a " + nx + "-state");
		if (!sensitivities)
			return new DMatrixRMaj[]{d.stateDerivative()};

		DMatrixRMaj a = d.stateJacobian(), dv = d.noiseJacobian();
		if (!MatrixDimension.square(nx).matches(a) || !new MatrixDimension(y[2]).matches(dv))
			throw new ModelEvaluationException("dynamics returned Jacobians " + MatrixDimension.describe(a) + " and "
					+ MatrixDimension.describe(dv) + ", expected " + MatrixDimension.square(nx) + " and " + new MatrixDimension(y[2]));
		DMatrixRMaj dF = new DMatrixRMaj(nx, nx);
		CommonOps_DDRM.mult(a, y[1], dF);
		DMatrixRMaj dGamma = dv.copy();
		CommonOps_DDRM.multAdd(a, y[2], dGamma);
		return new DMatrixRMaj[]{d.stateDerivative(), dF, dGamma};
	}

	private static DMatrixRMaj[] offset(DMatrixRMaj[] y, DMatrixRMaj[] k, double h) {
		DMatrixRMaj[] out = new DMatrixRMaj[y.length];
		for (int j = 0; j < y.length; ++j) {
			out[j] = new DMatrixRMaj(y[j].getNumRows(), y[j].getNumCols());
			CommonOps_DDRM.add(y[j], h, k[j], out[j]);
		}
		return out;
	}
}
