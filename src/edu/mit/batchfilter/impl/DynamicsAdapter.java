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

import edu.mit.batchfilter.api.ConfigurationException;
import edu.mit.batchfilter.api.FilterConfig;
import edu.mit.batchfilter.api.ModelEvaluationException;
import edu.mit.batchfilter.api.Transition;
import org.ejml.data.DMatrixRMaj;

/**
 * Supplies the propagated mean and its sensitivities (xbar, F, Gamma) for one
 * sample interval, either by discretizing continuous dynamics or by calling
 * discrete dynamics directly.  The process noise is held at its nominal zero
 * value.
 * @since 10/9/2026
 */
final class DynamicsAdapter {
	private final FilterConfig config;
	private final int rungeKuttaSteps;

	DynamicsAdapter(FilterConfig config, int rungeKuttaSteps) {
		this.config = config;
		this.rungeKuttaSteps = rungeKuttaSteps;
	}

	int rungeKuttaSteps() {
		return rungeKuttaSteps;
	}

	/**
	 * Propagates the posterior mean at the given sample to the next sample.
	 */
	Transition transition(DMatrixRMaj mean, int sample) {
		DMatrixRMaj u = config.history().controlAt(sample);
		DMatrixRMaj v = MatrixOps.zeros(config.processNoiseDimension());
		Transition t;
		switch (config.timing()) {
			case CONTINUOUS_DISCRETE:
				t = config.discretizer().discretize(config.continuousDynamics(), mean, u, v,
						config.timeAt(sample), config.timeAt(sample + 1), rungeKuttaSteps, true);
				break;
			case DISCRETE_DISCRETE:
				t = config.discreteDynamics().propagate(mean, u, v, sample);
				break;
			default:
				throw new ConfigurationException("unrecognized timing for the dynamics-measurement models: " + config.timing());
		}
		return checkShape(t, sample);
	}

	private Transition checkShape(Transition t, int sample) {
		int nx = config.stateDimension(), nv = config.processNoiseDimension();
		if (t == null || !MatrixDimension.column(nx).matches(t.state())
				|| !MatrixDimension.square(nx).matches(t.stateJacobian())
				|| !new MatrixDimension(nx, nv).matches(t.noiseJacobian()))
			throw new ModelEvaluationException(String.format(
					"dynamics at sample %d returned state %s, F %s, Gamma %s; expected %s, %s, %s", sample,
					t == null ? "null" : MatrixDimension.describe(t.state()),
					t == null ? "null" : MatrixDimension.describe(t.stateJacobian()),
					t == null ? "null" : MatrixDimension.describe(t.noiseJacobian()),
					MatrixDimension.column(nx), MatrixDimension.square(nx), new MatrixDimension(nx, nv)));
		return t;
	}
}
