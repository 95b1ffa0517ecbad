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

import org.ejml.data.DMatrixRMaj;

/**
 * Converts continuous-time dynamics to a discrete transition over one sample
 * interval.  Implementations must be deterministic and free of side effects;
 * exceptions thrown by the dynamics propagate unchanged.
 * @since 10/6/2026
 */
@FunctionalInterface
public interface Discretizer {
	/**
	 * @param dynamics the continuous dynamics
	 * @param x the state at t0
	 * @param u the control, held constant over the interval
	 * @param v the nominal process noise, held constant over the interval
	 * @param t0 the start time
	 * @param t1 the end time
	 * @param steps the number of integration substeps
	 * @param sensitivities whether to also integrate F and Gamma
	 * @return the state at t1, with F and Gamma if requested
	 */
	Transition discretize(ContinuousDynamics dynamics, DMatrixRMaj x, DMatrixRMaj u, DMatrixRMaj v,
			double t0, double t1, int steps, boolean sensitivities);
}
