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
import org.ejml.data.DMatrixRMaj;

/**
 * A continuous-time dynamics model, xdot = f(t, x, u, v).
 * @since 10/6/2026
 */
@FunctionalInterface
public interface ContinuousDynamics {
	/**
	 * Evaluates the state derivative, and its Jacobians if requested.
	 * Implementations must not modify their arguments.
	 * @param t the time
	 * @param x the state (nx x 1)
	 * @param u the control (nu x 1, possibly 0 x 1)
	 * @param v the process noise (nv x 1)
	 * @param jacobians whether to compute A = df/dx and D = df/dv
	 * @return the derivative
	 */
	Derivative evaluate(double t, DMatrixRMaj x, DMatrixRMaj u, DMatrixRMaj v, boolean jacobians);

	final class Derivative {
		private final DMatrixRMaj stateDerivative, stateJacobian, noiseJacobian;

		public Derivative(DMatrixRMaj stateDerivative, DMatrixRMaj stateJacobian, DMatrixRMaj noiseJacobian) {
			this.stateDerivative = checkNotNull(stateDerivative);
			this.stateJacobian = stateJacobian;
			this.noiseJacobian = noiseJacobian;
		}

		public Derivative(DMatrixRMaj stateDerivative) {
			this(stateDerivative, null, null);
		}

		public DMatrixRMaj stateDerivative() {
			return stateDerivative;
		}

		/**
		 * @return A = df/dx (nx x nx), or null if not computed
		 */
		public DMatrixRMaj stateJacobian() {
			return stateJacobian;
		}

		/**
		 * @return D = df/dv (nx x nv), or null if not computed
		 */
		public DMatrixRMaj noiseJacobian() {
			return noiseJacobian;
		}
	}
}
