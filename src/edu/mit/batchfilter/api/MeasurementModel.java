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
 * A discrete-time measurement model, z(k) = h(x(k), k) + w(k).
 * @since 10/6/2026
 */
@FunctionalInterface
public interface MeasurementModel {
	/**
	 * Predicts the measurement at the given state and linearizes about it.
	 * Implementations must not modify their arguments.
	 * @param x the state
	 * @param sample the sample index the measurement belongs to
	 * @return the predicted measurement and H = dh/dx
	 */
	Prediction predict(DMatrixRMaj x, int sample);

	final class Prediction {
		private final DMatrixRMaj measurement, jacobian;

		public Prediction(DMatrixRMaj measurement, DMatrixRMaj jacobian) {
			this.measurement = checkNotNull(measurement);
			this.jacobian = checkNotNull(jacobian);
		}

		public DMatrixRMaj measurement() {
			return measurement;
		}

		public DMatrixRMaj jacobian() {
			return jacobian;
		}
	}
}
