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

import edu.mit.batchfilter.api.FilterConfig;
import edu.mit.batchfilter.api.MeasurementModel.Prediction;
import edu.mit.batchfilter.api.ModelEvaluationException;
import org.ejml.data.DMatrixRMaj;

/**
 * Linearizes the configured measurement model and checks the shapes it
 * returns.
 * @since 10/9/2026
 */
final class MeasurementAdapter {
	private final FilterConfig config;

	MeasurementAdapter(FilterConfig config) {
		this.config = config;
	}

	Prediction predict(DMatrixRMaj mean, int sample) {
		Prediction p = config.measurementModel().predict(mean, sample);
		int nx = config.stateDimension(), nz = config.measurementDimension();
		if (p == null || !MatrixDimension.column(nz).matches(p.measurement())
				|| !new MatrixDimension(nz, nx).matches(p.jacobian()))
			throw new ModelEvaluationException(String.format(
					"measurement model at sample %d returned %s, H %s; expected %s, %s", sample,
					p == null ? "null" : MatrixDimension.describe(p.measurement()),
					p == null ? "null" : MatrixDimension.describe(p.jacobian()),
					MatrixDimension.column(nz), new MatrixDimension(nz, nx)));
		return p;
	}
}
