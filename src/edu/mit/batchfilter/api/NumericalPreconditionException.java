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

/**
 * Thrown when a run cannot continue because a matrix fails a numerical
 * precondition: a covariance that is not symmetric positive definite, a
 * singular state-transition Jacobian, or a singular information factor.
 * These failures are deterministic, so the run is aborted rather than
 * retried.
 * @since 10/6/2026
 */
public class NumericalPreconditionException extends ArithmeticException {
	private static final long serialVersionUID = 1L;
	private final int sample;

	public NumericalPreconditionException(String message, int sample) {
		super(message + " (sample " + sample + ")");
		this.sample = sample;
	}

	/**
	 * @return the sample index being processed when the failure occurred;
	 * setup failures report the filter's start sample
	 */
	public int getSample() {
		return sample;
	}
}
