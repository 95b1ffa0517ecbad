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
 * A discrete-time dynamics model, x(k+1) = f(x(k), u(k), v(k), k).
 * @since 10/6/2026
 */
@FunctionalInterface
public interface DiscreteDynamics {
	/**
	 * Propagates the state from sample k to sample k+1.  Implementations must
	 * not modify their arguments and must return both Jacobians.
	 * @param x the state at sample k
	 * @param u the control applied over the interval
	 * @param v the process noise
	 * @param sample k
	 * @return the state at k+1 with F = df/dx and Gamma = df/dv
	 */
	Transition propagate(DMatrixRMaj x, DMatrixRMaj u, DMatrixRMaj v, int sample);
}
