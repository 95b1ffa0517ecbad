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
 * The result of propagating a state over one sample interval: the next state
 * and its sensitivities with respect to the previous state (F) and the
 * process-noise input (Gamma).
 * @since 10/6/2026
 */
public final class Transition {
	private final DMatrixRMaj state, stateJacobian, noiseJacobian;

	/**
	 * @param state the propagated state (nx x 1)
	 * @param stateJacobian F (nx x nx), or null if sensitivities were not
	 * requested
	 * @param noiseJacobian Gamma (nx x nv), or null if sensitivities were not
	 * requested
	 */
	public Transition(DMatrixRMaj state, DMatrixRMaj stateJacobian, DMatrixRMaj noiseJacobian) {
		this.state = checkNotNull(state);
		this.stateJacobian = stateJacobian;
		this.noiseJacobian = noiseJacobian;
	}

	public DMatrixRMaj state() {
		return state;
	}

	public DMatrixRMaj stateJacobian() {
		return stateJacobian;
	}

	public DMatrixRMaj noiseJacobian() {
		return noiseJacobian;
	}

	public boolean hasSensitivities() {
		return stateJacobian != null && noiseJacobian != null;
	}
}
