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
 * How the dynamics and measurement models relate to time.
 * @since 10/6/2026
 */
public enum ModelTiming {
	/**
	 * Continuous-time dynamics, discretized between samples by a
	 * {@link Discretizer}; discrete-time measurements.
	 */
	CONTINUOUS_DISCRETE("CD"),
	/**
	 * Discrete-time dynamics and measurements.
	 */
	DISCRETE_DISCRETE("DD");

	private final String flag;
	ModelTiming(String flag) {
		this.flag = flag;
	}

	public String flag() {
		return flag;
	}

	/**
	 * Parses a short timing flag ("CD" or "DD", case-insensitive).
	 * @throws ConfigurationException if the flag is not recognized
	 */
	public static ModelTiming fromFlag(String flag) {
		ConfigurationException.checkConfigNotNull(flag, "timing flag");
		for (ModelTiming t : values())
			if (t.flag.equalsIgnoreCase(flag.trim()))
				return t;
		throw new ConfigurationException("unrecognized timing flag for the dynamics-measurement models: " + flag);
	}
}
