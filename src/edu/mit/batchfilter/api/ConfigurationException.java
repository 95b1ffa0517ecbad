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

import com.google.common.base.Strings;

/**
 * Thrown when a filter is constructed with malformed or missing options.
 * Configuration errors are detected before any sample is processed.
 * @since 10/6/2026
 */
public class ConfigurationException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}

	/**
	 * Throws a ConfigurationException if the given condition is false.  The
	 * message is formatted like Guava's Preconditions messages.
	 */
	public static void checkConfig(boolean condition, String template, Object... args) {
		if (!condition)
			throw new ConfigurationException(Strings.lenientFormat(template, args));
	}

	public static <T> T checkConfigNotNull(T reference, String what) {
		if (reference == null)
			throw new ConfigurationException(what + " is required");
		return reference;
	}
}
