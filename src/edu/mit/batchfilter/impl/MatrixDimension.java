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

import org.ejml.data.DMatrix;

/**
 * The shape of a matrix, used to check the matrices supplied by users and
 * returned by models.
 * @since 9/29/2026
 */
public final class MatrixDimension {
	private final int rows, cols;

	public MatrixDimension(int rows, int cols) {
		this.rows = rows;
		this.cols = cols;
	}

	public MatrixDimension(DMatrix m) {
		this(m.getNumRows(), m.getNumCols());
	}

	public static MatrixDimension square(int n) {
		return new MatrixDimension(n, n);
	}

	public static MatrixDimension column(int n) {
		return new MatrixDimension(n, 1);
	}

	public int rows() {
		return rows;
	}

	public int cols() {
		return cols;
	}

	public boolean isSquare() {
		return rows == cols;
	}

	/**
	 * @return true if the given matrix is non-null and has this shape
	 */
	public boolean matches(DMatrix m) {
		return m != null && m.getNumRows() == rows && m.getNumCols() == cols;
	}

	/**
	 * Formats the shape of a possibly-null matrix for error messages.
	 */
	public static String describe(DMatrix m) {
		return m == null ? "null" : new MatrixDimension(m).toString();
	}

	@Override
	public String toString() {
		return String.format("%dx%d", rows(), cols());
	}
}
