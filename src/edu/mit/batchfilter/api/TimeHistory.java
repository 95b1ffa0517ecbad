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

import static edu.mit.batchfilter.api.ConfigurationException.checkConfig;
import static edu.mit.batchfilter.api.ConfigurationException.checkConfigNotNull;
import static com.google.common.base.Preconditions.checkElementIndex;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import java.util.List;
import org.ejml.data.DMatrixRMaj;

/**
 * The timestamps, controls and measurements of samples 1 through kmax.  The
 * control recorded with sample k+1 drives the interval from sample k to
 * sample k+1, so it is addressed as {@code controlAt(k)}.
 * <p/>
 * Instances are immutable; matrices are copied in and out.
 * @since 10/6/2026
 */
public final class TimeHistory {
	private final ImmutableDoubleArray times;
	private final ImmutableList<DMatrixRMaj> controls, measurements;

	private TimeHistory(ImmutableDoubleArray times, ImmutableList<DMatrixRMaj> controls, ImmutableList<DMatrixRMaj> measurements) {
		checkConfig(times.length() == controls.size() && times.length() == measurements.size(),
				"misaligned history: %s times, %s controls, %s measurements",
				times.length(), controls.size(), measurements.size());
		for (int i = 1; i < times.length(); ++i)
			checkConfig(times.get(i - 1) <= times.get(i), "timestamps out of order at sample %s", i + 1);
		for (int i = 0; i < controls.size(); ++i) {
			checkConfig(controls.get(i).getNumCols() == 1, "control %s is not a column vector", i);
			checkConfig(controls.get(i).getNumRows() == controls.get(0).getNumRows(),
					"control %s has %s rows, expected %s", i, controls.get(i).getNumRows(), controls.get(0).getNumRows());
			checkConfig(measurements.get(i).getNumCols() == 1, "measurement %s is not a column vector", i + 1);
			checkConfig(measurements.get(i).getNumRows() == measurements.get(0).getNumRows(),
					"measurement %s has %s rows, expected %s", i + 1, measurements.get(i).getNumRows(), measurements.get(0).getNumRows());
		}
		this.times = times;
		this.controls = controls;
		this.measurements = measurements;
	}

	public static TimeHistory of(double[] times, List<DMatrixRMaj> controls, List<DMatrixRMaj> measurements) {
		checkConfigNotNull(times, "time history");
		checkConfigNotNull(controls, "control history");
		checkConfigNotNull(measurements, "measurement history");
		return new TimeHistory(ImmutableDoubleArray.copyOf(times), copyAll(controls), copyAll(measurements));
	}

	/**
	 * Creates a history without controls; each sample gets an empty (0x1)
	 * control vector.
	 */
	public static TimeHistory of(double[] times, List<DMatrixRMaj> measurements) {
		checkConfigNotNull(measurements, "measurement history");
		ImmutableList.Builder<DMatrixRMaj> controls = ImmutableList.builder();
		for (int i = 0; i < measurements.size(); ++i)
			controls.add(new DMatrixRMaj(0, 1));
		return of(times, controls.build(), measurements);
	}

	public static TimeHistory empty() {
		return new TimeHistory(ImmutableDoubleArray.of(), ImmutableList.of(), ImmutableList.of());
	}

	public static Builder builder() {
		return new Builder();
	}

	private static ImmutableList<DMatrixRMaj> copyAll(List<DMatrixRMaj> list) {
		ImmutableList.Builder<DMatrixRMaj> b = ImmutableList.builder();
		for (int i = 0; i < list.size(); ++i)
			b.add(checkConfigNotNull(list.get(i), "history entry " + i).copy());
		return b.build();
	}

	/**
	 * @return kmax, the number of measurement samples
	 */
	public int size() {
		return times.length();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * @param sample 1..kmax
	 */
	public double timeAt(int sample) {
		checkElementIndex(sample - 1, size(), "sample");
		return times.get(sample - 1);
	}

	/**
	 * @param sample 1..kmax
	 */
	public DMatrixRMaj measurementAt(int sample) {
		checkElementIndex(sample - 1, size(), "sample");
		return measurements.get(sample - 1).copy();
	}

	/**
	 * Returns the control that drives the interval from the given sample to
	 * the next one.
	 * @param sample 0..kmax-1
	 */
	public DMatrixRMaj controlAt(int sample) {
		checkElementIndex(sample, size(), "sample");
		return controls.get(sample).copy();
	}

	/**
	 * @return the measurement dimension, or -1 if the history is empty
	 */
	public int measurementDimension() {
		return isEmpty() ? -1 : measurements.get(0).getNumRows();
	}

	/**
	 * @return the control dimension, or -1 if the history is empty
	 */
	public int controlDimension() {
		return isEmpty() ? -1 : controls.get(0).getNumRows();
	}

	public static final class Builder {
		private final ImmutableDoubleArray.Builder times = ImmutableDoubleArray.builder();
		private final ImmutableList.Builder<DMatrixRMaj> controls = ImmutableList.builder(),
				measurements = ImmutableList.builder();
		private Builder() {}

		/**
		 * Appends the next sample.
		 * @param time the sample's timestamp
		 * @param control the control applied since the previous sample
		 * @param measurement the sample's measurement
		 */
		public Builder add(double time, DMatrixRMaj control, DMatrixRMaj measurement) {
			times.add(time);
			controls.add(checkConfigNotNull(control, "control").copy());
			measurements.add(checkConfigNotNull(measurement, "measurement").copy());
			return this;
		}

		public Builder add(double time, DMatrixRMaj measurement) {
			return add(time, new DMatrixRMaj(0, 1), measurement);
		}

		public TimeHistory build() {
			return new TimeHistory(times.build(), controls.build(), measurements.build());
		}
	}
}
