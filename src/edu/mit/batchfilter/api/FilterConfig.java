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
import edu.mit.batchfilter.impl.MatrixDimension;
import edu.mit.batchfilter.impl.RungeKuttaDiscretizer;
import org.ejml.data.DMatrixRMaj;

/**
 * Everything a batch filter needs: models, timing, initial condition, data
 * and noise statistics, plus estimator options.  Built and validated once by
 * {@link Builder#build()}; immutable afterwards.
 * <p/>
 * Options and defaults:
 * <ul>
 * <li>timing: inferred from the dynamics that was set, unless given</li>
 * <li>continuous or discrete dynamics: the one matching the timing is required</li>
 * <li>measurement model: required</li>
 * <li>initial mean and covariance: required</li>
 * <li>history: required (may be empty)</li>
 * <li>process and measurement noise covariances: required</li>
 * <li>Runge-Kutta substeps: estimator-specific default, at least
 * {@value #MIN_RUNGE_KUTTA_STEPS}</li>
 * <li>start sample: 0 (start from scratch); larger values warm-start from
 * that sample</li>
 * <li>initial time: 0.0, the time of sample 0</li>
 * <li>discretizer: {@link RungeKuttaDiscretizer}</li>
 * </ul>
 * @since 10/6/2026
 */
public final class FilterConfig {
	public static final int MIN_RUNGE_KUTTA_STEPS = 5;

	private final ModelTiming timing;
	private final ContinuousDynamics continuousDynamics;
	private final DiscreteDynamics discreteDynamics;
	private final MeasurementModel measurementModel;
	private final DMatrixRMaj initialMean, initialCovariance;
	private final TimeHistory history;
	private final DMatrixRMaj processNoise, measurementNoise;
	private final Integer rungeKuttaSteps;
	private final int startSample;
	private final double initialTime;
	private final Discretizer discretizer;

	private FilterConfig(Builder b) {
		this.timing = b.timing;
		this.continuousDynamics = b.continuousDynamics;
		this.discreteDynamics = b.discreteDynamics;
		this.measurementModel = b.measurementModel;
		this.initialMean = b.initialMean.copy();
		this.initialCovariance = b.initialCovariance.copy();
		this.history = b.history;
		this.processNoise = b.processNoise.copy();
		this.measurementNoise = b.measurementNoise.copy();
		this.rungeKuttaSteps = b.rungeKuttaSteps;
		this.startSample = b.startSample;
		this.initialTime = b.initialTime;
		this.discretizer = b.discretizer;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns a builder initialized with this configuration's options, for
	 * deriving variants (different data, noise realizations, options).
	 */
	public Builder toBuilder() {
		Builder b = new Builder()
				.timing(timing)
				.measurementModel(measurementModel)
				.initialMean(initialMean)
				.initialCovariance(initialCovariance)
				.history(history)
				.processNoise(processNoise)
				.measurementNoise(measurementNoise)
				.startSample(startSample)
				.initialTime(initialTime)
				.discretizer(discretizer);
		b.continuousDynamics = continuousDynamics;
		b.discreteDynamics = discreteDynamics;
		b.rungeKuttaSteps = rungeKuttaSteps;
		return b;
	}

	public ModelTiming timing() {
		return timing;
	}

	public ContinuousDynamics continuousDynamics() {
		return continuousDynamics;
	}

	public DiscreteDynamics discreteDynamics() {
		return discreteDynamics;
	}

	public MeasurementModel measurementModel() {
		return measurementModel;
	}

	public DMatrixRMaj initialMean() {
		return initialMean.copy();
	}

	public DMatrixRMaj initialCovariance() {
		return initialCovariance.copy();
	}

	public TimeHistory history() {
		return history;
	}

	public DMatrixRMaj processNoise() {
		return processNoise.copy();
	}

	public DMatrixRMaj measurementNoise() {
		return measurementNoise.copy();
	}

	/**
	 * @param defaultSteps the estimator's default
	 * @return the configured number of Runge-Kutta substeps, or the default
	 */
	public int rungeKuttaSteps(int defaultSteps) {
		return rungeKuttaSteps != null ? rungeKuttaSteps : defaultSteps;
	}

	public int startSample() {
		return startSample;
	}

	public double initialTime() {
		return initialTime;
	}

	/**
	 * @return the time of the given sample (0..kmax)
	 */
	public double timeAt(int sample) {
		return sample == 0 ? initialTime : history.timeAt(sample);
	}

	public Discretizer discretizer() {
		return discretizer;
	}

	/**
	 * @return nx, the state dimension
	 */
	public int stateDimension() {
		return initialMean.getNumRows();
	}

	/**
	 * @return nv, the process noise dimension
	 */
	public int processNoiseDimension() {
		return processNoise.getNumRows();
	}

	/**
	 * @return nz, the measurement dimension
	 */
	public int measurementDimension() {
		return measurementNoise.getNumRows();
	}

	/**
	 * @return kmax, the number of measurement samples
	 */
	public int sampleCount() {
		return history.size();
	}

	public static final class Builder {
		private ModelTiming timing;
		private ContinuousDynamics continuousDynamics;
		private DiscreteDynamics discreteDynamics;
		private MeasurementModel measurementModel;
		private DMatrixRMaj initialMean, initialCovariance;
		private TimeHistory history;
		private DMatrixRMaj processNoise, measurementNoise;
		private Integer rungeKuttaSteps;
		private int startSample = 0;
		private double initialTime = 0;
		private Discretizer discretizer = new RungeKuttaDiscretizer();
		private Builder() {}

		public Builder timing(ModelTiming timing) {
			this.timing = timing;
			return this;
		}

		/**
		 * Sets the timing from its short flag, "CD" or "DD".
		 * @throws ConfigurationException if the flag is not recognized
		 */
		public Builder timing(String flag) {
			return timing(ModelTiming.fromFlag(flag));
		}

		/**
		 * Sets continuous dynamics; also sets the timing to
		 * {@link ModelTiming#CONTINUOUS_DISCRETE} if it is not yet set.
		 */
		public Builder continuousDynamics(ContinuousDynamics dynamics) {
			this.continuousDynamics = dynamics;
			if (timing == null)
				timing = ModelTiming.CONTINUOUS_DISCRETE;
			return this;
		}

		/**
		 * Sets discrete dynamics; also sets the timing to
		 * {@link ModelTiming#DISCRETE_DISCRETE} if it is not yet set.
		 */
		public Builder discreteDynamics(DiscreteDynamics dynamics) {
			this.discreteDynamics = dynamics;
			if (timing == null)
				timing = ModelTiming.DISCRETE_DISCRETE;
			return this;
		}

		public Builder measurementModel(MeasurementModel model) {
			this.measurementModel = model;
			return this;
		}

		public Builder initialMean(DMatrixRMaj mean) {
			this.initialMean = mean;
			return this;
		}

		public Builder initialCovariance(DMatrixRMaj covariance) {
			this.initialCovariance = covariance;
			return this;
		}

		public Builder history(TimeHistory history) {
			this.history = history;
			return this;
		}

		public Builder processNoise(DMatrixRMaj q) {
			this.processNoise = q;
			return this;
		}

		public Builder measurementNoise(DMatrixRMaj r) {
			this.measurementNoise = r;
			return this;
		}

		public Builder rungeKuttaSteps(int steps) {
			this.rungeKuttaSteps = steps;
			return this;
		}

		public Builder startSample(int sample) {
			this.startSample = sample;
			return this;
		}

		public Builder initialTime(double time) {
			this.initialTime = time;
			return this;
		}

		public Builder discretizer(Discretizer discretizer) {
			this.discretizer = discretizer;
			return this;
		}

		/**
		 * Validates the options and builds the configuration.
		 * @throws ConfigurationException if any option is missing or malformed
		 */
		public FilterConfig build() {
			checkConfigNotNull(timing, "model timing");
			switch (timing) {
				case CONTINUOUS_DISCRETE:
					checkConfigNotNull(continuousDynamics, "continuous dynamics");
					break;
				case DISCRETE_DISCRETE:
					checkConfigNotNull(discreteDynamics, "discrete dynamics");
					break;
				default:
					throw new ConfigurationException("unrecognized timing for the dynamics-measurement models: " + timing);
			}
			checkConfigNotNull(measurementModel, "measurement model");
			checkConfigNotNull(discretizer, "discretizer");

			checkConfigNotNull(initialMean, "initial mean");
			checkConfig(initialMean.getNumCols() == 1 && initialMean.getNumRows() > 0,
					"initial mean must be a nonempty column vector, not %s", MatrixDimension.describe(initialMean));
			int nx = initialMean.getNumRows();
			checkConfigNotNull(initialCovariance, "initial covariance");
			checkConfig(MatrixDimension.square(nx).matches(initialCovariance),
					"initial covariance is %s, expected %s", MatrixDimension.describe(initialCovariance), MatrixDimension.square(nx));

			checkConfigNotNull(processNoise, "process noise covariance");
			checkConfig(new MatrixDimension(processNoise).isSquare() && processNoise.getNumRows() > 0,
					"process noise covariance must be square, not %s", MatrixDimension.describe(processNoise));
			checkConfigNotNull(measurementNoise, "measurement noise covariance");
			checkConfig(new MatrixDimension(measurementNoise).isSquare() && measurementNoise.getNumRows() > 0,
					"measurement noise covariance must be square, not %s", MatrixDimension.describe(measurementNoise));

			checkConfigNotNull(history, "history");
			checkConfig(history.isEmpty() || history.measurementDimension() == measurementNoise.getNumRows(),
					"measurements have %s rows but the measurement noise covariance is %s",
					history.measurementDimension(), MatrixDimension.describe(measurementNoise));
			checkConfig(history.isEmpty() || initialTime <= history.timeAt(1),
					"initial time %s is after the first sample's time %s", initialTime, history.isEmpty() ? null : history.timeAt(1));

			checkConfig(rungeKuttaSteps == null || rungeKuttaSteps >= MIN_RUNGE_KUTTA_STEPS,
					"number of Runge-Kutta substeps must be at least %s, not %s", MIN_RUNGE_KUTTA_STEPS, rungeKuttaSteps);
			checkConfig(startSample >= 0 && startSample <= history.size(),
					"start sample %s outside 0..%s", startSample, history.size());
			return new FilterConfig(this);
		}
	}
}
