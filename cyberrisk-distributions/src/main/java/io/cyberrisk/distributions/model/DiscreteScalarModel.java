/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.cyberrisk.distributions.model;

import com.google.gson.annotations.SerializedName;
import io.cyberrisk.api.InvalidParameterException;
import io.cyberrisk.api.ParameterChecks;

import java.util.Arrays;

/**
 * Finite discrete distribution over an ascending set of values.
 *
 * <h2>Purpose</h2>
 *
 * <p>Models the number of loss events per year: values are occurrence counts
 * and each carries an explicit probability.
 *
 * <h2>Invariants</h2>
 *
 * <ul>
 *   <li>at least one value; values and probabilities have equal length</li>
 *   <li>values are finite and strictly ascending</li>
 *   <li>probabilities are non-negative and sum to 1 within {@link #SUM_TOLERANCE}</li>
 * </ul>
 *
 * <h2>Sampling</h2>
 *
 * <p>Inverse CDF over the cumulative probabilities: a uniform u selects the
 * first value whose cumulative probability exceeds u.
 *
 * @see io.cyberrisk.distributions.sampling.DiscreteSampler
 */
@ModelType(DiscreteScalarModel.MODEL_TYPE)
public final class DiscreteScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "discrete";

    /** Allowed absolute deviation of the probability sum from 1. */
    public static final double SUM_TOLERANCE = 1e-6;

    @SerializedName("values")
    private final double[] values;

    @SerializedName("probabilities")
    private final double[] probabilities;

    /**
     * @param values the support points, strictly ascending
     * @param probabilities the probability of each support point
     * @throws InvalidParameterException if any invariant fails
     */
    public DiscreteScalarModel(double[] values, double[] probabilities) {
        this.values = values == null ? null : values.clone();
        this.probabilities = probabilities == null ? null : probabilities.clone();
        validate();
    }

    /**
     * Convenience constructor for integer support such as occurrence counts.
     *
     * @param values the integer support points, strictly ascending
     * @param probabilities the probability of each support point
     * @return the model
     */
    public static DiscreteScalarModel ofCounts(int[] values, double[] probabilities) {
        ParameterChecks.notNull("discrete values", values);
        return new DiscreteScalarModel(Arrays.stream(values).asDoubleStream().toArray(), probabilities);
    }

    @Override
    public void validate() {
        ParameterChecks.notNull("discrete values", values);
        ParameterChecks.notNull("discrete probabilities", probabilities);
        if (values.length == 0) {
            throw new InvalidParameterException("discrete distribution requires at least one value");
        }
        ParameterChecks.sameLength("discrete values", values.length, "probabilities", probabilities.length);

        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            ParameterChecks.finite("discrete value[" + i + "]", values[i]);
            if (i > 0 && !(values[i] > values[i - 1])) {
                throw new InvalidParameterException(
                    "discrete values must be strictly ascending, got " + values[i - 1]
                        + " then " + values[i] + " at index " + i);
            }
            double p = probabilities[i];
            if (!(p >= 0.0) || Double.isInfinite(p)) {
                throw new InvalidParameterException(
                    "probability[" + i + "] must be a non-negative finite number, got " + p);
            }
            sum += p;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidParameterException(
                "probabilities sum to " + sum + ", expected 1.0 ± 1e-6");
        }
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public double cdf(double x) {
        if (x >= values[values.length - 1]) {
            return 1.0;
        }
        double cumulative = 0.0;
        for (int i = 0; i < values.length && values[i] <= x; i++) {
            cumulative += probabilities[i];
        }
        return Math.min(1.0, cumulative);
    }

    /**
     * Returns the cumulative probabilities, one per value, with the last entry forced to 1.
     *
     * @return a new array of cumulative probabilities
     */
    public double[] cumulativeProbabilities() {
        double[] cumulative = new double[probabilities.length];
        double running = 0.0;
        for (int i = 0; i < probabilities.length; i++) {
            running += probabilities[i];
            cumulative[i] = running;
        }
        cumulative[cumulative.length - 1] = 1.0;
        return cumulative;
    }

    @Override
    public double getMean() {
        double mean = 0.0;
        for (int i = 0; i < values.length; i++) {
            mean += values[i] * probabilities[i];
        }
        return mean;
    }

    /**
     * Variance as E[X²] − E[X]².
     */
    @Override
    public double getVariance() {
        double mean = getMean();
        double secondMoment = 0.0;
        for (int i = 0; i < values.length; i++) {
            secondMoment += values[i] * values[i] * probabilities[i];
        }
        return secondMoment - mean * mean;
    }

    public double[] getValues() {
        return values.clone();
    }

    public double[] getProbabilities() {
        return probabilities.clone();
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscreteScalarModel)) return false;
        DiscreteScalarModel that = (DiscreteScalarModel) o;
        return Arrays.equals(values, that.values) && Arrays.equals(probabilities, that.probabilities);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Arrays.hashCode(probabilities);
    }

    @Override
    public String toString() {
        return "DiscreteScalarModel[values=" + Arrays.toString(values)
            + ", probabilities=" + Arrays.toString(probabilities) + "]";
    }
}
