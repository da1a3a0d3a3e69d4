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

import java.util.Objects;

/**
 * Triangular distribution over [min, max] with its peak at mode.
 *
 * <h2>Purpose</h2>
 *
 * <p>Models asset value when an analyst can state a minimum, a most likely
 * and a maximum value but little else.
 *
 * <h2>Properties</h2>
 *
 * <ul>
 *   <li><b>Mean</b>: (min + mode + max) / 3</li>
 *   <li><b>CDF</b>: (x − min)² / ((max − min)(mode − min)) on [min, mode],
 *       1 − (max − x)² / ((max − min)(max − mode)) on (mode, max]</li>
 *   <li><b>Median</b>: min + √((max − min)(mode − min)/2) when F(mode) ≥ ½,
 *       otherwise max − √((max − min)(max − mode)/2)</li>
 * </ul>
 *
 * <h2>Sampling</h2>
 *
 * <p>Inverse CDF: with F(mode) = (mode − min)/(max − min),
 * u &lt; F(mode) maps to min + √(u(max − min)(mode − min)),
 * otherwise to max − √((1 − u)(max − min)(max − mode)).
 *
 * @see io.cyberrisk.distributions.sampling.TriangularSampler
 */
@ModelType(TriangularScalarModel.MODEL_TYPE)
public final class TriangularScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "triangular";

    @SerializedName("min")
    private final double min;

    @SerializedName("mode")
    private final double mode;

    @SerializedName("max")
    private final double max;

    /**
     * @param min the lower bound
     * @param mode the most likely value, within [min, max]
     * @param max the upper bound, strictly greater than min
     * @throws InvalidParameterException unless min ≤ mode ≤ max and min &lt; max
     */
    public TriangularScalarModel(double min, double mode, double max) {
        this.min = min;
        this.mode = mode;
        this.max = max;
        validate();
    }

    @Override
    public void validate() {
        ParameterChecks.finite("triangular min", min);
        ParameterChecks.finite("triangular mode", mode);
        ParameterChecks.finite("triangular max", max);
        if (!(min <= mode && mode <= max)) {
            throw new InvalidParameterException(
                "triangular parameters require min <= mode <= max, got min=" + min
                    + ", mode=" + mode + ", max=" + max);
        }
        if (!(min < max)) {
            throw new InvalidParameterException(
                "triangular parameters require min < max, got min=" + min + ", max=" + max);
        }
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public double cdf(double x) {
        if (x <= min) {
            return 0.0;
        }
        if (x >= max) {
            return 1.0;
        }
        double range = max - min;
        if (x <= mode) {
            return ((x - min) * (x - min)) / (range * (mode - min));
        }
        return 1.0 - ((max - x) * (max - x)) / (range * (max - mode));
    }

    /**
     * Returns the value at cumulative probability u.
     *
     * @param u a probability in [0, 1]
     * @return the u-quantile
     */
    public double quantile(double u) {
        double range = max - min;
        double modeFraction = (mode - min) / range;
        if (u < modeFraction) {
            return min + Math.sqrt(u * range * (mode - min));
        }
        return max - Math.sqrt((1.0 - u) * range * (max - mode));
    }

    @Override
    public double getMean() {
        return (min + mode + max) / 3.0;
    }

    /**
     * @return the closed-form median
     */
    public double getMedian() {
        double range = max - min;
        double modeFraction = (mode - min) / range;
        if (modeFraction >= 0.5) {
            return min + Math.sqrt(0.5 * range * (mode - min));
        }
        return max - Math.sqrt(0.5 * range * (max - mode));
    }

    @Override
    public double getVariance() {
        return (min * min + mode * mode + max * max - min * mode - min * max - mode * max) / 18.0;
    }

    public double getMin() {
        return min;
    }

    public double getMode() {
        return mode;
    }

    public double getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TriangularScalarModel)) return false;
        TriangularScalarModel that = (TriangularScalarModel) o;
        return Double.compare(that.min, min) == 0
            && Double.compare(that.mode, mode) == 0
            && Double.compare(that.max, max) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, mode, max);
    }

    @Override
    public String toString() {
        return "TriangularScalarModel[min=" + min + ", mode=" + mode + ", max=" + max + "]";
    }
}
