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
import io.cyberrisk.api.ParameterChecks;

import java.util.Objects;

/**
 * Pareto (type I) distribution with support [scale, ∞).
 *
 * <h2>Purpose</h2>
 *
 * <p>Heavy-tailed loss magnitude, e.g. regulatory fines: most events sit
 * near the scale, a few are far larger.
 *
 * <h2>Properties</h2>
 *
 * <ul>
 *   <li><b>CDF</b>: 1 − (scale/x)^shape for x ≥ scale</li>
 *   <li><b>Quantile</b>: scale / (1 − u)^(1/shape)</li>
 *   <li><b>Mean</b>: shape·scale/(shape − 1) for shape &gt; 1, otherwise +∞</li>
 *   <li><b>Variance</b>: scale²·shape/((shape − 1)²(shape − 2)) for shape &gt; 2, otherwise +∞</li>
 * </ul>
 *
 * @see io.cyberrisk.distributions.sampling.ParetoSampler
 */
@ModelType(ParetoScalarModel.MODEL_TYPE)
public final class ParetoScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "pareto";

    @SerializedName("scale")
    private final double scale;

    @SerializedName("shape")
    private final double shape;

    /**
     * @param scale the minimum value x_m; must be positive
     * @param shape the tail index α; must be positive
     * @throws io.cyberrisk.api.InvalidParameterException if scale ≤ 0 or shape ≤ 0
     */
    public ParetoScalarModel(double scale, double shape) {
        this.scale = scale;
        this.shape = shape;
        validate();
    }

    @Override
    public void validate() {
        ParameterChecks.positive("pareto scale", scale);
        ParameterChecks.positive("pareto shape", shape);
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public double cdf(double x) {
        if (x <= scale) {
            return 0.0;
        }
        return 1.0 - Math.pow(scale / x, shape);
    }

    /**
     * @param u a probability in [0, 1)
     * @return the u-quantile, never below scale
     */
    public double quantile(double u) {
        return scale / Math.pow(1.0 - u, 1.0 / shape);
    }

    @Override
    public double getMean() {
        if (shape <= 1.0) {
            return Double.POSITIVE_INFINITY;
        }
        return shape * scale / (shape - 1.0);
    }

    @Override
    public double getVariance() {
        if (shape <= 2.0) {
            return Double.POSITIVE_INFINITY;
        }
        double shapeLess1 = shape - 1.0;
        return scale * scale * shape / (shapeLess1 * shapeLess1 * (shape - 2.0));
    }

    public double getScale() {
        return scale;
    }

    public double getShape() {
        return shape;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParetoScalarModel)) return false;
        ParetoScalarModel that = (ParetoScalarModel) o;
        return Double.compare(that.scale, scale) == 0 && Double.compare(that.shape, shape) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(scale, shape);
    }

    @Override
    public String toString() {
        return "ParetoScalarModel[scale=" + scale + ", shape=" + shape + "]";
    }
}
