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
 * Log-normal distribution: X = exp(μ + σZ) with Z ~ N(0, 1).
 *
 * <h2>Properties</h2>
 *
 * <ul>
 *   <li><b>Mean</b>: exp(μ + σ²/2)</li>
 *   <li><b>Median</b>: exp(μ)</li>
 *   <li><b>Variance</b>: (exp(σ²) − 1) · exp(2μ + σ²)</li>
 *   <li><b>CDF</b>: Φ((ln x − μ)/σ) for x &gt; 0</li>
 * </ul>
 *
 * @see io.cyberrisk.distributions.sampling.LogNormalBatchSampler
 */
@ModelType(LogNormalScalarModel.MODEL_TYPE)
public final class LogNormalScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "log_normal";

    @SerializedName("mu")
    private final double mu;

    @SerializedName("sigma")
    private final double sigma;

    /**
     * @param mu the mean of ln X
     * @param sigma the standard deviation of ln X; must be positive
     * @throws io.cyberrisk.api.InvalidParameterException if sigma ≤ 0 or either value is not finite
     */
    public LogNormalScalarModel(double mu, double sigma) {
        this.mu = mu;
        this.sigma = sigma;
        validate();
    }

    @Override
    public void validate() {
        ParameterChecks.finite("log-normal mu", mu);
        ParameterChecks.positive("log-normal sigma", sigma);
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public double cdf(double x) {
        if (x <= 0.0) {
            return 0.0;
        }
        return GaussianCDF.cdf(Math.log(x), mu, sigma);
    }

    @Override
    public double getMean() {
        return Math.exp(mu + 0.5 * sigma * sigma);
    }

    public double getMedian() {
        return Math.exp(mu);
    }

    @Override
    public double getVariance() {
        double s2 = sigma * sigma;
        return Math.expm1(s2) * Math.exp(2.0 * mu + s2);
    }

    public double getMu() {
        return mu;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogNormalScalarModel)) return false;
        LogNormalScalarModel that = (LogNormalScalarModel) o;
        return Double.compare(that.mu, mu) == 0 && Double.compare(that.sigma, sigma) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mu, sigma);
    }

    @Override
    public String toString() {
        return "LogNormalScalarModel[mu=" + mu + ", sigma=" + sigma + "]";
    }
}
