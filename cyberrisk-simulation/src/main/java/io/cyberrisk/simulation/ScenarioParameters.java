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

package io.cyberrisk.simulation;

import com.google.gson.annotations.SerializedName;
import io.cyberrisk.api.InvalidParameterException;
import io.cyberrisk.api.ParameterChecks;
import io.cyberrisk.distributions.model.DiscreteScalarModel;
import io.cyberrisk.distributions.model.LogNormalScalarModel;
import io.cyberrisk.distributions.model.ParetoScalarModel;
import io.cyberrisk.distributions.model.ScalarModel;
import io.cyberrisk.distributions.model.TriangularScalarModel;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Inputs of one loss-expectancy simulation.
 *
 * <h2>Components</h2>
 *
 * <ul>
 *   <li><b>asset value</b>: triangular(min, mode, max)</li>
 *   <li><b>occurrences</b>: discrete annual event counts</li>
 *   <li><b>primary loss</b>: log-normal(μ, σ), the first loss channel</li>
 *   <li><b>secondary loss</b>: Pareto(scale, shape), the second loss channel</li>
 *   <li><b>thresholds</b>: asset value threshold, exceedance threshold and an
 *       inclusive combined-loss range</li>
 *   <li><b>iterations</b> and an optional <b>seed</b></li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ScenarioParameters params = ScenarioParameters.builder()
 *     .scenarioName("ransomware on file servers")
 *     .assetValue(50_000, 150_000, 500_000)
 *     .occurrences(new int[]{0, 1, 2, 3, 4, 5}, new double[]{0.3, 0.4, 0.2, 0.06, 0.03, 0.01})
 *     .primaryLoss(9.2, 1.0)
 *     .secondaryLoss(5000, 2.5)
 *     .thresholds(100_000, 20_000, 10_000, 30_000)
 *     .iterations(50_000)
 *     .seed(42L)
 *     .build();
 * }</pre>
 *
 * <p>{@link Builder#build()} validates everything except the iteration upper
 * bound, which belongs to {@link SimulationOptions}.
 */
public final class ScenarioParameters {

    /** Iteration count used when the builder is not given one. */
    public static final int DEFAULT_ITERATIONS = 10_000;

    @SerializedName("scenario_name")
    private final String scenarioName;

    @SerializedName("asset_value")
    private final TriangularScalarModel assetValue;

    @SerializedName("occurrences")
    private final DiscreteScalarModel occurrences;

    @SerializedName("primary_loss")
    private final LogNormalScalarModel primaryLoss;

    @SerializedName("secondary_loss")
    private final ParetoScalarModel secondaryLoss;

    @SerializedName("asset_value_threshold")
    private final double assetValueThreshold;

    @SerializedName("exceedance_threshold")
    private final double exceedanceThreshold;

    @SerializedName("loss_range_lower")
    private final double lossRangeLower;

    @SerializedName("loss_range_upper")
    private final double lossRangeUpper;

    @SerializedName("iterations")
    private final int iterations;

    @SerializedName("seed")
    private final Long seed;

    private ScenarioParameters(Builder builder) {
        this.scenarioName = builder.scenarioName;
        this.assetValue = builder.assetValue;
        this.occurrences = builder.occurrences;
        this.primaryLoss = builder.primaryLoss;
        this.secondaryLoss = builder.secondaryLoss;
        this.assetValueThreshold = builder.assetValueThreshold;
        this.exceedanceThreshold = builder.exceedanceThreshold;
        this.lossRangeLower = builder.lossRangeLower;
        this.lossRangeUpper = builder.lossRangeUpper;
        this.iterations = builder.iterations;
        this.seed = builder.seed;
    }

    /**
     * Checks every invariant, including the iteration upper bound.
     *
     * @param maxIterations the largest accepted iteration count
     * @throws InvalidParameterException naming the first invariant that fails
     */
    public void validate(int maxIterations) {
        validateModel("asset value distribution", assetValue);
        validateModel("occurrence distribution", occurrences);
        validateModel("primary loss distribution", primaryLoss);
        validateModel("secondary loss distribution", secondaryLoss);
        if (assetValue.getMin() < 0.0) {
            throw new InvalidParameterException(
                "asset value distribution: minimum must be >= 0, got " + assetValue.getMin());
        }
        double[] counts = occurrences.getValues();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] < 0.0 || counts[i] != Math.rint(counts[i])) {
                throw new InvalidParameterException(
                    "occurrence distribution: value[" + i + "] must be a non-negative whole count, got " + counts[i]);
            }
        }

        ParameterChecks.finite("asset value threshold", assetValueThreshold);
        ParameterChecks.finite("exceedance threshold", exceedanceThreshold);
        ParameterChecks.finite("loss range lower bound", lossRangeLower);
        ParameterChecks.finite("loss range upper bound", lossRangeUpper);
        if (lossRangeLower > lossRangeUpper) {
            throw new InvalidParameterException(
                "loss range lower bound " + lossRangeLower + " exceeds upper bound " + lossRangeUpper);
        }

        if (iterations < 1) {
            throw new InvalidParameterException("iterations must be >= 1, got " + iterations);
        }
        if (iterations > maxIterations) {
            throw new InvalidParameterException(
                "iterations " + iterations + " exceeds the configured maximum of " + maxIterations);
        }
    }

    private static void validateModel(String role, ScalarModel model) {
        if (model == null) {
            throw new InvalidParameterException(role + " is required");
        }
        try {
            model.validate();
        } catch (InvalidParameterException e) {
            throw new InvalidParameterException(role + ": " + e.getMessage(), e);
        }
    }

    public String getScenarioName() {
        return scenarioName;
    }

    public TriangularScalarModel getAssetValue() {
        return assetValue;
    }

    public DiscreteScalarModel getOccurrences() {
        return occurrences;
    }

    public LogNormalScalarModel getPrimaryLoss() {
        return primaryLoss;
    }

    public ParetoScalarModel getSecondaryLoss() {
        return secondaryLoss;
    }

    /** @return threshold for P(asset value ≤ threshold) */
    public double getAssetValueThreshold() {
        return assetValueThreshold;
    }

    /** @return threshold for P(combined loss ≥ threshold) */
    public double getExceedanceThreshold() {
        return exceedanceThreshold;
    }

    public double getLossRangeLower() {
        return lossRangeLower;
    }

    public double getLossRangeUpper() {
        return lossRangeUpper;
    }

    public int getIterations() {
        return iterations;
    }

    /** @return the seed, or null when each run should draw a fresh one */
    public Long getSeed() {
        return seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .scenarioName(scenarioName)
            .assetValue(assetValue)
            .occurrences(occurrences)
            .primaryLoss(primaryLoss)
            .secondaryLoss(secondaryLoss)
            .thresholds(assetValueThreshold, exceedanceThreshold, lossRangeLower, lossRangeUpper)
            .iterations(iterations);
        builder.seed = seed;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScenarioParameters)) return false;
        ScenarioParameters that = (ScenarioParameters) o;
        return Double.compare(that.assetValueThreshold, assetValueThreshold) == 0
            && Double.compare(that.exceedanceThreshold, exceedanceThreshold) == 0
            && Double.compare(that.lossRangeLower, lossRangeLower) == 0
            && Double.compare(that.lossRangeUpper, lossRangeUpper) == 0
            && iterations == that.iterations
            && Objects.equals(scenarioName, that.scenarioName)
            && Objects.equals(assetValue, that.assetValue)
            && Objects.equals(occurrences, that.occurrences)
            && Objects.equals(primaryLoss, that.primaryLoss)
            && Objects.equals(secondaryLoss, that.secondaryLoss)
            && Objects.equals(seed, that.seed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scenarioName, assetValue, occurrences, primaryLoss, secondaryLoss,
            assetValueThreshold, exceedanceThreshold, lossRangeLower, lossRangeUpper, iterations, seed);
    }

    @Override
    public String toString() {
        return "ScenarioParameters{" +
            "scenarioName=" + scenarioName +
            ", assetValue=" + assetValue +
            ", occurrences=" + occurrences +
            ", primaryLoss=" + primaryLoss +
            ", secondaryLoss=" + secondaryLoss +
            ", thresholds=[" + assetValueThreshold + ", " + exceedanceThreshold +
            ", " + lossRangeLower + ", " + lossRangeUpper + "]" +
            ", iterations=" + iterations +
            ", seed=" + seed +
            '}';
    }

    /**
     * Builder for ScenarioParameters. Distribution shortcuts construct the
     * model immediately and report failures prefixed with the model's role.
     */
    public static final class Builder {
        private String scenarioName;
        private TriangularScalarModel assetValue;
        private DiscreteScalarModel occurrences;
        private LogNormalScalarModel primaryLoss;
        private ParetoScalarModel secondaryLoss;
        private double assetValueThreshold = Double.NaN;
        private double exceedanceThreshold = Double.NaN;
        private double lossRangeLower = Double.NaN;
        private double lossRangeUpper = Double.NaN;
        private int iterations = DEFAULT_ITERATIONS;
        private Long seed;

        Builder() {
        }

        public Builder scenarioName(String scenarioName) {
            this.scenarioName = scenarioName;
            return this;
        }

        public Builder assetValue(TriangularScalarModel model) {
            this.assetValue = model;
            return this;
        }

        public Builder assetValue(double min, double mode, double max) {
            return assetValue(construct("asset value distribution",
                () -> new TriangularScalarModel(min, mode, max)));
        }

        public Builder occurrences(DiscreteScalarModel model) {
            this.occurrences = model;
            return this;
        }

        public Builder occurrences(int[] counts, double[] probabilities) {
            return occurrences(construct("occurrence distribution",
                () -> DiscreteScalarModel.ofCounts(counts, probabilities)));
        }

        public Builder primaryLoss(LogNormalScalarModel model) {
            this.primaryLoss = model;
            return this;
        }

        public Builder primaryLoss(double mu, double sigma) {
            return primaryLoss(construct("primary loss distribution",
                () -> new LogNormalScalarModel(mu, sigma)));
        }

        public Builder secondaryLoss(ParetoScalarModel model) {
            this.secondaryLoss = model;
            return this;
        }

        public Builder secondaryLoss(double scale, double shape) {
            return secondaryLoss(construct("secondary loss distribution",
                () -> new ParetoScalarModel(scale, shape)));
        }

        /**
         * Sets all four probability thresholds.
         *
         * @param assetValueThreshold threshold for P(asset value ≤ t)
         * @param exceedanceThreshold threshold for P(combined loss ≥ t)
         * @param lossRangeLower inclusive lower bound of the combined-loss range
         * @param lossRangeUpper inclusive upper bound of the combined-loss range
         * @return this builder
         */
        public Builder thresholds(double assetValueThreshold, double exceedanceThreshold,
                                  double lossRangeLower, double lossRangeUpper) {
            this.assetValueThreshold = assetValueThreshold;
            this.exceedanceThreshold = exceedanceThreshold;
            this.lossRangeLower = lossRangeLower;
            this.lossRangeUpper = lossRangeUpper;
            return this;
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /** Clears the seed so each run draws a fresh one. */
        public Builder unseeded() {
            this.seed = null;
            return this;
        }

        /**
         * @return the validated parameters
         * @throws InvalidParameterException if any invariant fails
         */
        public ScenarioParameters build() {
            ScenarioParameters params = new ScenarioParameters(this);
            params.validate(Integer.MAX_VALUE);
            return params;
        }

        private static <M extends ScalarModel> M construct(String role, Supplier<M> factory) {
            try {
                return factory.get();
            } catch (InvalidParameterException e) {
                throw new InvalidParameterException(role + ": " + e.getMessage(), e);
            }
        }
    }
}
