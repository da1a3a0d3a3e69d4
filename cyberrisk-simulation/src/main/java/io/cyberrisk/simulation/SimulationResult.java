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

import java.util.Objects;

/**
 * Outcome of one loss-expectancy simulation. Immutable.
 *
 * <p>Sample statistics (means, probabilities, percentiles) come from the
 * simulated draws; closed-form counterparts are in {@link #getAnalyticSummary()}.
 * Percentile breakdowns are null when percentiles were disabled.
 */
public final class SimulationResult {

    @SerializedName("scenario_name")
    private final String scenarioName;

    @SerializedName("iterations")
    private final int iterations;

    @SerializedName("seed")
    private final long seed;

    @SerializedName("loss_model")
    private final LossModel lossModel;

    @SerializedName("annual_loss_expectancy")
    private final double annualLossExpectancy;

    @SerializedName("asset_value_mean")
    private final double assetValueMean;

    @SerializedName("asset_value_median")
    private final double assetValueMedian;

    @SerializedName("occurrence_mean")
    private final double occurrenceMean;

    @SerializedName("combined_loss_mean")
    private final double combinedLossMean;

    @SerializedName("combined_loss_variance")
    private final double combinedLossVariance;

    @SerializedName("probability_asset_value_at_most")
    private final double probabilityAssetValueAtMost;

    @SerializedName("probability_loss_at_least")
    private final double probabilityLossAtLeast;

    @SerializedName("probability_loss_within")
    private final double probabilityLossWithin;

    @SerializedName("asset_value_percentiles")
    private final PercentileBreakdown assetValuePercentiles;

    @SerializedName("annual_loss_percentiles")
    private final PercentileBreakdown annualLossPercentiles;

    @SerializedName("analytic_summary")
    private final AnalyticSummary analyticSummary;

    @SerializedName("risk_assessment")
    private final RiskAssessment riskAssessment;

    private SimulationResult(Builder builder) {
        this.scenarioName = builder.scenarioName;
        this.iterations = builder.iterations;
        this.seed = builder.seed;
        this.lossModel = builder.lossModel;
        this.annualLossExpectancy = builder.annualLossExpectancy;
        this.assetValueMean = builder.assetValueMean;
        this.assetValueMedian = builder.assetValueMedian;
        this.occurrenceMean = builder.occurrenceMean;
        this.combinedLossMean = builder.combinedLossMean;
        this.combinedLossVariance = builder.combinedLossVariance;
        this.probabilityAssetValueAtMost = builder.probabilityAssetValueAtMost;
        this.probabilityLossAtLeast = builder.probabilityLossAtLeast;
        this.probabilityLossWithin = builder.probabilityLossWithin;
        this.assetValuePercentiles = builder.assetValuePercentiles;
        this.annualLossPercentiles = builder.annualLossPercentiles;
        this.analyticSummary = builder.analyticSummary;
        this.riskAssessment = builder.riskAssessment;
    }

    static Builder builder() {
        return new Builder();
    }

    public String getScenarioName() {
        return scenarioName;
    }

    public int getIterations() {
        return iterations;
    }

    /** @return the seed the run's generator was created with */
    public long getSeed() {
        return seed;
    }

    public LossModel getLossModel() {
        return lossModel;
    }

    /** @return the headline annual loss expectancy under {@link #getLossModel()} */
    public double getAnnualLossExpectancy() {
        return annualLossExpectancy;
    }

    public double getAssetValueMean() {
        return assetValueMean;
    }

    public double getAssetValueMedian() {
        return assetValueMedian;
    }

    public double getOccurrenceMean() {
        return occurrenceMean;
    }

    public double getCombinedLossMean() {
        return combinedLossMean;
    }

    /** @return the population variance of the combined loss sample */
    public double getCombinedLossVariance() {
        return combinedLossVariance;
    }

    /** @return fraction of asset values ≤ the asset value threshold */
    public double getProbabilityAssetValueAtMost() {
        return probabilityAssetValueAtMost;
    }

    /** @return fraction of combined losses ≥ the exceedance threshold */
    public double getProbabilityLossAtLeast() {
        return probabilityLossAtLeast;
    }

    /** @return fraction of combined losses within the inclusive loss range */
    public double getProbabilityLossWithin() {
        return probabilityLossWithin;
    }

    public PercentileBreakdown getAssetValuePercentiles() {
        return assetValuePercentiles;
    }

    public PercentileBreakdown getAnnualLossPercentiles() {
        return annualLossPercentiles;
    }

    public AnalyticSummary getAnalyticSummary() {
        return analyticSummary;
    }

    public RiskAssessment getRiskAssessment() {
        return riskAssessment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationResult)) return false;
        SimulationResult that = (SimulationResult) o;
        return iterations == that.iterations
            && seed == that.seed
            && lossModel == that.lossModel
            && Double.compare(that.annualLossExpectancy, annualLossExpectancy) == 0
            && Double.compare(that.assetValueMean, assetValueMean) == 0
            && Double.compare(that.assetValueMedian, assetValueMedian) == 0
            && Double.compare(that.occurrenceMean, occurrenceMean) == 0
            && Double.compare(that.combinedLossMean, combinedLossMean) == 0
            && Double.compare(that.combinedLossVariance, combinedLossVariance) == 0
            && Double.compare(that.probabilityAssetValueAtMost, probabilityAssetValueAtMost) == 0
            && Double.compare(that.probabilityLossAtLeast, probabilityLossAtLeast) == 0
            && Double.compare(that.probabilityLossWithin, probabilityLossWithin) == 0
            && Objects.equals(scenarioName, that.scenarioName)
            && Objects.equals(assetValuePercentiles, that.assetValuePercentiles)
            && Objects.equals(annualLossPercentiles, that.annualLossPercentiles)
            && Objects.equals(analyticSummary, that.analyticSummary)
            && Objects.equals(riskAssessment, that.riskAssessment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scenarioName, iterations, seed, lossModel, annualLossExpectancy,
            assetValueMean, assetValueMedian, occurrenceMean, combinedLossMean, combinedLossVariance,
            probabilityAssetValueAtMost, probabilityLossAtLeast, probabilityLossWithin);
    }

    @Override
    public String toString() {
        return "SimulationResult{" +
            "scenarioName=" + scenarioName +
            ", iterations=" + iterations +
            ", seed=" + seed +
            ", lossModel=" + lossModel +
            ", annualLossExpectancy=" + annualLossExpectancy +
            ", assetValueMean=" + assetValueMean +
            ", assetValueMedian=" + assetValueMedian +
            ", occurrenceMean=" + occurrenceMean +
            ", combinedLossMean=" + combinedLossMean +
            ", combinedLossVariance=" + combinedLossVariance +
            ", probabilityAssetValueAtMost=" + probabilityAssetValueAtMost +
            ", probabilityLossAtLeast=" + probabilityLossAtLeast +
            ", probabilityLossWithin=" + probabilityLossWithin +
            ", assetValuePercentiles=" + assetValuePercentiles +
            ", annualLossPercentiles=" + annualLossPercentiles +
            ", riskAssessment=" + riskAssessment +
            '}';
    }

    static final class Builder {
        private String scenarioName;
        private int iterations;
        private long seed;
        private LossModel lossModel;
        private double annualLossExpectancy;
        private double assetValueMean;
        private double assetValueMedian;
        private double occurrenceMean;
        private double combinedLossMean;
        private double combinedLossVariance;
        private double probabilityAssetValueAtMost;
        private double probabilityLossAtLeast;
        private double probabilityLossWithin;
        private PercentileBreakdown assetValuePercentiles;
        private PercentileBreakdown annualLossPercentiles;
        private AnalyticSummary analyticSummary;
        private RiskAssessment riskAssessment;

        Builder scenario(String scenarioName, int iterations, long seed, LossModel lossModel) {
            this.scenarioName = scenarioName;
            this.iterations = iterations;
            this.seed = seed;
            this.lossModel = lossModel;
            return this;
        }

        Builder annualLossExpectancy(double ale) {
            this.annualLossExpectancy = ale;
            return this;
        }

        Builder assetValue(double mean, double median) {
            this.assetValueMean = mean;
            this.assetValueMedian = median;
            return this;
        }

        Builder occurrenceMean(double mean) {
            this.occurrenceMean = mean;
            return this;
        }

        Builder combinedLoss(double mean, double variance) {
            this.combinedLossMean = mean;
            this.combinedLossVariance = variance;
            return this;
        }

        Builder probabilities(double assetValueAtMost, double lossAtLeast, double lossWithin) {
            this.probabilityAssetValueAtMost = assetValueAtMost;
            this.probabilityLossAtLeast = lossAtLeast;
            this.probabilityLossWithin = lossWithin;
            return this;
        }

        Builder percentiles(PercentileBreakdown assetValue, PercentileBreakdown annualLoss) {
            this.assetValuePercentiles = assetValue;
            this.annualLossPercentiles = annualLoss;
            return this;
        }

        Builder analyticSummary(AnalyticSummary summary) {
            this.analyticSummary = summary;
            return this;
        }

        Builder riskAssessment(RiskAssessment assessment) {
            this.riskAssessment = assessment;
            return this;
        }

        SimulationResult build() {
            return new SimulationResult(this);
        }
    }
}
