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
 * Closed-form reference values reported next to the simulated ones.
 *
 * <p>The expected annual loss assumes the four inputs are independent:
 * E[AV] · E[count] · (E[A] + E[B]). It is +∞ when the Pareto mean does not
 * exist (shape ≤ 1).
 *
 * <p>The classical annual loss is the single-loss-expectancy form
 * E[count] · median(AV) · P(combined ≥ exceedance threshold), which uses the
 * simulated exceedance probability.
 */
public final class AnalyticSummary {

    @SerializedName("asset_value_mean")
    private final double assetValueMean;

    @SerializedName("asset_value_median")
    private final double assetValueMedian;

    @SerializedName("asset_value_cdf_at_threshold")
    private final double assetValueCdfAtThreshold;

    @SerializedName("occurrence_mean")
    private final double occurrenceMean;

    @SerializedName("occurrence_variance")
    private final double occurrenceVariance;

    @SerializedName("primary_loss_mean")
    private final double primaryLossMean;

    @SerializedName("secondary_loss_mean")
    private final double secondaryLossMean;

    @SerializedName("expected_annual_loss")
    private final double expectedAnnualLoss;

    @SerializedName("classical_annual_loss")
    private final double classicalAnnualLoss;

    AnalyticSummary(double assetValueMean, double assetValueMedian, double assetValueCdfAtThreshold,
                    double occurrenceMean, double occurrenceVariance, double primaryLossMean,
                    double secondaryLossMean, double expectedAnnualLoss, double classicalAnnualLoss) {
        this.assetValueMean = assetValueMean;
        this.assetValueMedian = assetValueMedian;
        this.assetValueCdfAtThreshold = assetValueCdfAtThreshold;
        this.occurrenceMean = occurrenceMean;
        this.occurrenceVariance = occurrenceVariance;
        this.primaryLossMean = primaryLossMean;
        this.secondaryLossMean = secondaryLossMean;
        this.expectedAnnualLoss = expectedAnnualLoss;
        this.classicalAnnualLoss = classicalAnnualLoss;
    }

    /**
     * Computes the summary for a scenario.
     *
     * @param params the validated scenario
     * @param exceedanceProbability the simulated P(combined ≥ exceedance threshold)
     * @return the summary
     */
    public static AnalyticSummary of(ScenarioParameters params, double exceedanceProbability) {
        double avMean = params.getAssetValue().getMean();
        double avMedian = params.getAssetValue().getMedian();
        double countMean = params.getOccurrences().getMean();
        double primaryMean = params.getPrimaryLoss().getMean();
        double secondaryMean = params.getSecondaryLoss().getMean();
        return new AnalyticSummary(
            avMean,
            avMedian,
            params.getAssetValue().cdf(params.getAssetValueThreshold()),
            countMean,
            params.getOccurrences().getVariance(),
            primaryMean,
            secondaryMean,
            avMean * countMean * (primaryMean + secondaryMean),
            countMean * avMedian * exceedanceProbability);
    }

    public double getAssetValueMean() {
        return assetValueMean;
    }

    public double getAssetValueMedian() {
        return assetValueMedian;
    }

    /** @return the triangular CDF at the asset value threshold */
    public double getAssetValueCdfAtThreshold() {
        return assetValueCdfAtThreshold;
    }

    public double getOccurrenceMean() {
        return occurrenceMean;
    }

    public double getOccurrenceVariance() {
        return occurrenceVariance;
    }

    public double getPrimaryLossMean() {
        return primaryLossMean;
    }

    public double getSecondaryLossMean() {
        return secondaryLossMean;
    }

    public double getExpectedAnnualLoss() {
        return expectedAnnualLoss;
    }

    public double getClassicalAnnualLoss() {
        return classicalAnnualLoss;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalyticSummary)) return false;
        AnalyticSummary that = (AnalyticSummary) o;
        return Double.compare(that.assetValueMean, assetValueMean) == 0
            && Double.compare(that.assetValueMedian, assetValueMedian) == 0
            && Double.compare(that.assetValueCdfAtThreshold, assetValueCdfAtThreshold) == 0
            && Double.compare(that.occurrenceMean, occurrenceMean) == 0
            && Double.compare(that.occurrenceVariance, occurrenceVariance) == 0
            && Double.compare(that.primaryLossMean, primaryLossMean) == 0
            && Double.compare(that.secondaryLossMean, secondaryLossMean) == 0
            && Double.compare(that.expectedAnnualLoss, expectedAnnualLoss) == 0
            && Double.compare(that.classicalAnnualLoss, classicalAnnualLoss) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(assetValueMean, assetValueMedian, assetValueCdfAtThreshold, occurrenceMean,
            occurrenceVariance, primaryLossMean, secondaryLossMean, expectedAnnualLoss, classicalAnnualLoss);
    }

    @Override
    public String toString() {
        return "AnalyticSummary{" +
            "assetValueMean=" + assetValueMean +
            ", assetValueMedian=" + assetValueMedian +
            ", assetValueCdfAtThreshold=" + assetValueCdfAtThreshold +
            ", occurrenceMean=" + occurrenceMean +
            ", occurrenceVariance=" + occurrenceVariance +
            ", primaryLossMean=" + primaryLossMean +
            ", secondaryLossMean=" + secondaryLossMean +
            ", expectedAnnualLoss=" + expectedAnnualLoss +
            ", classicalAnnualLoss=" + classicalAnnualLoss +
            '}';
    }
}
