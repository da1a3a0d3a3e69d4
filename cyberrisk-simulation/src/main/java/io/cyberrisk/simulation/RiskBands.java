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

import io.cyberrisk.api.InvalidParameterException;
import io.cyberrisk.api.ParameterChecks;

/// Loss thresholds used to classify a scenario.
///
/// ```text
///   ALE:   0 ──── low ──── medium ──── high ────► ∞
///          │ LOW  │ MEDIUM  │   HIGH   │ CRITICAL
/// ```
///
/// A band's upper bound is exclusive: an ALE equal to `low` is MEDIUM.
///
/// # Usage
///
/// ```java
/// RiskBands bands = RiskBands.defaults().toBuilder()
///     .toleranceLimit(250_000)
///     .build();
/// RiskAssessment assessment = bands.assess(ale, exceedanceProbability);
/// ```
public final class RiskBands {

    private final double low;
    private final double medium;
    private final double high;
    private final double toleranceLimit;
    private final double materialityLimit;
    private final double significantImpactProbability;

    private RiskBands(Builder builder) {
        this.low = builder.low;
        this.medium = builder.medium;
        this.high = builder.high;
        this.toleranceLimit = builder.toleranceLimit;
        this.materialityLimit = builder.materialityLimit;
        this.significantImpactProbability = builder.significantImpactProbability;
    }

    /// Classifies an annual loss expectancy and an exceedance probability.
    ///
    /// @param annualLossExpectancy the headline ALE
    /// @param exceedanceProbability P(combined loss ≥ exceedance threshold)
    /// @return the assessment
    public RiskAssessment assess(double annualLossExpectancy, double exceedanceProbability) {
        RiskLevel level;
        if (annualLossExpectancy < low) {
            level = RiskLevel.LOW;
        } else if (annualLossExpectancy < medium) {
            level = RiskLevel.MEDIUM;
        } else if (annualLossExpectancy < high) {
            level = RiskLevel.HIGH;
        } else {
            level = RiskLevel.CRITICAL;
        }
        return new RiskAssessment(level,
            annualLossExpectancy > toleranceLimit,
            annualLossExpectancy > materialityLimit,
            exceedanceProbability > significantImpactProbability);
    }

    public double low() {
        return low;
    }

    public double medium() {
        return medium;
    }

    public double high() {
        return high;
    }

    public double toleranceLimit() {
        return toleranceLimit;
    }

    public double materialityLimit() {
        return materialityLimit;
    }

    public double significantImpactProbability() {
        return significantImpactProbability;
    }

    /// Defaults: bands at 10,000 / 100,000 / 1,000,000, tolerance 500,000,
    /// materiality 100,000, significant impact above probability 0.1.
    ///
    /// @return the default bands
    public static RiskBands defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .levels(low, medium, high)
            .toleranceLimit(toleranceLimit)
            .materialityLimit(materialityLimit)
            .significantImpactProbability(significantImpactProbability);
    }

    @Override
    public String toString() {
        return "RiskBands{" +
            "low=" + low +
            ", medium=" + medium +
            ", high=" + high +
            ", toleranceLimit=" + toleranceLimit +
            ", materialityLimit=" + materialityLimit +
            ", significantImpactProbability=" + significantImpactProbability +
            '}';
    }

    /// Builder for RiskBands.
    public static final class Builder {
        private double low = 10_000;
        private double medium = 100_000;
        private double high = 1_000_000;
        private double toleranceLimit = 500_000;
        private double materialityLimit = 100_000;
        private double significantImpactProbability = 0.1;

        Builder() {
        }

        /// Sets the three band boundaries.
        ///
        /// @throws InvalidParameterException unless 0 ≤ low ≤ medium ≤ high, all finite
        public Builder levels(double low, double medium, double high) {
            ParameterChecks.nonNegative("low band", low);
            ParameterChecks.finite("medium band", medium);
            ParameterChecks.finite("high band", high);
            if (!(low <= medium && medium <= high)) {
                throw new InvalidParameterException(
                    "risk bands must be ordered low <= medium <= high, got " + low + ", " + medium + ", " + high);
            }
            this.low = low;
            this.medium = medium;
            this.high = high;
            return this;
        }

        public Builder toleranceLimit(double limit) {
            this.toleranceLimit = ParameterChecks.nonNegative("tolerance limit", limit);
            return this;
        }

        public Builder materialityLimit(double limit) {
            this.materialityLimit = ParameterChecks.nonNegative("materiality limit", limit);
            return this;
        }

        public Builder significantImpactProbability(double probability) {
            this.significantImpactProbability =
                ParameterChecks.probability("significant impact probability", probability);
            return this;
        }

        public RiskBands build() {
            return new RiskBands(this);
        }
    }
}
