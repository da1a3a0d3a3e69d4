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
import io.cyberrisk.distributions.sampling.RandomGenerators;

import java.util.Arrays;

/// Configuration options for [LossExpectancySimulator].
///
/// # Usage
///
/// ```java
/// SimulationOptions options = SimulationOptions.builder()
///     .percentileLevels(50, 90, 99)
///     .lossModel(LossModel.EXPOSURE_FACTOR)
///     .maxIterations(1_000_000)
///     .build();
/// ```
public final class SimulationOptions {

    /// Default percentile levels: P50, P75, P90, P95, P99.
    public static final double[] DEFAULT_PERCENTILES = {50, 75, 90, 95, 99};

    /// Default upper bound on iterations per run.
    public static final int DEFAULT_MAX_ITERATIONS = 10_000_000;

    private final RandomGenerators.Algorithm algorithm;
    private final double[] percentileLevels;
    private final boolean computePercentiles;
    private final LossModel lossModel;
    private final int maxIterations;
    private final RiskBands riskBands;

    private SimulationOptions(Builder builder) {
        this.algorithm = builder.algorithm;
        this.percentileLevels = builder.percentileLevels.clone();
        this.computePercentiles = builder.computePercentiles;
        this.lossModel = builder.lossModel;
        this.maxIterations = builder.maxIterations;
        this.riskBands = builder.riskBands;
    }

    /// @return the PRNG algorithm each run constructs its generator with
    public RandomGenerators.Algorithm algorithm() {
        return algorithm;
    }

    /// @return the percentile levels in (0, 100], ascending
    public double[] percentileLevels() {
        return percentileLevels.clone();
    }

    /// Returns whether percentile breakdowns are computed.
    ///
    /// Percentiles sort a copy of two n-length samples, which dominates the
    /// aggregation cost at high iteration counts.
    ///
    /// @return true if percentiles are computed
    public boolean computePercentiles() {
        return computePercentiles;
    }

    public LossModel lossModel() {
        return lossModel;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public RiskBands riskBands() {
        return riskBands;
    }

    /// Defaults:
    /// - algorithm: XO_SHI_RO_256_PP
    /// - percentiles: P50, P75, P90, P95, P99 (enabled)
    /// - loss model: MULTIPLICATIVE
    /// - max iterations: 10,000,000
    /// - risk bands: [RiskBands#defaults()]
    ///
    /// @return the default options
    public static SimulationOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .algorithm(algorithm)
            .percentileLevels(percentileLevels)
            .computePercentiles(computePercentiles)
            .lossModel(lossModel)
            .maxIterations(maxIterations)
            .riskBands(riskBands);
    }

    @Override
    public String toString() {
        return "SimulationOptions{" +
            "algorithm=" + algorithm +
            ", percentileLevels=" + Arrays.toString(percentileLevels) +
            ", computePercentiles=" + computePercentiles +
            ", lossModel=" + lossModel +
            ", maxIterations=" + maxIterations +
            ", riskBands=" + riskBands +
            '}';
    }

    /// Builder for SimulationOptions.
    public static final class Builder {
        private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;
        private double[] percentileLevels = DEFAULT_PERCENTILES.clone();
        private boolean computePercentiles = true;
        private LossModel lossModel = LossModel.MULTIPLICATIVE;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private RiskBands riskBands = RiskBands.defaults();

        Builder() {
        }

        public Builder algorithm(RandomGenerators.Algorithm algorithm) {
            this.algorithm = ParameterChecks.notNull("algorithm", algorithm);
            return this;
        }

        /// Sets the percentile levels.
        ///
        /// @param levels strictly ascending values in (0, 100]
        /// @return this builder
        /// @throws InvalidParameterException if the levels are empty, out of range or unordered
        public Builder percentileLevels(double... levels) {
            ParameterChecks.notNull("percentile levels", levels);
            if (levels.length == 0) {
                throw new InvalidParameterException("at least one percentile level is required");
            }
            for (int i = 0; i < levels.length; i++) {
                if (!(levels[i] > 0.0 && levels[i] <= 100.0)) {
                    throw new InvalidParameterException(
                        "percentile level must lie in (0, 100], got " + levels[i]);
                }
                if (i > 0 && !(levels[i] > levels[i - 1])) {
                    throw new InvalidParameterException(
                        "percentile levels must be strictly ascending: " + Arrays.toString(levels));
                }
            }
            this.percentileLevels = levels.clone();
            return this;
        }

        public Builder computePercentiles(boolean enabled) {
            this.computePercentiles = enabled;
            return this;
        }

        public Builder lossModel(LossModel lossModel) {
            this.lossModel = ParameterChecks.notNull("loss model", lossModel);
            return this;
        }

        /// @param max the largest iteration count a run accepts; must be positive
        /// @return this builder
        public Builder maxIterations(int max) {
            if (max < 1) {
                throw new InvalidParameterException("max iterations must be >= 1, got " + max);
            }
            this.maxIterations = max;
            return this;
        }

        public Builder riskBands(RiskBands riskBands) {
            this.riskBands = ParameterChecks.notNull("risk bands", riskBands);
            return this;
        }

        public SimulationOptions build() {
            return new SimulationOptions(this);
        }
    }
}
