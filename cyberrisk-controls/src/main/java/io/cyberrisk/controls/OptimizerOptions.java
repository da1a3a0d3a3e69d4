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

package io.cyberrisk.controls;

import io.cyberrisk.api.InvalidParameterException;

/// Configuration options for [ControlOptimizer] and [BudgetAllocator].
///
/// The tolerances are those of commons-math's `SimplexSolver`.
public final class OptimizerOptions {

    public static final int DEFAULT_MAX_ITERATIONS = 10_000;
    public static final double DEFAULT_EPSILON = 1e-6;
    public static final int DEFAULT_MAX_ULPS = 10;
    public static final double DEFAULT_CUT_OFF = 1e-10;

    private final int maxIterations;
    private final double epsilon;
    private final int maxUlps;
    private final double cutOff;
    private final RegressionOptions regressionOptions;

    private OptimizerOptions(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.epsilon = builder.epsilon;
        this.maxUlps = builder.maxUlps;
        this.cutOff = builder.cutOff;
        this.regressionOptions = builder.regressionOptions;
    }

    public int maxIterations() {
        return maxIterations;
    }

    /// Tolerance for comparing the objective row against zero.
    public double epsilon() {
        return epsilon;
    }

    public int maxUlps() {
        return maxUlps;
    }

    /// Tableau entries smaller than this are treated as zero.
    public double cutOff() {
        return cutOff;
    }

    /// Options for the fit run by [ControlOptimizer#optimize(ControlDeploymentMatrix, OptimizationSpec)].
    public RegressionOptions regressionOptions() {
        return regressionOptions;
    }

    public static OptimizerOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxIterations(maxIterations)
            .epsilon(epsilon)
            .maxUlps(maxUlps)
            .cutOff(cutOff)
            .regressionOptions(regressionOptions);
    }

    @Override
    public String toString() {
        return "OptimizerOptions{" +
            "maxIterations=" + maxIterations +
            ", epsilon=" + epsilon +
            ", maxUlps=" + maxUlps +
            ", cutOff=" + cutOff +
            ", regressionOptions=" + regressionOptions +
            '}';
    }

    /// Builder for OptimizerOptions.
    public static final class Builder {
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double epsilon = DEFAULT_EPSILON;
        private int maxUlps = DEFAULT_MAX_ULPS;
        private double cutOff = DEFAULT_CUT_OFF;
        private RegressionOptions regressionOptions = RegressionOptions.defaults();

        Builder() {
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new InvalidParameterException("max iterations must be >= 1, got " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = requirePositive("epsilon", epsilon);
            return this;
        }

        public Builder maxUlps(int maxUlps) {
            if (maxUlps < 0) {
                throw new InvalidParameterException("max ulps must be >= 0, got " + maxUlps);
            }
            this.maxUlps = maxUlps;
            return this;
        }

        public Builder cutOff(double cutOff) {
            this.cutOff = requirePositive("cut-off", cutOff);
            return this;
        }

        public Builder regressionOptions(RegressionOptions regressionOptions) {
            if (regressionOptions == null) {
                throw new InvalidParameterException("regression options are required");
            }
            this.regressionOptions = regressionOptions;
            return this;
        }

        private static double requirePositive(String name, double value) {
            if (!(value > 0.0) || Double.isInfinite(value)) {
                throw new InvalidParameterException(name + " must be > 0 and finite, got " + value);
            }
            return value;
        }

        public OptimizerOptions build() {
            return new OptimizerOptions(this);
        }
    }
}
