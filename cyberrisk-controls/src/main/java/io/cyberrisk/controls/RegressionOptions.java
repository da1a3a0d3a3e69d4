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

/// Configuration options for [ControlEffectivenessModel].
///
/// # Usage
///
/// ```java
/// RegressionOptions options = RegressionOptions.builder()
///     .includeIntercept(true)
///     .build();
/// ```
public final class RegressionOptions {

    /// Default QR singularity threshold.
    public static final double DEFAULT_SINGULARITY_THRESHOLD = 1e-10;

    private final boolean includeIntercept;
    private final double singularityThreshold;

    private RegressionOptions(Builder builder) {
        this.includeIntercept = builder.includeIntercept;
        this.singularityThreshold = builder.singularityThreshold;
    }

    /// Whether each fit carries an intercept term. Off by default.
    public boolean includeIntercept() {
        return includeIntercept;
    }

    /// R-diagonal magnitude at or below which the design is treated as singular.
    public double singularityThreshold() {
        return singularityThreshold;
    }

    public static RegressionOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .includeIntercept(includeIntercept)
            .singularityThreshold(singularityThreshold);
    }

    @Override
    public String toString() {
        return "RegressionOptions{" +
            "includeIntercept=" + includeIntercept +
            ", singularityThreshold=" + singularityThreshold +
            '}';
    }

    /// Builder for RegressionOptions.
    public static final class Builder {
        private boolean includeIntercept = false;
        private double singularityThreshold = DEFAULT_SINGULARITY_THRESHOLD;

        Builder() {
        }

        public Builder includeIntercept(boolean includeIntercept) {
            this.includeIntercept = includeIntercept;
            return this;
        }

        public Builder singularityThreshold(double threshold) {
            if (!(threshold > 0.0) || Double.isInfinite(threshold)) {
                throw new InvalidParameterException(
                    "singularity threshold must be > 0 and finite, got " + threshold);
            }
            this.singularityThreshold = threshold;
            return this;
        }

        public RegressionOptions build() {
            return new RegressionOptions(this);
        }
    }
}
