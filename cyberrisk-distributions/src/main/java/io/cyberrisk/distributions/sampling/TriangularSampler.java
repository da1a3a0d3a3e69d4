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

package io.cyberrisk.distributions.sampling;

import io.cyberrisk.distributions.model.TriangularScalarModel;

/// Sampler for triangular distributions, bound at construction.
public final class TriangularSampler implements ComponentSampler {

    private final double min;
    private final double max;
    private final double modeFraction;
    private final double lowerSpan;
    private final double upperSpan;

    /// @param model the triangular model
    public TriangularSampler(TriangularScalarModel model) {
        this.min = model.getMin();
        this.max = model.getMax();
        double range = max - min;
        this.modeFraction = (model.getMode() - min) / range;
        this.lowerSpan = range * (model.getMode() - min);
        this.upperSpan = range * (max - model.getMode());
    }

    @Override
    public double sample(double u) {
        if (u < modeFraction) {
            return min + Math.sqrt(u * lowerSpan);
        }
        return max - Math.sqrt((1.0 - u) * upperSpan);
    }
}
