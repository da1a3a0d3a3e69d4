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

import io.cyberrisk.distributions.model.ParetoScalarModel;

/// Sampler for Pareto distributions: scale / (1 − u)^(1/shape).
///
/// With u ∈ [0, 1) the result is finite and never below the scale.
public final class ParetoSampler implements ComponentSampler {

    private final double scale;
    private final double inverseShape;

    /// @param model the Pareto model
    public ParetoSampler(ParetoScalarModel model) {
        this.scale = model.getScale();
        this.inverseShape = 1.0 / model.getShape();
    }

    @Override
    public double sample(double u) {
        return scale / Math.pow(1.0 - u, inverseShape);
    }
}
