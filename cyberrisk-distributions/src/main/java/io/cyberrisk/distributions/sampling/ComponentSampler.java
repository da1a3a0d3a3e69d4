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

/// Inverse-CDF sampler bound to one distribution's parameters.
///
/// Parameters are copied out of the model at construction, so the hot path
/// is a pure function of the uniform input.
///
/// ```text
///   u ∈ [0, 1)  ──►  ComponentSampler  ──►  F⁻¹(u)
/// ```
///
/// @see BatchSamplerFactory
@FunctionalInterface
public interface ComponentSampler {

    /// Maps a uniform value to the corresponding quantile.
    ///
    /// @param u a value in the half-open interval [0, 1)
    /// @return a sample from the distribution
    double sample(double u);
}
