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

/// Draws a batch of independent samples from a distribution bound to one
/// random generator.
///
/// Two batch samplers sharing a generator interleave their draws, so the
/// order in which a caller asks for batches is part of its reproducibility
/// contract.
public interface BatchSampler {

    /// Draws `n` independent samples.
    ///
    /// @param n the number of samples; zero yields an empty array
    /// @return a new array of length n
    /// @throws io.cyberrisk.api.InvalidParameterException if n is negative
    double[] sample(int n);
}
