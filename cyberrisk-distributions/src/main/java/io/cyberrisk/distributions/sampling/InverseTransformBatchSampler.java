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

import io.cyberrisk.api.ParameterChecks;
import org.apache.commons.rng.UniformRandomProvider;

/// Batch sampler that feeds uniform draws through a [ComponentSampler].
///
/// Each sample consumes exactly one `nextDouble()` from the generator.
public final class InverseTransformBatchSampler implements BatchSampler {

    private final ComponentSampler sampler;
    private final UniformRandomProvider rng;

    /// @param sampler the bound inverse-CDF sampler
    /// @param rng the generator supplying uniform values in [0, 1)
    public InverseTransformBatchSampler(ComponentSampler sampler, UniformRandomProvider rng) {
        this.sampler = sampler;
        this.rng = rng;
    }

    @Override
    public double[] sample(int n) {
        ParameterChecks.nonNegative("sample count", n);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = sampler.sample(rng.nextDouble());
        }
        return out;
    }
}
