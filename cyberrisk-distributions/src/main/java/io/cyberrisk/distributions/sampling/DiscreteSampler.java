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

import io.cyberrisk.distributions.model.DiscreteScalarModel;

/// Sampler for finite discrete distributions, bound at construction.
///
/// Selects the first value whose cumulative probability exceeds u. The
/// last cumulative entry is pinned to 1, so rounding in the probabilities
/// can never leave u without a match.
public final class DiscreteSampler implements ComponentSampler {

    private final double[] values;
    private final double[] cumulative;

    /// @param model the discrete model
    public DiscreteSampler(DiscreteScalarModel model) {
        this.values = model.getValues();
        this.cumulative = model.cumulativeProbabilities();
    }

    @Override
    public double sample(double u) {
        int lo = 0;
        int hi = cumulative.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cumulative[mid] > u) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return values[lo];
    }
}
