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
import io.cyberrisk.distributions.model.LogNormalScalarModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.LogNormalSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/// Log-normal batch sampler backed by the commons-rng ziggurat Gaussian.
///
/// The Gaussian variate is not an inverse transform of a single uniform, so
/// this sampler consumes a variable number of generator outputs per sample.
public final class LogNormalBatchSampler implements BatchSampler {

    private final SharedStateContinuousSampler sampler;

    /// @param model the log-normal model
    /// @param rng the generator to draw from
    public LogNormalBatchSampler(LogNormalScalarModel model, UniformRandomProvider rng) {
        this.sampler = LogNormalSampler.of(
            ZigguratSampler.NormalizedGaussian.of(rng), model.getMu(), model.getSigma());
    }

    @Override
    public double[] sample(int n) {
        ParameterChecks.nonNegative("sample count", n);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = sampler.sample();
        }
        return out;
    }
}
