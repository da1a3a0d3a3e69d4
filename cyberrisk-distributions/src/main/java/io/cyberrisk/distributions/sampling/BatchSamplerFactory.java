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
import io.cyberrisk.distributions.model.LogNormalScalarModel;
import io.cyberrisk.distributions.model.ParetoScalarModel;
import io.cyberrisk.distributions.model.ScalarModel;
import io.cyberrisk.distributions.model.TriangularScalarModel;
import org.apache.commons.rng.UniformRandomProvider;

/// Factory for batch samplers bound to a model and a generator.
///
/// Type dispatch happens once here; the returned sampler never inspects
/// the model again.
///
/// ```java
/// UniformRandomProvider rng = RandomGenerators.create(42L);
/// BatchSampler assetValues = BatchSamplerFactory.forModel(triangular, rng);
/// double[] av = assetValues.sample(10_000);
/// ```
public final class BatchSamplerFactory {

    private BatchSamplerFactory() {
        // Factory class, no instantiation
    }

    /// Returns the inverse-CDF sampler for a model that has one.
    ///
    /// @param model the model
    /// @return a bound sampler
    /// @throws IllegalArgumentException if the model has no closed-form inverse CDF
    public static ComponentSampler inverseCdf(ScalarModel model) {
        if (model instanceof TriangularScalarModel) {
            return new TriangularSampler((TriangularScalarModel) model);
        } else if (model instanceof DiscreteScalarModel) {
            return new DiscreteSampler((DiscreteScalarModel) model);
        } else if (model instanceof ParetoScalarModel) {
            return new ParetoSampler((ParetoScalarModel) model);
        } else {
            throw new IllegalArgumentException(
                "No inverse-CDF sampler for model type: " + model.getClass().getName());
        }
    }

    /// Creates a batch sampler for the model drawing from `rng`.
    ///
    /// @param model the model
    /// @param rng the generator; shared generators interleave their draws
    /// @return a bound batch sampler
    /// @throws IllegalArgumentException if the model type is not supported
    public static BatchSampler forModel(ScalarModel model, UniformRandomProvider rng) {
        if (model instanceof LogNormalScalarModel) {
            return new LogNormalBatchSampler((LogNormalScalarModel) model, rng);
        }
        return new InverseTransformBatchSampler(inverseCdf(model), rng);
    }
}
