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

package io.cyberrisk.distributions.model;

/// Single-variable distribution model used by the loss simulation.
///
/// ## Models vs Samplers
///
/// A ScalarModel is a pure description: it holds distribution parameters
/// and answers closed-form questions (CDF, moments). It does not draw
/// values. Sampling is done by a
/// [io.cyberrisk.distributions.sampling.BatchSampler] bound to the model
/// and to one random generator at construction.
///
/// ```
///   ScenarioParameters            per run
///  ┌────────────────────┐     ┌──────────────────────────┐
///  │ TriangularScalar   │────►│ BatchSampler(model, rng) │──► double[n]
///  │ DiscreteScalar     │     └──────────────────────────┘
///  │ LogNormalScalar    │                 ▲
///  │ ParetoScalar       │                 │ one generator per run
///  └────────────────────┘          RandomGenerators.create(seed)
/// ```
///
/// ## Implementations
///
/// | Model Type | Distribution | Parameters |
/// |------------|--------------|------------|
/// | [TriangularScalarModel] | Triangular | min, mode, max |
/// | [DiscreteScalarModel] | finite discrete | values, probabilities |
/// | [LogNormalScalarModel] | log-normal | μ, σ |
/// | [ParetoScalarModel] | Pareto type I | scale, shape |
///
/// ## Validation
///
/// Constructors validate their parameters. Instances restored through
/// reflection (e.g. JSON deserialization) skip the constructor, so engines
/// call [#validate()] again before drawing any sample.
public interface ScalarModel {

    /// Returns the model type identifier used as the JSON discriminator.
    ///
    /// @return the model type identifier (e.g. "triangular", "pareto")
    String getModelType();

    /// Computes the cumulative distribution function P(X ≤ x).
    ///
    /// Implementations return values in [0, 1], monotonically non-decreasing in x.
    ///
    /// @param x the value at which to evaluate the CDF
    /// @return the cumulative probability P(X ≤ x)
    double cdf(double x);

    /// @return the distribution mean, or +∞ where the mean does not exist
    double getMean();

    /// @return the distribution variance, or +∞ where the variance does not exist
    double getVariance();

    /// Re-checks the parameter invariants of this model.
    ///
    /// @throws io.cyberrisk.api.InvalidParameterException if any invariant fails
    void validate();
}
