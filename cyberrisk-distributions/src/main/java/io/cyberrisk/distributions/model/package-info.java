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

/// # Loss Distribution Models
///
/// Parameter holders for the four distributions a loss scenario is built from.
///
/// | Role in a scenario | Model | Type name |
/// |--------------------|-------|-----------|
/// | asset value | [io.cyberrisk.distributions.model.TriangularScalarModel] | triangular |
/// | annual occurrence count | [io.cyberrisk.distributions.model.DiscreteScalarModel] | discrete |
/// | primary loss magnitude | [io.cyberrisk.distributions.model.LogNormalScalarModel] | log_normal |
/// | secondary loss magnitude | [io.cyberrisk.distributions.model.ParetoScalarModel] | pareto |
///
/// Models are immutable and safe to share between threads. Each one serializes
/// to JSON with a `"type"` discriminator through
/// [io.cyberrisk.distributions.model.ScalarModelTypeAdapterFactory].
package io.cyberrisk.distributions.model;
