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

package io.cyberrisk.simulation;

/// Selects how the headline annual loss expectancy is reported.
///
/// Every other field of a [SimulationResult] is computed the same way
/// under both models.
public enum LossModel {

    /// Mean over iterations of asset value × combined loss × occurrence count.
    MULTIPLICATIVE,

    /// Classical single-loss-expectancy form:
    /// E[count] · median(asset value) · P(combined loss ≥ exceedance threshold),
    /// with closed-form mean and median and the simulated exceedance probability.
    EXPOSURE_FACTOR
}
