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

package io.cyberrisk.controls;

/// Outcome of a linear program.
public enum SolverStatus {
    /// An optimal solution was found.
    OPTIMAL,
    /// No deployment satisfies every constraint.
    INFEASIBLE,
    /// The objective decreases without bound, e.g. a negative cost on an unlimited control.
    UNBOUNDED,
    /// The simplex iteration limit of [OptimizerOptions] was reached.
    ITERATION_LIMIT
}
