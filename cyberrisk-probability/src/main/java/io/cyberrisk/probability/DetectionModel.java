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

package io.cyberrisk.probability;

/// Conditional probabilities of a positive result from the second-stage test T.
///
/// A detection model answers joint questions about T=positive and one axis
/// of a [JointObservationTable]. The evaluator derives every conditional
/// from these joints:
///
/// ```text
///   P(T)             = Σ P(T, Y=y)
///   P(Y=y | T)       = P(T, Y=y) / P(T)
///   P(X=x | T)       = P(T, X=x) / P(T)
/// ```
///
/// ## Implementations
///
/// | Form | Supplied probabilities |
/// |------|------------------------|
/// | [CellDetectionProbabilities] | P(T \| X=x, Y=y) for every cell |
/// | [MarginalDetectionProbabilities] | P(T \| X=x) for every column, P(T \| Y=y) for every row but the last |
public interface DetectionModel {

    /// Checks that this model fits the table's shape and is internally consistent.
    ///
    /// @param table the table the model will be evaluated against
    /// @throws io.cyberrisk.api.InvalidParameterException if it does not
    void validateAgainst(JointObservationTable table);

    /// @param table the joint table
    /// @return P(T = positive)
    double probabilityPositive(JointObservationTable table);

    /// @param table the joint table
    /// @param axis the axis of the level
    /// @param index the row or column index of the level
    /// @return P(T = positive, axis = level)
    double jointPositive(JointObservationTable table, Axis axis, int index);
}
