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

import io.cyberrisk.api.DivisionByZeroException;
import io.cyberrisk.api.InvalidParameterException;
import io.cyberrisk.api.ParameterChecks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Evaluates joint, marginal and conditional probabilities of a two-stage
/// observation process: a joint table of (X, Y) counts followed by a binary
/// test T whose detection probabilities come from a [DetectionModel].
///
/// # Pipeline
///
/// ```text
///   validate table, detection model and query
///        │
///        ├── marginal     Σ P(level) over the inclusive range
///        ├── range        Σ P(x, y) over cells with low ≤ x + y ≤ high
///        ├── P(T)         from the detection model
///        └── conditional  P(T, level) / P(T)
/// ```
///
/// Every returned probability is clamped to [0, 1]. The evaluator holds no
/// state and may be shared between threads.
public final class ConditionalProbabilityEvaluator {

    private static final Logger logger = LogManager.getLogger(ConditionalProbabilityEvaluator.class);

    /// Evaluates the canonical query.
    ///
    /// @see ProbabilityQuery#canonical()
    public ConditionalProbabilities evaluate(JointObservationTable table, DetectionModel detection) {
        return evaluate(table, detection, ProbabilityQuery.canonical());
    }

    /// @param table the joint observation table
    /// @param detection the detection probabilities of T
    /// @param query the probabilities to compute
    /// @return the answers
    /// @throws InvalidParameterException if the inputs do not fit together
    /// @throws DivisionByZeroException if P(T = positive) is zero
    public ConditionalProbabilities evaluate(JointObservationTable table, DetectionModel detection,
                                             ProbabilityQuery query) {
        ParameterChecks.notNull("joint table", table);
        ParameterChecks.notNull("detection model", detection);
        ParameterChecks.notNull("probability query", query);
        detection.validateAgainst(table);
        query.validateAgainst(table);

        double marginal = marginalRange(table, query.marginalAxis(), query.marginalLow(), query.marginalHigh());
        double range = sumRange(table, query.sumLow(), query.sumHigh());
        double positive = probabilityPositive(table, detection);
        double conditional = conditional(table, detection, query.conditionAxis(), query.conditionLevel());

        ConditionalProbabilities result = new ConditionalProbabilities(query, marginal, range, conditional, positive);
        logger.info("Evaluated {} over N={}: {}", query, table.total(), result);
        return result;
    }

    /// @return P(X = x, Y = y)
    public double joint(JointObservationTable table, int x, int y) {
        int column = table.requireIndexOf(Axis.X, x);
        int row = table.requireIndexOf(Axis.Y, y);
        return table.jointProbability(row, column);
    }

    /// @return P(axis = level)
    public double marginal(JointObservationTable table, Axis axis, int level) {
        return marginalRange(table, axis, level, level);
    }

    /// Sums the marginal over the levels of one axis within [low, high].
    /// Both bounds must be levels of the table.
    public double marginalRange(JointObservationTable table, Axis axis, int low, int high) {
        table.requireIndexOf(axis, low);
        table.requireIndexOf(axis, high);
        if (low > high) {
            throw new InvalidParameterException(axis + " range low " + low + " exceeds high " + high);
        }
        long count = 0;
        for (int i = 0; i < table.levelCount(axis); i++) {
            int level = table.level(axis, i);
            if (level >= low && level <= high) {
                count += table.marginalCount(axis, i);
            }
        }
        return BayesRule.clamp(count / (double) table.total());
    }

    /// @return P(low ≤ X + Y ≤ high)
    public double sumRange(JointObservationTable table, long low, long high) {
        if (low > high) {
            throw new InvalidParameterException("sum range low " + low + " exceeds high " + high);
        }
        long count = 0;
        for (int r = 0; r < table.rows(); r++) {
            for (int c = 0; c < table.columns(); c++) {
                long sum = (long) table.xLevel(c) + table.yLevel(r);
                if (sum >= low && sum <= high) {
                    count += table.count(r, c);
                }
            }
        }
        return BayesRule.clamp(count / (double) table.total());
    }

    /// @return P(T = positive)
    public double probabilityPositive(JointObservationTable table, DetectionModel detection) {
        detection.validateAgainst(table);
        return BayesRule.clamp(detection.probabilityPositive(table));
    }

    /// @return P(axis = level | T = positive)
    /// @throws DivisionByZeroException if P(T = positive) is zero
    public double conditional(JointObservationTable table, DetectionModel detection, Axis axis, int level) {
        int index = table.requireIndexOf(axis, level);
        detection.validateAgainst(table);
        double positive = detection.probabilityPositive(table);
        if (positive <= 0.0) {
            logger.debug("P(T=positive) is zero for {}; P({}={} | T) is undefined", detection, axis, level);
            throw new DivisionByZeroException("P(T=positive)",
                "P(" + axis + "=" + level + " | T=positive) is undefined because P(T=positive) is zero");
        }
        return BayesRule.clamp(detection.jointPositive(table, axis, index) / positive);
    }

    /// Tabulates both marginals and the joint probability matrix.
    public JointDistributionSummary summarize(JointObservationTable table) {
        ParameterChecks.notNull("joint table", table);
        return JointDistributionSummary.of(table);
    }
}
