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
import io.cyberrisk.api.ParameterChecks;

/// Bayes' theorem and the definition of conditional probability.
public final class BayesRule {

    private BayesRule() {
    }

    /// P(A | B) = P(B | A) · P(A) / P(B)
    ///
    /// @param likelihood P(B | A)
    /// @param prior P(A)
    /// @param evidence P(B)
    /// @return the posterior, clamped to [0, 1]
    /// @throws DivisionByZeroException when the evidence is zero
    public static double posterior(double likelihood, double prior, double evidence) {
        ParameterChecks.probability("likelihood", likelihood);
        ParameterChecks.probability("prior", prior);
        ParameterChecks.probability("evidence", evidence);
        if (evidence == 0.0) {
            throw new DivisionByZeroException("evidence", "posterior is undefined when the evidence has probability zero");
        }
        return clamp(likelihood * prior / evidence);
    }

    /// P(A | B) = P(A, B) / P(B)
    ///
    /// @param joint P(A, B)
    /// @param marginal P(B)
    /// @return the conditional probability, clamped to [0, 1]
    /// @throws DivisionByZeroException when the marginal is zero
    public static double conditional(double joint, double marginal) {
        ParameterChecks.probability("joint probability", joint);
        ParameterChecks.probability("marginal probability", marginal);
        if (marginal == 0.0) {
            throw new DivisionByZeroException("marginal", "conditional probability is undefined for a zero-probability condition");
        }
        return clamp(joint / marginal);
    }

    static double clamp(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }
}
