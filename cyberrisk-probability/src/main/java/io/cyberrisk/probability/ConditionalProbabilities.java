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

import java.util.Objects;

/**
 * Answers to one {@link ProbabilityQuery}, each in [0, 1].
 */
public final class ConditionalProbabilities {

    private final ProbabilityQuery query;
    private final double marginal;
    private final double range;
    private final double conditional;
    private final double probabilityPositive;

    public ConditionalProbabilities(ProbabilityQuery query, double marginal, double range,
                                    double conditional, double probabilityPositive) {
        this.query = query;
        this.marginal = marginal;
        this.range = range;
        this.conditional = conditional;
        this.probabilityPositive = probabilityPositive;
    }

    public ProbabilityQuery query() {
        return query;
    }

    /** @return P(low ≤ axis ≤ high) */
    public double marginal() {
        return marginal;
    }

    /** @return P(low ≤ X + Y ≤ high) */
    public double range() {
        return range;
    }

    /** @return P(axis = level | T = positive) */
    public double conditional() {
        return conditional;
    }

    /** @return P(T = positive) */
    public double probabilityPositive() {
        return probabilityPositive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConditionalProbabilities)) return false;
        ConditionalProbabilities that = (ConditionalProbabilities) o;
        return Double.compare(that.marginal, marginal) == 0
            && Double.compare(that.range, range) == 0
            && Double.compare(that.conditional, conditional) == 0
            && Double.compare(that.probabilityPositive, probabilityPositive) == 0
            && Objects.equals(query, that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, marginal, range, conditional, probabilityPositive);
    }

    @Override
    public String toString() {
        return "ConditionalProbabilities{" +
            "marginal=" + marginal +
            ", range=" + range +
            ", conditional=" + conditional +
            ", probabilityPositive=" + probabilityPositive +
            '}';
    }
}
