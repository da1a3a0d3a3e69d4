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

import io.cyberrisk.api.InvalidParameterException;
import io.cyberrisk.api.ParameterChecks;

import java.util.Objects;

/// The three questions asked of a joint table in one evaluation.
///
/// | Part | Meaning |
/// |------|---------|
/// | marginal | P(low ≤ axis ≤ high) on one axis, a single level when low == high |
/// | range | P(low ≤ X + Y ≤ high) |
/// | conditional | P(axis = level \| T = positive) |
///
/// # Usage
///
/// ```java
/// ProbabilityQuery query = ProbabilityQuery.builder()
///     .marginal(Axis.X, 3, 4)
///     .sumAtMost(10)
///     .conditionOn(Axis.Y, 8)
///     .build();
/// ```
public final class ProbabilityQuery {

    private final Axis marginalAxis;
    private final int marginalLow;
    private final int marginalHigh;
    private final long sumLow;
    private final long sumHigh;
    private final Axis conditionAxis;
    private final int conditionLevel;

    private ProbabilityQuery(Builder builder) {
        this.marginalAxis = builder.marginalAxis;
        this.marginalLow = builder.marginalLow;
        this.marginalHigh = builder.marginalHigh;
        this.sumLow = builder.sumLow;
        this.sumHigh = builder.sumHigh;
        this.conditionAxis = builder.conditionAxis;
        this.conditionLevel = builder.conditionLevel;
    }

    /// The standard two-stage query: P(3 ≤ X ≤ 4), P(X+Y ≤ 10), P(Y=8 | T).
    public static ProbabilityQuery canonical() {
        return builder()
            .marginal(Axis.X, 3, 4)
            .sumAtMost(10)
            .conditionOn(Axis.Y, 8)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Checks that every level this query names exists in the table.
    ///
    /// @param table the table to be queried
    /// @throws InvalidParameterException naming the first missing level
    public void validateAgainst(JointObservationTable table) {
        table.requireIndexOf(marginalAxis, marginalLow);
        table.requireIndexOf(marginalAxis, marginalHigh);
        table.requireIndexOf(conditionAxis, conditionLevel);
    }

    public Axis marginalAxis() {
        return marginalAxis;
    }

    public int marginalLow() {
        return marginalLow;
    }

    public int marginalHigh() {
        return marginalHigh;
    }

    public long sumLow() {
        return sumLow;
    }

    public long sumHigh() {
        return sumHigh;
    }

    public Axis conditionAxis() {
        return conditionAxis;
    }

    public int conditionLevel() {
        return conditionLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProbabilityQuery)) return false;
        ProbabilityQuery that = (ProbabilityQuery) o;
        return marginalLow == that.marginalLow && marginalHigh == that.marginalHigh
            && sumLow == that.sumLow && sumHigh == that.sumHigh
            && conditionLevel == that.conditionLevel
            && marginalAxis == that.marginalAxis && conditionAxis == that.conditionAxis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(marginalAxis, marginalLow, marginalHigh, sumLow, sumHigh, conditionAxis, conditionLevel);
    }

    @Override
    public String toString() {
        return "ProbabilityQuery{" +
            "marginal=P(" + marginalLow + " <= " + marginalAxis + " <= " + marginalHigh + ")" +
            ", range=P(" + sumLow + " <= X+Y <= " + sumHigh + ")" +
            ", conditional=P(" + conditionAxis + "=" + conditionLevel + " | T)" +
            '}';
    }

    /// Builder for ProbabilityQuery. Every part must be set.
    public static final class Builder {
        private Axis marginalAxis;
        private int marginalLow;
        private int marginalHigh;
        private long sumLow = Long.MIN_VALUE;
        private long sumHigh;
        private boolean sumSet;
        private Axis conditionAxis;
        private int conditionLevel;

        Builder() {
        }

        public Builder marginal(Axis axis, int low, int high) {
            ParameterChecks.notNull("marginal axis", axis);
            if (low > high) {
                throw new InvalidParameterException(
                    "marginal range low " + low + " exceeds high " + high);
            }
            this.marginalAxis = axis;
            this.marginalLow = low;
            this.marginalHigh = high;
            return this;
        }

        public Builder marginal(Axis axis, int level) {
            return marginal(axis, level, level);
        }

        public Builder sumAtMost(long high) {
            return sumBetween(Long.MIN_VALUE, high);
        }

        public Builder sumBetween(long low, long high) {
            if (low > high) {
                throw new InvalidParameterException(
                    "sum range low " + low + " exceeds high " + high);
            }
            this.sumLow = low;
            this.sumHigh = high;
            this.sumSet = true;
            return this;
        }

        public Builder conditionOn(Axis axis, int level) {
            ParameterChecks.notNull("conditioning axis", axis);
            this.conditionAxis = axis;
            this.conditionLevel = level;
            return this;
        }

        public ProbabilityQuery build() {
            if (marginalAxis == null) {
                throw new InvalidParameterException("marginal query is required");
            }
            if (!sumSet) {
                throw new InvalidParameterException("sum range query is required");
            }
            if (conditionAxis == null) {
                throw new InvalidParameterException("conditional query is required");
            }
            return new ProbabilityQuery(this);
        }
    }
}
