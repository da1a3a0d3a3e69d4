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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Detection probabilities supplied per level: P(T | X=x) for every column
 * and P(T | Y=y) for every row except the last.
 *
 * <p>The last row's conditional is implied by the law of total probability,
 * P(T) computed from the X side being equal to P(T) computed from the Y side:
 *
 * <pre>{@code
 *   P(T)          = Σx P(T | x) · P(x)
 *   P(T, Y=last)  = P(T) − Σ(y ≠ last) P(T | y) · P(y)
 *   P(T | Y=last) = P(T, Y=last) / P(Y=last)
 * }</pre>
 *
 * <p>A negative implied joint P(T, Y=last) fails with
 * {@link InvalidParameterException}. An implied conditional above 1 is
 * accepted and logged as a warning; the joint is used as derived, so
 * P(Y=last | T) = P(T, Y=last) / P(T) still lies in [0, 1].
 */
public final class MarginalDetectionProbabilities implements DetectionModel {

    private static final Logger logger = LogManager.getLogger(MarginalDetectionProbabilities.class);

    private static final double CONSISTENCY_TOLERANCE = 1e-12;

    private final double[] xConditionals;
    private final double[] yConditionals;

    /**
     * @param xConditionals P(T | X=x) for every X level, in column order
     * @param yConditionals P(T | Y=y) for every Y level but the last, in row order
     */
    public MarginalDetectionProbabilities(double[] xConditionals, double[] yConditionals) {
        ParameterChecks.notNull("P(T | X) values", xConditionals);
        ParameterChecks.notNull("P(T | Y) values", yConditionals);
        for (int i = 0; i < xConditionals.length; i++) {
            ParameterChecks.probability("P(T | X level " + i + ")", xConditionals[i]);
        }
        for (int i = 0; i < yConditionals.length; i++) {
            ParameterChecks.probability("P(T | Y level " + i + ")", yConditionals[i]);
        }
        this.xConditionals = xConditionals.clone();
        this.yConditionals = yConditionals.clone();
    }

    /**
     * Splits a flat vector: the first {@code xLevels} entries are P(T | X),
     * the rest P(T | Y) for all rows but the last. For the canonical 3×4
     * table this is the six-value form [P(T|X=2..5), P(T|Y=6), P(T|Y=7)].
     *
     * @param vector the flat conditional probabilities
     * @param xLevels the number of X levels
     * @return the model
     */
    public static MarginalDetectionProbabilities fromVector(double[] vector, int xLevels) {
        ParameterChecks.notNull("detection probability vector", vector);
        if (xLevels < 0 || xLevels > vector.length) {
            throw new InvalidParameterException(
                "cannot take " + xLevels + " X conditionals from a vector of " + vector.length);
        }
        return new MarginalDetectionProbabilities(
            Arrays.copyOfRange(vector, 0, xLevels),
            Arrays.copyOfRange(vector, xLevels, vector.length));
    }

    @Override
    public void validateAgainst(JointObservationTable table) {
        ParameterChecks.sameLength("P(T | X) values", xConditionals.length, "X levels", table.columns());
        ParameterChecks.sameLength("P(T | Y) values", yConditionals.length,
            "Y levels other than the last", table.rows() - 1);
        double lastJoint = rawLastRowJoint(table);
        double lastMarginal = table.rowCount(table.rows() - 1) / (double) table.total();
        int lastLevel = table.yLevel(table.rows() - 1);
        if (lastJoint < -CONSISTENCY_TOLERANCE) {
            throw new InvalidParameterException(
                "detection probabilities are inconsistent: implied P(T, Y=" + lastLevel + ") = "
                    + lastJoint + " is negative");
        }
        if (lastJoint > lastMarginal + CONSISTENCY_TOLERANCE) {
            logger.warn("Implied P(T | Y={}) = {} exceeds 1; using the derived joint P(T, Y={}) = {}",
                lastLevel, lastJoint / lastMarginal, lastLevel, lastJoint);
        }
    }

    /**
     * @param table the joint table
     * @return the implied P(T | Y=last), which may exceed 1, or NaN when P(Y=last) is zero
     */
    public double impliedLastRowConditional(JointObservationTable table) {
        double lastMarginal = table.rowCount(table.rows() - 1) / (double) table.total();
        if (lastMarginal == 0.0) {
            return Double.NaN;
        }
        return lastRowJoint(table) / lastMarginal;
    }

    @Override
    public double probabilityPositive(JointObservationTable table) {
        double sum = 0.0;
        for (int c = 0; c < table.columns(); c++) {
            sum += xConditionals[c] * table.columnCount(c) / (double) table.total();
        }
        return sum;
    }

    @Override
    public double jointPositive(JointObservationTable table, Axis axis, int index) {
        if (axis == Axis.X) {
            return xConditionals[index] * table.columnCount(index) / (double) table.total();
        }
        if (index == table.rows() - 1) {
            return lastRowJoint(table);
        }
        return yConditionals[index] * table.rowCount(index) / (double) table.total();
    }

    private double rawLastRowJoint(JointObservationTable table) {
        double otherRows = 0.0;
        for (int r = 0; r < table.rows() - 1; r++) {
            otherRows += yConditionals[r] * table.rowCount(r) / (double) table.total();
        }
        return probabilityPositive(table) - otherRows;
    }

    private double lastRowJoint(JointObservationTable table) {
        return Math.max(0.0, rawLastRowJoint(table));
    }

    public double[] xConditionals() {
        return xConditionals.clone();
    }

    public double[] yConditionals() {
        return yConditionals.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarginalDetectionProbabilities)) return false;
        MarginalDetectionProbabilities that = (MarginalDetectionProbabilities) o;
        return Arrays.equals(xConditionals, that.xConditionals) && Arrays.equals(yConditionals, that.yConditionals);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(xConditionals) + Arrays.hashCode(yConditionals);
    }

    @Override
    public String toString() {
        return "MarginalDetectionProbabilities{" +
            "x=" + Arrays.toString(xConditionals) +
            ", y=" + Arrays.toString(yConditionals) +
            '}';
    }
}
