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

import java.util.Arrays;

/**
 * Detection probabilities supplied per table cell: P(T=positive | X=x, Y=y),
 * indexed [row][column] like the table.
 */
public final class CellDetectionProbabilities implements DetectionModel {

    private final double[][] probabilities;

    /**
     * @param probabilities P(T | x, y) indexed [Y][X]; every value in [0, 1]
     * @throws InvalidParameterException if the array is ragged or a value is out of range
     */
    public CellDetectionProbabilities(double[][] probabilities) {
        ParameterChecks.notNull("detection probabilities", probabilities);
        this.probabilities = new double[probabilities.length][];
        for (int r = 0; r < probabilities.length; r++) {
            ParameterChecks.notNull("detection probability row " + r, probabilities[r]);
            if (r > 0) {
                ParameterChecks.sameLength("detection probability row 0", probabilities[0].length,
                    "row " + r, probabilities[r].length);
            }
            for (int c = 0; c < probabilities[r].length; c++) {
                ParameterChecks.probability("P(T | cell [" + r + "][" + c + "])", probabilities[r][c]);
            }
            this.probabilities[r] = probabilities[r].clone();
        }
    }

    /**
     * @param rows number of rows
     * @param columns number of columns
     * @param p the detection probability of every cell
     * @return a model with the same probability in every cell
     */
    public static CellDetectionProbabilities uniform(int rows, int columns, double p) {
        double[][] cells = new double[rows][columns];
        for (double[] row : cells) {
            Arrays.fill(row, p);
        }
        return new CellDetectionProbabilities(cells);
    }

    @Override
    public void validateAgainst(JointObservationTable table) {
        if (probabilities.length != table.rows()
            || (probabilities.length > 0 && probabilities[0].length != table.columns())) {
            throw new InvalidParameterException(
                "detection probabilities are " + probabilities.length + "x"
                    + (probabilities.length > 0 ? probabilities[0].length : 0)
                    + " but the joint table is " + table.rows() + "x" + table.columns());
        }
    }

    @Override
    public double probabilityPositive(JointObservationTable table) {
        double sum = 0.0;
        for (int r = 0; r < table.rows(); r++) {
            sum += jointPositive(table, Axis.Y, r);
        }
        return sum;
    }

    @Override
    public double jointPositive(JointObservationTable table, Axis axis, int index) {
        double sum = 0.0;
        if (axis == Axis.Y) {
            for (int c = 0; c < table.columns(); c++) {
                sum += table.jointProbability(index, c) * probabilities[index][c];
            }
        } else {
            for (int r = 0; r < table.rows(); r++) {
                sum += table.jointProbability(r, index) * probabilities[r][index];
            }
        }
        return sum;
    }

    public double probability(int row, int column) {
        return probabilities[row][column];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellDetectionProbabilities)) return false;
        return Arrays.deepEquals(probabilities, ((CellDetectionProbabilities) o).probabilities);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(probabilities);
    }

    @Override
    public String toString() {
        return "CellDetectionProbabilities" + Arrays.deepToString(probabilities);
    }
}
