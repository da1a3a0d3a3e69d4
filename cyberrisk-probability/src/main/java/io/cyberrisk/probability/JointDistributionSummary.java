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

import java.util.Arrays;

/**
 * Marginal counts and probabilities of both axes of a joint table, with the
 * joint probability matrix.
 *
 * <pre>{@code
 *            X=2  X=3  X=4  X=5 │ row count  P(Y)
 *   Y=6       25   35   20   15 │    95      0.328
 *   Y=7       30   40   25   10 │   105      0.362
 *   Y=8       15   25   30   20 │    90      0.310
 *   ────────────────────────────┘
 *   column    70  100   75   45     N = 290
 * }</pre>
 */
public final class JointDistributionSummary {

    private final long total;
    private final long[] rowCounts;
    private final long[] columnCounts;
    private final double[] rowProbabilities;
    private final double[] columnProbabilities;
    private final double[][] jointProbabilities;

    private JointDistributionSummary(long total, long[] rowCounts, long[] columnCounts,
                                     double[] rowProbabilities, double[] columnProbabilities,
                                     double[][] jointProbabilities) {
        this.total = total;
        this.rowCounts = rowCounts;
        this.columnCounts = columnCounts;
        this.rowProbabilities = rowProbabilities;
        this.columnProbabilities = columnProbabilities;
        this.jointProbabilities = jointProbabilities;
    }

    public static JointDistributionSummary of(JointObservationTable table) {
        long n = table.total();
        long[] rowCounts = new long[table.rows()];
        double[] rowProbabilities = new double[table.rows()];
        double[][] joint = new double[table.rows()][table.columns()];
        for (int r = 0; r < table.rows(); r++) {
            rowCounts[r] = table.rowCount(r);
            rowProbabilities[r] = rowCounts[r] / (double) n;
            for (int c = 0; c < table.columns(); c++) {
                joint[r][c] = table.jointProbability(r, c);
            }
        }
        long[] columnCounts = new long[table.columns()];
        double[] columnProbabilities = new double[table.columns()];
        for (int c = 0; c < table.columns(); c++) {
            columnCounts[c] = table.columnCount(c);
            columnProbabilities[c] = columnCounts[c] / (double) n;
        }
        return new JointDistributionSummary(n, rowCounts, columnCounts, rowProbabilities,
            columnProbabilities, joint);
    }

    public long total() {
        return total;
    }

    /// Marginal counts of Y, one per row.
    public long[] rowCounts() {
        return rowCounts.clone();
    }

    /// Marginal counts of X, one per column.
    public long[] columnCounts() {
        return columnCounts.clone();
    }

    public double[] rowProbabilities() {
        return rowProbabilities.clone();
    }

    public double[] columnProbabilities() {
        return columnProbabilities.clone();
    }

    public double[][] jointProbabilities() {
        double[][] copy = new double[jointProbabilities.length][];
        for (int r = 0; r < jointProbabilities.length; r++) {
            copy[r] = jointProbabilities[r].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JointDistributionSummary)) return false;
        JointDistributionSummary that = (JointDistributionSummary) o;
        return total == that.total
            && Arrays.equals(rowCounts, that.rowCounts)
            && Arrays.equals(columnCounts, that.columnCounts)
            && Arrays.deepEquals(jointProbabilities, that.jointProbabilities);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(total) + Arrays.deepHashCode(jointProbabilities);
    }

    @Override
    public String toString() {
        return "JointDistributionSummary{" +
            "total=" + total +
            ", rowCounts=" + Arrays.toString(rowCounts) +
            ", columnCounts=" + Arrays.toString(columnCounts) +
            '}';
    }
}
