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
 * Joint occurrence counts of two categorical variables over N trials.
 *
 * <pre>{@code
 *              X=2   X=3   X=4   X=5
 *    Y=6   [   25,   35,   20,   15 ]
 *    Y=7   [   30,   40,   25,   10 ]
 *    Y=8   [   15,   25,   30,   20 ]      N = 290
 * }</pre>
 *
 * <p>Rows are levels of Y and columns are levels of X. Level values are
 * integers, strictly ascending along each axis, so that X + Y is meaningful.
 * The table is immutable; accessors return copies.
 */
public final class JointObservationTable {

    /** X levels of the canonical screening table. */
    public static final int[] CANONICAL_X_LEVELS = {2, 3, 4, 5};

    /** Y levels of the canonical screening table. */
    public static final int[] CANONICAL_Y_LEVELS = {6, 7, 8};

    private final long[][] counts;
    private final int[] xLevels;
    private final int[] yLevels;
    private final long total;

    /**
     * @param counts counts indexed [row][column], i.e. [Y][X]
     * @param xLevels the X value of each column
     * @param yLevels the Y value of each row
     * @param total the declared number of trials N; must equal the sum of counts
     * @throws InvalidParameterException if any invariant fails
     */
    public JointObservationTable(long[][] counts, int[] xLevels, int[] yLevels, long total) {
        ParameterChecks.notNull("joint table", counts);
        ParameterChecks.notNull("X levels", xLevels);
        ParameterChecks.notNull("Y levels", yLevels);
        if (counts.length == 0) {
            throw new InvalidParameterException("joint table must have at least one row");
        }
        ParameterChecks.sameLength("Y levels", yLevels.length, "joint table rows", counts.length);

        this.counts = new long[counts.length][];
        long sum = 0;
        for (int r = 0; r < counts.length; r++) {
            ParameterChecks.notNull("joint table row " + r, counts[r]);
            ParameterChecks.sameLength("X levels", xLevels.length, "joint table row " + r, counts[r].length);
            this.counts[r] = counts[r].clone();
            for (int c = 0; c < counts[r].length; c++) {
                if (counts[r][c] < 0) {
                    throw new InvalidParameterException(
                        "joint table entry [" + r + "][" + c + "] must be non-negative, got " + counts[r][c]);
                }
                sum = Math.addExact(sum, counts[r][c]);
            }
        }
        if (xLevels.length == 0) {
            throw new InvalidParameterException("joint table must have at least one column");
        }
        requireAscending("X levels", xLevels);
        requireAscending("Y levels", yLevels);
        if (total <= 0) {
            throw new InvalidParameterException("total N must be > 0, got " + total);
        }
        if (sum != total) {
            throw new InvalidParameterException(
                "total N=" + total + " does not match the sum of table entries " + sum);
        }
        this.xLevels = xLevels.clone();
        this.yLevels = yLevels.clone();
        this.total = total;
    }

    /**
     * Builds a table whose N is the sum of its entries.
     */
    public static JointObservationTable of(long[][] counts, int[] xLevels, int[] yLevels) {
        ParameterChecks.notNull("joint table", counts);
        long sum = 0;
        for (long[] row : counts) {
            if (row != null) {
                for (long v : row) {
                    sum += v;
                }
            }
        }
        return new JointObservationTable(counts, xLevels, yLevels, sum);
    }

    /**
     * Builds a 3×4 table over the canonical levels X ∈ {2,3,4,5}, Y ∈ {6,7,8}.
     *
     * @param counts the 3×4 counts, rows Y=6,7,8
     * @param total the declared N
     * @return the table
     */
    public static JointObservationTable canonical(long[][] counts, long total) {
        return new JointObservationTable(counts, CANONICAL_X_LEVELS, CANONICAL_Y_LEVELS, total);
    }

    private static void requireAscending(String name, int[] levels) {
        for (int i = 1; i < levels.length; i++) {
            if (levels[i] <= levels[i - 1]) {
                throw new InvalidParameterException(
                    name + " must be strictly ascending, got " + Arrays.toString(levels));
            }
        }
    }

    public int rows() {
        return counts.length;
    }

    public int columns() {
        return xLevels.length;
    }

    public long total() {
        return total;
    }

    public long count(int row, int column) {
        return counts[row][column];
    }

    public int xLevel(int column) {
        return xLevels[column];
    }

    public int yLevel(int row) {
        return yLevels[row];
    }

    public int[] xLevels() {
        return xLevels.clone();
    }

    public int[] yLevels() {
        return yLevels.clone();
    }

    public int levelCount(Axis axis) {
        return axis == Axis.X ? columns() : rows();
    }

    public int level(Axis axis, int index) {
        return axis == Axis.X ? xLevels[index] : yLevels[index];
    }

    /**
     * @param axis the axis
     * @param level a level value
     * @return the row or column index of the level, or -1 if absent
     */
    public int indexOf(Axis axis, int level) {
        int index = Arrays.binarySearch(axis == Axis.X ? xLevels : yLevels, level);
        return index >= 0 ? index : -1;
    }

    /**
     * @throws InvalidParameterException if the level is not on the axis
     */
    public int requireIndexOf(Axis axis, int level) {
        int index = indexOf(axis, level);
        if (index < 0) {
            throw new InvalidParameterException(
                axis + "=" + level + " is not a level of the table; levels are "
                    + Arrays.toString(axis == Axis.X ? xLevels : yLevels));
        }
        return index;
    }

    /** @return P(X = x_column, Y = y_row) */
    public double jointProbability(int row, int column) {
        return counts[row][column] / (double) total;
    }

    public long rowCount(int row) {
        long sum = 0;
        for (long v : counts[row]) {
            sum += v;
        }
        return sum;
    }

    public long columnCount(int column) {
        long sum = 0;
        for (long[] row : counts) {
            sum += row[column];
        }
        return sum;
    }

    /** @return the marginal count of the level at {@code index} on {@code axis} */
    public long marginalCount(Axis axis, int index) {
        return axis == Axis.X ? columnCount(index) : rowCount(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JointObservationTable)) return false;
        JointObservationTable that = (JointObservationTable) o;
        return total == that.total
            && Arrays.deepEquals(counts, that.counts)
            && Arrays.equals(xLevels, that.xLevels)
            && Arrays.equals(yLevels, that.yLevels);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(total);
        result = 31 * result + Arrays.deepHashCode(counts);
        result = 31 * result + Arrays.hashCode(xLevels);
        return 31 * result + Arrays.hashCode(yLevels);
    }

    @Override
    public String toString() {
        return "JointObservationTable{" +
            "xLevels=" + Arrays.toString(xLevels) +
            ", yLevels=" + Arrays.toString(yLevels) +
            ", counts=" + Arrays.deepToString(counts) +
            ", total=" + total +
            '}';
    }
}
