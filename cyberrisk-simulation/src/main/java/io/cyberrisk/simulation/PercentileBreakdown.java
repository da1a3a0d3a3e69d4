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

package io.cyberrisk.simulation;

import io.cyberrisk.api.InvalidParameterException;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/// Percentiles of one sample at a fixed set of levels.
///
/// Values use order-statistic linear interpolation (commons-math3
/// [Percentile.EstimationType#R_7]), the estimator most statistics
/// packages use by default: for level p over n sorted values the rank is
/// (n − 1)·p/100 and the result interpolates between its neighbours.
public final class PercentileBreakdown {

    private final double[] levels;
    private final double[] values;

    PercentileBreakdown(double[] levels, double[] values) {
        this.levels = levels.clone();
        this.values = values.clone();
    }

    /// Computes percentiles of `sample` at the given levels.
    ///
    /// @param sample the data; not modified
    /// @param levels ascending levels in (0, 100]
    /// @return the breakdown
    public static PercentileBreakdown of(double[] sample, double[] levels) {
        if (sample.length == 0) {
            throw new InvalidParameterException("cannot compute percentiles of an empty sample");
        }
        Percentile percentile = estimator();
        percentile.setData(sample);
        return of(percentile, levels);
    }

    /// Evaluates an estimator whose data has already been set.
    static PercentileBreakdown of(Percentile percentile, double[] levels) {
        double[] values = new double[levels.length];
        for (int i = 0; i < levels.length; i++) {
            values[i] = percentile.evaluate(levels[i]);
        }
        return new PercentileBreakdown(levels, values);
    }

    static Percentile estimator() {
        return new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    }

    /// Returns the value at a configured level.
    ///
    /// @param level one of [#getLevels()]
    /// @return the percentile value
    /// @throws IllegalArgumentException if the level was not computed
    public double valueAt(double level) {
        for (int i = 0; i < levels.length; i++) {
            if (Double.compare(levels[i], level) == 0) {
                return values[i];
            }
        }
        throw new IllegalArgumentException(
            "percentile level " + level + " was not computed; available: " + Arrays.toString(levels));
    }

    public double[] getLevels() {
        return levels.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PercentileBreakdown)) return false;
        PercentileBreakdown that = (PercentileBreakdown) o;
        return Arrays.equals(levels, that.levels) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(levels) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PercentileBreakdown{");
        for (int i = 0; i < levels.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('P').append(formatLevel(levels[i])).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }

    private static String formatLevel(double level) {
        return level == Math.rint(level) ? Long.toString((long) level) : Double.toString(level);
    }
}
