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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class PercentileBreakdownTest {

    @Test
    void linearInterpolationBetweenOrderStatistics() {
        PercentileBreakdown breakdown = PercentileBreakdown.of(
            new double[]{5, 1, 4, 2, 3}, new double[]{50, 75, 90, 100});
        assertThat(breakdown.getValues()).containsExactly(new double[]{3.0, 4.0, 4.6, 5.0}, within(1e-12));
        assertThat(breakdown.valueAt(90)).isCloseTo(4.6, within(1e-12));
    }

    @Test
    void singleValueSample() {
        PercentileBreakdown breakdown = PercentileBreakdown.of(new double[]{7.0}, SimulationOptions.DEFAULT_PERCENTILES);
        assertThat(breakdown.getValues()).containsOnly(7.0);
    }

    @Test
    void sampleIsNotModified() {
        double[] sample = {3, 1, 2};
        PercentileBreakdown.of(sample, new double[]{50});
        assertThat(sample).containsExactly(3, 1, 2);
    }

    @Test
    void unknownLevel() {
        PercentileBreakdown breakdown = PercentileBreakdown.of(new double[]{1, 2}, new double[]{50});
        assertThatThrownBy(() -> breakdown.valueAt(95)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptySample() {
        assertThatThrownBy(() -> PercentileBreakdown.of(new double[0], new double[]{50}))
            .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void toStringNamesLevels() {
        assertThat(PercentileBreakdown.of(new double[]{1, 2}, new double[]{50, 99.5}).toString())
            .contains("P50=").contains("P99.5=");
    }

    @Test
    void optionLevelsAreValidated() {
        assertThatThrownBy(() -> SimulationOptions.builder().percentileLevels(90, 50))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("strictly ascending");
        assertThatThrownBy(() -> SimulationOptions.builder().percentileLevels(0))
            .isInstanceOf(InvalidParameterException.class);
    }
}
