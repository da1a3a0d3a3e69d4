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
import io.cyberrisk.distributions.model.DiscreteScalarModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ScenarioParametersTest {

    private static ScenarioParameters.Builder valid() {
        return LossExpectancySimulatorTest.demoScenario().toBuilder();
    }

    @Test
    void probabilitySumMessageNamesTheDistribution() {
        assertThatThrownBy(() -> valid().occurrences(new int[]{0, 1, 2}, new double[]{0.3, 0.4, 0.27}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageStartingWith("occurrence distribution: probabilities sum to 0.97")
            .hasMessageEndingWith("expected 1.0 ± 1e-6");
    }

    @Test
    void modeOutsideBounds() {
        assertThatThrownBy(() -> valid().assetValue(100, 50, 200))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageStartingWith("asset value distribution:");
    }

    @Test
    void negativeAssetValueRejected() {
        assertThatThrownBy(() -> valid().assetValue(-500_000, -100_000, -50_000).build())
            .isInstanceOf(InvalidParameterException.class)
            .hasMessage("asset value distribution: minimum must be >= 0, got -500000.0");
    }

    @Test
    void zeroAssetValueMinimumIsAllowed() {
        assertThat(valid().assetValue(0, 10, 20).build().getAssetValue().getMin()).isEqualTo(0.0);
    }

    @Test
    void negativeOccurrenceCountRejected() {
        assertThatThrownBy(() -> valid().occurrences(new int[]{-3, 1}, new double[]{0.9, 0.1}).build())
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageStartingWith("occurrence distribution: value[0] must be a non-negative whole count");
    }

    @Test
    void fractionalOccurrenceCountRejected() {
        DiscreteScalarModel fractional = new DiscreteScalarModel(new double[]{0.0, 1.5}, new double[]{0.5, 0.5});
        assertThatThrownBy(() -> valid().occurrences(fractional).build())
            .isInstanceOf(InvalidParameterException.class)
            .hasMessage("occurrence distribution: value[1] must be a non-negative whole count, got 1.5");
    }

    @Test
    void nonPositiveSigmaAndShape() {
        assertThatThrownBy(() -> valid().primaryLoss(9.0, 0.0))
            .hasMessageStartingWith("primary loss distribution:");
        assertThatThrownBy(() -> valid().secondaryLoss(5000, -1))
            .hasMessageStartingWith("secondary loss distribution:");
    }

    @Test
    void thresholdsAreRequired() {
        ScenarioParameters.Builder builder = ScenarioParameters.builder()
            .assetValue(1, 2, 3)
            .occurrences(new int[]{1}, new double[]{1.0})
            .primaryLoss(0, 1)
            .secondaryLoss(1, 2);
        assertThatThrownBy(builder::build)
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("asset value threshold must be finite");
    }

    @Test
    void lossRangeMustBeOrdered() {
        assertThatThrownBy(() -> valid().thresholds(1, 1, 30_000, 10_000).build())
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("loss range lower bound 30000.0 exceeds upper bound 10000.0");
    }

    @Test
    void degenerateLossRangeIsAllowed() {
        assertThat(valid().thresholds(1, 1, 5, 5).build().getLossRangeLower()).isEqualTo(5.0);
    }

    @Test
    void iterationsMustBePositive() {
        assertThatThrownBy(() -> valid().iterations(0).build())
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("iterations must be >= 1");
    }

    @Test
    void missingDistribution() {
        assertThatThrownBy(() -> valid().secondaryLoss(null).build())
            .isInstanceOf(InvalidParameterException.class)
            .hasMessage("secondary loss distribution is required");
    }

    @Test
    void toBuilderRoundTrip() {
        ScenarioParameters params = valid().build();
        assertThat(params.toBuilder().build()).isEqualTo(params);
        assertThat(params.getSeed()).isEqualTo(42L);
        assertThat(params.toBuilder().unseeded().build().getSeed()).isNull();
    }
}
