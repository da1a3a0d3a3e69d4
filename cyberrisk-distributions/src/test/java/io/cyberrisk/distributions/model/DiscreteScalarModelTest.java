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

package io.cyberrisk.distributions.model;

import io.cyberrisk.api.InvalidParameterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class DiscreteScalarModelTest {

    private final DiscreteScalarModel counts =
        DiscreteScalarModel.ofCounts(new int[]{0, 1, 2, 3}, new double[]{0.3, 0.4, 0.2, 0.1});

    @Test
    void meanAndVariance() {
        assertThat(counts.getMean()).isCloseTo(1.1, within(1e-12));
        assertThat(counts.getVariance()).isCloseTo(0.89, within(1e-12));
    }

    @Test
    void cdfStepsAtEachValue() {
        assertThat(counts.cdf(-0.5)).isEqualTo(0.0);
        assertThat(counts.cdf(0.0)).isCloseTo(0.3, within(1e-12));
        assertThat(counts.cdf(1.5)).isCloseTo(0.7, within(1e-12));
        assertThat(counts.cdf(3.0)).isEqualTo(1.0);
        assertThat(counts.cdf(10.0)).isEqualTo(1.0);
    }

    @Test
    void cdfAtLargestValueMatchesCumulativeProbabilities() {
        double[] cumulative = counts.cumulativeProbabilities();
        assertThat(counts.cdf(3.0)).isEqualTo(cumulative[cumulative.length - 1]);
    }

    @Test
    void cumulativeProbabilitiesEndAtOne() {
        assertThat(counts.cumulativeProbabilities())
            .containsExactly(new double[]{0.3, 0.7, 0.9, 1.0}, within(1e-12));
    }

    @Test
    void singletonDistribution() {
        DiscreteScalarModel one = new DiscreteScalarModel(new double[]{4.0}, new double[]{1.0});
        assertThat(one.getMean()).isEqualTo(4.0);
        assertThat(one.getVariance()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void acceptsSumWithinTolerance() {
        DiscreteScalarModel model = new DiscreteScalarModel(
            new double[]{1, 2, 3}, new double[]{0.3333333, 0.3333333, 0.3333334});
        assertThat(model.size()).isEqualTo(3);
    }

    @Test
    void rejectsBadSum() {
        assertThatThrownBy(() -> new DiscreteScalarModel(new double[]{1, 2}, new double[]{0.5, 0.4}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("sum to");
    }

    @Test
    void rejectsLengthMismatch() {
        assertThatThrownBy(() -> new DiscreteScalarModel(new double[]{1, 2, 3}, new double[]{0.5, 0.5}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("has 3 entries but probabilities has 2");
    }

    @Test
    void rejectsEmpty() {
        assertThatThrownBy(() -> new DiscreteScalarModel(new double[0], new double[0]))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("at least one value");
    }

    @Test
    void rejectsNegativeProbability() {
        assertThatThrownBy(() -> new DiscreteScalarModel(new double[]{1, 2}, new double[]{1.2, -0.2}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("probability[1]");
    }

    @Test
    void rejectsUnorderedValues() {
        assertThatThrownBy(() -> new DiscreteScalarModel(new double[]{2, 1}, new double[]{0.5, 0.5}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("strictly ascending");
    }

    @Test
    void testInputArraysAreCopied() {
        double[] values = {0, 1};
        DiscreteScalarModel model = new DiscreteScalarModel(values, new double[]{0.5, 0.5});
        values[1] = 99;
        model.getValues()[0] = -1;
        assertThat(model.getValues()).containsExactly(0.0, 1.0);
    }
}
