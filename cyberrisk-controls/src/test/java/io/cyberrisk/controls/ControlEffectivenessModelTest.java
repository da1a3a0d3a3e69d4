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

package io.cyberrisk.controls;

import io.cyberrisk.api.InvalidParameterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ControlEffectivenessModelTest {

    static final int[][] HISTORY = {
        {2, 3, 1, 4, 2, 3, 1, 2, 3},
        {1, 2, 3, 2, 1, 2, 3, 1, 2},
        {3, 2, 4, 1, 3, 2, 4, 3, 2},
        {1, 1, 2, 2, 1, 1, 2, 1, 1}
    };
    static final double[] SAFEGUARD = {85, 78, 92, 70, 88, 82, 95, 87, 80};
    static final double[] MAINTENANCE = {45, 52, 38, 65, 42, 48, 35, 44, 50};

    static ControlDeploymentMatrix history() {
        return ControlDeploymentMatrix.ofCounts(HISTORY, SAFEGUARD, MAINTENANCE);
    }

    @Test
    void testNoInterceptCoefficients() {
        EffectivenessCoefficients fit = new ControlEffectivenessModel().fit(history());

        assertThat(fit.hasIntercept()).isFalse();
        assertThat(fit.safeguard()).containsExactly(
            new double[]{105.0 / 8, 7.0 / 8, 62.0 / 3, -59.0 / 24}, within(1e-9));
        assertThat(fit.maintenance()).containsExactly(
            new double[]{527.0 / 40, -19.0 / 8, 67.0 / 15, 151.0 / 24}, within(1e-9));
        assertThat(fit.safeguardIntercept()).isZero();
        assertThat(fit.safeguardRSquared()).isBetween(0.999, 1.0);
        assertThat(fit.maintenanceRSquared()).isBetween(0.999, 1.0);
    }

    @Test
    void testCurrentPortfolio() {
        EffectivenessCoefficients fit = new ControlEffectivenessModel().fit(history());
        PortfolioEvaluation evaluation = PortfolioEvaluation.of(fit, new double[]{2, 1, 3, 1});

        assertThat(evaluation.safeguardEffect()).isCloseTo(260.0 / 3, within(1e-9));
        assertThat(evaluation.maintenanceLoad()).isCloseTo(131.0 / 3, within(1e-9));
    }

    @Test
    void testInterceptOnCollinearHistoryIsRejected() {
        // control 1 + control 3 = 5 in every period, collinear with the intercept column
        ControlEffectivenessModel model =
            new ControlEffectivenessModel(RegressionOptions.builder().includeIntercept(true).build());

        assertThatThrownBy(() -> model.fit(history()))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("safeguard effect fit failed")
            .hasMessageContaining("singular");
    }

    @Test
    void testInterceptOnFullRankHistory() {
        // y = 10 + 2·a + 3·b exactly
        double[][] counts = {
            {1, 2, 3, 4, 5, 1},
            {2, 1, 4, 3, 1, 5}
        };
        double[] y = new double[6];
        double[] z = new double[6];
        for (int t = 0; t < 6; t++) {
            y[t] = 10 + 2 * counts[0][t] + 3 * counts[1][t];
            z[t] = 1 + 0.5 * counts[0][t] - counts[1][t];
        }
        EffectivenessCoefficients fit = new ControlEffectivenessModel(
            RegressionOptions.builder().includeIntercept(true).build())
            .fit(new ControlDeploymentMatrix(counts, y, z));

        assertThat(fit.hasIntercept()).isTrue();
        assertThat(fit.safeguardIntercept()).isCloseTo(10.0, within(1e-9));
        assertThat(fit.safeguard()).containsExactly(new double[]{2.0, 3.0}, within(1e-9));
        assertThat(fit.maintenanceIntercept()).isCloseTo(1.0, within(1e-9));
        assertThat(fit.maintenance()).containsExactly(new double[]{0.5, -1.0}, within(1e-9));
        assertThat(fit.safeguardEffect(new double[]{1, 1})).isCloseTo(15.0, within(1e-9));
    }

    @Test
    void testTooFewPeriods() {
        double[][] counts = {{1, 2, 3, 4}, {2, 1, 4, 3}, {1, 1, 2, 2}, {3, 1, 2, 1}};
        ControlDeploymentMatrix fourPeriods =
            new ControlDeploymentMatrix(counts, new double[]{1, 2, 3, 4}, new double[]{4, 3, 2, 1});

        assertThatThrownBy(() -> new ControlEffectivenessModel().fit(fourPeriods))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("requires at least 5 observation periods, got 4");
    }

    @Test
    void testMatrixValidation() {
        assertThatThrownBy(() -> new ControlDeploymentMatrix(new double[][]{{1}}, new double[]{1}, new double[]{1}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("at least 2 observation periods");
        assertThatThrownBy(() -> new ControlDeploymentMatrix(new double[][]{{1, 2}}, new double[]{1, 2}, new double[]{1}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("maintenance loads");
        assertThatThrownBy(() -> new ControlDeploymentMatrix(new double[][]{{1, -2}}, new double[]{1, 2}, new double[]{1, 2}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("deployment count [0][1]");
        assertThatThrownBy(() -> new ControlDeploymentMatrix(new double[][]{{1, 2, 3}}, new double[]{1, 2}, new double[]{1, 2}))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("deployment counts of control 0");
    }

    @Test
    void testDesignMatrixIsTransposed() {
        double[][] design = history().designMatrix();
        assertThat(design).hasDimensions(9, 4);
        assertThat(design[0]).containsExactly(2, 1, 3, 1);
        assertThat(design[8]).containsExactly(3, 2, 2, 1);
    }
}
