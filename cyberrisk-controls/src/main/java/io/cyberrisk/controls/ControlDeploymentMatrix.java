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
import io.cyberrisk.api.ParameterChecks;

import java.util.Arrays;

/**
 * Historical observations of deployed security controls and their outcomes.
 *
 * <pre>{@code
 *              period 1  period 2  ...  period n
 *   control 1      2         3              3
 *   control 2      1         2              2
 *   ...
 *   safeguard     85        78             80
 *   maintenance   45        52             50
 * }</pre>
 *
 * <p>Every sequence has the same length of at least two periods. Counts are
 * non-negative and every value is finite.
 */
public final class ControlDeploymentMatrix {

    private final double[][] deploymentCounts;
    private final double[] safeguardEffects;
    private final double[] maintenanceLoads;

    /**
     * @param deploymentCounts counts indexed [control][period]
     * @param safeguardEffects the observed safeguard effect of each period
     * @param maintenanceLoads the observed maintenance load of each period
     * @throws InvalidParameterException if any invariant fails
     */
    public ControlDeploymentMatrix(double[][] deploymentCounts, double[] safeguardEffects, double[] maintenanceLoads) {
        ParameterChecks.notNull("deployment counts", deploymentCounts);
        ParameterChecks.notNull("safeguard effects", safeguardEffects);
        ParameterChecks.notNull("maintenance loads", maintenanceLoads);
        if (deploymentCounts.length == 0) {
            throw new InvalidParameterException("at least one control type is required");
        }
        int periods = safeguardEffects.length;
        if (periods < 2) {
            throw new InvalidParameterException("at least 2 observation periods are required, got " + periods);
        }
        ParameterChecks.sameLength("safeguard effects", periods, "maintenance loads", maintenanceLoads.length);

        this.deploymentCounts = new double[deploymentCounts.length][];
        for (int i = 0; i < deploymentCounts.length; i++) {
            ParameterChecks.notNull("deployment counts of control " + i, deploymentCounts[i]);
            ParameterChecks.sameLength("deployment counts of control " + i, deploymentCounts[i].length,
                "safeguard effects", periods);
            for (int t = 0; t < periods; t++) {
                ParameterChecks.nonNegative("deployment count [" + i + "][" + t + "]", deploymentCounts[i][t]);
            }
            this.deploymentCounts[i] = deploymentCounts[i].clone();
        }
        for (int t = 0; t < periods; t++) {
            ParameterChecks.finite("safeguard effect [" + t + "]", safeguardEffects[t]);
            ParameterChecks.finite("maintenance load [" + t + "]", maintenanceLoads[t]);
        }
        this.safeguardEffects = safeguardEffects.clone();
        this.maintenanceLoads = maintenanceLoads.clone();
    }

    /**
     * Convenience factory for integer deployment histories.
     */
    public static ControlDeploymentMatrix ofCounts(int[][] deploymentCounts, double[] safeguardEffects,
                                                   double[] maintenanceLoads) {
        ParameterChecks.notNull("deployment counts", deploymentCounts);
        double[][] counts = new double[deploymentCounts.length][];
        for (int i = 0; i < deploymentCounts.length; i++) {
            ParameterChecks.notNull("deployment counts of control " + i, deploymentCounts[i]);
            counts[i] = Arrays.stream(deploymentCounts[i]).asDoubleStream().toArray();
        }
        return new ControlDeploymentMatrix(counts, safeguardEffects, maintenanceLoads);
    }

    public int controlCount() {
        return deploymentCounts.length;
    }

    public int periodCount() {
        return safeguardEffects.length;
    }

    public double count(int control, int period) {
        return deploymentCounts[control][period];
    }

    /**
     * @return the regression design matrix, indexed [period][control]
     */
    public double[][] designMatrix() {
        double[][] design = new double[periodCount()][controlCount()];
        for (int t = 0; t < periodCount(); t++) {
            for (int i = 0; i < controlCount(); i++) {
                design[t][i] = deploymentCounts[i][t];
            }
        }
        return design;
    }

    public double[] safeguardEffects() {
        return safeguardEffects.clone();
    }

    public double[] maintenanceLoads() {
        return maintenanceLoads.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlDeploymentMatrix)) return false;
        ControlDeploymentMatrix that = (ControlDeploymentMatrix) o;
        return Arrays.deepEquals(deploymentCounts, that.deploymentCounts)
            && Arrays.equals(safeguardEffects, that.safeguardEffects)
            && Arrays.equals(maintenanceLoads, that.maintenanceLoads);
    }

    @Override
    public int hashCode() {
        int result = Arrays.deepHashCode(deploymentCounts);
        result = 31 * result + Arrays.hashCode(safeguardEffects);
        return 31 * result + Arrays.hashCode(maintenanceLoads);
    }

    @Override
    public String toString() {
        return "ControlDeploymentMatrix{" +
            "controls=" + controlCount() +
            ", periods=" + periodCount() +
            '}';
    }
}
