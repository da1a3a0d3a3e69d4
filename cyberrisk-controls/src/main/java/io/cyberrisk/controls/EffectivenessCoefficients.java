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

import io.cyberrisk.api.ParameterChecks;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fitted linear effects of each control type.
 *
 * <pre>{@code
 *   safeguard effect  = b0 + Σ b_i · n_i
 *   maintenance load  = d0 + Σ d_i · n_i
 * }</pre>
 *
 * <p>The intercepts b0 and d0 are zero when the fit has no intercept.
 */
public final class EffectivenessCoefficients {

    private final double[] safeguard;
    private final double[] maintenance;
    private final boolean hasIntercept;
    private final double safeguardIntercept;
    private final double maintenanceIntercept;
    private final double safeguardRSquared;
    private final double maintenanceRSquared;

    /**
     * @param safeguard the per-control safeguard coefficients b_i
     * @param maintenance the per-control maintenance coefficients d_i
     * @param hasIntercept whether the intercepts were fitted
     * @param safeguardIntercept b0, ignored without an intercept
     * @param maintenanceIntercept d0, ignored without an intercept
     * @param safeguardRSquared R² of the safeguard fit, NaN when unknown
     * @param maintenanceRSquared R² of the maintenance fit, NaN when unknown
     */
    public EffectivenessCoefficients(double[] safeguard, double[] maintenance, boolean hasIntercept,
                                     double safeguardIntercept, double maintenanceIntercept,
                                     double safeguardRSquared, double maintenanceRSquared) {
        ParameterChecks.notNull("safeguard coefficients", safeguard);
        ParameterChecks.notNull("maintenance coefficients", maintenance);
        ParameterChecks.sameLength("safeguard coefficients", safeguard.length,
            "maintenance coefficients", maintenance.length);
        for (int i = 0; i < safeguard.length; i++) {
            ParameterChecks.finite("safeguard coefficient [" + i + "]", safeguard[i]);
            ParameterChecks.finite("maintenance coefficient [" + i + "]", maintenance[i]);
        }
        this.safeguard = safeguard.clone();
        this.maintenance = maintenance.clone();
        this.hasIntercept = hasIntercept;
        this.safeguardIntercept = hasIntercept ? ParameterChecks.finite("safeguard intercept", safeguardIntercept) : 0.0;
        this.maintenanceIntercept = hasIntercept ? ParameterChecks.finite("maintenance intercept", maintenanceIntercept) : 0.0;
        this.safeguardRSquared = safeguardRSquared;
        this.maintenanceRSquared = maintenanceRSquared;
    }

    /**
     * Coefficients without intercepts or fit statistics, e.g. supplied by an analyst.
     */
    public static EffectivenessCoefficients of(double[] safeguard, double[] maintenance) {
        return new EffectivenessCoefficients(safeguard, maintenance, false, 0.0, 0.0, Double.NaN, Double.NaN);
    }

    public int controlCount() {
        return safeguard.length;
    }

    /** @return the safeguard effect of a deployment: b0 + Σ b_i · n_i */
    public double safeguardEffect(double[] deployment) {
        return safeguardIntercept + dot("deployment", safeguard, deployment);
    }

    /** @return the maintenance load of a deployment: d0 + Σ d_i · n_i */
    public double maintenanceLoad(double[] deployment) {
        return maintenanceIntercept + dot("deployment", maintenance, deployment);
    }

    static double dot(String name, double[] coefficients, double[] values) {
        ParameterChecks.notNull(name, values);
        ParameterChecks.sameLength(name, values.length, "coefficients", coefficients.length);
        double sum = 0.0;
        for (int i = 0; i < coefficients.length; i++) {
            sum += coefficients[i] * values[i];
        }
        return sum;
    }

    public double[] safeguard() {
        return safeguard.clone();
    }

    public double[] maintenance() {
        return maintenance.clone();
    }

    public boolean hasIntercept() {
        return hasIntercept;
    }

    public double safeguardIntercept() {
        return safeguardIntercept;
    }

    public double maintenanceIntercept() {
        return maintenanceIntercept;
    }

    public double safeguardRSquared() {
        return safeguardRSquared;
    }

    public double maintenanceRSquared() {
        return maintenanceRSquared;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EffectivenessCoefficients)) return false;
        EffectivenessCoefficients that = (EffectivenessCoefficients) o;
        return hasIntercept == that.hasIntercept
            && Double.compare(that.safeguardIntercept, safeguardIntercept) == 0
            && Double.compare(that.maintenanceIntercept, maintenanceIntercept) == 0
            && Double.compare(that.safeguardRSquared, safeguardRSquared) == 0
            && Double.compare(that.maintenanceRSquared, maintenanceRSquared) == 0
            && Arrays.equals(safeguard, that.safeguard)
            && Arrays.equals(maintenance, that.maintenance);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(hasIntercept, safeguardIntercept, maintenanceIntercept);
        result = 31 * result + Arrays.hashCode(safeguard);
        return 31 * result + Arrays.hashCode(maintenance);
    }

    @Override
    public String toString() {
        return "EffectivenessCoefficients{" +
            "safeguard=" + Arrays.toString(safeguard) +
            ", maintenance=" + Arrays.toString(maintenance) +
            (hasIntercept ? ", b0=" + safeguardIntercept + ", d0=" + maintenanceIntercept : "") +
            ", r2=[" + safeguardRSquared + ", " + maintenanceRSquared + "]" +
            '}';
    }
}
