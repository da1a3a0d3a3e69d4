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
import java.util.Objects;

/**
 * Inputs of a minimum-cost deployment problem.
 *
 * <pre>{@code
 *   minimize    Σ cost_i · Δ_i
 *   subject to  safeguardEffect(current + Δ)  ≥ safeguardTarget
 *               maintenanceLoad(current + Δ)  ≤ maintenanceLimit
 *               0 ≤ Δ_i ≤ additionLimit_i
 * }</pre>
 *
 * <p>An addition limit of {@code +∞} leaves that control unbounded above.
 * Costs may be negative but must be finite.
 */
public final class OptimizationSpec {

    private final double[] current;
    private final double[] unitCosts;
    private final double[] additionLimits;
    private final double safeguardTarget;
    private final double maintenanceLimit;

    /**
     * @param current the deployed count of each control type; non-negative
     * @param unitCosts the cost of one additional unit of each type
     * @param additionLimits the most units of each type that may be added; non-negative, may be +∞
     * @param safeguardTarget the minimum safeguard effect after deployment
     * @param maintenanceLimit the maximum maintenance load after deployment
     * @throws InvalidParameterException if the arrays disagree in length or hold invalid values
     */
    public OptimizationSpec(double[] current, double[] unitCosts, double[] additionLimits,
                            double safeguardTarget, double maintenanceLimit) {
        ParameterChecks.notNull("current deployment", current);
        ParameterChecks.notNull("unit costs", unitCosts);
        ParameterChecks.notNull("addition limits", additionLimits);
        if (current.length == 0) {
            throw new InvalidParameterException("at least one control type is required");
        }
        ParameterChecks.sameLength("current deployment", current.length, "unit costs", unitCosts.length);
        ParameterChecks.sameLength("current deployment", current.length, "addition limits", additionLimits.length);
        for (int i = 0; i < current.length; i++) {
            ParameterChecks.nonNegative("current deployment [" + i + "]", current[i]);
            ParameterChecks.finite("unit cost [" + i + "]", unitCosts[i]);
            if (!(additionLimits[i] >= 0.0)) {
                throw new InvalidParameterException(
                    "addition limit [" + i + "] must be >= 0 or +Infinity, got " + additionLimits[i]);
            }
        }
        this.current = current.clone();
        this.unitCosts = unitCosts.clone();
        this.additionLimits = additionLimits.clone();
        this.safeguardTarget = ParameterChecks.finite("safeguard target", safeguardTarget);
        this.maintenanceLimit = ParameterChecks.finite("maintenance limit", maintenanceLimit);
    }

    /**
     * Builds a spec from caps on the total count of each type. The addition
     * limit becomes max(0, cap − current).
     *
     * @param totalCaps the largest total count of each type
     */
    public static OptimizationSpec fromTotalCaps(double[] current, double[] unitCosts, double[] totalCaps,
                                                 double safeguardTarget, double maintenanceLimit) {
        ParameterChecks.notNull("current deployment", current);
        ParameterChecks.notNull("total caps", totalCaps);
        ParameterChecks.sameLength("current deployment", current.length, "total caps", totalCaps.length);
        double[] limits = new double[totalCaps.length];
        for (int i = 0; i < totalCaps.length; i++) {
            if (Double.isNaN(totalCaps[i])) {
                throw new InvalidParameterException("total cap [" + i + "] must be a number");
            }
            limits[i] = Math.max(0.0, totalCaps[i] - current[i]);
        }
        return new OptimizationSpec(current, unitCosts, limits, safeguardTarget, maintenanceLimit);
    }

    public int controlCount() {
        return current.length;
    }

    public double[] current() {
        return current.clone();
    }

    public double[] unitCosts() {
        return unitCosts.clone();
    }

    public double[] additionLimits() {
        return additionLimits.clone();
    }

    public double safeguardTarget() {
        return safeguardTarget;
    }

    public double maintenanceLimit() {
        return maintenanceLimit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptimizationSpec)) return false;
        OptimizationSpec that = (OptimizationSpec) o;
        return Double.compare(that.safeguardTarget, safeguardTarget) == 0
            && Double.compare(that.maintenanceLimit, maintenanceLimit) == 0
            && Arrays.equals(current, that.current)
            && Arrays.equals(unitCosts, that.unitCosts)
            && Arrays.equals(additionLimits, that.additionLimits);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(safeguardTarget, maintenanceLimit);
        result = 31 * result + Arrays.hashCode(current);
        result = 31 * result + Arrays.hashCode(unitCosts);
        return 31 * result + Arrays.hashCode(additionLimits);
    }

    @Override
    public String toString() {
        return "OptimizationSpec{" +
            "current=" + Arrays.toString(current) +
            ", unitCosts=" + Arrays.toString(unitCosts) +
            ", additionLimits=" + Arrays.toString(additionLimits) +
            ", safeguardTarget=" + safeguardTarget +
            ", maintenanceLimit=" + maintenanceLimit +
            '}';
    }
}
