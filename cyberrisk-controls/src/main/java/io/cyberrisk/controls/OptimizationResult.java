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

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of {@link ControlOptimizer}.
 *
 * <p>Only an {@link SolverStatus#OPTIMAL} result carries a deployment: for
 * any other status the additions are empty and the cost and projections are NaN.
 */
public final class OptimizationResult {

    private static final double[] NONE = new double[0];

    private final SolverStatus status;
    private final double[] additions;
    private final double totalCost;
    private final EffectivenessCoefficients coefficients;
    private final double projectedSafeguardEffect;
    private final double projectedMaintenanceLoad;

    private OptimizationResult(SolverStatus status, double[] additions, double totalCost,
                               EffectivenessCoefficients coefficients,
                               double projectedSafeguardEffect, double projectedMaintenanceLoad) {
        this.status = status;
        this.additions = additions;
        this.totalCost = totalCost;
        this.coefficients = coefficients;
        this.projectedSafeguardEffect = projectedSafeguardEffect;
        this.projectedMaintenanceLoad = projectedMaintenanceLoad;
    }

    static OptimizationResult optimal(double[] additions, double totalCost, EffectivenessCoefficients coefficients,
                                      double projectedSafeguardEffect, double projectedMaintenanceLoad) {
        return new OptimizationResult(SolverStatus.OPTIMAL, additions.clone(), totalCost, coefficients,
            projectedSafeguardEffect, projectedMaintenanceLoad);
    }

    static OptimizationResult failed(SolverStatus status, EffectivenessCoefficients coefficients) {
        return new OptimizationResult(status, NONE, Double.NaN, coefficients, Double.NaN, Double.NaN);
    }

    public SolverStatus status() {
        return status;
    }

    public boolean isOptimal() {
        return status == SolverStatus.OPTIMAL;
    }

    /** @return the units of each control type to add; empty unless optimal */
    public double[] additions() {
        return additions.clone();
    }

    public double totalCost() {
        return totalCost;
    }

    public EffectivenessCoefficients coefficients() {
        return coefficients;
    }

    public double projectedSafeguardEffect() {
        return projectedSafeguardEffect;
    }

    public double projectedMaintenanceLoad() {
        return projectedMaintenanceLoad;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptimizationResult)) return false;
        OptimizationResult that = (OptimizationResult) o;
        return status == that.status
            && Double.compare(that.totalCost, totalCost) == 0
            && Double.compare(that.projectedSafeguardEffect, projectedSafeguardEffect) == 0
            && Double.compare(that.projectedMaintenanceLoad, projectedMaintenanceLoad) == 0
            && Arrays.equals(additions, that.additions)
            && Objects.equals(coefficients, that.coefficients);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(status, totalCost, coefficients);
        return 31 * result + Arrays.hashCode(additions);
    }

    @Override
    public String toString() {
        return "OptimizationResult{" +
            "status=" + status +
            ", additions=" + Arrays.toString(additions) +
            ", totalCost=" + totalCost +
            ", projectedSafeguardEffect=" + projectedSafeguardEffect +
            ", projectedMaintenanceLoad=" + projectedMaintenanceLoad +
            '}';
    }
}
