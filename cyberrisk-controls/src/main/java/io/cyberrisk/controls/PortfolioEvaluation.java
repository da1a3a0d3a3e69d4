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

import java.util.Objects;

/**
 * Safeguard effect and maintenance load of one deployment under fitted coefficients.
 */
public final class PortfolioEvaluation {

    private final double safeguardEffect;
    private final double maintenanceLoad;

    private PortfolioEvaluation(double safeguardEffect, double maintenanceLoad) {
        this.safeguardEffect = safeguardEffect;
        this.maintenanceLoad = maintenanceLoad;
    }

    /**
     * @param coefficients the fitted effects
     * @param deployment the count of each control type
     * @return the evaluation
     */
    public static PortfolioEvaluation of(EffectivenessCoefficients coefficients, double[] deployment) {
        ParameterChecks.notNull("effectiveness coefficients", coefficients);
        return new PortfolioEvaluation(coefficients.safeguardEffect(deployment),
            coefficients.maintenanceLoad(deployment));
    }

    public double safeguardEffect() {
        return safeguardEffect;
    }

    public double maintenanceLoad() {
        return maintenanceLoad;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PortfolioEvaluation)) return false;
        PortfolioEvaluation that = (PortfolioEvaluation) o;
        return Double.compare(that.safeguardEffect, safeguardEffect) == 0
            && Double.compare(that.maintenanceLoad, maintenanceLoad) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(safeguardEffect, maintenanceLoad);
    }

    @Override
    public String toString() {
        return "PortfolioEvaluation{safeguardEffect=" + safeguardEffect + ", maintenanceLoad=" + maintenanceLoad + '}';
    }
}
