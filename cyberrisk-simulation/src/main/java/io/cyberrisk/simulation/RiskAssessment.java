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

import java.util.Objects;

/// Classification of a simulated scenario against [RiskBands].
public final class RiskAssessment {

    private final RiskLevel level;
    private final boolean toleranceExceeded;
    private final boolean materialRisk;
    private final boolean significantImpact;

    public RiskAssessment(RiskLevel level, boolean toleranceExceeded, boolean materialRisk,
                          boolean significantImpact) {
        this.level = Objects.requireNonNull(level, "level");
        this.toleranceExceeded = toleranceExceeded;
        this.materialRisk = materialRisk;
        this.significantImpact = significantImpact;
    }

    public RiskLevel level() {
        return level;
    }

    /// @return true if the annual loss expectancy is above the tolerance limit
    public boolean toleranceExceeded() {
        return toleranceExceeded;
    }

    /// @return true if the annual loss expectancy is above the materiality limit
    public boolean materialRisk() {
        return materialRisk;
    }

    /// @return true if the exceedance probability is above the significance limit
    public boolean significantImpact() {
        return significantImpact;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RiskAssessment)) return false;
        RiskAssessment that = (RiskAssessment) o;
        return level == that.level
            && toleranceExceeded == that.toleranceExceeded
            && materialRisk == that.materialRisk
            && significantImpact == that.significantImpact;
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, toleranceExceeded, materialRisk, significantImpact);
    }

    @Override
    public String toString() {
        return "RiskAssessment{" +
            "level=" + level +
            ", toleranceExceeded=" + toleranceExceeded +
            ", materialRisk=" + materialRisk +
            ", significantImpact=" + significantImpact +
            '}';
    }
}
