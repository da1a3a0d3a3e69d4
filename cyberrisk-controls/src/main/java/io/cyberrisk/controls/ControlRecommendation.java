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

import java.util.Objects;

/**
 * One human-readable deployment recommendation.
 */
public final class ControlRecommendation {

    private final String controlName;
    private final double currentCount;
    private final double recommendedAdditional;
    private final double newTotal;
    private final Priority priority;

    ControlRecommendation(String controlName, double currentCount, double recommendedAdditional,
                          double newTotal, Priority priority) {
        this.controlName = controlName;
        this.currentCount = currentCount;
        this.recommendedAdditional = recommendedAdditional;
        this.newTotal = newTotal;
        this.priority = priority;
    }

    public String controlName() {
        return controlName;
    }

    public double currentCount() {
        return currentCount;
    }

    /** @return the units to add, rounded to two decimals */
    public double recommendedAdditional() {
        return recommendedAdditional;
    }

    public double newTotal() {
        return newTotal;
    }

    public Priority priority() {
        return priority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlRecommendation)) return false;
        ControlRecommendation that = (ControlRecommendation) o;
        return Double.compare(that.currentCount, currentCount) == 0
            && Double.compare(that.recommendedAdditional, recommendedAdditional) == 0
            && Double.compare(that.newTotal, newTotal) == 0
            && Objects.equals(controlName, that.controlName)
            && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(controlName, currentCount, recommendedAdditional, newTotal, priority);
    }

    @Override
    public String toString() {
        return controlName + ": add " + recommendedAdditional + " (" + currentCount + " -> " + newTotal
            + ", " + priority + ")";
    }
}
