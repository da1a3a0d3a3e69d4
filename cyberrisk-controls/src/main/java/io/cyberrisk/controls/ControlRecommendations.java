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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Turns an optimal deployment into a ranked list of recommendations.
public final class ControlRecommendations {

    /// Additions at or below this many units are not recommended.
    public static final double MINIMUM_ADDITION = 0.01;

    private ControlRecommendations() {
    }

    /// Recommendations with default names "Control Type 1", "Control Type 2", ...
    public static List<ControlRecommendation> generate(double[] current, double[] additions) {
        ParameterChecks.notNull("current deployment", current);
        List<String> names = new ArrayList<>(current.length);
        for (int i = 0; i < current.length; i++) {
            names.add("Control Type " + (i + 1));
        }
        return generate(current, additions, names);
    }

    /// @param current the deployed count of each control type
    /// @param additions the units to add of each type
    /// @param controlNames the display name of each type
    /// @return recommendations for every addition above [#MINIMUM_ADDITION], largest first
    public static List<ControlRecommendation> generate(double[] current, double[] additions,
                                                       List<String> controlNames) {
        ParameterChecks.notNull("current deployment", current);
        ParameterChecks.notNull("additions", additions);
        ParameterChecks.notNull("control names", controlNames);
        ParameterChecks.sameLength("current deployment", current.length, "additions", additions.length);
        ParameterChecks.sameLength("current deployment", current.length, "control names", controlNames.size());

        List<ControlRecommendation> recommendations = new ArrayList<>();
        for (int i = 0; i < current.length; i++) {
            if (additions[i] > MINIMUM_ADDITION) {
                double rounded = Math.round(additions[i] * 100.0) / 100.0;
                recommendations.add(new ControlRecommendation(controlNames.get(i), current[i], rounded,
                    current[i] + rounded, Priority.forAddition(additions[i])));
            }
        }
        recommendations.sort(Comparator.comparingDouble(ControlRecommendation::recommendedAdditional).reversed());
        return recommendations;
    }
}
