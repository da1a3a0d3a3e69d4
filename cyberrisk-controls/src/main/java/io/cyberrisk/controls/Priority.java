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

/// Urgency of a control recommendation, by the number of units to add.
public enum Priority {
    /// More than two units.
    HIGH,
    /// More than one unit.
    MEDIUM,
    LOW;

    static Priority forAddition(double units) {
        if (units > 2.0) {
            return HIGH;
        }
        if (units > 1.0) {
            return MEDIUM;
        }
        return LOW;
    }
}
