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

package io.cyberrisk.api;

/**
 * Invariant checks that throw {@link InvalidParameterException} with a message
 * naming the parameter and the value that failed.
 */
public final class ParameterChecks {

    private ParameterChecks() {
        // Utility class
    }

    public static double finite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException(name + " must be finite, got " + value);
        }
        return value;
    }

    public static double positive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(name + " must be > 0 and finite, got " + value);
        }
        return value;
    }

    public static double nonNegative(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(name + " must be >= 0 and finite, got " + value);
        }
        return value;
    }

    /**
     * Accepts any value in [0, 1].
     */
    public static double probability(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidParameterException(name + " must lie in [0, 1], got " + value);
        }
        return value;
    }

    public static <T> T notNull(String name, T value) {
        if (value == null) {
            throw new InvalidParameterException(name + " is required");
        }
        return value;
    }

    public static void sameLength(String leftName, int left, String rightName, int right) {
        if (left != right) {
            throw new InvalidParameterException(
                leftName + " has " + left + " entries but " + rightName + " has " + right);
        }
    }
}
