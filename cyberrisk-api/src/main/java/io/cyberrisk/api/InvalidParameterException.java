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
 * Thrown when an input violates one of the documented invariants.
 *
 * <p>The message names the invariant that failed and the offending value,
 * for example {@code "occurrence probabilities sum to 0.97, expected 1.0 ± 1e-6"}.
 * This failure is always detected before any computation begins and is
 * never worth retrying with the same input.
 */
public class InvalidParameterException extends CyberRiskException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
