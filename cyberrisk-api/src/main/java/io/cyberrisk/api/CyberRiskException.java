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

/// Base type for every failure raised by the cyberrisk engines.
///
/// The engines perform no I/O, so nothing below this type is transient.
/// Callers can catch this single type at their service boundary and map
/// the concrete subtypes to their own responses:
///
/// | Subtype | Meaning |
/// |---------|---------|
/// | [InvalidParameterException] | input violates an invariant, rejected before computing |
/// | [DivisionByZeroException] | well-formed query whose answer is undefined |
/// | [CancelledException] | caller requested cancellation between phases |
public abstract class CyberRiskException extends RuntimeException {

    protected CyberRiskException(String message) {
        super(message);
    }

    protected CyberRiskException(String message, Throwable cause) {
        super(message, cause);
    }
}
