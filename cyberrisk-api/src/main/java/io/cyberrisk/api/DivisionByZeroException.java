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
 * Thrown when a well-formed probability query has no defined answer,
 * such as conditioning on an event of probability zero.
 */
public class DivisionByZeroException extends CyberRiskException {

    private final String quantity;

    /**
     * @param quantity the name of the denominator that evaluated to zero, e.g. {@code "P(T=positive)"}
     * @param message a description of the query that could not be answered
     */
    public DivisionByZeroException(String quantity, String message) {
        super(message);
        this.quantity = quantity;
    }

    /// @return the name of the zero-valued denominator
    public String getQuantity() {
        return quantity;
    }
}
