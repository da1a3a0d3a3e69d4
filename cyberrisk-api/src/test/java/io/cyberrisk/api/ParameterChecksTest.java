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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ParameterChecksTest {

    @Test
    void positiveRejectsZeroNegativeNanAndInfinity() {
        assertEquals(2.5, ParameterChecks.positive("shape", 2.5));
        assertThrows(InvalidParameterException.class, () -> ParameterChecks.positive("shape", 0.0));
        assertThrows(InvalidParameterException.class, () -> ParameterChecks.positive("shape", -1.0));
        assertThrows(InvalidParameterException.class, () -> ParameterChecks.positive("shape", Double.NaN));
        assertThrows(InvalidParameterException.class,
            () -> ParameterChecks.positive("shape", Double.POSITIVE_INFINITY));
    }

    @Test
    void messageNamesParameterAndValue() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> ParameterChecks.probability("P(T|X=2)", 1.2));
        assertTrue(e.getMessage().contains("P(T|X=2)"), e.getMessage());
        assertTrue(e.getMessage().contains("1.2"), e.getMessage());
    }

    @Test
    void probabilityAcceptsClosedUnitInterval() {
        assertEquals(0.0, ParameterChecks.probability("p", 0.0));
        assertEquals(1.0, ParameterChecks.probability("p", 1.0));
        assertThrows(InvalidParameterException.class, () -> ParameterChecks.probability("p", -0.01));
    }

    @Test
    void sameLengthReportsBothSizes() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> ParameterChecks.sameLength("values", 6, "probabilities", 5));
        assertEquals("values has 6 entries but probabilities has 5", e.getMessage());
    }

    @Test
    void nonNegativeAndFinite() {
        assertEquals(0.0, ParameterChecks.nonNegative("count", 0.0));
        assertThrows(InvalidParameterException.class, () -> ParameterChecks.nonNegative("count", -0.5));
        assertThrows(InvalidParameterException.class, () -> ParameterChecks.finite("x", Double.NaN));
        assertThrows(InvalidParameterException.class, () -> ParameterChecks.notNull("table", null));
    }
}
