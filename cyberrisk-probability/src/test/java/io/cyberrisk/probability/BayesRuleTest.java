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

package io.cyberrisk.probability;

import io.cyberrisk.api.DivisionByZeroException;
import io.cyberrisk.api.InvalidParameterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class BayesRuleTest {

    @Test
    void testPosterior() {
        // P(disease)=0.01, P(+|disease)=0.9, P(+)=0.9*0.01 + 0.05*0.99
        double evidence = 0.9 * 0.01 + 0.05 * 0.99;
        assertEquals(0.009 / 0.0585, BayesRule.posterior(0.9, 0.01, evidence), 1e-12);
    }

    @Test
    void testConditional() {
        assertEquals(0.25, BayesRule.conditional(0.1, 0.4), 1e-12);
    }

    @Test
    void testClampsRoundingAboveOne() {
        assertEquals(1.0, BayesRule.conditional(0.3000000000000001, 0.3), 0.0);
    }

    @Test
    void testZeroDenominator() {
        assertThrows(DivisionByZeroException.class, () -> BayesRule.posterior(0.5, 0.5, 0.0));
        assertThrows(DivisionByZeroException.class, () -> BayesRule.conditional(0.0, 0.0));
    }

    @Test
    void testRejectsNonProbabilities() {
        assertThrows(InvalidParameterException.class, () -> BayesRule.posterior(1.5, 0.5, 0.5));
        assertThrows(InvalidParameterException.class, () -> BayesRule.conditional(Double.NaN, 0.5));
    }
}
