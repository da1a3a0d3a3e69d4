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

package io.cyberrisk.distributions.model;

import io.cyberrisk.api.InvalidParameterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class TriangularScalarModelTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    void testSymmetricMoments() {
        TriangularScalarModel model = new TriangularScalarModel(0.0, 0.5, 1.0);
        assertEquals(0.5, model.getMean(), TOLERANCE);
        assertEquals(0.5, model.getMedian(), TOLERANCE);
        assertEquals(0.75 / 18.0, model.getVariance(), TOLERANCE);
    }

    @Test
    void testAssetValueMean() {
        TriangularScalarModel model = new TriangularScalarModel(50_000, 200_000, 450_000);
        assertEquals(700_000.0 / 3.0, model.getMean(), 1e-6);
    }

    @Test
    void testCdfBoundariesAndMode() {
        TriangularScalarModel model = new TriangularScalarModel(0.0, 0.5, 1.0);
        assertEquals(0.0, model.cdf(-1.0));
        assertEquals(0.0, model.cdf(0.0));
        assertEquals(0.5, model.cdf(0.5), TOLERANCE);
        assertEquals(1.0, model.cdf(1.0));
        assertEquals(1.0, model.cdf(2.0));
    }

    @Test
    void testQuantileInvertsCdf() {
        TriangularScalarModel model = new TriangularScalarModel(10.0, 40.0, 100.0);
        for (double u = 0.05; u < 1.0; u += 0.1) {
            assertEquals(u, model.cdf(model.quantile(u)), 1e-9, "u=" + u);
        }
        assertEquals(10.0, model.quantile(0.0), TOLERANCE);
        assertEquals(100.0, model.quantile(1.0), TOLERANCE);
    }

    @Test
    void testModeAtBoundIsAccepted() {
        TriangularScalarModel left = new TriangularScalarModel(0.0, 0.0, 1.0);
        TriangularScalarModel right = new TriangularScalarModel(0.0, 1.0, 1.0);
        assertEquals(1.0 / 3.0, left.getMean(), TOLERANCE);
        assertEquals(2.0 / 3.0, right.getMean(), TOLERANCE);
        assertEquals(1.0, right.quantile(0.999999), 1e-3);
    }

    @Test
    void testRejectsModeOutsideRange() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> new TriangularScalarModel(0.0, 2.0, 1.0));
        assertTrue(e.getMessage().contains("min <= mode <= max"), e.getMessage());
    }

    @Test
    void testRejectsDegenerateRange() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> new TriangularScalarModel(5.0, 5.0, 5.0));
        assertTrue(e.getMessage().contains("min < max"), e.getMessage());
    }

    @Test
    void testRejectsNonFinite() {
        assertThrows(InvalidParameterException.class,
            () -> new TriangularScalarModel(Double.NaN, 0.5, 1.0));
    }
}
