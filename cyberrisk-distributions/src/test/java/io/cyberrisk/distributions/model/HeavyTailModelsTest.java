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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/// Closed-form checks for the log-normal and Pareto loss magnitude models.
@Tag("unit")
class HeavyTailModelsTest {

    @Test
    void testLogNormalMoments() {
        LogNormalScalarModel model = new LogNormalScalarModel(9.0, 1.0);
        assertEquals(Math.exp(9.5), model.getMean(), 1e-6);
        assertEquals(Math.exp(9.0), model.getMedian(), 1e-9);
        assertEquals((Math.E - 1.0) * Math.exp(19.0), model.getVariance(), 1e-3 * model.getVariance());
    }

    @Test
    void testLogNormalCdf() {
        LogNormalScalarModel model = new LogNormalScalarModel(9.0, 1.0);
        assertEquals(0.0, model.cdf(0.0));
        assertEquals(0.0, model.cdf(-5.0));
        assertEquals(0.5, model.cdf(Math.exp(9.0)), 1e-7);
        assertEquals(0.8413447, model.cdf(Math.exp(10.0)), 1e-6);
    }

    @ParameterizedTest
    @CsvSource({"0.0, 0.0", "0.0, -1.0", "0.0, NaN", "Infinity, 1.0"})
    void testLogNormalRejects(double mu, double sigma) {
        assertThrows(InvalidParameterException.class, () -> new LogNormalScalarModel(mu, sigma));
    }

    @Test
    void testParetoMoments() {
        ParetoScalarModel model = new ParetoScalarModel(5000.0, 2.5);
        assertEquals(5000.0 * 2.5 / 1.5, model.getMean(), 1e-9);
        assertEquals(5000.0 * 5000.0 * 2.5 / (1.5 * 1.5 * 0.5), model.getVariance(), 1e-3);
    }

    @Test
    void testParetoUndefinedMomentsAreInfinite() {
        assertEquals(Double.POSITIVE_INFINITY, new ParetoScalarModel(1.0, 1.0).getMean());
        assertEquals(Double.POSITIVE_INFINITY, new ParetoScalarModel(1.0, 0.5).getMean());
        assertEquals(Double.POSITIVE_INFINITY, new ParetoScalarModel(1.0, 2.0).getVariance());
        assertTrue(Double.isFinite(new ParetoScalarModel(1.0, 2.0).getMean()));
    }

    @Test
    void testParetoCdfAndQuantile() {
        ParetoScalarModel model = new ParetoScalarModel(100.0, 2.0);
        assertEquals(0.0, model.cdf(100.0));
        assertEquals(0.75, model.cdf(200.0), 1e-12);
        assertEquals(100.0, model.quantile(0.0), 1e-12);
        assertEquals(200.0, model.quantile(0.75), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({"0.0, 1.0", "-1.0, 1.0", "1.0, 0.0", "1.0, -2.0", "NaN, 1.0"})
    void testParetoRejects(double scale, double shape) {
        assertThrows(InvalidParameterException.class, () -> new ParetoScalarModel(scale, shape));
    }
}
