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

import static io.cyberrisk.probability.JointObservationTableTest.demoTable;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ConditionalProbabilityEvaluatorTest {

    private static final double EPS = 1e-12;

    private final ConditionalProbabilityEvaluator evaluator = new ConditionalProbabilityEvaluator();

    /// P(T|X)=0.5 everywhere, P(T|Y=6)=0.4, P(T|Y=7)=0.6, so P(T|Y=8)=44/90.
    private static MarginalDetectionProbabilities consistentMarginals() {
        return MarginalDetectionProbabilities.fromVector(new double[]{0.5, 0.5, 0.5, 0.5, 0.4, 0.6}, 4);
    }

    @Test
    void testCanonicalQueryWithMarginalDetection() {
        ConditionalProbabilities result = evaluator.evaluate(demoTable(), consistentMarginals());

        assertEquals(175.0 / 290.0, result.marginal(), EPS);
        assertEquals(165.0 / 290.0, result.range(), EPS);
        assertEquals(0.5, result.probabilityPositive(), EPS);
        assertEquals(44.0 / 145.0, result.conditional(), EPS);
        assertEquals(ProbabilityQuery.canonical(), result.query());
    }

    @Test
    void testImpliedLastRowConditional() {
        assertEquals(44.0 / 90.0, consistentMarginals().impliedLastRowConditional(demoTable()), EPS);
    }

    @Test
    void testDemoVectorWithImpliedConditionalAboveOne() {
        MarginalDetectionProbabilities demo =
            MarginalDetectionProbabilities.fromVector(new double[]{0.8, 0.75, 0.7, 0.65, 0.6, 0.55}, 4);
        ConditionalProbabilities result = evaluator.evaluate(demoTable(), demo);

        assertEquals(212.75 / 290.0, result.probabilityPositive(), EPS);
        assertEquals(98.0 / 212.75, result.conditional(), EPS);
        assertEquals(98.0 / 90.0, demo.impliedLastRowConditional(demoTable()), EPS);
    }

    @Test
    void testNegativeImpliedJointRejected() {
        MarginalDetectionProbabilities inconsistent =
            MarginalDetectionProbabilities.fromVector(new double[]{0.1, 0.1, 0.1, 0.1, 0.9, 0.9}, 4);
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> evaluator.evaluate(demoTable(), inconsistent));
        assertTrue(e.getMessage().contains("P(T, Y=8)"), e.getMessage());
        assertTrue(e.getMessage().contains("negative"), e.getMessage());
    }

    @Test
    void testUniformCellDetection() {
        CellDetectionProbabilities half = CellDetectionProbabilities.uniform(3, 4, 0.5);
        JointObservationTable table = demoTable();

        assertEquals(0.5, evaluator.probabilityPositive(table, half), EPS);
        assertEquals(90.0 / 290.0, evaluator.conditional(table, half, Axis.Y, 8), EPS);
        assertEquals(100.0 / 290.0, evaluator.conditional(table, half, Axis.X, 3), EPS);
    }

    @Test
    void testDetectionOnlyOnLastRow() {
        CellDetectionProbabilities lastRow = new CellDetectionProbabilities(new double[][]{
            {0, 0, 0, 0},
            {0, 0, 0, 0},
            {1, 1, 1, 1}
        });
        JointObservationTable table = demoTable();

        assertEquals(90.0 / 290.0, evaluator.probabilityPositive(table, lastRow), EPS);
        assertEquals(1.0, evaluator.conditional(table, lastRow, Axis.Y, 8), EPS);
        assertEquals(0.0, evaluator.conditional(table, lastRow, Axis.Y, 6), EPS);
        assertEquals(15.0 / 90.0, evaluator.conditional(table, lastRow, Axis.X, 2), EPS);
    }

    @Test
    void testZeroDetectionIsDivisionByZero() {
        CellDetectionProbabilities never = CellDetectionProbabilities.uniform(3, 4, 0.0);
        DivisionByZeroException e = assertThrows(DivisionByZeroException.class,
            () -> evaluator.evaluate(demoTable(), never));
        assertEquals("P(T=positive)", e.getQuantity());
    }

    @Test
    void testMarginalsOverFullPartitionSumToOne() {
        JointObservationTable table = demoTable();
        double xSum = 0.0;
        for (int x : table.xLevels()) {
            xSum += evaluator.marginal(table, Axis.X, x);
        }
        double ySum = 0.0;
        for (int y : table.yLevels()) {
            ySum += evaluator.marginal(table, Axis.Y, y);
        }
        assertEquals(1.0, xSum, EPS);
        assertEquals(1.0, ySum, EPS);
        assertEquals(1.0, evaluator.marginalRange(table, Axis.X, 2, 5), EPS);
    }

    @Test
    void testPosteriorsOverFullPartitionSumToOne() {
        JointObservationTable table = demoTable();
        DetectionModel detection = consistentMarginals();
        double sum = 0.0;
        for (int y : table.yLevels()) {
            double p = evaluator.conditional(table, detection, Axis.Y, y);
            assertTrue(p >= 0.0 && p <= 1.0);
            sum += p;
        }
        assertEquals(1.0, sum, EPS);
    }

    @Test
    void testJointAndMarginal() {
        JointObservationTable table = demoTable();
        assertEquals(40.0 / 290.0, evaluator.joint(table, 3, 7), EPS);
        assertEquals(105.0 / 290.0, evaluator.marginal(table, Axis.Y, 7), EPS);
        assertEquals(45.0 / 290.0, evaluator.marginal(table, Axis.X, 5), EPS);
    }

    @Test
    void testSumRange() {
        JointObservationTable table = demoTable();
        assertEquals(165.0 / 290.0, evaluator.sumRange(table, Long.MIN_VALUE, 10), EPS);
        // X+Y = 13 only at (5, 8)
        assertEquals(20.0 / 290.0, evaluator.sumRange(table, 13, 13), EPS);
        assertEquals(0.0, evaluator.sumRange(table, 100, 200), EPS);
        assertEquals(1.0, evaluator.sumRange(table, 8, 13), EPS);
    }

    @Test
    void testCustomQuery() {
        ProbabilityQuery query = ProbabilityQuery.builder()
            .marginal(Axis.Y, 7)
            .sumBetween(9, 10)
            .conditionOn(Axis.X, 3)
            .build();
        ConditionalProbabilities result =
            evaluator.evaluate(demoTable(), CellDetectionProbabilities.uniform(3, 4, 0.5), query);

        assertEquals(105.0 / 290.0, result.marginal(), EPS);
        // (2,7) (3,6) (2,8) (3,7) (4,6) = 30 + 35 + 15 + 40 + 20
        assertEquals(140.0 / 290.0, result.range(), EPS);
        assertEquals(100.0 / 290.0, result.conditional(), EPS);
    }

    @Test
    void testUnknownQueryLevelRejected() {
        ProbabilityQuery query = ProbabilityQuery.builder()
            .marginal(Axis.X, 3, 4)
            .sumAtMost(10)
            .conditionOn(Axis.Y, 9)
            .build();
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> evaluator.evaluate(demoTable(), consistentMarginals(), query));
        assertTrue(e.getMessage().contains("Y=9"));
    }

    @Test
    void testDetectionShapeMismatchRejected() {
        CellDetectionProbabilities wrongShape = CellDetectionProbabilities.uniform(2, 4, 0.5);
        assertThrows(InvalidParameterException.class, () -> evaluator.evaluate(demoTable(), wrongShape));

        MarginalDetectionProbabilities tooFew =
            MarginalDetectionProbabilities.fromVector(new double[]{0.5, 0.5, 0.5, 0.4, 0.6}, 3);
        assertThrows(InvalidParameterException.class, () -> evaluator.evaluate(demoTable(), tooFew));
    }

    @Test
    void testOutOfRangeDetectionRejected() {
        assertThrows(InvalidParameterException.class,
            () -> CellDetectionProbabilities.uniform(3, 4, 1.2));
        assertThrows(InvalidParameterException.class,
            () -> MarginalDetectionProbabilities.fromVector(new double[]{0.5, -0.1, 0.5, 0.5, 0.4, 0.6}, 4));
    }

    @Test
    void testSummary() {
        JointDistributionSummary summary = evaluator.summarize(demoTable());
        assertArrayEquals(new long[]{95, 105, 90}, summary.rowCounts());
        assertArrayEquals(new long[]{70, 100, 75, 45}, summary.columnCounts());
        assertEquals(290, summary.total());
        assertEquals(95.0 / 290.0, summary.rowProbabilities()[0], EPS);
        assertEquals(45.0 / 290.0, summary.columnProbabilities()[3], EPS);
        assertEquals(25.0 / 290.0, summary.jointProbabilities()[0][0], EPS);
    }
}
