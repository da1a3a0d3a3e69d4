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

import io.cyberrisk.api.InvalidParameterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class JointObservationTableTest {

    static final long[][] DEMO_COUNTS = {
        {25, 35, 20, 15},
        {30, 40, 25, 10},
        {15, 25, 30, 20}
    };

    static JointObservationTable demoTable() {
        return JointObservationTable.canonical(DEMO_COUNTS, 290);
    }

    @Test
    void testMarginalCounts() {
        JointObservationTable table = demoTable();
        assertThat(table.rows()).isEqualTo(3);
        assertThat(table.columns()).isEqualTo(4);
        assertThat(table.rowCount(0)).isEqualTo(95);
        assertThat(table.rowCount(1)).isEqualTo(105);
        assertThat(table.rowCount(2)).isEqualTo(90);
        assertThat(table.columnCount(0)).isEqualTo(70);
        assertThat(table.columnCount(1)).isEqualTo(100);
        assertThat(table.columnCount(2)).isEqualTo(75);
        assertThat(table.columnCount(3)).isEqualTo(45);
        assertThat(table.marginalCount(Axis.X, 1)).isEqualTo(100);
        assertThat(table.marginalCount(Axis.Y, 2)).isEqualTo(90);
    }

    @Test
    void testLevelLookup() {
        JointObservationTable table = demoTable();
        assertThat(table.indexOf(Axis.X, 4)).isEqualTo(2);
        assertThat(table.indexOf(Axis.Y, 8)).isEqualTo(2);
        assertThat(table.indexOf(Axis.X, 9)).isEqualTo(-1);
        assertThatThrownBy(() -> table.requireIndexOf(Axis.X, 9))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("X=9 is not a level");
    }

    @Test
    void testInputIsCopied() {
        long[][] counts = {{1, 2}, {3, 4}};
        JointObservationTable table = JointObservationTable.of(counts, new int[]{0, 1}, new int[]{0, 1});
        counts[0][0] = 100;
        assertThat(table.count(0, 0)).isEqualTo(1);
        assertThat(table.total()).isEqualTo(10);
    }

    @Test
    void testRejectsNegativeEntry() {
        long[][] counts = {{25, -35, 20, 15}, {30, 40, 25, 10}, {15, 25, 30, 20}};
        assertThatThrownBy(() -> JointObservationTable.canonical(counts, 220))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("[0][1] must be non-negative");
    }

    @Test
    void testRejectsWrongTotal() {
        assertThatThrownBy(() -> JointObservationTable.canonical(DEMO_COUNTS, 300))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("total N=300 does not match the sum of table entries 290");
    }

    @Test
    void testRejectsEmptyTable() {
        long[][] zeros = new long[3][4];
        assertThatThrownBy(() -> JointObservationTable.canonical(zeros, 0))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("must be > 0");
    }

    @Test
    void testRejectsRaggedRows() {
        long[][] ragged = {{25, 35, 20, 15}, {30, 40, 25}, {15, 25, 30, 20}};
        assertThatThrownBy(() -> JointObservationTable.canonical(ragged, 280))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("row 1");
    }

    @Test
    void testRejectsLevelShapeMismatch() {
        assertThatThrownBy(() -> new JointObservationTable(DEMO_COUNTS, new int[]{2, 3, 4}, new int[]{6, 7, 8}, 290))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("X levels has 3 entries");
    }

    @Test
    void testRejectsUnorderedLevels() {
        assertThatThrownBy(() -> new JointObservationTable(DEMO_COUNTS, new int[]{2, 4, 3, 5}, new int[]{6, 7, 8}, 290))
            .isInstanceOf(InvalidParameterException.class)
            .hasMessageContaining("strictly ascending");
    }
}
