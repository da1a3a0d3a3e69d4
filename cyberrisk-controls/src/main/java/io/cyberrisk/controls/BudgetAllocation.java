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

package io.cyberrisk.controls;

import java.util.Arrays;

/**
 * Selected fraction of each candidate control under a budget.
 */
public final class BudgetAllocation {

    private final double[] selection;
    private final double totalCost;
    private final double totalEffectiveness;
    private final double budgetUtilization;

    BudgetAllocation(double[] selection, double totalCost, double totalEffectiveness, double budgetUtilization) {
        this.selection = selection.clone();
        this.totalCost = totalCost;
        this.totalEffectiveness = totalEffectiveness;
        this.budgetUtilization = budgetUtilization;
    }

    /** @return the selected fraction of each control, each in [0, 1] */
    public double[] selection() {
        return selection.clone();
    }

    public double totalCost() {
        return totalCost;
    }

    public double totalEffectiveness() {
        return totalEffectiveness;
    }

    /** @return total cost as a percentage of the budget */
    public double budgetUtilization() {
        return budgetUtilization;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BudgetAllocation)) return false;
        BudgetAllocation that = (BudgetAllocation) o;
        return Double.compare(that.totalCost, totalCost) == 0
            && Double.compare(that.totalEffectiveness, totalEffectiveness) == 0
            && Double.compare(that.budgetUtilization, budgetUtilization) == 0
            && Arrays.equals(selection, that.selection);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(selection) + Double.hashCode(totalCost);
    }

    @Override
    public String toString() {
        return "BudgetAllocation{" +
            "selection=" + Arrays.toString(selection) +
            ", totalCost=" + totalCost +
            ", totalEffectiveness=" + totalEffectiveness +
            ", budgetUtilization=" + budgetUtilization +
            '}';
    }
}
