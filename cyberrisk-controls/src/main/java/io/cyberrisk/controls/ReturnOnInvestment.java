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

import io.cyberrisk.api.ParameterChecks;

import java.util.Objects;

/// Financial return of a control deployment against the loss it avoids.
///
/// ```text
///   total cost      = Σ cost_i · Δ_i
///   annual savings  = ALE · reduction% / 100
///   ROI %           = (savings − cost) / cost · 100      0 when cost is 0
///   payback years   = cost / savings                     +∞ when savings is 0
///   3-year value    = 3 · savings − cost
/// ```
public final class ReturnOnInvestment {

    private final double totalCost;
    private final double annualSavings;
    private final double roiPercentage;
    private final double paybackYears;
    private final double threeYearNetValue;

    private ReturnOnInvestment(double totalCost, double annualSavings, double roiPercentage,
                               double paybackYears, double threeYearNetValue) {
        this.totalCost = totalCost;
        this.annualSavings = annualSavings;
        this.roiPercentage = roiPercentage;
        this.paybackYears = paybackYears;
        this.threeYearNetValue = threeYearNetValue;
    }

    /// @param additions the units added of each control type
    /// @param unitCosts the cost of one unit of each type
    /// @param riskReductionPercent the reduction of annual loss, in percent
    /// @param currentAle the annualized loss expectancy before deployment
    public static ReturnOnInvestment calculate(double[] additions, double[] unitCosts,
                                               double riskReductionPercent, double currentAle) {
        ParameterChecks.notNull("unit costs", unitCosts);
        ParameterChecks.nonNegative("risk reduction percent", riskReductionPercent);
        ParameterChecks.nonNegative("current ALE", currentAle);
        double totalCost = EffectivenessCoefficients.dot("additions", unitCosts, additions);
        double savings = currentAle * (riskReductionPercent / 100.0);
        double roi = totalCost > 0.0 ? (savings - totalCost) / totalCost * 100.0 : 0.0;
        double payback = savings > 0.0 ? totalCost / savings : Double.POSITIVE_INFINITY;
        return new ReturnOnInvestment(totalCost, savings, roi, payback, 3.0 * savings - totalCost);
    }

    public double totalCost() {
        return totalCost;
    }

    public double annualSavings() {
        return annualSavings;
    }

    public double roiPercentage() {
        return roiPercentage;
    }

    public double paybackYears() {
        return paybackYears;
    }

    public double threeYearNetValue() {
        return threeYearNetValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReturnOnInvestment)) return false;
        ReturnOnInvestment that = (ReturnOnInvestment) o;
        return Double.compare(that.totalCost, totalCost) == 0
            && Double.compare(that.annualSavings, annualSavings) == 0
            && Double.compare(that.roiPercentage, roiPercentage) == 0
            && Double.compare(that.paybackYears, paybackYears) == 0
            && Double.compare(that.threeYearNetValue, threeYearNetValue) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalCost, annualSavings, roiPercentage, paybackYears, threeYearNetValue);
    }

    @Override
    public String toString() {
        return "ReturnOnInvestment{" +
            "totalCost=" + totalCost +
            ", annualSavings=" + annualSavings +
            ", roiPercentage=" + roiPercentage +
            ", paybackYears=" + paybackYears +
            ", threeYearNetValue=" + threeYearNetValue +
            '}';
    }
}
