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

import io.cyberrisk.api.InvalidParameterException;
import io.cyberrisk.api.ParameterChecks;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Chooses which candidate controls to fund under a fixed budget.
///
/// This is the linear relaxation of a 0/1 knapsack:
///
/// ```text
///   maximize    Σ effectiveness_i · x_i
///   subject to  Σ cost_i · x_i ≤ budget,   0 ≤ x_i ≤ 1
/// ```
///
/// At most one control is selected fractionally.
public final class BudgetAllocator {

    private static final Logger logger = LogManager.getLogger(BudgetAllocator.class);

    private final OptimizerOptions options;

    public BudgetAllocator() {
        this(OptimizerOptions.defaults());
    }

    public BudgetAllocator(OptimizerOptions options) {
        this.options = ParameterChecks.notNull("optimizer options", options);
    }

    /// @param budget the available budget; must be positive
    /// @param costs the non-negative cost of each candidate control
    /// @param effectiveness the effectiveness score of each candidate control
    /// @return the allocation
    public BudgetAllocation allocate(double budget, double[] costs, double[] effectiveness) {
        ParameterChecks.positive("budget", budget);
        ParameterChecks.notNull("control costs", costs);
        ParameterChecks.notNull("control effectiveness", effectiveness);
        if (costs.length == 0) {
            throw new InvalidParameterException("at least one candidate control is required");
        }
        ParameterChecks.sameLength("control costs", costs.length, "control effectiveness", effectiveness.length);
        for (int i = 0; i < costs.length; i++) {
            ParameterChecks.nonNegative("control cost [" + i + "]", costs[i]);
            ParameterChecks.finite("control effectiveness [" + i + "]", effectiveness[i]);
        }

        int n = costs.length;
        List<LinearConstraint> constraints = new ArrayList<>();
        constraints.add(new LinearConstraint(costs, Relationship.LEQ, budget));
        for (int i = 0; i < n; i++) {
            double[] unit = new double[n];
            unit[i] = 1.0;
            constraints.add(new LinearConstraint(unit, Relationship.LEQ, 1.0));
        }

        PointValuePair solution;
        try {
            solution = new SimplexSolver(options.epsilon(), options.maxUlps(), options.cutOff()).optimize(
                new MaxIter(options.maxIterations()),
                new LinearObjectiveFunction(effectiveness, 0.0),
                new LinearConstraintSet(constraints),
                GoalType.MAXIMIZE,
                new NonNegativeConstraint(true));
        } catch (TooManyIterationsException e) {
            throw new IllegalStateException(
                "budget allocation did not converge within " + options.maxIterations() + " iterations", e);
        }

        double[] selection = solution.getPoint();
        double totalCost = 0.0;
        double totalEffectiveness = 0.0;
        for (int i = 0; i < n; i++) {
            selection[i] = Math.min(1.0, Math.max(0.0, selection[i]));
            totalCost += costs[i] * selection[i];
            totalEffectiveness += effectiveness[i] * selection[i];
        }
        BudgetAllocation allocation =
            new BudgetAllocation(selection, totalCost, totalEffectiveness, totalCost / budget * 100.0);
        logger.info("Allocated budget {}: {}", budget, allocation);
        return allocation;
    }
}
