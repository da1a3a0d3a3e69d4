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
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Finds the cheapest set of additional controls that meets a safeguard
/// target without exceeding a maintenance limit.
///
/// # Linear program
///
/// ```text
///   variables    Δ_i ≥ 0                       additional units of control i
///   minimize     Σ cost_i · Δ_i
///   subject to   Σ b_i · Δ_i ≥ target − b0 − Σ b_i · current_i
///                Σ d_i · Δ_i ≤ limit  − d0 − Σ d_i · current_i
///                Δ_i ≤ additionLimit_i         (finite limits only)
/// ```
///
/// Units are continuous. Infeasible, unbounded and iteration-limited
/// programs are reported through [OptimizationResult#status()] and never
/// thrown.
public final class ControlOptimizer {

    private static final Logger logger = LogManager.getLogger(ControlOptimizer.class);

    private final OptimizerOptions options;

    public ControlOptimizer() {
        this(OptimizerOptions.defaults());
    }

    public ControlOptimizer(OptimizerOptions options) {
        this.options = ParameterChecks.notNull("optimizer options", options);
    }

    /// Fits the effectiveness model to the history, then optimizes.
    ///
    /// @throws io.cyberrisk.api.InvalidParameterException if the fit or the optimization spec is invalid
    public OptimizationResult optimize(ControlDeploymentMatrix history, OptimizationSpec spec) {
        ParameterChecks.notNull("deployment history", history);
        ParameterChecks.notNull("optimization spec", spec);
        ParameterChecks.sameLength("history control types", history.controlCount(),
            "optimization spec control types", spec.controlCount());
        EffectivenessCoefficients coefficients =
            new ControlEffectivenessModel(options.regressionOptions()).fit(history);
        return optimize(coefficients, spec);
    }

    /// @param coefficients the effectiveness of each control type
    /// @param spec the costs, limits and targets
    /// @return the result; its status tells whether a deployment was found
    public OptimizationResult optimize(EffectivenessCoefficients coefficients, OptimizationSpec spec) {
        ParameterChecks.notNull("effectiveness coefficients", coefficients);
        ParameterChecks.notNull("optimization spec", spec);
        ParameterChecks.sameLength("effectiveness coefficients", coefficients.controlCount(),
            "optimization spec control types", spec.controlCount());

        int n = spec.controlCount();
        double[] current = spec.current();
        double[] b = coefficients.safeguard();
        double[] d = coefficients.maintenance();
        double safeguardGap = spec.safeguardTarget() - coefficients.safeguardEffect(current);
        double maintenanceHeadroom = spec.maintenanceLimit() - coefficients.maintenanceLoad(current);
        logger.debug("Optimizing {} control types: safeguard gap {}, maintenance headroom {}",
            n, safeguardGap, maintenanceHeadroom);

        List<LinearConstraint> constraints = new ArrayList<>();
        constraints.add(new LinearConstraint(b, Relationship.GEQ, safeguardGap));
        constraints.add(new LinearConstraint(d, Relationship.LEQ, maintenanceHeadroom));
        double[] limits = spec.additionLimits();
        for (int i = 0; i < n; i++) {
            if (!Double.isInfinite(limits[i])) {
                double[] unit = new double[n];
                unit[i] = 1.0;
                constraints.add(new LinearConstraint(unit, Relationship.LEQ, limits[i]));
            }
        }

        SimplexSolver solver = new SimplexSolver(options.epsilon(), options.maxUlps(), options.cutOff());
        PointValuePair solution;
        try {
            solution = solver.optimize(
                new MaxIter(options.maxIterations()),
                new LinearObjectiveFunction(spec.unitCosts(), 0.0),
                new LinearConstraintSet(constraints),
                GoalType.MINIMIZE,
                new NonNegativeConstraint(true));
        } catch (NoFeasibleSolutionException e) {
            logger.warn("No feasible deployment reaches safeguard target {} within maintenance limit {}",
                spec.safeguardTarget(), spec.maintenanceLimit());
            return OptimizationResult.failed(SolverStatus.INFEASIBLE, coefficients);
        } catch (UnboundedSolutionException e) {
            logger.warn("Deployment cost is unbounded below for {}", spec);
            return OptimizationResult.failed(SolverStatus.UNBOUNDED, coefficients);
        } catch (TooManyIterationsException e) {
            logger.warn("Simplex stopped after {} iterations without an optimum", options.maxIterations());
            return OptimizationResult.failed(SolverStatus.ITERATION_LIMIT, coefficients);
        }

        double[] additions = solution.getPoint();
        double[] costs = spec.unitCosts();
        double totalCost = 0.0;
        double[] deployed = new double[n];
        for (int i = 0; i < n; i++) {
            // simplex round-off can leave -0.0 or tiny negatives
            additions[i] = Math.max(0.0, additions[i]);
            totalCost += costs[i] * additions[i];
            deployed[i] = current[i] + additions[i];
        }
        OptimizationResult result = OptimizationResult.optimal(additions, totalCost, coefficients,
            coefficients.safeguardEffect(deployed), coefficients.maintenanceLoad(deployed));
        logger.info("Optimal deployment found: {}", result);
        return result;
    }

    public OptimizerOptions options() {
        return options;
    }
}
