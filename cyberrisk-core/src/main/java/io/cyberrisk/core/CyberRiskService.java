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

package io.cyberrisk.core;

import io.cyberrisk.api.CancellationToken;
import io.cyberrisk.api.CancelledException;
import io.cyberrisk.api.ParameterChecks;
import io.cyberrisk.controls.ControlDeploymentMatrix;
import io.cyberrisk.controls.ControlOptimizer;
import io.cyberrisk.controls.OptimizationResult;
import io.cyberrisk.controls.OptimizationSpec;
import io.cyberrisk.controls.OptimizerOptions;
import io.cyberrisk.probability.ConditionalProbabilities;
import io.cyberrisk.probability.ConditionalProbabilityEvaluator;
import io.cyberrisk.probability.DetectionModel;
import io.cyberrisk.probability.JointObservationTable;
import io.cyberrisk.probability.ProbabilityQuery;
import io.cyberrisk.simulation.LossExpectancySimulator;
import io.cyberrisk.simulation.ScenarioParameters;
import io.cyberrisk.simulation.SimulationOptions;
import io.cyberrisk.simulation.SimulationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/// Entry point to the three cyber-risk engines.
///
/// | Call | Engine |
/// |------|--------|
/// | [#runSimulation(ScenarioParameters)] | Monte Carlo annual loss expectancy |
/// | [#evaluateConditionalProbabilities(JointObservationTable, DetectionModel, ProbabilityQuery)] | two-stage conditional probabilities |
/// | [#optimizeControls(ControlDeploymentMatrix, OptimizationSpec)] | control regression and minimum-cost deployment |
///
/// Every call is synchronous and keeps its state on the calling thread, so
/// one service may be shared. Invalid input fails with
/// [io.cyberrisk.api.InvalidParameterException] before any computation.
public final class CyberRiskService {

    private static final Logger logger = LogManager.getLogger(CyberRiskService.class);

    private final LossExpectancySimulator simulator;
    private final ConditionalProbabilityEvaluator evaluator;
    private final ControlOptimizer optimizer;

    public CyberRiskService() {
        this(SimulationOptions.defaults(), OptimizerOptions.defaults());
    }

    public CyberRiskService(SimulationOptions simulationOptions, OptimizerOptions optimizerOptions) {
        this.simulator = new LossExpectancySimulator(ParameterChecks.notNull("simulation options", simulationOptions));
        this.evaluator = new ConditionalProbabilityEvaluator();
        this.optimizer = new ControlOptimizer(ParameterChecks.notNull("optimizer options", optimizerOptions));
    }

    public SimulationResult runSimulation(ScenarioParameters params) {
        return simulator.run(params);
    }

    /// @throws CancelledException if the token is cancelled before the run completes
    public SimulationResult runSimulation(ScenarioParameters params, CancellationToken token) {
        return simulator.run(params, token);
    }

    /// Runs independent scenarios on the given executor, one task per scenario.
    /// Results are in input order and equal the sequential results for the same seeds.
    ///
    /// @param scenarios the scenarios to run
    /// @param executor the executor that runs them; not shut down by this call
    /// @return one result per scenario
    public List<SimulationResult> runSimulations(List<ScenarioParameters> scenarios, ExecutorService executor) {
        return runSimulations(scenarios, executor, CancellationToken.none());
    }

    /// As [#runSimulations(List, ExecutorService)], sharing one cancellation token across the batch.
    /// The first scenario to fail cancels its siblings at their next checkpoint, and its
    /// exception is the one thrown.
    public List<SimulationResult> runSimulations(List<ScenarioParameters> scenarios, ExecutorService executor,
                                                 CancellationToken token) {
        ParameterChecks.notNull("scenarios", scenarios);
        ParameterChecks.notNull("executor", executor);
        ParameterChecks.notNull("cancellation token", token);
        for (int i = 0; i < scenarios.size(); i++) {
            ParameterChecks.notNull("scenario " + i, scenarios.get(i));
        }
        logger.debug("Submitting {} scenarios", scenarios.size());

        CancellationToken batch = token.newChild();
        AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        List<CompletableFuture<SimulationResult>> futures = new ArrayList<>(scenarios.size());
        for (ScenarioParameters scenario : scenarios) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return simulator.run(scenario, batch);
                } catch (RuntimeException e) {
                    if (firstFailure.compareAndSet(null, e)) {
                        logger.debug("Scenario '{}' failed; cancelling the rest of the batch", scenario.getScenarioName());
                    }
                    batch.cancel();
                    throw e;
                }
            }, executor));
        }
        List<SimulationResult> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<SimulationResult> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            batch.cancel();
            futures.forEach(f -> f.cancel(true));
            RuntimeException failure = firstFailure.get();
            if (failure != null) {
                throw failure;
            }
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        logger.info("Completed {} scenarios", results.size());
        return results;
    }

    /// Evaluates the canonical query: P(3 ≤ X ≤ 4), P(X+Y ≤ 10), P(Y=8 | T).
    public ConditionalProbabilities evaluateConditionalProbabilities(JointObservationTable table,
                                                                     DetectionModel detection) {
        return evaluator.evaluate(table, detection);
    }

    /// @throws io.cyberrisk.api.DivisionByZeroException if P(T = positive) is zero
    public ConditionalProbabilities evaluateConditionalProbabilities(JointObservationTable table,
                                                                     DetectionModel detection,
                                                                     ProbabilityQuery query) {
        return evaluator.evaluate(table, detection, query);
    }

    /// Fits control effectiveness to the history and finds the cheapest deployment.
    /// Infeasible and unbounded programs are reported in the result's status.
    public OptimizationResult optimizeControls(ControlDeploymentMatrix history, OptimizationSpec spec) {
        return optimizer.optimize(history, spec);
    }
}
