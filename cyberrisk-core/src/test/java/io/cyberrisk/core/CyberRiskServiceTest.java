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
import io.cyberrisk.api.DivisionByZeroException;
import io.cyberrisk.api.InvalidParameterException;
import io.cyberrisk.controls.ControlDeploymentMatrix;
import io.cyberrisk.controls.OptimizationResult;
import io.cyberrisk.controls.OptimizationSpec;
import io.cyberrisk.controls.SolverStatus;
import io.cyberrisk.probability.CellDetectionProbabilities;
import io.cyberrisk.probability.ConditionalProbabilities;
import io.cyberrisk.probability.JointObservationTable;
import io.cyberrisk.probability.MarginalDetectionProbabilities;
import io.cyberrisk.simulation.ScenarioParameters;
import io.cyberrisk.simulation.SimulationOptions;
import io.cyberrisk.simulation.SimulationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class CyberRiskServiceTest {

    static final int[] COUNTS = {0, 1, 2, 3, 4, 5};
    static final double[] PROBABILITIES = {0.3, 0.4, 0.2, 0.06, 0.03, 0.01};

    static final long[][] TABLE = {
        {25, 35, 20, 15},
        {30, 40, 25, 10},
        {15, 25, 30, 20}
    };

    static ScenarioParameters scenario(long seed, int iterations) {
        return ScenarioParameters.builder()
            .scenarioName("scenario-" + seed)
            .assetValue(50_000, 150_000, 500_000)
            .occurrences(COUNTS, PROBABILITIES)
            .primaryLoss(9.2, 1.0)
            .secondaryLoss(5000, 2.5)
            .thresholds(100_000, 20_000, 10_000, 30_000)
            .iterations(iterations)
            .seed(seed)
            .build();
    }

    private final CyberRiskService service = new CyberRiskService();
    private ExecutorService executor;

    @BeforeEach
    void startExecutor() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void stopExecutor() {
        executor.shutdownNow();
    }

    @Test
    void testParallelMatchesSequential() {
        List<ScenarioParameters> scenarios = new ArrayList<>();
        for (long seed = 1; seed <= 8; seed++) {
            scenarios.add(scenario(seed, 5_000));
        }

        List<SimulationResult> parallel = service.runSimulations(scenarios, executor);
        assertEquals(scenarios.size(), parallel.size());
        for (int i = 0; i < scenarios.size(); i++) {
            assertEquals(service.runSimulation(scenarios.get(i)), parallel.get(i));
            assertEquals("scenario-" + (i + 1), parallel.get(i).getScenarioName());
        }
    }

    @Test
    void testBatchPropagatesInvalidScenario() {
        ScenarioParameters tooMany = scenario(3, 1_000).toBuilder().iterations(20_000_000).build();
        List<ScenarioParameters> scenarios = List.of(scenario(1, 1_000), tooMany);

        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> service.runSimulations(scenarios, executor));
        assertTrue(e.getMessage().contains("exceeds the configured maximum"), e.getMessage());
    }

    @Test
    void testFailedScenarioCancelsRunningSiblings() throws InterruptedException {
        ScenarioParameters large = scenario(1, SimulationOptions.DEFAULT_MAX_ITERATIONS);
        ScenarioParameters tooMany = scenario(2, 1_000).toBuilder().iterations(20_000_000).build();
        CountDownLatch secondFinished = new CountDownLatch(1);
        AtomicInteger submitted = new AtomicInteger();
        ExecutorService ordered = new ThreadPoolExecutor(2, 2, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>()) {
            @Override
            public void execute(Runnable task) {
                if (submitted.getAndIncrement() == 0) {
                    super.execute(() -> {
                        try {
                            secondFinished.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        task.run();
                    });
                } else {
                    super.execute(() -> {
                        try {
                            task.run();
                        } finally {
                            secondFinished.countDown();
                        }
                    });
                }
            }
        };
        CancellationToken caller = new CancellationToken();
        try {
            InvalidParameterException e = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> assertThrows(InvalidParameterException.class,
                    () -> service.runSimulations(List.of(large, tooMany), ordered, caller)));
            assertTrue(e.getMessage().contains("exceeds the configured maximum"), e.getMessage());
            assertFalse(caller.isCancellationRequested());
        } finally {
            ordered.shutdownNow();
            ordered.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void testBatchCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertThrows(CancelledException.class,
            () -> service.runSimulations(List.of(scenario(1, 1_000)), executor, token));
    }

    @Test
    void testConditionalProbabilities() {
        JointObservationTable table = JointObservationTable.canonical(TABLE, 290);
        ConditionalProbabilities result = service.evaluateConditionalProbabilities(table,
            MarginalDetectionProbabilities.fromVector(new double[]{0.5, 0.5, 0.5, 0.5, 0.4, 0.6}, 4));

        assertEquals(175.0 / 290.0, result.marginal(), 1e-12);
        assertEquals(165.0 / 290.0, result.range(), 1e-12);
        assertEquals(44.0 / 145.0, result.conditional(), 1e-12);

        assertThrows(DivisionByZeroException.class, () -> service.evaluateConditionalProbabilities(table,
            CellDetectionProbabilities.uniform(3, 4, 0.0)));
    }

    @Test
    void testOptimizeControls() {
        ControlDeploymentMatrix history = ControlDeploymentMatrix.ofCounts(new int[][]{
                {2, 3, 1, 4, 2, 3, 1, 2, 3},
                {1, 2, 3, 2, 1, 2, 3, 1, 2},
                {3, 2, 4, 1, 3, 2, 4, 3, 2},
                {1, 1, 2, 2, 1, 1, 2, 1, 1}},
            new double[]{85, 78, 92, 70, 88, 82, 95, 87, 80},
            new double[]{45, 52, 38, 65, 42, 48, 35, 44, 50});
        OptimizationSpec spec = new OptimizationSpec(new double[]{2, 1, 3, 1},
            new double[]{10000, 15000, 8000, 5000}, new double[]{5, 4, 6, 3}, 90, 50);

        OptimizationResult result = service.optimizeControls(history, spec);
        assertEquals(SolverStatus.OPTIMAL, result.status());
        assertEquals(40000.0 / 31.0, result.totalCost(), 1e-6);
    }
}
