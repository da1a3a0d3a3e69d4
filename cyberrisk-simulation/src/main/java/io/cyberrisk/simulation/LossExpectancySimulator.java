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

package io.cyberrisk.simulation;

import io.cyberrisk.api.CancellationToken;
import io.cyberrisk.api.CancelledException;
import io.cyberrisk.api.ParameterChecks;
import io.cyberrisk.distributions.sampling.BatchSamplerFactory;
import io.cyberrisk.distributions.sampling.RandomGenerators;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Monte Carlo estimator of annualized loss expectancy.
///
/// # Algorithm
///
/// ```text
///   seed ──► one generator per run
///              │
///              ├─► asset value AV[n]    ~ Triangular(min, mode, max)
///              ├─► count C[n]           ~ Discrete(counts, probabilities)
///              ├─► primary A[n]         ~ LogNormal(μ, σ)
///              └─► secondary B[n]       ~ Pareto(scale, shape)
///
///   combined[i] = A[i] + B[i]
///   loss[i]     = AV[i] · combined[i] · C[i]
///   ALE         = mean(loss)
/// ```
///
/// The four sampling phases always run in the order shown and each draws
/// all n values before the next starts, so a fixed seed reproduces a run
/// bit for bit.
///
/// # Cancellation
///
/// The token is checked before every phase and before the aggregation
/// steps. A cancelled run throws [CancelledException] and produces nothing.
///
/// # Thread Safety
///
/// Instances hold only immutable options and may be shared. Each call
/// builds its own generator, so concurrent calls never share random state.
public final class LossExpectancySimulator {

    private static final Logger logger = LogManager.getLogger(LossExpectancySimulator.class);

    static final String PHASE_ASSET_VALUE = "asset-value";
    static final String PHASE_OCCURRENCES = "occurrences";
    static final String PHASE_PRIMARY_LOSS = "primary-loss";
    static final String PHASE_SECONDARY_LOSS = "secondary-loss";
    static final String PHASE_AGGREGATION = "aggregation";
    static final String PHASE_PERCENTILES = "percentiles";

    private final SimulationOptions options;

    /// Creates a simulator with [SimulationOptions#defaults()].
    public LossExpectancySimulator() {
        this(SimulationOptions.defaults());
    }

    /// @param options the simulation options
    public LossExpectancySimulator(SimulationOptions options) {
        this.options = ParameterChecks.notNull("simulation options", options);
    }

    public SimulationOptions options() {
        return options;
    }

    /// Runs a simulation that cannot be cancelled.
    ///
    /// @param params the scenario
    /// @return the result
    /// @throws io.cyberrisk.api.InvalidParameterException if the scenario is invalid
    public SimulationResult run(ScenarioParameters params) {
        return run(params, CancellationToken.none());
    }

    /// Runs a simulation.
    ///
    /// @param params the scenario; validated before any sampling
    /// @param token the cancellation signal
    /// @return the result
    /// @throws io.cyberrisk.api.InvalidParameterException if the scenario is invalid
    /// @throws CancelledException if the token was cancelled before completion
    public SimulationResult run(ScenarioParameters params, CancellationToken token) {
        ParameterChecks.notNull("scenario parameters", params);
        ParameterChecks.notNull("cancellation token", token);
        params.validate(options.maxIterations());

        int n = params.getIterations();
        long seed = params.getSeed() != null ? params.getSeed() : RandomGenerators.newSeed();
        UniformRandomProvider rng = RandomGenerators.create(options.algorithm(), seed);
        long startNanos = System.nanoTime();
        logger.debug("Simulating scenario '{}': {} iterations, seed {}, {}",
            params.getScenarioName(), n, seed, options.algorithm());

        try {
            token.checkpoint(PHASE_ASSET_VALUE);
            double[] assetValues = BatchSamplerFactory.forModel(params.getAssetValue(), rng).sample(n);

            token.checkpoint(PHASE_OCCURRENCES);
            double[] counts = BatchSamplerFactory.forModel(params.getOccurrences(), rng).sample(n);

            token.checkpoint(PHASE_PRIMARY_LOSS);
            double[] primary = BatchSamplerFactory.forModel(params.getPrimaryLoss(), rng).sample(n);

            token.checkpoint(PHASE_SECONDARY_LOSS);
            double[] secondary = BatchSamplerFactory.forModel(params.getSecondaryLoss(), rng).sample(n);

            token.checkpoint(PHASE_AGGREGATION);
            logger.debug("Sampling complete after {} ms", elapsedMillis(startNanos));

            double assetThreshold = params.getAssetValueThreshold();
            double exceedanceThreshold = params.getExceedanceThreshold();
            double rangeLower = params.getLossRangeLower();
            double rangeUpper = params.getLossRangeUpper();

            double[] combined = new double[n];
            double[] annualLoss = new double[n];
            long assetAtMost = 0;
            long lossAtLeast = 0;
            long lossWithin = 0;
            for (int i = 0; i < n; i++) {
                combined[i] = primary[i] + secondary[i];
                annualLoss[i] = assetValues[i] * combined[i] * counts[i];
                if (assetValues[i] <= assetThreshold) {
                    assetAtMost++;
                }
                if (combined[i] >= exceedanceThreshold) {
                    lossAtLeast++;
                }
                if (combined[i] >= rangeLower && combined[i] <= rangeUpper) {
                    lossWithin++;
                }
            }

            double probAssetAtMost = assetAtMost / (double) n;
            double probLossAtLeast = lossAtLeast / (double) n;
            double probLossWithin = lossWithin / (double) n;

            AnalyticSummary analytic = AnalyticSummary.of(params, probLossAtLeast);
            double ale = options.lossModel() == LossModel.EXPOSURE_FACTOR
                ? analytic.getClassicalAnnualLoss()
                : StatUtils.mean(annualLoss);

            token.checkpoint(PHASE_PERCENTILES);
            Percentile assetPercentile = PercentileBreakdown.estimator();
            assetPercentile.setData(assetValues);
            double assetMedian = assetPercentile.evaluate(50.0);

            PercentileBreakdown assetBreakdown = null;
            PercentileBreakdown lossBreakdown = null;
            if (options.computePercentiles()) {
                double[] levels = options.percentileLevels();
                assetBreakdown = PercentileBreakdown.of(assetPercentile, levels);
                lossBreakdown = PercentileBreakdown.of(annualLoss, levels);
            }

            SimulationResult result = SimulationResult.builder()
                .scenario(params.getScenarioName(), n, seed, options.lossModel())
                .annualLossExpectancy(ale)
                .assetValue(StatUtils.mean(assetValues), assetMedian)
                .occurrenceMean(StatUtils.mean(counts))
                .combinedLoss(StatUtils.mean(combined), StatUtils.populationVariance(combined))
                .probabilities(probAssetAtMost, probLossAtLeast, probLossWithin)
                .percentiles(assetBreakdown, lossBreakdown)
                .analyticSummary(analytic)
                .riskAssessment(options.riskBands().assess(ale, probLossAtLeast))
                .build();

            logger.info("Scenario '{}' simulated: ALE {} ({}), {} iterations in {} ms",
                params.getScenarioName(), ale, result.getRiskAssessment().level(), n, elapsedMillis(startNanos));
            return result;
        } catch (CancelledException e) {
            logger.debug("Scenario '{}' cancelled at phase '{}' after {} ms",
                params.getScenarioName(), e.getPhase(), elapsedMillis(startNanos));
            throw e;
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
