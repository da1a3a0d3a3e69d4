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
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Fits the linear effect of each control type on safeguard effect and on
/// maintenance load with ordinary least squares.
///
/// The two fits are independent and share one design matrix. Each is solved
/// by QR decomposition; a rank-deficient design is rejected rather than
/// approximated.
///
/// | Option | Fit |
/// |--------|-----|
/// | no intercept (default) | y = Σ b_i · n_i |
/// | intercept | y = b0 + Σ b_i · n_i |
public final class ControlEffectivenessModel {

    private static final Logger logger = LogManager.getLogger(ControlEffectivenessModel.class);

    static final String SAFEGUARD_FIT = "safeguard effect";
    static final String MAINTENANCE_FIT = "maintenance load";

    private final RegressionOptions options;

    public ControlEffectivenessModel() {
        this(RegressionOptions.defaults());
    }

    public ControlEffectivenessModel(RegressionOptions options) {
        this.options = ParameterChecks.notNull("regression options", options);
    }

    /// @param history the deployment history
    /// @return the fitted coefficients of both models
    /// @throws InvalidParameterException if there are too few periods or the design is singular
    public EffectivenessCoefficients fit(ControlDeploymentMatrix history) {
        ParameterChecks.notNull("deployment history", history);
        int controls = history.controlCount();
        int periods = history.periodCount();
        if (periods < controls + 1) {
            throw new InvalidParameterException(
                "fitting " + controls + " control types requires at least " + (controls + 1)
                    + " observation periods, got " + periods);
        }
        double[][] design = history.designMatrix();
        logger.debug("Fitting {} control types over {} periods with {}", controls, periods, options);

        Fit safeguard = fitOne(SAFEGUARD_FIT, history.safeguardEffects(), design);
        Fit maintenance = fitOne(MAINTENANCE_FIT, history.maintenanceLoads(), design);

        EffectivenessCoefficients coefficients = new EffectivenessCoefficients(
            safeguard.coefficients, maintenance.coefficients, options.includeIntercept(),
            safeguard.intercept, maintenance.intercept, safeguard.rSquared, maintenance.rSquared);
        logger.info("Fitted control effectiveness: {}", coefficients);
        return coefficients;
    }

    private Fit fitOne(String name, double[] response, double[][] design) {
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(options.singularityThreshold());
        regression.setNoIntercept(!options.includeIntercept());
        regression.newSampleData(response, design);
        double[] beta;
        double rSquared;
        try {
            beta = regression.estimateRegressionParameters();
            rSquared = regression.calculateRSquared();
        } catch (SingularMatrixException e) {
            throw new InvalidParameterException(
                name + " fit failed: the deployment design matrix is singular"
                    + (options.includeIntercept() ? " with an intercept column" : "")
                    + "; some control counts are linearly dependent", e);
        }

        Fit fit = new Fit();
        if (options.includeIntercept()) {
            fit.intercept = beta[0];
            fit.coefficients = new double[beta.length - 1];
            System.arraycopy(beta, 1, fit.coefficients, 0, fit.coefficients.length);
        } else {
            fit.coefficients = beta;
        }
        fit.rSquared = rSquared;
        logger.debug("{} fit: R^2={}", name, rSquared);
        return fit;
    }

    public RegressionOptions options() {
        return options;
    }

    private static final class Fit {
        double[] coefficients;
        double intercept;
        double rSquared;
    }
}
