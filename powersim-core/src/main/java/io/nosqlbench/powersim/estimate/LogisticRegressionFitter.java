package io.nosqlbench.powersim.estimate;

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

import io.nosqlbench.powersim.DegenerateFitException;
import io.nosqlbench.powersim.model.LogitLink;

import java.util.Objects;

/**
 * Fits a single-predictor logistic regression by iteratively reweighted
 * least squares.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 * start:  b0 = logit(mean(y)), b1 = 0
 * repeat:
 *   eta = b0 + b1 * x,  mu = logistic(eta),  w = mu * (1 - mu)
 *   solve  [Σw    Σwx ] [d0]   [Σ(y-mu)  ]
 *          [Σwx   Σwx²] [d1] = [Σ(y-mu)x ]
 *   b += d   (halved while the deviance is not finite)
 * until |dev - devOld| / (|dev| + 0.1) < tolerance
 * }</pre>
 *
 * <p>The convergence rule and the default iteration limit (25) match those
 * of common GLM implementations, so fits on separable data end the same way:
 * with large but finite coefficients. Reaching the iteration limit is not an
 * error; the last iterate is returned with {@link LogisticFit#converged()}
 * false.
 *
 * <h2>Degenerate fits</h2>
 *
 * <p>{@link DegenerateFitException} is thrown when the response has fewer
 * than two distinct values, when the information matrix is singular relative
 * to its diagonal (for example a constant predictor), and when no finite
 * deviance can be reached.
 */
public final class LogisticRegressionFitter {

    public static final int DEFAULT_MAX_ITERATIONS = 25;
    public static final double DEFAULT_TOLERANCE = 1e-8;

    private static final int MAX_STEP_HALVINGS = 30;
    private static final double SINGULARITY_EPSILON = 1e-12;

    private final int maxIterations;
    private final double tolerance;

    public LogisticRegressionFitter() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    /**
     * @param maxIterations the iteration limit; must be positive
     * @param tolerance the relative deviance change that counts as converged
     */
    public LogisticRegressionFitter(int maxIterations, double tolerance) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("tolerance must be positive, got: " + tolerance);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * Result of a fit.
     *
     * @param intercept the intercept estimate
     * @param slope the slope estimate
     * @param iterations the number of IRLS iterations used
     * @param deviance the residual deviance at the solution
     * @param converged false if the iteration limit was reached first
     */
    public record LogisticFit(double intercept, double slope, int iterations, double deviance, boolean converged) {

        /**
         * @return the predictor value at which the fitted probability is 0.5
         */
        public double midpoint() {
            return -intercept / slope;
        }
    }

    /**
     * Fits {@code P(y = 1) = logistic(b0 + b1 * x)}.
     *
     * @param x the predictor values
     * @param y the responses, each 0 or 1
     * @return the fit, converged or at the iteration limit
     * @throws DegenerateFitException if the data cannot support a fit
     */
    public LogisticFit fit(double[] x, int[] y) throws DegenerateFitException {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y differ in length: " + x.length + " != " + y.length);
        }

        int n = x.length;
        int successes = 0;
        for (int v : y) {
            if (v != 0 && v != 1) {
                throw new IllegalArgumentException("responses must be 0 or 1, got: " + v);
            }
            successes += v;
        }
        if (n == 0) {
            throw new DegenerateFitException("no observations");
        }
        if (successes == 0 || successes == n) {
            throw new DegenerateFitException("fewer than 2 distinct response values");
        }

        double b0 = LogitLink.logit((double) successes / n);
        double b1 = 0.0;
        double deviance = deviance(x, y, b0, b1);

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            double g0 = 0, g1 = 0, i00 = 0, i01 = 0, i11 = 0;
            for (int i = 0; i < n; i++) {
                double mu = LogitLink.logistic(b0 + b1 * x[i]);
                double w = mu * (1.0 - mu);
                double r = y[i] - mu;
                g0 += r;
                g1 += r * x[i];
                i00 += w;
                i01 += w * x[i];
                i11 += w * x[i] * x[i];
            }

            double det = i00 * i11 - i01 * i01;
            // relative to the diagonal, since the weights shrink toward 0 on separable data
            if (!(Math.abs(det) > SINGULARITY_EPSILON * i00 * i11)) {
                throw new DegenerateFitException("singular information matrix at iteration " + iteration);
            }
            double d0 = (i11 * g0 - i01 * g1) / det;
            double d1 = (i00 * g1 - i01 * g0) / det;

            double next0 = b0 + d0;
            double next1 = b1 + d1;
            double nextDeviance = deviance(x, y, next0, next1);
            for (int halving = 0; !Double.isFinite(nextDeviance) && halving < MAX_STEP_HALVINGS; halving++) {
                d0 /= 2;
                d1 /= 2;
                next0 = b0 + d0;
                next1 = b1 + d1;
                nextDeviance = deviance(x, y, next0, next1);
            }
            if (!Double.isFinite(nextDeviance)) {
                throw new DegenerateFitException("deviance is not finite at iteration " + iteration);
            }

            boolean converged = Math.abs(nextDeviance - deviance) / (Math.abs(nextDeviance) + 0.1) < tolerance;
            b0 = next0;
            b1 = next1;
            deviance = nextDeviance;
            if (converged) {
                return new LogisticFit(b0, b1, iteration, deviance, true);
            }
        }
        return new LogisticFit(b0, b1, maxIterations, deviance, false);
    }

    private static double deviance(double[] x, int[] y, double b0, double b1) {
        double sum = 0;
        for (int i = 0; i < x.length; i++) {
            double eta = b0 + b1 * x[i];
            // -log(mu) for y=1 is softplus(-eta); -log(1-mu) for y=0 is softplus(eta)
            sum += softplus(y[i] == 1 ? -eta : eta);
        }
        return 2.0 * sum;
    }

    private static double softplus(double z) {
        return z > 0 ? z + Math.log1p(Math.exp(-z)) : Math.log1p(Math.exp(z));
    }
}
