package io.nosqlbench.powersim.model;

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

import io.nosqlbench.powersim.NumericDomainException;

/**
 * The logistic function and its inverse, the logit.
 *
 * <p>{@link #logistic(double)} is evaluated in a form that does not overflow
 * for large negative arguments, so the pair round-trips over the whole open
 * interval (0, 1) to within floating-point tolerance.
 */
public final class LogitLink {

    private LogitLink() {
    }

    /**
     * Computes {@code 1 / (1 + exp(-y))}.
     *
     * @param y the linear predictor
     * @return a probability in [0, 1]
     */
    public static double logistic(double y) {
        if (y >= 0) {
            return 1.0 / (1.0 + Math.exp(-y));
        }
        double e = Math.exp(y);
        return e / (1.0 + e);
    }

    /**
     * Computes {@code log(p / (1 - p))}.
     *
     * @param p a probability strictly between 0 and 1
     * @return the log-odds of {@code p}
     * @throws NumericDomainException if {@code p} is not in (0, 1)
     */
    public static double logit(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new NumericDomainException("logit is undefined for p=" + p);
        }
        return Math.log(p) - Math.log1p(-p);
    }
}
