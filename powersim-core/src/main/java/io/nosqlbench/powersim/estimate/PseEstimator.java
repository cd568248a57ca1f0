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
import io.nosqlbench.powersim.estimate.LogisticRegressionFitter.LogisticFit;
import io.nosqlbench.powersim.model.GroupKey;
import io.nosqlbench.powersim.model.PseEstimate;
import io.nosqlbench.powersim.model.TrialRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Estimates one point of subjective equality per (subject, color, contrast)
 * group.
 *
 * <p>Each group is fitted independently with a logistic regression of the
 * response on the raw {@code size_delta}. Missing responses are dropped from
 * the fit. The PSE is the size difference at which the fitted probability is
 * one half:
 *
 * <pre>{@code
 * pse = -b0 / b1
 * }</pre>
 *
 * <p>A group whose fit is degenerate, or whose slope is too close to zero
 * for the ratio to be meaningful, yields an invalid estimate carrying the
 * reason. Every group present in the input produces exactly one estimate,
 * in {@link GroupKey} order.
 */
public final class PseEstimator {

    private static final Logger logger = LogManager.getLogger(PseEstimator.class);

    /** Slopes with a smaller magnitude are treated as zero. */
    public static final double MIN_SLOPE = 1e-10;

    private final LogisticRegressionFitter fitter;

    public PseEstimator() {
        this(new LogisticRegressionFitter());
    }

    public PseEstimator(LogisticRegressionFitter fitter) {
        this.fitter = Objects.requireNonNull(fitter, "fitter cannot be null");
    }

    /**
     * Estimates the PSE of every group in the records.
     *
     * @param records one replication's trial records
     * @return all estimates, valid and invalid
     */
    public PseEstimationResult estimate(List<TrialRecord> records) {
        Objects.requireNonNull(records, "records cannot be null");

        Map<GroupKey, List<TrialRecord>> groups = new TreeMap<>();
        for (TrialRecord record : records) {
            groups.computeIfAbsent(GroupKey.of(record), k -> new ArrayList<>()).add(record);
        }

        List<PseEstimate> estimates = new ArrayList<>(groups.size());
        for (Map.Entry<GroupKey, List<TrialRecord>> group : groups.entrySet()) {
            PseEstimate estimate = estimateGroup(group.getKey(), group.getValue());
            if (!estimate.valid()) {
                logger.debug("Excluding PSE for {}: {}", estimate.key(), estimate.invalidReason());
            }
            estimates.add(estimate);
        }
        return new PseEstimationResult(estimates);
    }

    /**
     * Estimates the PSE of a single group.
     *
     * @param key the group
     * @param records the group's records, including missing responses
     * @return the estimate, invalid if the fit is degenerate
     */
    public PseEstimate estimateGroup(GroupKey key, List<TrialRecord> records) {
        int observed = 0;
        for (TrialRecord record : records) {
            if (!record.response().isMissing()) {
                observed++;
            }
        }

        double[] x = new double[observed];
        int[] y = new int[observed];
        int i = 0;
        for (TrialRecord record : records) {
            if (!record.response().isMissing()) {
                x[i] = record.sizeDelta();
                y[i] = record.response().value();
                i++;
            }
        }

        LogisticFit fit;
        try {
            fit = fitter.fit(x, y);
        } catch (DegenerateFitException e) {
            return PseEstimate.invalid(key, e.getMessage());
        }
        if (!fit.converged() && logger.isDebugEnabled()) {
            logger.debug("Fit for {} stopped at the iteration limit (slope {}); the group is likely separated",
                key, fit.slope());
        }

        if (Math.abs(fit.slope()) < MIN_SLOPE) {
            return PseEstimate.invalid(key, "slope is effectively zero: " + fit.slope());
        }
        double pse = fit.midpoint();
        if (!Double.isFinite(pse)) {
            return PseEstimate.invalid(key, "PSE is not finite: " + pse);
        }
        return PseEstimate.valid(key, pse);
    }
}
