package io.nosqlbench.powersim.simulate;

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

import io.nosqlbench.powersim.model.FixedEffectSet;
import io.nosqlbench.powersim.model.LogitLink;
import io.nosqlbench.powersim.model.RandomEffectDraw;
import io.nosqlbench.powersim.model.Response;
import io.nosqlbench.powersim.model.TrialRecord;
import io.nosqlbench.powersim.model.TrialShell;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Samples binary responses from the logistic mixed model.
 *
 * <h2>Model</h2>
 *
 * <p>For a trial of subject {@code s}:
 * <pre>{@code
 * Y = fixef.linearPredictor(trial) + u_s      u_s ~ N(0, sd)
 * p = logistic(Y)
 * response ~ Bernoulli(p)
 * }</pre>
 *
 * <p>The random intercepts {@code u_s} are drawn once per subject, in order
 * of first appearance in the design, before any response is drawn. Given the
 * same stream state the simulator therefore produces the same records.
 */
public final class ResponseSimulator {

    /**
     * Draws one random-intercept offset per subject.
     *
     * @param subjectIds the subjects, in draw order
     * @param sd the random-intercept standard deviation; 0 yields zero offsets
     * @param rng the random stream
     * @return the draws, one per subject id, in the given order
     */
    public List<RandomEffectDraw> drawRandomEffects(List<Integer> subjectIds, double sd, UniformRandomProvider rng) {
        Objects.requireNonNull(subjectIds, "subjectIds cannot be null");
        Objects.requireNonNull(rng, "rng cannot be null");

        List<RandomEffectDraw> draws = new ArrayList<>(subjectIds.size());
        if (sd == 0.0) {
            for (int subjectId : subjectIds) {
                draws.add(new RandomEffectDraw(subjectId, 0.0));
            }
            return draws;
        }

        ContinuousSampler sampler = GaussianSampler.of(ZigguratSampler.NormalizedGaussian.of(rng), 0.0, sd);
        for (int subjectId : subjectIds) {
            draws.add(new RandomEffectDraw(subjectId, sampler.sample()));
        }
        return draws;
    }

    /**
     * Computes the success probability of one trial.
     *
     * @param shell the trial
     * @param fixef the fixed effects
     * @param subjectOffset the subject's random intercept
     * @return {@code logistic(Y)}
     */
    public double probability(TrialShell shell, FixedEffectSet fixef, double subjectOffset) {
        return LogitLink.logistic(fixef.linearPredictor(shell) + subjectOffset);
    }

    /**
     * Draws the response of one trial.
     *
     * @param shell the trial
     * @param fixef the fixed effects
     * @param subjectOffset the subject's random intercept
     * @param rng the random stream
     * @return {@link Response#ONE} with probability {@code logistic(Y)}, otherwise {@link Response#ZERO}
     */
    public Response simulate(TrialShell shell, FixedEffectSet fixef, double subjectOffset, UniformRandomProvider rng) {
        double p = probability(shell, fixef, subjectOffset);
        return Response.of(rng.nextDouble() < p);
    }

    /**
     * Simulates a whole design: draws the subject intercepts, then one
     * response per shell.
     *
     * @param shells the design, as produced by the design generator
     * @param fixef the fixed effects
     * @param rng the random stream
     * @return one record per shell, in design order
     */
    public List<TrialRecord> simulate(List<TrialShell> shells, FixedEffectSet fixef, UniformRandomProvider rng) {
        Objects.requireNonNull(shells, "shells cannot be null");
        Objects.requireNonNull(fixef, "fixef cannot be null");

        Map<Integer, Double> offsets = new LinkedHashMap<>();
        List<Integer> subjectIds = new ArrayList<>();
        for (TrialShell shell : shells) {
            if (offsets.putIfAbsent(shell.subjectId(), 0.0) == null) {
                subjectIds.add(shell.subjectId());
            }
        }
        for (RandomEffectDraw draw : drawRandomEffects(subjectIds, fixef.randomInterceptSd(), rng)) {
            offsets.put(draw.subjectId(), draw.offset());
        }

        List<TrialRecord> records = new ArrayList<>(shells.size());
        for (TrialShell shell : shells) {
            Response response = simulate(shell, fixef, offsets.get(shell.subjectId()), rng);
            records.add(new TrialRecord(shell, response));
        }
        return records;
    }
}
