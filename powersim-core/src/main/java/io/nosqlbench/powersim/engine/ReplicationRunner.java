package io.nosqlbench.powersim.engine;

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

import io.nosqlbench.powersim.analyze.EffectSizeAnalysis;
import io.nosqlbench.powersim.analyze.EffectSizeAnalyzer;
import io.nosqlbench.powersim.design.DesignGenerator;
import io.nosqlbench.powersim.estimate.PseEstimationResult;
import io.nosqlbench.powersim.estimate.PseEstimator;
import io.nosqlbench.powersim.model.FixedEffectSet;
import io.nosqlbench.powersim.model.TrialRecord;
import io.nosqlbench.powersim.model.TrialShell;
import io.nosqlbench.powersim.simulate.QualityDegrader;
import io.nosqlbench.powersim.simulate.ResponseSimulator;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.List;
import java.util.Objects;

/**
 * Runs a single replication of the pipeline.
 *
 * <pre>{@code
 * DesignGenerator ──► ResponseSimulator ──► QualityDegrader ──► PseEstimator ──► EffectSizeAnalyzer
 *   shells              records               records'            estimates         effect sizes
 * }</pre>
 *
 * <p>The runner holds only read-only collaborators. All per-replication
 * state lives on the stack of {@link #run}, so one runner can serve many
 * threads as long as each call gets its own random stream.
 */
public final class ReplicationRunner {

    private final FixedEffectSet fixef;
    private final PowerRunConfig config;
    private final DesignGenerator designGenerator = new DesignGenerator();
    private final ResponseSimulator simulator = new ResponseSimulator();
    private final QualityDegrader degrader = new QualityDegrader();
    private final PseEstimator estimator = new PseEstimator();
    private final EffectSizeAnalyzer analyzer = new EffectSizeAnalyzer();

    public ReplicationRunner(FixedEffectSet fixef, PowerRunConfig config) {
        this.fixef = Objects.requireNonNull(fixef, "fixef cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Generates, simulates and degrades one synthetic dataset.
     *
     * @param rng the replication's random stream
     * @return the trial records, in design order
     */
    public List<TrialRecord> simulateTrials(UniformRandomProvider rng) {
        List<TrialShell> shells = designGenerator.generate(config.subjects(), config.trialsPerCell());
        List<TrialRecord> simulated = simulator.simulate(shells, fixef, rng);
        return degrader.degrade(simulated, config.excludedProportion(), rng);
    }

    /**
     * Runs one full replication.
     *
     * @param replication the replication index, for reporting
     * @param rng the replication's random stream
     * @return the replication's effect sizes and diagnostics
     */
    public ReplicationResult run(int replication, UniformRandomProvider rng) {
        List<TrialRecord> trials = simulateTrials(rng);
        int missing = (int) trials.stream().filter(t -> t.response().isMissing()).count();

        PseEstimationResult pse = estimator.estimate(trials);
        EffectSizeAnalysis analysis = analyzer.analyze(pse.estimates());

        return new ReplicationResult(replication, trials.size(), missing,
            pse.estimates().size(), pse.invalidCount(), analysis);
    }
}
