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

import io.nosqlbench.powersim.model.FixedEffectSet;
import io.nosqlbench.powersim.simulate.RandomStreams;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * Drives the replications of a power run and collects their effect sizes.
 *
 * <h2>Architecture</h2>
 *
 * <pre>{@code
 * ┌────────────────────────────────────────────────────────────────┐
 * │ PHASE 1: derive one jump()ed random stream per replication     │
 * └────────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌────────────────────────────────────────────────────────────────┐
 * │ PHASE 2: run replications (calling thread or ForkJoinPool)     │
 * │   design → simulate → degrade → estimate PSE → effect sizes    │
 * └────────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌────────────────────────────────────────────────────────────────┐
 * │ PHASE 3: assemble results in replication order                 │
 * └────────────────────────────────────────────────────────────────┘
 * }</pre>
 *
 * <p>Because each replication's stream is fixed before any work starts,
 * results depend only on the fixed effects and the configuration,
 * including the seed, and not on the parallelism.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * PowerRunConfig config = PowerRunConfig.builder()
 *     .subjects(10).trialsPerCell(24)
 *     .excludedProportion(0.08)
 *     .replications(500).seed(42L).parallelism(8)
 *     .build();
 *
 * PowerAnalysisResult result = new PowerEngine(fixef, config).run();
 * Map<String, List<Double>> fByEffect = result.cohensFByEffect();
 * }</pre>
 */
public final class PowerEngine {

    private static final Logger logger = LogManager.getLogger(PowerEngine.class);

    private final PowerRunConfig config;
    private final ReplicationRunner runner;

    public PowerEngine(FixedEffectSet fixef, PowerRunConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.runner = new ReplicationRunner(fixef, config);
    }

    /**
     * Runs a power analysis with a time-based seed on the calling thread.
     *
     * @param fixef the fixed effects of the pilot model
     * @param subjects subjects per replication
     * @param trialsPerCell replicate trials per design cell
     * @param excludedProportion share of responses marked missing
     * @param replications number of replications
     * @return the accumulated result
     */
    public static PowerAnalysisResult run(FixedEffectSet fixef, int subjects, int trialsPerCell,
                                          double excludedProportion, int replications) {
        PowerRunConfig config = PowerRunConfig.builder()
            .subjects(subjects)
            .trialsPerCell(trialsPerCell)
            .excludedProportion(excludedProportion)
            .replications(replications)
            .build();
        return new PowerEngine(fixef, config).run();
    }

    /**
     * Runs every replication and accumulates the results.
     *
     * @return the result, with replications in index order
     */
    public PowerAnalysisResult run() {
        logger.info("Starting power run: {}", config);
        long startTime = System.currentTimeMillis();

        List<UniformRandomProvider> streams = RandomStreams.replicationStreams(config.seed(), config.replications());
        ReplicationResult[] results = config.parallelism() == 1
            ? runSequential(streams)
            : runParallel(streams);

        PowerAnalysisResult result = new PowerAnalysisResult(config, Arrays.asList(results));
        long elapsed = System.currentTimeMillis() - startTime;

        logger.info("Power run finished in {} ms: {} replications, {} affected, {} unanalyzable, {} invalid PSE fits, {} subjects excluded",
            elapsed, results.length, result.affectedReplications(), result.unanalyzableReplications(),
            result.invalidPseCount(), result.excludedSubjectCount());
        if (result.unanalyzableReplications() > 0) {
            logger.warn("{} of {} replications had too few complete subjects for an ANOVA",
                result.unanalyzableReplications(), results.length);
        }
        return result;
    }

    private ReplicationResult[] runSequential(List<UniformRandomProvider> streams) {
        ReplicationResult[] results = new ReplicationResult[streams.size()];
        for (int i = 0; i < streams.size(); i++) {
            results[i] = runner.run(i, streams.get(i));
            if (logger.isDebugEnabled()) {
                logger.debug("Replication {}/{} done", i + 1, streams.size());
            }
        }
        return results;
    }

    private ReplicationResult[] runParallel(List<UniformRandomProvider> streams) {
        ForkJoinPool pool = new ForkJoinPool(config.parallelism());
        try {
            List<Callable<ReplicationResult>> tasks = new ArrayList<>(streams.size());
            for (int i = 0; i < streams.size(); i++) {
                int index = i;
                UniformRandomProvider stream = streams.get(i);
                tasks.add(() -> runner.run(index, stream));
            }

            List<Future<ReplicationResult>> futures = pool.invokeAll(tasks);
            ReplicationResult[] results = new ReplicationResult[futures.size()];
            for (int i = 0; i < futures.size(); i++) {
                results[i] = futures.get(i).get();
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Power run interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Replication failed", cause);
        } finally {
            pool.shutdown();
        }
    }
}
