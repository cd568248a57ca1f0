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

import io.nosqlbench.powersim.ConfigurationException;

/**
 * Validated parameters of a power run.
 *
 * @param subjects number of simulated subjects per replication
 * @param trialsPerCell replicate trials per design cell
 * @param excludedProportion share of responses marked missing, in [0, 1]
 * @param replications number of replications
 * @param seed run-level seed; replication streams are derived from it
 * @param parallelism number of worker threads; 1 runs on the calling thread
 * @param alpha significance level used for the empirical power summary
 */
public record PowerRunConfig(
    int subjects,
    int trialsPerCell,
    double excludedProportion,
    int replications,
    long seed,
    int parallelism,
    double alpha
) {

    public static final int DEFAULT_SUBJECTS = 10;
    public static final int DEFAULT_TRIALS_PER_CELL = 24;
    public static final int DEFAULT_REPLICATIONS = 100;
    public static final double DEFAULT_ALPHA = 0.05;

    public PowerRunConfig {
        if (subjects <= 0) {
            throw new ConfigurationException("subjects must be positive, got: " + subjects);
        }
        if (trialsPerCell <= 0) {
            throw new ConfigurationException("trialsPerCell must be positive, got: " + trialsPerCell);
        }
        if (!(excludedProportion >= 0.0 && excludedProportion <= 1.0)) {
            throw new ConfigurationException("excludedProportion must be in [0, 1], got: " + excludedProportion);
        }
        if (replications <= 0) {
            throw new ConfigurationException("replications must be positive, got: " + replications);
        }
        if (parallelism <= 0) {
            throw new ConfigurationException("parallelism must be positive, got: " + parallelism);
        }
        if (!(alpha > 0.0 && alpha < 1.0)) {
            throw new ConfigurationException("alpha must be in (0, 1), got: " + alpha);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("subjects=%d trials=%d excluded=%.4f replications=%d seed=%d parallelism=%d alpha=%.3f",
            subjects, trialsPerCell, excludedProportion, replications, seed, parallelism, alpha);
    }

    public static final class Builder {
        private int subjects = DEFAULT_SUBJECTS;
        private int trialsPerCell = DEFAULT_TRIALS_PER_CELL;
        private double excludedProportion = 0.0;
        private int replications = DEFAULT_REPLICATIONS;
        private long seed = System.currentTimeMillis();
        private int parallelism = 1;
        private double alpha = DEFAULT_ALPHA;

        private Builder() {
        }

        public Builder subjects(int subjects) {
            this.subjects = subjects;
            return this;
        }

        public Builder trialsPerCell(int trialsPerCell) {
            this.trialsPerCell = trialsPerCell;
            return this;
        }

        public Builder excludedProportion(double excludedProportion) {
            this.excludedProportion = excludedProportion;
            return this;
        }

        public Builder replications(int replications) {
            this.replications = replications;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder alpha(double alpha) {
            this.alpha = alpha;
            return this;
        }

        /**
         * @return the validated configuration
         * @throws ConfigurationException if any parameter is out of range
         */
        public PowerRunConfig build() {
            return new PowerRunConfig(subjects, trialsPerCell, excludedProportion, replications, seed, parallelism, alpha);
        }
    }
}
