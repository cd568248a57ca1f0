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

import org.apache.commons.rng.JumpableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeded random streams for power runs, backed by Apache Commons RNG.
 *
 * <p>All streams use the XoShiRo256++ generator. Per-replication streams
 * are obtained by repeated {@code jump()} calls on a single generator seeded
 * from the run seed. Each jump advances the state by 2<sup>128</sup> steps, so
 * the streams cannot overlap for any realistic replication count, and
 * stream {@code i} depends only on the run seed and {@code i}.
 */
public final class RandomStreams {

    private static final RandomSource SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private RandomStreams() {
    }

    /**
     * Creates a single generator from a seed.
     *
     * @param seed the seed
     * @return a new generator
     */
    public static UniformRandomProvider create(long seed) {
        return SOURCE.create(seed);
    }

    /**
     * Creates {@code count} non-overlapping streams derived from a run seed.
     *
     * @param runSeed the run-level seed
     * @param count the number of streams, one per replication
     * @return the streams, indexed by replication
     */
    public static List<UniformRandomProvider> replicationStreams(long runSeed, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Stream count must be non-negative, got: " + count);
        }
        JumpableUniformRandomProvider base = (JumpableUniformRandomProvider) SOURCE.create(runSeed);
        List<UniformRandomProvider> streams = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            streams.add(base.jump());
        }
        return streams;
    }
}
