package io.nosqlbench.powersim.design;

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
import io.nosqlbench.powersim.model.ColorLevel;
import io.nosqlbench.powersim.model.ContrastLevel;
import io.nosqlbench.powersim.model.TrialShell;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the trial-level skeleton of the factorial design.
 *
 * <h2>Design</h2>
 *
 * <pre>{@code
 * subject (subjects)
 *   └── replicate trial (trialsPerCell)
 *         └── contrast {positive, negative}
 *               └── color {TRUE, FALSE}
 *                     └── magnitude {0, 10, ..., 80}
 *                           └── sign {+, -}     → size_delta = magnitude × sign
 * }</pre>
 *
 * <p>Crossing magnitude 0 with both signs yields two identical
 * {@code size_delta = 0} shells per cell, which doubles the weight of the
 * zero stimulus relative to every other magnitude. The duplicate is kept so
 * that simulated designs match the experiment layout the pilot data came
 * from.
 *
 * <p>Shells are emitted in the nesting order above, so a given
 * (subjects, trialsPerCell) pair always yields the same sequence.
 */
public final class DesignGenerator {

    /** Magnitude step of the size difference. */
    public static final int MAGNITUDE_STEP = 10;

    /** Largest magnitude of the size difference. */
    public static final int MAX_MAGNITUDE = 80;

    private static final int[] SIGNS = {1, -1};

    /**
     * @return the number of shells generated per subject and replicate trial
     */
    public static int shellsPerReplicate() {
        int magnitudes = MAX_MAGNITUDE / MAGNITUDE_STEP + 1;
        return ContrastLevel.values().length * ColorLevel.values().length * magnitudes * SIGNS.length;
    }

    /**
     * Generates the full design.
     *
     * @param subjects number of subjects; must be positive
     * @param trialsPerCell number of replicate trials per cell; must be positive
     * @return the design shells, {@code subjects * trialsPerCell * shellsPerReplicate()} of them
     * @throws ConfigurationException if either count is not positive, or the
     *     design would have more than {@link Integer#MAX_VALUE} shells
     */
    public List<TrialShell> generate(int subjects, int trialsPerCell) {
        if (subjects <= 0) {
            throw new ConfigurationException("Subject count must be positive, got: " + subjects);
        }
        if (trialsPerCell <= 0) {
            throw new ConfigurationException("Trial count must be positive, got: " + trialsPerCell);
        }

        long replicates = (long) subjects * trialsPerCell;
        if (replicates > Integer.MAX_VALUE / shellsPerReplicate()) {
            throw new ConfigurationException("Design too large: " + subjects + " subjects x " + trialsPerCell
                + " trials exceeds " + Integer.MAX_VALUE + " shells");
        }

        List<TrialShell> shells = new ArrayList<>((int) replicates * shellsPerReplicate());
        for (int subject = 1; subject <= subjects; subject++) {
            for (int replicate = 1; replicate <= trialsPerCell; replicate++) {
                for (ContrastLevel contrast : ContrastLevel.values()) {
                    for (ColorLevel color : ColorLevel.values()) {
                        for (int magnitude = 0; magnitude <= MAX_MAGNITUDE; magnitude += MAGNITUDE_STEP) {
                            for (int sign : SIGNS) {
                                shells.add(new TrialShell(subject, replicate, contrast, color, magnitude * sign));
                            }
                        }
                    }
                }
            }
        }
        return shells;
    }
}
