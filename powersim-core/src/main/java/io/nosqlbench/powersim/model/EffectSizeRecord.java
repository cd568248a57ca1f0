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

import java.util.Objects;

/**
 * The F test and effect size of one ANOVA effect in one replication.
 *
 * @param effect the effect
 * @param statistic the F statistic
 * @param dfEffect numerator degrees of freedom
 * @param dfError denominator degrees of freedom
 * @param pValue upper-tail probability of {@code statistic}
 * @param partialEtaSquared partial variance explained, in [0, 1]
 * @param cohensF {@code sqrt(pes / (1 - pes))}
 */
public record EffectSizeRecord(
    AnovaEffect effect,
    double statistic,
    int dfEffect,
    int dfError,
    double pValue,
    double partialEtaSquared,
    double cohensF
) {

    public EffectSizeRecord {
        Objects.requireNonNull(effect, "effect cannot be null");
    }

    public String effectName() {
        return effect.effectName();
    }
}
