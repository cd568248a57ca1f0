package io.nosqlbench.powersim.analyze;

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

import io.nosqlbench.powersim.model.AnovaEffect;
import io.nosqlbench.powersim.model.EffectSizeRecord;

import java.util.List;
import java.util.Optional;

/**
 * Effect sizes of one replication, with the listwise-exclusion diagnostics.
 *
 * @param records one record per effect; empty when not analyzable
 * @param includedSubjects subjects with a complete set of cells
 * @param excludedSubjects subjects removed listwise
 * @param analyzable whether enough subjects remained to run the ANOVA
 */
public record EffectSizeAnalysis(
    List<EffectSizeRecord> records,
    int includedSubjects,
    int excludedSubjects,
    boolean analyzable
) {

    public EffectSizeAnalysis {
        records = List.copyOf(records);
    }

    static EffectSizeAnalysis unanalyzable(int includedSubjects, int excludedSubjects) {
        return new EffectSizeAnalysis(List.of(), includedSubjects, excludedSubjects, false);
    }

    public Optional<EffectSizeRecord> record(AnovaEffect effect) {
        return records.stream().filter(r -> r.effect() == effect).findFirst();
    }
}
