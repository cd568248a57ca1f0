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
import io.nosqlbench.powersim.model.EffectSizeRecord;

import java.util.List;

/**
 * Outcome of one replication.
 *
 * @param replication the replication index
 * @param trials simulated trials
 * @param missingResponses trials whose response was marked missing
 * @param pseGroups (subject, color, contrast) groups fitted
 * @param invalidPse groups whose fit was degenerate
 * @param analysis the effect-size analysis
 */
public record ReplicationResult(
    int replication,
    int trials,
    int missingResponses,
    int pseGroups,
    int invalidPse,
    EffectSizeAnalysis analysis
) {

    public boolean analyzable() {
        return analysis.analyzable();
    }

    public List<EffectSizeRecord> records() {
        return analysis.records();
    }

    public int excludedSubjects() {
        return analysis.excludedSubjects();
    }

    /**
     * @return whether any group fit or subject was dropped in this replication
     */
    public boolean affected() {
        return invalidPse > 0 || analysis.excludedSubjects() > 0 || !analysis.analyzable();
    }
}
