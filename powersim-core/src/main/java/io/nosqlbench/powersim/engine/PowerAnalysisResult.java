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

import io.nosqlbench.powersim.model.AnovaEffect;
import io.nosqlbench.powersim.model.EffectSizeRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a power run produced.
 *
 * <p>The primary output is {@link #cohensFByEffect()}: for every effect, the
 * sequence of Cohen's f values over the analyzable replications, in
 * replication order. {@link #rows()} flattens the same data into the output
 * table, and the diagnostic counters report how many fits, subjects and
 * replications were dropped along the way.
 *
 * @param config the configuration of the run
 * @param replications all replication results, in index order
 */
public record PowerAnalysisResult(PowerRunConfig config, List<ReplicationResult> replications) {

    public PowerAnalysisResult {
        replications = List.copyOf(replications);
    }

    /**
     * @return effect name to Cohen's f sequence, in {@link AnovaEffect} order
     */
    public Map<String, List<Double>> cohensFByEffect() {
        Map<String, List<Double>> byEffect = new LinkedHashMap<>();
        for (AnovaEffect effect : AnovaEffect.values()) {
            byEffect.put(effect.effectName(), new ArrayList<>());
        }
        for (ReplicationResult replication : replications) {
            for (EffectSizeRecord record : replication.records()) {
                byEffect.get(record.effectName()).add(record.cohensF());
            }
        }
        return byEffect;
    }

    /**
     * @return one row per (replication, effect), in replication order
     */
    public List<EffectSizeRow> rows() {
        List<EffectSizeRow> rows = new ArrayList<>();
        for (ReplicationResult replication : replications) {
            for (EffectSizeRecord record : replication.records()) {
                rows.add(EffectSizeRow.of(replication.replication(), record));
            }
        }
        return rows;
    }

    public Map<AnovaEffect, EffectSizeSummary> summaries() {
        return summaries(config.alpha());
    }

    /**
     * @param alpha significance level for the power estimate
     * @return one summary per effect
     */
    public Map<AnovaEffect, EffectSizeSummary> summaries(double alpha) {
        Map<AnovaEffect, List<EffectSizeRecord>> byEffect = new EnumMap<>(AnovaEffect.class);
        for (AnovaEffect effect : AnovaEffect.values()) {
            byEffect.put(effect, new ArrayList<>());
        }
        for (ReplicationResult replication : replications) {
            for (EffectSizeRecord record : replication.records()) {
                byEffect.get(record.effect()).add(record);
            }
        }
        Map<AnovaEffect, EffectSizeSummary> summaries = new EnumMap<>(AnovaEffect.class);
        byEffect.forEach((effect, records) -> summaries.put(effect, EffectSizeSummary.of(effect, records, alpha)));
        return summaries;
    }

    public int invalidPseCount() {
        return replications.stream().mapToInt(ReplicationResult::invalidPse).sum();
    }

    public int excludedSubjectCount() {
        return replications.stream().mapToInt(ReplicationResult::excludedSubjects).sum();
    }

    public int unanalyzableReplications() {
        return (int) replications.stream().filter(r -> !r.analyzable()).count();
    }

    /**
     * @return replications in which at least one fit or subject was dropped
     */
    public int affectedReplications() {
        return (int) replications.stream().filter(ReplicationResult::affected).count();
    }
}
