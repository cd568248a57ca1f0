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
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;

/**
 * Distribution summary of one effect's Cohen's f across replications,
 * with the empirical power of its F test.
 *
 * @param effect the effect
 * @param count analyzable replications contributing to the summary
 * @param meanCohensF mean of Cohen's f
 * @param sdCohensF sample standard deviation of Cohen's f
 * @param medianCohensF median of Cohen's f
 * @param lowerCohensF 2.5th percentile of Cohen's f
 * @param upperCohensF 97.5th percentile of Cohen's f
 * @param power share of replications with {@code p < alpha}
 */
public record EffectSizeSummary(
    AnovaEffect effect,
    int count,
    double meanCohensF,
    double sdCohensF,
    double medianCohensF,
    double lowerCohensF,
    double upperCohensF,
    double power
) {

    /**
     * Summarizes the records of one effect.
     *
     * @param effect the effect
     * @param records that effect's records, one per analyzable replication
     * @param alpha significance level for the power estimate
     * @return the summary; all values NaN when {@code records} is empty
     */
    public static EffectSizeSummary of(AnovaEffect effect, List<EffectSizeRecord> records, double alpha) {
        if (records.isEmpty()) {
            return new EffectSizeSummary(effect, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        int significant = 0;
        for (EffectSizeRecord record : records) {
            if (!Double.isNaN(record.cohensF())) {
                stats.addValue(record.cohensF());
            }
            if (record.pValue() < alpha) {
                significant++;
            }
        }
        return new EffectSizeSummary(
            effect,
            records.size(),
            stats.getMean(),
            stats.getStandardDeviation(),
            stats.getPercentile(50),
            stats.getPercentile(2.5),
            stats.getPercentile(97.5),
            (double) significant / records.size());
    }

    public String effectName() {
        return effect.effectName();
    }
}
