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

import io.nosqlbench.powersim.model.EffectSizeRecord;

/**
 * One row of the output table: one effect in one replication.
 *
 * @param replication the replication index
 * @param effect the effect name
 * @param statistic the F statistic
 * @param dfEffect numerator degrees of freedom
 * @param dfError denominator degrees of freedom
 * @param pValue p-value of the F test
 * @param pes partial eta squared
 * @param cohensF Cohen's f
 */
public record EffectSizeRow(
    int replication,
    String effect,
    double statistic,
    int dfEffect,
    int dfError,
    double pValue,
    double pes,
    double cohensF
) {

    public static EffectSizeRow of(int replication, EffectSizeRecord record) {
        return new EffectSizeRow(replication, record.effectName(), record.statistic(), record.dfEffect(),
            record.dfError(), record.pValue(), record.partialEtaSquared(), record.cohensF());
    }
}
