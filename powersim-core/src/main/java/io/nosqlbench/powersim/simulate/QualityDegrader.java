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

import io.nosqlbench.powersim.ConfigurationException;
import io.nosqlbench.powersim.model.TrialRecord;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CombinationSampler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Marks a fixed share of responses as missing, completely at random.
 *
 * <p>Exactly {@code round(proportion * n)} records are selected without
 * replacement, uniformly over all records and independently of their
 * covariates. The selected records keep their covariates; only the response
 * is replaced by the missing marker.
 */
public final class QualityDegrader {

    /**
     * @param records the simulated records
     * @param proportion the share of records to mark missing, in [0, 1]
     * @return the number of records that {@link #degrade} marks missing
     */
    public static int missingCount(int records, double proportion) {
        validateProportion(proportion);
        return (int) Math.round(proportion * records);
    }

    /**
     * Returns a copy of {@code records} with the selected responses missing.
     *
     * @param records the simulated records; not modified
     * @param proportion the share of records to mark missing, in [0, 1]
     * @param rng the random stream
     * @return the degraded records, in the original order
     * @throws ConfigurationException if {@code proportion} is outside [0, 1]
     */
    public List<TrialRecord> degrade(List<TrialRecord> records, double proportion, UniformRandomProvider rng) {
        Objects.requireNonNull(records, "records cannot be null");
        int n = records.size();
        int k = missingCount(n, proportion);

        List<TrialRecord> degraded = new ArrayList<>(records);
        if (k == 0) {
            return degraded;
        }
        if (k == n) {
            degraded.replaceAll(TrialRecord::withMissingResponse);
            return degraded;
        }

        int[] selected = new CombinationSampler(rng, n, k).sample();
        for (int index : selected) {
            degraded.set(index, degraded.get(index).withMissingResponse());
        }
        return degraded;
    }

    private static void validateProportion(double proportion) {
        if (!(proportion >= 0.0 && proportion <= 1.0)) {
            throw new ConfigurationException("Excluded proportion must be in [0, 1], got: " + proportion);
        }
    }
}
