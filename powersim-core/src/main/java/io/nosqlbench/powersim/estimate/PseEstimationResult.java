package io.nosqlbench.powersim.estimate;

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

import io.nosqlbench.powersim.model.PseEstimate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All PSE estimates of one replication.
 *
 * @param estimates one estimate per group, valid and invalid
 */
public record PseEstimationResult(List<PseEstimate> estimates) {

    public PseEstimationResult {
        estimates = List.copyOf(estimates);
    }

    public List<PseEstimate> validEstimates() {
        return estimates.stream().filter(PseEstimate::valid).collect(Collectors.toList());
    }

    public int validCount() {
        return (int) estimates.stream().filter(PseEstimate::valid).count();
    }

    /**
     * @return the number of groups whose fit was degenerate
     */
    public int invalidCount() {
        return estimates.size() - validCount();
    }
}
