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
 * The point of subjective equality estimated for one (subject, color,
 * contrast) group, or the record of why it could not be estimated.
 *
 * @param key the group
 * @param pse the estimate; {@code NaN} when invalid
 * @param valid whether the estimate may be used downstream
 * @param invalidReason why the estimate is invalid, or {@code null} when valid
 */
public record PseEstimate(GroupKey key, double pse, boolean valid, String invalidReason) {

    public PseEstimate {
        Objects.requireNonNull(key, "key cannot be null");
    }

    public static PseEstimate valid(GroupKey key, double pse) {
        return new PseEstimate(key, pse, true, null);
    }

    public static PseEstimate invalid(GroupKey key, String reason) {
        return new PseEstimate(key, Double.NaN, false, reason);
    }

    public int subjectId() {
        return key.subjectId();
    }

    public ColorLevel color() {
        return key.color();
    }

    public ContrastLevel contrast() {
        return key.contrast();
    }
}
