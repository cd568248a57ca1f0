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

import java.util.Comparator;

/**
 * Grouping key of the per-group PSE fits.
 *
 * @param subjectId the subject
 * @param color the color level
 * @param contrast the contrast level
 */
public record GroupKey(int subjectId, ColorLevel color, ContrastLevel contrast) implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
        .comparingInt(GroupKey::subjectId)
        .thenComparing(GroupKey::color)
        .thenComparing(GroupKey::contrast);

    public static GroupKey of(TrialRecord record) {
        return new GroupKey(record.subjectId(), record.color(), record.contrast());
    }

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }
}
