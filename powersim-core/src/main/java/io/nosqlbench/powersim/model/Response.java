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

/**
 * A binary same/different judgment, or the marker for a response that was
 * excluded from the data.
 */
public enum Response {

    ZERO(0),
    ONE(1),
    MISSING(-1);

    private final int value;

    Response(int value) {
        this.value = value;
    }

    /**
     * @return 0 or 1 for observed responses
     * @throws IllegalStateException for {@link #MISSING}
     */
    public int value() {
        if (this == MISSING) {
            throw new IllegalStateException("Missing response has no value");
        }
        return value;
    }

    public boolean isMissing() {
        return this == MISSING;
    }

    public static Response of(boolean success) {
        return success ? ONE : ZERO;
    }
}
