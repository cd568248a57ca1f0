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
 * Effects reported by the repeated-measures analysis, with the row names of
 * the output table.
 */
public enum AnovaEffect {

    /** The between-subject grouping term: grand mean tested against subject variability. */
    INTERCEPT("(Intercept)"),
    COLOR("color"),
    CONTRAST("contrast"),
    COLOR_X_CONTRAST("color:contrast");

    private final String effectName;

    AnovaEffect(String effectName) {
        this.effectName = effectName;
    }

    public String effectName() {
        return effectName;
    }
}
