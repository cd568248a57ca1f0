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
 * Levels of the contrast factor, with their sum-to-zero effect codes.
 */
public enum ContrastLevel {

    POSITIVE("positive", 0.5),
    NEGATIVE("negative", -0.5);

    private final String label;
    private final double effectCode;

    ContrastLevel(String label, double effectCode) {
        this.label = label;
        this.effectCode = effectCode;
    }

    public String label() {
        return label;
    }

    /**
     * @return the centered covariate value {@code contrast.e} for this level
     */
    public double effectCode() {
        return effectCode;
    }
}
