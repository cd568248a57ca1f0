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
 * Levels of the within-subject color factor.
 *
 * <p>Each level carries its sum-to-zero effect code. The two codes are
 * symmetric about zero so that the color main-effect coefficient is
 * independent of which level is taken as reference.
 */
public enum ColorLevel {

    TRUE("TRUE", 0.5),
    FALSE("FALSE", -0.5);

    private final String label;
    private final double effectCode;

    ColorLevel(String label, double effectCode) {
        this.label = label;
        this.effectCode = effectCode;
    }

    /**
     * @return the level label as it appears in experiment data
     */
    public String label() {
        return label;
    }

    /**
     * @return the centered covariate value {@code color.e} for this level
     */
    public double effectCode() {
        return effectCode;
    }

    public static ColorLevel of(boolean color) {
        return color ? TRUE : FALSE;
    }
}
