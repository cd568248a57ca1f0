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
 * One trial of the factorial design before a response has been simulated.
 *
 * <p>The centered covariates {@code color.e}, {@code contrast.e} and the
 * rescaled {@code size} are derived from the factor levels rather than
 * stored, so a shell can never hold inconsistent covariates.
 *
 * @param subjectId the 1-based subject identifier
 * @param replicate the 1-based replicate-trial index within the cell
 * @param contrast the contrast level
 * @param color the color level
 * @param sizeDelta the signed stimulus size difference, in {-80, ..., 80}
 */
public record TrialShell(int subjectId, int replicate, ContrastLevel contrast, ColorLevel color, int sizeDelta) {

    /** Divisor converting {@code size_delta} to the model's {@code size} covariate. */
    public static final double SIZE_SCALE = 10.0;

    public double colorE() {
        return color.effectCode();
    }

    public double contrastE() {
        return contrast.effectCode();
    }

    public double size() {
        return sizeDelta / SIZE_SCALE;
    }
}
