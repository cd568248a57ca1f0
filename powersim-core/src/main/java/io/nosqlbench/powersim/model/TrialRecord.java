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
 * A simulated trial: the design shell plus its response.
 *
 * @param shell the design cell this trial belongs to
 * @param response the simulated response, possibly {@link Response#MISSING}
 */
public record TrialRecord(TrialShell shell, Response response) {

    public TrialRecord {
        Objects.requireNonNull(shell, "shell cannot be null");
        Objects.requireNonNull(response, "response cannot be null");
    }

    /**
     * Returns a copy of this record with the response replaced by the missing
     * marker. Covariates are untouched.
     */
    public TrialRecord withMissingResponse() {
        return new TrialRecord(shell, Response.MISSING);
    }

    public int subjectId() {
        return shell.subjectId();
    }

    public ColorLevel color() {
        return shell.color();
    }

    public ContrastLevel contrast() {
        return shell.contrast();
    }

    public int sizeDelta() {
        return shell.sizeDelta();
    }
}
