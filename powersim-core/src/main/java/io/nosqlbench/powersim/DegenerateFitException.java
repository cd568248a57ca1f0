package io.nosqlbench.powersim;

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
 * Signals that a per-group logistic fit could not produce a usable estimate.
 *
 * <p>Callers recover locally by marking the affected estimate invalid; the
 * reason is kept for diagnostics.
 */
public class DegenerateFitException extends Exception {

    public DegenerateFitException(String message) {
        super(message);
    }
}
