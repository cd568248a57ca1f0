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

import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * The enumerated design-matrix descriptor of the response model.
 *
 * <h2>Purpose</h2>
 *
 * <p>Each constant names one fixed-effect term of the pilot model and maps a
 * {@link TrialShell} to the value of that term's design column. The linear
 * predictor of a trial is the coefficient-weighted sum of these columns:
 *
 * <pre>{@code
 * Y = b0
 *   + b1 * color.e + b2 * contrast.e + b3 * size
 *   + b4 * color.e * contrast.e
 *   + b5 * color.e * size + b6 * contrast.e * size
 *   + b7 * color.e * contrast.e * size
 * }</pre>
 *
 * <p>The term set is closed: a coefficient table with a term that is not
 * listed here, or without one that is, cannot be turned into a
 * {@link FixedEffectSet}.
 *
 * @see FixedEffectSet
 */
public enum DesignTerm {

    INTERCEPT("(Intercept)", t -> 1.0),
    COLOR("color.e", TrialShell::colorE),
    CONTRAST("contrast.e", TrialShell::contrastE),
    SIZE("size", TrialShell::size),
    COLOR_X_CONTRAST("color.e:contrast.e", t -> t.colorE() * t.contrastE()),
    COLOR_X_SIZE("color.e:size", t -> t.colorE() * t.size()),
    CONTRAST_X_SIZE("contrast.e:size", t -> t.contrastE() * t.size()),
    COLOR_X_CONTRAST_X_SIZE("color.e:contrast.e:size", t -> t.colorE() * t.contrastE() * t.size());

    private final String termName;
    private final ToDoubleFunction<TrialShell> column;

    DesignTerm(String termName, ToDoubleFunction<TrialShell> column) {
        this.termName = termName;
        this.column = column;
    }

    /**
     * @return the coefficient-table name of this term
     */
    public String termName() {
        return termName;
    }

    /**
     * Evaluates this term's design column for one trial.
     *
     * @param shell the trial
     * @return the column value
     */
    public double columnValue(TrialShell shell) {
        return column.applyAsDouble(shell);
    }

    /**
     * Looks up a term by its coefficient-table name.
     *
     * @param termName the exact term name, e.g. {@code "color.e:size"}
     * @return the matching term, or empty if the name is not part of the model
     */
    public static Optional<DesignTerm> byTermName(String termName) {
        for (DesignTerm term : values()) {
            if (term.termName.equals(termName)) {
                return Optional.of(term);
            }
        }
        return Optional.empty();
    }
}
