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

import io.nosqlbench.powersim.ConfigurationException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed coefficient table of the pilot model: one estimate per
 * {@link DesignTerm} plus the standard deviation of the per-subject random
 * intercept.
 *
 * <h2>Construction</h2>
 *
 * <p>Instances are built either from a name-keyed table as produced by the
 * pilot fit ({@link #fromNamedCoefficients(Map)}) or term by term through
 * {@link #builder()}. Both paths require every term to be present exactly
 * once; a missing term, an unknown name or a non-finite value raises
 * {@link ConfigurationException}. There is no implicit zero.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * FixedEffectSet fixef = FixedEffectSet.builder()
 *     .setAll(0.0)
 *     .set(DesignTerm.INTERCEPT, -0.2)
 *     .set(DesignTerm.SIZE, 1.1)
 *     .randomInterceptSd(0.6)
 *     .build();
 *
 * double y = fixef.linearPredictor(shell);
 * }</pre>
 *
 * <p>Instances are immutable and safe to share across replication threads.
 */
public final class FixedEffectSet {

    /** Coefficient-table name of the random-intercept standard deviation. */
    public static final String RANDOM_INTERCEPT_SD = "subject_id.sd";

    private final EnumMap<DesignTerm, Double> coefficients;
    private final double randomInterceptSd;

    private FixedEffectSet(EnumMap<DesignTerm, Double> coefficients, double randomInterceptSd) {
        this.coefficients = coefficients;
        this.randomInterceptSd = randomInterceptSd;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a fixed-effect set from a name-keyed coefficient table.
     *
     * @param named term name to estimate, including {@value #RANDOM_INTERCEPT_SD}
     * @return the validated set
     * @throws ConfigurationException if a term is missing, unknown or not finite
     */
    public static FixedEffectSet fromNamedCoefficients(Map<String, ? extends Number> named) {
        Objects.requireNonNull(named, "coefficient table cannot be null");

        Set<String> unknown = new TreeSet<>();
        Builder builder = builder();
        for (Map.Entry<String, ? extends Number> entry : named.entrySet()) {
            String name = entry.getKey();
            if (entry.getValue() == null) {
                throw new ConfigurationException("Coefficient '" + name + "' has no value");
            }
            double value = entry.getValue().doubleValue();
            if (RANDOM_INTERCEPT_SD.equals(name)) {
                builder.randomInterceptSd(value);
            } else {
                DesignTerm term = DesignTerm.byTermName(name).orElse(null);
                if (term == null) {
                    unknown.add(name);
                } else {
                    builder.set(term, value);
                }
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown coefficient terms: " + unknown);
        }
        return builder.build();
    }

    /**
     * @param term a model term
     * @return the fixed-effect estimate for the term
     */
    public double coefficient(DesignTerm term) {
        return coefficients.get(term);
    }

    /**
     * @return the standard deviation of the per-subject random intercept
     */
    public double randomInterceptSd() {
        return randomInterceptSd;
    }

    /**
     * Computes the fixed part of the linear predictor for one trial.
     * The subject's random intercept is added by the caller.
     *
     * @param shell the trial
     * @return the sum over all terms of coefficient times column value
     */
    public double linearPredictor(TrialShell shell) {
        double y = 0.0;
        for (Map.Entry<DesignTerm, Double> entry : coefficients.entrySet()) {
            y += entry.getValue() * entry.getKey().columnValue(shell);
        }
        return y;
    }

    /**
     * Returns the coefficient table keyed by term name, in design order,
     * with the random-intercept SD last.
     */
    public Map<String, Double> toNamedCoefficients() {
        Map<String, Double> named = new LinkedHashMap<>();
        coefficients.forEach((term, value) -> named.put(term.termName(), value));
        named.put(RANDOM_INTERCEPT_SD, randomInterceptSd);
        return named;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FixedEffectSet)) return false;
        FixedEffectSet that = (FixedEffectSet) o;
        return Double.compare(that.randomInterceptSd, randomInterceptSd) == 0
            && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coefficients, randomInterceptSd);
    }

    @Override
    public String toString() {
        return "FixedEffectSet" + toNamedCoefficients();
    }

    /**
     * Builder that refuses to produce an incomplete coefficient table.
     */
    public static final class Builder {

        private final EnumMap<DesignTerm, Double> coefficients = new EnumMap<>(DesignTerm.class);
        private Double randomInterceptSd;

        private Builder() {
        }

        public Builder set(DesignTerm term, double value) {
            Objects.requireNonNull(term, "term cannot be null");
            if (!Double.isFinite(value)) {
                throw new ConfigurationException("Coefficient '" + term.termName() + "' is not finite: " + value);
            }
            coefficients.put(term, value);
            return this;
        }

        /**
         * Sets every design term to the same value. Individual terms can be
         * overridden afterwards with {@link #set(DesignTerm, double)}.
         */
        public Builder setAll(double value) {
            for (DesignTerm term : DesignTerm.values()) {
                set(term, value);
            }
            return this;
        }

        public Builder randomInterceptSd(double sd) {
            if (!Double.isFinite(sd) || sd < 0) {
                throw new ConfigurationException(
                    "Random-intercept SD '" + RANDOM_INTERCEPT_SD + "' must be finite and non-negative, got: " + sd);
            }
            this.randomInterceptSd = sd;
            return this;
        }

        /**
         * @return the validated set
         * @throws ConfigurationException if any term or the random-intercept SD is unset
         */
        public FixedEffectSet build() {
            Set<String> missing = new TreeSet<>();
            for (DesignTerm term : DesignTerm.values()) {
                if (!coefficients.containsKey(term)) {
                    missing.add(term.termName());
                }
            }
            if (randomInterceptSd == null) {
                missing.add(RANDOM_INTERCEPT_SD);
            }
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Missing coefficient terms: " + missing);
            }
            return new FixedEffectSet(new EnumMap<>(coefficients), randomInterceptSd);
        }
    }
}
