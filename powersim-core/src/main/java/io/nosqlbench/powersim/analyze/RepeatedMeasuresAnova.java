package io.nosqlbench.powersim.analyze;

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

import io.nosqlbench.powersim.model.AnovaEffect;
import org.apache.commons.math3.distribution.FDistribution;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Two-factor fully within-subject analysis of variance.
 *
 * <h2>Decomposition</h2>
 *
 * <p>For {@code n} subjects, factor A (color) with {@code a} levels and
 * factor B (contrast) with {@code b} levels, each effect is tested against
 * its own subject interaction term. No sphericity correction is applied.
 *
 * <pre>{@code
 * effect        SS                                   error term      df
 * ------------  -----------------------------------  --------------  -------------------------
 * (Intercept)   n·a·b·M²                             S               1,  n-1
 * A             n·b·Σ(Ā_i - M)²                      A×S             a-1, (a-1)(n-1)
 * B             n·a·Σ(B̄_j - M)²                      B×S             b-1, (b-1)(n-1)
 * A×B           n·ΣΣ(AB_ij - Ā_i - B̄_j + M)²         A×B×S           (a-1)(b-1), (a-1)(b-1)(n-1)
 * }</pre>
 *
 * <p>For each effect the result carries {@code F = (SS/df) / (SSerr/dfErr)},
 * its upper-tail p-value, and the partial variance explained
 * {@code SS / (SS + SSerr)}.
 */
public final class RepeatedMeasuresAnova {

    /**
     * One row of the ANOVA table.
     *
     * @param effect the effect
     * @param sumOfSquares effect sum of squares
     * @param dfEffect effect degrees of freedom
     * @param errorSumOfSquares error-term sum of squares
     * @param dfError error degrees of freedom
     * @param fStatistic the F ratio
     * @param pValue upper-tail probability of the F ratio
     * @param partialEtaSquared {@code SS / (SS + SSerr)}
     */
    public record AnovaRow(
        AnovaEffect effect,
        double sumOfSquares,
        int dfEffect,
        double errorSumOfSquares,
        int dfError,
        double fStatistic,
        double pValue,
        double partialEtaSquared
    ) {
    }

    /**
     * Runs the decomposition.
     *
     * @param cells {@code cells[subject][a][b]}, complete and rectangular, at least two subjects
     * @return one row per {@link AnovaEffect}
     */
    public Map<AnovaEffect, AnovaRow> analyze(double[][][] cells) {
        Objects.requireNonNull(cells, "cells cannot be null");
        int n = cells.length;
        if (n < 2) {
            throw new IllegalArgumentException("At least two subjects are required, got: " + n);
        }
        int a = cells[0].length;
        int b = a > 0 ? cells[0][0].length : 0;
        if (a < 2 || b < 2) {
            throw new IllegalArgumentException("Both factors need at least two levels, got: " + a + "x" + b);
        }
        for (double[][] subject : cells) {
            if (subject.length != a) {
                throw new IllegalArgumentException("Ragged cell array");
            }
            for (double[] row : subject) {
                if (row.length != b) {
                    throw new IllegalArgumentException("Ragged cell array");
                }
            }
        }

        double grand = 0;
        double[] subjectMean = new double[n];
        double[] aMean = new double[a];
        double[] bMean = new double[b];
        double[][] abMean = new double[a][b];
        double[][] saMean = new double[n][a];
        double[][] sbMean = new double[n][b];

        for (int s = 0; s < n; s++) {
            for (int i = 0; i < a; i++) {
                for (int j = 0; j < b; j++) {
                    double y = cells[s][i][j];
                    grand += y;
                    subjectMean[s] += y;
                    aMean[i] += y;
                    bMean[j] += y;
                    abMean[i][j] += y;
                    saMean[s][i] += y;
                    sbMean[s][j] += y;
                }
            }
        }
        grand /= (double) n * a * b;
        for (int s = 0; s < n; s++) {
            subjectMean[s] /= a * b;
            for (int i = 0; i < a; i++) saMean[s][i] /= b;
            for (int j = 0; j < b; j++) sbMean[s][j] /= a;
        }
        for (int i = 0; i < a; i++) {
            aMean[i] /= (double) n * b;
            for (int j = 0; j < b; j++) abMean[i][j] /= n;
        }
        for (int j = 0; j < b; j++) bMean[j] /= (double) n * a;

        double ssIntercept = (double) n * a * b * grand * grand;
        double ssSubjects = 0;
        for (int s = 0; s < n; s++) {
            ssSubjects += square(subjectMean[s] - grand);
        }
        ssSubjects *= a * b;

        double ssA = 0;
        for (int i = 0; i < a; i++) ssA += square(aMean[i] - grand);
        ssA *= (double) n * b;

        double ssB = 0;
        for (int j = 0; j < b; j++) ssB += square(bMean[j] - grand);
        ssB *= (double) n * a;

        double ssAB = 0;
        for (int i = 0; i < a; i++) {
            for (int j = 0; j < b; j++) {
                ssAB += square(abMean[i][j] - aMean[i] - bMean[j] + grand);
            }
        }
        ssAB *= n;

        double ssAS = 0, ssBS = 0, ssABS = 0;
        for (int s = 0; s < n; s++) {
            for (int i = 0; i < a; i++) {
                ssAS += square(saMean[s][i] - subjectMean[s] - aMean[i] + grand);
            }
            for (int j = 0; j < b; j++) {
                ssBS += square(sbMean[s][j] - subjectMean[s] - bMean[j] + grand);
            }
            for (int i = 0; i < a; i++) {
                for (int j = 0; j < b; j++) {
                    ssABS += square(cells[s][i][j] - saMean[s][i] - sbMean[s][j] - abMean[i][j]
                        + subjectMean[s] + aMean[i] + bMean[j] - grand);
                }
            }
        }
        ssAS *= b;
        ssBS *= a;

        Map<AnovaEffect, AnovaRow> table = new EnumMap<>(AnovaEffect.class);
        table.put(AnovaEffect.INTERCEPT, row(AnovaEffect.INTERCEPT, ssIntercept, 1, ssSubjects, n - 1));
        table.put(AnovaEffect.COLOR, row(AnovaEffect.COLOR, ssA, a - 1, ssAS, (a - 1) * (n - 1)));
        table.put(AnovaEffect.CONTRAST, row(AnovaEffect.CONTRAST, ssB, b - 1, ssBS, (b - 1) * (n - 1)));
        table.put(AnovaEffect.COLOR_X_CONTRAST,
            row(AnovaEffect.COLOR_X_CONTRAST, ssAB, (a - 1) * (b - 1), ssABS, (a - 1) * (b - 1) * (n - 1)));
        return table;
    }

    private static AnovaRow row(AnovaEffect effect, double ss, int df, double ssError, int dfError) {
        double f = (ss / df) / (ssError / dfError);
        double pValue;
        if (Double.isNaN(f)) {
            pValue = Double.NaN;
        } else if (Double.isInfinite(f)) {
            pValue = 0.0;
        } else {
            pValue = 1.0 - new FDistribution(null, df, dfError).cumulativeProbability(f);
        }
        double pes = ss / (ss + ssError);
        return new AnovaRow(effect, ss, df, ssError, dfError, f, pValue, pes);
    }

    private static double square(double v) {
        return v * v;
    }
}
