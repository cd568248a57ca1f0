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

import io.nosqlbench.powersim.analyze.RepeatedMeasuresAnova.AnovaRow;
import io.nosqlbench.powersim.model.AnovaEffect;
import io.nosqlbench.powersim.model.ColorLevel;
import io.nosqlbench.powersim.model.ContrastLevel;
import io.nosqlbench.powersim.model.EffectSizeRecord;
import io.nosqlbench.powersim.model.PseEstimate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Turns one replication's PSE estimates into per-effect effect sizes.
 *
 * <h2>Steps</h2>
 *
 * <ol>
 *   <li>Arrange the valid estimates into a subject × color × contrast grid.</li>
 *   <li>Exclude, listwise, every subject missing at least one cell. The
 *       number of excluded subjects is reported, never imputed.</li>
 *   <li>Run the {@link RepeatedMeasuresAnova} on the remaining subjects.</li>
 *   <li>Convert each partial eta squared to Cohen's f.</li>
 * </ol>
 *
 * <p>With fewer than two complete subjects there are no error degrees of
 * freedom; the result is then marked unanalyzable and carries no records.
 */
public final class EffectSizeAnalyzer {

    private static final Logger logger = LogManager.getLogger(EffectSizeAnalyzer.class);

    private static final int COLORS = ColorLevel.values().length;
    private static final int CONTRASTS = ContrastLevel.values().length;

    private final RepeatedMeasuresAnova anova;

    public EffectSizeAnalyzer() {
        this(new RepeatedMeasuresAnova());
    }

    public EffectSizeAnalyzer(RepeatedMeasuresAnova anova) {
        this.anova = Objects.requireNonNull(anova, "anova cannot be null");
    }

    /**
     * Converts partial variance explained to Cohen's f.
     *
     * @param partialEtaSquared a value in [0, 1]
     * @return {@code sqrt(pes / (1 - pes))}; infinite for 1, NaN for NaN
     */
    public static double cohensF(double partialEtaSquared) {
        if (Double.isNaN(partialEtaSquared)) {
            return Double.NaN;
        }
        if (partialEtaSquared >= 1.0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.sqrt(partialEtaSquared / (1.0 - partialEtaSquared));
    }

    /**
     * Analyzes one replication.
     *
     * @param estimates the replication's estimates; invalid ones are treated as missing cells
     * @return the effect sizes and exclusion counts
     * @throws IllegalArgumentException if two valid estimates share a cell
     */
    public EffectSizeAnalysis analyze(List<PseEstimate> estimates) {
        Objects.requireNonNull(estimates, "estimates cannot be null");

        Map<Integer, Double[][]> bySubject = new TreeMap<>();
        for (PseEstimate estimate : estimates) {
            Double[][] grid = bySubject.computeIfAbsent(estimate.subjectId(), k -> new Double[COLORS][CONTRASTS]);
            if (!estimate.valid()) {
                continue;
            }
            int i = estimate.color().ordinal();
            int j = estimate.contrast().ordinal();
            if (grid[i][j] != null) {
                throw new IllegalArgumentException("Duplicate estimate for " + estimate.key());
            }
            grid[i][j] = estimate.pse();
        }

        List<double[][]> complete = new ArrayList<>();
        int excluded = 0;
        for (Double[][] grid : bySubject.values()) {
            double[][] cells = toComplete(grid);
            if (cells == null) {
                excluded++;
            } else {
                complete.add(cells);
            }
        }
        if (excluded > 0) {
            logger.warn("Incomplete design: excluded {} of {} subjects listwise", excluded, bySubject.size());
        }

        if (complete.size() < 2) {
            logger.warn("Only {} complete subject(s); effect sizes cannot be computed", complete.size());
            return EffectSizeAnalysis.unanalyzable(complete.size(), excluded);
        }

        Map<AnovaEffect, AnovaRow> table = anova.analyze(complete.toArray(new double[0][][]));
        List<EffectSizeRecord> records = new ArrayList<>(table.size());
        for (AnovaRow row : table.values()) {
            records.add(new EffectSizeRecord(
                row.effect(),
                row.fStatistic(),
                row.dfEffect(),
                row.dfError(),
                row.pValue(),
                row.partialEtaSquared(),
                cohensF(row.partialEtaSquared())));
        }
        return new EffectSizeAnalysis(records, complete.size(), excluded, true);
    }

    private static double[][] toComplete(Double[][] grid) {
        double[][] cells = new double[COLORS][CONTRASTS];
        for (int i = 0; i < COLORS; i++) {
            for (int j = 0; j < CONTRASTS; j++) {
                if (grid[i][j] == null) {
                    return null;
                }
                cells[i][j] = grid[i][j];
            }
        }
        return cells;
    }
}
