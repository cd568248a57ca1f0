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
import io.nosqlbench.powersim.model.ColorLevel;
import io.nosqlbench.powersim.model.ContrastLevel;
import io.nosqlbench.powersim.model.EffectSizeRecord;
import io.nosqlbench.powersim.model.GroupKey;
import io.nosqlbench.powersim.model.PseEstimate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
public class EffectSizeAnalyzerTest {

    private final EffectSizeAnalyzer analyzer = new EffectSizeAnalyzer();

    private static final double[][][] CELLS = {
        {{1, 2}, {3, 4}},
        {{2, 3}, {4, 6}},
        {{3, 3}, {5, 7}},
    };

    private static List<PseEstimate> estimates(double[][][] cells) {
        List<PseEstimate> estimates = new ArrayList<>();
        for (int s = 0; s < cells.length; s++) {
            for (ColorLevel color : ColorLevel.values()) {
                for (ContrastLevel contrast : ContrastLevel.values()) {
                    GroupKey key = new GroupKey(s + 1, color, contrast);
                    estimates.add(PseEstimate.valid(key, cells[s][color.ordinal()][contrast.ordinal()]));
                }
            }
        }
        return estimates;
    }

    @Test
    void cohensFFromPartialEtaSquared() {
        assertThat(EffectSizeAnalyzer.cohensF(0.0)).isEqualTo(0.0);
        assertThat(EffectSizeAnalyzer.cohensF(0.5)).isCloseTo(1.0, within(1e-12));
        assertThat(EffectSizeAnalyzer.cohensF(0.2)).isCloseTo(0.5, within(1e-12));
        assertThat(EffectSizeAnalyzer.cohensF(1.0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(EffectSizeAnalyzer.cohensF(Double.NaN)).isNaN();
    }

    @Test
    void reportsAllFourEffects() {
        EffectSizeAnalysis analysis = analyzer.analyze(estimates(CELLS));

        assertThat(analysis.analyzable()).isTrue();
        assertThat(analysis.includedSubjects()).isEqualTo(3);
        assertThat(analysis.excludedSubjects()).isZero();
        assertThat(analysis.records()).extracting(EffectSizeRecord::effect)
            .containsExactly(AnovaEffect.values());

        EffectSizeRecord interaction = analysis.record(AnovaEffect.COLOR_X_CONTRAST).orElseThrow();
        assertThat(interaction.statistic()).isCloseTo(3.0, within(1e-9));
        assertThat(interaction.partialEtaSquared()).isCloseTo(0.6, within(1e-9));
        assertThat(interaction.cohensF()).isCloseTo(Math.sqrt(1.5), within(1e-9));
        assertThat(interaction.effectName()).isEqualTo("color:contrast");
    }

    @Test
    void cellOrderInInputDoesNotMatter() {
        List<PseEstimate> shuffled = estimates(CELLS);
        java.util.Collections.reverse(shuffled);

        assertThat(analyzer.analyze(shuffled).records()).isEqualTo(analyzer.analyze(estimates(CELLS)).records());
    }

    @Test
    void excludesIncompleteSubjectsListwise() {
        double[][][] four = {
            {{1, 2}, {3, 4}},
            {{2, 3}, {4, 6}},
            {{3, 3}, {5, 7}},
            {{9, 9}, {9, 9}},
        };
        List<PseEstimate> estimates = estimates(four);
        GroupKey dropped = new GroupKey(4, ColorLevel.FALSE, ContrastLevel.NEGATIVE);
        estimates.replaceAll(e -> e.key().equals(dropped) ? PseEstimate.invalid(dropped, "slope is effectively zero") : e);

        EffectSizeAnalysis analysis = analyzer.analyze(estimates);

        assertThat(analysis.includedSubjects()).isEqualTo(3);
        assertThat(analysis.excludedSubjects()).isEqualTo(1);
        assertThat(analysis.records()).isEqualTo(analyzer.analyze(estimates(CELLS)).records());
    }

    @Test
    void subjectWithMissingCellEntryIsExcluded() {
        List<PseEstimate> estimates = estimates(CELLS);
        estimates.remove(estimates.size() - 1);

        EffectSizeAnalysis analysis = analyzer.analyze(estimates);

        assertThat(analysis.analyzable()).isTrue();
        assertThat(analysis.includedSubjects()).isEqualTo(2);
        assertThat(analysis.excludedSubjects()).isEqualTo(1);
        assertThat(analysis.records()).isNotEmpty();
    }

    @Test
    void fewerThanTwoCompleteSubjectsIsUnanalyzable() {
        List<PseEstimate> estimates = estimates(CELLS);
        estimates.replaceAll(e -> e.subjectId() == 1 ? e : PseEstimate.invalid(e.key(), "no observations"));

        EffectSizeAnalysis analysis = analyzer.analyze(estimates);

        assertThat(analysis.analyzable()).isFalse();
        assertThat(analysis.records()).isEmpty();
        assertThat(analysis.includedSubjects()).isEqualTo(1);
        assertThat(analysis.excludedSubjects()).isEqualTo(2);
        assertThat(analysis.record(AnovaEffect.COLOR)).isEmpty();
    }

    @Test
    void noEstimatesIsUnanalyzable() {
        EffectSizeAnalysis analysis = analyzer.analyze(List.of());

        assertThat(analysis.analyzable()).isFalse();
        assertThat(analysis.includedSubjects()).isZero();
        assertThat(analysis.excludedSubjects()).isZero();
    }

    @Test
    void rejectsDuplicateCells() {
        List<PseEstimate> estimates = estimates(CELLS);
        estimates.add(PseEstimate.valid(new GroupKey(1, ColorLevel.TRUE, ContrastLevel.POSITIVE), 0.0));

        assertThatThrownBy(() -> analyzer.analyze(estimates))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate");
    }
}
