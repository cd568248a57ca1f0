package io.nosqlbench.powersim.estimate;

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

import io.nosqlbench.powersim.design.DesignGenerator;
import io.nosqlbench.powersim.model.ColorLevel;
import io.nosqlbench.powersim.model.ContrastLevel;
import io.nosqlbench.powersim.model.DesignTerm;
import io.nosqlbench.powersim.model.FixedEffectSet;
import io.nosqlbench.powersim.model.GroupKey;
import io.nosqlbench.powersim.model.LogitLink;
import io.nosqlbench.powersim.model.PseEstimate;
import io.nosqlbench.powersim.model.Response;
import io.nosqlbench.powersim.model.TrialRecord;
import io.nosqlbench.powersim.model.TrialShell;
import io.nosqlbench.powersim.simulate.RandomStreams;
import io.nosqlbench.powersim.simulate.ResponseSimulator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
public class PseEstimatorTest {

    private final PseEstimator estimator = new PseEstimator();

    private static final GroupKey KEY = new GroupKey(1, ColorLevel.TRUE, ContrastLevel.POSITIVE);

    private static List<TrialRecord> noiseFreeGroup(double b0, double b1, int n) {
        List<TrialRecord> records = new ArrayList<>();
        for (int x = -80; x <= 80; x += 10) {
            long ones = Math.round(n * LogitLink.logistic(b0 + b1 * x));
            for (int i = 0; i < n; i++) {
                TrialShell shell = new TrialShell(KEY.subjectId(), i + 1, KEY.contrast(), KEY.color(), x);
                records.add(new TrialRecord(shell, Response.of(i < ones)));
            }
        }
        return records;
    }

    @Test
    void recoversPointOfSubjectiveEquality() {
        PseEstimate estimate = estimator.estimateGroup(KEY, noiseFreeGroup(0.5, 0.08, 5000));

        assertThat(estimate.valid()).isTrue();
        assertThat(estimate.pse()).isCloseTo(-6.25, within(0.05));
        assertThat(estimate.key()).isEqualTo(KEY);
    }

    @Test
    void ignoresMissingResponses() {
        List<TrialRecord> records = noiseFreeGroup(0.5, 0.08, 200);
        List<TrialRecord> withMissing = new ArrayList<>(records);
        for (int i = 0; i < 300; i++) {
            TrialShell shell = new TrialShell(1, 1000 + i, KEY.contrast(), KEY.color(), 80);
            withMissing.add(new TrialRecord(shell, Response.MISSING));
        }

        PseEstimate clean = estimator.estimateGroup(KEY, records);
        PseEstimate degraded = estimator.estimateGroup(KEY, withMissing);
        assertThat(degraded.valid()).isTrue();
        assertThat(degraded.pse()).isEqualTo(clean.pse());
    }

    @Test
    void separatedGroupHasValidFinitePse() {
        List<TrialRecord> records = new ArrayList<>();
        for (int x = -80; x <= 80; x += 10) {
            TrialShell shell = new TrialShell(KEY.subjectId(), 1, KEY.contrast(), KEY.color(), x);
            records.add(new TrialRecord(shell, Response.of(x > 0)));
        }

        PseEstimate estimate = estimator.estimateGroup(KEY, records);

        assertThat(estimate.valid()).isTrue();
        assertThat(estimate.pse()).isFinite().isBetween(0.0, 10.0);
    }

    @Test
    void allMissingGroupIsInvalid() {
        List<TrialRecord> records = noiseFreeGroup(0.5, 0.08, 5).stream()
            .map(TrialRecord::withMissingResponse)
            .collect(Collectors.toList());

        PseEstimate estimate = estimator.estimateGroup(KEY, records);
        assertThat(estimate.valid()).isFalse();
        assertThat(estimate.pse()).isNaN();
        assertThat(estimate.invalidReason()).contains("no observations");
    }

    @Test
    void constantResponseGroupIsInvalid() {
        List<TrialRecord> records = noiseFreeGroup(50.0, 0.0, 5);

        PseEstimate estimate = estimator.estimateGroup(KEY, records);
        assertThat(estimate.valid()).isFalse();
        assertThat(estimate.invalidReason()).isNotBlank();
    }

    @Test
    void flatResponseGroupIsInvalid() {
        List<TrialRecord> records = new ArrayList<>();
        for (int x = -80; x <= 80; x += 10) {
            for (int i = 0; i < 4; i++) {
                TrialShell shell = new TrialShell(1, i + 1, KEY.contrast(), KEY.color(), x);
                records.add(new TrialRecord(shell, Response.of(i % 2 == 0)));
            }
        }

        PseEstimate estimate = estimator.estimateGroup(KEY, records);
        assertThat(estimate.valid()).isFalse();
        assertThat(estimate.invalidReason()).contains("slope");
    }

    @Test
    void estimatesOneResultPerGroupInKeyOrder() {
        FixedEffectSet fixef = FixedEffectSet.builder()
            .setAll(0.0)
            .set(DesignTerm.SIZE, 1.0)
            .randomInterceptSd(0.0)
            .build();
        List<TrialShell> shells = new DesignGenerator().generate(4, 6);
        List<TrialRecord> records = new ResponseSimulator().simulate(shells, fixef, RandomStreams.create(3L));

        PseEstimationResult result = estimator.estimate(records);

        assertThat(result.estimates()).hasSize(4 * 4);
        List<GroupKey> keys = result.estimates().stream().map(PseEstimate::key).collect(Collectors.toList());
        assertThat(keys).isSorted();
        assertThat(keys).doesNotHaveDuplicates();
        assertThat(result.validCount() + result.invalidCount()).isEqualTo(16);
        assertThat(result.validEstimates()).allSatisfy(e -> assertThat(e.pse()).isFinite());
    }
}
