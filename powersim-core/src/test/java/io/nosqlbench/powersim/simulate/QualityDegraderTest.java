package io.nosqlbench.powersim.simulate;

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
import io.nosqlbench.powersim.design.DesignGenerator;
import io.nosqlbench.powersim.model.Response;
import io.nosqlbench.powersim.model.TrialRecord;
import io.nosqlbench.powersim.model.TrialShell;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class QualityDegraderTest {

    private final QualityDegrader degrader = new QualityDegrader();

    private static List<TrialRecord> allOnes() {
        List<TrialShell> shells = new DesignGenerator().generate(3, 2);
        return shells.stream().map(s -> new TrialRecord(s, Response.ONE)).collect(Collectors.toList());
    }

    private static long missing(List<TrialRecord> records) {
        return records.stream().filter(r -> r.response().isMissing()).count();
    }

    @Test
    void zeroProportionIsNoOp() {
        List<TrialRecord> records = allOnes();
        List<TrialRecord> degraded = degrader.degrade(records, 0.0, RandomStreams.create(1L));

        assertEquals(records, degraded);
        assertEquals(0, missing(degraded));
    }

    @Test
    void fullProportionMarksEverythingMissing() {
        List<TrialRecord> degraded = degrader.degrade(allOnes(), 1.0, RandomStreams.create(1L));

        assertEquals(432, degraded.size());
        assertEquals(432, missing(degraded));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.001, 0.1, 0.25, 0.5, 0.9, 0.999})
    void marksRoundedShareMissing(double proportion) {
        List<TrialRecord> records = allOnes();
        List<TrialRecord> degraded = degrader.degrade(records, proportion, RandomStreams.create(5L));

        assertEquals(Math.round(proportion * records.size()), missing(degraded));
        assertEquals(QualityDegrader.missingCount(records.size(), proportion), missing(degraded));
    }

    @Test
    void covariatesAreUntouched() {
        List<TrialRecord> records = allOnes();
        List<TrialRecord> degraded = degrader.degrade(records, 0.4, RandomStreams.create(9L));

        assertEquals(records.size(), degraded.size());
        for (int i = 0; i < records.size(); i++) {
            assertEquals(records.get(i).shell(), degraded.get(i).shell());
        }
    }

    @Test
    void inputIsNotModified() {
        List<TrialRecord> records = allOnes();
        degrader.degrade(records, 0.5, RandomStreams.create(9L));

        assertEquals(0, missing(records));
    }

    @Test
    void selectionIsSpreadAcrossTheDesign() {
        List<TrialRecord> records = allOnes();
        List<TrialRecord> degraded = degrader.degrade(records, 0.5, RandomStreams.create(11L));

        for (int subject = 1; subject <= 3; subject++) {
            int s = subject;
            long subjectMissing = degraded.stream().filter(r -> r.subjectId() == s && r.response().isMissing()).count();
            assertTrue(subjectMissing > 30 && subjectMissing < 114, "subject " + s + ": " + subjectMissing);
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.01, 1.01, Double.NaN})
    void rejectsProportionOutsideUnitInterval(double proportion) {
        assertThrows(ConfigurationException.class,
            () -> degrader.degrade(allOnes(), proportion, RandomStreams.create(1L)));
    }
}
