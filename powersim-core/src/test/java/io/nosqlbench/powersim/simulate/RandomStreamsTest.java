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

import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RandomStreamsTest {

    private static long[] head(UniformRandomProvider rng, int n) {
        long[] values = new long[n];
        for (int i = 0; i < n; i++) {
            values[i] = rng.nextLong();
        }
        return values;
    }

    @Test
    void sameSeedSameSequence() {
        assertArrayEquals(head(RandomStreams.create(42L), 16), head(RandomStreams.create(42L), 16));
    }

    @Test
    void replicationStreamsAreReproducibleAndDistinct() {
        List<UniformRandomProvider> first = RandomStreams.replicationStreams(42L, 3);
        List<UniformRandomProvider> second = RandomStreams.replicationStreams(42L, 3);

        assertEquals(3, first.size());
        long[][] heads = new long[3][];
        for (int i = 0; i < 3; i++) {
            heads[i] = head(first.get(i), 8);
            assertArrayEquals(heads[i], head(second.get(i), 8));
        }
        assertFalse(java.util.Arrays.equals(heads[0], heads[1]));
        assertFalse(java.util.Arrays.equals(heads[1], heads[2]));
    }

    @Test
    void streamsDoNotDependOnCount() {
        List<UniformRandomProvider> small = RandomStreams.replicationStreams(9L, 2);
        List<UniformRandomProvider> large = RandomStreams.replicationStreams(9L, 5);

        assertArrayEquals(head(small.get(1), 8), head(large.get(1), 8));
    }
}
