package io.nosqlbench.powersim.codec;

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
import io.nosqlbench.powersim.model.DesignTerm;
import io.nosqlbench.powersim.model.FixedEffectSet;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
public class FixedEffectSetCodecTest {

    private static final String PILOT = "{\n"
        + "  \"(Intercept)\": -0.12,\n"
        + "  \"color.e\": 0.31,\n"
        + "  \"contrast.e\": -0.05,\n"
        + "  \"size\": 1.08,\n"
        + "  \"color.e:contrast.e\": 0.0,\n"
        + "  \"color.e:size\": 0.02,\n"
        + "  \"contrast.e:size\": -0.01,\n"
        + "  \"color.e:contrast.e:size\": 0.0,\n"
        + "  \"subject_id.sd\": 0.64\n"
        + "}";

    @Test
    void decodesPilotTable() {
        FixedEffectSet fixef = FixedEffectSetCodec.fromJson(PILOT);

        assertThat(fixef.coefficient(DesignTerm.INTERCEPT)).isEqualTo(-0.12);
        assertThat(fixef.coefficient(DesignTerm.SIZE)).isEqualTo(1.08);
        assertThat(fixef.coefficient(DesignTerm.CONTRAST_X_SIZE)).isEqualTo(-0.01);
        assertThat(fixef.randomInterceptSd()).isEqualTo(0.64);
    }

    @Test
    void readerAndStringFormsAgree() {
        assertThat(FixedEffectSetCodec.fromJson(new StringReader(PILOT)))
            .isEqualTo(FixedEffectSetCodec.fromJson(PILOT));
    }

    @Test
    void encodesTermNamesVerbatim() {
        String json = FixedEffectSetCodec.toJson(FixedEffectSetCodec.fromJson(PILOT));

        assertThat(json).contains("\"(Intercept)\": -0.12", "\"color.e:contrast.e:size\": 0.0", "\"subject_id.sd\": 0.64");
        assertThat(json.indexOf("subject_id.sd")).isGreaterThan(json.indexOf("color.e:contrast.e:size"));
        assertThat(FixedEffectSetCodec.fromJson(json)).isEqualTo(FixedEffectSetCodec.fromJson(PILOT));
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> FixedEffectSetCodec.fromJson("{\"size\": [1, 2]}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    void rejectsEmptyDocument() {
        assertThatThrownBy(() -> FixedEffectSetCodec.fromJson(""))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsIncompleteTable() {
        assertThatThrownBy(() -> FixedEffectSetCodec.fromJson("{\"(Intercept)\": 0.5}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("size");
    }
}
