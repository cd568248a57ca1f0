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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.nosqlbench.powersim.ConfigurationException;
import io.nosqlbench.powersim.model.FixedEffectSet;

import java.io.Reader;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;

/// JSON form of the pilot model's coefficient table.
///
/// ## Format
///
/// A flat object from term name to estimate, with the random-intercept SD
/// under [FixedEffectSet#RANDOM_INTERCEPT_SD]:
///
/// ```json
/// {
///   "(Intercept)": -0.12,
///   "color.e": 0.31,
///   "contrast.e": -0.05,
///   "size": 1.08,
///   "color.e:contrast.e": 0.0,
///   "color.e:size": 0.02,
///   "contrast.e:size": -0.01,
///   "color.e:contrast.e:size": 0.0,
///   "subject_id.sd": 0.64
/// }
/// ```
///
/// Decoding goes through [FixedEffectSet#fromNamedCoefficients(Map)], so a
/// table with missing or unknown terms is rejected with a
/// [ConfigurationException] just like one built in code.
///
/// ## Thread Safety
///
/// The shared [Gson] instance is thread-safe.
public final class FixedEffectSetCodec {

    private static final Type TABLE_TYPE = new TypeToken<Map<String, Double>>() { }.getType();

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private FixedEffectSetCodec() {
    }

    /// Encodes a coefficient table.
    ///
    /// @param fixef the coefficients
    /// @return pretty-printed JSON
    public static String toJson(FixedEffectSet fixef) {
        Objects.requireNonNull(fixef, "fixef cannot be null");
        return GSON.toJson(fixef.toNamedCoefficients(), TABLE_TYPE);
    }

    /// Decodes a coefficient table.
    ///
    /// @param json the JSON text
    /// @return the validated coefficients
    /// @throws ConfigurationException if the JSON is malformed or the term set is wrong
    public static FixedEffectSet fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return fromTable(GSON.fromJson(json, TABLE_TYPE));
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed coefficient table: " + e.getMessage(), e);
        }
    }

    /// Decodes a coefficient table from a reader. The reader is not closed.
    ///
    /// @param reader the JSON source
    /// @return the validated coefficients
    /// @throws ConfigurationException if the JSON is malformed or the term set is wrong
    public static FixedEffectSet fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        try {
            return fromTable(GSON.fromJson(reader, TABLE_TYPE));
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed coefficient table: " + e.getMessage(), e);
        }
    }

    private static FixedEffectSet fromTable(Map<String, Double> table) {
        if (table == null) {
            throw new ConfigurationException("Coefficient table is empty");
        }
        return FixedEffectSet.fromNamedCoefficients(table);
    }
}
