/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.powersim.command.common;

import io.nosqlbench.powersim.engine.EffectSizeRow;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/// Writes the per-replication output table as CSV.
///
/// Columns: `replication,effect,statistic,df_effect,df_error,p_value,pes,cohens_f`.
/// Effect names are quoted since they may contain `:` and parentheses.
public final class EffectSizeCsvWriter {

    public static final String HEADER = "replication,effect,statistic,df_effect,df_error,p_value,pes,cohens_f";

    private EffectSizeCsvWriter() {
    }

    /// Writes the header and one line per row. The writer is not closed.
    ///
    /// @param rows the output table
    /// @param out the destination
    /// @throws IOException if writing fails
    public static void write(List<EffectSizeRow> rows, Writer out) throws IOException {
        out.write(HEADER);
        out.write('\n');
        for (EffectSizeRow row : rows) {
            out.write(String.format(Locale.ROOT, "%d,\"%s\",%s,%d,%d,%s,%s,%s\n",
                row.replication(),
                row.effect(),
                number(row.statistic()),
                row.dfEffect(),
                row.dfError(),
                number(row.pValue()),
                number(row.pes()),
                number(row.cohensF())));
        }
        out.flush();
    }

    private static String number(double v) {
        if (Double.isNaN(v)) {
            return "NA";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "Inf" : "-Inf";
        }
        return String.format(Locale.ROOT, "%.8g", v);
    }
}
