package io.nosqlbench.powersim.command.subcommands;

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

import io.nosqlbench.powersim.codec.FixedEffectSetCodec;
import io.nosqlbench.powersim.command.CMD_power;
import io.nosqlbench.powersim.model.DesignTerm;
import io.nosqlbench.powersim.model.FixedEffectSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class CMD_power_templateTest {

    @TempDir
    Path tempDir;

    @Test
    public void testTemplateListsEveryTerm() throws IOException {
        Path output = tempDir.resolve("fixef.json");

        int exitCode = new CommandLine(new CMD_power()).execute("template", "--output", output.toString());

        assertThat(exitCode).isZero();
        String json = Files.readString(output);
        for (DesignTerm term : DesignTerm.values()) {
            assertThat(json).contains("\"" + term.termName() + "\"");
        }
        FixedEffectSet template = FixedEffectSetCodec.fromJson(json);
        assertThat(template.coefficient(DesignTerm.SIZE)).isZero();
        assertThat(template.randomInterceptSd()).isZero();
    }

    @Test
    public void testTemplateDoesNotOverwrite() throws IOException {
        Path output = tempDir.resolve("fixef.json");
        Files.writeString(output, "{}");

        int exitCode = new CommandLine(new CMD_power()).execute("template", "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.readString(output)).isEqualTo("{}");
    }
}
