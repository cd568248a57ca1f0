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

package io.nosqlbench.powersim.command.subcommands;

import io.nosqlbench.powersim.codec.FixedEffectSetCodec;
import io.nosqlbench.powersim.model.FixedEffectSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Write a coefficient table with every required term, for filling in from a pilot fit.
@CommandLine.Command(
    name = "template",
    header = "Write a coefficient table template",
    description = "Writes a JSON coefficient table containing every term the simulator requires, all set to 0.",
    exitCodeList = {
        "0: Success",
        "1: Output exists or could not be written"
    }
)
public class CMD_power_template implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_power_template.class);

    @CommandLine.Option(
        names = {"--output", "-o"},
        description = "Path of the JSON file to write (default: standard output)"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"--force"},
        description = "Overwrite an existing output file"
    )
    private boolean force = false;

    @Override
    public Integer call() {
        FixedEffectSet template = FixedEffectSet.builder().setAll(0.0).randomInterceptSd(0.0).build();
        String json = FixedEffectSetCodec.toJson(template);

        if (outputPath == null) {
            System.out.println(json);
            return 0;
        }
        if (Files.exists(outputPath) && !force) {
            System.err.println("Error: Output file already exists. Use --force to overwrite.");
            return 1;
        }
        try {
            Files.writeString(outputPath, json + System.lineSeparator(), StandardCharsets.UTF_8);
            logger.info("Wrote coefficient template to {}", outputPath);
            return 0;
        } catch (IOException e) {
            logger.error("Could not write template", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
