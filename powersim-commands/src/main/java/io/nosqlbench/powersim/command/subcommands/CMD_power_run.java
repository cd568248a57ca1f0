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

import io.nosqlbench.powersim.ConfigurationException;
import io.nosqlbench.powersim.codec.FixedEffectSetCodec;
import io.nosqlbench.powersim.command.common.EffectSizeCsvWriter;
import io.nosqlbench.powersim.command.common.RunSeedOption;
import io.nosqlbench.powersim.engine.EffectSizeSummary;
import io.nosqlbench.powersim.engine.PowerAnalysisResult;
import io.nosqlbench.powersim.engine.PowerEngine;
import io.nosqlbench.powersim.engine.PowerRunConfig;
import io.nosqlbench.powersim.model.FixedEffectSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Run a power simulation from a pilot coefficient table.
///
/// ## Usage
///
/// ```bash
/// # 500 replications of a 10-subject, 24-trial design with 8% of trials excluded
/// powersim run --fixef pilot.json --subjects 10 --trials 24 --excluded 0.08 \
///     --replications 500 --seed 42 --threads 8 --output effect_sizes.csv
/// ```
///
/// ## Output
///
/// A summary table of Cohen's f per effect is printed to standard output. With
/// `--output`, the per-replication table is written as CSV.
@CommandLine.Command(
    name = "run",
    header = "Run a simulation-based power analysis",
    description = "Simulates replications from a pilot coefficient table, re-estimates PSEs and reports the Cohen's f distribution per effect.",
    exitCodeList = {
        "0: Success",
        "1: Output exists or could not be written",
        "2: Invalid configuration or coefficient table"
    }
)
public class CMD_power_run implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_power_run.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @CommandLine.Option(
        names = {"--fixef", "-f"},
        description = "JSON coefficient table of the pilot model",
        required = true
    )
    private Path fixefPath;

    @CommandLine.Option(
        names = {"--subjects", "-n"},
        description = "Subjects per replication (default: ${DEFAULT-VALUE})",
        defaultValue = "10"
    )
    private int subjects;

    @CommandLine.Option(
        names = {"--trials", "-t"},
        description = "Replicate trials per design cell (default: ${DEFAULT-VALUE})",
        defaultValue = "24"
    )
    private int trials;

    @CommandLine.Option(
        names = {"--excluded", "-x"},
        description = "Share of responses marked missing, in [0, 1] (default: ${DEFAULT-VALUE})",
        defaultValue = "0.0"
    )
    private double excludedProportion;

    @CommandLine.Option(
        names = {"--replications", "-r"},
        description = "Number of replications (default: ${DEFAULT-VALUE})",
        defaultValue = "100"
    )
    private int replications;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Worker threads (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    private int threads;

    @CommandLine.Option(
        names = {"--alpha"},
        description = "Significance level for the power estimate (default: ${DEFAULT-VALUE})",
        defaultValue = "0.05"
    )
    private double alpha;

    @CommandLine.Option(
        names = {"--output", "-o"},
        description = "CSV file for the per-replication effect-size table"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"--force"},
        description = "Overwrite an existing output file"
    )
    private boolean force = false;

    @CommandLine.Mixin
    private RunSeedOption runSeedOption = new RunSeedOption();

    @Override
    public Integer call() {
        if (outputPath != null && Files.exists(outputPath) && !force) {
            System.err.println("Error: Output file already exists. Use --force to overwrite.");
            return EXIT_IO_ERROR;
        }

        FixedEffectSet fixef;
        PowerRunConfig config;
        try (Reader reader = Files.newBufferedReader(fixefPath, StandardCharsets.UTF_8)) {
            fixef = FixedEffectSetCodec.fromJson(reader);
            config = PowerRunConfig.builder()
                .subjects(subjects)
                .trialsPerCell(trials)
                .excludedProportion(excludedProportion)
                .replications(replications)
                .seed(runSeedOption.resolve())
                .parallelism(threads)
                .alpha(alpha)
                .build();
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            logger.error("Could not read coefficient table {}", fixefPath, e);
            System.err.println("Error: could not read " + fixefPath + ": " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        PowerAnalysisResult result = new PowerEngine(fixef, config).run();
        printSummary(result, System.out);

        if (outputPath != null) {
            try {
                Path parent = outputPath.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
                    EffectSizeCsvWriter.write(result.rows(), writer);
                }
                logger.info("Wrote {} effect-size rows to {}", result.rows().size(), outputPath);
            } catch (IOException e) {
                logger.error("Could not write output table", e);
                System.err.println("Error: could not write " + outputPath + ": " + e.getMessage());
                return EXIT_IO_ERROR;
            }
        }
        return EXIT_SUCCESS;
    }

    static void printSummary(PowerAnalysisResult result, PrintStream out) {
        PowerRunConfig config = result.config();
        out.println();
        out.printf("Power run: %s%n", config);
        out.printf("Replications: %d (%d affected by exclusions, %d unanalyzable)%n",
            result.replications().size(), result.affectedReplications(), result.unanalyzableReplications());
        out.printf("Invalid PSE fits: %d, subjects excluded listwise: %d%n",
            result.invalidPseCount(), result.excludedSubjectCount());
        out.println();
        out.println("┌──────────────────┬───────┬──────────┬──────────┬──────────┬──────────┬──────────┬──────────┐");
        out.println("│ Effect           │     N │  mean(f) │    sd(f) │  med(f)  │  q2.5(f) │ q97.5(f) │   power  │");
        out.println("├──────────────────┼───────┼──────────┼──────────┼──────────┼──────────┼──────────┼──────────┤");
        for (EffectSizeSummary summary : result.summaries().values()) {
            out.printf("│ %-16s │ %5d │ %8.4f │ %8.4f │ %8.4f │ %8.4f │ %8.4f │ %8.3f │%n",
                summary.effectName(),
                summary.count(),
                summary.meanCohensF(),
                summary.sdCohensF(),
                summary.medianCohensF(),
                summary.lowerCohensF(),
                summary.upperCohensF(),
                summary.power());
        }
        out.println("└──────────────────┴───────┴──────────┴──────────┴──────────┴──────────┴──────────┴──────────┘");
    }
}
