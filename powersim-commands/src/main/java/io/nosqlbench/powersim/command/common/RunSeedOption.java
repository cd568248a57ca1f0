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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/**
 * Run seed mixin. Every replication stream of a power run is derived from
 * this one value, so reporting it is enough to repeat a run exactly.
 */
public class RunSeedOption {

    private static final Logger logger = LogManager.getLogger(RunSeedOption.class);

    /**
     * A run seed as given on the command line.
     *
     * @param value the seed, or null to derive one from the clock
     */
    public record RunSeed(Long value) {

        public static RunSeed clock() {
            return new RunSeed(null);
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "clock";
        }
    }

    /**
     * Parses {@code --seed} values. Accepts decimal longs, {@code 0x} hex
     * longs, and {@code clock}.
     */
    public static class RunSeedConverter implements CommandLine.ITypeConverter<RunSeed> {

        @Override
        public RunSeed convert(String value) {
            String trimmed = value == null ? "" : value.trim();
            if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("clock")) {
                return RunSeed.clock();
            }
            try {
                if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                    return new RunSeed(Long.parseUnsignedLong(trimmed.substring(2), 16));
                }
                return new RunSeed(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed '" + value + "': expected a long, a 0x-prefixed hex long, or 'clock'");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Run seed; replication streams are derived from it (default: clock)",
        converter = RunSeedConverter.class
    )
    private RunSeed seed;

    private Long resolved;

    public RunSeed getRunSeed() {
        return seed != null ? seed : RunSeed.clock();
    }

    /**
     * Returns the seed for this run. A clock seed is drawn on the first call
     * and reused after that.
     *
     * @return the effective seed
     */
    public synchronized long resolve() {
        if (resolved == null) {
            RunSeed runSeed = getRunSeed();
            if (runSeed.isExplicit()) {
                resolved = runSeed.value();
            } else {
                resolved = System.currentTimeMillis();
                logger.info("No --seed given; using clock seed {}", resolved);
            }
        }
        return resolved;
    }

    @Override
    public String toString() {
        return getRunSeed().toString();
    }
}
