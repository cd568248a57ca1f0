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

package io.nosqlbench.powersim.command;

import io.nosqlbench.powersim.command.subcommands.CMD_power_run;
import io.nosqlbench.powersim.command.subcommands.CMD_power_template;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The power command groups the subcommands of a simulation-based power analysis.
///
/// This is an umbrella command; it prints usage when invoked without a subcommand.
@CommandLine.Command(name = "power",
    header = "Simulation-based power analysis for PSE experiments",
    description = "Simulates synthetic experiments from a pilot model and summarizes the effect sizes they yield",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_power_run.class,
        CMD_power_template.class
    })
public class CMD_power implements Callable<Integer> {

    /// Run CMD_power
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_power()).execute(args));
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
