package io.nosqlbench.powersim.command.common;

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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;

public class RunSeedOptionTest {

    @CommandLine.Command(name = "test")
    static class TestCommand implements Runnable {
        @CommandLine.Mixin
        RunSeedOption seedOption = new RunSeedOption();

        @Override
        public void run() {
        }
    }

    private static RunSeedOption parse(String... args) {
        TestCommand command = new TestCommand();
        new CommandLine(command).parseArgs(args);
        return command.seedOption;
    }

    @Test
    public void testExplicitSeed() {
        RunSeedOption option = parse("--seed", "42");

        assertTrue(option.getRunSeed().isExplicit());
        assertEquals(42L, option.resolve());
        assertEquals("42", option.toString());
    }

    @Test
    public void testHexSeed() {
        assertEquals(255L, parse("-s", "0xff").resolve());
        assertEquals(-1L, parse("-s", "0xFFFFFFFFFFFFFFFF").resolve());
    }

    @Test
    public void testClockSeedIsStable() {
        RunSeedOption option = parse();

        assertFalse(option.getRunSeed().isExplicit());
        long first = option.resolve();
        assertEquals(first, option.resolve());
        assertEquals("clock", option.toString());
    }

    @Test
    public void testExplicitClockKeyword() {
        assertFalse(parse("--seed", "clock").getRunSeed().isExplicit());
    }

    @Test
    public void testInvalidSeed() {
        TestCommand command = new TestCommand();
        CommandLine cmd = new CommandLine(command);

        assertThrows(CommandLine.ParameterException.class, () -> cmd.parseArgs("--seed", "not-a-number"));
    }
}
