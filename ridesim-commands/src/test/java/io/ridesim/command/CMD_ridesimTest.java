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


package io.ridesim.command;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class CMD_ridesimTest {

    @Test
    public void testWithoutSubcommandPrintsUsage() {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_ridesim()).execute();
            assertEquals(0, exitCode);
            assertThat(outContent.toString(StandardCharsets.UTF_8))
                .contains("Usage: ridesim")
                .contains("run")
                .contains("defaults");
        } finally {
            System.setOut(originalOut);
        }
    }

    @Test
    public void testSubcommandIsDispatched() {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_ridesim()).execute("run", "--horizon", "20", "--rides", "1");
            assertEquals(0, exitCode);
            assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("- Ride 0 was used ");
        } finally {
            System.setOut(originalOut);
        }
    }
}
