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

import io.ridesim.command.subcommands.CMD_ridesim_defaults;
import io.ridesim.command.subcommands.CMD_ridesim_run;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The ridesim command runs theme park ride simulations and shows their configuration.
///
/// This is an umbrella command for the `run` and `defaults` subcommands.
@CommandLine.Command(name = "ridesim",
    header = "Simulate visitors queueing for theme park rides",
    description = "Contains subcommands to run a ride simulation and to inspect its configuration",
    mixinStandardHelpOptions = true,
    version = "ridesim 0.1.0",
    subcommands = {
        CMD_ridesim_run.class,
        CMD_ridesim_defaults.class
    })
public class CMD_ridesim implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_ridesim.class);

    /// Run CMD_ridesim
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_ridesim()).execute(args));
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        logger.debug("No subcommand given");
        CommandLine.usage(this, System.out);
        return 0;
    }
}
