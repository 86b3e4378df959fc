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


package io.ridesim.command.subcommands;

import io.ridesim.command.common.ConfigFileOption;
import io.ridesim.command.common.RandomSeedOption;
import io.ridesim.command.common.SimulationOverridesOption;
import io.ridesim.config.InvalidConfigurationException;
import io.ridesim.config.SimulationConfig;
import io.ridesim.config.SimulationConfigLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.concurrent.Callable;

/// Print the effective simulation configuration.
///
/// Without options this prints the built-in defaults, which makes a convenient
/// starting point for a configuration file:
///
/// ```bash
/// ridesim defaults > park.yaml
/// ```
///
/// With `--config` and overrides it prints what `run` would use.
@CommandLine.Command(
    name = "defaults",
    header = "Print the effective simulation configuration",
    description = "Prints the configuration a run would use, as YAML or JSON.",
    exitCodeList = {
        "0: Success",
        "1: Error reading the configuration",
        "2: Invalid configuration"
    }
)
public class CMD_ridesim_defaults implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_ridesim_defaults.class);

    /** Output document format. */
    public enum Format {
        yaml,
        json
    }

    @CommandLine.Mixin
    private ConfigFileOption configFileOption = new ConfigFileOption();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private SimulationOverridesOption overridesOption = new SimulationOverridesOption();

    @CommandLine.Option(names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "yaml")
    private Format format = Format.yaml;

    @Override
    public Integer call() {
        SimulationConfig config;
        try {
            SimulationConfig.Builder builder = configFileOption.loadBuilder();
            randomSeedOption.applyTo(builder);
            overridesOption.applyTo(builder);
            config = builder.build();
        } catch (InvalidConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getViolations());
            System.err.println("Error: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            logger.error("Could not read configuration {}", configFileOption.getConfigFile(), e);
            System.err.println("Error: cannot read configuration " + configFileOption.getConfigFile() + ": " + e);
            return 1;
        }

        if (format == Format.json) {
            System.out.println(SimulationConfigLoader.toJson(config));
        } else {
            System.out.print(SimulationConfigLoader.toYaml(config));
        }
        return 0;
    }
}
