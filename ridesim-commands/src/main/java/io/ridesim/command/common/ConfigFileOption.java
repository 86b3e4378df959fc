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


package io.ridesim.command.common;

import io.ridesim.config.SimulationConfig;
import io.ridesim.config.SimulationConfigLoader;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shared {@code --config} option naming a YAML or JSON simulation configuration.
 */
public class ConfigFileOption {

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "YAML or JSON simulation configuration file (default: built-in defaults)"
    )
    private Path configFile;

    public Path getConfigFile() {
        return configFile;
    }

    /**
     * Loads the configuration file, if one was given, into an unvalidated builder.
     *
     * @return a builder holding the file's values, or the defaults
     * @throws IOException if the file cannot be read
     */
    public SimulationConfig.Builder loadBuilder() throws IOException {
        if (configFile == null) {
            return SimulationConfig.builder();
        }
        return SimulationConfigLoader.builderFrom(configFile);
    }
}
