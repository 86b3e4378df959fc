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
import io.ridesim.command.common.VerbosityOption;
import io.ridesim.command.render.SnapshotJson;
import io.ridesim.command.render.SummaryTableRenderer;
import io.ridesim.config.InvalidConfigurationException;
import io.ridesim.config.SimulationConfig;
import io.ridesim.park.ThemeParkSimulation;
import io.ridesim.stats.StatisticsSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Run one theme park simulation and print its results.
///
/// ## Usage
///
/// ```bash
/// # Default park: 3 rides, 480 minutes, seed 42
/// ridesim run
///
/// # A park described in a file, with a different seed and no failures
/// ridesim run --config park.yaml --seed 7 --no-failures
///
/// # Results as JSON on stdout
/// ridesim run --json -
/// ```
///
/// ## Output
///
/// A per-ride results table with each ride's share of all boardings, the summary
/// lines, a histogram of queue waits in `--wait-bins` bins and the arrivals in each
/// interval of `--arrival-bin` minutes. With `--json FILE` the results are also written as
/// JSON; with `--json -` the JSON replaces the tables on stdout.
@CommandLine.Command(
    name = "run",
    header = "Run a theme park ride simulation",
    description = "Simulates visitors arriving, queueing for rides and riding until the horizon, "
        + "then prints per-ride and overall statistics.",
    exitCodeList = {
        "0: Success",
        "1: Error reading the configuration or writing results",
        "2: Invalid configuration or options"
    }
)
public class CMD_ridesim_run implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_ridesim_run.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_IO_ERROR = 1;
    private static final int EXIT_INVALID_CONFIG = 2;

    private static final String STDOUT = "-";

    @CommandLine.Mixin
    private ConfigFileOption configFileOption = new ConfigFileOption();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private SimulationOverridesOption overridesOption = new SimulationOverridesOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"--arrival-bin"},
        description = "Width in minutes of the arrivals-per-interval table (default: ${DEFAULT-VALUE})",
        defaultValue = "10")
    private double arrivalBinMinutes = 10.0;

    @CommandLine.Option(names = {"--wait-bins"},
        description = "Number of bins in the queue-wait histogram (default: ${DEFAULT-VALUE})",
        defaultValue = "20")
    private int waitBins = 20;

    @CommandLine.Option(names = {"--json"},
        description = "Also write the results as JSON to this file, or - for stdout")
    private String jsonTarget;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
        if (!(arrivalBinMinutes > 0.0) || !Double.isFinite(arrivalBinMinutes)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --arrival-bin must be a positive number of minutes");
        }
        if (waitBins < 1 || waitBins > StatisticsSnapshot.MAX_BINS) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --wait-bins must be between 1 and " + StatisticsSnapshot.MAX_BINS);
        }
        verbosityOption.applyLogLevel();
        try {
            return runAndReport();
        } finally {
            verbosityOption.restoreLogLevel();
        }
    }

    private int runAndReport() {
        SimulationConfig config;
        try {
            SimulationConfig.Builder builder = configFileOption.loadBuilder();
            randomSeedOption.applyTo(builder);
            overridesOption.applyTo(builder);
            config = builder.build();
        } catch (InvalidConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getViolations());
            System.err.println("Error: " + e.getMessage());
            return EXIT_INVALID_CONFIG;
        } catch (IOException e) {
            logger.error("Could not read configuration {}", configFileOption.getConfigFile(), e);
            System.err.println("Error: cannot read configuration " + configFileOption.getConfigFile() + ": " + e);
            return EXIT_IO_ERROR;
        }

        try {
            StatisticsSnapshot.intervalCount(config.getHorizon(), arrivalBinMinutes);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --arrival-bin " + arrivalBinMinutes + " is too small: " + e.getMessage());
        }

        StatisticsSnapshot snapshot = ThemeParkSimulation.runSimulation(config);

        boolean jsonToStdout = STDOUT.equals(jsonTarget);
        if (verbosityOption.showNormalOutput() && !jsonToStdout) {
            new SummaryTableRenderer(System.out).render(config, snapshot, arrivalBinMinutes, waitBins);
        }

        if (jsonTarget != null) {
            String json = SnapshotJson.toJson(config, snapshot, arrivalBinMinutes, waitBins);
            if (jsonToStdout) {
                System.out.println(json);
            } else {
                Path target = Path.of(jsonTarget);
                try {
                    Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
                    logger.info("Wrote results to {}", target);
                } catch (IOException e) {
                    logger.error("Could not write results to {}", target, e);
                    System.err.println("Error: cannot write " + target + ": " + e);
                    return EXIT_IO_ERROR;
                }
            }
        }
        return EXIT_SUCCESS;
    }
}
