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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags. Verbose
 * mode logs the event-by-event narrative of the run; quiet mode suppresses all
 * output except errors.
 */
public class VerbosityOption {

    /** The logger hierarchy the flags adjust. */
    public static final String LOGGER_ROOT = "io.ridesim";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log every arrival, boarding, failure and repair"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    private Level previousLevel;

    /**
     * Checks if verbose mode is enabled.
     *
     * @return true if verbose is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Checks if quiet mode is enabled.
     *
     * @return true if quiet is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Checks if normal (non-verbose, non-quiet) output should be shown.
     *
     * @return true if normal output should be shown
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }

    /**
     * Raises the {@value #LOGGER_ROOT} loggers to DEBUG for verbose runs or lowers
     * them to WARN for quiet runs. Without either flag the configured levels stay.
     * The level in effect before the change is kept for {@link #restoreLogLevel()}.
     */
    public void applyLogLevel() {
        if (!verbose && !quiet) {
            return;
        }
        previousLevel = LogManager.getLogger(LOGGER_ROOT).getLevel();
        Configurator.setLevel(LOGGER_ROOT, verbose ? Level.DEBUG : Level.WARN);
    }

    /**
     * Puts back the level that {@link #applyLogLevel()} replaced, so that later
     * commands in the same JVM start from the configured levels.
     */
    public void restoreLogLevel() {
        if (previousLevel != null) {
            Configurator.setLevel(LOGGER_ROOT, previousLevel);
            previousLevel = null;
        }
    }
}
