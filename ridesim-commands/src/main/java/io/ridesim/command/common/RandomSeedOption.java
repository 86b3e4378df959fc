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
import picocli.CommandLine;

/**
 * Shared random seed option using {@link Seed} record with automatic parsing.
 * When no seed is given the seed from the configuration file, or the default
 * seed, is kept, so runs stay reproducible unless a seed is asked for.
 */
public class RandomSeedOption {

    /**
     * Immutable random seed specification.
     *
     * @param value the seed value, or null to keep the configured seed
     */
    public record Seed(Long value) {

        /**
         * Creates a Seed with a specific value.
         */
        public Seed(long value) {
            this(Long.valueOf(value));
        }

        /**
         * Creates a Seed that keeps the configured value.
         */
        public Seed() {
            this((Long) null);
        }

        /**
         * Checks if this seed was explicitly specified.
         */
        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "configured";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }

            try {
                long seedValue = Long.parseLong(value.trim());
                return new Seed(seedValue);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid seed value: " + value + ". Must be a valid long integer."
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for the run (default: the configured seed, "
            + SimulationConfig.DEFAULT_SEED + " unless a config file sets one)",
        converter = SeedConverter.class
    )
    private Seed seed;

    /**
     * Gets the Seed record.
     */
    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    /**
     * Checks if a seed was explicitly specified by the user.
     */
    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    /**
     * Sets the seed on the builder if one was given on the command line.
     */
    public SimulationConfig.Builder applyTo(SimulationConfig.Builder builder) {
        if (isSeedSpecified()) {
            builder.seed(seed.value());
        }
        return builder;
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
