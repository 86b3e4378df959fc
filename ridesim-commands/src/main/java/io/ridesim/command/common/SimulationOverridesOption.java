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

import io.ridesim.config.SelectionPolicy;
import io.ridesim.config.ServiceSampling;
import io.ridesim.config.SimulationConfig;
import picocli.CommandLine;

/**
 * Command-line overrides for individual configuration values.
 * Every option is optional; values that are not given keep what the
 * configuration file or the defaults say.
 */
public class SimulationOverridesOption {

    @CommandLine.Option(names = {"--horizon"},
        description = "Simulated minutes to run")
    private Double horizon;

    @CommandLine.Option(names = {"--rides"},
        description = "Number of rides")
    private Integer rides;

    @CommandLine.Option(names = {"--capacity"},
        description = "Capacity of every ride")
    private Integer capacity;

    @CommandLine.Option(names = {"--policy"},
        description = "Ride selection policy: bounded_retry or unconditional_queue",
        converter = SelectionPolicyConverter.class)
    private SelectionPolicy policy;

    @CommandLine.Option(names = {"--retry-bound"},
        description = "Redraws allowed before a visitor gives up under bounded_retry")
    private Integer retryBound;

    @CommandLine.Option(names = {"--no-failures"},
        description = "Disable ride failures")
    private boolean noFailures = false;

    @CommandLine.Option(names = {"--service-sampling"},
        description = "Ride duration model: fixed, per_ride or per_visit",
        converter = ServiceSamplingConverter.class)
    private ServiceSampling serviceSampling;

    /** Accepts policy names in any case, with dashes or underscores. */
    public static class SelectionPolicyConverter implements CommandLine.ITypeConverter<SelectionPolicy> {
        @Override
        public SelectionPolicy convert(String value) {
            return SelectionPolicy.fromName(value);
        }
    }

    /** Accepts sampling names in any case, with dashes or underscores. */
    public static class ServiceSamplingConverter implements CommandLine.ITypeConverter<ServiceSampling> {
        @Override
        public ServiceSampling convert(String value) {
            return ServiceSampling.fromName(value);
        }
    }

    /**
     * Writes the given overrides into the builder.
     */
    public SimulationConfig.Builder applyTo(SimulationConfig.Builder builder) {
        if (horizon != null) {
            builder.horizon(horizon);
        }
        if (capacity != null) {
            builder.capacity(capacity);
        }
        if (rides != null) {
            builder.rideCount(rides);
        }
        if (policy != null) {
            builder.selectionPolicy(policy);
        }
        if (retryBound != null) {
            builder.retryBound(retryBound);
        }
        if (noFailures) {
            builder.failuresEnabled(false);
        }
        if (serviceSampling != null) {
            builder.serviceSampling(serviceSampling);
        }
        return builder;
    }
}
