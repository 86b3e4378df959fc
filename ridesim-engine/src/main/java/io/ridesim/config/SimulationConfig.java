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

package io.ridesim.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable parameters for a single simulation run.
 *
 * <p>Instances are created through {@link #builder()}, which starts from the park
 * defaults (an eight hour day, three rides of ten seats, arrivals rising from 5 to
 * 10 to 15 per hour every two hours, outages roughly every 90 minutes lasting about
 * 15) and validates everything in {@link Builder#build()}. A configuration that
 * builds is guaranteed to run.</p>
 *
 * <p>{@link #toMap()} renders the configuration with the same keys
 * {@link SimulationConfigLoader} reads, so a dumped configuration can be edited and
 * loaded back.</p>
 */
public final class SimulationConfig {

    public static final double DEFAULT_HORIZON = 480.0;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_RIDE_COUNT = 3;
    public static final int DEFAULT_CAPACITY = 10;
    public static final List<RateBand> DEFAULT_BANDS = List.of(
        new RateBand(0.0, 5.0),
        new RateBand(120.0, 10.0),
        new RateBand(240.0, 15.0));
    public static final double DEFAULT_MEAN_TIME_TO_FAILURE = 90.0;
    public static final double DEFAULT_MEAN_REPAIR_TIME = 15.0;
    public static final double DEFAULT_SERVICE_MIN = 4.0;
    public static final double DEFAULT_SERVICE_MODE = 5.0;
    public static final double DEFAULT_SERVICE_MAX = 6.0;
    public static final double DEFAULT_FIXED_SERVICE = 5.0;
    public static final int DEFAULT_RETRY_BOUND = 5;

    private final double horizon;
    private final long seed;
    private final List<Integer> capacities;
    private final List<RateBand> arrivalBands;
    private final boolean failuresEnabled;
    private final double meanTimeToFailure;
    private final double meanRepairTime;
    private final ServiceSampling serviceSampling;
    private final double serviceMin;
    private final double serviceMode;
    private final double serviceMax;
    private final double fixedServiceMinutes;
    private final SelectionPolicy selectionPolicy;
    private final int retryBound;

    private SimulationConfig(Builder builder, List<Integer> capacities) {
        this.horizon = builder.horizon;
        this.seed = builder.seed;
        this.capacities = List.copyOf(capacities);
        this.arrivalBands = List.copyOf(builder.arrivalBands);
        this.failuresEnabled = builder.failuresEnabled;
        this.meanTimeToFailure = builder.meanTimeToFailure;
        this.meanRepairTime = builder.meanRepairTime;
        this.serviceSampling = builder.serviceSampling;
        this.serviceMin = builder.serviceMin;
        this.serviceMode = builder.serviceMode;
        this.serviceMax = builder.serviceMax;
        this.fixedServiceMinutes = builder.fixedServiceMinutes;
        this.selectionPolicy = builder.selectionPolicy;
        this.retryBound = builder.retryBound;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the default park configuration */
    public static SimulationConfig defaults() {
        return builder().build();
    }

    /** @return a builder pre-populated with this configuration's values */
    public Builder toBuilder() {
        return new Builder()
            .horizon(horizon)
            .seed(seed)
            .capacities(capacities)
            .arrivalBands(arrivalBands)
            .failuresEnabled(failuresEnabled)
            .meanTimeToFailure(meanTimeToFailure)
            .meanRepairTime(meanRepairTime)
            .serviceSampling(serviceSampling)
            .triangularService(serviceMin, serviceMode, serviceMax)
            .fixedServiceMinutes(fixedServiceMinutes)
            .selectionPolicy(selectionPolicy)
            .retryBound(retryBound);
    }

    public double getHorizon() {
        return horizon;
    }

    public long getSeed() {
        return seed;
    }

    public int getRideCount() {
        return capacities.size();
    }

    public List<Integer> getCapacities() {
        return capacities;
    }

    public int getCapacity(int rideIndex) {
        return capacities.get(rideIndex);
    }

    public List<RateBand> getArrivalBands() {
        return arrivalBands;
    }

    public boolean isFailuresEnabled() {
        return failuresEnabled;
    }

    public double getMeanTimeToFailure() {
        return meanTimeToFailure;
    }

    public double getMeanRepairTime() {
        return meanRepairTime;
    }

    public ServiceSampling getServiceSampling() {
        return serviceSampling;
    }

    public double getServiceMin() {
        return serviceMin;
    }

    public double getServiceMode() {
        return serviceMode;
    }

    public double getServiceMax() {
        return serviceMax;
    }

    public double getFixedServiceMinutes() {
        return fixedServiceMinutes;
    }

    public SelectionPolicy getSelectionPolicy() {
        return selectionPolicy;
    }

    public int getRetryBound() {
        return retryBound;
    }

    /**
     * Renders this configuration as nested maps and lists using the loader's keys.
     *
     * @return an insertion-ordered map suitable for YAML or JSON output
     */
    public Map<String, Object> toMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("horizon", horizon);
        root.put("seed", seed);

        Map<String, Object> rides = new LinkedHashMap<>();
        rides.put("count", capacities.size());
        rides.put("capacities", new ArrayList<>(capacities));
        root.put("rides", rides);

        List<Map<String, Object>> bands = new ArrayList<>();
        for (RateBand band : arrivalBands) {
            Map<String, Object> b = new LinkedHashMap<>();
            b.put("start", band.start());
            b.put("rate", band.rate());
            bands.add(b);
        }
        root.put("arrivals", new LinkedHashMap<>(Map.of("bands", bands)));

        Map<String, Object> failures = new LinkedHashMap<>();
        failures.put("enabled", failuresEnabled);
        failures.put("mean_time_to_failure", meanTimeToFailure);
        failures.put("mean_repair_time", meanRepairTime);
        root.put("failures", failures);

        Map<String, Object> service = new LinkedHashMap<>();
        service.put("sampling", serviceSampling.configName());
        service.put("min", serviceMin);
        service.put("mode", serviceMode);
        service.put("max", serviceMax);
        service.put("fixed", fixedServiceMinutes);
        root.put("service", service);

        Map<String, Object> selection = new LinkedHashMap<>();
        selection.put("policy", selectionPolicy.configName());
        selection.put("retry_bound", retryBound);
        root.put("selection", selection);
        return root;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationConfig that)) return false;
        return toMap().equals(that.toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return "SimulationConfig" + toMap();
    }

    /**
     * Collects configuration values and validates them as a whole on {@link #build()}.
     */
    public static final class Builder {
        private double horizon = DEFAULT_HORIZON;
        private long seed = DEFAULT_SEED;
        private Integer rideCount;
        private int capacity = DEFAULT_CAPACITY;
        private List<Integer> capacities;
        private List<RateBand> arrivalBands = DEFAULT_BANDS;
        private boolean failuresEnabled = true;
        private double meanTimeToFailure = DEFAULT_MEAN_TIME_TO_FAILURE;
        private double meanRepairTime = DEFAULT_MEAN_REPAIR_TIME;
        private ServiceSampling serviceSampling = ServiceSampling.PER_RIDE;
        private double serviceMin = DEFAULT_SERVICE_MIN;
        private double serviceMode = DEFAULT_SERVICE_MODE;
        private double serviceMax = DEFAULT_SERVICE_MAX;
        private double fixedServiceMinutes = DEFAULT_FIXED_SERVICE;
        private SelectionPolicy selectionPolicy = SelectionPolicy.BOUNDED_RETRY;
        private int retryBound = DEFAULT_RETRY_BOUND;

        private Builder() {
        }

        public Builder horizon(double horizon) {
            this.horizon = horizon;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /** Sets the number of rides; each gets the uniform {@link #capacity(int)} unless capacities are listed. */
        public Builder rideCount(int rideCount) {
            this.rideCount = rideCount;
            return this;
        }

        /** Sets one capacity for every ride and clears any per-ride list. */
        public Builder capacity(int capacity) {
            this.capacity = capacity;
            this.capacities = null;
            return this;
        }

        /** Sets a capacity per ride; the list length is the ride count. */
        public Builder capacities(List<Integer> capacities) {
            this.capacities = capacities == null ? null : new ArrayList<>(capacities);
            return this;
        }

        public Builder arrivalBands(List<RateBand> arrivalBands) {
            this.arrivalBands = Objects.requireNonNull(arrivalBands, "arrivalBands");
            return this;
        }

        public Builder failuresEnabled(boolean failuresEnabled) {
            this.failuresEnabled = failuresEnabled;
            return this;
        }

        public Builder meanTimeToFailure(double meanTimeToFailure) {
            this.meanTimeToFailure = meanTimeToFailure;
            return this;
        }

        public Builder meanRepairTime(double meanRepairTime) {
            this.meanRepairTime = meanRepairTime;
            return this;
        }

        public Builder serviceSampling(ServiceSampling serviceSampling) {
            this.serviceSampling = Objects.requireNonNull(serviceSampling, "serviceSampling");
            return this;
        }

        public Builder triangularService(double min, double mode, double max) {
            this.serviceMin = min;
            this.serviceMode = mode;
            this.serviceMax = max;
            return this;
        }

        public Builder fixedServiceMinutes(double fixedServiceMinutes) {
            this.fixedServiceMinutes = fixedServiceMinutes;
            return this;
        }

        public Builder selectionPolicy(SelectionPolicy selectionPolicy) {
            this.selectionPolicy = Objects.requireNonNull(selectionPolicy, "selectionPolicy");
            return this;
        }

        public Builder retryBound(int retryBound) {
            this.retryBound = retryBound;
            return this;
        }

        /**
         * Validates the collected values and creates the configuration.
         *
         * @throws InvalidConfigurationException listing every problem found
         */
        public SimulationConfig build() {
            List<String> violations = new ArrayList<>();

            if (!Double.isFinite(horizon) || horizon < 0.0) {
                violations.add("horizon must be a finite, non-negative number of minutes, but was " + horizon);
            }

            List<Integer> resolved = resolveCapacities(violations);

            validateBands(violations);

            if (failuresEnabled) {
                if (!(meanTimeToFailure > 0.0) || !Double.isFinite(meanTimeToFailure)) {
                    violations.add("failures.mean_time_to_failure must be positive, but was " + meanTimeToFailure);
                }
                if (!(meanRepairTime > 0.0) || !Double.isFinite(meanRepairTime)) {
                    violations.add("failures.mean_repair_time must be positive, but was " + meanRepairTime);
                }
            }

            if (!(serviceMin >= 0.0 && serviceMin <= serviceMode && serviceMode <= serviceMax)
                || !Double.isFinite(serviceMax)) {
                violations.add(String.format("service triangle must satisfy 0 <= min <= mode <= max, but was %s/%s/%s",
                    serviceMin, serviceMode, serviceMax));
            }
            if (!(fixedServiceMinutes >= 0.0) || !Double.isFinite(fixedServiceMinutes)) {
                violations.add("service.fixed must be a non-negative number of minutes, but was " + fixedServiceMinutes);
            }
            if (retryBound < 0) {
                violations.add("selection.retry_bound must not be negative, but was " + retryBound);
            }

            if (!violations.isEmpty()) {
                throw new InvalidConfigurationException(violations);
            }
            return new SimulationConfig(this, resolved);
        }

        private List<Integer> resolveCapacities(List<String> violations) {
            List<Integer> resolved;
            if (capacities != null) {
                resolved = capacities;
                if (rideCount != null && rideCount != capacities.size()) {
                    violations.add("rides.count is " + rideCount + " but " + capacities.size()
                        + " capacities were given");
                }
            } else {
                int count = rideCount == null ? DEFAULT_RIDE_COUNT : rideCount;
                resolved = count > 0 ? Collections.nCopies(count, capacity) : List.of();
            }
            if (resolved.isEmpty()) {
                violations.add("at least one ride is required");
            }
            for (int i = 0; i < resolved.size(); i++) {
                Integer c = resolved.get(i);
                if (c == null || c < 1) {
                    violations.add("capacity of ride " + i + " must be positive, but was " + c);
                }
            }
            return resolved;
        }

        private void validateBands(List<String> violations) {
            if (arrivalBands.isEmpty()) {
                violations.add("arrivals.bands must contain at least one band");
                return;
            }
            double previousStart = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < arrivalBands.size(); i++) {
                RateBand band = arrivalBands.get(i);
                if (band == null) {
                    violations.add("arrival band " + i + " is missing");
                    continue;
                }
                if (i == 0 && band.start() != 0.0) {
                    violations.add("the first arrival band must start at 0, but starts at " + band.start());
                }
                if (!(band.start() > previousStart) || !Double.isFinite(band.start())) {
                    violations.add("arrival band starts must be finite and strictly increasing, but band " + i
                        + " starts at " + band.start());
                }
                if (!(band.rate() > 0.0) || !Double.isFinite(band.rate())) {
                    violations.add("arrival rate of band " + i + " must be positive, but was " + band.rate());
                }
                previousStart = band.start();
            }
        }
    }
}
