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

package io.ridesim.park;

import io.ridesim.config.ServiceSampling;
import io.ridesim.config.SimulationConfig;
import io.ridesim.random.RandomGenerators;
import io.ridesim.random.TriangularSampler;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;

import java.util.Arrays;

/// Ride durations for each visit, according to the configured {@link ServiceSampling}.
///
/// With {@link ServiceSampling#PER_RIDE} every ride draws its duration once, in ride
/// order, when this object is created; visits to that ride then always take the
/// same time.
public class ServiceDurations {

    private final ServiceSampling sampling;
    private final double[] rideMeans;
    private final ContinuousSampler perVisit;
    private final double overallMean;

    private ServiceDurations(ServiceSampling sampling, double[] rideMeans, ContinuousSampler perVisit,
                             double overallMean) {
        this.sampling = sampling;
        this.rideMeans = rideMeans;
        this.perVisit = perVisit;
        this.overallMean = overallMean;
    }

    public static ServiceDurations fromConfig(SimulationConfig config, UniformRandomProvider rng) {
        int rides = config.getRideCount();
        switch (config.getServiceSampling()) {
            case FIXED: {
                double[] means = new double[rides];
                Arrays.fill(means, config.getFixedServiceMinutes());
                return new ServiceDurations(ServiceSampling.FIXED, means, null, config.getFixedServiceMinutes());
            }
            case PER_RIDE: {
                ContinuousSampler triangle = RandomGenerators.triangular(rng,
                    config.getServiceMin(), config.getServiceMode(), config.getServiceMax());
                double[] means = new double[rides];
                for (int i = 0; i < rides; i++) {
                    means[i] = triangle.sample();
                }
                double mean = rides == 0 ? 0.0 : Arrays.stream(means).average().orElse(0.0);
                return new ServiceDurations(ServiceSampling.PER_RIDE, means, null, mean);
            }
            case PER_VISIT: {
                TriangularSampler triangle = new TriangularSampler(rng,
                    config.getServiceMin(), config.getServiceMode(), config.getServiceMax());
                double[] means = new double[rides];
                Arrays.fill(means, triangle.mean());
                return new ServiceDurations(ServiceSampling.PER_VISIT, means, triangle, triangle.mean());
            }
            default:
                throw new IllegalArgumentException("Unsupported service sampling " + config.getServiceSampling());
        }
    }

    /// @return how long the next visit to the given ride lasts, in minutes
    public double sample(int rideIndex) {
        if (sampling == ServiceSampling.PER_VISIT) {
            return perVisit.sample();
        }
        return rideMeans[rideIndex];
    }

    /// @return the expected duration of a visit to the given ride
    public double meanFor(int rideIndex) {
        return rideMeans[rideIndex];
    }

    /// @return the mean duration across rides, as used for utilization
    public double overallMean() {
        return overallMean;
    }

    public double[] rideMeans() {
        return rideMeans.clone();
    }

    public ServiceSampling getSampling() {
        return sampling;
    }
}
