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

import io.ridesim.config.SimulationConfig;
import io.ridesim.engine.Resource;
import io.ridesim.engine.Scheduler;
import io.ridesim.random.RandomGenerators;
import io.ridesim.stats.StatisticsSnapshot;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Wires one run together: a fresh scheduler, one seeded random stream, the park,
/// the arrival generator and a failure cycle per ride, then runs to the horizon.
///
/// Every run owns all of its state, so any number of runs may proceed on separate
/// threads, and two runs with the same configuration produce equal snapshots.
public class ThemeParkSimulation {

    private static final Logger logger = LogManager.getLogger(ThemeParkSimulation.class);

    private final SimulationConfig config;
    private final Scheduler scheduler;
    private final ThemePark park;
    private boolean finished = false;

    public ThemeParkSimulation(SimulationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = new Scheduler();
        UniformRandomProvider rng = RandomGenerators.create(config.getSeed());
        this.park = new ThemePark(config, scheduler, rng);
    }

    /// Convenience for a single run with the given configuration.
    public static StatisticsSnapshot runSimulation(SimulationConfig config) {
        return new ThemeParkSimulation(config).run();
    }

    /// Runs the simulation once.
    ///
    /// @return the statistics of the run
    /// @throws IllegalStateException if this simulation has already run
    public StatisticsSnapshot run() {
        if (finished) {
            throw new IllegalStateException("A simulation can only be run once");
        }
        finished = true;

        logger.info("Starting theme park simulation: {} rides, horizon {} min, seed {}, policy {}, failures {}",
            config.getRideCount(), config.getHorizon(), config.getSeed(),
            config.getSelectionPolicy().configName(), config.isFailuresEnabled() ? "on" : "off");

        scheduler.spawn(new ArrivalGenerator(park, new RateSchedule(config.getArrivalBands())));
        if (config.isFailuresEnabled()) {
            for (Resource ride : park.getRides()) {
                scheduler.spawn(new FailureRepairCycle(park, ride, config.getMeanTimeToFailure(),
                    config.getMeanRepairTime()));
            }
        }

        scheduler.run(config.getHorizon());
        StatisticsSnapshot snapshot = park.snapshot(config.getHorizon());

        logger.info("Simulation finished at t={}: {} arrivals, {} boarded, {} balked, {} failures, {} events",
            scheduler.now(), snapshot.arrivalCount(), snapshot.totalVisitors(), snapshot.balkedVisitors(),
            snapshot.totalFailures(), scheduler.getEventsDispatched());
        return snapshot;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public ThemePark getPark() {
        return park;
    }
}
