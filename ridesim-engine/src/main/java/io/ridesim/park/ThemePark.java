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
import io.ridesim.stats.StatisticsCollector;
import io.ridesim.stats.StatisticsSnapshot;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Everything the processes of one run share: the rides, the random stream, the
/// service-duration model, the selection policy and the statistics collector.
///
/// A park belongs to exactly one {@link Scheduler}. It is passed explicitly to
/// every process it creates; nothing here is global.
public class ThemePark {

    private final SimulationConfig config;
    private final Scheduler scheduler;
    private final UniformRandomProvider rng;
    private final List<Resource> rides;
    private final ServiceDurations serviceDurations;
    private final RideSelector selector;
    private final StatisticsCollector statistics;
    private long lastVisitorId = 0;

    public ThemePark(SimulationConfig config, Scheduler scheduler, UniformRandomProvider rng) {
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.rng = Objects.requireNonNull(rng, "rng");

        List<Resource> built = new ArrayList<>(config.getRideCount());
        for (int i = 0; i < config.getRideCount(); i++) {
            built.add(new Resource(scheduler, i, "Ride " + i, config.getCapacity(i)));
        }
        this.rides = List.copyOf(built);
        this.serviceDurations = ServiceDurations.fromConfig(config, rng);
        this.selector = new RideSelector(config.getSelectionPolicy(), config.getRetryBound());
        this.statistics = new StatisticsCollector(config.getRideCount());
    }

    /// Creates the next visitor with a freshly incremented id. The caller spawns it.
    public VisitorProcess newVisitor() {
        return new VisitorProcess(++lastVisitorId, this);
    }

    /// Freezes the statistics into the snapshot of this run.
    public StatisticsSnapshot snapshot(double horizon) {
        int[] peakQueues = new int[rides.size()];
        for (int i = 0; i < rides.size(); i++) {
            peakQueues[i] = rides.get(i).getPeakQueueLength();
        }
        return statistics.freeze(horizon, serviceDurations.overallMean(), serviceDurations.rideMeans(), peakQueues);
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public UniformRandomProvider getRandom() {
        return rng;
    }

    public List<Resource> getRides() {
        return rides;
    }

    public Resource getRide(int index) {
        return rides.get(index);
    }

    public ServiceDurations getServiceDurations() {
        return serviceDurations;
    }

    public RideSelector getSelector() {
        return selector;
    }

    public StatisticsCollector getStatistics() {
        return statistics;
    }

    public long getVisitorCount() {
        return lastVisitorId;
    }
}
