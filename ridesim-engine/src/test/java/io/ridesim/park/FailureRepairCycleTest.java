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
import io.ridesim.engine.SimProcess;
import io.ridesim.engine.Step;
import io.ridesim.random.RandomGenerators;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class FailureRepairCycleTest {

    /// Counts the minutes during which a ride was down.
    private static final class DowntimeSampler extends SimProcess {
        private final Resource ride;
        int samples = 0;
        int down = 0;

        DowntimeSampler(Resource ride) {
            super("downtime-sampler");
            this.ride = ride;
        }

        @Override
        protected Step step(Scheduler scheduler) {
            samples++;
            if (!ride.isOperational()) {
                down++;
            }
            return Step.hold(1.0);
        }
    }

    @Test
    public void testRideAlternatesBetweenUpAndDown() {
        SimulationConfig config = SimulationConfig.builder().rideCount(1).build();
        Scheduler scheduler = new Scheduler();
        ThemePark park = new ThemePark(config, scheduler, RandomGenerators.create(1234L));
        Resource ride = park.getRide(0);
        FailureRepairCycle cycle = scheduler.spawn(new FailureRepairCycle(park, ride, 90.0, 15.0));
        DowntimeSampler sampler = scheduler.spawn(new DowntimeSampler(ride));

        double horizon = 100_000.0;
        scheduler.run(horizon);

        assertThat(cycle.getName()).isEqualTo("failures-0");
        int failures = park.getStatistics().getFailureCount(0);
        // one failure per 105 minutes on average
        assertThat(failures).isBetween(800, 1110);
        double downFraction = (double) sampler.down / sampler.samples;
        assertThat(downFraction).isBetween(0.11, 0.18);
    }

    @Test
    public void testNoFailureBeforeFirstDraw() {
        SimulationConfig config = SimulationConfig.builder().rideCount(1).build();
        Scheduler scheduler = new Scheduler();
        ThemePark park = new ThemePark(config, scheduler, RandomGenerators.create(9L));
        scheduler.spawn(new FailureRepairCycle(park, park.getRide(0), 90.0, 15.0));

        scheduler.run(0.0);

        assertThat(park.getRide(0).isOperational()).isTrue();
        assertThat(park.getStatistics().getFailureCount(0)).isZero();
    }
}
