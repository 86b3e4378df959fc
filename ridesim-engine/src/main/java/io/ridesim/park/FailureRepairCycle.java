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

import io.ridesim.engine.Resource;
import io.ridesim.engine.Scheduler;
import io.ridesim.engine.SimProcess;
import io.ridesim.engine.Step;
import io.ridesim.random.RandomGenerators;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Breaks one ride down and repairs it, forever.
///
/// Time to failure and repair time are both exponential. Visitors already on the
/// ride when it fails finish their ride; the outage only blocks new boardings.
public class FailureRepairCycle extends SimProcess {

    private static final Logger logger = LogManager.getLogger(FailureRepairCycle.class);

    private enum Phase {
        START,
        FAIL,
        REPAIR
    }

    private final ThemePark park;
    private final Resource ride;
    private final ContinuousSampler timeToFailure;
    private final ContinuousSampler repairTime;
    private Phase phase = Phase.START;

    public FailureRepairCycle(ThemePark park, Resource ride, double meanTimeToFailure, double meanRepairTime) {
        super("failures-" + ride.getIndex());
        this.park = park;
        this.ride = ride;
        this.timeToFailure = RandomGenerators.exponential(park.getRandom(), meanTimeToFailure);
        this.repairTime = RandomGenerators.exponential(park.getRandom(), meanRepairTime);
    }

    @Override
    protected Step step(Scheduler scheduler) {
        switch (phase) {
            case START:
                phase = Phase.FAIL;
                return Step.hold(timeToFailure.sample());
            case FAIL:
                if (ride.isOperational()) {
                    ride.setOperational(false);
                    park.getStatistics().recordFailure(ride.getIndex());
                    logger.printf(Level.DEBUG, "[%7.2fm] %s FAILED", scheduler.now(), ride.getName());
                }
                phase = Phase.REPAIR;
                return Step.hold(repairTime.sample());
            case REPAIR:
                ride.setOperational(true);
                logger.printf(Level.DEBUG, "[%7.2fm] %s repaired, %d waiting", scheduler.now(), ride.getName(),
                    ride.getQueueLength());
                phase = Phase.FAIL;
                return Step.hold(timeToFailure.sample());
            default:
                throw new IllegalStateException("Unknown phase " + phase);
        }
    }

    public Resource getRide() {
        return ride;
    }
}
