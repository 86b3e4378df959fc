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

import io.ridesim.engine.Scheduler;
import io.ridesim.engine.SimProcess;
import io.ridesim.engine.Step;
import io.ridesim.random.RandomGenerators;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Spawns visitors with exponentially distributed gaps whose mean follows the
/// rate band in effect when each gap is drawn.
///
/// The generator never completes; it simply stops being resumed once the
/// scheduler reaches the horizon.
public class ArrivalGenerator extends SimProcess {

    private static final Logger logger = LogManager.getLogger(ArrivalGenerator.class);

    private final ThemePark park;
    private final RateSchedule schedule;
    private final ContinuousSampler unitExponential;
    private boolean waiting = false;

    public ArrivalGenerator(ThemePark park, RateSchedule schedule) {
        super("arrivals");
        this.park = park;
        this.schedule = schedule;
        this.unitExponential = RandomGenerators.exponential(park.getRandom(), 1.0);
    }

    @Override
    protected Step step(Scheduler scheduler) {
        if (waiting) {
            VisitorProcess visitor = scheduler.spawn(park.newVisitor());
            logger.trace("Spawned {} at t={}", visitor.getName(), scheduler.now());
        }
        double gap = unitExponential.sample() * schedule.meanGapAt(scheduler.now());
        waiting = true;
        return Step.hold(gap);
    }
}
