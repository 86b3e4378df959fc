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


package io.ridesim.engine;

import java.util.ArrayList;
import java.util.List;

/// Small scripted processes for driving the scheduler in tests.
final class TestProcesses {

    private TestProcesses() {
    }

    /// Holds for a fixed delay, notes the time it woke, then finishes.
    static final class Sleeper extends SimProcess {
        private final double delay;
        private final List<String> log;
        private boolean slept = false;
        double wokeAt = Double.NaN;

        Sleeper(String name, double delay, List<String> log) {
            super(name);
            this.delay = delay;
            this.log = log;
        }

        @Override
        protected Step step(Scheduler scheduler) {
            if (!slept) {
                slept = true;
                return Step.hold(delay);
            }
            wokeAt = scheduler.now();
            log.add(getName() + "@" + wokeAt);
            return Step.done();
        }
    }

    /// Waits before asking for a resource, rides for a fixed time, then releases it.
    static final class Rider extends SimProcess {
        private final Resource resource;
        private final double startDelay;
        private final double rideTime;
        private final List<String> boardings;
        private int phase = 0;
        double requestedAt = Double.NaN;
        double grantedAt = Double.NaN;

        Rider(String name, Resource resource, double startDelay, double rideTime, List<String> boardings) {
            super(name);
            this.resource = resource;
            this.startDelay = startDelay;
            this.rideTime = rideTime;
            this.boardings = boardings;
        }

        Rider(String name, Resource resource, double rideTime, List<String> boardings) {
            this(name, resource, 0.0, rideTime, boardings);
        }

        @Override
        protected Step step(Scheduler scheduler) {
            switch (phase) {
                case 0:
                    phase = 1;
                    if (startDelay > 0.0) {
                        return Step.hold(startDelay);
                    }
                    // fall through when starting right away
                case 1:
                    requestedAt = scheduler.now();
                    phase = 2;
                    return Step.request(resource);
                case 2:
                    grantedAt = scheduler.now();
                    boardings.add(getName());
                    phase = 3;
                    return Step.hold(rideTime);
                case 3:
                    resource.release();
                    phase = 4;
                    return Step.done();
                default:
                    throw new IllegalStateException("resumed after done");
            }
        }

        double waited() {
            return grantedAt - requestedAt;
        }
    }

    /// Switches a resource's operational flag at fixed times.
    static final class Toggler extends SimProcess {
        private final Resource resource;
        private final List<double[]> script = new ArrayList<>();
        private int next = 0;
        private double lastTime = 0.0;

        Toggler(Resource resource) {
            super("toggler-" + resource.getName());
            this.resource = resource;
        }

        Toggler at(double time, boolean operational) {
            script.add(new double[]{time, operational ? 1.0 : 0.0});
            return this;
        }

        @Override
        protected Step step(Scheduler scheduler) {
            if (next > 0) {
                resource.setOperational(script.get(next - 1)[1] > 0.5);
            }
            if (next == script.size()) {
                return Step.done();
            }
            double time = script.get(next)[0];
            double delay = time - lastTime;
            lastTime = time;
            next++;
            return Step.hold(delay);
        }
    }
}
