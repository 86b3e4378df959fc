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
import io.ridesim.stats.StatisticsCollector;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalInt;

/// One visitor: arrives, picks a ride, queues, rides, leaves.
///
/// The queue wait and the ride's usage count are recorded when the visitor boards.
/// A visitor who gives up under the bounded-retry policy records only a balk, and a
/// visitor still queued when the horizon cuts the run off records nothing beyond
/// its arrival.
public class VisitorProcess extends SimProcess {

    private static final Logger logger = LogManager.getLogger(VisitorProcess.class);

    private enum Phase {
        ARRIVE,
        BOARD,
        LEAVE,
        GONE
    }

    private final long visitorId;
    private final ThemePark park;

    private Phase phase = Phase.ARRIVE;
    private Resource ride;
    private double arrivalTime = Double.NaN;
    private double requestTime = Double.NaN;
    private double queueWait = Double.NaN;
    private boolean queuedOnRequest;
    private boolean balked;

    public VisitorProcess(long visitorId, ThemePark park) {
        super("visitor-" + visitorId);
        this.visitorId = visitorId;
        this.park = park;
    }

    @Override
    protected Step step(Scheduler scheduler) {
        StatisticsCollector statistics = park.getStatistics();
        switch (phase) {
            case ARRIVE: {
                arrivalTime = scheduler.now();
                statistics.recordArrival(arrivalTime);
                logger.printf(Level.DEBUG, "[%7.2fm] Visitor %d arrived", arrivalTime, visitorId);

                OptionalInt choice = park.getSelector().select(park.getRides(), park.getRandom());
                if (choice.isEmpty()) {
                    balked = true;
                    statistics.recordBalk();
                    logger.printf(Level.DEBUG, "[%7.2fm] Visitor %d couldn't find any working ride", arrivalTime,
                        visitorId);
                    phase = Phase.GONE;
                    return Step.done();
                }
                ride = park.getRide(choice.getAsInt());
                requestTime = scheduler.now();
                queuedOnRequest = !ride.isOperational() || ride.getQueueLength() > 0
                    || ride.getOccupancy() >= ride.getCapacity();
                phase = Phase.BOARD;
                return Step.request(ride);
            }
            case BOARD: {
                queueWait = scheduler.now() - requestTime;
                statistics.recordQueueWait(queueWait);
                statistics.recordUsage(ride.getIndex());
                logger.printf(Level.DEBUG, "[%7.2fm] Visitor %d started %s after waiting %.2f min",
                    scheduler.now(), visitorId, ride.getName(), queueWait);
                phase = Phase.LEAVE;
                return Step.hold(park.getServiceDurations().sample(ride.getIndex()));
            }
            case LEAVE: {
                ride.release();
                logger.printf(Level.DEBUG, "[%7.2fm] Visitor %d finished %s", scheduler.now(), visitorId,
                    ride.getName());
                phase = Phase.GONE;
                return Step.done();
            }
            default:
                throw new IllegalStateException("Visitor " + visitorId + " resumed after leaving");
        }
    }

    public long getVisitorId() {
        return visitorId;
    }

    public double getArrivalTime() {
        return arrivalTime;
    }

    /// @return minutes between request and boarding, or NaN if the visitor has not boarded
    public double getQueueWait() {
        return queueWait;
    }

    /// @return the chosen ride's index, or -1 if no ride was chosen
    public int getRideIndex() {
        return ride == null ? -1 : ride.getIndex();
    }

    /// @return whether the ride was down, full or had a queue when the visitor asked for it
    public boolean wasQueuedOnRequest() {
        return queuedOnRequest;
    }

    public boolean hasBalked() {
        return balked;
    }

    public boolean hasBoarded() {
        return !Double.isNaN(queueWait);
    }
}
