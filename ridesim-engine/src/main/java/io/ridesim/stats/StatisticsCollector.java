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

package io.ridesim.stats;

import java.util.ArrayList;
import java.util.List;

/// Append-only store of the measurable outcomes of one run.
///
/// Visitor processes and failure cycles write into the collector as the run
/// progresses. No aggregation happens here; {@link #freeze} turns the raw samples
/// into an immutable {@link StatisticsSnapshot} once the scheduler has stopped, and
/// any later write is rejected.
public class StatisticsCollector {

    private final int rideCount;
    private final List<Double> queueWaits = new ArrayList<>();
    private final List<Double> arrivalTimes = new ArrayList<>();
    private final int[] usageCounts;
    private final int[] failureCounts;
    private int balkedVisitors = 0;
    private boolean frozen = false;

    public StatisticsCollector(int rideCount) {
        if (rideCount < 0) {
            throw new IllegalArgumentException("Ride count must not be negative: " + rideCount);
        }
        this.rideCount = rideCount;
        this.usageCounts = new int[rideCount];
        this.failureCounts = new int[rideCount];
    }

    /// Records how long a visitor waited between requesting a ride and boarding it.
    public void recordQueueWait(double minutes) {
        checkWritable();
        if (!(minutes >= 0.0)) {
            throw new IllegalArgumentException("Queue wait must be non-negative: " + minutes);
        }
        queueWaits.add(minutes);
    }

    public void recordUsage(int rideIndex) {
        checkWritable();
        usageCounts[rideIndex]++;
    }

    public void recordFailure(int rideIndex) {
        checkWritable();
        failureCounts[rideIndex]++;
    }

    public void recordArrival(double time) {
        checkWritable();
        arrivalTimes.add(time);
    }

    /// Records a visitor who left without queueing because every ride it tried was down.
    public void recordBalk() {
        checkWritable();
        balkedVisitors++;
    }

    public int getRideCount() {
        return rideCount;
    }

    public int getUsageCount(int rideIndex) {
        return usageCounts[rideIndex];
    }

    public int getFailureCount(int rideIndex) {
        return failureCounts[rideIndex];
    }

    public int getQueueWaitCount() {
        return queueWaits.size();
    }

    public int getArrivalCount() {
        return arrivalTimes.size();
    }

    public int getBalkedVisitors() {
        return balkedVisitors;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /// Closes the collector and produces the immutable snapshot of this run.
    ///
    /// @param horizon the simulated minutes the run covered
    /// @param meanServiceMinutes the overall mean ride duration used for utilization
    /// @param rideServiceMinutes the mean ride duration of each ride
    /// @param peakQueueLengths the longest wait-queue observed at each ride
    /// @return the snapshot
    public StatisticsSnapshot freeze(double horizon, double meanServiceMinutes,
                                     double[] rideServiceMinutes, int[] peakQueueLengths) {
        if (rideServiceMinutes.length != rideCount || peakQueueLengths.length != rideCount) {
            throw new IllegalArgumentException("Per-ride arrays must have one entry for each of " + rideCount + " rides");
        }
        frozen = true;
        List<RideStatistics> rides = new ArrayList<>(rideCount);
        for (int i = 0; i < rideCount; i++) {
            rides.add(new RideStatistics(i, usageCounts[i], failureCounts[i], peakQueueLengths[i],
                rideServiceMinutes[i]));
        }
        return new StatisticsSnapshot(horizon, rideCount, queueWaits, arrivalTimes, rides, balkedVisitors,
            meanServiceMinutes);
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Statistics are read-only once the run has ended");
        }
    }
}
