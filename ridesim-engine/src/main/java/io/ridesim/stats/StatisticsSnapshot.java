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

import java.util.List;

/// The immutable result of one simulation run.
///
/// Raw samples are kept in the order they were recorded. Aggregates are computed on
/// demand from those samples, so two runs with equal inputs produce equal
/// snapshots.
///
/// @param horizon the simulated minutes the run covered
/// @param rideCount the number of rides in the park
/// @param queueWaits one sample per boarding, in boarding order
/// @param arrivalTimes one timestamp per arrival, in arrival order
/// @param rides per-ride counters, indexed by ride
/// @param balkedVisitors visitors who left without queueing
/// @param meanServiceMinutes the mean ride duration used for utilization
public record StatisticsSnapshot(double horizon,
                                 int rideCount,
                                 List<Double> queueWaits,
                                 List<Double> arrivalTimes,
                                 List<RideStatistics> rides,
                                 int balkedVisitors,
                                 double meanServiceMinutes) {

    /// Upper limit on the number of bins any histogram of a snapshot may have.
    public static final int MAX_BINS = 1_000_000;

    public StatisticsSnapshot {
        queueWaits = List.copyOf(queueWaits);
        arrivalTimes = List.copyOf(arrivalTimes);
        rides = List.copyOf(rides);
    }

    /// @return visitors who boarded a ride, one per queue-wait sample
    public int totalVisitors() {
        return queueWaits.size();
    }

    /// @return visitors who entered the park
    public int arrivalCount() {
        return arrivalTimes.size();
    }

    /// @return the mean queue wait in minutes, or 0 when nobody boarded
    public double averageQueueWait() {
        return queueWaits.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public double maxQueueWait() {
        return queueWaits.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public int totalUsage() {
        return rides.stream().mapToInt(RideStatistics::usageCount).sum();
    }

    public int totalFailures() {
        return rides.stream().mapToInt(RideStatistics::failureCount).sum();
    }

    /// Share of ride capacity-time spent carrying visitors:
    /// `totalUsage * meanServiceMinutes / (horizon * rideCount)`.
    ///
    /// @return the utilization ratio, or 0 for an empty horizon or park
    public double utilization() {
        if (horizon <= 0.0 || rideCount == 0) {
            return 0.0;
        }
        return totalUsage() * meanServiceMinutes / (horizon * rideCount);
    }

    /// Counts arrivals per fixed-width time bin, starting at minute 0.
    ///
    /// @param binMinutes width of each bin, positive
    /// @return one count per bin covering {@code [0, horizon)}
    /// @throws IllegalArgumentException if the width is not positive or would need
    ///     more than {@value #MAX_BINS} bins
    public int[] arrivalsPerInterval(double binMinutes) {
        int bins = intervalCount(horizon, binMinutes);
        int[] counts = new int[bins];
        if (bins == 0) {
            return counts;
        }
        for (double t : arrivalTimes) {
            int bin = Math.min(bins - 1, (int) Math.floor(t / binMinutes));
            counts[bin]++;
        }
        return counts;
    }

    /// Number of bins of width `binMinutes` needed to cover `[0, horizon)`.
    ///
    /// @throws IllegalArgumentException if the width is not positive or the count
    ///     exceeds {@value #MAX_BINS}
    public static int intervalCount(double horizon, double binMinutes) {
        if (!(binMinutes > 0.0)) {
            throw new IllegalArgumentException("Bin width must be positive: " + binMinutes);
        }
        double bins = Math.ceil(horizon / binMinutes);
        if (!(bins <= MAX_BINS)) {
            throw new IllegalArgumentException("Bin width " + binMinutes + " would split " + horizon
                + " minutes into more than " + MAX_BINS + " bins");
        }
        return Math.max(0, (int) bins);
    }

    /// Splits the queue waits into equal-width bins spanning `[0, maxQueueWait]`.
    /// The last bin is closed, so the longest wait lands in it. When every wait is
    /// zero all samples fall into the first bin.
    ///
    /// @param bins number of bins, between 1 and {@value #MAX_BINS}
    /// @return the histogram, with all counts zero when nobody boarded
    public QueueWaitHistogram queueWaitHistogram(int bins) {
        if (bins < 1 || bins > MAX_BINS) {
            throw new IllegalArgumentException("Histogram needs between 1 and " + MAX_BINS + " bins: " + bins);
        }
        double upper = maxQueueWait();
        double width = upper / bins;
        int[] counts = new int[bins];
        for (double wait : queueWaits) {
            int bin = width > 0.0 ? Math.min(bins - 1, (int) Math.floor(wait / width)) : 0;
            counts[bin]++;
        }
        return new QueueWaitHistogram(width, counts);
    }

    /// @return the ride's share of all boardings in percent, or 0 when nobody boarded
    public double usageSharePercent(int rideIndex) {
        int total = totalUsage();
        if (total == 0) {
            return 0.0;
        }
        return rides.get(rideIndex).usageCount() * 100.0 / total;
    }
}
