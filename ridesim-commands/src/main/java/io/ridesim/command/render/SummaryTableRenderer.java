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


package io.ridesim.command.render;

import io.ridesim.config.SimulationConfig;
import io.ridesim.stats.QueueWaitHistogram;
import io.ridesim.stats.RideStatistics;
import io.ridesim.stats.StatisticsSnapshot;

import java.io.PrintStream;
import java.util.Locale;

/// Prints the results of a run as console tables.
///
/// Four blocks are printed: a per-ride results table, the summary lines, a
/// histogram of queue waits, and the number of arrivals in each fixed-width
/// interval of the run.
public class SummaryTableRenderer {

    private final PrintStream out;

    public SummaryTableRenderer(PrintStream out) {
        this.out = out;
    }

    public void render(SimulationConfig config, StatisticsSnapshot snapshot, double arrivalBinMinutes,
                       int waitBins) {
        renderRideTable(config, snapshot);
        renderSummary(snapshot);
        renderQueueWaits(snapshot, waitBins);
        renderArrivals(snapshot, arrivalBinMinutes);
    }

    public void renderRideTable(SimulationConfig config, StatisticsSnapshot snapshot) {
        out.println();
        out.println("Simulation Results Table");
        out.println("┌────────┬──────────┬──────────┬─────────┬──────────┬────────────┬─────────────┐");
        out.println("│  Ride  │ Capacity │  Usage   │  Share  │ Failures │ Peak Queue │ Ride (min)  │");
        out.println("├────────┼──────────┼──────────┼─────────┼──────────┼────────────┼─────────────┤");
        for (RideStatistics ride : snapshot.rides()) {
            out.print(String.format(Locale.ROOT, "│ %6d │ %8d │ %8d │ %6.2f%% │ %8d │ %10d │ %11.2f │%n",
                ride.index(), config.getCapacity(ride.index()), ride.usageCount(),
                snapshot.usageSharePercent(ride.index()), ride.failureCount(), ride.peakQueueLength(),
                ride.serviceMinutes()));
        }
        out.println("└────────┴──────────┴──────────┴─────────┴──────────┴────────────┴─────────────┘");
    }

    public void renderSummary(StatisticsSnapshot snapshot) {
        out.println();
        out.println("Simulation Summary");
        out.print(String.format(Locale.ROOT, "- Total visitors: %d%n", snapshot.totalVisitors()));
        out.print(String.format(Locale.ROOT, "- Arrivals: %d%n", snapshot.arrivalCount()));
        out.print(String.format(Locale.ROOT, "- Visitors who gave up: %d%n", snapshot.balkedVisitors()));
        out.print(String.format(Locale.ROOT, "- Average queue time: %.2f minutes%n", snapshot.averageQueueWait()));
        out.print(String.format(Locale.ROOT, "- Longest queue time: %.2f minutes%n", snapshot.maxQueueWait()));
        out.print(String.format(Locale.ROOT, "- Average ride utilization: %.2f%%%n", snapshot.utilization() * 100.0));
        for (RideStatistics ride : snapshot.rides()) {
            out.print(String.format(Locale.ROOT, "- Ride %d was used %d times and failed %d times%n",
                ride.index(), ride.usageCount(), ride.failureCount()));
        }
    }

    public void renderQueueWaits(StatisticsSnapshot snapshot, int bins) {
        QueueWaitHistogram histogram = snapshot.queueWaitHistogram(bins);
        int[] counts = histogram.counts();
        out.println();
        out.println("Queue Time Distribution");
        out.println("┌───────────────────────┬──────────┐");
        out.println("│    Wait (minutes)     │ Visitors │");
        out.println("├───────────────────────┼──────────┤");
        for (int i = 0; i < counts.length; i++) {
            String range = String.format(Locale.ROOT, "%.2f - %.2f", histogram.binStart(i), histogram.binEnd(i));
            out.print(String.format(Locale.ROOT, "│ %21s │ %8d │%n", range, counts[i]));
        }
        out.println("└───────────────────────┴──────────┘");
    }

    public void renderArrivals(StatisticsSnapshot snapshot, double binMinutes) {
        int[] counts = snapshot.arrivalsPerInterval(binMinutes);
        out.println();
        out.print(String.format(Locale.ROOT, "Arrivals per %s minutes%n", formatMinutes(binMinutes)));
        out.println("┌─────────────────────┬──────────┐");
        out.println("│      Interval       │ Arrivals │");
        out.println("├─────────────────────┼──────────┤");
        for (int i = 0; i < counts.length; i++) {
            double start = i * binMinutes;
            double end = Math.min(snapshot.horizon(), start + binMinutes);
            String interval = formatMinutes(start) + " - " + formatMinutes(end);
            out.print(String.format(Locale.ROOT, "│ %19s │ %8d │%n", interval, counts[i]));
        }
        out.println("└─────────────────────┴──────────┘");
    }

    static String formatMinutes(double minutes) {
        if (minutes == Math.rint(minutes) && Math.abs(minutes) < 1e15) {
            return String.valueOf((long) minutes);
        }
        return String.format(Locale.ROOT, "%.2f", minutes);
    }
}
