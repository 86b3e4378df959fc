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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.ridesim.config.SimulationConfig;
import io.ridesim.stats.QueueWaitHistogram;
import io.ridesim.stats.RideStatistics;
import io.ridesim.stats.StatisticsSnapshot;

/// JSON rendering of a run: the effective configuration, the raw snapshot and the
/// aggregates derived from it.
public class SnapshotJson {

    private final static Gson gson = new GsonBuilder().setPrettyPrinting().create();

    private SnapshotJson() {
    }

    public static JsonObject toJsonTree(SimulationConfig config, StatisticsSnapshot snapshot, double arrivalBinMinutes,
                                        int waitBins) {
        JsonObject root = new JsonObject();
        root.add("config", gson.toJsonTree(config.toMap()));

        JsonObject summary = new JsonObject();
        summary.addProperty("totalVisitors", snapshot.totalVisitors());
        summary.addProperty("arrivals", snapshot.arrivalCount());
        summary.addProperty("balkedVisitors", snapshot.balkedVisitors());
        summary.addProperty("averageQueueWait", snapshot.averageQueueWait());
        summary.addProperty("maxQueueWait", snapshot.maxQueueWait());
        summary.addProperty("utilization", snapshot.utilization());
        summary.addProperty("totalUsage", snapshot.totalUsage());
        summary.addProperty("totalFailures", snapshot.totalFailures());
        summary.addProperty("arrivalBinMinutes", arrivalBinMinutes);
        JsonArray bins = new JsonArray();
        for (int count : snapshot.arrivalsPerInterval(arrivalBinMinutes)) {
            bins.add(count);
        }
        summary.add("arrivalsPerInterval", bins);

        JsonArray shares = new JsonArray();
        for (RideStatistics ride : snapshot.rides()) {
            shares.add(snapshot.usageSharePercent(ride.index()));
        }
        summary.add("usageSharePercent", shares);

        QueueWaitHistogram histogram = snapshot.queueWaitHistogram(waitBins);
        JsonObject waits = new JsonObject();
        waits.addProperty("binWidth", histogram.binWidth());
        JsonArray waitCounts = new JsonArray();
        for (int count : histogram.counts()) {
            waitCounts.add(count);
        }
        waits.add("counts", waitCounts);
        summary.add("queueWaitHistogram", waits);
        root.add("summary", summary);

        root.add("snapshot", gson.toJsonTree(snapshot));
        return root;
    }

    public static String toJson(SimulationConfig config, StatisticsSnapshot snapshot, double arrivalBinMinutes,
                                int waitBins) {
        return gson.toJson(toJsonTree(config, snapshot, arrivalBinMinutes, waitBins));
    }
}
