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

import com.google.gson.JsonObject;
import io.ridesim.config.SimulationConfig;
import io.ridesim.stats.StatisticsCollector;
import io.ridesim.stats.StatisticsSnapshot;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class SummaryTableRendererTest {

    private static StatisticsSnapshot snapshot() {
        StatisticsCollector collector = new StatisticsCollector(2);
        collector.recordArrival(1.0);
        collector.recordArrival(12.0);
        collector.recordArrival(14.0);
        collector.recordQueueWait(0.0);
        collector.recordQueueWait(4.0);
        collector.recordUsage(0);
        collector.recordUsage(1);
        collector.recordFailure(1);
        collector.recordBalk();
        return collector.freeze(25.0, 5.0, new double[]{4.5, 5.5}, new int[]{0, 1});
    }

    @Test
    public void testRendersAllBlocks() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        SimulationConfig config = SimulationConfig.builder().rideCount(2).capacity(3).build();

        new SummaryTableRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8))
            .render(config, snapshot(), 10.0, 2);

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertThat(output)
            .contains("│      0 │        3 │        1 │  50.00% │        0 │          0 │        4.50 │")
            .contains("│      1 │        3 │        1 │  50.00% │        1 │          1 │        5.50 │")
            .contains("- Total visitors: 2")
            .contains("- Arrivals: 3")
            .contains("- Visitors who gave up: 1")
            .contains("- Average queue time: 2.00 minutes")
            .contains("- Longest queue time: 4.00 minutes")
            .contains("- Average ride utilization: 20.00%")
            .contains("- Ride 1 was used 1 times and failed 1 times")
            .contains("Queue Time Distribution")
            .contains("│           0.00 - 2.00 │        1 │")
            .contains("│           2.00 - 4.00 │        1 │")
            .contains("Arrivals per 10 minutes")
            .contains("│              0 - 10 │        1 │")
            .contains("│             10 - 20 │        2 │")
            .contains("│             20 - 25 │        0 │");
    }

    @Test
    public void testFractionalMinutes() {
        assertThat(SummaryTableRenderer.formatMinutes(7.5)).isEqualTo("7.50");
        assertThat(SummaryTableRenderer.formatMinutes(480.0)).isEqualTo("480");
    }

    @Test
    public void testJsonCarriesSummaryAndRawSamples() {
        SimulationConfig config = SimulationConfig.builder().rideCount(2).build();
        JsonObject json = SnapshotJson.toJsonTree(config, snapshot(), 5.0, 4);

        JsonObject summary = json.getAsJsonObject("summary");
        assertThat(summary.get("totalVisitors").getAsInt()).isEqualTo(2);
        assertThat(summary.get("balkedVisitors").getAsInt()).isEqualTo(1);
        assertThat(summary.get("utilization").getAsDouble()).isEqualTo(0.2);
        assertThat(summary.getAsJsonArray("arrivalsPerInterval")).hasSize(5);
        assertThat(summary.getAsJsonArray("usageSharePercent").get(0).getAsDouble()).isEqualTo(50.0);
        assertThat(summary.getAsJsonArray("usageSharePercent").get(1).getAsDouble()).isEqualTo(50.0);
        JsonObject waits = summary.getAsJsonObject("queueWaitHistogram");
        assertThat(waits.get("binWidth").getAsDouble()).isEqualTo(1.0);
        assertThat(waits.getAsJsonArray("counts").toString()).isEqualTo("[1,0,0,1]");
        assertThat(json.getAsJsonObject("snapshot").getAsJsonArray("arrivalTimes")).hasSize(3);
        assertThat(json.getAsJsonObject("config").get("horizon").getAsDouble()).isEqualTo(480.0);
    }
}
