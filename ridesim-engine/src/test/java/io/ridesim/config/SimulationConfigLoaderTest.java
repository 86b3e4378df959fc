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


package io.ridesim.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class SimulationConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    public void testYamlDocument() {
        String yaml = """
            horizon: 600
            seed: 7
            rides:
              capacities: [5, 10, 15, 20]
            arrivals:
              bands:
                - { start: 0, rate: 8 }
                - { start: 300, rate: 20 }
            failures:
              enabled: false
            service:
              sampling: fixed
              fixed: 3.5
            selection:
              policy: unconditional_queue
            """;
        SimulationConfig config = SimulationConfigLoader.parse(yaml);

        assertThat(config.getHorizon()).isEqualTo(600.0);
        assertThat(config.getSeed()).isEqualTo(7L);
        assertThat(config.getCapacities()).containsExactly(5, 10, 15, 20);
        assertThat(config.getArrivalBands()).containsExactly(new RateBand(0.0, 8.0), new RateBand(300.0, 20.0));
        assertThat(config.isFailuresEnabled()).isFalse();
        assertThat(config.getServiceSampling()).isEqualTo(ServiceSampling.FIXED);
        assertThat(config.getFixedServiceMinutes()).isEqualTo(3.5);
        assertThat(config.getSelectionPolicy()).isEqualTo(SelectionPolicy.UNCONDITIONAL_QUEUE);
        assertThat(config.getRetryBound()).isEqualTo(SimulationConfig.DEFAULT_RETRY_BOUND);
    }

    @Test
    public void testJsonDocument() {
        String json = "{\"horizon\": 120, \"rides\": {\"count\": 2, \"capacity\": 4},"
            + " \"selection\": {\"policy\": \"bounded_retry\", \"retry_bound\": 2}}";
        SimulationConfig config = SimulationConfigLoader.parse(json);
        assertThat(config.getHorizon()).isEqualTo(120.0);
        assertThat(config.getCapacities()).containsExactly(4, 4);
        assertThat(config.getRetryBound()).isEqualTo(2);
    }

    @Test
    public void testEmptyDocumentGivesDefaults() {
        assertThat(SimulationConfigLoader.parse("")).isEqualTo(SimulationConfig.defaults());
    }

    @Test
    public void testUnknownKeysAndWrongTypesAreAllReported() {
        String yaml = """
            horizon: lots
            colour: blue
            rides:
              count: 2.5
              speed: 3
            failures:
              enabled: maybe
            """;
        InvalidConfigurationException e = catchThrowableOfType(
            () -> SimulationConfigLoader.parse(yaml), InvalidConfigurationException.class);
        assertThat(e).isNotNull();
        assertThat(e.getViolations()).containsExactlyInAnyOrder(
            "unknown key 'colour'",
            "unknown key 'rides.speed'",
            "horizon must be a number, but was lots",
            "rides.count must be a whole number, but was 2.5",
            "failures.enabled must be true or false, but was maybe");
    }

    @Test
    public void testSemanticViolationsSurfaceOnBuild() {
        assertThatThrownBy(() -> SimulationConfigLoader.parse("rides:\n  capacity: 0\n"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("capacity of ride 0");
    }

    @Test
    public void testMalformedDocuments() {
        assertThatThrownBy(() -> SimulationConfigLoader.parse("horizon: [1, 2"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("malformed YAML");
        assertThatThrownBy(() -> SimulationConfigLoader.parse("{\"horizon\": }"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("malformed JSON");
        assertThatThrownBy(() -> SimulationConfigLoader.parse("- 1\n- 2\n"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("must be a mapping");
    }

    @Test
    public void testYamlOutputLoadsBackToSameConfig() {
        SimulationConfig config = SimulationConfig.builder()
            .seed(99L)
            .capacities(List.of(3, 6))
            .serviceSampling(ServiceSampling.PER_VISIT)
            .build();
        String yaml = SimulationConfigLoader.toYaml(config);
        assertThat(yaml).contains("sampling: per_visit").contains("retry_bound: 5");
        assertThat(SimulationConfigLoader.parse(yaml)).isEqualTo(config);
        assertThat(SimulationConfigLoader.parse(SimulationConfigLoader.toJson(config))).isEqualTo(config);
    }

    @Test
    public void testLoadFromFileAndApplyOverrides() throws IOException {
        Path file = tempDir.resolve("park.yaml");
        Files.writeString(file, "seed: 5\nhorizon: 60\n");
        SimulationConfig loaded = SimulationConfigLoader.load(file);
        assertThat(loaded.getSeed()).isEqualTo(5L);

        SimulationConfig overridden = SimulationConfigLoader.builderFrom(file).seed(6L).build();
        assertThat(overridden.getSeed()).isEqualTo(6L);
        assertThat(overridden.getHorizon()).isEqualTo(60.0);
    }

    @Test
    public void testWholeNumbersOutsideIntRangeAreRejected() {
        String yaml = """
            rides:
              count: 4294967297
              capacities: [10, 2147483648]
            selection:
              retry_bound: 4294967301
            """;
        InvalidConfigurationException e = catchThrowableOfType(
            () -> SimulationConfigLoader.parse(yaml), InvalidConfigurationException.class);
        assertThat(e).isNotNull();
        assertThat(e.getViolations()).containsExactlyInAnyOrder(
            "rides.count must be between -2147483648 and 2147483647, but was 4294967297",
            "rides.capacities[1] must be between -2147483648 and 2147483647, but was 2147483648",
            "selection.retry_bound must be between -2147483648 and 2147483647, but was 4294967301");
    }

    @Test
    public void testSeedOutsideLongRangeIsRejected() {
        assertThatThrownBy(() -> SimulationConfigLoader.parse("seed: 18446744073709551617\n"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("seed must be between");
        assertThatThrownBy(() -> SimulationConfigLoader.parse("{\"seed\": 18446744073709551617}"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("seed must be between");
        assertThat(SimulationConfigLoader.parse("seed: 9223372036854775807\n").getSeed())
            .isEqualTo(Long.MAX_VALUE);
    }

    @Test
    public void testLargeJsonSeedMatchesYamlSeed() {
        SimulationConfig fromJson = SimulationConfigLoader.parse("{\"seed\": 9007199254740993}");
        SimulationConfig fromYaml = SimulationConfigLoader.parse("seed: 9007199254740993\n");
        assertThat(fromJson.getSeed()).isEqualTo(9007199254740993L);
        assertThat(fromJson).isEqualTo(fromYaml);
    }
}
