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

import io.ridesim.config.ServiceSampling;
import io.ridesim.config.SimulationConfig;
import io.ridesim.random.RandomGenerators;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class ServiceDurationsTest {

    @Test
    public void testFixedDurations() {
        SimulationConfig config = SimulationConfig.builder()
            .serviceSampling(ServiceSampling.FIXED)
            .fixedServiceMinutes(7.5)
            .build();
        ServiceDurations durations = ServiceDurations.fromConfig(config, RandomGenerators.create(1L));
        assertThat(durations.sample(0)).isEqualTo(7.5);
        assertThat(durations.sample(2)).isEqualTo(7.5);
        assertThat(durations.overallMean()).isEqualTo(7.5);
        assertThat(durations.rideMeans()).containsExactly(7.5, 7.5, 7.5);
    }

    @Test
    public void testPerRideDurationsAreDrawnOnceAndReused() {
        SimulationConfig config = SimulationConfig.builder()
            .rideCount(4)
            .serviceSampling(ServiceSampling.PER_RIDE)
            .triangularService(4.0, 5.0, 6.0)
            .build();
        ServiceDurations durations = ServiceDurations.fromConfig(config, RandomGenerators.create(21L));
        double[] means = durations.rideMeans();
        double sum = 0.0;
        for (int i = 0; i < 4; i++) {
            assertThat(means[i]).isBetween(4.0, 6.0);
            assertThat(durations.sample(i)).isEqualTo(means[i]);
            assertThat(durations.sample(i)).isEqualTo(means[i]);
            sum += means[i];
        }
        assertThat(durations.overallMean()).isCloseTo(sum / 4, within(1e-12));
    }

    @Test
    public void testPerRideDurationsDependOnlyOnSeed() {
        SimulationConfig config = SimulationConfig.defaults();
        double[] a = ServiceDurations.fromConfig(config, RandomGenerators.create(42L)).rideMeans();
        double[] b = ServiceDurations.fromConfig(config, RandomGenerators.create(42L)).rideMeans();
        assertThat(a).containsExactly(b);
    }

    @Test
    public void testPerVisitDurationsVaryAroundTheAnalyticMean() {
        SimulationConfig config = SimulationConfig.builder()
            .serviceSampling(ServiceSampling.PER_VISIT)
            .triangularService(2.0, 3.0, 7.0)
            .build();
        ServiceDurations durations = ServiceDurations.fromConfig(config, RandomGenerators.create(8L));
        assertThat(durations.overallMean()).isCloseTo(4.0, within(1e-12));
        assertThat(durations.meanFor(1)).isCloseTo(4.0, within(1e-12));

        double total = 0.0;
        int n = 20_000;
        for (int i = 0; i < n; i++) {
            double d = durations.sample(i % 3);
            assertThat(d).isBetween(2.0, 7.0);
            total += d;
        }
        assertThat(total / n).isCloseTo(4.0, within(0.05));
    }
}
