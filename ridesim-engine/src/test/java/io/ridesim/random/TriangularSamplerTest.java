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


package io.ridesim.random;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class TriangularSamplerTest {

    @Test
    public void testSamplesStayWithinBoundsAndCentreOnMean() {
        TriangularSampler sampler = new TriangularSampler(RandomGenerators.create(17L), 4.0, 5.0, 6.0);
        double total = 0.0;
        int belowMode = 0;
        int n = 40_000;
        for (int i = 0; i < n; i++) {
            double x = sampler.sample();
            assertThat(x).isBetween(4.0, 6.0);
            if (x < 5.0) {
                belowMode++;
            }
            total += x;
        }
        assertThat(sampler.mean()).isEqualTo(5.0);
        assertThat(total / n).isCloseTo(5.0, within(0.02));
        assertThat((double) belowMode / n).isCloseTo(0.5, within(0.02));
    }

    @Test
    public void testSkewedTriangle() {
        TriangularSampler sampler = new TriangularSampler(RandomGenerators.create(18L), 0.0, 0.0, 3.0);
        double total = 0.0;
        int n = 40_000;
        for (int i = 0; i < n; i++) {
            total += sampler.sample();
        }
        assertThat(sampler.mean()).isEqualTo(1.0);
        assertThat(total / n).isCloseTo(1.0, within(0.03));
    }

    @Test
    public void testDegenerateTriangleIsConstant() {
        TriangularSampler sampler = new TriangularSampler(RandomGenerators.create(1L), 5.0, 5.0, 5.0);
        assertThat(sampler.sample()).isEqualTo(5.0);
        assertThat(sampler.sample()).isEqualTo(5.0);
    }

    @Test
    public void testUnorderedBoundsAreRejected() {
        assertThatThrownBy(() -> new TriangularSampler(RandomGenerators.create(1L), 5.0, 4.0, 6.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
