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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;

import java.util.Objects;

/**
 * Samples a triangular distribution on {@code [min, max]} peaking at {@code mode},
 * by inverting its CDF. A degenerate triangle ({@code min == max}) always yields
 * {@code min}.
 */
public class TriangularSampler implements ContinuousSampler {

    private final UniformRandomProvider rng;
    private final double min;
    private final double mode;
    private final double max;
    private final double modeFraction;

    public TriangularSampler(UniformRandomProvider rng, double min, double mode, double max) {
        if (!(min <= mode && mode <= max)) {
            throw new IllegalArgumentException(
                String.format("Triangular bounds must satisfy min <= mode <= max, got %s/%s/%s", min, mode, max));
        }
        this.rng = Objects.requireNonNull(rng, "rng");
        this.min = min;
        this.mode = mode;
        this.max = max;
        double range = max - min;
        this.modeFraction = range == 0.0 ? 0.0 : (mode - min) / range;
    }

    @Override
    public double sample() {
        double range = max - min;
        if (range == 0.0) {
            return min;
        }
        double u = rng.nextDouble();
        if (u < modeFraction) {
            return min + Math.sqrt(u * range * (mode - min));
        }
        return max - Math.sqrt((1.0 - u) * range * (max - mode));
    }

    /** @return the analytic mean {@code (min + mode + max) / 3} */
    public double mean() {
        return (min + mode + max) / 3.0;
    }

    public double getMin() {
        return min;
    }

    public double getMode() {
        return mode;
    }

    public double getMax() {
        return max;
    }
}
