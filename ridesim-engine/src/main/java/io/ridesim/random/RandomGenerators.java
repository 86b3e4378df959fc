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
import org.apache.commons.rng.sampling.distribution.AhrensDieterExponentialSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seeded random sources and the samplers the park model draws from.
 * Based on Apache Commons RNG, so a given seed and algorithm always produce the
 * same stream on every platform.
 */
public class RandomGenerators {

    /**
     * PRNG algorithms a run can be seeded with.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ algorithm - 256-bit state, fast with excellent statistical properties.
         * The default for simulation runs.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * SplitMix64 algorithm - 64-bit state, minimal state with acceptable quality.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister, for comparison with runs made by other tools.
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a random provider with the given algorithm and seed.
     *
     * @param algorithm the PRNG algorithm to use
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a random provider with the default algorithm, XO_SHI_RO_256_PP.
     *
     * @param seed the seed for deterministic generation
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates an exponential sampler.
     *
     * @param rng the random provider
     * @param mean the mean of the distribution, positive
     * @return a sampler of exponentially distributed values
     */
    public static ContinuousSampler exponential(UniformRandomProvider rng, double mean) {
        return AhrensDieterExponentialSampler.of(rng, mean);
    }

    /**
     * Creates a triangular sampler.
     *
     * @param rng the random provider
     * @param min the lower limit
     * @param mode the most likely value
     * @param max the upper limit
     * @return a sampler of triangularly distributed values
     */
    public static ContinuousSampler triangular(UniformRandomProvider rng, double min, double mode, double max) {
        return new TriangularSampler(rng, min, mode, max);
    }

    /**
     * Picks an index uniformly from {@code [0, bound)}.
     */
    public static int uniformIndex(UniformRandomProvider rng, int bound) {
        return rng.nextInt(bound);
    }
}
