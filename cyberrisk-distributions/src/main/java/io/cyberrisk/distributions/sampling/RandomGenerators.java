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

package io.cyberrisk.distributions.sampling;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Creates the pseudo-random generators used by simulation runs.
 * Based on Apache Commons RNG.
 *
 * <p>A run owns exactly one generator. Two runs created with the same
 * algorithm and seed produce identical streams.
 */
public final class RandomGenerators {

    private RandomGenerators() {
    }

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiro256++: 256-bit state, period 2^256 - 1. The default.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiro128++: 128-bit state, period 2^128 - 1.
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64: 64-bit state, period 2^64.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister: 19937-bit state.
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

    /**
     * @param algorithm the PRNG algorithm
     * @param seed the seed
     * @return a new generator
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * @param seed the seed
     * @return a new XO_SHI_RO_256_PP generator
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Draws a fresh seed from system entropy, for runs that did not ask for one.
     *
     * @return a new seed
     */
    public static long newSeed() {
        return RandomSource.createLong();
    }
}
