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

import io.ridesim.config.SelectionPolicy;
import io.ridesim.engine.Resource;
import io.ridesim.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.List;
import java.util.OptionalInt;

/// Chooses the ride a visitor queues for.
///
/// Under {@link SelectionPolicy#UNCONDITIONAL_QUEUE} one uniform pick is final, even
/// when that ride is down. Under {@link SelectionPolicy#BOUNDED_RETRY} a pick that
/// lands on a ride that is down is redrawn, up to the retry bound; if the last pick
/// is still down the visitor gives up. All redraws happen at the same instant.
public class RideSelector {

    private final SelectionPolicy policy;
    private final int retryBound;

    public RideSelector(SelectionPolicy policy, int retryBound) {
        if (retryBound < 0) {
            throw new IllegalArgumentException("Retry bound must not be negative: " + retryBound);
        }
        this.policy = policy;
        this.retryBound = retryBound;
    }

    /// @return the index of the chosen ride, or empty if the visitor gives up
    public OptionalInt select(List<Resource> rides, UniformRandomProvider rng) {
        int choice = RandomGenerators.uniformIndex(rng, rides.size());
        if (policy == SelectionPolicy.UNCONDITIONAL_QUEUE) {
            return OptionalInt.of(choice);
        }
        int redraws = 0;
        while (!rides.get(choice).isOperational() && redraws < retryBound) {
            choice = RandomGenerators.uniformIndex(rng, rides.size());
            redraws++;
        }
        if (!rides.get(choice).isOperational()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(choice);
    }

    public SelectionPolicy getPolicy() {
        return policy;
    }

    public int getRetryBound() {
        return retryBound;
    }
}
