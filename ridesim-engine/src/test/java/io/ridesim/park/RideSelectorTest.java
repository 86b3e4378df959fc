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
import io.ridesim.engine.Scheduler;
import io.ridesim.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RideSelectorTest {

    private static List<Resource> rides(boolean... operational) {
        Scheduler scheduler = new Scheduler();
        Resource[] rides = new Resource[operational.length];
        for (int i = 0; i < operational.length; i++) {
            rides[i] = new Resource(scheduler, i, "Ride " + i, 1);
            rides[i].setOperational(operational[i]);
        }
        return List.of(rides);
    }

    @Test
    public void testUnconditionalQueueKeepsFirstPick() {
        RideSelector selector = new RideSelector(SelectionPolicy.UNCONDITIONAL_QUEUE, 5);
        UniformRandomProvider rng = RandomGenerators.create(11L);
        UniformRandomProvider twin = RandomGenerators.create(11L);
        List<Resource> allDown = rides(false, false, false);
        for (int i = 0; i < 50; i++) {
            OptionalInt choice = selector.select(allDown, rng);
            assertThat(choice).hasValue(twin.nextInt(3));
        }
    }

    @Test
    public void testBoundedRetryGivesUpAfterAllRedraws() {
        RideSelector selector = new RideSelector(SelectionPolicy.BOUNDED_RETRY, 5);
        UniformRandomProvider rng = RandomGenerators.create(3L);
        UniformRandomProvider twin = RandomGenerators.create(3L);

        assertThat(selector.select(rides(false, false, false), rng)).isEmpty();

        // one initial draw plus five redraws
        for (int i = 0; i < 6; i++) {
            twin.nextInt(3);
        }
        assertThat(rng.nextLong()).isEqualTo(twin.nextLong());
    }

    @Test
    public void testBoundedRetryWithZeroBoundChecksOnce() {
        RideSelector selector = new RideSelector(SelectionPolicy.BOUNDED_RETRY, 0);
        UniformRandomProvider rng = RandomGenerators.create(5L);
        assertThat(selector.select(rides(false), rng)).isEmpty();
        assertThat(selector.select(rides(true), rng)).hasValue(0);
    }

    @Test
    public void testBoundedRetryFindsTheWorkingRide() {
        RideSelector selector = new RideSelector(SelectionPolicy.BOUNDED_RETRY, 60);
        UniformRandomProvider rng = RandomGenerators.create(99L);
        List<Resource> oneUp = rides(false, true, false);
        for (int i = 0; i < 100; i++) {
            assertThat(selector.select(oneUp, rng)).hasValue(1);
        }
    }

    @Test
    public void testPicksCoverAllWorkingRides() {
        RideSelector selector = new RideSelector(SelectionPolicy.BOUNDED_RETRY, 5);
        UniformRandomProvider rng = RandomGenerators.create(1L);
        List<Resource> allUp = rides(true, true, true);
        int[] counts = new int[3];
        for (int i = 0; i < 3000; i++) {
            counts[selector.select(allUp, rng).getAsInt()]++;
        }
        for (int count : counts) {
            assertThat(count).isBetween(850, 1150);
        }
    }

    @Test
    public void testNegativeBoundIsRejected() {
        assertThatThrownBy(() -> new RideSelector(SelectionPolicy.BOUNDED_RETRY, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
