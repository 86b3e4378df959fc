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

package io.ridesim.engine;

import java.util.ArrayDeque;
import java.util.Objects;

/// A capacity-limited station with a FIFO wait-queue and an operational flag.
///
/// A slot is granted only while the station is operational and has a free slot.
/// Requesters that cannot be served immediately join the tail of the wait-queue
/// and are granted strictly in arrival order; nothing ever overtakes the queue,
/// so a new request is served on the spot only when the queue is empty.
///
/// Taking a station out of operation does not evict current occupants. It only
/// stops new grants until the station is operational again, at which point queued
/// requesters are granted head-first while slots are free.
///
/// A granted slot is assigned to the waiting process at the moment of the grant.
/// The process itself resumes through a zero-delay event on the scheduler, so the
/// releasing process finishes its own step first.
public class Resource {

    private final Scheduler scheduler;
    private final int index;
    private final String name;
    private final int capacity;
    private final ArrayDeque<SimProcess> waiting = new ArrayDeque<>();

    private int occupancy = 0;
    private boolean operational = true;
    private int peakOccupancy = 0;
    private int peakQueueLength = 0;

    /// @param scheduler the scheduler whose processes contend for this resource
    /// @param index the position of this resource in its pool
    /// @param name a label for logging
    /// @param capacity the number of simultaneous occupants, at least 1
    public Resource(Scheduler scheduler, int index, String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Resource capacity must be positive, but was " + capacity);
        }
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.index = index;
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
    }

    /// Asks for a slot on behalf of a process.
    ///
    /// @return true if the slot was granted immediately; false if the process was
    ///     queued and will be woken when a slot is granted to it
    public boolean request(SimProcess process) {
        scheduler.checkDispatchThread();
        Objects.requireNonNull(process, "process");
        if (operational && occupancy < capacity && waiting.isEmpty()) {
            occupy();
            return true;
        }
        waiting.addLast(process);
        peakQueueLength = Math.max(peakQueueLength, waiting.size());
        return false;
    }

    /// Frees one slot and hands it to the head of the queue if the resource is operational.
    ///
    /// @throws IllegalStateException if nothing occupies the resource
    public void release() {
        scheduler.checkDispatchThread();
        if (occupancy == 0) {
            throw new IllegalStateException("Release of " + name + " with no occupants");
        }
        occupancy--;
        grantWaiting();
    }

    /// Marks the resource as accepting or refusing new occupants.
    public void setOperational(boolean operational) {
        scheduler.checkDispatchThread();
        this.operational = operational;
        if (operational) {
            grantWaiting();
        }
    }

    private void grantWaiting() {
        while (operational && occupancy < capacity && !waiting.isEmpty()) {
            SimProcess next = waiting.pollFirst();
            occupy();
            scheduler.wake(next);
        }
    }

    private void occupy() {
        occupancy++;
        if (occupancy > capacity) {
            throw new IllegalStateException("Occupancy of " + name + " exceeded capacity " + capacity);
        }
        peakOccupancy = Math.max(peakOccupancy, occupancy);
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getOccupancy() {
        return occupancy;
    }

    public int getQueueLength() {
        return waiting.size();
    }

    public boolean isOperational() {
        return operational;
    }

    public int getPeakOccupancy() {
        return peakOccupancy;
    }

    public int getPeakQueueLength() {
        return peakQueueLength;
    }

    @Override
    public String toString() {
        return name + "{occupancy=" + occupancy + "/" + capacity + ", queued=" + waiting.size()
            + ", operational=" + operational + '}';
    }
}
