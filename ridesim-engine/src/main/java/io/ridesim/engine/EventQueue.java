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

import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/// The simulation clock together with its time-ordered set of pending wake-ups.
///
/// Time is logical and measured in minutes. It only moves forward, and only when
/// {@link #advance()} or {@link #advanceTo(double)} is called by the scheduler.
/// Delays passed to {@link #scheduleAfter(double, SimProcess)} are relative to the
/// current clock, so an event can never be due before the time it was scheduled.
public class EventQueue {

    private final PriorityQueue<SimEvent> pending = new PriorityQueue<>();
    private double now = 0.0;
    private long nextSequence = 0;

    /// Schedules a process to be resumed after the given delay.
    ///
    /// @param delay minutes from now, finite and non-negative
    /// @param process the process to resume
    /// @return the scheduled event
    /// @throws InvalidDelayException if the delay is negative, NaN or infinite
    public SimEvent scheduleAfter(double delay, SimProcess process) {
        if (!Double.isFinite(delay) || delay < 0.0) {
            throw new InvalidDelayException(delay);
        }
        SimEvent event = new SimEvent(now + delay, nextSequence++, process);
        pending.add(event);
        return event;
    }

    /// Removes the earliest pending event and moves the clock to its due time.
    ///
    /// @return the fired event
    /// @throws NoSuchElementException if nothing is pending
    public SimEvent advance() {
        SimEvent event = pending.poll();
        if (event == null) {
            throw new NoSuchElementException("No pending events");
        }
        now = event.getDueTime();
        return event;
    }

    /// Moves the clock forward to {@code time} without firing anything.
    /// Requests for an earlier time leave the clock where it is.
    public void advanceTo(double time) {
        if (time > now) {
            now = time;
        }
    }

    public double peekDueTime() {
        SimEvent head = pending.peek();
        return head == null ? Double.POSITIVE_INFINITY : head.getDueTime();
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    /// @return the current simulation time in minutes
    public double now() {
        return now;
    }
}
