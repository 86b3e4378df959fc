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

import java.util.Objects;

/// A pending wake-up: the process to resume and the simulation time it is due.
///
/// Events sort by due time first and by insertion sequence second, so events due
/// at the same instant fire in the order they were scheduled. The sequence is
/// assigned by the owning {@link EventQueue}, which keeps numbering identical
/// from one run to the next.
public final class SimEvent implements Comparable<SimEvent> {

    private final double dueTime;
    private final long sequence;
    private final SimProcess process;

    SimEvent(double dueTime, long sequence, SimProcess process) {
        this.dueTime = dueTime;
        this.sequence = sequence;
        this.process = Objects.requireNonNull(process, "process");
    }

    /// @return the simulation time, in minutes, at which this event fires
    public double getDueTime() {
        return dueTime;
    }

    /// @return the insertion order of this event within its queue
    public long getSequence() {
        return sequence;
    }

    /// @return the process resumed when this event fires
    public SimProcess getProcess() {
        return process;
    }

    @Override
    public int compareTo(SimEvent other) {
        int timeComparison = Double.compare(this.dueTime, other.dueTime);
        if (timeComparison != 0) {
            return timeComparison;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimEvent that)) return false;
        return sequence == that.sequence && Double.compare(dueTime, that.dueTime) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dueTime, sequence);
    }

    @Override
    public String toString() {
        return "SimEvent{t=" + dueTime + ", seq=" + sequence + ", process=" + process.getName() + '}';
    }
}
