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

/// A cooperative unit of simulated behavior.
///
/// Subclasses are explicit state machines. Each call to {@link #step(Scheduler)}
/// runs from the current phase up to the next suspension point, records which
/// phase to continue from, and returns a {@link Step} saying what to wait on.
/// A typical implementation switches on a phase field:
///
/// ```java
/// protected Step step(Scheduler scheduler) {
///     switch (phase) {
///         case WAIT:
///             phase = Phase.FIRE;
///             return Step.hold(delay);
///         case FIRE:
///             doWork();
///             return Step.done();
///     }
/// }
/// ```
///
/// Processes are only ever resumed by the {@link Scheduler} that spawned them,
/// one at a time, so implementations need no synchronization.
public abstract class SimProcess {

    private final String name;
    private long id = -1;
    private ProcessState state = ProcessState.RUNNABLE;

    protected SimProcess(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /// Runs this process up to its next suspension point.
    ///
    /// @param scheduler the scheduler driving this process, for clock access and spawning
    /// @return what the process waits on next
    protected abstract Step step(Scheduler scheduler);

    /// @return the stable id assigned when the process was spawned, or -1 before that
    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ProcessState getState() {
        return state;
    }

    void attach(long id) {
        if (this.id >= 0) {
            throw new IllegalStateException("Process " + name + " was already spawned as #" + this.id);
        }
        this.id = id;
    }

    void setState(ProcessState state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return name + "#" + id + "[" + state + "]";
    }
}
