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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Drives cooperative processes through logical time.
///
/// The scheduler owns the {@link EventQueue}. {@link #run(double)} repeatedly fires
/// the earliest pending event and resumes its process until that process suspends
/// again, either on a timer or on a {@link Resource}, or completes. Exactly one
/// process runs at any moment, on the thread that called {@link #run(double)}.
///
/// The run stops at the horizon. Events due at or after the horizon never fire, and
/// whatever processes are still suspended at that point are left as they are: no
/// cleanup runs and nothing about them is recorded.
public class Scheduler {

    private static final Logger logger = LogManager.getLogger(Scheduler.class);

    private final EventQueue queue = new EventQueue();

    private long nextProcessId = 0;
    private long eventsDispatched = 0;
    private long processesCompleted = 0;

    private Thread dispatchThread;
    private SimProcess current;

    /// @return the current simulation time in minutes
    public double now() {
        return queue.now();
    }

    /// Starts a new process at the current instant.
    ///
    /// The process first runs when its start event fires, after any events already
    /// scheduled for this instant.
    ///
    /// @param process a process that has not been spawned before
    /// @return the same process, now carrying its id
    public <P extends SimProcess> P spawn(P process) {
        return spawnAfter(0.0, process);
    }

    /// Starts a new process after the given delay in minutes.
    public <P extends SimProcess> P spawnAfter(double delay, P process) {
        checkDispatchThread();
        process.attach(nextProcessId++);
        process.setState(ProcessState.RUNNABLE);
        queue.scheduleAfter(delay, process);
        return process;
    }

    /// Makes a process that was waiting on a resource runnable at the current instant.
    void wake(SimProcess process) {
        if (process.getState() != ProcessState.SUSPENDED_RESOURCE) {
            throw new IllegalStateException("Cannot wake " + process + ": it is not waiting on a resource");
        }
        process.setState(ProcessState.RUNNABLE);
        queue.scheduleAfter(0.0, process);
    }

    /// Runs the event loop until the horizon is reached or nothing is left to do.
    ///
    /// @param horizon the simulation time, in minutes, at which the run is cut off
    /// @throws IllegalArgumentException if the horizon is negative or NaN
    /// @throws IllegalStateException if called while a run is already in progress
    public void run(double horizon) {
        if (Double.isNaN(horizon) || horizon < 0.0) {
            throw new IllegalArgumentException("Horizon must be non-negative, but was " + horizon);
        }
        if (dispatchThread != null) {
            throw new IllegalStateException("Scheduler is already running on " + dispatchThread.getName());
        }
        dispatchThread = Thread.currentThread();
        logger.debug("Running until t={} with {} pending events", horizon, queue.size());
        try {
            while (queue.hasPending() && queue.peekDueTime() < horizon) {
                SimEvent event = queue.advance();
                dispatch(event.getProcess());
            }
            if (Double.isFinite(horizon)) {
                queue.advanceTo(horizon);
            }
        } finally {
            dispatchThread = null;
        }
        logger.debug("Stopped at t={} after {} events, {} pending, {} of {} processes completed",
            queue.now(), eventsDispatched, queue.size(), processesCompleted, nextProcessId);
    }

    private void dispatch(SimProcess process) {
        if (process.getState() != ProcessState.RUNNABLE && process.getState() != ProcessState.SUSPENDED_TIMER) {
            throw new IllegalStateException("Event fired for " + process + ", which is not waiting on a timer");
        }
        eventsDispatched++;
        process.setState(ProcessState.RUNNABLE);
        current = process;
        try {
            while (true) {
                Step step = process.step(this);
                switch (step.getKind()) {
                    case HOLD:
                        process.setState(ProcessState.SUSPENDED_TIMER);
                        queue.scheduleAfter(step.getDelay(), process);
                        return;
                    case REQUEST:
                        if (step.getResource().request(process)) {
                            // granted on the spot, keep going within this dispatch
                            continue;
                        }
                        process.setState(ProcessState.SUSPENDED_RESOURCE);
                        return;
                    case DONE:
                        process.setState(ProcessState.COMPLETED);
                        processesCompleted++;
                        return;
                    default:
                        throw new IllegalStateException("Unknown step kind " + step.getKind());
                }
            }
        } finally {
            current = null;
        }
    }

    /// Fails when shared model state is touched from anything but the dispatch thread.
    void checkDispatchThread() {
        Thread owner = dispatchThread;
        if (owner != null && owner != Thread.currentThread()) {
            throw new IllegalStateException("Simulation state may only be changed from the dispatch thread "
                + owner.getName() + ", not " + Thread.currentThread().getName());
        }
    }

    /// @return the process being resumed right now, or null between events
    public SimProcess getCurrentProcess() {
        return current;
    }

    public int getPendingEventCount() {
        return queue.size();
    }

    public long getEventsDispatched() {
        return eventsDispatched;
    }

    public long getProcessesSpawned() {
        return nextProcessId;
    }

    public long getProcessesCompleted() {
        return processesCompleted;
    }
}
