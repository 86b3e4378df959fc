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

/// Lifecycle of a {@link SimProcess}.
public enum ProcessState {
    /// Scheduled to run, or running right now.
    RUNNABLE,
    /// Waiting for a timer event on the queue.
    SUSPENDED_TIMER,
    /// Waiting in a resource's queue for a slot.
    SUSPENDED_RESOURCE,
    /// Finished; never scheduled again.
    COMPLETED;

    public boolean isSuspended() {
        return this == SUSPENDED_TIMER || this == SUSPENDED_RESOURCE;
    }
}
