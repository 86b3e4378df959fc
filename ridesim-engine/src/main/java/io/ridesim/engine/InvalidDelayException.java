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

/// Thrown when a process asks to be woken after a negative or non-finite delay.
///
/// Delays are relative to the current clock, so rejecting them here is what keeps
/// the event queue from ever holding an event in the simulated past. Seeing this
/// exception means a component computed a bad delay; it is never a runtime condition
/// of a correctly wired model.
public class InvalidDelayException extends IllegalArgumentException {

    private final double delay;

    public InvalidDelayException(double delay) {
        super(String.format("Scheduling delay must be finite and non-negative, but was %s", delay));
        this.delay = delay;
    }

    public double getDelay() {
        return delay;
    }
}
