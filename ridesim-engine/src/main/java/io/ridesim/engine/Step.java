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

/// What a process wants to happen after one slice of its work.
///
/// A process returns one of these from {@link SimProcess#step(Scheduler)}. The
/// scheduler interprets it: {@link Kind#HOLD} parks the process on the event queue,
/// {@link Kind#REQUEST} asks a resource for a slot, and {@link Kind#DONE} retires it.
/// The process keeps its own record of where to continue; the step only says what
/// to wait on.
public final class Step {

    public enum Kind {
        HOLD,
        REQUEST,
        DONE
    }

    private static final Step DONE = new Step(Kind.DONE, 0.0, null);

    private final Kind kind;
    private final double delay;
    private final Resource resource;

    private Step(Kind kind, double delay, Resource resource) {
        this.kind = kind;
        this.delay = delay;
        this.resource = resource;
    }

    /// Suspend on a timer for the given number of minutes.
    public static Step hold(double delay) {
        return new Step(Kind.HOLD, delay, null);
    }

    /// Suspend until the given resource grants a slot.
    public static Step request(Resource resource) {
        return new Step(Kind.REQUEST, 0.0, Objects.requireNonNull(resource, "resource"));
    }

    /// The process has nothing more to do.
    public static Step done() {
        return DONE;
    }

    public Kind getKind() {
        return kind;
    }

    public double getDelay() {
        return delay;
    }

    public Resource getResource() {
        return resource;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case HOLD -> "hold(" + delay + ")";
            case REQUEST -> "request(" + resource.getName() + ")";
            case DONE -> "done";
        };
    }
}
