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

package io.ridesim.config;

import java.util.Locale;

/// How a visitor picks a ride.
public enum SelectionPolicy {
    /// Pick one ride uniformly at random and queue for it even if it is down.
    UNCONDITIONAL_QUEUE,
    /// Pick uniformly at random, redrawing while the pick is down up to a fixed
    /// number of times, then give up without queueing.
    BOUNDED_RETRY;

    /// Parses names like {@code bounded_retry}, {@code bounded-retry} or {@code BOUNDED_RETRY}.
    public static SelectionPolicy fromName(String name) {
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
