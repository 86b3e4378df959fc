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

/// How long a visitor occupies a ride.
public enum ServiceSampling {
    /// Every ride takes the same fixed number of minutes.
    FIXED,
    /// Each ride draws one triangular duration when the park opens and keeps it.
    PER_RIDE,
    /// Every visit draws a fresh triangular duration.
    PER_VISIT;

    public static ServiceSampling fromName(String name) {
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
