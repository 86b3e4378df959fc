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

import java.util.List;

/// Thrown when a simulation configuration cannot be run.
///
/// The exception is raised before any simulated time passes and carries every
/// problem found, not just the first one.
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid simulation configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidConfigurationException(String violation) {
        this(List.of(violation));
    }

    public InvalidConfigurationException(String violation, Throwable cause) {
        super("Invalid simulation configuration: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }
}
