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

/// One step of the piecewise arrival-rate schedule.
///
/// A band applies from its start time until the start of the next band, or
/// forever if it is the last one.
///
/// @param start the simulation minute at which this band begins
/// @param rate the arrival rate in visitors per 60 minutes
public record RateBand(double start, double rate) {

    /// @return the mean gap between arrivals in this band, in minutes
    public double meanGap() {
        return 60.0 / rate;
    }
}
