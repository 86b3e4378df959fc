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

package io.ridesim.stats;

/// Outcome counters for one ride.
///
/// @param index the ride's position in the park
/// @param usageCount visitors who boarded the ride
/// @param failureCount times the ride broke down
/// @param peakQueueLength the longest wait-queue seen at the ride
/// @param serviceMinutes the mean ride duration at this ride
public record RideStatistics(int index, int usageCount, int failureCount, int peakQueueLength,
                             double serviceMinutes) {
}
