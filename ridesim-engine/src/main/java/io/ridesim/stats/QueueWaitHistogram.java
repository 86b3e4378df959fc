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

/// Queue waits counted into equal-width bins starting at zero minutes.
///
/// @param binWidth width of each bin in minutes; 0 when every wait was zero
/// @param counts samples per bin
public record QueueWaitHistogram(double binWidth, int[] counts) {

    public QueueWaitHistogram {
        counts = counts.clone();
    }

    @Override
    public int[] counts() {
        return counts.clone();
    }

    public int binCount() {
        return counts.length;
    }

    public double binStart(int bin) {
        return bin * binWidth;
    }

    public double binEnd(int bin) {
        return (bin + 1) * binWidth;
    }

    public int total() {
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        return total;
    }
}
