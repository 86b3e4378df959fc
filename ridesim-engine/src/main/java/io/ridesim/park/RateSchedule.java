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

package io.ridesim.park;

import io.ridesim.config.RateBand;

import java.util.List;

/// Piecewise-constant arrival rate over elapsed simulation time.
///
/// Bands must start at 0 and be ordered by strictly increasing start time, which
/// {@link io.ridesim.config.SimulationConfig} guarantees. The rate at time `t` is
/// the rate of the last band whose start is at or before `t`.
public class RateSchedule {

    private final List<RateBand> bands;

    public RateSchedule(List<RateBand> bands) {
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("A rate schedule needs at least one band");
        }
        this.bands = List.copyOf(bands);
    }

    public RateBand bandAt(double time) {
        RateBand current = bands.get(0);
        for (RateBand band : bands) {
            if (band.start() <= time) {
                current = band;
            } else {
                break;
            }
        }
        return current;
    }

    /// @return arrivals per 60 minutes in effect at the given time
    public double rateAt(double time) {
        return bandAt(time).rate();
    }

    /// @return the mean inter-arrival gap in minutes at the given time
    public double meanGapAt(double time) {
        return bandAt(time).meanGap();
    }

    public List<RateBand> getBands() {
        return bands;
    }
}
