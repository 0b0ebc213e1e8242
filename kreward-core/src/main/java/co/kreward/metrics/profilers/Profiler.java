/*
 * This file is part of Kreward
 * Copyright (C) 2023 Kreward contributors.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */

package co.kreward.metrics.profilers;

/**
 * Times the stages of block reward calculation. The calculator starts a metric before a stage and
 * stops it in a {@code finally} block, so a failed calculation is measured too.
 * Implementations must not change the reward being computed.
 */
public interface Profiler {

    /**
     * @param kind the reward calculation stage being timed
     * @return a handle to pass back to {@link #stop(Metric)}
     */
    Metric start(MetricKind kind);

    /**
     * Ends the measurement started for the given handle.
     */
    void stop(Metric metric);
}
