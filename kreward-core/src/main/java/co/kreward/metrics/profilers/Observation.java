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

import java.time.Duration;

public class Observation {

    private final MetricKind kind;
    private final Duration duration;

    public Observation(MetricKind kind, Duration duration) {
        this.kind = kind;
        this.duration = duration;
    }

    public MetricKind getKind() {
        return kind;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "Observation{kind=" + kind + ", duration=" + duration + '}';
    }
}
