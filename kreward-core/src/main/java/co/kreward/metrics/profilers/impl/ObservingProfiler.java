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

package co.kreward.metrics.profilers.impl;

import co.kreward.metrics.profilers.Metric;
import co.kreward.metrics.profilers.MetricKind;
import co.kreward.metrics.profilers.Observation;
import co.kreward.metrics.profilers.Profiler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Measures wall time and hands each {@link Observation} to the registered consumers on the
 * calling thread. Every metric carries its own start instant, so concurrent measurements don't interfere.
 */
public class ObservingProfiler implements Profiler {

    private final List<Consumer<Observation>> observers = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public ObservingProfiler() {
        this(Clock.systemUTC());
    }

    public ObservingProfiler(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    public void registerConsumer(Consumer<Observation> observationConsumer) {
        observers.add(Objects.requireNonNull(observationConsumer));
    }

    @Override
    public Metric start(MetricKind kind) {
        return new TimeMetric(kind, clock.instant());
    }

    @Override
    public void stop(Metric metric) {
        TimeMetric timeMetric = (TimeMetric) metric;
        Observation observation = new Observation(
                timeMetric.getKind(),
                Duration.between(timeMetric.startInstant, clock.instant()));
        observers.forEach(c -> c.accept(observation));
    }

    private static class TimeMetric implements Metric {

        private final MetricKind kind;
        private final Instant startInstant;

        TimeMetric(MetricKind kind, Instant startInstant) {
            this.kind = kind;
            this.startInstant = startInstant;
        }

        @Override
        public MetricKind getKind() {
            return kind;
        }
    }
}
