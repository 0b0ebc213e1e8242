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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ObservingProfilerTest {

    @Test
    void reportsElapsedTimeToEveryConsumer() {
        Clock clock = mock(Clock.class);
        Instant start = Instant.ofEpochMilli(1_000);
        when(clock.instant()).thenReturn(start, start.plusMillis(250));
        ObservingProfiler profiler = new ObservingProfiler(clock);
        List<Observation> first = new ArrayList<>();
        List<Observation> second = new ArrayList<>();
        profiler.registerConsumer(first::add);
        profiler.registerConsumer(second::add);

        Metric metric = profiler.start(MetricKind.BLOCK_REWARD_CALCULATION);
        profiler.stop(metric);

        Assertions.assertEquals(1, first.size());
        Assertions.assertEquals(MetricKind.BLOCK_REWARD_CALCULATION, first.get(0).getKind());
        Assertions.assertEquals(Duration.ofMillis(250), first.get(0).getDuration());
        Assertions.assertSame(first.get(0), second.get(0));
    }

    @Test
    void metricsAreIndependent() {
        Clock clock = mock(Clock.class);
        Instant base = Instant.ofEpochMilli(0);
        when(clock.instant()).thenReturn(base, base.plusMillis(10), base.plusMillis(30), base.plusMillis(100));
        ObservingProfiler profiler = new ObservingProfiler(clock);
        List<Observation> observations = new ArrayList<>();
        profiler.registerConsumer(observations::add);

        Metric outer = profiler.start(MetricKind.BLOCK_REWARD_CALCULATION);
        Metric inner = profiler.start(MetricKind.DEFERRED_REWARD_CALCULATION);
        profiler.stop(inner);
        profiler.stop(outer);

        Assertions.assertEquals(Duration.ofMillis(20), observations.get(0).getDuration());
        Assertions.assertEquals(Duration.ofMillis(100), observations.get(1).getDuration());
    }

    @Test
    void disabledProfilerDoesNothing() {
        Metric metric = DisabledProfiler.INSTANCE.start(MetricKind.BLOCK_REWARD_CALCULATION);

        DisabledProfiler.INSTANCE.stop(metric);

        Assertions.assertEquals(MetricKind.BLOCK_REWARD_CALCULATION, metric.getKind());
    }
}
