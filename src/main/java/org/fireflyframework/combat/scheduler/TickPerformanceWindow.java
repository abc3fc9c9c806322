/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.combat.scheduler;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Rolling window of tick durations.
 * Recording is constant time; the percentile is computed on read.
 */
public class TickPerformanceWindow {

    static final int MIN_SAMPLES_FOR_P99 = 10;

    private final int capacity;
    private final Deque<Double> samples;
    private long totalTicks;
    private double windowSum;
    private double maxMs;

    public TickPerformanceWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be positive");
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    public synchronized void record(double durationMs) {
        totalTicks++;
        samples.addLast(durationMs);
        windowSum += durationMs;
        if (samples.size() > capacity) {
            windowSum -= samples.removeFirst();
        }
        if (durationMs > maxMs) {
            maxMs = durationMs;
        }
    }

    public synchronized PulsePerformance snapshot() {
        int count = samples.size();
        if (count == 0) {
            return new PulsePerformance(totalTicks, 0, 0.0, maxMs, 0.0);
        }
        double p99 = 0.0;
        if (count >= MIN_SAMPLES_FOR_P99) {
            double[] sorted = samples.stream().mapToDouble(Double::doubleValue).toArray();
            Arrays.sort(sorted);
            p99 = sorted[Math.min(count - 1, (int) (count * 0.99))];
        }
        return new PulsePerformance(totalTicks, count, windowSum / count, maxMs, p99);
    }

    public synchronized void reset() {
        samples.clear();
        totalTicks = 0L;
        windowSum = 0.0;
        maxMs = 0.0;
    }
}
