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

/**
 * Tick statistics over the recent window.
 *
 * @param totalTicks  ticks since the window was last reset
 * @param sampleCount ticks currently in the window
 * @param averageMs   average tick duration in the window
 * @param maxMs       longest tick since the last reset
 * @param p99Ms       99th percentile in the window, zero below ten samples
 */
public record PulsePerformance(
        long totalTicks,
        int sampleCount,
        double averageMs,
        double maxMs,
        double p99Ms
) {

    public static PulsePerformance empty() {
        return new PulsePerformance(0L, 0, 0.0, 0.0, 0.0);
    }
}
