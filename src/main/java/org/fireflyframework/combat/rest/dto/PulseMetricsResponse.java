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

package org.fireflyframework.combat.rest.dto;

import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.PulsePerformance;

/**
 * Response DTO for the combat pulse metrics.
 */
public record PulseMetricsResponse(
        boolean running,
        int activeParticipants,
        long totalTicks,
        int sampleCount,
        double averageTickMs,
        double maxTickMs,
        double p99TickMs
) {

    public static PulseMetricsResponse from(CombatPulseScheduler scheduler) {
        PulsePerformance performance = scheduler.getPerformance();
        return new PulseMetricsResponse(
                scheduler.isRunning(),
                scheduler.getActiveParticipantCount(),
                performance.totalTicks(),
                performance.sampleCount(),
                performance.averageMs(),
                performance.maxMs(),
                performance.p99Ms());
    }
}
