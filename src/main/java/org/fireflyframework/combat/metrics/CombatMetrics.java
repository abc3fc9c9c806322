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

package org.fireflyframework.combat.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.TickListener;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Provides Micrometer metrics for the combat engine.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>tick.duration</b> - Timer of tick durations</li>
 *   <li><b>participants.active</b> - Gauge of active participants</li>
 *   <li><b>resolutions</b> - Counter of resolved swings (tags: outcome)</li>
 *   <li><b>shadow.discrepancies</b> - Counter of shadow discrepancies (tags: weapon)</li>
 *   <li><b>audit.dropped</b> - Counter of audit entries dropped by the per-tick cap</li>
 *   <li><b>audit.flushed</b> - Counter of audit entries written (tags: result)</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.combat.".
 */
@Slf4j
public class CombatMetrics implements TickListener {

    private static final String METRIC_PREFIX = "firefly.combat.";

    private static final String TAG_OUTCOME = "outcome";
    private static final String TAG_WEAPON = "weapon";
    private static final String TAG_RESULT = "result";

    private final MeterRegistry meterRegistry;
    private final Timer tickTimer;

    public CombatMetrics(MeterRegistry meterRegistry, CombatPulseScheduler scheduler) {
        this.meterRegistry = meterRegistry;
        this.tickTimer = Timer.builder(METRIC_PREFIX + "tick.duration")
                .description("Combat pulse tick duration")
                .register(meterRegistry);
        if (scheduler != null) {
            Gauge.builder(METRIC_PREFIX + "participants.active", scheduler,
                            CombatPulseScheduler::getActiveParticipantCount)
                    .description("Actors currently tracked by the combat pulse")
                    .register(meterRegistry);
        }
        log.info("CombatMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    @Override
    public void onTickCompleted(double durationMs, int activeParticipants) {
        tickTimer.record((long) (durationMs * 1_000_000), TimeUnit.NANOSECONDS);
    }

    /**
     * Records the outcome of a scheduled resolution: hit, miss, skipped or failed.
     */
    public void recordResolution(String outcome) {
        Counter.builder(METRIC_PREFIX + "resolutions")
                .description("Number of scheduled hit resolutions")
                .tag(TAG_OUTCOME, normalizeTag(outcome))
                .register(meterRegistry)
                .increment();
        log.debug("METRIC: resolutions outcome={}", outcome);
    }

    public void recordShadowDiscrepancy(String weaponName) {
        Counter.builder(METRIC_PREFIX + "shadow.discrepancies")
                .description("Number of shadow comparisons above the discrepancy threshold")
                .tag(TAG_WEAPON, normalizeTag(weaponName))
                .register(meterRegistry)
                .increment();
    }

    public void recordAuditDropped() {
        Counter.builder(METRIC_PREFIX + "audit.dropped")
                .description("Number of audit entries dropped by the per-tick cap")
                .register(meterRegistry)
                .increment();
    }

    public void recordAuditFlush(int entries, boolean success) {
        Counter.builder(METRIC_PREFIX + "audit.flushed")
                .description("Number of audit entries processed by flushes")
                .tag(TAG_RESULT, success ? "success" : "failure")
                .register(meterRegistry)
                .increment(entries);
    }

    private String normalizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.-]", "_");
    }
}
