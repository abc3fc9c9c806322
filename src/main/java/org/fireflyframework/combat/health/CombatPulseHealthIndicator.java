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

package org.fireflyframework.combat.health;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.audit.AuditStatistics;
import org.fireflyframework.combat.audit.CombatAuditService;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.PulsePerformance;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Health indicator for the combat pulse.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Whether the tick loop is installed</li>
 *   <li>Tick performance of the recent window</li>
 *   <li>Audit buffer and throttle state</li>
 * </ul>
 */
@Slf4j
public class CombatPulseHealthIndicator implements ReactiveHealthIndicator {

    private final CombatPulseScheduler scheduler;
    @Nullable
    private final CombatAuditService auditService;

    public CombatPulseHealthIndicator(CombatPulseScheduler scheduler, @Nullable CombatAuditService auditService) {
        this.scheduler = scheduler;
        this.auditService = auditService;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::buildHealth)
                .onErrorResume(e -> {
                    log.warn("Combat pulse health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Health buildHealth() {
        PulsePerformance performance = scheduler.getPerformance();
        Health.Builder builder = scheduler.isRunning() ? Health.up() : Health.down();
        builder.withDetail("pulse", scheduler.isRunning() ? "running" : "stopped")
                .withDetail("activeParticipants", scheduler.getActiveParticipantCount())
                .withDetail("totalTicks", performance.totalTicks())
                .withDetail("averageTickMs", performance.averageMs())
                .withDetail("p99TickMs", performance.p99Ms())
                .withDetail("maxTickMs", performance.maxMs());
        if (auditService != null) {
            AuditStatistics audit = auditService.getStatistics();
            builder.withDetail("auditBuffered", audit.bufferedEntries())
                    .withDetail("auditThrottled", audit.throttled())
                    .withDetail("auditFailedFlushes", audit.failedFlushes());
        }
        return builder.build();
    }
}
