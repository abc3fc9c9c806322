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

package org.fireflyframework.combat.rest;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.audit.AuditLogEntry;
import org.fireflyframework.combat.audit.AuditStatistics;
import org.fireflyframework.combat.audit.CombatAuditService;
import org.fireflyframework.combat.audit.FlushResult;
import org.fireflyframework.combat.audit.ShadowModeReport;
import org.fireflyframework.combat.audit.ShadowModeVerifier;
import org.fireflyframework.combat.rest.dto.ClearResponse;
import org.fireflyframework.combat.rest.dto.PulseMetricsResponse;
import org.fireflyframework.combat.rest.dto.ShadowExportResponse;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * REST controller for the combat engine's operational queries.
 * <p>
 * Provides endpoints for:
 * <ul>
 *   <li>Reading, flushing and clearing the audit buffer</li>
 *   <li>Per-actor audit history</li>
 *   <li>Shadow mode reports, CSV export and reset</li>
 *   <li>Pulse performance metrics</li>
 * </ul>
 * Audit and shadow endpoints answer 404 when the corresponding service is not configured.
 */
@Slf4j
@RestController
@RequestMapping("${firefly.combat.api.base-path:/api/v1/combat}")
public class CombatAuditController {

    private final CombatPulseScheduler scheduler;
    @Nullable
    private final CombatAuditService auditService;
    @Nullable
    private final ShadowModeVerifier shadowVerifier;

    public CombatAuditController(CombatPulseScheduler scheduler,
                                 @Nullable CombatAuditService auditService,
                                 @Nullable ShadowModeVerifier shadowVerifier) {
        this.scheduler = scheduler;
        this.auditService = auditService;
        this.shadowVerifier = shadowVerifier;
    }

    /**
     * Gets a copy of the unflushed audit entries.
     */
    @GetMapping("/audit/buffer")
    public Mono<ResponseEntity<List<AuditLogEntry>>> getBuffer() {
        if (auditService == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(auditService.getBufferSnapshot()));
    }

    @GetMapping("/audit/statistics")
    public Mono<ResponseEntity<AuditStatistics>> getStatistics() {
        if (auditService == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(auditService.getStatistics()));
    }

    /**
     * Gets an actor's recent history, optionally limited to the last {@code windowMs}.
     */
    @GetMapping("/audit/actors/{actorId}/history")
    public Mono<ResponseEntity<List<AuditLogEntry>>> getActorHistory(
            @PathVariable String actorId,
            @RequestParam(required = false) Long windowMs) {
        if (auditService == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        Duration window = windowMs != null && windowMs > 0 ? Duration.ofMillis(windowMs) : null;
        return Mono.just(ResponseEntity.ok(auditService.getActorHistory(actorId, window)));
    }

    /**
     * Flushes the audit buffer now.
     */
    @PostMapping("/audit/flush")
    public Mono<ResponseEntity<FlushResult>> flush() {
        if (auditService == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        log.info("Manual audit flush requested");
        return auditService.flush()
                .map(result -> result.success()
                        ? ResponseEntity.ok(result)
                        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result));
    }

    @DeleteMapping("/audit/buffer")
    public Mono<ResponseEntity<ClearResponse>> clearBuffer() {
        if (auditService == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(new ClearResponse(auditService.clear())));
    }

    /**
     * Gets the shadow mode report, optionally limited to the last {@code windowMs}.
     */
    @GetMapping("/shadow/report")
    public Mono<ResponseEntity<ShadowModeReport>> getShadowReport(@RequestParam(required = false) Long windowMs) {
        if (shadowVerifier == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        Duration window = windowMs != null && windowMs > 0 ? Duration.ofMillis(windowMs) : null;
        return Mono.just(ResponseEntity.ok(shadowVerifier.generateReport(window)));
    }

    /**
     * Exports shadow comparisons to a CSV file in the audit output directory.
     */
    @PostMapping("/shadow/export")
    public Mono<ResponseEntity<ShadowExportResponse>> exportShadow() {
        ShadowModeVerifier verifier = shadowVerifier;
        if (verifier == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.fromCallable(() -> {
                    int count = verifier.getComparisonCount();
                    return verifier.exportToCsv()
                            .map(path -> ResponseEntity.ok(new ShadowExportResponse(path.toString(), count)))
                            .orElseGet(() -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/shadow")
    public Mono<ResponseEntity<ClearResponse>> clearShadow() {
        if (shadowVerifier == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(new ClearResponse(shadowVerifier.clear())));
    }

    /**
     * Gets tick performance of the combat pulse.
     */
    @GetMapping("/pulse/metrics")
    public Mono<ResponseEntity<PulseMetricsResponse>> getPulseMetrics() {
        return Mono.just(ResponseEntity.ok(PulseMetricsResponse.from(scheduler)));
    }
}
