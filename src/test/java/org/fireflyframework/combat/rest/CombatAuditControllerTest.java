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

import org.fireflyframework.combat.audit.AuditLevel;
import org.fireflyframework.combat.audit.AuditLogEntry;
import org.fireflyframework.combat.audit.CombatActionTypes;
import org.fireflyframework.combat.audit.CombatAuditService;
import org.fireflyframework.combat.audit.FlushResult;
import org.fireflyframework.combat.audit.ShadowModeReport;
import org.fireflyframework.combat.audit.ShadowModeVerifier;
import org.fireflyframework.combat.properties.CombatTimingProperties.PulseConfig;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.TimerSubsystemProbe;
import org.fireflyframework.combat.support.MutableClock;
import org.fireflyframework.combat.support.TestActor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CombatAuditController}.
 */
@ExtendWith(MockitoExtension.class)
class CombatAuditControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    @Mock
    private CombatAuditService auditService;

    @Mock
    private ShadowModeVerifier shadowVerifier;

    private CombatPulseScheduler scheduler;
    private CombatAuditController controller;

    @BeforeEach
    void setUp() {
        scheduler = new CombatPulseScheduler(new PulseConfig(), new MutableClock(0L), TimerSubsystemProbe.ALWAYS_READY);
        controller = new CombatAuditController(scheduler, auditService, shadowVerifier);
    }

    private static AuditLogEntry entry() {
        return AuditLogEntry.builder()
                .timestamp(NOW)
                .actorId("hero")
                .actionType(CombatActionTypes.SWING_START)
                .expectedDelayMs(1850)
                .level(AuditLevel.STANDARD)
                .build();
    }

    // ========================================================================
    // Audit Endpoint Tests
    // ========================================================================

    @Nested
    @DisplayName("audit endpoints")
    class AuditEndpointTests {

        @Test
        @DisplayName("should return the buffered entries")
        void shouldReturnBuffer() {
            when(auditService.getBufferSnapshot()).thenReturn(List.of(entry()));

            StepVerifier.create(controller.getBuffer())
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(response.getBody()).hasSize(1);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should pass the history window through to the audit service")
        void shouldReturnActorHistory() {
            when(auditService.getActorHistory("hero", Duration.ofMillis(5000))).thenReturn(List.of(entry()));

            StepVerifier.create(controller.getActorHistory("hero", 5000L))
                    .assertNext(response -> assertThat(response.getBody()).hasSize(1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 200 for a successful flush and 503 for a failed one")
        void shouldMapFlushResults() {
            when(auditService.flush())
                    .thenReturn(Mono.just(FlushResult.written(3, "combat-audit-2026-03-15.jsonl", NOW)))
                    .thenReturn(Mono.just(FlushResult.failed("disk full", NOW)));

            StepVerifier.create(controller.flush())
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(response.getBody().entriesWritten()).isEqualTo(3);
                    })
                    .verifyComplete();
            StepVerifier.create(controller.flush())
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                        assertThat(response.getBody().message()).isEqualTo("disk full");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should clear the buffer")
        void shouldClearBuffer() {
            when(auditService.clear()).thenReturn(12);

            StepVerifier.create(controller.clearBuffer())
                    .assertNext(response -> assertThat(response.getBody().removed()).isEqualTo(12))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 404 when auditing is disabled")
        void shouldReturnNotFoundWithoutAudit() {
            CombatAuditController withoutAudit = new CombatAuditController(scheduler, null, null);

            StepVerifier.create(withoutAudit.getStatistics())
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                    .verifyComplete();
            StepVerifier.create(withoutAudit.getShadowReport(null))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                    .verifyComplete();
        }
    }

    // ========================================================================
    // Shadow and Pulse Endpoint Tests
    // ========================================================================

    @Nested
    @DisplayName("shadow and pulse endpoints")
    class ShadowAndPulseEndpointTests {

        @Test
        @DisplayName("should return the full shadow report when no window is given")
        void shouldReturnShadowReport() {
            ShadowModeReport report = new ShadowModeReport(2, 5, 15, 10.0, 1, 50.0, List.of(), null, NOW);
            when(shadowVerifier.generateReport(null)).thenReturn(report);

            StepVerifier.create(controller.getShadowReport(null))
                    .assertNext(response -> assertThat(response.getBody()).isEqualTo(report))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should export comparisons and report the file")
        void shouldExportShadowComparisons() {
            when(shadowVerifier.getComparisonCount()).thenReturn(4);
            when(shadowVerifier.exportToCsv()).thenReturn(Optional.of(Path.of("shadow.csv")));

            StepVerifier.create(controller.exportShadow())
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                        assertThat(response.getBody().file()).isEqualTo("shadow.csv");
                        assertThat(response.getBody().comparisons()).isEqualTo(4);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 500 when the export fails")
        void shouldReportExportFailure() {
            when(shadowVerifier.exportToCsv()).thenReturn(Optional.empty());

            StepVerifier.create(controller.exportShadow())
                    .assertNext(response ->
                            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR))
                    .verifyComplete();
            verify(shadowVerifier).getComparisonCount();
        }

        @Test
        @DisplayName("should report pulse metrics")
        void shouldReportPulseMetrics() {
            scheduler.register(TestActor.player("hero", 100));
            scheduler.tick();

            StepVerifier.create(controller.getPulseMetrics())
                    .assertNext(response -> {
                        assertThat(response.getBody().running()).isFalse();
                        assertThat(response.getBody().activeParticipants()).isEqualTo(1);
                        assertThat(response.getBody().totalTicks()).isEqualTo(1);
                    })
                    .verifyComplete();
        }
    }
}
