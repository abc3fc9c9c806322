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

package org.fireflyframework.combat.action;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.combat.actor.HitResolver;
import org.fireflyframework.combat.actor.SwingAnimator;
import org.fireflyframework.combat.audit.AuditLogWriter;
import org.fireflyframework.combat.audit.CombatAuditService;
import org.fireflyframework.combat.event.ActionPhase;
import org.fireflyframework.combat.event.CombatActionEvent;
import org.fireflyframework.combat.event.CombatActionListener;
import org.fireflyframework.combat.event.CombatEventPublisher;
import org.fireflyframework.combat.properties.CombatTimingProperties.AuditConfig;
import org.fireflyframework.combat.properties.CombatTimingProperties.PulseConfig;
import org.fireflyframework.combat.routine.AttackRoutine;
import org.fireflyframework.combat.routine.AttackTiming;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.TimerSubsystemProbe;
import org.fireflyframework.combat.state.ActionCategory;
import org.fireflyframework.combat.state.ActionRules;
import org.fireflyframework.combat.state.ActorTimerRegistry;
import org.fireflyframework.combat.state.ActorTimerState;
import org.fireflyframework.combat.state.TimerMode;
import org.fireflyframework.combat.support.MutableClock;
import org.fireflyframework.combat.support.TestActor;
import org.fireflyframework.combat.support.TestWeapon;
import org.fireflyframework.combat.timing.LegacyTimingProvider;
import org.fireflyframework.combat.timing.SpellTimingTable;
import org.fireflyframework.combat.timing.TimingProviderRegistry;
import org.fireflyframework.combat.timing.WeaponTimingProvider;
import org.fireflyframework.combat.timing.WeaponTimingTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link CombatActionService}.
 * <p>
 * Tests cover the begin and complete operations for each action category,
 * the configurable cancel and blocking rules, pulse readiness and actor removal.
 */
class CombatActionServiceTest {

    private static final long T0 = 100_000L;

    private MutableClock clock;
    private CombatPulseScheduler scheduler;
    private List<CombatActionEvent> events;
    private CombatEventPublisher publisher;
    private ActorTimerRegistry timers;
    private CombatActionService service;

    private TestActor actor;
    private TestActor enemy;
    private TestWeapon katana;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduler = new CombatPulseScheduler(new PulseConfig(), clock, TimerSubsystemProbe.ALWAYS_READY);
        events = new CopyOnWriteArrayList<>();
        publisher = new CombatEventPublisher(List.<CombatActionListener>of(events::add));
        service = newService(ActionRules.defaults(), null);

        actor = TestActor.player("hero", 100);
        enemy = TestActor.creature("orc");
        katana = TestWeapon.katana();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private CombatActionService newService(ActionRules rules, CombatAuditService auditService) {
        return newService(rules, auditService, SwingAnimator.NONE);
    }

    private CombatActionService newService(ActionRules rules, CombatAuditService auditService,
                                           SwingAnimator animator) {
        timers = new ActorTimerRegistry(TimerMode.INDEPENDENT, rules, clock, true, false);
        TimingProviderRegistry providers = new TimingProviderRegistry(
                new WeaponTimingProvider(WeaponTimingTable.compatibility()), new LegacyTimingProvider());
        AttackRoutine routine = new AttackRoutine(scheduler, timers, providers, mock(HitResolver.class),
                animator, publisher, clock, 1500, 300, null, null);
        scheduler.setResolutionHandler(routine);
        CombatActionService created = new CombatActionService(timers, routine, scheduler,
                SpellTimingTable.defaults(), publisher, clock, auditService);
        scheduler.setPulseActionTrigger(created);
        return created;
    }

    private static ActionRules rules(boolean disableSwingDuringCast, boolean removePostCastRecovery,
                                     boolean instantDeviceUse) {
        return new ActionRules(true, true, true, true, disableSwingDuringCast, disableSwingDuringCast,
                removePostCastRecovery, instantDeviceUse);
    }

    private List<CombatActionEvent> eventsFor(ActionCategory category, ActionPhase phase) {
        return events.stream()
                .filter(e -> e.category() == category && e.phase() == phase)
                .toList();
    }

    // ========================================================================
    // Swing Tests
    // ========================================================================

    @Nested
    @DisplayName("beginSwing")
    class SwingTests {

        @Test
        @DisplayName("should start a swing and refuse another until the interval elapses")
        void shouldRefuseOverlappingSwing() {
            Optional<AttackTiming> first = service.beginSwing(actor, enemy, katana);

            assertThat(first).isPresent();
            assertThat(service.beginSwing(actor, enemy, katana)).isEmpty();
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.CANCELLED)).singleElement()
                    .satisfies(e -> assertThat(e.reason()).isEqualTo("ATTACK timer not elapsed"));

            clock.advance(first.get().intervalMs());
            assertThat(service.beginSwing(actor, enemy, katana)).isPresent();
        }

        @Test
        @DisplayName("should refuse a swing requested while another swing is starting")
        void shouldRefuseSwingRequestedDuringSwing() {
            AtomicBoolean reentered = new AtomicBoolean();
            List<Optional<AttackTiming>> nested = new ArrayList<>();
            service = newService(ActionRules.defaults(), null, (attacker, weapon) -> {
                if (reentered.compareAndSet(false, true)) {
                    nested.add(service.beginSwing(actor, enemy, katana));
                }
            });

            assertThat(service.beginSwing(actor, enemy, katana)).isPresent();

            assertThat(nested).singleElement().satisfies(result -> assertThat(result).isEmpty());
            assertThat(scheduler.getPendingCount(actor)).isEqualTo(1);
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.BEGIN)).hasSize(1);
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.CANCELLED)).singleElement()
                    .satisfies(e -> assertThat(e.reason()).isEqualTo("swing already starting"));
        }

        @Test
        @DisplayName("should start exactly one swing when many threads swing for the same actor")
        void shouldStartOneSwingUnderContention() throws Exception {
            int threads = 8;
            CountDownLatch ready = new CountDownLatch(threads);
            CountDownLatch go = new CountDownLatch(1);
            AtomicInteger started = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        ready.countDown();
                        go.await();
                        if (service.beginSwing(actor, enemy, katana).isPresent()) {
                            started.incrementAndGet();
                        }
                        return null;
                    }));
                }
                assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
                go.countDown();
                for (Future<?> future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(started).hasValue(1);
            assertThat(scheduler.getPendingCount(actor)).isEqualTo(1);
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.BEGIN)).hasSize(1);
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.CANCELLED)).hasSize(threads - 1);
        }

        @Test
        @DisplayName("should refuse a swing while casting under default rules")
        void shouldRefuseSwingWhileCasting() {
            service.beginCast(actor, "Explosion", 0, false);

            assertThat(service.beginSwing(actor, enemy, katana)).isEmpty();
            assertThat(timers.getOrCreate(actor).isCasting()).isTrue();
        }

        @Test
        @DisplayName("should interrupt the cast when swings are allowed during casting")
        void shouldCancelCastOnSwing() {
            service = newService(rules(false, true, true), null);
            service.beginCast(actor, "Explosion", 0, false);

            assertThat(service.beginSwing(actor, enemy, katana)).isPresent();

            assertThat(timers.getOrCreate(actor).isCasting()).isFalse();
            assertThat(eventsFor(ActionCategory.CAST, ActionPhase.CANCELLED)).singleElement()
                    .satisfies(e -> {
                        assertThat(e.reason()).isEqualTo("Weapon swing started");
                        assertThat(e.context()).isEqualTo("Explosion");
                    });
        }

        @Test
        @DisplayName("should ignore invalid participants")
        void shouldIgnoreInvalidParticipants() {
            enemy.invalidate();

            assertThat(service.beginSwing(actor, enemy, katana)).isEmpty();
            assertThat(service.beginSwing(actor, TestActor.creature("x"), null)).isEmpty();
            assertThat(events).isEmpty();
        }
    }

    // ========================================================================
    // Cast Tests
    // ========================================================================

    @Nested
    @DisplayName("spell casting")
    class CastTests {

        @Test
        @DisplayName("should publish the cast delay from the spell table")
        void shouldPublishCastDelay() {
            assertThat(service.beginCast(actor, "Explosion", 0, false)).isTrue();

            assertThat(eventsFor(ActionCategory.CAST, ActionPhase.BEGIN)).singleElement().satisfies(e -> {
                assertThat(e.expectedDelayMs()).isEqualTo(2500);
                assertThat(e.context()).isEqualTo("Explosion");
            });
            assertThat(service.beginCast(actor, "Explosion", 0, false)).isFalse();
        }

        @Test
        @DisplayName("should cancel a scheduled hit when a spell starts")
        void shouldCancelSwingOnCast() {
            service.beginSwing(actor, enemy, katana);
            assertThat(scheduler.getPendingCount(actor)).isEqualTo(1);

            service.beginCast(actor, "Explosion", 0, false);

            assertThat(scheduler.getPendingCount(actor)).isZero();
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.CANCELLED)).singleElement()
                    .satisfies(e -> assertThat(e.reason()).isEqualTo("Spell cast started"));
        }

        @Test
        @DisplayName("should block swings during the cast delay and release them on completion")
        void shouldBlockSwingDuringCastDelay() {
            service.beginCast(actor, "Explosion", 0, false);
            service.enterCastDelay(actor, Duration.ofMillis(400));

            assertThat(service.canPerform(actor, ActionCategory.ATTACK)).isFalse();

            service.completeCast(actor, Duration.ofMillis(1000));

            assertThat(service.canPerform(actor, ActionCategory.ATTACK)).isTrue();
            assertThat(service.canPerform(actor, ActionCategory.CAST)).isTrue();
            assertThat(eventsFor(ActionCategory.CAST, ActionPhase.COMPLETE)).singleElement()
                    .satisfies(e -> assertThat(e.context()).isEqualTo("Explosion"));
        }

        @Test
        @DisplayName("should apply post-cast recovery when it is not removed")
        void shouldApplyPostCastRecovery() {
            service = newService(rules(true, false, true), null);
            service.beginCast(actor, "Explosion", 0, false);

            service.completeCast(actor, Duration.ofMillis(1000));

            assertThat(service.canPerform(actor, ActionCategory.CAST)).isFalse();
            clock.advance(1000);
            assertThat(service.canPerform(actor, ActionCategory.CAST)).isTrue();
        }
    }

    // ========================================================================
    // Bandage and Device Tests
    // ========================================================================

    @Nested
    @DisplayName("bandage and device use")
    class BandageAndDeviceTests {

        @Test
        @DisplayName("should cancel swing and cast when bandaging starts")
        void shouldCancelActionsOnBandage() {
            service.beginSwing(actor, enemy, katana);

            assertThat(service.beginBandage(actor, null)).isTrue();

            assertThat(scheduler.getPendingCount(actor)).isZero();
            assertThat(service.beginBandage(actor, null)).isFalse();
            assertThat(eventsFor(ActionCategory.HEAL, ActionPhase.BEGIN)).singleElement()
                    .satisfies(e -> assertThat(e.context()).isEqualTo("hero"));
        }

        @Test
        @DisplayName("should apply the bandage delay on completion")
        void shouldApplyBandageDelay() {
            TestActor patient = TestActor.player("friend", 100);
            service.beginBandage(actor, patient);

            service.completeBandage(actor, Duration.ofMillis(2000));

            assertThat(service.canPerform(actor, ActionCategory.HEAL)).isFalse();
            assertThat(eventsFor(ActionCategory.HEAL, ActionPhase.COMPLETE)).singleElement().satisfies(e -> {
                assertThat(e.context()).isEqualTo("friend");
                assertThat(e.expectedDelayMs()).isEqualTo(2000);
            });
            clock.advance(2000);
            assertThat(service.canPerform(actor, ActionCategory.HEAL)).isTrue();
        }

        @Test
        @DisplayName("should cancel cast and bandage when a device is used")
        void shouldCancelOnDeviceUse() {
            service.beginCast(actor, "Explosion", 0, false);

            assertThat(service.beginDeviceUse(actor, "Wand of Lightning")).isTrue();

            ActorTimerState state = timers.getOrCreate(actor);
            assertThat(state.isCasting()).isFalse();
            assertThat(state.isUsingDevice()).isTrue();
            assertThat(eventsFor(ActionCategory.CAST, ActionPhase.CANCELLED)).hasSize(1);
        }

        @Test
        @DisplayName("should honor instant device use")
        void shouldHonorInstantDeviceUse() {
            service.beginDeviceUse(actor, "Wand");
            service.completeDeviceUse(actor, Duration.ofMillis(500));
            assertThat(service.canPerform(actor, ActionCategory.DEVICE)).isTrue();

            service = newService(rules(true, true, false), null);
            service.beginDeviceUse(actor, "Wand");
            service.completeDeviceUse(actor, Duration.ofMillis(500));
            assertThat(service.canPerform(actor, ActionCategory.DEVICE)).isFalse();
        }

        @Test
        @DisplayName("should cancel a category only when it is in progress")
        void shouldCancelExplicitly() {
            assertThat(service.cancel(actor, ActionCategory.HEAL, "moved")).isFalse();

            service.beginBandage(actor, null);

            assertThat(service.cancel(actor, ActionCategory.HEAL, "moved")).isTrue();
            assertThat(eventsFor(ActionCategory.HEAL, ActionPhase.CANCELLED)).singleElement()
                    .satisfies(e -> assertThat(e.reason()).isEqualTo("moved"));
        }
    }

    // ========================================================================
    // Pulse and Removal Tests
    // ========================================================================

    @Nested
    @DisplayName("pulse readiness and removal")
    class PulseAndRemovalTests {

        @Test
        @DisplayName("should mark an eligible actor ready once per swing")
        void shouldMarkReadyOnce() {
            service.onActionReady(actor);
            service.onActionReady(actor);

            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.READY)).hasSize(1);
            assertThat(timers.getOrCreate(actor).getInFlight(ActionCategory.ATTACK)).contains("pulse");
        }

        @Test
        @DisplayName("should signal readiness from the pulse after the swing interval")
        void shouldSignalReadinessFromPulse() {
            AttackTiming timing = service.beginSwing(actor, enemy, katana).orElseThrow();

            clock.advance(timing.intervalMs() - 50);
            scheduler.updateActivity(actor);
            scheduler.tick();
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.READY)).isEmpty();

            clock.advance(50);
            scheduler.tick();
            assertThat(eventsFor(ActionCategory.ATTACK, ActionPhase.READY)).hasSize(1);
        }

        @Test
        @DisplayName("should drop all tracking for a removed actor")
        void shouldForgetRemovedActor(@TempDir Path tempDir) {
            CombatAuditService audit = new CombatAuditService(new AuditConfig(),
                    new AuditLogWriter(tempDir, new ObjectMapper().findAndRegisterModules(), clock, 1, 0, null),
                    clock, Duration.ofMillis(50), null);
            publisher.addListener(audit);
            service = newService(ActionRules.defaults(), audit);
            service.beginSwing(actor, enemy, katana);
            assertThat(audit.getActorHistory(actor, null)).isNotEmpty();

            service.onActorRemoved(actor);

            assertThat(scheduler.isActive(actor)).isFalse();
            assertThat(timers.size()).isZero();
            assertThat(audit.getActorHistory(actor, null)).isEmpty();
        }
    }
}
