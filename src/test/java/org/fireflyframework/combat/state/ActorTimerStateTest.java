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

package org.fireflyframework.combat.state;

import org.fireflyframework.combat.support.MutableClock;
import org.fireflyframework.combat.support.TestActor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ActorTimerState}.
 * <p>
 * Tests cover per-category timers in independent and shared modes,
 * the busy-state transitions, cancellation and the blocking rules.
 */
class ActorTimerStateTest {

    private static final long START = 1_000_000L;

    private MutableClock clock;
    private TestActor actor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        actor = TestActor.player("p1", 100);
    }

    private ActorTimerState newState(TimerMode mode, ActionRules rules) {
        return new ActorTimerState(actor, mode, rules, clock, true, true);
    }

    // ========================================================================
    // Timer Tests
    // ========================================================================

    @Nested
    @DisplayName("timers")
    class TimerTests {

        @Test
        @DisplayName("should block a category until its next time has elapsed")
        void shouldBlockUntilElapsed() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            state.setNextTime(ActionCategory.ATTACK, Duration.ofMillis(1500));

            assertThat(state.canPerform(ActionCategory.ATTACK)).isFalse();
            assertThat(state.getRemainingDelayMs(ActionCategory.ATTACK)).isEqualTo(1500);
            assertThat(state.canPerform(ActionCategory.CAST)).isTrue();

            clock.advance(1499);
            assertThat(state.canPerform(ActionCategory.ATTACK)).isFalse();

            clock.advance(1);
            assertThat(state.canPerform(ActionCategory.ATTACK)).isTrue();
            assertThat(state.getRemainingDelayMs(ActionCategory.ATTACK)).isZero();
        }

        @Test
        @DisplayName("should keep timers internal in independent mode")
        void shouldKeepTimersInternal() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            state.setNextTimeAt(ActionCategory.ATTACK, START + 500);

            assertThat(state.getNextTime(ActionCategory.ATTACK)).isEqualTo(START + 500);
            assertThat(actor.getNextCombatTime()).isZero();
        }

        @Test
        @DisplayName("should read and write the actor's own fields in shared mode")
        void shouldShareActorFields() {
            ActorTimerState state = newState(TimerMode.SHARED, ActionRules.defaults());

            state.setNextTimeAt(ActionCategory.ATTACK, START + 500);
            state.setNextTimeAt(ActionCategory.CAST, START + 700);
            state.setNextTimeAt(ActionCategory.HEAL, START + 900);

            assertThat(actor.getNextCombatTime()).isEqualTo(START + 500);
            assertThat(actor.getNextSpellTime()).isEqualTo(START + 700);
            assertThat(actor.getNextSkillTime()).isEqualTo(START + 900);
            assertThat(state.getNextTime(ActionCategory.DEVICE)).isEqualTo(START + 900);

            actor.setNextCombatTime(START - 1);
            assertThat(state.canPerform(ActionCategory.ATTACK)).isTrue();
        }

        @Test
        @DisplayName("should clear the pending swing when the attack timer is set")
        void shouldClearPendingSwingOnAttackTimer() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            state.begin(ActionCategory.ATTACK, "Katana");
            assertThat(state.hasPendingSwing()).isTrue();
            assertThat(state.getInFlight(ActionCategory.ATTACK)).contains("Katana");

            state.setNextTimeAt(ActionCategory.ATTACK, START + 1000);

            assertThat(state.hasPendingSwing()).isFalse();
            assertThat(state.getInFlight(ActionCategory.ATTACK)).isEmpty();
        }

        @Test
        @DisplayName("should treat negative delays as zero")
        void shouldClampNegativeDelay() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            state.setNextTime(ActionCategory.HEAL, Duration.ofMillis(-300));

            assertThat(state.getNextTime(ActionCategory.HEAL)).isEqualTo(START);
            assertThat(state.canPerform(ActionCategory.HEAL)).isTrue();
        }
    }

    // ========================================================================
    // Busy State Tests
    // ========================================================================

    @Nested
    @DisplayName("busy state")
    class BusyStateTests {

        @Test
        @DisplayName("should move from casting to cast delay to idle")
        void shouldFollowCastLifecycle() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            state.begin(ActionCategory.CAST, "Explosion");
            assertThat(state.isCasting()).isTrue();
            assertThat(state.blockingReason(ActionCategory.CAST)).contains("already casting");

            state.enterCastDelay();
            state.setCastDelay(Duration.ofMillis(400));
            assertThat(state.isCasting()).isFalse();
            assertThat(state.isInCastDelay()).isTrue();
            assertThat(state.getRemainingCastDelayMs()).isEqualTo(400);
            assertThat(state.isBusy()).isTrue();

            state.end(ActionCategory.CAST);
            assertThat(state.isInCastDelay()).isFalse();
            assertThat(state.isBusy()).isFalse();
            assertThat(state.canPerform(ActionCategory.CAST)).isTrue();
        }

        @Test
        @DisplayName("should refuse overlapping bandage and device use")
        void shouldRefuseOverlap() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            state.begin(ActionCategory.HEAL, "p2");
            state.begin(ActionCategory.DEVICE, "Wand");

            assertThat(state.blockingReason(ActionCategory.HEAL)).contains("already bandaging");
            assertThat(state.blockingReason(ActionCategory.DEVICE)).contains("already using a device");
            assertThat(state.describe()).contains("bandage=true").contains("device=true");
        }

        @Test
        @DisplayName("should cancel only categories that are in progress")
        void shouldCancelInProgressCategories() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            assertThat(state.cancel(ActionCategory.HEAL, "nothing to cancel")).isFalse();

            state.begin(ActionCategory.HEAL, "p2");
            assertThat(state.cancel(ActionCategory.HEAL, "Interrupted")).isTrue();
            assertThat(state.isBandaging()).isFalse();
            assertThat(state.getInFlight(ActionCategory.HEAL)).isEmpty();
        }

        @Test
        @DisplayName("should reset everything on clearAll")
        void shouldClearAll() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());
            state.begin(ActionCategory.CAST, "Explosion");
            state.begin(ActionCategory.ATTACK, "Katana");
            state.setNextTimeAt(ActionCategory.HEAL, START + 5000);

            state.clearAll();

            assertThat(state.isBusy()).isFalse();
            assertThat(state.hasPendingSwing()).isFalse();
            assertThat(state.getNextTime(ActionCategory.HEAL)).isZero();
        }
    }

    // ========================================================================
    // Blocking Rule Tests
    // ========================================================================

    @Nested
    @DisplayName("blocking rules")
    class BlockingRuleTests {

        @Test
        @DisplayName("should block swings while casting when configured")
        void shouldBlockSwingWhileCasting() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());

            state.begin(ActionCategory.CAST, "Explosion");

            assertThat(state.blockingReason(ActionCategory.ATTACK)).contains("casting");
        }

        @Test
        @DisplayName("should block swings during an active cast delay until it expires")
        void shouldBlockSwingDuringCastDelay() {
            ActorTimerState state = newState(TimerMode.INDEPENDENT, ActionRules.defaults());
            state.begin(ActionCategory.CAST, "Explosion");
            state.enterCastDelay();
            state.setCastDelay(Duration.ofMillis(300));

            assertThat(state.blockingReason(ActionCategory.ATTACK)).contains("in cast delay");

            clock.advance(300);
            assertThat(state.canPerform(ActionCategory.ATTACK)).isTrue();
        }

        @Test
        @DisplayName("should allow swings while casting when the rules permit it")
        void shouldAllowSwingWhenRulesPermit() {
            ActionRules permissive = new ActionRules(true, true, true, true, false, false, true, true);
            ActorTimerState state = newState(TimerMode.INDEPENDENT, permissive);

            state.begin(ActionCategory.CAST, "Explosion");
            assertThat(state.canPerform(ActionCategory.ATTACK)).isTrue();

            state.enterCastDelay();
            assertThat(state.canPerform(ActionCategory.ATTACK)).isTrue();
        }
    }

    @Test
    @DisplayName("should reject a null actor")
    void shouldRejectNullActor() {
        assertThatThrownBy(() -> new ActorTimerState(null, TimerMode.INDEPENDENT, ActionRules.defaults(),
                clock, false, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
