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

package org.fireflyframework.combat.routine;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;
import org.fireflyframework.combat.actor.HitResolver;
import org.fireflyframework.combat.actor.SwingAnimator;
import org.fireflyframework.combat.audit.ShadowModeVerifier;
import org.fireflyframework.combat.event.ActionPhase;
import org.fireflyframework.combat.event.CombatActionEvent;
import org.fireflyframework.combat.event.CombatEventPublisher;
import org.fireflyframework.combat.metrics.CombatMetrics;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.PendingResolution;
import org.fireflyframework.combat.scheduler.ResolutionHandler;
import org.fireflyframework.combat.state.ActionCategory;
import org.fireflyframework.combat.state.ActorTimerRegistry;
import org.fireflyframework.combat.state.ActorTimerState;
import org.fireflyframework.combat.timing.TimingProvider;
import org.fireflyframework.combat.timing.TimingProviderRegistry;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Starts attacks now and resolves them later.
 * <p>
 * {@link #executeAttack} first claims the swing on the actor's timer state,
 * so a second swing attempted before the first has stamped its interval is
 * refused. It then plays the swing animation immediately, schedules the
 * hit resolution at {@code now + hitOffset} and stamps the next swing time at
 * {@code now + interval}, both from the same instant, in the actor's timer
 * state and in the scheduler. The scheduler calls back into
 * {@link #resolveScheduledHit} from the tick once the resolution is due.
 */
@Slf4j
public class AttackRoutine implements ResolutionHandler {

    private final CombatPulseScheduler scheduler;
    private final ActorTimerRegistry timers;
    private final TimingProviderRegistry providers;
    private final HitResolver hitResolver;
    private final SwingAnimator animator;
    private final CombatEventPublisher events;
    private final Clock clock;
    private final int fallbackIntervalMs;
    private final int fallbackHitOffsetMs;
    @Nullable
    private final ShadowModeVerifier shadowVerifier;
    @Nullable
    private final CombatMetrics metrics;

    public AttackRoutine(CombatPulseScheduler scheduler,
                         ActorTimerRegistry timers,
                         TimingProviderRegistry providers,
                         HitResolver hitResolver,
                         SwingAnimator animator,
                         CombatEventPublisher events,
                         Clock clock,
                         int fallbackIntervalMs,
                         int fallbackHitOffsetMs,
                         @Nullable ShadowModeVerifier shadowVerifier,
                         @Nullable CombatMetrics metrics) {
        if (scheduler == null || timers == null || providers == null || hitResolver == null) {
            throw new IllegalArgumentException("Scheduler, timers, providers and hit resolver are required");
        }
        this.scheduler = scheduler;
        this.timers = timers;
        this.providers = providers;
        this.hitResolver = hitResolver;
        this.animator = animator != null ? animator : SwingAnimator.NONE;
        this.events = events != null ? events : new CombatEventPublisher();
        this.clock = clock;
        this.fallbackIntervalMs = fallbackIntervalMs;
        this.fallbackHitOffsetMs = fallbackHitOffsetMs;
        this.shadowVerifier = shadowVerifier;
        this.metrics = metrics;
    }

    /**
     * Starts a swing and schedules its resolution.
     *
     * @return the timing decided for this swing, or {@code null} when the
     *         attacker, defender or weapon is missing or no longer valid, or
     *         when the attacker may not swing yet
     */
    public AttackTiming executeAttack(CombatActor attacker, CombatActor defender, CombatWeapon weapon) {
        if (!isValid(attacker) || !isValid(defender) || weapon == null) {
            log.debug("Ignoring attack with invalid attacker, defender or weapon");
            return null;
        }

        ActorTimerState state = timers.getOrCreate(attacker);
        Optional<String> refused = state.tryBeginSwing(weapon.getName());
        if (refused.isPresent()) {
            log.debug("Attack by {} refused: {}", attacker.getId(), refused.get());
            return null;
        }
        try {
            return startSwing(state, attacker, defender, weapon);
        } catch (RuntimeException e) {
            state.cancel(ActionCategory.ATTACK, "Swing failed to start");
            throw e;
        }
    }

    private AttackTiming startSwing(ActorTimerState state, CombatActor attacker,
                                    CombatActor defender, CombatWeapon weapon) {
        scheduler.register(attacker);
        scheduler.updateActivity(attacker);
        playSwing(attacker, weapon);

        TimingProvider provider = providers.getActive();
        int interval = computeInterval(provider, attacker, weapon);
        int offset = computeHitOffset(provider, weapon);

        long now = clock.millis();
        PendingResolution pending = scheduler.scheduleResolution(attacker, defender, weapon, now, offset,
                provider.getProviderName());
        long nextSwingAt = now + interval;
        state.setNextTimeAt(ActionCategory.ATTACK, nextSwingAt);
        scheduler.updateNextActionTime(attacker, nextSwingAt);

        if (shadowVerifier != null) {
            shadowVerifier.compareWeaponTiming(attacker, weapon);
        }

        events.publish(CombatActionEvent.builder()
                .actor(attacker)
                .target(defender)
                .weapon(weapon)
                .category(ActionCategory.ATTACK)
                .phase(ActionPhase.BEGIN)
                .expectedDelayMs(interval)
                .providerName(provider.getProviderName())
                .details(Map.of("hitOffsetMs", offset))
                .timestamp(now)
                .build());

        log.debug("Attack {} -> {} with {}: interval={}ms, hitOffset={}ms",
                attacker.getId(), defender.getId(), weapon.getName(), interval, offset);

        long resolveAt = pending != null ? pending.resolveAt() : now + offset;
        return new AttackTiming(provider.getProviderName(), interval, offset, now, resolveAt, nextSwingAt);
    }

    @Override
    public void resolve(CombatActor attacker, PendingResolution resolution) {
        resolveScheduledHit(attacker, resolution);
    }

    /**
     * Applies a due resolution. Both parties are checked again because time
     * has passed since the swing. Never throws.
     */
    public ResolutionOutcome resolveScheduledHit(CombatActor attacker, PendingResolution resolution) {
        if (resolution == null || !isValid(attacker) || !isValid(resolution.target())) {
            record(ResolutionOutcome.SKIPPED);
            return ResolutionOutcome.SKIPPED;
        }

        CombatActor defender = resolution.target();
        CombatWeapon weapon = resolution.weapon();
        ResolutionOutcome outcome;
        try {
            if (hitResolver.checkHit(attacker, defender, weapon)) {
                hitResolver.onHit(attacker, defender, weapon);
                outcome = ResolutionOutcome.HIT;
            } else {
                hitResolver.onMiss(attacker, defender, weapon);
                outcome = ResolutionOutcome.MISS;
            }
        } catch (RuntimeException e) {
            log.error("HIT_RESOLUTION_FAILED: attacker={}, defender={}", attacker.getId(), defender.getId(), e);
            outcome = ResolutionOutcome.FAILED;
        }
        record(outcome);

        long now = clock.millis();
        events.publish(CombatActionEvent.builder()
                .actor(attacker)
                .target(defender)
                .weapon(weapon)
                .category(ActionCategory.ATTACK)
                .phase(ActionPhase.COMPLETE)
                .expectedDelayMs(resolution.expectedOffsetMs())
                .actualDelayMs(now - resolution.scheduledAt())
                .providerName(resolution.providerName() != null
                        ? resolution.providerName()
                        : providers.getActive().getProviderName())
                .details(Map.of("outcome", outcome.name()))
                .timestamp(now)
                .build());
        return outcome;
    }

    /**
     * Whether the actor may swing now.
     */
    public boolean canAttack(CombatActor actor) {
        return isValid(actor) && timers.getOrCreate(actor).canPerform(ActionCategory.ATTACK);
    }

    /**
     * Clears the pending swing and drops the actor's scheduled resolutions.
     *
     * @return {@code true} when a swing or a resolution was cancelled
     */
    public boolean cancelPendingAttack(CombatActor actor, String reason) {
        if (actor == null) {
            return false;
        }
        boolean swingCancelled = timers.find(actor)
                .map(state -> state.cancel(ActionCategory.ATTACK, reason))
                .orElse(false);
        int dropped = scheduler.cancelPendingResolutions(actor);
        if (!swingCancelled && dropped == 0) {
            return false;
        }
        events.publish(CombatActionEvent.builder()
                .actor(actor)
                .category(ActionCategory.ATTACK)
                .phase(ActionPhase.CANCELLED)
                .reason(reason)
                .details(Map.of("droppedResolutions", dropped))
                .timestamp(clock.millis())
                .build());
        return true;
    }

    private void playSwing(CombatActor attacker, CombatWeapon weapon) {
        try {
            animator.playSwing(attacker, weapon);
        } catch (RuntimeException e) {
            log.error("SWING_ANIMATION_FAILED: attacker={}, weapon={}", attacker.getId(), weapon.getName(), e);
        }
    }

    private int computeInterval(TimingProvider provider, CombatActor attacker, CombatWeapon weapon) {
        try {
            return provider.getAttackIntervalMs(attacker, weapon);
        } catch (RuntimeException e) {
            log.error("TIMING_PROVIDER_FAILED: provider={}, weapon={}, using fallback interval {}ms",
                    provider.getProviderName(), weapon.getName(), fallbackIntervalMs, e);
            return fallbackIntervalMs;
        }
    }

    private int computeHitOffset(TimingProvider provider, CombatWeapon weapon) {
        try {
            return provider.getAnimationHitOffsetMs(weapon);
        } catch (RuntimeException e) {
            log.error("TIMING_PROVIDER_FAILED: provider={}, weapon={}, using fallback hit offset {}ms",
                    provider.getProviderName(), weapon.getName(), fallbackHitOffsetMs, e);
            return fallbackHitOffsetMs;
        }
    }

    private void record(ResolutionOutcome outcome) {
        if (metrics != null) {
            metrics.recordResolution(outcome.name());
        }
    }

    private static boolean isValid(CombatActor actor) {
        return actor != null && actor.isValid();
    }
}
