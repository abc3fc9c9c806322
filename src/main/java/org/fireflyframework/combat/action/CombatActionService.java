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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;
import org.fireflyframework.combat.audit.CombatAuditService;
import org.fireflyframework.combat.event.ActionPhase;
import org.fireflyframework.combat.event.CombatActionEvent;
import org.fireflyframework.combat.event.CombatEventPublisher;
import org.fireflyframework.combat.routine.AttackRoutine;
import org.fireflyframework.combat.routine.AttackTiming;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.PulseActionTrigger;
import org.fireflyframework.combat.state.ActionCategory;
import org.fireflyframework.combat.state.ActionRules;
import org.fireflyframework.combat.state.ActorTimerRegistry;
import org.fireflyframework.combat.state.ActorTimerState;
import org.fireflyframework.combat.timing.SpellTimingTable;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Entry point for game logic starting, completing and cancelling timed actions.
 * <p>
 * Every "begin" checks eligibility (including the blocking rules), then
 * applies the cancel rules of the action being started, marks the category
 * busy and publishes an event. A refused
 * action publishes a {@link ActionPhase#CANCELLED} event with the reason.
 * Only the rules of the action being started are applied, so the most
 * recently started action always wins.
 */
@Slf4j
public class CombatActionService implements PulseActionTrigger {

    private final ActorTimerRegistry timers;
    private final AttackRoutine attackRoutine;
    private final CombatPulseScheduler scheduler;
    private final SpellTimingTable spellTimings;
    private final CombatEventPublisher events;
    private final Clock clock;
    @Nullable
    private final CombatAuditService auditService;

    public CombatActionService(ActorTimerRegistry timers,
                               AttackRoutine attackRoutine,
                               CombatPulseScheduler scheduler,
                               SpellTimingTable spellTimings,
                               CombatEventPublisher events,
                               Clock clock,
                               @Nullable CombatAuditService auditService) {
        this.timers = timers;
        this.attackRoutine = attackRoutine;
        this.scheduler = scheduler;
        this.spellTimings = spellTimings;
        this.events = events;
        this.clock = clock;
        this.auditService = auditService;
    }

    // ========================================================================
    // Swing
    // ========================================================================

    /**
     * Starts a swing against {@code defender}.
     *
     * @return the swing timing, or empty when the swing was refused
     */
    public Optional<AttackTiming> beginSwing(CombatActor attacker, CombatActor defender, CombatWeapon weapon) {
        if (!isValid(attacker) || !isValid(defender) || weapon == null) {
            return Optional.empty();
        }
        ActorTimerState state = timers.getOrCreate(attacker);
        Optional<String> blocked = state.blockingReason(ActionCategory.ATTACK);
        if (blocked.isPresent()) {
            refuse(attacker, ActionCategory.ATTACK, blocked.get());
            return Optional.empty();
        }
        if (rules().swingCancelsSpell()) {
            cancelInternal(attacker, state, ActionCategory.CAST, "Weapon swing started");
        }
        AttackTiming timing = attackRoutine.executeAttack(attacker, defender, weapon);
        if (timing == null) {
            // Another swing claimed the actor after the check above
            refuse(attacker, ActionCategory.ATTACK,
                    state.blockingReason(ActionCategory.ATTACK).orElse("swing already starting"));
            return Optional.empty();
        }
        return Optional.of(timing);
    }

    /**
     * Called by the global pulse once the actor's next swing time has elapsed.
     * Marks the swing pending and publishes a {@link ActionPhase#READY} event;
     * game logic answers with {@link #beginSwing}.
     */
    @Override
    public void onActionReady(CombatActor actor) {
        if (!isValid(actor)) {
            return;
        }
        ActorTimerState state = timers.getOrCreate(actor);
        if (state.hasPendingSwing() || !state.canPerform(ActionCategory.ATTACK)) {
            return;
        }
        state.begin(ActionCategory.ATTACK, "pulse");
        publish(actor, ActionCategory.ATTACK, ActionPhase.READY, null, 0L, null);
    }

    // ========================================================================
    // Spell casting
    // ========================================================================

    /**
     * Starts casting a spell.
     *
     * @param skill      caster skill, shortens configured delays
     * @param fromScroll whether the spell is cast from a scroll
     */
    public boolean beginCast(CombatActor caster, String spellName, double skill, boolean fromScroll) {
        if (!isValid(caster)) {
            return false;
        }
        ActorTimerState state = timers.getOrCreate(caster);
        Optional<String> blocked = state.blockingReason(ActionCategory.CAST);
        if (blocked.isPresent()) {
            refuse(caster, ActionCategory.CAST, blocked.get());
            return false;
        }
        if (rules().spellCancelsSwing()) {
            if (state.hasPendingSwing() || scheduler.getPendingCount(caster) > 0) {
                attackRoutine.cancelPendingAttack(caster, "Spell cast started");
            }
        }
        state.begin(ActionCategory.CAST, spellName);
        int castDelay = spellTimings.getCastDelayMs(spellName, skill, fromScroll, 0, 1);
        publish(caster, ActionCategory.CAST, ActionPhase.BEGIN, spellName, castDelay, null);
        return true;
    }

    /**
     * Moves the cast into its delay phase.
     */
    public void enterCastDelay(CombatActor caster, Duration castDelay) {
        if (!isValid(caster)) {
            return;
        }
        ActorTimerState state = timers.getOrCreate(caster);
        state.enterCastDelay();
        state.setCastDelay(castDelay != null ? castDelay : Duration.ZERO);
    }

    /**
     * Completes the cast and, unless post-cast recovery is removed, stamps the
     * next cast time.
     */
    public void completeCast(CombatActor caster, Duration recovery) {
        if (!isValid(caster)) {
            return;
        }
        ActorTimerState state = timers.getOrCreate(caster);
        String spell = state.getInFlight(ActionCategory.CAST).orElse(null);
        if (!rules().removePostCastRecovery() && recovery != null) {
            state.setNextTime(ActionCategory.CAST, recovery);
        }
        state.end(ActionCategory.CAST);
        publish(caster, ActionCategory.CAST, ActionPhase.COMPLETE, spell, 0L, null);
    }

    // ========================================================================
    // Bandage
    // ========================================================================

    public boolean beginBandage(CombatActor healer, @Nullable CombatActor patient) {
        if (!isValid(healer)) {
            return false;
        }
        ActorTimerState state = timers.getOrCreate(healer);
        Optional<String> blocked = state.blockingReason(ActionCategory.HEAL);
        if (blocked.isPresent()) {
            refuse(healer, ActionCategory.HEAL, blocked.get());
            return false;
        }
        if (rules().bandageCancelsActions()) {
            attackRoutine.cancelPendingAttack(healer, "Bandage started");
            cancelInternal(healer, state, ActionCategory.CAST, "Bandage started");
        }
        String patientId = patient != null ? patient.getId() : healer.getId();
        state.begin(ActionCategory.HEAL, patientId);
        publish(healer, ActionCategory.HEAL, ActionPhase.BEGIN, patientId, 0L, null);
        return true;
    }

    /**
     * Completes the bandage and stamps the next heal time.
     */
    public void completeBandage(CombatActor healer, Duration delay) {
        if (!isValid(healer)) {
            return;
        }
        ActorTimerState state = timers.getOrCreate(healer);
        String patient = state.getInFlight(ActionCategory.HEAL).orElse(null);
        long delayMs = delay != null ? delay.toMillis() : 0L;
        state.setNextTime(ActionCategory.HEAL, Duration.ofMillis(delayMs));
        state.end(ActionCategory.HEAL);
        publish(healer, ActionCategory.HEAL, ActionPhase.COMPLETE, patient, delayMs, null);
    }

    // ========================================================================
    // Device (wand) use
    // ========================================================================

    public boolean beginDeviceUse(CombatActor user, String deviceName) {
        if (!isValid(user)) {
            return false;
        }
        ActorTimerState state = timers.getOrCreate(user);
        Optional<String> blocked = state.blockingReason(ActionCategory.DEVICE);
        if (blocked.isPresent()) {
            refuse(user, ActionCategory.DEVICE, blocked.get());
            return false;
        }
        if (rules().deviceCancelsActions()) {
            attackRoutine.cancelPendingAttack(user, "Device use started");
            cancelInternal(user, state, ActionCategory.CAST, "Device use started");
            cancelInternal(user, state, ActionCategory.HEAL, "Device use started");
        }
        state.begin(ActionCategory.DEVICE, deviceName);
        publish(user, ActionCategory.DEVICE, ActionPhase.BEGIN, deviceName, 0L, null);
        return true;
    }

    /**
     * Completes the device use. With instant device use no cooldown is stamped.
     */
    public void completeDeviceUse(CombatActor user, Duration delay) {
        if (!isValid(user)) {
            return;
        }
        ActorTimerState state = timers.getOrCreate(user);
        String device = state.getInFlight(ActionCategory.DEVICE).orElse(null);
        long delayMs = 0L;
        if (!rules().instantDeviceUse() && delay != null) {
            delayMs = delay.toMillis();
            state.setNextTime(ActionCategory.DEVICE, delay);
        }
        state.end(ActionCategory.DEVICE);
        publish(user, ActionCategory.DEVICE, ActionPhase.COMPLETE, device, delayMs, null);
    }

    // ========================================================================
    // Queries and cancellation
    // ========================================================================

    public boolean canPerform(CombatActor actor, ActionCategory category) {
        return isValid(actor) && timers.getOrCreate(actor).canPerform(category);
    }

    /**
     * Cancels the category's in-progress action.
     *
     * @return {@code true} when something was cancelled
     */
    public boolean cancel(CombatActor actor, ActionCategory category, String reason) {
        if (actor == null) {
            return false;
        }
        if (category == ActionCategory.ATTACK) {
            return attackRoutine.cancelPendingAttack(actor, reason);
        }
        return timers.find(actor)
                .map(state -> cancelInternal(actor, state, category, reason))
                .orElse(false);
    }

    /**
     * Forgets everything the engine holds about an actor leaving the world.
     */
    public void onActorRemoved(CombatActor actor) {
        if (actor == null) {
            return;
        }
        scheduler.unregister(actor);
        timers.remove(actor);
        if (auditService != null) {
            auditService.removeActor(actor);
        }
        log.debug("Actor {} removed from combat tracking", actor.getId());
    }

    private boolean cancelInternal(CombatActor actor, ActorTimerState state, ActionCategory category, String reason) {
        String context = state.getInFlight(category).orElse(null);
        if (!state.cancel(category, reason)) {
            return false;
        }
        publish(actor, category, ActionPhase.CANCELLED, context, 0L, reason);
        return true;
    }

    private void refuse(CombatActor actor, ActionCategory category, String reason) {
        log.debug("Actor {} may not start {}: {}", actor.getId(), category, reason);
        publish(actor, category, ActionPhase.CANCELLED, null, 0L, reason);
    }

    private void publish(CombatActor actor, ActionCategory category, ActionPhase phase,
                         @Nullable String context, long expectedDelayMs, @Nullable String reason) {
        events.publish(CombatActionEvent.builder()
                .actor(actor)
                .category(category)
                .phase(phase)
                .context(context)
                .expectedDelayMs(expectedDelayMs)
                .reason(reason)
                .timestamp(clock.millis())
                .build());
    }

    private ActionRules rules() {
        return timers.getRules();
    }

    private static boolean isValid(CombatActor actor) {
        return actor != null && actor.isValid();
    }
}
