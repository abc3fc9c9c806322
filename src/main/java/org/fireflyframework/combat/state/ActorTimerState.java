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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.actor.CombatActor;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Timer and busy state of one actor.
 * <p>
 * Each category moves Idle, Busy, then back to Idle. Casting has an extra
 * cast-delay phase between the cast and its completion. Swings are fire and
 * forget: stamping the next attack time returns the swing to Idle.
 * <p>
 * Instances are thread-safe. All mutation goes through the methods below.
 */
@Slf4j
public class ActorTimerState {

    private final String actorId;
    private final String actorName;
    private final TimerMode mode;
    private final TimerStore timers;
    private final ActionRules rules;
    private final Clock clock;
    private final boolean logCancellations;
    private final boolean logTimerChanges;

    private final Map<ActionCategory, String> inFlight = new EnumMap<>(ActionCategory.class);
    private boolean pendingSwing;
    private boolean swingStarting;
    private boolean casting;
    private boolean inCastDelay;
    private boolean bandaging;
    private boolean usingDevice;
    private long castDelayEndTime;

    public ActorTimerState(CombatActor actor, TimerMode mode, ActionRules rules, Clock clock,
                           boolean logCancellations, boolean logTimerChanges) {
        if (actor == null) {
            throw new IllegalArgumentException("Actor must not be null");
        }
        this.actorId = actor.getId();
        this.actorName = actor.getName();
        this.mode = mode;
        this.timers = mode.createStore(actor);
        this.rules = rules;
        this.clock = clock;
        this.logCancellations = logCancellations;
        this.logTimerChanges = logTimerChanges;
    }

    // ========================================================================
    // Transitions
    // ========================================================================

    /**
     * Marks the category busy and records what is in flight.
     */
    public synchronized void begin(ActionCategory category, String context) {
        switch (category) {
            case ATTACK -> pendingSwing = true;
            case CAST -> {
                casting = true;
                inCastDelay = false;
            }
            case HEAL -> bandaging = true;
            case DEVICE -> usingDevice = true;
        }
        if (context != null) {
            inFlight.put(category, context);
        } else {
            inFlight.remove(category);
        }
        log.debug("Actor {} began {} ({})", actorId, category, context);
    }

    /**
     * Checks that a swing may start and claims it in the same step. The claim
     * holds until the next attack time is stamped or the swing is cancelled,
     * and any other swing attempted meanwhile is refused.
     *
     * @return the refusal reason, or empty when the swing was claimed
     */
    public synchronized Optional<String> tryBeginSwing(String context) {
        Optional<String> blocked = blockingReason(ActionCategory.ATTACK);
        if (blocked.isPresent()) {
            return blocked;
        }
        swingStarting = true;
        begin(ActionCategory.ATTACK, context);
        return Optional.empty();
    }

    /**
     * Stamps the next eligible time to now plus {@code delay}.
     */
    public void setNextTime(ActionCategory category, Duration delay) {
        setNextTimeAt(category, clock.millis() + Math.max(0L, delay.toMillis()));
    }

    /**
     * Stamps an absolute next eligible time. Clears the pending swing when the
     * category is {@link ActionCategory#ATTACK}.
     */
    public synchronized void setNextTimeAt(ActionCategory category, long epochMillis) {
        timers.setNextTime(category, epochMillis);
        if (category == ActionCategory.ATTACK) {
            pendingSwing = false;
            swingStarting = false;
            inFlight.remove(ActionCategory.ATTACK);
        }
        if (logTimerChanges) {
            log.info("TIMER_STATE_CHANGE: actor={}, category={}, nextTime={}", actorName, category, epochMillis);
        }
    }

    /**
     * Moves from casting to the cast-delay phase.
     */
    public synchronized void enterCastDelay() {
        casting = false;
        inCastDelay = true;
        log.debug("Actor {} entered cast delay", actorId);
    }

    /**
     * Sets when the cast-delay phase ends, independent of the spell recovery timer.
     */
    public synchronized void setCastDelay(Duration delay) {
        castDelayEndTime = clock.millis() + Math.max(0L, delay.toMillis());
        log.debug("Actor {} cast delay set to {}ms", actorId, delay.toMillis());
    }

    /**
     * Completes the category's action and returns it to Idle without logging.
     */
    public synchronized void end(ActionCategory category) {
        clearBusy(category);
        log.debug("Actor {} ended {}", actorId, category);
    }

    /**
     * Returns the category to Idle.
     *
     * @return {@code true} when something was in progress
     */
    public synchronized boolean cancel(ActionCategory category, String reason) {
        if (!isBusyIn(category)) {
            return false;
        }
        String context = inFlight.get(category);
        clearBusy(category);
        if (logCancellations) {
            log.info("ACTION_CANCELLED: actor={}, category={}, context={}, reason={}",
                    actorName, category, context, reason != null ? reason : "Cancelled");
        }
        return true;
    }

    public synchronized void clearAll() {
        for (ActionCategory category : ActionCategory.values()) {
            clearBusy(category);
        }
        castDelayEndTime = 0L;
        timers.clear();
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public boolean canPerform(ActionCategory category) {
        return blockingReason(category).isEmpty();
    }

    /**
     * Why the category may not act now, or empty when it may.
     */
    public synchronized Optional<String> blockingReason(ActionCategory category) {
        long now = clock.millis();
        if (timers.getNextTime(category) > now) {
            return Optional.of(category + " timer not elapsed");
        }
        switch (category) {
            case ATTACK -> {
                if (swingStarting) {
                    return Optional.of("swing already starting");
                }
                if (rules.disableSwingDuringCast() && casting) {
                    return Optional.of("casting");
                }
                if (rules.disableSwingDuringCastDelay() && isCastDelayActive(now)) {
                    return Optional.of("in cast delay");
                }
            }
            case CAST -> {
                if (casting || inCastDelay) {
                    return Optional.of("already casting");
                }
            }
            case HEAL -> {
                if (bandaging) {
                    return Optional.of("already bandaging");
                }
            }
            case DEVICE -> {
                if (usingDevice) {
                    return Optional.of("already using a device");
                }
            }
        }
        return Optional.empty();
    }

    public synchronized long getNextTime(ActionCategory category) {
        return timers.getNextTime(category);
    }

    public synchronized long getRemainingDelayMs(ActionCategory category) {
        return Math.max(0L, timers.getNextTime(category) - clock.millis());
    }

    public synchronized long getRemainingCastDelayMs() {
        return Math.max(0L, castDelayEndTime - clock.millis());
    }

    public synchronized boolean hasPendingSwing() {
        return pendingSwing;
    }

    public synchronized boolean isCasting() {
        return casting;
    }

    public synchronized boolean isInCastDelay() {
        return inCastDelay;
    }

    public synchronized boolean isBandaging() {
        return bandaging;
    }

    public synchronized boolean isUsingDevice() {
        return usingDevice;
    }

    public synchronized boolean isBusy() {
        return casting || inCastDelay || bandaging || usingDevice;
    }

    public synchronized Optional<String> getInFlight(ActionCategory category) {
        return Optional.ofNullable(inFlight.get(category));
    }

    public String getActorId() {
        return actorId;
    }

    public TimerMode getMode() {
        return mode;
    }

    public synchronized String describe() {
        return "cast=" + casting + ", delay=" + inCastDelay + ", bandage=" + bandaging
                + ", device=" + usingDevice + ", swing=" + pendingSwing;
    }

    private boolean isBusyIn(ActionCategory category) {
        return switch (category) {
            case ATTACK -> pendingSwing;
            case CAST -> casting || inCastDelay;
            case HEAL -> bandaging;
            case DEVICE -> usingDevice;
        };
    }

    private void clearBusy(ActionCategory category) {
        switch (category) {
            case ATTACK -> {
                pendingSwing = false;
                swingStarting = false;
            }
            case CAST -> {
                casting = false;
                inCastDelay = false;
            }
            case HEAL -> bandaging = false;
            case DEVICE -> usingDevice = false;
        }
        inFlight.remove(category);
    }

    private boolean isCastDelayActive(long now) {
        return inCastDelay && (castDelayEndTime == 0L || castDelayEndTime > now);
    }
}
