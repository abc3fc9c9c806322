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

package org.fireflyframework.combat.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;
import org.fireflyframework.combat.properties.CombatTimingProperties.PulseConfig;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global tick loop of the combat engine.
 * <p>
 * A single {@link Flux#interval} callback advances every active participant:
 * due resolutions are handed to the {@link ResolutionHandler} in scheduling
 * order, elapsed participants are offered to the {@link PulseActionTrigger},
 * and idle or invalid participants are dropped.
 * <p>
 * <b>Concurrency:</b> registration and scheduling may be called from any
 * thread. Participants live in a {@link ConcurrentHashMap} keyed by actor id;
 * removals found during a tick are applied after the iteration and re-checked
 * under the map's per-key lock, so a participant refreshed or given new work
 * while the tick ran is kept. No lock is held while calling into game logic.
 * <p>
 * <b>Startup:</b> {@link #start()} probes the {@link TimerSubsystemProbe} with
 * exponential backoff and installs the tick once the probe reports ready.
 * Repeated calls while starting or running are ignored.
 *
 * @see TickPerformanceWindow
 */
@Slf4j
public class CombatPulseScheduler implements DisposableBean {

    private final Map<String, ActiveParticipant> participants = new ConcurrentHashMap<>();
    private final List<TickListener> tickListeners = new CopyOnWriteArrayList<>();

    private final PulseConfig config;
    private final Clock clock;
    private final TimerSubsystemProbe probe;
    private final TickPerformanceWindow performance;
    private final double slowTickThresholdMs;

    private volatile ResolutionHandler resolutionHandler;
    private volatile PulseActionTrigger pulseActionTrigger;

    private volatile Disposable startupSubscription;
    private volatile Disposable tickSubscription;
    private volatile Scheduler tickScheduler;
    private long lifecycleGeneration;

    public CombatPulseScheduler(PulseConfig config, Clock clock, TimerSubsystemProbe probe) {
        if (config == null || clock == null) {
            throw new IllegalArgumentException("Pulse configuration and clock must not be null");
        }
        this.config = config;
        this.clock = clock;
        this.probe = probe != null ? probe : TimerSubsystemProbe.ALWAYS_READY;
        this.performance = new TickPerformanceWindow(config.getPerformanceWindow());
        this.slowTickThresholdMs = config.getSlowTickThreshold().toNanos() / 1_000_000.0;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Probes the timer subsystem and installs the periodic tick once it is ready.
     * Has no effect while a previous start is in progress or the tick is running.
     */
    public synchronized void start() {
        if (isRunning()) {
            log.warn("Combat pulse is already running");
            return;
        }
        if (startupSubscription != null && !startupSubscription.isDisposed()) {
            log.debug("Combat pulse startup already in progress");
            return;
        }

        long generation = lifecycleGeneration;
        log.info("Starting combat pulse with tickInterval={}, idleTimeout={}, globalPulse={}",
                config.getTickInterval(), config.getIdleTimeout(), config.isGlobalPulse());

        startupSubscription = Mono.fromCallable(probe::isReady)
                .flatMap(ready -> ready
                        ? Mono.just(Boolean.TRUE)
                        : Mono.<Boolean>error(new IllegalStateException("Timer subsystem not ready")))
                .retryWhen(Retry.backoff(config.getStartup().getMaxAttempts(), config.getStartup().getFirstBackoff())
                        .maxBackoff(config.getStartup().getMaxBackoff())
                        .doBeforeRetry(signal -> log.debug("PULSE_STARTUP_RETRY: attempt={}, cause={}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ready -> installTick(generation),
                        error -> log.error("PULSE_STARTUP_FAILED: timer subsystem never became ready", error));
    }

    private synchronized void installTick(long generation) {
        if (generation != lifecycleGeneration) {
            log.debug("Combat pulse was stopped during startup, not installing the tick");
            return;
        }
        if (isRunning()) {
            return;
        }
        tickScheduler = Schedulers.newSingle("combat-pulse", true);
        tickSubscription = Flux.interval(config.getTickInterval(), tickScheduler)
                .onBackpressureDrop(dropped -> log.debug("Tick {} dropped, previous tick still running", dropped))
                .subscribe(
                        tick -> tick(),
                        error -> log.error("PULSE_LOOP_TERMINATED: tick loop stopped unexpectedly", error));
        log.info("Combat pulse installed, ticking every {}", config.getTickInterval());
    }

    /**
     * Stops probing and ticking. Safe to call repeatedly or before {@link #start()}.
     */
    public synchronized void stop() {
        lifecycleGeneration++;
        if (startupSubscription != null && !startupSubscription.isDisposed()) {
            startupSubscription.dispose();
        }
        startupSubscription = null;
        if (tickSubscription != null && !tickSubscription.isDisposed()) {
            log.info("Stopping combat pulse");
            tickSubscription.dispose();
        }
        tickSubscription = null;
        if (tickScheduler != null) {
            tickScheduler.dispose();
            tickScheduler = null;
        }
    }

    /**
     * Stops the tick and forgets every participant.
     */
    public void shutdown() {
        stop();
        participants.clear();
        log.info("Combat pulse shut down");
    }

    public boolean isRunning() {
        Disposable subscription = tickSubscription;
        return subscription != null && !subscription.isDisposed();
    }

    @Override
    public void destroy() {
        shutdown();
    }

    // ========================================================================
    // Tick
    // ========================================================================

    /**
     * Advances all participants once. Called by the periodic callback and
     * directly by tests.
     */
    public void tick() {
        long startNanos = System.nanoTime();
        long now = clock.millis();
        try {
            processParticipants(now);
        } catch (RuntimeException e) {
            log.error("PULSE_TICK_FAILED: unexpected error during tick", e);
        } finally {
            double durationMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            performance.record(durationMs);
            if (durationMs > slowTickThresholdMs) {
                log.warn("PULSE_SLOW_TICK: duration={}ms, threshold={}ms, participants={}",
                        String.format("%.2f", durationMs), slowTickThresholdMs, participants.size());
            }
            notifyTickListeners(durationMs);
        }
    }

    private void processParticipants(long now) {
        List<ActiveParticipant> invalid = new ArrayList<>();
        List<ActiveParticipant> idle = new ArrayList<>();
        long idleCutoff = now - config.getIdleTimeout().toMillis();

        for (ActiveParticipant participant : participants.values()) {
            CombatActor actor = participant.getActor();
            if (actor == null || !actor.isValid()) {
                invalid.add(participant);
                continue;
            }

            processDueResolutions(actor, participant, now);

            if (config.isGlobalPulse() && participant.getNextActionTime() > 0
                    && participant.getNextActionTime() <= now) {
                triggerNextAction(actor);
            }

            if (participant.getLastActivity() < idleCutoff) {
                idle.add(participant);
            }
        }

        for (ActiveParticipant participant : invalid) {
            if (participants.remove(participant.getActorId(), participant)) {
                int dropped = participant.clearPending();
                log.debug("Removed invalid participant {} (pending dropped={})", participant.getActorId(), dropped);
            }
        }
        // Activity may have been refreshed since the iteration saw it
        for (ActiveParticipant participant : idle) {
            participants.computeIfPresent(participant.getActorId(), (id, current) -> {
                if (current != participant || current.getLastActivity() >= idleCutoff) {
                    return current;
                }
                int dropped = current.clearPending();
                log.debug("Removed idle participant {} (pending dropped={})", id, dropped);
                return null;
            });
        }
    }

    private void processDueResolutions(CombatActor attacker, ActiveParticipant participant, long now) {
        List<PendingResolution> due = participant.drainDue(now);
        if (due.isEmpty()) {
            return;
        }
        ResolutionHandler handler = resolutionHandler;
        for (PendingResolution resolution : due) {
            CombatActor target = resolution.target();
            if (target == null || !target.isValid()) {
                log.debug("Skipping resolution for {}: target no longer valid", participant.getActorId());
                continue;
            }
            if (handler == null) {
                log.warn("No resolution handler registered, dropping resolution for {}", participant.getActorId());
                continue;
            }
            try {
                handler.resolve(attacker, resolution);
            } catch (RuntimeException e) {
                log.error("PULSE_RESOLUTION_FAILED: attacker={}, target={}",
                        participant.getActorId(), target.getId(), e);
            }
        }
    }

    private void triggerNextAction(CombatActor actor) {
        PulseActionTrigger trigger = pulseActionTrigger;
        if (trigger == null) {
            return;
        }
        try {
            trigger.onActionReady(actor);
        } catch (RuntimeException e) {
            log.error("PULSE_TRIGGER_FAILED: actor={}", actor.getId(), e);
        }
    }

    private void notifyTickListeners(double durationMs) {
        int active = participants.size();
        for (TickListener listener : tickListeners) {
            try {
                listener.onTickCompleted(durationMs, active);
            } catch (RuntimeException e) {
                log.error("Tick listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    // ========================================================================
    // Registration
    // ========================================================================

    /**
     * Registers an actor as an active participant, or refreshes the activity of
     * an existing one. Idempotent per actor id.
     *
     * @return {@code false} for a null or invalid actor
     */
    public boolean register(CombatActor actor) {
        if (actor == null || !actor.isValid()) {
            return false;
        }
        long now = clock.millis();
        participants.compute(actor.getId(), (id, existing) -> {
            if (existing != null && existing.getActor() == actor) {
                existing.touch(now);
                return existing;
            }
            log.debug("Registered combat participant {}", id);
            return new ActiveParticipant(actor, now);
        });
        return true;
    }

    public boolean unregister(CombatActor actor) {
        if (actor == null) {
            return false;
        }
        ActiveParticipant removed = participants.remove(actor.getId());
        if (removed != null) {
            removed.clearPending();
            log.debug("Unregistered combat participant {}", actor.getId());
            return true;
        }
        return false;
    }

    public boolean isActive(CombatActor actor) {
        return actor != null && participants.containsKey(actor.getId());
    }

    public void updateActivity(CombatActor actor) {
        ActiveParticipant participant = find(actor);
        if (participant != null) {
            participant.touch(clock.millis());
        }
    }

    public void updateNextActionTime(CombatActor actor, long nextActionTime) {
        ActiveParticipant participant = find(actor);
        if (participant != null) {
            participant.setNextActionTime(nextActionTime);
        }
    }

    /**
     * Schedules a resolution {@code hitOffsetMs} after now.
     *
     * @return the scheduled resolution, or {@code null} when either party is
     *         invalid or the attacker is not registered
     */
    public PendingResolution scheduleResolution(CombatActor attacker, CombatActor target,
                                                CombatWeapon weapon, long hitOffsetMs) {
        return scheduleResolution(attacker, target, weapon, clock.millis(), hitOffsetMs);
    }

    /**
     * Schedules a resolution {@code hitOffsetMs} after {@code scheduledAt}.
     * Negative offsets are treated as zero.
     */
    public PendingResolution scheduleResolution(CombatActor attacker, CombatActor target,
                                                CombatWeapon weapon, long scheduledAt, long hitOffsetMs) {
        return scheduleResolution(attacker, target, weapon, scheduledAt, hitOffsetMs, null);
    }

    /**
     * Schedules a resolution {@code hitOffsetMs} after {@code scheduledAt},
     * remembering the timing provider that produced the offset.
     */
    public PendingResolution scheduleResolution(CombatActor attacker, CombatActor target, CombatWeapon weapon,
                                                long scheduledAt, long hitOffsetMs, String providerName) {
        if (attacker == null || target == null || !attacker.isValid() || !target.isValid()) {
            return null;
        }
        long offset = Math.max(0L, hitOffsetMs);
        PendingResolution resolution = new PendingResolution(target, weapon, scheduledAt, scheduledAt + offset,
                offset, providerName);
        AtomicBoolean added = new AtomicBoolean();
        participants.computeIfPresent(attacker.getId(), (id, current) -> {
            if (current.getActor() == attacker) {
                current.addPending(resolution);
                added.set(true);
            }
            return current;
        });
        if (!added.get()) {
            log.debug("Cannot schedule resolution for unregistered actor {}", attacker.getId());
            return null;
        }
        return resolution;
    }

    /**
     * Drops every pending resolution of the actor.
     *
     * @return number of resolutions dropped
     */
    public int cancelPendingResolutions(CombatActor actor) {
        ActiveParticipant participant = find(actor);
        return participant != null ? participant.clearPending() : 0;
    }

    public int getPendingCount(CombatActor actor) {
        ActiveParticipant participant = find(actor);
        return participant != null ? participant.getPendingCount() : 0;
    }

    public int getActiveParticipantCount() {
        return participants.size();
    }

    public ActiveParticipant getParticipant(CombatActor actor) {
        return find(actor);
    }

    private ActiveParticipant find(CombatActor actor) {
        if (actor == null) {
            return null;
        }
        ActiveParticipant participant = participants.get(actor.getId());
        return participant != null && participant.getActor() == actor ? participant : null;
    }

    // ========================================================================
    // Collaborators and statistics
    // ========================================================================

    public void setResolutionHandler(ResolutionHandler resolutionHandler) {
        this.resolutionHandler = resolutionHandler;
    }

    public void setPulseActionTrigger(PulseActionTrigger pulseActionTrigger) {
        this.pulseActionTrigger = pulseActionTrigger;
    }

    public void addTickListener(TickListener listener) {
        if (listener != null) {
            tickListeners.add(listener);
        }
    }

    public void removeTickListener(TickListener listener) {
        tickListeners.remove(listener);
    }

    public PulsePerformance getPerformance() {
        return performance.snapshot();
    }

    public void resetPerformance() {
        performance.reset();
    }

    public PulseConfig getConfig() {
        return config;
    }
}
