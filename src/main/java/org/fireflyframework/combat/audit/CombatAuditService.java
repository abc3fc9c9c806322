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

package org.fireflyframework.combat.audit;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;
import org.fireflyframework.combat.event.ActionPhase;
import org.fireflyframework.combat.event.CombatActionEvent;
import org.fireflyframework.combat.event.CombatActionListener;
import org.fireflyframework.combat.metrics.CombatMetrics;
import org.fireflyframework.combat.properties.CombatTimingProperties.AuditConfig;
import org.fireflyframework.combat.scheduler.TickListener;
import org.fireflyframework.combat.state.ActionCategory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Records combat actions into a bounded in-memory buffer and flushes it to
 * daily JSONL files in the background.
 * <p>
 * <b>Buffering:</b> the global buffer holds at most {@code bufferSize} entries
 * and evicts the oldest first. An optional per-actor history is kept weakly
 * keyed by actor. At most {@code maxEntriesPerTick} entries are accepted per
 * tick window, the rest are counted as dropped.
 * <p>
 * <b>Auto-throttle:</b> when a tick takes longer than the threshold the
 * effective level drops to {@link AuditLevel#STANDARD}; it recovers once a
 * tick finishes under 80% of the threshold.
 * <p>
 * <b>Failures:</b> errors while recording are logged and discarded. A failed
 * flush leaves the buffer unchanged for the next attempt.
 */
@Slf4j
public class CombatAuditService implements CombatActionListener, TickListener, DisposableBean {

    static final double THROTTLE_RECOVERY_RATIO = 0.8;
    private static final Duration SHUTDOWN_FLUSH_TIMEOUT = Duration.ofSeconds(10);

    private final AuditConfig config;
    private final AuditLogWriter writer;
    private final Clock clock;
    private final long tickWindowMs;
    @Nullable
    private final CombatMetrics metrics;

    private final Deque<AuditLogEntry> buffer = new ArrayDeque<>();
    private final Map<CombatActor, Deque<AuditLogEntry>> actorHistory =
            Collections.synchronizedMap(new WeakHashMap<>());
    private final Map<CombatActor, Map<ActionCategory, Long>> actionStarts =
            Collections.synchronizedMap(new WeakHashMap<>());

    private final AtomicLong tickWindow = new AtomicLong(-1L);
    private final AtomicInteger entriesInTickWindow = new AtomicInteger();
    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private final AtomicLong recordedCount = new AtomicLong();
    private final AtomicLong flushedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong failedFlushCount = new AtomicLong();

    private volatile boolean throttled;
    private volatile Disposable flushSubscription;

    public CombatAuditService(AuditConfig config, AuditLogWriter writer, Clock clock,
                              Duration tickInterval, @Nullable CombatMetrics metrics) {
        if (config == null || writer == null || clock == null) {
            throw new IllegalArgumentException("Audit configuration, writer and clock are required");
        }
        this.config = config.normalized();
        this.writer = writer;
        this.clock = clock;
        this.tickWindowMs = tickInterval != null && tickInterval.toMillis() > 0 ? tickInterval.toMillis() : 50L;
        this.metrics = metrics;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Starts the periodic background flush. Repeated calls are ignored.
     */
    public synchronized void start() {
        if (!config.isEnabled()) {
            log.info("Combat audit is disabled");
            return;
        }
        if (flushSubscription != null && !flushSubscription.isDisposed()) {
            log.warn("Combat audit flush is already running");
            return;
        }
        log.info("Starting combat audit with level={}, bufferSize={}, flushInterval={}, outputDirectory={}",
                config.getLevel(), config.getBufferSize(), config.getFlushInterval(), writer.getOutputDirectory());

        flushSubscription = Flux.interval(config.getFlushInterval(), config.getFlushInterval())
                .onBackpressureDrop()
                .concatMap(tick -> flush()
                        .onErrorResume(error -> {
                            log.error("Error during audit flush cycle", error);
                            return Mono.empty();
                        }))
                .subscribe();

        Mono.fromRunnable(writer::cleanupExpired)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(error -> {
                    log.error("AUDIT_RETENTION_FAILED", error);
                    return Mono.empty();
                })
                .subscribe();
    }

    public synchronized void stop() {
        if (flushSubscription != null && !flushSubscription.isDisposed()) {
            log.info("Stopping combat audit flush");
            flushSubscription.dispose();
        }
        flushSubscription = null;
    }

    /**
     * Stops the periodic flush and writes what is left in the buffer.
     */
    @Override
    public void destroy() {
        stop();
        try {
            FlushResult result = flush().block(SHUTDOWN_FLUSH_TIMEOUT);
            if (result != null && !result.success()) {
                log.warn("Final audit flush did not complete: {}", result.message());
            }
        } catch (RuntimeException e) {
            log.error("Final audit flush failed, {} entries lost", getBufferedCount(), e);
        }
    }

    // ========================================================================
    // Recording
    // ========================================================================

    @Override
    public void onCombatAction(CombatActionEvent event) {
        try {
            recordEvent(event);
        } catch (RuntimeException e) {
            log.error("AUDIT_RECORD_FAILED: category={}, phase={}",
                    event != null ? event.category() : null, event != null ? event.phase() : null, e);
        }
    }

    private void recordEvent(CombatActionEvent event) {
        if (event == null || event.actor() == null || event.category() == null
                || event.phase() == null || event.phase() == ActionPhase.READY) {
            return;
        }
        CombatActor actor = event.actor();
        Long actual = event.actualDelayMs();
        if (event.phase() == ActionPhase.BEGIN) {
            startsOf(actor).put(event.category(), event.timestamp());
        } else if (actual == null && event.phase() == ActionPhase.COMPLETE) {
            Long startedAt = startsOf(actor).remove(event.category());
            if (startedAt != null) {
                actual = event.timestamp() - startedAt;
            }
        }

        AuditLevel required = requiredLevel(event.category());
        if (!shouldRecord(required)) {
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>(event.details());
        if (event.context() != null) {
            details.put("context", event.context());
        }
        if (event.target() != null) {
            details.put("targetId", event.target().getId());
        }
        if (event.reason() != null) {
            details.put("reason", event.reason());
        }

        CombatWeapon weapon = event.weapon();
        AuditLogEntry entry = AuditLogEntry.builder()
                .timestamp(Instant.ofEpochMilli(event.timestamp()))
                .actorId(actor.getId())
                .actorName(actor.getName())
                .actionType(actionType(event.category(), event.phase()))
                .timingProvider(event.providerName())
                .expectedDelayMs(event.expectedDelayMs())
                .actualDelayMs(actual)
                .varianceMs(actual != null ? actual - event.expectedDelayMs() : 0L)
                .weaponId(weapon != null ? weapon.getItemId() : 0)
                .weaponName(weapon != null ? weapon.getName() : null)
                .dexterity(actor.getDexterity())
                .details(details)
                .level(required)
                .build();
        record(entry, actor);
    }

    /**
     * Records a shadow comparison at {@link AuditLevel#DEBUG}.
     */
    public void recordShadowComparison(TimingComparison comparison, @Nullable CombatActor actor) {
        if (comparison == null || !shouldRecord(AuditLevel.DEBUG)) {
            return;
        }
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("provider1", comparison.provider1Name());
            details.put("provider2", comparison.provider2Name());
            details.put("discrepancy", comparison.discrepancy());
            record(AuditLogEntry.builder()
                    .timestamp(comparison.timestamp())
                    .actorId(comparison.actorId())
                    .actorName(comparison.actorName())
                    .actionType(CombatActionTypes.SHADOW_COMPARISON)
                    .timingProvider(comparison.provider1Name())
                    .expectedDelayMs(comparison.provider1DelayMs())
                    .actualDelayMs((long) comparison.provider2DelayMs())
                    .varianceMs(comparison.varianceMs())
                    .weaponId(comparison.weaponId())
                    .weaponName(comparison.weaponName())
                    .dexterity(comparison.dexterity())
                    .details(details)
                    .level(AuditLevel.DEBUG)
                    .build(), actor);
        } catch (RuntimeException e) {
            log.error("AUDIT_RECORD_FAILED: shadow comparison for {}", comparison.actorId(), e);
        }
    }

    /**
     * Appends an entry to the buffer and, when enabled, to the actor's history.
     *
     * @return {@code false} when auditing is disabled or the per-tick cap was reached
     */
    public boolean record(AuditLogEntry entry, @Nullable CombatActor actor) {
        if (!config.isEnabled() || entry == null) {
            return false;
        }
        if (!admitInTickWindow()) {
            droppedCount.incrementAndGet();
            if (metrics != null) {
                metrics.recordAuditDropped();
            }
            return false;
        }

        synchronized (buffer) {
            buffer.addLast(entry);
            while (buffer.size() > config.getBufferSize()) {
                buffer.removeFirst();
            }
        }
        recordedCount.incrementAndGet();

        if (config.isActorHistoryEnabled() && actor != null) {
            Deque<AuditLogEntry> history = actorHistory.computeIfAbsent(actor, a -> new ArrayDeque<>());
            synchronized (history) {
                history.addLast(entry);
                while (history.size() > config.getActorHistorySize()) {
                    history.removeFirst();
                }
            }
        }

        if (getEffectiveLevel().includes(AuditLevel.DETAILED) && entry.isAnomaly(config.getAnomalyThresholdMs())) {
            log.warn("AUDIT_ANOMALY: actor={}, action={}, expected={}ms, actual={}ms, variance={}ms",
                    entry.actorName(), entry.actionType(), entry.expectedDelayMs(),
                    entry.actualDelayMs(), entry.varianceMs());
        }
        return true;
    }

    private boolean admitInTickWindow() {
        long window = clock.millis() / tickWindowMs;
        long current = tickWindow.get();
        if (current != window && tickWindow.compareAndSet(current, window)) {
            entriesInTickWindow.set(0);
        }
        return entriesInTickWindow.incrementAndGet() <= config.getMaxEntriesPerTick();
    }

    public boolean shouldRecord(AuditLevel required) {
        return config.isEnabled() && getEffectiveLevel().includes(required);
    }

    private Map<ActionCategory, Long> startsOf(CombatActor actor) {
        return actionStarts.computeIfAbsent(actor,
                a -> Collections.synchronizedMap(new EnumMap<>(ActionCategory.class)));
    }

    static AuditLevel requiredLevel(ActionCategory category) {
        return switch (category) {
            case ATTACK, CAST -> AuditLevel.STANDARD;
            case HEAL, DEVICE -> AuditLevel.DETAILED;
        };
    }

    static String actionType(ActionCategory category, ActionPhase phase) {
        return switch (category) {
            case ATTACK -> switch (phase) {
                case BEGIN -> CombatActionTypes.SWING_START;
                case COMPLETE -> CombatActionTypes.HIT_RESOLUTION;
                case CANCELLED -> CombatActionTypes.SWING_CANCELLED;
                default -> throw new IllegalArgumentException("Unsupported phase " + phase);
            };
            case CAST -> switch (phase) {
                case BEGIN -> CombatActionTypes.SPELL_CAST_START;
                case COMPLETE -> CombatActionTypes.SPELL_CAST_COMPLETE;
                case CANCELLED -> CombatActionTypes.SPELL_CAST_CANCELLED;
                default -> throw new IllegalArgumentException("Unsupported phase " + phase);
            };
            case HEAL -> switch (phase) {
                case BEGIN -> CombatActionTypes.BANDAGE_START;
                case COMPLETE -> CombatActionTypes.BANDAGE_COMPLETE;
                case CANCELLED -> CombatActionTypes.BANDAGE_CANCELLED;
                default -> throw new IllegalArgumentException("Unsupported phase " + phase);
            };
            case DEVICE -> switch (phase) {
                case BEGIN -> CombatActionTypes.WAND_START;
                case COMPLETE -> CombatActionTypes.WAND_COMPLETE;
                case CANCELLED -> CombatActionTypes.WAND_CANCELLED;
                default -> throw new IllegalArgumentException("Unsupported phase " + phase);
            };
        };
    }

    // ========================================================================
    // Auto-throttle
    // ========================================================================

    @Override
    public void onTickCompleted(double durationMs, int activeParticipants) {
        int threshold = config.getAutoThrottleThresholdMs();
        if (threshold <= 0) {
            return;
        }
        if (!throttled && durationMs > threshold) {
            throttled = true;
            log.warn("AUDIT_THROTTLE_ON: tick={}ms exceeds {}ms, audit level reduced to STANDARD",
                    String.format("%.2f", durationMs), threshold);
            recordThrottleChange(durationMs, activeParticipants);
        } else if (throttled && durationMs < threshold * THROTTLE_RECOVERY_RATIO) {
            throttled = false;
            log.info("AUDIT_THROTTLE_OFF: tick={}ms, audit level restored to {}",
                    String.format("%.2f", durationMs), config.getLevel());
            recordThrottleChange(durationMs, activeParticipants);
        }
    }

    private void recordThrottleChange(double durationMs, int activeParticipants) {
        if (!shouldRecord(AuditLevel.STANDARD)) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("throttled", throttled);
        details.put("tickMs", durationMs);
        details.put("activeParticipants", activeParticipants);
        record(AuditLogEntry.builder()
                .timestamp(clock.instant())
                .actorId("system")
                .actorName("CombatPulse")
                .actionType(CombatActionTypes.PERFORMANCE_METRIC)
                .details(details)
                .level(AuditLevel.STANDARD)
                .build(), null);
    }

    public boolean isThrottled() {
        return throttled;
    }

    public AuditLevel getEffectiveLevel() {
        AuditLevel level = config.getLevel();
        if (throttled && level.compareTo(AuditLevel.STANDARD) > 0) {
            return AuditLevel.STANDARD;
        }
        return level;
    }

    // ========================================================================
    // Flush
    // ========================================================================

    /**
     * Writes the current buffer to the daily file and removes exactly the
     * written entries. Runs on a bounded-elastic worker.
     */
    public Mono<FlushResult> flush() {
        return Mono.defer(() -> {
            if (!flushing.compareAndSet(false, true)) {
                return Mono.just(FlushResult.skipped("Flush already in progress", clock.instant()));
            }
            List<AuditLogEntry> batch = getBufferSnapshot();
            if (batch.isEmpty()) {
                flushing.set(false);
                return Mono.just(FlushResult.nothingToFlush(clock.instant()));
            }
            return writer.write(batch)
                    .map(path -> {
                        removeFlushed(batch);
                        flushedCount.addAndGet(batch.size());
                        if (metrics != null) {
                            metrics.recordAuditFlush(batch.size(), true);
                        }
                        log.debug("Flushed {} audit entries to {}", batch.size(), path);
                        return FlushResult.written(batch.size(), path.toString(), clock.instant());
                    })
                    .onErrorResume(error -> {
                        failedFlushCount.incrementAndGet();
                        if (metrics != null) {
                            metrics.recordAuditFlush(batch.size(), false);
                        }
                        log.error("AUDIT_FLUSH_FAILED: entries={}, buffer retained, error={}",
                                batch.size(), error.getMessage());
                        return Mono.just(FlushResult.failed(error.getMessage(), clock.instant()));
                    })
                    .doFinally(signal -> flushing.set(false));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void removeFlushed(List<AuditLogEntry> batch) {
        Set<AuditLogEntry> written = Collections.newSetFromMap(new IdentityHashMap<>());
        written.addAll(batch);
        synchronized (buffer) {
            while (!buffer.isEmpty() && written.contains(buffer.peekFirst())) {
                buffer.removeFirst();
            }
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public List<AuditLogEntry> getBufferSnapshot() {
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    public int getBufferedCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /**
     * Entries of one actor, oldest first, optionally limited to the last {@code window}.
     */
    public List<AuditLogEntry> getActorHistory(CombatActor actor, @Nullable Duration window) {
        if (actor == null) {
            return List.of();
        }
        Deque<AuditLogEntry> history = actorHistory.get(actor);
        return history == null ? List.of() : filterWindow(history, window);
    }

    public List<AuditLogEntry> getActorHistory(String actorId, @Nullable Duration window) {
        if (actorId == null) {
            return List.of();
        }
        List<Deque<AuditLogEntry>> matches = new ArrayList<>();
        synchronized (actorHistory) {
            actorHistory.forEach((actor, history) -> {
                if (actorId.equals(actor.getId())) {
                    matches.add(history);
                }
            });
        }
        List<AuditLogEntry> result = new ArrayList<>();
        for (Deque<AuditLogEntry> history : matches) {
            result.addAll(filterWindow(history, window));
        }
        return result;
    }

    private List<AuditLogEntry> filterWindow(Deque<AuditLogEntry> history, @Nullable Duration window) {
        Instant cutoff = window != null ? clock.instant().minus(window) : null;
        synchronized (history) {
            List<AuditLogEntry> result = new ArrayList<>(history.size());
            for (AuditLogEntry entry : history) {
                if (cutoff == null || !entry.timestamp().isBefore(cutoff)) {
                    result.add(entry);
                }
            }
            return result;
        }
    }

    /**
     * Discards all buffered entries without writing them.
     *
     * @return number of entries discarded
     */
    public int clear() {
        synchronized (buffer) {
            int count = buffer.size();
            buffer.clear();
            log.info("Cleared {} buffered audit entries", count);
            return count;
        }
    }

    public void removeActor(CombatActor actor) {
        if (actor != null) {
            actorHistory.remove(actor);
            actionStarts.remove(actor);
        }
    }

    public AuditStatistics getStatistics() {
        return new AuditStatistics(
                getBufferedCount(),
                config.getBufferSize(),
                recordedCount.get(),
                flushedCount.get(),
                droppedCount.get(),
                failedFlushCount.get(),
                throttled,
                config.getLevel(),
                getEffectiveLevel());
    }

    public AuditConfig getConfig() {
        return config;
    }
}
