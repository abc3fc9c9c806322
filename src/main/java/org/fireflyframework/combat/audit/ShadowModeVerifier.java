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
import org.fireflyframework.combat.metrics.CombatMetrics;
import org.fireflyframework.combat.properties.CombatTimingProperties.ShadowConfig;
import org.fireflyframework.combat.timing.TimingProvider;
import org.fireflyframework.combat.timing.TimingProviderRegistry;
import org.springframework.lang.Nullable;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Runs the reference timing provider next to the active one and records how
 * far apart they are.
 * <p>
 * Comparisons are side observations: they read both providers and never
 * change any scheduled value. A comparison is a discrepancy when its variance
 * exceeds the configured threshold.
 */
@Slf4j
public class ShadowModeVerifier {

    static final String CSV_HEADER = "Timestamp,ActorId,ActorName,WeaponId,WeaponName,Dexterity,"
            + "Provider1,Provider1Delay,Provider2,Provider2Delay,Variance";

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss").withZone(ZoneOffset.UTC);

    private final ShadowConfig config;
    private final TimingProviderRegistry providers;
    @Nullable
    private final CombatAuditService auditService;
    @Nullable
    private final CombatMetrics metrics;
    private final Path outputDirectory;
    private final Clock clock;

    private final Deque<TimingComparison> comparisons = new ArrayDeque<>();
    private final AtomicLong sampleCounter = new AtomicLong();
    private volatile boolean enabled;

    public ShadowModeVerifier(ShadowConfig config, boolean enabled, TimingProviderRegistry providers,
                              @Nullable CombatAuditService auditService, Path outputDirectory,
                              Clock clock, @Nullable CombatMetrics metrics) {
        if (config == null || providers == null || clock == null) {
            throw new IllegalArgumentException("Shadow configuration, providers and clock are required");
        }
        this.config = config;
        this.enabled = enabled;
        this.providers = providers;
        this.auditService = auditService;
        this.outputDirectory = outputDirectory;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Compares both providers for this attack when shadow mode is on and the
     * sample filter admits it.
     */
    public Optional<TimingComparison> compareWeaponTiming(CombatActor attacker, CombatWeapon weapon) {
        if (!enabled || attacker == null || weapon == null) {
            return Optional.empty();
        }
        TimingProvider reference = providers.getReference();
        if (reference == null) {
            return Optional.empty();
        }
        if (sampleCounter.getAndIncrement() % config.getSampleEvery() != 0) {
            return Optional.empty();
        }
        try {
            TimingProvider active = providers.getActive();
            int delay1 = active.getAttackIntervalMs(attacker, weapon);
            int delay2 = reference.getAttackIntervalMs(attacker, weapon);
            int variance = Math.abs(delay1 - delay2);
            boolean discrepancy = variance > config.getDiscrepancyThresholdMs();

            TimingComparison comparison = new TimingComparison(
                    clock.instant(), attacker.getId(), attacker.getName(),
                    weapon.getItemId(), weapon.getName(), attacker.getDexterity(),
                    active.getProviderName(), delay1, reference.getProviderName(), delay2,
                    variance, discrepancy);
            add(comparison);

            if (discrepancy) {
                log.debug("SHADOW_DISCREPANCY: actor={}, weapon={}, {}={}ms, {}={}ms, variance={}ms",
                        attacker.getName(), weapon.getName(), active.getProviderName(), delay1,
                        reference.getProviderName(), delay2, variance);
                if (metrics != null) {
                    metrics.recordShadowDiscrepancy(weapon.getName());
                }
            }
            if (auditService != null) {
                auditService.recordShadowComparison(comparison, attacker);
            }
            return Optional.of(comparison);
        } catch (RuntimeException e) {
            log.error("SHADOW_COMPARISON_FAILED: actor={}, weapon={}", attacker.getId(), weapon.getName(), e);
            return Optional.empty();
        }
    }

    private void add(TimingComparison comparison) {
        synchronized (comparisons) {
            comparisons.addLast(comparison);
            while (comparisons.size() > config.getMaxComparisons()) {
                comparisons.removeFirst();
            }
        }
    }

    // ========================================================================
    // Reporting
    // ========================================================================

    public ShadowModeReport generateReport() {
        return generateReport(null);
    }

    /**
     * Builds a report over the comparisons of the last {@code window}, or over
     * all retained comparisons when {@code window} is null.
     */
    public ShadowModeReport generateReport(@Nullable Duration window) {
        List<TimingComparison> selected = getComparisons(window);
        Instant now = clock.instant();
        if (selected.isEmpty()) {
            return ShadowModeReport.empty(now);
        }

        IntSummaryStatistics stats = selected.stream()
                .mapToInt(TimingComparison::varianceMs)
                .summaryStatistics();
        int discrepancies = (int) selected.stream()
                .filter(c -> c.varianceMs() > config.getDiscrepancyThresholdMs())
                .count();

        Map<String, List<TimingComparison>> byWeapon = selected.stream()
                .collect(Collectors.groupingBy(c -> c.weaponName() != null ? c.weaponName() : "Unknown"));
        List<WeaponComparisonStats> breakdown = byWeapon.entrySet().stream()
                .map(e -> new WeaponComparisonStats(
                        e.getKey(),
                        e.getValue().size(),
                        e.getValue().stream().mapToInt(TimingComparison::varianceMs).average().orElse(0.0),
                        e.getValue().stream().mapToInt(TimingComparison::varianceMs).max().orElse(0)))
                .sorted(Comparator.comparingDouble(WeaponComparisonStats::averageVarianceMs).reversed())
                .toList();

        return new ShadowModeReport(
                selected.size(),
                stats.getMin(),
                stats.getMax(),
                stats.getAverage(),
                discrepancies,
                discrepancies * 100.0 / selected.size(),
                breakdown,
                null,
                now);
    }

    public List<TimingComparison> getComparisons(@Nullable Duration window) {
        Instant cutoff = window != null ? clock.instant().minus(window) : null;
        synchronized (comparisons) {
            List<TimingComparison> result = new ArrayList<>(comparisons.size());
            for (TimingComparison comparison : comparisons) {
                if (cutoff == null || !comparison.timestamp().isBefore(cutoff)) {
                    result.add(comparison);
                }
            }
            return result;
        }
    }

    // ========================================================================
    // Export
    // ========================================================================

    /**
     * Exports all comparisons to a timestamped CSV file in the output directory.
     *
     * @return the written file, or empty when the export failed
     */
    public Optional<Path> exportToCsv() {
        if (outputDirectory == null) {
            log.warn("No output directory configured for shadow mode export");
            return Optional.empty();
        }
        return exportToCsv(outputDirectory.resolve("shadow-comparison-" + FILE_TIMESTAMP.format(clock.instant()) + ".csv"));
    }

    public Optional<Path> exportToCsv(Path file) {
        List<TimingComparison> snapshot = getComparisons(null);
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                out.write(CSV_HEADER);
                out.newLine();
                for (TimingComparison c : snapshot) {
                    out.write(String.join(",",
                            c.timestamp().toString(),
                            csv(c.actorId()),
                            csv(c.actorName()),
                            Integer.toString(c.weaponId()),
                            csv(c.weaponName()),
                            Integer.toString(c.dexterity()),
                            csv(c.provider1Name()),
                            Integer.toString(c.provider1DelayMs()),
                            csv(c.provider2Name()),
                            Integer.toString(c.provider2DelayMs()),
                            Integer.toString(c.varianceMs())));
                    out.newLine();
                }
            }
            log.info("Exported {} shadow comparisons to {}", snapshot.size(), file);
            return Optional.of(file);
        } catch (IOException e) {
            log.error("SHADOW_EXPORT_FAILED: file={}", file, e);
            return Optional.empty();
        }
    }

    private static String csv(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    // ========================================================================
    // Control
    // ========================================================================

    public int clear() {
        synchronized (comparisons) {
            int count = comparisons.size();
            comparisons.clear();
            log.info("Cleared {} shadow comparisons", count);
            return count;
        }
    }

    public int getComparisonCount() {
        synchronized (comparisons) {
            return comparisons.size();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        log.info("Shadow mode {}", enabled ? "enabled" : "disabled");
    }
}
