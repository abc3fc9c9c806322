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

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;
import org.fireflyframework.combat.actor.WeaponAnimation;
import org.fireflyframework.combat.actor.WeaponType;
import org.fireflyframework.combat.metrics.CombatMetrics;
import org.fireflyframework.combat.properties.CombatTimingProperties.ShadowConfig;
import org.fireflyframework.combat.support.MutableClock;
import org.fireflyframework.combat.support.TestActor;
import org.fireflyframework.combat.support.TestWeapon;
import org.fireflyframework.combat.timing.TimingProvider;
import org.fireflyframework.combat.timing.TimingProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ShadowModeVerifier}.
 * <p>
 * Tests cover comparisons between the active and reference providers,
 * sampling, the bounded history, report aggregation and CSV export.
 */
class ShadowModeVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ShadowConfig config;
    private TimingProviderRegistry providers;
    private TestActor actor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(NOW);
        config = new ShadowConfig();
        providers = new TimingProviderRegistry(new ItemIdProvider(), new FixedProvider("Reference", 1000));
        actor = TestActor.player("hero", 100);
    }

    private ShadowModeVerifier newVerifier(boolean enabled) {
        return new ShadowModeVerifier(config, enabled, providers, null, tempDir, clock, null);
    }

    private static TestWeapon weapon(int itemId, String name) {
        return new TestWeapon(itemId, name, WeaponAnimation.SLASH_1H, WeaponType.SLASHING, 2.0);
    }

    // ========================================================================
    // Comparison Tests
    // ========================================================================

    @Nested
    @DisplayName("compareWeaponTiming")
    class ComparisonTests {

        @Test
        @DisplayName("should record variance and flag discrepancies above the threshold")
        void shouldCompareProviders() {
            ShadowModeVerifier verifier = newVerifier(true);

            TimingComparison close = verifier.compareWeaponTiming(actor, weapon(1010, "Sword")).orElseThrow();
            TimingComparison far = verifier.compareWeaponTiming(actor, weapon(1050, "Axe")).orElseThrow();

            assertThat(close.provider1Name()).isEqualTo("ItemId");
            assertThat(close.provider1DelayMs()).isEqualTo(1010);
            assertThat(close.provider2DelayMs()).isEqualTo(1000);
            assertThat(close.varianceMs()).isEqualTo(10);
            assertThat(close.discrepancy()).isFalse();
            assertThat(far.varianceMs()).isEqualTo(50);
            assertThat(far.discrepancy()).isTrue();
            assertThat(verifier.getComparisonCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should do nothing while disabled or without a reference provider")
        void shouldSkipWhenDisabled() {
            ShadowModeVerifier verifier = newVerifier(false);
            assertThat(verifier.compareWeaponTiming(actor, weapon(1010, "Sword"))).isEmpty();

            verifier.setEnabled(true);
            providers.setReference(null);
            assertThat(verifier.compareWeaponTiming(actor, weapon(1010, "Sword"))).isEmpty();
            assertThat(verifier.getComparisonCount()).isZero();
        }

        @Test
        @DisplayName("should sample every Nth swing")
        void shouldSample() {
            config.setSampleEvery(3);
            ShadowModeVerifier verifier = newVerifier(true);

            for (int i = 0; i < 7; i++) {
                verifier.compareWeaponTiming(actor, weapon(1010, "Sword"));
            }

            assertThat(verifier.getComparisonCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should keep only the most recent comparisons")
        void shouldBoundHistory() {
            config.setMaxComparisons(5);
            ShadowModeVerifier verifier = newVerifier(true);

            for (int i = 0; i < 8; i++) {
                verifier.compareWeaponTiming(actor, weapon(1000 + i, "Sword"));
            }

            assertThat(verifier.getComparisons(null))
                    .extracting(TimingComparison::weaponId)
                    .containsExactly(1003, 1004, 1005, 1006, 1007);
        }

        @Test
        @DisplayName("should count discrepancies in metrics")
        void shouldCountDiscrepancies() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            ShadowModeVerifier verifier = new ShadowModeVerifier(config, true, providers, null, tempDir, clock,
                    new CombatMetrics(registry, null));

            verifier.compareWeaponTiming(actor, weapon(1050, "War Axe"));
            verifier.compareWeaponTiming(actor, weapon(1005, "War Axe"));

            assertThat(registry.get("firefly.combat.shadow.discrepancies").tag("weapon", "war_axe")
                    .counter().count()).isEqualTo(1.0);
        }
    }

    // ========================================================================
    // Report Tests
    // ========================================================================

    @Nested
    @DisplayName("generateReport")
    class ReportTests {

        @Test
        @DisplayName("should explain an empty report")
        void shouldExplainEmptyReport() {
            ShadowModeReport report = newVerifier(true).generateReport();

            assertThat(report.totalComparisons()).isZero();
            assertThat(report.message()).isEqualTo("No shadow mode comparisons available");
            assertThat(report.weaponBreakdown()).isEmpty();
        }

        @Test
        @DisplayName("should aggregate variance and sort weapons by average variance")
        void shouldAggregateReport() {
            ShadowModeVerifier verifier = newVerifier(true);
            verifier.compareWeaponTiming(actor, weapon(1010, "Sword"));
            verifier.compareWeaponTiming(actor, weapon(1020, "Sword"));
            verifier.compareWeaponTiming(actor, weapon(1050, "Axe"));

            ShadowModeReport report = verifier.generateReport();

            assertThat(report.totalComparisons()).isEqualTo(3);
            assertThat(report.minVarianceMs()).isEqualTo(10);
            assertThat(report.maxVarianceMs()).isEqualTo(50);
            assertThat(report.averageVarianceMs()).isCloseTo(26.67, within(0.01));
            assertThat(report.discrepancyCount()).isEqualTo(2);
            assertThat(report.discrepancyPercentage()).isCloseTo(66.67, within(0.01));
            assertThat(report.message()).isNull();
            assertThat(report.weaponBreakdown()).satisfiesExactly(
                    axe -> {
                        assertThat(axe.weaponName()).isEqualTo("Axe");
                        assertThat(axe.maxVarianceMs()).isEqualTo(50);
                    },
                    sword -> {
                        assertThat(sword.comparisons()).isEqualTo(2);
                        assertThat(sword.averageVarianceMs()).isEqualTo(15.0);
                    });
        }

        @Test
        @DisplayName("should restrict the report to a recent window")
        void shouldRestrictToWindow() {
            ShadowModeVerifier verifier = newVerifier(true);
            verifier.compareWeaponTiming(actor, weapon(1050, "Axe"));
            clock.advance(Duration.ofMinutes(10));
            verifier.compareWeaponTiming(actor, weapon(1010, "Sword"));

            ShadowModeReport report = verifier.generateReport(Duration.ofMinutes(5));

            assertThat(report.totalComparisons()).isEqualTo(1);
            assertThat(report.weaponBreakdown()).extracting(WeaponComparisonStats::weaponName)
                    .containsExactly("Sword");
        }

        @Test
        @DisplayName("should clear stored comparisons")
        void shouldClear() {
            ShadowModeVerifier verifier = newVerifier(true);
            verifier.compareWeaponTiming(actor, weapon(1050, "Axe"));

            assertThat(verifier.clear()).isEqualTo(1);
            assertThat(verifier.generateReport().totalComparisons()).isZero();
        }
    }

    // ========================================================================
    // Export Tests
    // ========================================================================

    @Nested
    @DisplayName("exportToCsv")
    class ExportTests {

        @Test
        @DisplayName("should write a timestamped CSV with one row per comparison")
        void shouldExportCsv() throws IOException {
            ShadowModeVerifier verifier = newVerifier(true);
            verifier.compareWeaponTiming(actor, weapon(1010, "Sword"));
            verifier.compareWeaponTiming(actor, weapon(1050, "Axe, Great"));

            Path file = verifier.exportToCsv().orElseThrow();

            assertThat(file.getFileName().toString()).isEqualTo("shadow-comparison-2026-03-15-120000.csv");
            List<String> lines = Files.readAllLines(file);
            assertThat(lines).hasSize(3);
            assertThat(lines.get(0)).isEqualTo(ShadowModeVerifier.CSV_HEADER);
            assertThat(lines.get(1)).isEqualTo(
                    "2026-03-15T12:00:00Z,hero,Actor-hero,1010,Sword,100,ItemId,1010,Reference,1000,10");
            assertThat(lines.get(2)).contains("\"Axe, Great\"");
        }

        @Test
        @DisplayName("should report failure when the file cannot be written")
        void shouldReportExportFailure() throws IOException {
            Path blocked = Files.writeString(tempDir.resolve("blocked"), "file");
            ShadowModeVerifier verifier = newVerifier(true);

            assertThat(verifier.exportToCsv(blocked.resolve("out.csv"))).isEmpty();
        }
    }

    /**
     * Active provider whose interval equals the weapon's item id.
     */
    private static final class ItemIdProvider implements TimingProvider {

        @Override
        public int getAttackIntervalMs(CombatActor actor, CombatWeapon weapon) {
            return weapon.getItemId();
        }

        @Override
        public int getAnimationHitOffsetMs(CombatWeapon weapon) {
            return 300;
        }

        @Override
        public int getAnimationDurationMs(CombatWeapon weapon) {
            return 600;
        }

        @Override
        public String getProviderName() {
            return "ItemId";
        }
    }

    private static final class FixedProvider implements TimingProvider {

        private final String name;
        private final int intervalMs;

        private FixedProvider(String name, int intervalMs) {
            this.name = name;
            this.intervalMs = intervalMs;
        }

        @Override
        public int getAttackIntervalMs(CombatActor actor, CombatWeapon weapon) {
            return intervalMs;
        }

        @Override
        public int getAnimationHitOffsetMs(CombatWeapon weapon) {
            return 300;
        }

        @Override
        public int getAnimationDurationMs(CombatWeapon weapon) {
            return 600;
        }

        @Override
        public String getProviderName() {
            return name;
        }
    }
}
