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

package org.fireflyframework.combat.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.fireflyframework.combat.audit.AuditLevel;
import org.fireflyframework.combat.state.ActionRules;
import org.fireflyframework.combat.state.TimerMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the combat timing engine.
 */
@ConfigurationProperties(prefix = "firefly.combat")
@Validated
@Data
public class CombatTimingProperties {

    /**
     * Whether the combat timing engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to register the pulse health indicator.
     */
    private boolean healthEnabled = true;

    @Valid
    @NotNull
    private PulseConfig pulse = new PulseConfig();

    @Valid
    @NotNull
    private TimersConfig timers = new TimersConfig();

    @Valid
    @NotNull
    private RulesConfig rules = new RulesConfig();

    @Valid
    @NotNull
    private TimingConfig timing = new TimingConfig();

    @Valid
    @NotNull
    private AuditConfig audit = new AuditConfig();

    @Valid
    @NotNull
    private ShadowConfig shadow = new ShadowConfig();

    @Valid
    @NotNull
    private ApiConfig api = new ApiConfig();

    /**
     * Global tick scheduler configuration.
     */
    @Data
    public static class PulseConfig {

        /**
         * Interval between ticks.
         */
        @NotNull
        private Duration tickInterval = Duration.ofMillis(50);

        /**
         * Participants without activity for this long are evicted.
         */
        @NotNull
        private Duration idleTimeout = Duration.ofSeconds(5);

        /**
         * Ticks slower than this are logged as warnings.
         */
        @NotNull
        private Duration slowTickThreshold = Duration.ofMillis(10);

        /**
         * Whether the tick triggers each participant's next action when its timer elapses.
         */
        private boolean globalPulse = true;

        /**
         * Number of recent ticks kept for performance statistics.
         */
        @Min(10)
        private int performanceWindow = 1000;

        /**
         * Whether the scheduler starts when the application context starts.
         */
        private boolean autoStart = true;

        @Valid
        @NotNull
        private StartupConfig startup = new StartupConfig();
    }

    /**
     * Readiness probing performed before the tick is installed.
     */
    @Data
    public static class StartupConfig {

        @NotNull
        private Duration firstBackoff = Duration.ofMillis(100);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(2);

        @Min(1)
        private int maxAttempts = 50;
    }

    /**
     * Per-actor timer configuration.
     */
    @Data
    public static class TimersConfig {

        /**
         * INDEPENDENT keeps one timer per category, SHARED uses the actor's own cooldown fields.
         */
        @NotNull
        private TimerMode mode = TimerMode.INDEPENDENT;

        /**
         * Log every cancelled action with its reason.
         */
        private boolean logCancellations = false;

        /**
         * Log every next-eligible time change.
         */
        private boolean logTimerChanges = false;
    }

    /**
     * Cross-category action rules.
     */
    @Data
    public static class RulesConfig {

        private boolean spellCancelsSwing = true;

        private boolean swingCancelsSpell = true;

        private boolean bandageCancelsActions = true;

        private boolean deviceCancelsActions = true;

        private boolean disableSwingDuringCast = true;

        private boolean disableSwingDuringCastDelay = true;

        /**
         * Skip the recovery timer after a completed cast.
         */
        private boolean removePostCastRecovery = true;

        /**
         * Device use completes without a cooldown.
         */
        private boolean instantDeviceUse = true;

        public ActionRules toActionRules() {
            return new ActionRules(spellCancelsSwing, swingCancelsSpell, bandageCancelsActions,
                    deviceCancelsActions, disableSwingDuringCast, disableSwingDuringCastDelay,
                    removePostCastRecovery, instantDeviceUse);
        }
    }

    /**
     * Timing tables and fallbacks.
     */
    @Data
    public static class TimingConfig {

        /**
         * Resource location of a JSON array of weapon timing entries.
         * When unset the built-in compatibility table is used.
         */
        private String weaponTableLocation;

        /**
         * Resource location of a JSON spell timing document.
         * When unset the built-in spell defaults are used.
         */
        private String spellTableLocation;

        /**
         * Interval used when the timing provider fails.
         */
        @Min(0)
        private int fallbackIntervalMs = 1500;

        /**
         * Hit offset used when the timing provider fails.
         */
        @Min(0)
        private int fallbackHitOffsetMs = 300;
    }

    /**
     * Audit log configuration. Out-of-range values are clamped by {@link #normalized()}.
     */
    @Data
    public static class AuditConfig {

        private boolean enabled = true;

        @NotNull
        private AuditLevel level = AuditLevel.STANDARD;

        /**
         * Directory receiving the daily JSONL files and shadow CSV exports.
         */
        @NotNull
        private String outputDirectory = "logs/combat-audit";

        private int bufferSize = 10000;

        @NotNull
        private Duration flushInterval = Duration.ofSeconds(5);

        /**
         * Whether the reference provider runs alongside the active one.
         */
        private boolean shadowMode = false;

        private int retentionDays = 7;

        private int maxFileSizeMb = 100;

        private int maxEntriesPerTick = 250;

        /**
         * Tick duration above which the audit level is reduced to STANDARD.
         */
        private int autoThrottleThresholdMs = 10;

        private boolean actorHistoryEnabled = true;

        private int actorHistorySize = 100;

        /**
         * Variance above which an entry is reported as an anomaly.
         */
        @Min(0)
        private int anomalyThresholdMs = 50;

        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        /**
         * Returns a copy with every limit clamped to its supported range.
         */
        public AuditConfig normalized() {
            AuditConfig copy = new AuditConfig();
            copy.setEnabled(enabled);
            copy.setLevel(level != null ? level : AuditLevel.STANDARD);
            copy.setOutputDirectory(outputDirectory);
            copy.setBufferSize(clamp(bufferSize, 100, 100_000));
            long flushMs = flushInterval != null ? flushInterval.toMillis() : 5000L;
            copy.setFlushInterval(Duration.ofMillis(Math.max(1000L, Math.min(60_000L, flushMs))));
            copy.setShadowMode(shadowMode);
            copy.setRetentionDays(Math.max(0, retentionDays));
            copy.setMaxFileSizeMb(clamp(maxFileSizeMb, 0, 1000));
            copy.setMaxEntriesPerTick(clamp(maxEntriesPerTick, 10, 1000));
            copy.setAutoThrottleThresholdMs(clamp(autoThrottleThresholdMs, 0, 100));
            copy.setActorHistoryEnabled(actorHistoryEnabled);
            copy.setActorHistorySize(clamp(actorHistorySize, 10, 1000));
            copy.setAnomalyThresholdMs(anomalyThresholdMs);
            copy.setCircuitBreaker(circuitBreaker);
            return copy;
        }

        private static int clamp(int value, int min, int max) {
            return Math.max(min, Math.min(max, value));
        }
    }

    /**
     * Circuit breaker guarding audit file writes.
     */
    @Data
    public static class CircuitBreakerConfig {

        @Min(1)
        private int failureRateThreshold = 50;

        @Min(1)
        private int minimumNumberOfCalls = 3;

        @Min(1)
        private int slidingWindowSize = 10;

        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }

    /**
     * Shadow comparison configuration.
     */
    @Data
    public static class ShadowConfig {

        /**
         * Variance above which a comparison is a discrepancy.
         */
        @Min(0)
        private int discrepancyThresholdMs = 10;

        @Min(1)
        private int maxComparisons = 10000;

        /**
         * Compare one attack out of every N.
         */
        @Min(1)
        private int sampleEvery = 1;
    }

    /**
     * REST API configuration.
     */
    @Data
    public static class ApiConfig {

        /**
         * Whether to enable the operational REST API.
         */
        private boolean enabled = true;

        /**
         * Base path for combat REST endpoints.
         */
        private String basePath = "/api/v1/combat";
    }
}
