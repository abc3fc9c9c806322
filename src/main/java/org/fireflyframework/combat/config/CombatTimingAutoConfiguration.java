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

package org.fireflyframework.combat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.action.CombatActionService;
import org.fireflyframework.combat.actor.HitResolver;
import org.fireflyframework.combat.actor.SwingAnimator;
import org.fireflyframework.combat.audit.AuditLogWriter;
import org.fireflyframework.combat.audit.CombatAuditService;
import org.fireflyframework.combat.audit.ShadowModeVerifier;
import org.fireflyframework.combat.event.CombatActionListener;
import org.fireflyframework.combat.event.CombatEventPublisher;
import org.fireflyframework.combat.health.CombatPulseHealthIndicator;
import org.fireflyframework.combat.metrics.CombatMetrics;
import org.fireflyframework.combat.properties.CombatTimingProperties;
import org.fireflyframework.combat.rest.CombatAuditController;
import org.fireflyframework.combat.routine.AttackRoutine;
import org.fireflyframework.combat.scheduler.CombatPulseScheduler;
import org.fireflyframework.combat.scheduler.TimerSubsystemProbe;
import org.fireflyframework.combat.state.ActorTimerRegistry;
import org.fireflyframework.combat.timing.LegacyTimingProvider;
import org.fireflyframework.combat.timing.SpellTimingTable;
import org.fireflyframework.combat.timing.TimingProviderRegistry;
import org.fireflyframework.combat.timing.WeaponTimingProvider;
import org.fireflyframework.combat.timing.WeaponTimingTable;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Auto-configuration for the combat timing engine.
 * <p>
 * Creates the following beans:
 * <ul>
 *   <li>WeaponTimingTable, SpellTimingTable - timing data</li>
 *   <li>WeaponTimingProvider, LegacyTimingProvider, TimingProviderRegistry - interval formulas</li>
 *   <li>ActorTimerRegistry - per-actor timer state</li>
 *   <li>CombatPulseScheduler - global tick loop</li>
 *   <li>CombatAuditService, AuditLogWriter, ShadowModeVerifier - audit and shadow verification</li>
 *   <li>AttackRoutine, CombatActionService - inbound action surface (requires a HitResolver bean)</li>
 *   <li>CombatMetrics, CombatPulseHealthIndicator - observability</li>
 *   <li>CombatAuditController - REST API endpoints</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
})
@EnableConfigurationProperties(CombatTimingProperties.class)
@ConditionalOnProperty(prefix = "firefly.combat", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CombatTimingAutoConfiguration {

    private final ResourceLoader resourceLoader = new DefaultResourceLoader();

    @Bean
    @ConditionalOnMissingBean
    public Clock combatClock() {
        return Clock.systemUTC();
    }

    // ==================== Timing ====================

    @Bean
    @ConditionalOnMissingBean
    public WeaponTimingTable weaponTimingTable(CombatTimingProperties properties,
                                               ObjectProvider<ObjectMapper> objectMapper) {
        String location = properties.getTiming().getWeaponTableLocation();
        if (location == null || location.isBlank()) {
            log.info("Using built-in weapon timing table");
            return WeaponTimingTable.compatibility();
        }
        return WeaponTimingTable.load(resourceLoader.getResource(location), mapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public SpellTimingTable spellTimingTable(CombatTimingProperties properties,
                                             ObjectProvider<ObjectMapper> objectMapper) {
        String location = properties.getTiming().getSpellTableLocation();
        if (location == null || location.isBlank()) {
            return SpellTimingTable.defaults();
        }
        return SpellTimingTable.load(resourceLoader.getResource(location), mapper(objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public WeaponTimingProvider weaponTimingProvider(WeaponTimingTable weaponTimingTable) {
        return new WeaponTimingProvider(weaponTimingTable);
    }

    @Bean
    @ConditionalOnMissingBean
    public LegacyTimingProvider legacyTimingProvider() {
        return new LegacyTimingProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimingProviderRegistry timingProviderRegistry(WeaponTimingProvider weaponTimingProvider,
                                                         LegacyTimingProvider legacyTimingProvider) {
        log.info("Creating TimingProviderRegistry with active={}, reference={}",
                weaponTimingProvider.getProviderName(), legacyTimingProvider.getProviderName());
        return new TimingProviderRegistry(weaponTimingProvider, legacyTimingProvider);
    }

    // ==================== State and scheduling ====================

    @Bean
    @ConditionalOnMissingBean
    public ActorTimerRegistry actorTimerRegistry(CombatTimingProperties properties, Clock combatClock) {
        CombatTimingProperties.TimersConfig timers = properties.getTimers();
        log.info("Creating ActorTimerRegistry with mode={}", timers.getMode());
        return new ActorTimerRegistry(timers.getMode(), properties.getRules().toActionRules(), combatClock,
                timers.isLogCancellations(), timers.isLogTimerChanges());
    }

    @Bean
    @ConditionalOnMissingBean
    public CombatEventPublisher combatEventPublisher(ObjectProvider<CombatActionListener> listeners) {
        CombatEventPublisher publisher = new CombatEventPublisher(listeners.orderedStream().collect(Collectors.toList()));
        log.info("Creating CombatEventPublisher with {} listener(s)", publisher.getListenerCount());
        return publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    public CombatPulseScheduler combatPulseScheduler(CombatTimingProperties properties,
                                                     Clock combatClock,
                                                     ObjectProvider<TimerSubsystemProbe> probe) {
        CombatPulseScheduler scheduler = new CombatPulseScheduler(properties.getPulse(), combatClock,
                probe.getIfAvailable(() -> TimerSubsystemProbe.ALWAYS_READY));
        if (properties.getPulse().isAutoStart()) {
            scheduler.start();
            log.info("Created and started CombatPulseScheduler with tickInterval={}, idleTimeout={}",
                    properties.getPulse().getTickInterval(), properties.getPulse().getIdleTimeout());
        }
        return scheduler;
    }

    // ==================== Audit ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.combat.audit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public AuditLogWriter auditLogWriter(CombatTimingProperties properties,
                                         ObjectProvider<ObjectMapper> objectMapper,
                                         Clock combatClock) {
        CombatTimingProperties.AuditConfig audit = properties.getAudit().normalized();
        CombatTimingProperties.CircuitBreakerConfig cb = audit.getCircuitBreaker();
        CircuitBreaker circuitBreaker = CircuitBreaker.of("combat-audit-writer", CircuitBreakerConfig.custom()
                .failureRateThreshold(cb.getFailureRateThreshold())
                .minimumNumberOfCalls(cb.getMinimumNumberOfCalls())
                .slidingWindowSize(cb.getSlidingWindowSize())
                .waitDurationInOpenState(cb.getWaitDurationInOpenState())
                .build());
        log.info("Creating AuditLogWriter writing to {}", audit.getOutputDirectory());
        return new AuditLogWriter(Path.of(audit.getOutputDirectory()), mapper(objectMapper), combatClock,
                audit.getMaxFileSizeMb(), audit.getRetentionDays(), circuitBreaker);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.combat.audit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CombatAuditService combatAuditService(CombatTimingProperties properties,
                                                 AuditLogWriter auditLogWriter,
                                                 Clock combatClock,
                                                 CombatPulseScheduler combatPulseScheduler,
                                                 ObjectProvider<CombatMetrics> metrics) {
        CombatAuditService auditService = new CombatAuditService(properties.getAudit(), auditLogWriter,
                combatClock, properties.getPulse().getTickInterval(), metrics.getIfAvailable());
        combatPulseScheduler.addTickListener(auditService);
        auditService.start();
        return auditService;
    }

    @Bean
    @ConditionalOnMissingBean
    public ShadowModeVerifier shadowModeVerifier(CombatTimingProperties properties,
                                                 TimingProviderRegistry timingProviderRegistry,
                                                 ObjectProvider<CombatAuditService> auditService,
                                                 Clock combatClock,
                                                 ObjectProvider<CombatMetrics> metrics) {
        log.info("Creating ShadowModeVerifier (enabled: {}, threshold: {}ms)",
                properties.getAudit().isShadowMode(), properties.getShadow().getDiscrepancyThresholdMs());
        return new ShadowModeVerifier(properties.getShadow(), properties.getAudit().isShadowMode(),
                timingProviderRegistry, auditService.getIfAvailable(),
                Path.of(properties.getAudit().getOutputDirectory()), combatClock, metrics.getIfAvailable());
    }

    // ==================== Actions ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(HitResolver.class)
    public AttackRoutine attackRoutine(CombatTimingProperties properties,
                                       CombatPulseScheduler combatPulseScheduler,
                                       ActorTimerRegistry actorTimerRegistry,
                                       TimingProviderRegistry timingProviderRegistry,
                                       HitResolver hitResolver,
                                       ObjectProvider<SwingAnimator> swingAnimator,
                                       CombatEventPublisher combatEventPublisher,
                                       Clock combatClock,
                                       ShadowModeVerifier shadowModeVerifier,
                                       ObjectProvider<CombatMetrics> metrics) {
        AttackRoutine routine = new AttackRoutine(combatPulseScheduler, actorTimerRegistry, timingProviderRegistry,
                hitResolver, swingAnimator.getIfAvailable(() -> SwingAnimator.NONE), combatEventPublisher,
                combatClock, properties.getTiming().getFallbackIntervalMs(),
                properties.getTiming().getFallbackHitOffsetMs(), shadowModeVerifier, metrics.getIfAvailable());
        combatPulseScheduler.setResolutionHandler(routine);
        log.info("Creating AttackRoutine and registering it as resolution handler");
        return routine;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(HitResolver.class)
    public CombatActionService combatActionService(ActorTimerRegistry actorTimerRegistry,
                                                   AttackRoutine attackRoutine,
                                                   CombatPulseScheduler combatPulseScheduler,
                                                   SpellTimingTable spellTimingTable,
                                                   CombatEventPublisher combatEventPublisher,
                                                   Clock combatClock,
                                                   ObjectProvider<CombatAuditService> auditService) {
        CombatActionService service = new CombatActionService(actorTimerRegistry, attackRoutine,
                combatPulseScheduler, spellTimingTable, combatEventPublisher, combatClock,
                auditService.getIfAvailable());
        combatPulseScheduler.setPulseActionTrigger(service);
        return service;
    }

    // ==================== Observability ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.combat", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public CombatMetrics combatMetrics(MeterRegistry meterRegistry, CombatPulseScheduler combatPulseScheduler) {
        CombatMetrics metrics = new CombatMetrics(meterRegistry, combatPulseScheduler);
        combatPulseScheduler.addTickListener(metrics);
        return metrics;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    @ConditionalOnProperty(prefix = "firefly.combat", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public CombatPulseHealthIndicator combatPulseHealthIndicator(CombatPulseScheduler combatPulseScheduler,
                                                                 ObjectProvider<CombatAuditService> auditService) {
        log.info("Creating CombatPulseHealthIndicator");
        return new CombatPulseHealthIndicator(combatPulseScheduler, auditService.getIfAvailable());
    }

    /**
     * REST API Configuration - conditionally enabled.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.combat.api", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CombatAuditController combatAuditController(CombatPulseScheduler combatPulseScheduler,
                                                       ObjectProvider<CombatAuditService> auditService,
                                                       ObjectProvider<ShadowModeVerifier> shadowModeVerifier) {
        log.info("Creating CombatAuditController REST API");
        return new CombatAuditController(combatPulseScheduler, auditService.getIfAvailable(),
                shadowModeVerifier.getIfAvailable());
    }

    private static ObjectMapper mapper(ObjectProvider<ObjectMapper> objectMapper) {
        return objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
    }
}
