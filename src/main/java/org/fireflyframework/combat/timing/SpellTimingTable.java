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

package org.fireflyframework.combat.timing;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Case-insensitive spell name to {@link SpellTiming} lookup.
 * Unknown spells have no delay.
 */
@Slf4j
public final class SpellTimingTable {

    private final Map<String, SpellTiming> timings;

    private SpellTimingTable(Map<String, SpellTiming> timings) {
        this.timings = Collections.unmodifiableMap(timings);
    }

    public static SpellTimingTable of(Collection<SpellTiming> spells) {
        Map<String, SpellTiming> byName = new LinkedHashMap<>();
        for (SpellTiming spell : spells) {
            if (spell != null && spell.name() != null && !spell.name().isBlank()) {
                byName.put(key(spell.name()), spell);
            }
        }
        return new SpellTimingTable(byName);
    }

    public static SpellTimingTable defaults() {
        return of(List.of(
                new SpellTiming("Explosion", 2500, 100, 0, 5000),
                new SpellTiming("ChainLightning", 1800, 0, 200, 4000),
                new SpellTiming("MeteorSwarm", 2500, 150, 0, 6000),
                SpellTiming.of("EnergyField", 1800),
                SpellTiming.of("FireField", 1800),
                SpellTiming.of("PoisonField", 1800),
                SpellTiming.of("ParalyzeField", 1800)));
    }

    /**
     * Loads {@code {"spells": [...]}} from a resource, falling back to the
     * defaults when the resource is missing, malformed or has no spells.
     */
    public static SpellTimingTable load(Resource resource, ObjectMapper objectMapper) {
        if (resource == null || !resource.exists()) {
            log.info("Spell timing resource {} not found, using defaults", resource);
            return defaults();
        }
        try (InputStream in = resource.getInputStream()) {
            SpellTimingDocument document = objectMapper.readValue(in, SpellTimingDocument.class);
            if (document == null || document.spells() == null || document.spells().isEmpty()) {
                log.warn("SPELL_TABLE_EMPTY: resource={}, using defaults", resource.getDescription());
                return defaults();
            }
            SpellTimingTable table = of(document.spells());
            log.info("Loaded {} spell timings from {}", table.size(), resource.getDescription());
            return table;
        } catch (IOException e) {
            log.error("SPELL_TABLE_INVALID: resource={}, using defaults", resource.getDescription(), e);
            return defaults();
        }
    }

    public Optional<SpellTiming> find(String spellName) {
        if (spellName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(timings.get(key(spellName)));
    }

    /**
     * Cast delay for a spell, or zero when the spell is not configured.
     */
    public int getCastDelayMs(String spellName, double skill, boolean fromScroll, int tiles, int targets) {
        Optional<SpellTiming> timing = find(spellName);
        if (timing.isEmpty()) {
            log.debug("No spell timing for {}", spellName);
            return 0;
        }
        return timing.get().calculateDelay(skill, fromScroll, tiles, targets);
    }

    public int size() {
        return timings.size();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    record SpellTimingDocument(List<SpellTiming> spells) {
    }
}
