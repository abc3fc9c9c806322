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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.actor.CombatWeapon;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable weapon timing lookup keyed by item id.
 * <p>
 * Lookups never fail: weapons without an entry resolve to their class default,
 * and a missing weapon resolves to {@link WeaponTimingEntry#DEFAULT}.
 */
@Slf4j
public final class WeaponTimingTable {

    private static final TypeReference<List<WeaponTimingEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final Map<Integer, WeaponTimingEntry> entries;

    private WeaponTimingTable(Map<Integer, WeaponTimingEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static WeaponTimingTable empty() {
        return new WeaponTimingTable(new LinkedHashMap<>());
    }

    public static WeaponTimingTable of(Collection<WeaponTimingEntry> entries) {
        Map<Integer, WeaponTimingEntry> byId = new LinkedHashMap<>();
        for (WeaponTimingEntry entry : entries) {
            if (entry != null) {
                byId.put(entry.itemId(), entry);
            }
        }
        return new WeaponTimingTable(byId);
    }

    /**
     * Built-in table used when no weapon file is configured.
     */
    public static WeaponTimingTable compatibility() {
        return of(List.of(
                new WeaponTimingEntry(0x13FF, "Katana", 46, 1600, 300, 600),
                new WeaponTimingEntry(0x13B8, "Longsword", 30, 1600, 300, 600),
                new WeaponTimingEntry(0x143E, "Halberd", 25, 1900, 400, 800),
                new WeaponTimingEntry(0x13B1, "Bow", 30, 2000, 500, 900)));
    }

    /**
     * Loads a JSON array of weapon entries. A missing or malformed resource
     * yields an empty table and a warning.
     */
    public static WeaponTimingTable load(Resource resource, ObjectMapper objectMapper) {
        if (resource == null || !resource.exists()) {
            log.warn("WEAPON_TABLE_MISSING: resource={}, using class defaults only", resource);
            return empty();
        }
        try (InputStream in = resource.getInputStream()) {
            List<WeaponTimingEntry> loaded = objectMapper.readValue(in, ENTRY_LIST);
            WeaponTimingTable table = of(loaded == null ? List.of() : loaded);
            log.info("Loaded {} weapon timing entries from {}", table.size(), resource.getDescription());
            return table;
        } catch (IOException e) {
            log.warn("WEAPON_TABLE_INVALID: resource={}, error={}", resource.getDescription(), e.getMessage());
            return empty();
        }
    }

    public Optional<WeaponTimingEntry> find(int itemId) {
        return Optional.ofNullable(entries.get(itemId));
    }

    public WeaponTimingEntry resolve(CombatWeapon weapon) {
        if (weapon == null) {
            return WeaponTimingEntry.DEFAULT;
        }
        WeaponTimingEntry entry = entries.get(weapon.getItemId());
        return entry != null ? entry : WeaponTimingEntry.classDefault(weapon);
    }

    public Collection<WeaponTimingEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }
}
