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

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observed action, written as a single JSON line.
 *
 * @param timestamp       when the action was observed
 * @param actorId         actor identifier
 * @param actorName       actor display name
 * @param actionType      one of {@link CombatActionTypes}
 * @param timingProvider  provider that computed the expected delay, may be null
 * @param expectedDelayMs delay the engine scheduled
 * @param actualDelayMs   measured delay, null when not measured
 * @param varianceMs      {@code actual - expected}, zero when not measured
 * @param weaponId        weapon item id, zero when no weapon is involved
 * @param weaponName      weapon name, may be null
 * @param dexterity       actor dexterity at the time of the action
 * @param details         additional key/value data
 * @param level           level the entry was recorded at
 */
@Builder
public record AuditLogEntry(
        Instant timestamp,
        String actorId,
        String actorName,
        String actionType,
        String timingProvider,
        long expectedDelayMs,
        Long actualDelayMs,
        long varianceMs,
        int weaponId,
        String weaponName,
        int dexterity,
        Map<String, Object> details,
        AuditLevel level
) {

    public AuditLogEntry {
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isAnomaly(long thresholdMs) {
        return actualDelayMs != null && Math.abs(varianceMs) > thresholdMs;
    }
}
