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

import java.time.Instant;

/**
 * Intervals computed by the active and reference providers for the same attack.
 */
public record TimingComparison(
        Instant timestamp,
        String actorId,
        String actorName,
        int weaponId,
        String weaponName,
        int dexterity,
        String provider1Name,
        int provider1DelayMs,
        String provider2Name,
        int provider2DelayMs,
        int varianceMs,
        boolean discrepancy
) {
}
