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

import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;

/**
 * A deferred hit resolution owned by one participant.
 *
 * @param target           defender at scheduling time
 * @param weapon           weapon used for the swing
 * @param scheduledAt      epoch millis when the swing started
 * @param resolveAt        epoch millis at or after which the hit resolves
 * @param expectedOffsetMs non-negative hit offset that produced {@code resolveAt}
 * @param providerName     timing provider that computed the offset, may be null
 */
public record PendingResolution(
        CombatActor target,
        CombatWeapon weapon,
        long scheduledAt,
        long resolveAt,
        long expectedOffsetMs,
        String providerName
) {

    public boolean isDue(long now) {
        return now >= resolveAt;
    }
}
