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

package org.fireflyframework.combat.event;

import lombok.Builder;
import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;
import org.fireflyframework.combat.state.ActionCategory;

import java.util.Map;

/**
 * Notification that a timed action began, completed or was cancelled.
 *
 * @param actor           actor performing the action
 * @param target          defender or patient, may be null
 * @param weapon          weapon of an attack, may be null
 * @param category        action category
 * @param phase           lifecycle phase
 * @param context         spell, device or other in-flight description, may be null
 * @param expectedDelayMs delay the engine scheduled, zero when not applicable
 * @param actualDelayMs   measured delay when known by the publisher, otherwise null
 * @param providerName    timing provider that computed the delay, may be null
 * @param reason          cancellation or refusal reason, may be null
 * @param details         additional key/value data
 * @param timestamp       epoch millis of the event
 */
@Builder
public record CombatActionEvent(
        CombatActor actor,
        CombatActor target,
        CombatWeapon weapon,
        ActionCategory category,
        ActionPhase phase,
        String context,
        long expectedDelayMs,
        Long actualDelayMs,
        String providerName,
        String reason,
        Map<String, Object> details,
        long timestamp
) {

    public CombatActionEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
