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

import org.fireflyframework.combat.actor.CombatActor;
import org.fireflyframework.combat.actor.CombatWeapon;

/**
 * Computes attack timing for an actor and weapon.
 * <p>
 * Implementations must be deterministic and free of side effects: the same
 * inputs always produce the same values. This lets the scheduler and the
 * shadow verifier call any provider at any time without changing outcomes.
 */
public interface TimingProvider {

    /**
     * Delay in milliseconds before the actor may attack again with this weapon.
     */
    int getAttackIntervalMs(CombatActor actor, CombatWeapon weapon);

    /**
     * Delay in milliseconds between the start of the swing and its resolution.
     */
    int getAnimationHitOffsetMs(CombatWeapon weapon);

    /**
     * Total length of the swing animation in milliseconds.
     */
    int getAnimationDurationMs(CombatWeapon weapon);

    /**
     * Name recorded in audit entries and shadow comparisons.
     */
    String getProviderName();
}
