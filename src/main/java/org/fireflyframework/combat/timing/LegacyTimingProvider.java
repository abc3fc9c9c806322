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
 * Reference formula kept for shadow comparison.
 * <p>
 * {@code interval = speed / (1 + (dex - 50) * 0.002)} seconds, clamped to
 * half and double the weapon's base speed.
 */
public class LegacyTimingProvider implements TimingProvider {

    public static final String NAME = "LegacyTimingProvider";

    static final int NULL_ACTOR_INTERVAL_MS = 700;
    static final int NO_SPEED_INTERVAL_MS = 1500;

    private static final int DEXTERITY_BASELINE = 50;
    private static final double DEXTERITY_RATE = 0.002;

    @Override
    public int getAttackIntervalMs(CombatActor actor, CombatWeapon weapon) {
        if (actor == null) {
            return NULL_ACTOR_INTERVAL_MS;
        }
        if (weapon == null || weapon.getLegacySpeedSeconds() <= 0) {
            return NO_SPEED_INTERVAL_MS;
        }
        double speed = weapon.getLegacySpeedSeconds();
        double scaled = speed / (1 + (actor.getDexterity() - DEXTERITY_BASELINE) * DEXTERITY_RATE);
        scaled = Math.max(speed * 0.5, Math.min(speed * 2.0, scaled));
        return (int) Math.round(scaled * 1000);
    }

    @Override
    public int getAnimationHitOffsetMs(CombatWeapon weapon) {
        return WeaponTimingEntry.classDefault(weapon).hitOffsetMs();
    }

    @Override
    public int getAnimationDurationMs(CombatWeapon weapon) {
        return WeaponTimingEntry.classDefault(weapon).animationDurationMs();
    }

    @Override
    public String getProviderName() {
        return NAME;
    }
}
