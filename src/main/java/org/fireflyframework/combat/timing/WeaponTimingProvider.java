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
 * Primary timing provider.
 * <p>
 * The interval is {@code speedValue * 40} ms, scaled by the actor's dexterity
 * bonus over a baseline of 100. The bonus is capped to {@code [-50, +25]} and is
 * zero for non-players. Each point above the baseline shortens the swing by
 * 0.8%, each point below lengthens it by 0.4%. The result is rounded to the
 * nearest 50 ms tick and clamped to {@code [200, 4000]} ms.
 */
public class WeaponTimingProvider implements TimingProvider {

    public static final String NAME = "WeaponTimingProvider";

    public static final int TICK_MS = 50;
    public static final int MIN_INTERVAL_MS = 200;
    public static final int MAX_INTERVAL_MS = 4000;

    static final int SPEED_SCALE_MS = 40;
    static final int DEXTERITY_BASELINE = 100;
    static final int MAX_BONUS = 25;
    static final int MAX_PENALTY = -50;
    static final double BONUS_RATE = 0.008;
    static final double PENALTY_RATE = 0.004;

    private final WeaponTimingTable table;

    public WeaponTimingProvider(WeaponTimingTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Weapon timing table must not be null");
        }
        this.table = table;
    }

    @Override
    public int getAttackIntervalMs(CombatActor actor, CombatWeapon weapon) {
        if (actor == null) {
            return MIN_INTERVAL_MS;
        }
        WeaponTimingEntry entry = table.resolve(weapon);
        double base = entry.speedValue() * (double) SPEED_SCALE_MS;
        int bonus = dexterityBonus(actor);
        double multiplier = bonus >= 0
                ? 1.0 - bonus * BONUS_RATE
                : 1.0 - bonus * PENALTY_RATE;
        long rounded = (long) (Math.rint(base * multiplier / TICK_MS) * TICK_MS);
        return (int) Math.max(MIN_INTERVAL_MS, Math.min(MAX_INTERVAL_MS, rounded));
    }

    @Override
    public int getAnimationHitOffsetMs(CombatWeapon weapon) {
        return table.resolve(weapon).hitOffsetMs();
    }

    @Override
    public int getAnimationDurationMs(CombatWeapon weapon) {
        return table.resolve(weapon).animationDurationMs();
    }

    @Override
    public String getProviderName() {
        return NAME;
    }

    public WeaponTimingTable getTable() {
        return table;
    }

    static int dexterityBonus(CombatActor actor) {
        if (!actor.isPlayer()) {
            return 0;
        }
        int raw = actor.getDexterity() - DEXTERITY_BASELINE;
        return Math.max(MAX_PENALTY, Math.min(MAX_BONUS, raw));
    }
}
