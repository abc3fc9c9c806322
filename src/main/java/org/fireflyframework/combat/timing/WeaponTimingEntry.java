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

import org.fireflyframework.combat.actor.CombatWeapon;
import org.fireflyframework.combat.actor.WeaponAnimation;
import org.fireflyframework.combat.actor.WeaponType;

/**
 * Timing parameters of one weapon kind.
 *
 * @param itemId              item identifier, {@code -1} for class and global defaults
 * @param name                display name
 * @param speedValue          weapon speed value, higher is slower
 * @param baseMs              nominal base duration of the weapon class
 * @param hitOffsetMs         delay from swing start to resolution
 * @param animationDurationMs total swing animation length
 */
public record WeaponTimingEntry(
        int itemId,
        String name,
        int speedValue,
        int baseMs,
        int hitOffsetMs,
        int animationDurationMs
) {

    public static final WeaponTimingEntry DEFAULT = new WeaponTimingEntry(-1, "Default", 50, 1600, 300, 600);

    public static final WeaponTimingEntry DAGGER = new WeaponTimingEntry(-1, "Dagger", 20, 1600, 200, 400);
    public static final WeaponTimingEntry ONE_HANDED_SWORD = new WeaponTimingEntry(-1, "OneHandedSword", 35, 1600, 300, 600);
    public static final WeaponTimingEntry TWO_HANDED = new WeaponTimingEntry(-1, "TwoHanded", 75, 1900, 400, 800);
    public static final WeaponTimingEntry BOW = new WeaponTimingEntry(-1, "Bow", 45, 2000, 500, 900);
    public static final WeaponTimingEntry CROSSBOW = new WeaponTimingEntry(-1, "Crossbow", 50, 2000, 600, 1100);

    /**
     * Selects the class default for a weapon that has no entry of its own.
     * Ranged weapons map to crossbow or bow, two-handed weapons to the
     * two-handed class, one-handed swing animations to the sword class and
     * remaining piercing weapons to the dagger class.
     */
    public static WeaponTimingEntry classDefault(CombatWeapon weapon) {
        if (weapon == null) {
            return DEFAULT;
        }
        if (weapon.isRanged()) {
            return weapon.isCrossbow() ? CROSSBOW : BOW;
        }
        if (weapon.isTwoHanded()) {
            return TWO_HANDED;
        }
        WeaponAnimation animation = weapon.getAnimation();
        if (animation != null && animation.isOneHanded()) {
            return ONE_HANDED_SWORD;
        }
        if (weapon.getType() == WeaponType.PIERCING) {
            return DAGGER;
        }
        return ONE_HANDED_SWORD;
    }
}
