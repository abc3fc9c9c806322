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

/**
 * Cast delay parameters of one spell.
 *
 * @param name              spell name
 * @param baseDelayMs       delay before any area or target scaling
 * @param perTileDelayMs    added for each tile of travel distance
 * @param perTargetDelayMs  added for each target beyond the first
 * @param maxDelayMs        upper bound, or zero for none
 */
public record SpellTiming(
        String name,
        int baseDelayMs,
        int perTileDelayMs,
        int perTargetDelayMs,
        int maxDelayMs
) {

    private static final double MAX_SKILL_REDUCTION = 0.5;

    public static SpellTiming of(String name, int baseDelayMs) {
        return new SpellTiming(name, baseDelayMs, 0, 0, 0);
    }

    /**
     * Computes the cast delay. Caster skill shortens the delay by up to half
     * unless the spell is cast from a scroll.
     */
    public int calculateDelay(double skill, boolean fromScroll, int tiles, int targets) {
        double delay = baseDelayMs;
        if (tiles > 0) {
            delay += (double) perTileDelayMs * tiles;
        }
        if (targets > 1) {
            delay += (double) perTargetDelayMs * (targets - 1);
        }
        if (!fromScroll && skill > 0) {
            delay *= 1.0 - Math.min(skill / 10.0, MAX_SKILL_REDUCTION);
        }
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return (int) Math.max(delay, 0);
    }
}
