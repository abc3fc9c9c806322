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

/**
 * Action type tags written to audit entries.
 */
public final class CombatActionTypes {

    public static final String SWING_START = "SwingStart";
    public static final String SWING_CANCELLED = "SwingCancelled";
    public static final String HIT_RESOLUTION = "HitResolution";

    public static final String SPELL_CAST_START = "SpellCastStart";
    public static final String SPELL_CAST_COMPLETE = "SpellCastComplete";
    public static final String SPELL_CAST_CANCELLED = "SpellCastCancelled";

    public static final String BANDAGE_START = "BandageStart";
    public static final String BANDAGE_COMPLETE = "BandageComplete";
    public static final String BANDAGE_CANCELLED = "BandageCancelled";

    public static final String WAND_START = "WandStart";
    public static final String WAND_COMPLETE = "WandComplete";
    public static final String WAND_CANCELLED = "WandCancelled";

    public static final String SHADOW_COMPARISON = "ShadowComparison";
    public static final String PERFORMANCE_METRIC = "PerformanceMetric";

    private CombatActionTypes() {
    }
}
