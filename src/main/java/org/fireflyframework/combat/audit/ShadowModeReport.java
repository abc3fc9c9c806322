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
import java.util.List;

/**
 * Aggregate of shadow comparisons. {@code weaponBreakdown} is sorted by
 * average variance, highest first.
 */
public record ShadowModeReport(
        int totalComparisons,
        int minVarianceMs,
        int maxVarianceMs,
        double averageVarianceMs,
        int discrepancyCount,
        double discrepancyPercentage,
        List<WeaponComparisonStats> weaponBreakdown,
        String message,
        Instant generatedAt
) {

    static final String NO_COMPARISONS = "No shadow mode comparisons available";

    static ShadowModeReport empty(Instant generatedAt) {
        return new ShadowModeReport(0, 0, 0, 0.0, 0, 0.0, List.of(), NO_COMPARISONS, generatedAt);
    }
}
