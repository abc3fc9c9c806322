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

package org.fireflyframework.combat.routine;

/**
 * Timing decided for one attack.
 *
 * @param providerName provider that computed the values
 * @param intervalMs   delay until the next swing is allowed
 * @param hitOffsetMs  delay until the hit resolves
 * @param startedAt    epoch millis of the swing
 * @param resolveAt    epoch millis of the scheduled resolution
 * @param nextSwingAt  epoch millis from which the next swing is allowed
 */
public record AttackTiming(
        String providerName,
        int intervalMs,
        int hitOffsetMs,
        long startedAt,
        long resolveAt,
        long nextSwingAt
) {
}
