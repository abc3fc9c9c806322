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

package org.fireflyframework.combat.state;

/**
 * Cross-category rules applied when an action begins.
 * <p>
 * Rules of the form "X cancels others" are applied only when X starts, so
 * the most recently started action always wins.
 */
public record ActionRules(
        boolean spellCancelsSwing,
        boolean swingCancelsSpell,
        boolean bandageCancelsActions,
        boolean deviceCancelsActions,
        boolean disableSwingDuringCast,
        boolean disableSwingDuringCastDelay,
        boolean removePostCastRecovery,
        boolean instantDeviceUse
) {

    public static ActionRules defaults() {
        return new ActionRules(true, true, true, true, true, true, true, true);
    }
}
