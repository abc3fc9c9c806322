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

package org.fireflyframework.combat.actor;

/**
 * Swing animation class of a weapon. Used to select class defaults for
 * weapons with no timing entry of their own.
 */
public enum WeaponAnimation {
    WRESTLE,
    SLASH_1H,
    PIERCE_1H,
    BASH_1H,
    BASH_2H,
    SLASH_2H,
    PIERCE_2H,
    SHOOT_BOW,
    SHOOT_XBOW;

    public boolean isOneHanded() {
        return this == WRESTLE || this == SLASH_1H || this == PIERCE_1H || this == BASH_1H;
    }
}
