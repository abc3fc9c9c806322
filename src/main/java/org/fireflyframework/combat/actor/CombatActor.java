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
 * View of a game actor as seen by the combat timing engine.
 * <p>
 * The engine never owns actors. It keeps weak references where it needs to
 * remember one, and reads only the attributes declared here. The three
 * shared cooldown fields back {@link org.fireflyframework.combat.state.TimerMode#SHARED}.
 */
public interface CombatActor {

    /**
     * Stable identifier, unique among live actors.
     */
    String getId();

    String getName();

    /**
     * Returns {@code false} once the actor has been deleted from the world.
     */
    boolean isValid();

    /**
     * The speed-relevant attribute used by the timing formulas.
     */
    int getDexterity();

    boolean isPlayer();

    long getNextCombatTime();

    void setNextCombatTime(long epochMillis);

    long getNextSpellTime();

    void setNextSpellTime(long epochMillis);

    long getNextSkillTime();

    void setNextSkillTime(long epochMillis);
}
