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

import org.fireflyframework.combat.actor.CombatActor;

import java.lang.ref.WeakReference;

/**
 * Reads and writes the actor's own cooldown fields: attack uses the combat
 * time, cast the spell time, healing and device use the skill time.
 */
final class SharedTimerStore implements TimerStore {

    private final WeakReference<CombatActor> actorRef;

    SharedTimerStore(CombatActor actor) {
        this.actorRef = new WeakReference<>(actor);
    }

    @Override
    public long getNextTime(ActionCategory category) {
        CombatActor actor = actorRef.get();
        if (actor == null) {
            return 0L;
        }
        return switch (category) {
            case ATTACK -> actor.getNextCombatTime();
            case CAST -> actor.getNextSpellTime();
            case HEAL, DEVICE -> actor.getNextSkillTime();
        };
    }

    @Override
    public void setNextTime(ActionCategory category, long epochMillis) {
        CombatActor actor = actorRef.get();
        if (actor == null) {
            return;
        }
        switch (category) {
            case ATTACK -> actor.setNextCombatTime(epochMillis);
            case CAST -> actor.setNextSpellTime(epochMillis);
            case HEAL, DEVICE -> actor.setNextSkillTime(epochMillis);
        }
    }

    @Override
    public void clear() {
        // the actor's fields belong to the game engine
    }
}
