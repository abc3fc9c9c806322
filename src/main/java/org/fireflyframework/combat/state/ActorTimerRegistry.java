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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.combat.actor.CombatActor;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;

/**
 * Per-actor timer state keyed weakly by actor, so entries disappear with
 * the actor. Entries are also removed explicitly when an actor leaves the world.
 */
@Slf4j
public class ActorTimerRegistry {

    private final Map<CombatActor, ActorTimerState> states = Collections.synchronizedMap(new WeakHashMap<>());

    private final TimerMode mode;
    private final ActionRules rules;
    private final Clock clock;
    private final boolean logCancellations;
    private final boolean logTimerChanges;

    public ActorTimerRegistry(TimerMode mode, ActionRules rules, Clock clock,
                              boolean logCancellations, boolean logTimerChanges) {
        this.mode = mode;
        this.rules = rules;
        this.clock = clock;
        this.logCancellations = logCancellations;
        this.logTimerChanges = logTimerChanges;
    }

    /**
     * Returns the actor's state, creating it on first use.
     *
     * @throws IllegalArgumentException if {@code actor} is null
     */
    public ActorTimerState getOrCreate(CombatActor actor) {
        if (actor == null) {
            throw new IllegalArgumentException("Actor must not be null");
        }
        return states.computeIfAbsent(actor,
                a -> new ActorTimerState(a, mode, rules, clock, logCancellations, logTimerChanges));
    }

    public Optional<ActorTimerState> find(CombatActor actor) {
        if (actor == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(states.get(actor));
    }

    public boolean remove(CombatActor actor) {
        if (actor == null) {
            return false;
        }
        boolean removed = states.remove(actor) != null;
        if (removed) {
            log.debug("Removed timer state for actor {}", actor.getId());
        }
        return removed;
    }

    public int size() {
        return states.size();
    }

    public void clear() {
        states.clear();
    }

    public ActionRules getRules() {
        return rules;
    }

    public TimerMode getMode() {
        return mode;
    }
}
