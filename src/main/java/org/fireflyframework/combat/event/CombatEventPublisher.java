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

package org.fireflyframework.combat.event;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers combat action events to every listener synchronously.
 * A failing listener is logged and does not affect the others.
 */
@Slf4j
public class CombatEventPublisher {

    private final List<CombatActionListener> listeners = new CopyOnWriteArrayList<>();

    public CombatEventPublisher() {
    }

    public CombatEventPublisher(Collection<? extends CombatActionListener> listeners) {
        if (listeners != null) {
            this.listeners.addAll(listeners);
        }
    }

    public void addListener(CombatActionListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(CombatActionListener listener) {
        listeners.remove(listener);
    }

    public void publish(CombatActionEvent event) {
        if (event == null) {
            return;
        }
        for (CombatActionListener listener : listeners) {
            try {
                listener.onCombatAction(event);
            } catch (RuntimeException e) {
                log.error("Combat action listener {} failed for {} {}",
                        listener.getClass().getSimpleName(), event.category(), event.phase(), e);
            }
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
