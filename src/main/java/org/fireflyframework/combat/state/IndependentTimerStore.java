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

import java.util.EnumMap;
import java.util.Map;

/**
 * Keeps one timer per category. Not thread-safe on its own, guarded by
 * the owning {@link ActorTimerState}.
 */
final class IndependentTimerStore implements TimerStore {

    private final Map<ActionCategory, Long> nextTimes = new EnumMap<>(ActionCategory.class);

    @Override
    public long getNextTime(ActionCategory category) {
        return nextTimes.getOrDefault(category, 0L);
    }

    @Override
    public void setNextTime(ActionCategory category, long epochMillis) {
        nextTimes.put(category, epochMillis);
    }

    @Override
    public void clear() {
        nextTimes.clear();
    }
}
