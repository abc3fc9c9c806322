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

package org.fireflyframework.combat.timing;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active timing provider used for scheduling and the reference
 * provider used for shadow comparison. The active provider may be swapped
 * at runtime.
 */
@Slf4j
public class TimingProviderRegistry {

    private final AtomicReference<TimingProvider> active;
    private final AtomicReference<TimingProvider> reference;

    public TimingProviderRegistry(TimingProvider active, TimingProvider reference) {
        if (active == null) {
            throw new IllegalArgumentException("Active timing provider must not be null");
        }
        this.active = new AtomicReference<>(active);
        this.reference = new AtomicReference<>(reference);
    }

    public TimingProvider getActive() {
        return active.get();
    }

    /**
     * Replaces the active provider and returns the previous one.
     */
    public TimingProvider setActive(TimingProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("Active timing provider must not be null");
        }
        TimingProvider previous = active.getAndSet(provider);
        log.info("Active timing provider changed from {} to {}",
                previous.getProviderName(), provider.getProviderName());
        return previous;
    }

    /**
     * The reference provider, or {@code null} when shadow comparison has none.
     */
    public TimingProvider getReference() {
        return reference.get();
    }

    public void setReference(TimingProvider provider) {
        reference.set(provider);
    }
}
