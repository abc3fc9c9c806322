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

package org.fireflyframework.combat.scheduler;

import org.fireflyframework.combat.actor.CombatActor;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Scheduler bookkeeping for one actor in combat.
 * <p>
 * Holds the actor weakly. Pending resolutions are kept in scheduling order and
 * guarded by this instance.
 */
public final class ActiveParticipant {

    private final String actorId;
    private final WeakReference<CombatActor> actorRef;
    private final List<PendingResolution> pending = new ArrayList<>();
    private volatile long lastActivity;
    private volatile long nextActionTime;

    ActiveParticipant(CombatActor actor, long now) {
        this.actorId = actor.getId();
        this.actorRef = new WeakReference<>(actor);
        this.lastActivity = now;
    }

    public String getActorId() {
        return actorId;
    }

    /**
     * The actor, or {@code null} once it has been reclaimed.
     */
    public CombatActor getActor() {
        return actorRef.get();
    }

    public boolean isActorValid() {
        CombatActor actor = actorRef.get();
        return actor != null && actor.isValid();
    }

    public long getLastActivity() {
        return lastActivity;
    }

    void touch(long now) {
        lastActivity = now;
    }

    public long getNextActionTime() {
        return nextActionTime;
    }

    void setNextActionTime(long nextActionTime) {
        this.nextActionTime = nextActionTime;
    }

    synchronized void addPending(PendingResolution resolution) {
        pending.add(resolution);
    }

    /**
     * Removes and returns the resolutions due at {@code now}, oldest first.
     */
    synchronized List<PendingResolution> drainDue(long now) {
        if (pending.isEmpty()) {
            return List.of();
        }
        List<PendingResolution> due = new ArrayList<>();
        Iterator<PendingResolution> it = pending.iterator();
        while (it.hasNext()) {
            PendingResolution resolution = it.next();
            if (resolution.isDue(now)) {
                due.add(resolution);
                it.remove();
            }
        }
        return due;
    }

    synchronized int clearPending() {
        int count = pending.size();
        pending.clear();
        return count;
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }

    public synchronized List<PendingResolution> getPending() {
        return List.copyOf(pending);
    }
}
