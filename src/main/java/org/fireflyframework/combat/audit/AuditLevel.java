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

package org.fireflyframework.combat.audit;

/**
 * Audit detail levels, ordered from least to most verbose.
 */
public enum AuditLevel {

    /**
     * Nothing is recorded.
     */
    NONE,

    /**
     * Swings, casts and hit resolutions.
     */
    STANDARD,

    /**
     * Adds healing and device use, and anomaly warnings.
     */
    DETAILED,

    /**
     * Adds shadow comparisons and performance metrics.
     */
    DEBUG;

    public boolean includes(AuditLevel required) {
        return required != NONE && this.compareTo(required) >= 0;
    }
}
