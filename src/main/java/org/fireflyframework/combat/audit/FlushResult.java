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

import java.time.Instant;

/**
 * Outcome of one audit flush.
 *
 * @param success        whether the buffer was written or was already empty
 * @param entriesWritten number of entries written and removed from the buffer
 * @param file           file written to, null when nothing was written
 * @param message        failure or skip reason, null on success
 * @param timestamp      when the flush finished
 */
public record FlushResult(
        boolean success,
        int entriesWritten,
        String file,
        String message,
        Instant timestamp
) {

    public static FlushResult written(int entries, String file, Instant timestamp) {
        return new FlushResult(true, entries, file, null, timestamp);
    }

    public static FlushResult nothingToFlush(Instant timestamp) {
        return new FlushResult(true, 0, null, null, timestamp);
    }

    public static FlushResult skipped(String reason, Instant timestamp) {
        return new FlushResult(false, 0, null, reason, timestamp);
    }

    public static FlushResult failed(String error, Instant timestamp) {
        return new FlushResult(false, 0, null, error, timestamp);
    }
}
