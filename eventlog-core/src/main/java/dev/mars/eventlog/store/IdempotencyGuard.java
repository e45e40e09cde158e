/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.eventlog.store;

import dev.mars.eventlog.model.Event;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which event ids have been appended so that re-submitting a write
 * is a no-op.
 * <p>
 * Ids are kept for the life of the store. A store opened on an existing
 * journal seeds the guard from the journal's events, so idempotency holds
 * across restarts of a durable store.
 * <p>
 * This class is thread-safe.
 */
public final class IdempotencyGuard {

    private final Set<String> processed = ConcurrentHashMap.newKeySet();

    /** Whether {@code eventId} has already been appended. */
    public boolean isProcessed(String eventId) {
        return processed.contains(eventId);
    }

    /**
     * Marks {@code eventId} as appended.
     *
     * @return {@code true} if the id was new, {@code false} if another append already claimed it
     */
    public boolean tryMark(String eventId) {
        return processed.add(eventId);
    }

    /**
     * Forgets {@code eventId}. Used to roll back a mark when the append that
     * claimed it could not be stored.
     */
    public void release(String eventId) {
        processed.remove(eventId);
    }

    void seed(Iterable<Event> events) {
        for (Event event : events) {
            processed.add(event.eventId());
        }
    }

    public int size() {
        return processed.size();
    }
}
