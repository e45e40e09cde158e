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

import dev.mars.eventlog.EventStoreConfig;
import dev.mars.eventlog.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * Factory and helper methods for {@link EventStore}.
 */
public final class EventStores {

    private static final Logger LOG = LoggerFactory.getLogger(EventStores.class);

    private EventStores() {
    }

    /** An in-memory store with configuration resolved by {@link EventStoreConfig#load()}. */
    public static EventStore inMemory() {
        return inMemory(EventStoreConfig.load());
    }

    public static EventStore inMemory(EventStoreConfig config) {
        return DefaultEventStore.builder().config(config).build();
    }

    /**
     * Runs an optimistic append until it succeeds or {@code maxAttempts} is
     * reached. Each attempt is given the aggregate's version as read just
     * before the attempt, to be passed as the expected version:
     *
     * <pre>{@code
     * EventStores.appendWithRetry(store, "acct-1", 5, version ->
     *     store.appendEvent("acct-1", "Deposited", payload, AppendOptions.expectVersion(version)));
     * }</pre>
     *
     * @param attempt performs one append given the current version
     * @return the result of the first attempt that did not conflict
     * @throws ConcurrencyException from the last attempt when every attempt conflicted
     */
    public static Optional<Event> appendWithRetry(EventStore store, String aggregateId, int maxAttempts,
                                                  LongFunction<Optional<Event>> attempt) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(attempt, "attempt");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        ConcurrencyException last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            long version = store.getAggregateVersion(aggregateId);
            try {
                return attempt.apply(version);
            } catch (ConcurrencyException e) {
                last = e;
                LOG.debug("Attempt {}/{} on {} conflicted: expected {}, actual {}",
                        i, maxAttempts, aggregateId, e.expectedVersion(), e.actualVersion());
            }
        }
        throw last;
    }
}
