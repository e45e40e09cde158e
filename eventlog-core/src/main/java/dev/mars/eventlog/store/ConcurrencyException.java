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

/**
 * Thrown when an append names an expected version that differs from the
 * aggregate's current version. The stream is left unchanged.
 * <p>
 * The store never retries on its own. Re-read the aggregate (or at least
 * {@link EventStore#getAggregateVersion(String)}) and retry with the new
 * version, or use {@link EventStores#appendWithRetry}.
 */
public class ConcurrencyException extends RuntimeException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion) {
        super("Concurrency conflict on aggregate " + aggregateId
                + ": expected version " + expectedVersion + ", actual version " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
