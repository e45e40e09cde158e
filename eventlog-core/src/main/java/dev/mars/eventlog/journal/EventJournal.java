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
package dev.mars.eventlog.journal;

import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Storage backend for the event log and the snapshot table.
 * <p>
 * This interface abstracts persistence for the event store, allowing the
 * in-memory journal used in tests and embedded setups to be swapped for a
 * durable one ({@link FileEventJournal}) without touching store logic.
 * <p>
 * <b>Append Contract:</b> the store hands events over in commit order.
 * Every appended event must carry {@code globalPosition == lastPosition() + 1}
 * and {@code version == streamVersion(aggregateId) + 1}; a journal rejects
 * anything else with a {@link JournalException} and leaves its state unchanged.
 * <p>
 * Reads must be safe to call concurrently with appends and must never return
 * a partially appended event.
 *
 * @see InMemoryEventJournal
 * @see FileEventJournal
 */
public interface EventJournal extends Closeable {

    /**
     * Opens the journal, recovering any existing state. Idempotent.
     */
    void open();

    // ========================================================================
    // Event Log
    // ========================================================================

    /**
     * Appends one event to its aggregate stream and to the global log.
     * <p>
     * When this method returns normally the event is visible to all readers
     * (and, for durable journals, written according to their sync policy).
     *
     * @param event the event to append
     * @throws JournalException if the event is out of sequence or cannot be written
     */
    void append(Event event);

    /**
     * Returns the events of one aggregate with {@code version >= fromVersion},
     * in version order. Unknown aggregates yield an empty list.
     *
     * @param aggregateId the aggregate
     * @param fromVersion first version to include (values below 1 are treated as 1)
     * @return an immutable list, never {@code null}
     */
    List<Event> readStream(String aggregateId, long fromVersion);

    /**
     * Returns all events with {@code globalPosition >= fromPosition}, in global order.
     *
     * @param fromPosition first position to include (values below 1 are treated as 1)
     * @return an immutable list, never {@code null}
     */
    List<Event> readAll(long fromPosition);

    /**
     * Current version of a stream: the number of events it holds (0 if none).
     */
    long streamVersion(String aggregateId);

    /**
     * Position of the last appended event (0 if the journal is empty).
     */
    long lastPosition();

    // ========================================================================
    // Snapshots
    // ========================================================================

    /**
     * Stores a snapshot, replacing any previous one for the same aggregate.
     *
     * @param snapshot the snapshot to keep
     */
    void saveSnapshot(Snapshot snapshot);

    /**
     * Loads the newest snapshot of an aggregate.
     *
     * @param aggregateId the aggregate
     * @return the snapshot, or empty if none was saved
     */
    Optional<Snapshot> loadSnapshot(String aggregateId);

    /**
     * Closes the journal, releasing all resources.
     * <p>
     * After close, no other methods should be called.
     */
    @Override
    void close();
}
