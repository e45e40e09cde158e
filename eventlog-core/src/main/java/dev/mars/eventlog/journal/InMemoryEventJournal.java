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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-resident implementation of {@link EventJournal}.
 * <p>
 * Nothing survives the process. It is the default journal of the store and
 * also serves as the read index behind {@link FileEventJournal}.
 * <p>
 * <b>Thread Safety:</b>
 * Each aggregate stream is guarded by its own read/write lock, so a reader of
 * one aggregate never waits for a writer of another. The global log has a
 * separate read/write lock that is always taken before a stream lock.
 */
public final class InMemoryEventJournal implements EventJournal {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventJournal.class);

    private final Map<String, EventStream> streams = new ConcurrentHashMap<>();
    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final ReadWriteLock logLock = new ReentrantReadWriteLock();
    private final List<Event> log = new ArrayList<>();

    @Override
    public void open() {
        LOG.debug("In-memory journal ready");
    }

    @Override
    public void append(Event event) {
        logLock.writeLock().lock();
        try {
            verifyAppendable(event);
            streams.computeIfAbsent(event.aggregateId(), id -> new EventStream()).append(event);
            log.add(event);
        } finally {
            logLock.writeLock().unlock();
        }
        LOG.trace("Appended {}", event);
    }

    /**
     * Checks that {@code event} would be accepted by {@link #append(Event)} without appending it.
     *
     * @throws JournalException if the event is out of sequence
     */
    void verifyAppendable(Event event) {
        long expectedPosition = lastPosition() + 1;
        if (event.globalPosition() != expectedPosition) {
            throw new JournalException("Out of sequence append: expected globalPosition "
                    + expectedPosition + " but event " + event.eventId() + " has " + event.globalPosition());
        }
        long expectedVersion = streamVersion(event.aggregateId()) + 1;
        if (event.version() != expectedVersion) {
            throw new JournalException("Out of sequence append for aggregate " + event.aggregateId()
                    + ": expected version " + expectedVersion + " but got " + event.version());
        }
    }

    @Override
    public List<Event> readStream(String aggregateId, long fromVersion) {
        EventStream stream = streams.get(aggregateId);
        if (stream == null) {
            return List.of();
        }
        return stream.read(fromVersion);
    }

    @Override
    public List<Event> readAll(long fromPosition) {
        logLock.readLock().lock();
        try {
            if (fromPosition - 1 >= log.size()) {
                return List.of();
            }
            int from = (int) Math.max(0, fromPosition - 1);
            return List.copyOf(log.subList(from, log.size()));
        } finally {
            logLock.readLock().unlock();
        }
    }

    @Override
    public long streamVersion(String aggregateId) {
        EventStream stream = streams.get(aggregateId);
        return stream == null ? 0L : stream.version();
    }

    @Override
    public long lastPosition() {
        logLock.readLock().lock();
        try {
            return log.size();
        } finally {
            logLock.readLock().unlock();
        }
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        snapshots.put(snapshot.aggregateId(), snapshot);
        LOG.trace("Snapshot stored: aggregateId={}, version={}", snapshot.aggregateId(), snapshot.version());
    }

    @Override
    public Optional<Snapshot> loadSnapshot(String aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    /** Number of aggregates with at least one event. */
    public int aggregateCount() {
        return streams.size();
    }

    @Override
    public void close() {
        LOG.debug("In-memory journal closed: {} events, {} aggregates, {} snapshots",
                lastPosition(), streams.size(), snapshots.size());
    }

    /**
     * One aggregate's events. {@code events.get(i).version() == i + 1} always holds.
     */
    private static final class EventStream {
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private final List<Event> events = new ArrayList<>();

        void append(Event event) {
            lock.writeLock().lock();
            try {
                long expectedVersion = events.size() + 1L;
                if (event.version() != expectedVersion) {
                    throw new JournalException("Out of sequence append for aggregate " + event.aggregateId()
                            + ": expected version " + expectedVersion + " but got " + event.version());
                }
                events.add(event);
            } finally {
                lock.writeLock().unlock();
            }
        }

        List<Event> read(long fromVersion) {
            lock.readLock().lock();
            try {
                // compare as long before narrowing to a list index
                if (fromVersion - 1 >= events.size()) {
                    return List.of();
                }
                int from = (int) Math.max(0, fromVersion - 1);
                return List.copyOf(events.subList(from, events.size()));
            } finally {
                lock.readLock().unlock();
            }
        }

        long version() {
            lock.readLock().lock();
            try {
                return events.size();
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
