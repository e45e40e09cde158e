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

import com.fasterxml.jackson.databind.JsonNode;
import com.github.f4b6a3.ulid.UlidCreator;
import dev.mars.eventlog.EventStoreConfig;
import dev.mars.eventlog.journal.EventJournal;
import dev.mars.eventlog.journal.InMemoryEventJournal;
import dev.mars.eventlog.journal.JournalException;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;
import dev.mars.eventlog.projection.Projection;
import dev.mars.eventlog.projection.ProjectionEngine;
import dev.mars.eventlog.projection.ProjectionView;
import dev.mars.eventlog.subscription.EventSubscriber;
import dev.mars.eventlog.subscription.SubscriberBus;
import dev.mars.eventlog.subscription.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link EventStore} over an {@link EventJournal}.
 * <p>
 * <b>Locking:</b>
 * <ul>
 *   <li>Aggregate lock: held for the idempotency re-check, the version check,
 *       the commit and the cadence snapshot of one aggregate.</li>
 *   <li>Commit lock: store-wide, always taken inside an aggregate lock. Assigns
 *       the global position and runs the journal append, the idempotency mark,
 *       projection updates and subscriber enqueue as one step.</li>
 * </ul>
 * Projection registration and replay take only the commit lock, so a replay
 * never interleaves with a live update.
 * <p>
 * Opening a store opens its journal. The global sequence and the idempotency
 * guard are seeded from the events the journal already holds.
 *
 * <pre>{@code
 * EventStore store = DefaultEventStore.builder()
 *     .config(EventStoreConfig.load())
 *     .journal(new FileEventJournal(config))
 *     .snapshotReducer(AccountReducer::apply)
 *     .build();
 * }</pre>
 */
public final class DefaultEventStore implements EventStore {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultEventStore.class);

    private final EventStoreConfig config;
    private final Clock clock;
    private final EventJournal journal;
    private final AggregateReducer snapshotReducer;
    private final JsonNode snapshotInitialState;

    private final IdempotencyGuard guard = new IdempotencyGuard();
    private final AggregateLocks aggregateLocks = new AggregateLocks();
    private final ReentrantLock commitLock = new ReentrantLock();
    private final AtomicLong sequence;
    private final ProjectionEngine projectionEngine = new ProjectionEngine();
    private final SubscriberBus subscriberBus;
    private final AggregateRebuilder rebuilder;

    private volatile boolean closed;

    private DefaultEventStore(Builder builder) {
        this.config = builder.config != null ? builder.config : EventStoreConfig.builder().build();
        this.clock = builder.clock;
        this.journal = builder.journal != null ? builder.journal : new InMemoryEventJournal();
        this.snapshotReducer = builder.snapshotReducer;
        this.snapshotInitialState = builder.snapshotInitialState;

        journal.open();
        this.sequence = new AtomicLong(journal.lastPosition());
        guard.seed(journal.readAll(1));
        this.subscriberBus = new SubscriberBus(config.subscriberThreads(), config.drainTimeoutMs());
        this.rebuilder = new AggregateRebuilder(journal, clock);

        if (config.snapshotsEnabled() && snapshotReducer == null) {
            LOG.warn("snapshotInterval={} but no snapshot reducer configured; automatic snapshots are disabled",
                    config.snapshotInterval());
        }
        LOG.info("EventStore opened: journal={}, position={}, knownEventIds={}, {}",
                journal.getClass().getSimpleName(), sequence.get(), guard.size(), config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Streams
    // ========================================================================

    @Override
    public Optional<Event> appendEvent(String aggregateId, String type, JsonNode payload, AppendOptions options) {
        requireId(aggregateId, "aggregateId");
        requireId(type, "type");
        Objects.requireNonNull(options, "options");
        ensureOpen();

        String eventId = options.eventId() != null ? options.eventId() : UlidCreator.getMonotonicUlid().toString();
        if (guard.isProcessed(eventId)) {
            LOG.debug("Duplicate event {} for aggregate {} skipped", eventId, aggregateId);
            return Optional.empty();
        }

        ReentrantLock aggregateLock = aggregateLocks.lockFor(aggregateId);
        aggregateLock.lock();
        try {
            // another writer may have committed the same id while we waited
            if (guard.isProcessed(eventId)) {
                LOG.debug("Duplicate event {} for aggregate {} skipped", eventId, aggregateId);
                return Optional.empty();
            }
            long currentVersion = journal.streamVersion(aggregateId);
            options.expectedVersion().verify(aggregateId, currentVersion);

            Optional<Event> committed = commit(eventId, aggregateId, type, payload, options, currentVersion + 1);
            committed.ifPresent(event -> maybeSnapshot(aggregateId, event.version()));
            return committed;
        } finally {
            aggregateLock.unlock();
        }
    }

    private Optional<Event> commit(String eventId, String aggregateId, String type, JsonNode payload,
                                   AppendOptions options, long version) {
        commitLock.lock();
        try {
            ensureOpen();
            if (!guard.tryMark(eventId)) {
                LOG.debug("Duplicate event {} for aggregate {} skipped", eventId, aggregateId);
                return Optional.empty();
            }
            Event event = new Event(eventId, sequence.get() + 1, aggregateId, type, payload,
                    options.metadata(), version, clock.instant());
            try {
                journal.append(event);
            } catch (RuntimeException e) {
                guard.release(eventId);
                LOG.error("Append failed for aggregate {} at version {}: {}", aggregateId, version, e.getMessage());
                throw e;
            }
            sequence.set(event.globalPosition());
            projectionEngine.update(event);
            subscriberBus.publish(event);
            LOG.debug("Appended {} to {} at version {} (position {})",
                    type, aggregateId, version, event.globalPosition());
            return Optional.of(event);
        } finally {
            commitLock.unlock();
        }
    }

    private void maybeSnapshot(String aggregateId, long version) {
        int interval = config.snapshotInterval();
        if (interval == 0 || snapshotReducer == null || version % interval != 0) {
            return;
        }
        try {
            rebuilder.takeSnapshot(aggregateId, snapshotReducer, snapshotInitialState);
        } catch (RuntimeException e) {
            LOG.error("Snapshot of aggregate {} at version {} failed; the event stays committed",
                    aggregateId, version, e);
        }
    }

    @Override
    public List<Event> getEvents(String aggregateId, long fromVersion) {
        requireId(aggregateId, "aggregateId");
        if (fromVersion < 1) {
            throw new IllegalArgumentException("fromVersion must be >= 1, got " + fromVersion);
        }
        return journal.readStream(aggregateId, fromVersion);
    }

    @Override
    public List<Event> getAllEvents(long fromPosition) {
        if (fromPosition < 1) {
            throw new IllegalArgumentException("fromPosition must be >= 1, got " + fromPosition);
        }
        return journal.readAll(fromPosition);
    }

    @Override
    public long getAggregateVersion(String aggregateId) {
        requireId(aggregateId, "aggregateId");
        return journal.streamVersion(aggregateId);
    }

    @Override
    public long getGlobalPosition() {
        return sequence.get();
    }

    // ========================================================================
    // Snapshots
    // ========================================================================

    @Override
    public void saveSnapshot(String aggregateId, long version, JsonNode state) {
        requireId(aggregateId, "aggregateId");
        Objects.requireNonNull(state, "state");
        if (version < 0) {
            throw new IllegalArgumentException("Snapshot version must be >= 0, got " + version);
        }
        ensureOpen();
        ReentrantLock aggregateLock = aggregateLocks.lockFor(aggregateId);
        aggregateLock.lock();
        try {
            long currentVersion = journal.streamVersion(aggregateId);
            if (version > currentVersion) {
                throw new IllegalArgumentException("Snapshot version " + version
                        + " is beyond the current version " + currentVersion + " of aggregate " + aggregateId);
            }
            journal.saveSnapshot(new Snapshot(aggregateId, version, state, clock.instant()));
            LOG.debug("Snapshot saved for {} at version {}", aggregateId, version);
        } finally {
            aggregateLock.unlock();
        }
    }

    @Override
    public Optional<Snapshot> getSnapshot(String aggregateId) {
        requireId(aggregateId, "aggregateId");
        return journal.loadSnapshot(aggregateId);
    }

    // ========================================================================
    // Projections
    // ========================================================================

    @Override
    public ProjectionView registerProjection(Projection projection) {
        Objects.requireNonNull(projection, "projection");
        commitLock.lock();
        try {
            ensureOpen();
            return projectionEngine.register(projection, journal.readAll(1));
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public boolean replayProjection(String name) {
        commitLock.lock();
        try {
            ensureOpen();
            return projectionEngine.replay(name, journal.readAll(1));
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public boolean unregisterProjection(String name) {
        commitLock.lock();
        try {
            return projectionEngine.unregister(name);
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public Optional<ProjectionView> getProjection(String name) {
        return projectionEngine.get(name);
    }

    // ========================================================================
    // Subscribers
    // ========================================================================

    @Override
    public Subscription subscribe(EventSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        // under the commit lock so the first delivered event is the next one committed
        commitLock.lock();
        try {
            ensureOpen();
            return subscriberBus.subscribe(subscriber);
        } finally {
            commitLock.unlock();
        }
    }

    // ========================================================================
    // Rebuild
    // ========================================================================

    @Override
    public JsonNode rebuildAggregate(String aggregateId, AggregateReducer reducer, JsonNode initialState) {
        requireId(aggregateId, "aggregateId");
        return rebuilder.rebuild(aggregateId, reducer, initialState);
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public void close() {
        commitLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            commitLock.unlock();
        }
        subscriberBus.close();
        try {
            journal.close();
        } catch (JournalException e) {
            LOG.error("Failed to close journal", e);
            throw e;
        }
        LOG.info("EventStore closed at position {}", sequence.get());
    }

    public boolean isClosed() {
        return closed;
    }

    /** Number of subscriptions currently receiving events. */
    public int subscriberCount() {
        return subscriberBus.subscriberCount();
    }

    public EventStoreConfig config() {
        return config;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("EventStore is closed");
        }
    }

    private static void requireId(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    /**
     * Builder for {@link DefaultEventStore}.
     */
    public static final class Builder {
        private EventStoreConfig config;
        private Clock clock = Clock.systemUTC();
        private EventJournal journal;
        private AggregateReducer snapshotReducer;
        private JsonNode snapshotInitialState;

        private Builder() {
        }

        /** Store settings. Defaults to {@code EventStoreConfig.builder().build()}. */
        public Builder config(EventStoreConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /** Source of event and snapshot timestamps. Defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Storage backend. Defaults to a new {@link InMemoryEventJournal}.
         * The store owns the journal: it opens it on build and closes it on {@link #close()}.
         */
        public Builder journal(EventJournal journal) {
            this.journal = Objects.requireNonNull(journal, "journal");
            return this;
        }

        /**
         * Reducer used for automatic snapshots every {@code snapshotInterval}
         * versions. Without one no automatic snapshots are taken.
         */
        public Builder snapshotReducer(AggregateReducer snapshotReducer) {
            this.snapshotReducer = snapshotReducer;
            return this;
        }

        /** State the snapshot reducer starts from. Defaults to an empty object. */
        public Builder snapshotInitialState(JsonNode snapshotInitialState) {
            this.snapshotInitialState = snapshotInitialState;
            return this;
        }

        public DefaultEventStore build() {
            return new DefaultEventStore(this);
        }
    }
}
