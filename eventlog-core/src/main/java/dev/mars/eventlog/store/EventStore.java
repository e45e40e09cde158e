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
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;
import dev.mars.eventlog.projection.Projection;
import dev.mars.eventlog.projection.ProjectionHandler;
import dev.mars.eventlog.projection.ProjectionView;
import dev.mars.eventlog.subscription.EventSubscriber;
import dev.mars.eventlog.subscription.Subscription;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Event-sourcing store: per-aggregate append-only streams with optimistic
 * concurrency control, idempotent writes, snapshots, projections and
 * asynchronous subscribers.
 * <p>
 * <b>Write Path:</b> an append is checked against the idempotency guard and the
 * expected version, then committed: it receives the next version of its
 * aggregate and the next global position, is stored, is applied to every
 * projection and is queued for every subscriber. Either all of that happens
 * or none of it does. Every {@code snapshotInterval} versions a snapshot of the
 * aggregate is taken before the append returns.
 * <p>
 * <b>Concurrency:</b> appends to one aggregate are serialized; appends to
 * different aggregates validate in parallel and are then committed one at a
 * time, which makes global position order a total order that projections and
 * subscribers observe. Reads take no store lock and never wait for writers of
 * other aggregates; a read of an aggregate being appended to may wait for that
 * single append to finish.
 * <p>
 * <b>Errors:</b> only {@link ConcurrencyException}, argument errors and backend
 * failures reach the writer. Projection and subscriber failures are logged and
 * isolated.
 *
 * @see DefaultEventStore
 */
public interface EventStore extends Closeable {

    // ========================================================================
    // Streams
    // ========================================================================

    /**
     * Appends an event with default options: no version check and a generated event id.
     *
     * @see #appendEvent(String, String, JsonNode, AppendOptions)
     */
    default Optional<Event> appendEvent(String aggregateId, String type, JsonNode payload) {
        return appendEvent(aggregateId, type, payload, AppendOptions.defaults());
    }

    /**
     * Appends an event to the stream of {@code aggregateId}.
     *
     * @param aggregateId the aggregate
     * @param type        the event type
     * @param payload     event data; deep-copied, later changes by the caller are not seen
     * @param options     expected version, event id and metadata
     * @return the stored event, or empty if {@code options.eventId()} was already appended
     * @throws ConcurrencyException     if the expected version does not match
     * @throws IllegalArgumentException if {@code aggregateId} or {@code type} is blank
     * @throws IllegalStateException    if the store is closed
     */
    Optional<Event> appendEvent(String aggregateId, String type, JsonNode payload, AppendOptions options);

    /** All events of an aggregate, in version order. */
    default List<Event> getEvents(String aggregateId) {
        return getEvents(aggregateId, 1);
    }

    /**
     * Events of an aggregate with {@code version >= fromVersion}, in version order.
     * Unknown aggregates yield an empty list.
     *
     * @throws IllegalArgumentException if {@code fromVersion < 1}
     */
    List<Event> getEvents(String aggregateId, long fromVersion);

    /** Every event in global position order. */
    default List<Event> getAllEvents() {
        return getAllEvents(1);
    }

    /**
     * Events with {@code globalPosition >= fromPosition}, in global position order.
     *
     * @throws IllegalArgumentException if {@code fromPosition < 1}
     */
    List<Event> getAllEvents(long fromPosition);

    /** Number of events in the aggregate's stream, 0 if it has none. */
    long getAggregateVersion(String aggregateId);

    /** Global position of the last appended event, 0 if the store is empty. */
    long getGlobalPosition();

    // ========================================================================
    // Snapshots
    // ========================================================================

    /**
     * Stores {@code state} as the snapshot of {@code aggregateId} at {@code version},
     * replacing any earlier snapshot.
     *
     * @throws IllegalArgumentException if {@code version} is negative or beyond the current version
     */
    void saveSnapshot(String aggregateId, long version, JsonNode state);

    /** The newest snapshot of an aggregate, if any. */
    Optional<Snapshot> getSnapshot(String aggregateId);

    // ========================================================================
    // Projections
    // ========================================================================

    /**
     * Registers a projection and replays all stored events into it before
     * returning. A projection with the same name is replaced.
     *
     * @return a live read-only view of the projection
     */
    ProjectionView registerProjection(Projection projection);

    /**
     * Registers a projection with an empty-object initial state.
     *
     * @see #registerProjection(Projection)
     */
    default ProjectionView registerProjection(String name, Map<String, ProjectionHandler> handlers) {
        return registerProjection(Projection.of(name, handlers));
    }

    /**
     * Resets a projection to its initial state and replays all stored events.
     *
     * @return {@code false} if no projection of that name is registered
     */
    boolean replayProjection(String name);

    /**
     * @return {@code false} if no projection of that name was registered
     */
    boolean unregisterProjection(String name);

    Optional<ProjectionView> getProjection(String name);

    // ========================================================================
    // Subscribers
    // ========================================================================

    /**
     * Delivers every event appended from now on to {@code subscriber},
     * asynchronously and in global order. Earlier events are not replayed.
     *
     * @return the handle used to unsubscribe
     */
    Subscription subscribe(EventSubscriber subscriber);

    // ========================================================================
    // Rebuild
    // ========================================================================

    /**
     * Rebuilds aggregate state starting from an empty object.
     *
     * @see #rebuildAggregate(String, AggregateReducer, JsonNode)
     */
    default JsonNode rebuildAggregate(String aggregateId, AggregateReducer reducer) {
        return rebuildAggregate(aggregateId, reducer, null);
    }

    /**
     * Rebuilds aggregate state: starts from the latest snapshot if there is
     * one, otherwise from {@code initialState}, and folds the remaining events
     * through {@code reducer}. Does not modify the store.
     *
     * @param initialState starting state when no snapshot exists; {@code null} means an empty object
     */
    JsonNode rebuildAggregate(String aggregateId, AggregateReducer reducer, JsonNode initialState);

    /**
     * Stops accepting writes, drains subscriber queues and closes the journal.
     * Idempotent.
     */
    @Override
    void close();
}
