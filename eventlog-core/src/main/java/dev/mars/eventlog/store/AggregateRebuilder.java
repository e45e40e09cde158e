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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.eventlog.journal.EventJournal;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconstructs aggregate state from the latest snapshot plus the events
 * appended after it.
 * <p>
 * {@link #rebuild} only reads. {@link #takeSnapshot} additionally stores the
 * result; the store calls it while holding the aggregate's lock so the
 * snapshot version is the aggregate's current version.
 */
public final class AggregateRebuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AggregateRebuilder.class);

    private final EventJournal journal;
    private final Clock clock;

    public AggregateRebuilder(EventJournal journal, Clock clock) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Rebuilds the state of {@code aggregateId}.
     *
     * @param aggregateId  the aggregate
     * @param reducer      folds events into state
     * @param initialState state before the first event; {@code null} means an empty object.
     *                     Ignored when a snapshot exists.
     * @return the folded state; {@code initialState} (copied) for an aggregate with no events
     */
    public JsonNode rebuild(String aggregateId, AggregateReducer reducer, JsonNode initialState) {
        return fold(aggregateId, reducer, initialState).state;
    }

    /**
     * Rebuilds the state of {@code aggregateId} and stores it as the aggregate's snapshot.
     *
     * @return the stored snapshot
     */
    public Snapshot takeSnapshot(String aggregateId, AggregateReducer reducer, JsonNode initialState) {
        Folded folded = fold(aggregateId, reducer, initialState);
        Snapshot snapshot = new Snapshot(aggregateId, folded.version, folded.state, clock.instant());
        journal.saveSnapshot(snapshot);
        LOG.debug("Snapshot taken: aggregateId={}, version={}, eventsFolded={}",
                aggregateId, folded.version, folded.eventsFolded);
        return snapshot;
    }

    private Folded fold(String aggregateId, AggregateReducer reducer, JsonNode initialState) {
        Objects.requireNonNull(reducer, "reducer");
        Optional<Snapshot> snapshot = journal.loadSnapshot(aggregateId);

        JsonNode state;
        long version;
        if (snapshot.isPresent()) {
            state = snapshot.get().state();
            version = snapshot.get().version();
        } else {
            state = initialState == null ? JsonNodeFactory.instance.objectNode() : initialState.deepCopy();
            version = 0L;
        }

        List<Event> events = journal.readStream(aggregateId, version + 1);
        for (Event event : events) {
            state = reducer.apply(state, event);
            if (state == null) {
                throw new IllegalStateException("Reducer returned null state for event " + event.eventId()
                        + " (aggregateId=" + aggregateId + ", version=" + event.version() + ")");
            }
            version = event.version();
        }

        LOG.trace("Rebuilt aggregate {}: snapshot={}, eventsFolded={}, version={}",
                aggregateId, snapshot.map(Snapshot::version).orElse(null), events.size(), version);
        return new Folded(state, version, events.size());
    }

    private record Folded(JsonNode state, long version, int eventsFolded) {
    }
}
