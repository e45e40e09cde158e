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
package dev.mars.eventlog.projection;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.eventlog.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maintains the registered projections.
 * <p>
 * The engine does not read history itself: the caller supplies it on
 * {@link #register} and {@link #replay}. The caller must also serialize
 * {@code register}, {@code replay} and {@link #update} so that each projection
 * sees every event exactly once and in global order.
 * <p>
 * A failing handler never propagates. It is logged with the projection name
 * and event id, counted on the projection, and the event is skipped for that
 * projection only. Replay and incremental updates apply the same rule, so a
 * replayed projection ends in the same state as one updated event by event.
 */
public final class ProjectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectionEngine.class);

    private final Map<String, ProjectionState> projections = new ConcurrentHashMap<>();

    /**
     * Registers {@code projection}, replacing any projection of the same name,
     * and folds {@code history} into it.
     *
     * @param projection the projection definition
     * @param history    every stored event in ascending global position
     * @return a live view of the projection
     */
    public ProjectionView register(Projection projection, List<Event> history) {
        Objects.requireNonNull(projection, "projection");
        ProjectionState state = new ProjectionState(projection);
        ProjectionState previous = projections.put(projection.name(), state);
        if (previous != null) {
            LOG.info("Projection '{}' replaced", projection.name());
        }
        state.replay(history);
        LOG.info("Projection '{}' registered: {} events applied, {} failures, position {}",
                projection.name(), state.eventsApplied(), state.failures(), state.lastPosition());
        return state;
    }

    /**
     * Removes a projection. Its views keep their last state.
     *
     * @return {@code true} if a projection of that name existed
     */
    public boolean unregister(String name) {
        boolean removed = projections.remove(name) != null;
        if (removed) {
            LOG.info("Projection '{}' unregistered", name);
        }
        return removed;
    }

    /**
     * Resets a projection to its initial state and folds {@code history} into it.
     *
     * @return {@code false} if no projection of that name is registered
     */
    public boolean replay(String name, List<Event> history) {
        ProjectionState state = projections.get(name);
        if (state == null) {
            LOG.debug("Replay requested for unknown projection '{}'", name);
            return false;
        }
        state.replay(history);
        LOG.info("Projection '{}' replayed: {} events applied, {} failures, position {}",
                name, state.eventsApplied(), state.failures(), state.lastPosition());
        return true;
    }

    /**
     * Offers one newly appended event to every projection.
     */
    public void update(Event event) {
        for (ProjectionState state : projections.values()) {
            state.apply(event);
        }
    }

    public Optional<ProjectionView> get(String name) {
        return Optional.ofNullable(projections.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(projections.keySet());
    }

    /**
     * Mutable state of one projection, guarded by its own monitor so that
     * readers never observe a handler halfway through.
     */
    private static final class ProjectionState implements ProjectionView {
        private final Projection definition;
        private JsonNode state;
        private long lastPosition;
        private long eventsApplied;
        private long failures;

        ProjectionState(Projection definition) {
            this.definition = definition;
            this.state = definition.initialState();
        }

        synchronized void replay(Collection<Event> history) {
            state = definition.initialState();
            lastPosition = 0;
            eventsApplied = 0;
            failures = 0;
            for (Event event : history) {
                apply(event);
            }
        }

        synchronized void apply(Event event) {
            if (event.globalPosition() <= lastPosition) {
                LOG.warn("Projection '{}' skipped event {} at position {}: already at position {}",
                        definition.name(), event.eventId(), event.globalPosition(), lastPosition);
                return;
            }
            lastPosition = event.globalPosition();
            ProjectionHandler handler = definition.handlerFor(event.type());
            if (handler == null) {
                return;
            }
            try {
                JsonNode next = handler.apply(state.deepCopy(), event);
                if (next == null) {
                    throw new IllegalStateException("handler for '" + event.type() + "' returned null state");
                }
                state = next;
                eventsApplied++;
            } catch (RuntimeException e) {
                failures++;
                LOG.error("Projection '{}' failed on event {} (type={}, aggregateId={}, position={}): {}",
                        definition.name(), event.eventId(), event.type(), event.aggregateId(),
                        event.globalPosition(), e.getMessage(), e);
            }
        }

        @Override
        public String name() {
            return definition.name();
        }

        @Override
        public synchronized JsonNode state() {
            return state.deepCopy();
        }

        @Override
        public synchronized long lastPosition() {
            return lastPosition;
        }

        @Override
        public synchronized long eventsApplied() {
            return eventsApplied;
        }

        @Override
        public synchronized long failures() {
            return failures;
        }

        @Override
        public String toString() {
            return "ProjectionView{name=" + definition.name() + ", lastPosition=" + lastPosition() + '}';
        }
    }
}
