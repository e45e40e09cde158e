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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Definition of a named read model: an initial state and an explicit
 * dispatch table from event type to {@link ProjectionHandler}.
 * <p>
 * The table is fixed when the projection is built. Event types without an
 * entry are ignored by this projection.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Projection balances = Projection.builder("balances")
 *     .on("Deposited", (state, event) -> ...)
 *     .on("Withdrawn", (state, event) -> ...)
 *     .build();
 * store.registerProjection(balances);
 * }</pre>
 */
public final class Projection {

    private final String name;
    private final JsonNode initialState;
    private final Map<String, ProjectionHandler> handlers;

    private Projection(Builder builder) {
        this.name = builder.name;
        this.initialState = builder.initialState.deepCopy();
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
    }

    /**
     * Creates a projection with an empty object as initial state.
     *
     * @param name     projection name
     * @param handlers dispatch table, copied
     * @return the projection
     */
    public static Projection of(String name, Map<String, ProjectionHandler> handlers) {
        Objects.requireNonNull(handlers, "handlers");
        Builder builder = builder(name);
        handlers.forEach(builder::on);
        return builder.build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /** Returns a private copy of the initial state. */
    public JsonNode initialState() {
        return initialState.deepCopy();
    }

    /** Handler for {@code eventType}, or {@code null} when this projection ignores it. */
    public ProjectionHandler handlerFor(String eventType) {
        return handlers.get(eventType);
    }

    public Set<String> eventTypes() {
        return handlers.keySet();
    }

    @Override
    public String toString() {
        return "Projection{name=" + name + ", eventTypes=" + handlers.keySet() + '}';
    }

    /** Builder for {@link Projection}. */
    public static final class Builder {
        private final String name;
        private JsonNode initialState = JsonNodeFactory.instance.objectNode();
        private final Map<String, ProjectionHandler> handlers = new LinkedHashMap<>();

        private Builder(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("projection name cannot be blank");
            }
            this.name = name;
        }

        /** Sets the state a reset or replay starts from (default: empty object). */
        public Builder initialState(JsonNode initialState) {
            this.initialState = Objects.requireNonNull(initialState, "initialState");
            return this;
        }

        /**
         * Routes {@code eventType} to {@code handler}.
         *
         * @throws IllegalArgumentException if the type already has a handler
         */
        public Builder on(String eventType, ProjectionHandler handler) {
            Objects.requireNonNull(eventType, "eventType");
            Objects.requireNonNull(handler, "handler");
            if (handlers.putIfAbsent(eventType, handler) != null) {
                throw new IllegalArgumentException("Duplicate handler for event type '" + eventType
                        + "' in projection '" + name + "'");
            }
            return this;
        }

        public Projection build() {
            return new Projection(this);
        }
    }
}
