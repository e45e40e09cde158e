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
package dev.mars.eventlog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.projection.Projection;
import dev.mars.eventlog.projection.ProjectionView;
import dev.mars.eventlog.store.AggregateReducer;
import dev.mars.eventlog.store.AppendOptions;
import dev.mars.eventlog.store.ConcurrencyException;
import dev.mars.eventlog.store.EventStore;
import dev.mars.eventlog.store.EventStores;

import java.util.Optional;

/**
 * Quickstart for the in-memory event store.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Appending events with generated and caller supplied ids</li>
 *   <li>Rejecting a stale expected version</li>
 *   <li>Skipping a re-submitted event</li>
 *   <li>Rebuilding an aggregate and reading a projection</li>
 * </ul>
 */
public class Main {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public static void main(String[] args) {
        System.out.println("EventLog Quickstart");
        System.out.println("===================\n");

        try (EventStore store = EventStores.inMemory()) {
            ProjectionView names = store.registerProjection(Projection.builder("account-names")
                    .on("Created", Main::recordName)
                    .on("Renamed", Main::recordName)
                    .build());
            System.out.println("✓ Registered projection: " + names.name());

            store.appendEvent("acct-1", "Created", name("x"));
            Event renamed = store.appendEvent("acct-1", "Renamed", name("y"),
                    AppendOptions.builder().eventId("rename-1").expectedVersion(1).build()).orElseThrow();
            store.appendEvent("acct-1", "Renamed", name("z"), AppendOptions.expectVersion(2));
            System.out.println("✓ Appended 3 events, version=" + store.getAggregateVersion("acct-1"));

            try {
                store.appendEvent("acct-1", "Renamed", name("stale"), AppendOptions.expectVersion(1));
            } catch (ConcurrencyException e) {
                System.out.println("✓ Stale write rejected: " + e.getMessage());
            }

            Optional<Event> duplicate = store.appendEvent("acct-1", "Renamed", name("y"),
                    AppendOptions.withEventId(renamed.eventId()));
            System.out.println("✓ Re-submitted " + renamed.eventId() + " skipped: " + duplicate.isEmpty()
                    + ", version=" + store.getAggregateVersion("acct-1"));

            AggregateReducer reducer = (state, event) -> {
                ObjectNode next = state.deepCopy();
                next.set("name", event.payload().get("name"));
                return next;
            };
            System.out.println("✓ Rebuilt acct-1: " + store.rebuildAggregate("acct-1", reducer));
            System.out.println("✓ Projection state: " + names.state());

            System.out.println("\n✓ Quickstart complete!");
        }
    }

    private static JsonNode name(String value) {
        return JSON.objectNode().put("name", value);
    }

    private static JsonNode recordName(JsonNode state, Event event) {
        ObjectNode next = state.deepCopy();
        next.set(event.aggregateId(), event.payload().get("name"));
        return next;
    }
}
