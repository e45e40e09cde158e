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
package dev.mars.eventlog.demo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.eventlog.EventStoreConfig;
import dev.mars.eventlog.journal.FileEventJournal;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.projection.Projection;
import dev.mars.eventlog.projection.ProjectionView;
import dev.mars.eventlog.store.AppendOptions;
import dev.mars.eventlog.store.DefaultEventStore;
import dev.mars.eventlog.store.EventStores;

import java.util.List;

/**
 * Demo entry point for a file-backed event store.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Opening a store over a {@link FileEventJournal}</li>
 *   <li>Replaying events stored by earlier runs</li>
 *   <li>Appending account events with an expected version</li>
 *   <li>Automatic snapshots and aggregate rebuild</li>
 *   <li>A projection over all accounts</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link EventStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Deventlog.dataDir=/path -Deventlog.snapshotInterval=5 ...}</li>
 *   <li>Environment variables: {@code EVENTLOG_DATA_DIR, EVENTLOG_SNAPSHOT_INTERVAL, ...}</li>
 *   <li>Properties file: {@code eventlog.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl eventlog-demo -am
 *
 * # Run with default configuration
 * java -jar eventlog-demo/target/eventlog-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI data directory override
 * java -jar eventlog-demo/target/eventlog-demo-1.0-SNAPSHOT.jar /path/to/data
 *
 * # Snapshot every 4 versions
 * java -Deventlog.snapshotInterval=4 -jar eventlog-demo/target/eventlog-demo-1.0-SNAPSHOT.jar
 * </pre>
 *
 * @see EventStoreConfig
 */
public class EventLogDemo {

    static final String ACCOUNT = "acct-demo";

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|           EventLog Demo               |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        EventStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? EventStoreConfig.builder().dataDir(args[0]).build()
                : EventStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (DefaultEventStore store = DefaultEventStore.builder()
                .config(config)
                .journal(new FileEventJournal(config))
                .snapshotReducer(EventLogDemo::applyAccountEvent)
                .build()) {
            System.out.println("[OK] Store opened at: " + config.dataDir().toAbsolutePath());

            List<Event> existing = store.getEvents(ACCOUNT);
            System.out.println("[OK] Replayed " + existing.size() + " existing events for " + ACCOUNT);
            if (!existing.isEmpty()) {
                System.out.println("\n  Last events in stream:");
                for (int i = Math.max(0, existing.size() - 3); i < existing.size(); i++) {
                    printEvent(existing.get(i));
                }
            }

            ProjectionView totals = store.registerProjection(Projection.builder("balances")
                    .on("Opened", EventLogDemo::applyBalance)
                    .on("Deposited", EventLogDemo::applyBalance)
                    .on("Withdrawn", EventLogDemo::applyBalance)
                    .build());
            System.out.println("\n[OK] Projection '" + totals.name() + "' replayed "
                    + totals.eventsApplied() + " events");

            long version = store.getAggregateVersion(ACCOUNT);
            if (version == 0) {
                store.appendEvent(ACCOUNT, "Opened", JSON.objectNode().put("owner", "demo"),
                        AppendOptions.builder().expectedVersion(0).metadata("source", "EventLogDemo").build());
            }
            EventStores.appendWithRetry(store, ACCOUNT, 3, v -> store.appendEvent(ACCOUNT, "Deposited",
                    JSON.objectNode().put("amount", 100), AppendOptions.expectVersion(v)));
            EventStores.appendWithRetry(store, ACCOUNT, 3, v -> store.appendEvent(ACCOUNT, "Withdrawn",
                    JSON.objectNode().put("amount", 30), AppendOptions.expectVersion(v)));

            List<Event> appended = store.getEvents(ACCOUNT, version + 1);
            System.out.println("\n[OK] Appended " + appended.size() + " events, " + ACCOUNT
                    + " now at version " + store.getAggregateVersion(ACCOUNT));
            for (Event event : appended) {
                printEvent(event);
            }

            System.out.println("\n[OK] Snapshot: " + store.getSnapshot(ACCOUNT)
                    .map(s -> "version=" + s.version() + " state=" + s.state())
                    .orElse("(none yet, interval=" + config.snapshotInterval() + ")"));
            System.out.println("[OK] Rebuilt " + ACCOUNT + ": "
                    + store.rebuildAggregate(ACCOUNT, EventLogDemo::applyAccountEvent));
            System.out.println("[OK] Projection state: " + totals.state());

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  EventLog demo complete!              |");
            System.out.println("|  Run again to see events replayed.    |");
            System.out.println("+---------------------------------------+");
        }
    }

    static JsonNode applyAccountEvent(JsonNode state, Event event) {
        ObjectNode next = state.deepCopy();
        JsonNode payload = event.payload();
        switch (event.type()) {
            case "Opened" -> {
                next.put("owner", payload.path("owner").asText());
                next.put("balance", 0L);
            }
            case "Deposited" -> next.put("balance", next.path("balance").asLong() + payload.path("amount").asLong());
            case "Withdrawn" -> next.put("balance", next.path("balance").asLong() - payload.path("amount").asLong());
            default -> {
                return state;
            }
        }
        next.put("version", event.version());
        return next;
    }

    private static JsonNode applyBalance(JsonNode state, Event event) {
        ObjectNode next = state.deepCopy();
        JsonNode account = applyAccountEvent(next.path(event.aggregateId()).isObject()
                ? next.get(event.aggregateId()) : JSON.objectNode(), event);
        next.set(event.aggregateId(), account);
        return next;
    }

    private static void printEvent(Event event) {
        System.out.printf("    [%d] v%d %s %s%n",
                event.globalPosition(), event.version(), event.type(), event.payload());
    }
}
