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
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.eventlog.EventStoreConfig;
import dev.mars.eventlog.journal.InMemoryEventJournal;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for aggregate rebuild and snapshot production.
 * <p>
 * The central property: rebuilding from a snapshot plus the remaining events
 * yields the same state as folding every event from the initial state.
 */
class AggregateRebuilderTest {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    /** Running balance plus a count of folded events. */
    static final AggregateReducer BALANCE = (state, event) -> {
        ObjectNode next = state.deepCopy();
        long amount = event.payload().path("amount").asLong();
        long balance = next.path("balance").asLong();
        next.put("balance", "Withdrawn".equals(event.type()) ? balance - amount : balance + amount);
        next.put("folded", next.path("folded").asInt() + 1);
        return next;
    };

    private static JsonNode amount(long value) {
        return JSON.objectNode().put("amount", value);
    }

    // ========================================================================
    // Rebuilder
    // ========================================================================

    @Nested
    @DisplayName("AggregateRebuilder")
    class RebuilderTests {

        private InMemoryEventJournal journal;
        private AggregateRebuilder rebuilder;

        @BeforeEach
        void setUp() {
            journal = new InMemoryEventJournal();
            journal.open();
            rebuilder = new AggregateRebuilder(journal, Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        }

        private void append(String aggregateId, String type, long value) {
            long position = journal.lastPosition() + 1;
            long version = journal.streamVersion(aggregateId) + 1;
            journal.append(new Event("e-" + position, position, aggregateId, type, amount(value),
                    Map.of(), version, Instant.EPOCH));
        }

        @Test
        @DisplayName("Unknown aggregate rebuilds to the initial state")
        void testUnknownAggregate() {
            assertEquals(JSON.objectNode(), rebuilder.rebuild("missing", BALANCE, null));
            JsonNode initial = JSON.objectNode().put("balance", 7);
            assertEquals(initial, rebuilder.rebuild("missing", BALANCE, initial));
        }

        @Test
        @DisplayName("Initial state is not modified by the fold")
        void testInitialStateUntouched() {
            append("acct", "Deposited", 10);
            ObjectNode initial = JSON.objectNode().put("balance", 5);

            JsonNode state = rebuilder.rebuild("acct", BALANCE, initial);

            assertEquals(15, state.get("balance").asLong());
            assertEquals(5, initial.get("balance").asLong());
        }

        @Test
        @DisplayName("Rebuild from snapshot equals rebuild from scratch")
        void testSnapshotEquivalence() {
            for (int i = 1; i <= 20; i++) {
                append("acct", i % 4 == 0 ? "Withdrawn" : "Deposited", i);
            }
            JsonNode fromScratch = rebuilder.rebuild("acct", BALANCE, null);

            Snapshot snapshot = rebuilder.takeSnapshot("acct", BALANCE, null);
            assertEquals(20, snapshot.version());
            for (int i = 21; i <= 30; i++) {
                append("acct", "Deposited", i);
            }

            JsonNode withSnapshot = rebuilder.rebuild("acct", BALANCE, null);
            JsonNode expected = fromScratch.deepCopy();
            for (int i = 21; i <= 30; i++) {
                expected = BALANCE.apply(expected, journal.readStream("acct", i).get(0));
            }
            assertEquals(expected, withSnapshot);
            assertEquals(30, withSnapshot.get("folded").asInt());
        }

        @Test
        @DisplayName("Rebuild starts from the snapshot, not from the initial state")
        void testSnapshotUsedAsStart() {
            append("acct", "Deposited", 10);
            append("acct", "Deposited", 20);
            journal.saveSnapshot(new Snapshot("acct", 1, JSON.objectNode().put("balance", 1000), Instant.EPOCH));

            JsonNode state = rebuilder.rebuild("acct", BALANCE, JSON.objectNode().put("balance", -1));
            assertEquals(1020, state.get("balance").asLong());
            assertEquals(1, state.get("folded").asInt());
        }

        @Test
        @DisplayName("Reducer returning null is reported")
        void testNullReducerResult() {
            append("acct", "Deposited", 10);
            assertThrows(IllegalStateException.class, () -> rebuilder.rebuild("acct", (s, e) -> null, null));
        }
    }

    // ========================================================================
    // Snapshot Cadence
    // ========================================================================

    @Nested
    @DisplayName("Snapshot Cadence")
    class CadenceTests {

        private DefaultEventStore newStore(int interval, AggregateReducer reducer) {
            return DefaultEventStore.builder()
                    .config(EventStoreConfig.builder().snapshotInterval(interval).build())
                    .snapshotReducer(reducer)
                    .build();
        }

        @Test
        @DisplayName("A snapshot is taken every snapshotInterval versions")
        void testSnapshotEveryInterval() {
            try (DefaultEventStore store = newStore(5, BALANCE)) {
                for (int i = 1; i <= 4; i++) {
                    store.appendEvent("acct", "Deposited", amount(i));
                }
                assertTrue(store.getSnapshot("acct").isEmpty());

                store.appendEvent("acct", "Deposited", amount(5));
                Snapshot first = store.getSnapshot("acct").orElseThrow();
                assertEquals(5, first.version());
                assertEquals(15, first.state().get("balance").asLong());

                for (int i = 6; i <= 12; i++) {
                    store.appendEvent("acct", "Deposited", amount(i));
                }
                assertEquals(10, store.getSnapshot("acct").orElseThrow().version());
                assertEquals(78, store.rebuildAggregate("acct", BALANCE).get("balance").asLong());
            }
        }

        @Test
        @DisplayName("Cadence counts each aggregate's own versions")
        void testCadencePerAggregate() {
            try (DefaultEventStore store = newStore(3, BALANCE)) {
                for (int i = 0; i < 4; i++) {
                    store.appendEvent("a", "Deposited", amount(1));
                    store.appendEvent("b", "Deposited", amount(1));
                }
                assertEquals(3, store.getSnapshot("a").orElseThrow().version());
                assertEquals(3, store.getSnapshot("b").orElseThrow().version());
            }
        }

        @Test
        @DisplayName("Interval 0 disables snapshots")
        void testIntervalZero() {
            try (DefaultEventStore store = newStore(0, BALANCE)) {
                for (int i = 0; i < 10; i++) {
                    store.appendEvent("acct", "Deposited", amount(1));
                }
                assertTrue(store.getSnapshot("acct").isEmpty());
            }
        }

        @Test
        @DisplayName("No reducer means no automatic snapshots")
        void testNoReducer() {
            try (DefaultEventStore store = newStore(2, null)) {
                store.appendEvent("acct", "Deposited", amount(1));
                store.appendEvent("acct", "Deposited", amount(1));
                assertTrue(store.getSnapshot("acct").isEmpty());
            }
        }

        @Test
        @DisplayName("A failing snapshot reducer does not undo the append")
        void testSnapshotFailureIsolated() {
            AtomicInteger calls = new AtomicInteger();
            AggregateReducer failing = (state, event) -> {
                calls.incrementAndGet();
                throw new IllegalStateException("reducer broken");
            };
            try (DefaultEventStore store = newStore(2, failing)) {
                store.appendEvent("acct", "Deposited", amount(1));
                Event second = store.appendEvent("acct", "Deposited", amount(1)).orElseThrow();

                assertEquals(2, second.version());
                assertEquals(2, store.getAggregateVersion("acct"));
                assertTrue(store.getSnapshot("acct").isEmpty());
                assertEquals(1, calls.get());

                store.appendEvent("acct", "Deposited", amount(1));
                assertEquals(3, store.getAggregateVersion("acct"));
            }
        }

        @Test
        @DisplayName("Configured initial state seeds automatic snapshots")
        void testSnapshotInitialState() {
            try (DefaultEventStore store = DefaultEventStore.builder()
                    .config(EventStoreConfig.builder().snapshotInterval(2).build())
                    .snapshotReducer(BALANCE)
                    .snapshotInitialState(JSON.objectNode().put("balance", 100))
                    .build()) {
                store.appendEvent("acct", "Deposited", amount(1));
                store.appendEvent("acct", "Withdrawn", amount(3));

                assertEquals(98, store.getSnapshot("acct").orElseThrow().state().get("balance").asLong());
            }
        }
    }
}
