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
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.projection.Projection;
import dev.mars.eventlog.projection.ProjectionView;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the store under concurrent writers: per-aggregate serialization,
 * a single global order, and projections and subscribers that observe it.
 */
class ConcurrentAppendTest {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;
    private static final int THREADS = 8;

    private DefaultEventStore store;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = DefaultEventStore.builder()
                .config(EventStoreConfig.builder().snapshotInterval(0).subscriberThreads(2).build())
                .build();
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
        store.close();
    }

    private void runOnAllThreads(ThreadBody body) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            final int threadId = t;
            futures.add(executor.submit(() -> {
                start.await();
                body.run(threadId);
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
    }

    @FunctionalInterface
    private interface ThreadBody {
        void run(int threadId) throws Exception;
    }

    private static JsonNode count(JsonNode state, Event event) {
        ObjectNode next = state.deepCopy();
        next.put("count", next.path("count").asLong() + 1);
        next.put("sum", next.path("sum").asLong() + event.payload().path("n").asLong());
        return next;
    }

    // ========================================================================
    // Same Aggregate
    // ========================================================================

    @Nested
    @DisplayName("Same Aggregate")
    class SameAggregateTests {

        @Test
        @DisplayName("Concurrent appends without expected version get distinct contiguous versions")
        void testDistinctVersions() throws Exception {
            int perThread = 200;
            runOnAllThreads(t -> {
                for (int i = 0; i < perThread; i++) {
                    store.appendEvent("hot", "Incremented", JSON.objectNode().put("n", 1));
                }
            });

            List<Event> events = store.getEvents("hot");
            assertEquals(THREADS * perThread, events.size());
            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1, events.get(i).version());
            }
        }

        @Test
        @DisplayName("Exactly one of two writers with the same expected version wins")
        void testOneWinnerPerVersion() throws Exception {
            AtomicInteger wins = new AtomicInteger();
            AtomicInteger conflicts = new AtomicInteger();
            store.appendEvent("acct", "Created", JSON.objectNode());

            runOnAllThreads(t -> {
                try {
                    store.appendEvent("acct", "Renamed", JSON.objectNode().put("by", t), AppendOptions.expectVersion(1));
                    wins.incrementAndGet();
                } catch (ConcurrencyException e) {
                    conflicts.incrementAndGet();
                }
            });

            assertEquals(1, wins.get());
            assertEquals(THREADS - 1, conflicts.get());
            assertEquals(2, store.getAggregateVersion("acct"));
        }

        @Test
        @DisplayName("Retrying writers all land exactly once")
        void testRetryingWriters() throws Exception {
            int perThread = 50;
            runOnAllThreads(t -> {
                for (int i = 0; i < perThread; i++) {
                    JsonNode payload = JSON.objectNode().put("n", 1);
                    EventStores.appendWithRetry(store, "counter", 10_000, version ->
                            store.appendEvent("counter", "Incremented", payload, AppendOptions.expectVersion(version)));
                }
            });

            assertEquals(THREADS * perThread, store.getAggregateVersion("counter"));
        }

        @Test
        @DisplayName("Racing duplicates of one event id store it once")
        void testRacingDuplicates() throws Exception {
            AtomicInteger stored = new AtomicInteger();
            runOnAllThreads(t -> {
                for (int i = 0; i < 100; i++) {
                    store.appendEvent("agg-" + (i % 3), "Handled", JSON.objectNode(), AppendOptions.withEventId("cmd-" + i))
                            .ifPresent(e -> stored.incrementAndGet());
                }
            });

            assertEquals(100, stored.get());
            assertEquals(100, store.getGlobalPosition());
        }
    }

    // ========================================================================
    // Global Order
    // ========================================================================

    @Nested
    @DisplayName("Global Order")
    class GlobalOrderTests {

        @Test
        @DisplayName("Global positions are contiguous and agree with every stream's version order")
        void testGlobalOrderConsistent() throws Exception {
            int perThread = 300;
            runOnAllThreads(t -> {
                for (int i = 0; i < perThread; i++) {
                    store.appendEvent("agg-" + ((t * 7 + i) % 5), "Ticked", JSON.objectNode().put("n", i));
                }
            });

            List<Event> all = store.getAllEvents();
            assertEquals(THREADS * perThread, all.size());
            Map<String, Long> lastVersion = new HashMap<>();
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < all.size(); i++) {
                Event event = all.get(i);
                assertEquals(i + 1, event.globalPosition());
                assertTrue(ids.add(event.eventId()));
                long previous = lastVersion.getOrDefault(event.aggregateId(), 0L);
                assertEquals(previous + 1, event.version(), "version order of " + event.aggregateId());
                lastVersion.put(event.aggregateId(), event.version());
            }
        }

        @Test
        @DisplayName("Reads during writes always see a contiguous prefix")
        void testReadsDuringWrites() throws Exception {
            Future<?> writer = executor.submit(() -> {
                for (int i = 0; i < 2000; i++) {
                    store.appendEvent("agg-" + (i % 4), "Ticked", JSON.objectNode());
                }
            });
            while (!writer.isDone()) {
                List<Event> snapshot = store.getEvents("agg-1");
                for (int i = 0; i < snapshot.size(); i++) {
                    assertEquals(i + 1, snapshot.get(i).version());
                }
                List<Event> all = store.getAllEvents();
                for (int i = 0; i < all.size(); i++) {
                    assertEquals(i + 1, all.get(i).globalPosition());
                }
            }
            writer.get();
            assertEquals(500, store.getAggregateVersion("agg-1"));
        }
    }

    // ========================================================================
    // Projections and Subscribers
    // ========================================================================

    @Nested
    @DisplayName("Projections and Subscribers Under Load")
    class ConsumerTests {

        @Test
        @DisplayName("Projection observes every event once, in global order")
        void testProjectionGlobalOrder() throws Exception {
            List<Long> positions = Collections.synchronizedList(new ArrayList<>());
            ProjectionView view = store.registerProjection(Projection.builder("order")
                    .on("Ticked", (state, event) -> {
                        positions.add(event.globalPosition());
                        return count(state, event);
                    })
                    .build());

            runOnAllThreads(t -> {
                for (int i = 0; i < 100; i++) {
                    store.appendEvent("agg-" + t, "Ticked", JSON.objectNode().put("n", 1));
                }
            });

            assertEquals(THREADS * 100, view.state().get("count").asLong());
            assertEquals(THREADS * 100L, view.lastPosition());
            for (int i = 0; i < positions.size(); i++) {
                assertEquals(i + 1, positions.get(i).longValue());
            }
        }

        @Test
        @DisplayName("Projection registered during writes ends equal to a fresh replay")
        void testRegisterDuringWrites() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            Future<?> writers = executor.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    store.appendEvent("agg-" + (i % 3), "Ticked", JSON.objectNode().put("n", i));
                    if (i == 100) {
                        started.countDown();
                    }
                }
            });
            assertTrue(started.await(30, TimeUnit.SECONDS));
            ProjectionView live = store.registerProjection("live", Map.of("Ticked", ConcurrentAppendTest::count));
            writers.get(60, TimeUnit.SECONDS);

            ProjectionView fresh = store.registerProjection("fresh", Map.of("Ticked", ConcurrentAppendTest::count));
            assertEquals(fresh.state(), live.state());
            assertEquals(1000, live.eventsApplied());
        }

        @Test
        @DisplayName("Each subscriber receives every event in global order")
        void testSubscriberGlobalOrder() throws Exception {
            List<Long> first = Collections.synchronizedList(new ArrayList<>());
            List<Long> second = Collections.synchronizedList(new ArrayList<>());
            store.subscribe(event -> first.add(event.globalPosition()));
            store.subscribe(event -> second.add(event.globalPosition()));

            runOnAllThreads(t -> {
                for (int i = 0; i < 100; i++) {
                    store.appendEvent("agg-" + (t % 3), "Ticked", JSON.objectNode());
                }
            });

            Awaitility.await().atMost(Duration.ofSeconds(10)).until(() -> first.size() == THREADS * 100
                    && second.size() == THREADS * 100);
            synchronized (first) {
                for (int i = 0; i < first.size(); i++) {
                    assertEquals(i + 1, first.get(i).longValue());
                }
            }
            assertEquals(new ArrayList<>(first), new ArrayList<>(second));
        }
    }
}
