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
import dev.mars.eventlog.store.ConcurrencyException;
import dev.mars.eventlog.store.DefaultEventStore;
import dev.mars.eventlog.store.EventStore;
import dev.mars.eventlog.store.EventStores;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chaos testing for the event store.
 * <p>
 * Throws concurrent writers, duplicate submissions, crashes and misbehaving
 * consumers at a store and checks after each scenario that:
 * <ul>
 *   <li>every stream has contiguous versions starting at 1</li>
 *   <li>global positions are contiguous and agree with each stream's order</li>
 *   <li>no event id is stored twice</li>
 *   <li>projections equal a replay of the stored events</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build
 * mvn package -pl eventlog-demo -am
 *
 * # Run all chaos scenarios
 * java -cp eventlog-demo/target/eventlog-demo-1.0-SNAPSHOT.jar dev.mars.eventlog.demo.AppendChaos
 *
 * # Run one group
 * java -cp eventlog-demo/target/eventlog-demo-1.0-SNAPSHOT.jar dev.mars.eventlog.demo.AppendChaos concurrent
 * java -cp eventlog-demo/target/eventlog-demo-1.0-SNAPSHOT.jar dev.mars.eventlog.demo.AppendChaos crash
 * java -cp eventlog-demo/target/eventlog-demo-1.0-SNAPSHOT.jar dev.mars.eventlog.demo.AppendChaos consumers
 * </pre>
 *
 * @see DefaultEventStore
 */
public class AppendChaos {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final Path baseDir;
    private final AtomicInteger testsPassed = new AtomicInteger(0);
    private final AtomicInteger testsFailed = new AtomicInteger(0);

    public AppendChaos(Path baseDir) {
        this.baseDir = baseDir;
    }

    public static void main(String[] args) throws Exception {
        System.out.println("╔═══════════════════════════════════════════════════════════════╗");
        System.out.println("║              EVENT STORE CHAOS SUITE                          ║");
        System.out.println("╚═══════════════════════════════════════════════════════════════╝");
        System.out.println();

        Path chaosDir = Files.createTempDirectory("eventlog-chaos-");
        System.out.println("Chaos directory: " + chaosDir.toAbsolutePath());
        System.out.println();

        AppendChaos chaos = new AppendChaos(chaosDir);

        String testFilter = args.length > 0 ? args[0].toLowerCase() : "all";

        try {
            switch (testFilter) {
                case "concurrent" -> chaos.runConcurrencyTests();
                case "crash" -> chaos.runCrashTests();
                case "consumers" -> chaos.runConsumerTests();
                case "all" -> {
                    chaos.runConcurrencyTests();
                    chaos.runCrashTests();
                    chaos.runConsumerTests();
                }
                default -> {
                    System.err.println("Unknown test filter: " + testFilter);
                    System.err.println("Available: concurrent, crash, consumers, all");
                    System.exit(1);
                }
            }
        } finally {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════════════╗");
            System.out.printf("║  RESULTS: %d passed, %d failed                                 ║%n",
                    chaos.testsPassed.get(), chaos.testsFailed.get());
            System.out.println("╚═══════════════════════════════════════════════════════════════╝");

            deleteRecursively(chaosDir);
        }

        System.exit(chaos.testsFailed.get() > 0 ? 1 : 0);
    }

    // =========================================================================
    // CONCURRENCY CHAOS
    // =========================================================================

    private void runConcurrencyTests() throws Exception {
        printSection("CONCURRENCY CHAOS");

        chaosTest("Writer Storm (16 threads x 8 aggregates)", this::writerStorm);
        chaosTest("Single Aggregate Contention (expected version)", this::singleAggregateContention);
        chaosTest("Duplicate Submission Storm (same event ids)", this::duplicateSubmissionStorm);
        chaosTest("Projection Registered Mid-Storm", this::projectionRegisteredMidStorm);
    }

    private void writerStorm() throws Exception {
        int threads = 16;
        int appendsPerThread = 250;
        try (EventStore store = inMemoryStore()) {
            runConcurrently(threads, t -> {
                for (int i = 0; i < appendsPerThread; i++) {
                    store.appendEvent("agg-" + ((t + i) % 8), "Ticked", JSON.objectNode().put("thread", t));
                }
            });
            assertEquals(threads * appendsPerThread, store.getGlobalPosition(), "global position");
            verifyInvariants(store);
        }
    }

    private void singleAggregateContention() throws Exception {
        int threads = 12;
        int appendsPerThread = 50;
        AtomicInteger conflicts = new AtomicInteger();
        try (EventStore store = inMemoryStore()) {
            runConcurrently(threads, t -> {
                for (int i = 0; i < appendsPerThread; i++) {
                    EventStores.appendWithRetry(store, "hot", 1000, version -> {
                        try {
                            return store.appendEvent("hot", "Incremented", JSON.objectNode().put("by", 1),
                                    AppendOptions.expectVersion(version));
                        } catch (ConcurrencyException e) {
                            conflicts.incrementAndGet();
                            throw e;
                        }
                    });
                }
            });
            assertEquals(threads * appendsPerThread, store.getAggregateVersion("hot"), "version of hot");
            verifyInvariants(store);
            System.out.printf("(%d conflicts retried) ", conflicts.get());
        }
    }

    private void duplicateSubmissionStorm() throws Exception {
        int threads = 10;
        int commands = 200;
        AtomicInteger stored = new AtomicInteger();
        try (EventStore store = inMemoryStore()) {
            runConcurrently(threads, t -> {
                for (int i = 0; i < commands; i++) {
                    store.appendEvent("cmd-" + (i % 5), "Handled", JSON.objectNode().put("command", i),
                            AppendOptions.withEventId("command-" + i))
                            .ifPresent(e -> stored.incrementAndGet());
                }
            });
            assertEquals(commands, stored.get(), "stored events");
            assertEquals(commands, store.getGlobalPosition(), "global position");
            verifyInvariants(store);
        }
    }

    private void projectionRegisteredMidStorm() throws Exception {
        try (EventStore store = inMemoryStore()) {
            CountDownLatch halfway = new CountDownLatch(1);
            ExecutorService writers = Executors.newFixedThreadPool(4);
            for (int t = 0; t < 4; t++) {
                final int threadId = t;
                writers.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        store.appendEvent("agg-" + threadId, "Ticked", JSON.objectNode().put("i", i));
                        if (i == 250) {
                            halfway.countDown();
                        }
                    }
                    return null;
                });
            }
            halfway.await(30, TimeUnit.SECONDS);
            ProjectionView view = store.registerProjection(countingProjection());
            writers.shutdown();
            assertTrue(writers.awaitTermination(60, TimeUnit.SECONDS), "writers finished");

            assertEquals(store.getGlobalPosition(), view.eventsApplied(), "events applied");
            assertEquals(store.getGlobalPosition(), view.lastPosition(), "projection position");
            verifyInvariants(store);
        }
    }

    // =========================================================================
    // CRASH CHAOS
    // =========================================================================

    private void runCrashTests() throws Exception {
        printSection("CRASH CHAOS");

        chaosTest("Restart Preserves Streams and Ids", this::restartPreservesStreams);
        chaosTest("Torn Tail Is Truncated On Reopen", this::tornTailTruncated);
        chaosTest("Corrupted Last Record Is Dropped", this::corruptedLastRecordDropped);
        chaosTest("Appends Continue After Recovery", this::appendsContinueAfterRecovery);
    }

    private void restartPreservesStreams() throws Exception {
        Path dir = createTestDir("restart");
        try (EventStore store = fileStore(dir)) {
            for (int i = 0; i < 100; i++) {
                store.appendEvent("acct-" + (i % 4), "Deposited", JSON.objectNode().put("amount", i),
                        AppendOptions.withEventId("dep-" + i));
            }
        }
        try (EventStore store = fileStore(dir)) {
            assertEquals(100, store.getGlobalPosition(), "global position after restart");
            assertEquals(25, store.getAggregateVersion("acct-0"), "version of acct-0");
            assertTrue(store.appendEvent("acct-0", "Deposited", JSON.objectNode().put("amount", 0),
                    AppendOptions.withEventId("dep-0")).isEmpty(), "duplicate after restart skipped");
            verifyInvariants(store);
        }
    }

    private void tornTailTruncated() throws Exception {
        Path dir = createTestDir("torn");
        try (EventStore store = fileStore(dir)) {
            for (int i = 0; i < 10; i++) {
                store.appendEvent("acct", "Deposited", JSON.objectNode().put("amount", i));
            }
        }
        Path log = dir.resolve("events.log");
        long size = Files.size(log);
        try (FileChannel channel = FileChannel.open(log, StandardOpenOption.WRITE)) {
            channel.truncate(size - 7);
        }
        try (EventStore store = fileStore(dir)) {
            assertEquals(9, store.getAggregateVersion("acct"), "version after torn tail");
            verifyInvariants(store);
        }
    }

    private void corruptedLastRecordDropped() throws Exception {
        Path dir = createTestDir("corrupt");
        try (EventStore store = fileStore(dir)) {
            for (int i = 0; i < 5; i++) {
                store.appendEvent("acct", "Deposited", JSON.objectNode().put("amount", i));
            }
        }
        Path log = dir.resolve("events.log");
        long size = Files.size(log);
        try (FileChannel channel = FileChannel.open(log, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ByteBuffer b = ByteBuffer.allocate(1);
            channel.read(b, size - 10);
            b.flip();
            byte flipped = (byte) (b.get() ^ 0xFF);
            channel.write(ByteBuffer.wrap(new byte[]{flipped}), size - 10);
        }
        try (EventStore store = fileStore(dir)) {
            assertEquals(4, store.getAggregateVersion("acct"), "version after corruption");
            verifyInvariants(store);
        }
    }

    private void appendsContinueAfterRecovery() throws Exception {
        Path dir = createTestDir("recover");
        try (EventStore store = fileStore(dir)) {
            for (int i = 0; i < 3; i++) {
                store.appendEvent("acct", "Deposited", JSON.objectNode().put("amount", i));
            }
        }
        Path log = dir.resolve("events.log");
        try (FileChannel channel = FileChannel.open(log, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            channel.write(ByteBuffer.wrap(new byte[]{0x45, 0x56, 0x4C}));
        }
        try (EventStore store = fileStore(dir)) {
            Event next = store.appendEvent("acct", "Deposited", JSON.objectNode().put("amount", 3),
                    AppendOptions.expectVersion(3)).orElseThrow();
            assertEquals(4, next.version(), "version of next event");
            assertEquals(4, next.globalPosition(), "position of next event");
        }
        try (EventStore store = fileStore(dir)) {
            assertEquals(4, store.getAggregateVersion("acct"), "version after second restart");
            verifyInvariants(store);
        }
    }

    // =========================================================================
    // CONSUMER CHAOS
    // =========================================================================

    private void runConsumerTests() throws Exception {
        printSection("CONSUMER CHAOS");

        chaosTest("Throwing Projection Does Not Block Appends", this::throwingProjection);
        chaosTest("Slow Subscriber Does Not Block Appends", this::slowSubscriber);
        chaosTest("Throwing Subscriber Keeps Receiving In Order", this::throwingSubscriber);
    }

    private void throwingProjection() throws Exception {
        try (EventStore store = inMemoryStore()) {
            ProjectionView broken = store.registerProjection(Projection.builder("broken")
                    .on("Ticked", (state, event) -> {
                        if (event.globalPosition() % 3 == 0) {
                            throw new IllegalStateException("boom at " + event.globalPosition());
                        }
                        return state;
                    })
                    .build());
            ProjectionView counting = store.registerProjection(countingProjection());
            for (int i = 0; i < 30; i++) {
                store.appendEvent("agg", "Ticked", JSON.objectNode());
            }
            assertEquals(30, store.getAggregateVersion("agg"), "version");
            assertEquals(10, broken.failures(), "broken projection failures");
            assertEquals(30, counting.state().path("count").asLong(), "counting projection");
        }
    }

    private void slowSubscriber() throws Exception {
        try (EventStore store = inMemoryStore()) {
            CountDownLatch release = new CountDownLatch(1);
            store.subscribe(event -> release.await());
            long start = System.nanoTime();
            for (int i = 0; i < 1000; i++) {
                store.appendEvent("agg", "Ticked", JSON.objectNode());
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            release.countDown();
            assertTrue(elapsedMs < 10_000, "appends finished while subscriber was blocked (" + elapsedMs + " ms)");
        }
    }

    private void throwingSubscriber() throws Exception {
        try (EventStore store = inMemoryStore()) {
            List<Long> seen = new ArrayList<>();
            CountDownLatch done = new CountDownLatch(1);
            store.subscribe(event -> {
                synchronized (seen) {
                    seen.add(event.globalPosition());
                }
                if (event.globalPosition() == 100) {
                    done.countDown();
                }
                if (event.globalPosition() % 2 == 0) {
                    throw new IllegalStateException("subscriber failure");
                }
            });
            for (int i = 0; i < 100; i++) {
                store.appendEvent("agg-" + (i % 3), "Ticked", JSON.objectNode());
            }
            assertTrue(done.await(30, TimeUnit.SECONDS), "all events delivered");
            synchronized (seen) {
                assertEquals(100, seen.size(), "delivered events");
                for (int i = 0; i < seen.size(); i++) {
                    assertEquals(i + 1, seen.get(i), "delivery order at " + i);
                }
            }
        }
    }

    // =========================================================================
    // INVARIANTS
    // =========================================================================

    private static void verifyInvariants(EventStore store) {
        List<Event> all = store.getAllEvents();
        assertEquals(store.getGlobalPosition(), all.size(), "global log size");

        Set<String> ids = new HashSet<>();
        Map<String, Long> versions = new HashMap<>();
        for (int i = 0; i < all.size(); i++) {
            Event event = all.get(i);
            assertEquals(i + 1, event.globalPosition(), "global position at index " + i);
            assertTrue(ids.add(event.eventId()), "event id stored once: " + event.eventId());
            long expected = versions.merge(event.aggregateId(), 1L, Long::sum);
            assertEquals(expected, event.version(), "version of " + event.eventId());
        }
        for (Map.Entry<String, Long> entry : versions.entrySet()) {
            assertEquals(entry.getValue(), store.getAggregateVersion(entry.getKey()),
                    "aggregate version of " + entry.getKey());
            assertEquals(entry.getValue(), store.getEvents(entry.getKey()).size(),
                    "stream size of " + entry.getKey());
        }

        String name = "invariant-check-" + System.nanoTime();
        ProjectionView replayed = store.registerProjection(countingProjection(name));
        assertEquals(all.size(), replayed.state().path("count").asLong(), "replayed projection count");
        store.unregisterProjection(name);
    }

    private static Projection countingProjection() {
        return countingProjection("counter");
    }

    private static Projection countingProjection(String name) {
        return Projection.builder(name)
                .on("Ticked", AppendChaos::count)
                .on("Deposited", AppendChaos::count)
                .on("Handled", AppendChaos::count)
                .on("Incremented", AppendChaos::count)
                .build();
    }

    private static JsonNode count(JsonNode state, Event event) {
        ObjectNode next = state.deepCopy();
        next.put("count", next.path("count").asLong() + 1);
        return next;
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private static EventStore inMemoryStore() {
        return EventStores.inMemory(EventStoreConfig.builder().subscriberThreads(2).drainTimeoutMs(1000).build());
    }

    private static EventStore fileStore(Path dir) {
        EventStoreConfig config = EventStoreConfig.builder()
                .dataDir(dir)
                .syncEnabled(false)
                .drainTimeoutMs(1000)
                .build();
        return DefaultEventStore.builder()
                .config(config)
                .journal(new FileEventJournal(config))
                .build();
    }

    private static void runConcurrently(int threads, ThreadBody body) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Throwable> errors = new ArrayList<>();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int threadId = t;
            futures.add(executor.submit(() -> {
                startLatch.await();
                body.run(threadId);
                return null;
            }));
        }
        startLatch.countDown();
        for (Future<?> future : futures) {
            try {
                future.get(60, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                errors.add(e.getCause());
            }
        }
        executor.shutdownNow();
        if (!errors.isEmpty()) {
            throw new AssertionError(errors.size() + " writer threads failed", errors.get(0));
        }
    }

    @FunctionalInterface
    private interface ThreadBody {
        void run(int threadId) throws Exception;
    }

    @FunctionalInterface
    private interface ChaosTestRunnable {
        void run() throws Exception;
    }

    private static void assertEquals(long expected, long actual, String what) {
        if (expected != actual) {
            throw new AssertionError(what + ": expected " + expected + " but was " + actual);
        }
    }

    private static void assertTrue(boolean condition, String what) {
        if (!condition) {
            throw new AssertionError("Expected true: " + what);
        }
    }

    private void printSection(String name) {
        System.out.println();
        System.out.println("┌───────────────────────────────────────────────────────────────┐");
        System.out.printf("│  %-61s │%n", name);
        System.out.println("└───────────────────────────────────────────────────────────────┘");
    }

    private void chaosTest(String name, ChaosTestRunnable test) {
        System.out.printf("  %-55s ", name);
        try {
            test.run();
            System.out.println("[PASS]");
            testsPassed.incrementAndGet();
        } catch (Throwable e) {
            System.out.println("[FAIL]");
            System.err.println("    Error: " + e.getMessage());
            e.printStackTrace(System.err);
            testsFailed.incrementAndGet();
        }
    }

    private Path createTestDir(String name) throws IOException {
        Path dir = baseDir.resolve(name + "-" + System.nanoTime());
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteRecursively(Path path) {
        try {
            if (Files.isDirectory(path)) {
                try (var stream = Files.list(path)) {
                    stream.forEach(AppendChaos::deleteRecursively);
                }
            }
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("    Cleanup failed for " + path + ": " + e.getMessage());
        }
    }
}
