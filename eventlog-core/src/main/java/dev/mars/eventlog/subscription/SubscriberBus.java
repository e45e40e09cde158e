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
package dev.mars.eventlog.subscription;

import dev.mars.eventlog.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous fan-out of appended events to subscribers.
 * <p>
 * Every subscriber owns a FIFO queue. {@link #publish(Event)} only enqueues,
 * so the appending thread never waits for a subscriber. A queue is drained by
 * at most one worker at a time (a drain is scheduled on the shared pool when
 * the queue goes from idle to busy), which keeps each subscriber's delivery in
 * publish order while letting different subscribers run in parallel.
 * <p>
 * The caller must publish events in global order from one thread at a time;
 * the store does this from inside its commit section.
 * <p>
 * This class is thread-safe and implements {@link AutoCloseable} for graceful
 * shutdown with a drain timeout.
 */
public final class SubscriberBus implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SubscriberBus.class);

    private final ExecutorService workers;
    private final List<SubscriberQueue> queues = new CopyOnWriteArrayList<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final long drainTimeoutMs;

    /**
     * @param workerCount    threads shared by all subscriber queues
     * @param drainTimeoutMs how long {@link #close()} waits for queued events
     */
    public SubscriberBus(int workerCount, long drainTimeoutMs) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.drainTimeoutMs = drainTimeoutMs;
        AtomicInteger threadIds = new AtomicInteger(1);
        this.workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "eventlog-subscriber-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        LOG.debug("SubscriberBus started: workerCount={}, drainTimeoutMs={}", workerCount, drainTimeoutMs);
    }

    /**
     * Registers a subscriber for events published from now on.
     *
     * @throws IllegalStateException if the bus is closed
     */
    public Subscription subscribe(EventSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!accepting.get()) {
            throw new IllegalStateException("SubscriberBus is closed");
        }
        SubscriberQueue queue = new SubscriberQueue("subscription-" + subscriptionIds.incrementAndGet(), subscriber);
        queues.add(queue);
        LOG.debug("Subscriber registered: {}", queue.id());
        return queue;
    }

    /**
     * Queues {@code event} for every active subscriber. Never blocks on delivery.
     */
    public void publish(Event event) {
        if (!accepting.get()) {
            LOG.debug("SubscriberBus closed, not publishing event {}", event.eventId());
            return;
        }
        for (SubscriberQueue queue : queues) {
            queue.offer(event);
        }
    }

    public int subscriberCount() {
        return queues.size();
    }

    /**
     * Stops accepting events, lets queued events drain within the drain
     * timeout, then stops the worker threads.
     */
    @Override
    public void close() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                int remaining = queues.stream().mapToInt(SubscriberQueue::pending).sum();
                LOG.warn("Drain timeout exceeded; forcing shutdown with {} undelivered events", remaining);
                workers.shutdownNow();
                workers.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (SubscriberQueue queue : queues) {
            queue.unsubscribe();
        }
        LOG.debug("SubscriberBus closed");
    }

    private final class SubscriberQueue implements Subscription {
        private final String id;
        private final EventSubscriber subscriber;
        private final Queue<Event> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private final AtomicLong delivered = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
        private volatile boolean active = true;

        SubscriberQueue(String id, EventSubscriber subscriber) {
            this.id = id;
            this.subscriber = subscriber;
        }

        void offer(Event event) {
            if (!active) {
                return;
            }
            pending.add(event);
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                workers.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                LOG.warn("Subscriber {} could not be scheduled; {} events left undelivered", id, pending.size());
            }
        }

        private void drain() {
            try {
                Event event;
                while (active && !Thread.currentThread().isInterrupted() && (event = pending.poll()) != null) {
                    deliver(event);
                }
            } finally {
                draining.set(false);
            }
            // An event may have been queued after the last poll but before the flag was cleared
            if (active && !pending.isEmpty()) {
                scheduleDrain();
            }
        }

        private void deliver(Event event) {
            try {
                subscriber.onEvent(event);
                delivered.incrementAndGet();
            } catch (InterruptedException e) {
                failed.incrementAndGet();
                Thread.currentThread().interrupt();
                LOG.warn("Subscriber {} interrupted on event {}; remaining events delivered on the next drain",
                        id, event.eventId());
            } catch (Exception e) {
                failed.incrementAndGet();
                LOG.warn("Subscriber {} failed on event {} (type={}, aggregateId={}, version={}): {}",
                        id, event.eventId(), event.type(), event.aggregateId(), event.version(),
                        e.getMessage(), e);
            }
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public int pending() {
            return pending.size();
        }

        @Override
        public long delivered() {
            return delivered.get();
        }

        @Override
        public long failed() {
            return failed.get();
        }

        @Override
        public void unsubscribe() {
            if (!active) {
                return;
            }
            active = false;
            queues.remove(this);
            int dropped = pending.size();
            pending.clear();
            LOG.debug("Subscriber {} unsubscribed; {} queued events dropped", id, dropped);
        }

        @Override
        public String toString() {
            return "Subscription{id=" + id + ", active=" + active + ", pending=" + pending.size() + '}';
        }
    }
}
