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

/**
 * Registration handle returned by {@code subscribe}.
 * <p>
 * {@link #unsubscribe()} stops delivery: events still queued for this
 * subscriber are dropped, and an event already being handled finishes.
 * Calling it more than once is harmless.
 */
public interface Subscription extends AutoCloseable {

    String id();

    boolean isActive();

    /** Events queued for this subscriber but not yet handed to it. */
    int pending();

    /** Events handed to the subscriber that it handled without throwing. */
    long delivered();

    /** Events whose handling threw. */
    long failed();

    void unsubscribe();

    /** Same as {@link #unsubscribe()}. */
    @Override
    default void close() {
        unsubscribe();
    }
}
