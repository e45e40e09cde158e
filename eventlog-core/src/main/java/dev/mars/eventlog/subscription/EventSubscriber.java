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

/**
 * Receives events appended to the store after it subscribed.
 *
 * <h2>Execution Model</h2>
 * <p>Subscribers run on the bus worker threads, never on the thread that
 * appended the event. Each subscriber sees events one at a time, in global
 * position order, so events of one aggregate always arrive in version order.
 * Different subscribers make progress independently.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown here is logged and the next event is delivered as
 * usual. There is no retry.
 *
 * <p>Events appended before {@code subscribe} are not replayed; read them with
 * {@code EventStore.getAllEvents} if needed.
 */
@FunctionalInterface
public interface EventSubscriber {

    /**
     * Handles one event.
     *
     * @param event the appended event
     * @throws Exception if handling fails; logged and otherwise ignored
     */
    void onEvent(Event event) throws Exception;
}
