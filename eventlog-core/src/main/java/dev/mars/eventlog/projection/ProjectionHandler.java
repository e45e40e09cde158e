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

/**
 * Folds one event type into a projection's read model.
 * <p>
 * The handler receives a copy of the projection's current state and returns
 * the next state. It may mutate and return the copy it was given; a handler
 * that fails leaves the projection's state as it was. Returning
 * {@code null} or throwing counts as a failure: the event is skipped for this
 * projection and the failure is logged.
 */
@FunctionalInterface
public interface ProjectionHandler {

    /**
     * @param state the current read model
     * @param event the event being applied
     * @return the new read model, never {@code null}
     */
    JsonNode apply(JsonNode state, Event event);
}
