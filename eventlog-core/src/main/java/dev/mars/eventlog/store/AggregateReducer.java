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
import dev.mars.eventlog.model.Event;

/**
 * Folds one event into aggregate state.
 * <p>
 * The state passed in is a private copy; a reducer may mutate and return it
 * or build a new node. Snapshots hold reducer output, so the reducer used to
 * produce snapshots must be the one used to rebuild from them.
 */
@FunctionalInterface
public interface AggregateReducer {

    /**
     * @param state the state so far
     * @param event the next event of the aggregate, in version order
     * @return the new state, never {@code null}
     */
    JsonNode apply(JsonNode state, Event event);
}
