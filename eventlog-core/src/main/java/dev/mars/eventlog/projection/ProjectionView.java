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

/**
 * Read-only handle on a registered projection.
 * <p>
 * The handle is live: every call reflects the projection as it is now. It
 * stays valid after the projection is unregistered but no longer changes.
 */
public interface ProjectionView {

    String name();

    /**
     * Returns a private copy of the current read model.
     */
    JsonNode state();

    /**
     * Global position of the last event offered to this projection (0 if none).
     */
    long lastPosition();

    /** Number of events successfully folded since the last reset. */
    long eventsApplied();

    /** Number of handler failures since the last reset. */
    long failures();
}
