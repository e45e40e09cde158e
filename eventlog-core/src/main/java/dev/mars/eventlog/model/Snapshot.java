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
package dev.mars.eventlog.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Materialized aggregate state at a known stream version.
 * <p>
 * Only the newest snapshot per aggregate is retained. The stream stays the
 * source of truth; a snapshot only bounds how many events a rebuild folds.
 *
 * @param aggregateId the aggregate the state belongs to
 * @param version     the last event version folded into {@code state}
 * @param state       the materialized state (deep-copied in and out)
 * @param timestamp   when the snapshot was taken
 */
public record Snapshot(String aggregateId, long version, JsonNode state, Instant timestamp) {

    public Snapshot {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(timestamp, "timestamp");
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0, got " + version);
        }
        state = state.deepCopy();
    }

    /** Returns a private copy of the snapshot state. */
    @Override
    public JsonNode state() {
        return state.deepCopy();
    }
}
