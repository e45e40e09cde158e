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
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable fact recorded against one aggregate.
 * <p>
 * The payload is deep-copied when the event is created and again on every call
 * to {@link #payload()}, so neither the writer nor any reader can change what
 * was stored. Metadata is an unmodifiable copy.
 *
 * @param eventId        unique identifier, also the idempotency key
 * @param globalPosition store-wide position, strictly increasing across aggregates
 * @param aggregateId    the aggregate this event belongs to
 * @param type           event type tag used for projection dispatch
 * @param payload        event data
 * @param metadata       opaque key/value pairs supplied by the writer
 * @param version        1-based position within the aggregate stream
 * @param timestamp      creation time taken from the store clock
 */
public record Event(
        String eventId,
        long globalPosition,
        String aggregateId,
        String type,
        JsonNode payload,
        Map<String, String> metadata,
        long version,
        Instant timestamp
) {

    public Event {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (globalPosition < 1) {
            throw new IllegalArgumentException("globalPosition must be >= 1, got " + globalPosition);
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got " + version);
        }
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        if (metadata == null || metadata.isEmpty()) {
            metadata = Collections.emptyMap();
        } else {
            Map<String, String> copy = new LinkedHashMap<>(metadata);
            if (copy.containsKey(null)) {
                throw new IllegalArgumentException("metadata cannot contain null keys");
            }
            if (copy.containsValue(null)) {
                throw new IllegalArgumentException("metadata cannot contain null values");
            }
            metadata = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * Returns a private copy of the payload. Mutating it has no effect on the store.
     */
    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    @Override
    public String toString() {
        return "Event{" +
                "eventId=" + eventId +
                ", globalPosition=" + globalPosition +
                ", aggregateId=" + aggregateId +
                ", type=" + type +
                ", version=" + version +
                ", timestamp=" + timestamp +
                '}';
    }
}
