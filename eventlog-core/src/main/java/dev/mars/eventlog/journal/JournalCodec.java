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
package dev.mars.eventlog.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of journal records.
 * <p>
 * Records are written as explicit JSON trees rather than through data binding
 * so that the on-disk field names stay stable if the model types change.
 */
final class JournalCodec {

    private final ObjectMapper mapper;

    JournalCodec() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    byte[] encodeEvent(Event event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("eventId", event.eventId());
        node.put("globalPosition", event.globalPosition());
        node.put("aggregateId", event.aggregateId());
        node.put("type", event.type());
        node.put("version", event.version());
        node.set("timestamp", mapper.valueToTree(event.timestamp()));
        node.set("payload", event.payload());
        ObjectNode metadata = node.putObject("metadata");
        event.metadata().forEach(metadata::put);
        return write(node);
    }

    Event decodeEvent(byte[] bytes) throws IOException {
        JsonNode node = mapper.readTree(bytes);
        Map<String, String> metadata = new LinkedHashMap<>();
        node.path("metadata").fields().forEachRemaining(e -> metadata.put(e.getKey(), e.getValue().asText()));
        return new Event(
                required(node, "eventId").asText(),
                required(node, "globalPosition").asLong(),
                required(node, "aggregateId").asText(),
                required(node, "type").asText(),
                node.get("payload"),
                metadata,
                required(node, "version").asLong(),
                mapper.treeToValue(required(node, "timestamp"), Instant.class));
    }

    byte[] encodeSnapshot(Snapshot snapshot) {
        ObjectNode node = mapper.createObjectNode();
        node.put("aggregateId", snapshot.aggregateId());
        node.put("version", snapshot.version());
        node.set("timestamp", mapper.valueToTree(snapshot.timestamp()));
        node.set("state", snapshot.state());
        return write(node);
    }

    Snapshot decodeSnapshot(byte[] bytes) throws IOException {
        JsonNode node = mapper.readTree(bytes);
        return new Snapshot(
                required(node, "aggregateId").asText(),
                required(node, "version").asLong(),
                required(node, "state"),
                mapper.treeToValue(required(node, "timestamp"), Instant.class));
    }

    private byte[] write(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new JournalException("Failed to encode journal record", e);
        }
    }

    private static JsonNode required(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Journal record is missing field '" + field + "'");
        }
        return value;
    }
}
