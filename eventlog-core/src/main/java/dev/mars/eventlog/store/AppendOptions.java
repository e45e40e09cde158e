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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Optional parameters of an append: expected version, event id and metadata.
 *
 * <pre>{@code
 * store.appendEvent("acct-1", "Renamed", payload, AppendOptions.builder()
 *     .expectedVersion(2)
 *     .eventId("cmd-7f3a")
 *     .metadata("userId", "u-42")
 *     .build());
 * }</pre>
 */
public final class AppendOptions {

    private static final AppendOptions DEFAULTS = builder().build();

    private final ExpectedVersion expectedVersion;
    private final String eventId;
    private final Map<String, String> metadata;

    private AppendOptions(Builder builder) {
        this.expectedVersion = builder.expectedVersion;
        this.eventId = builder.eventId;
        this.metadata = builder.metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /** No version check, generated event id, no metadata. */
    public static AppendOptions defaults() {
        return DEFAULTS;
    }

    /** Shorthand for an append that requires {@code version}. */
    public static AppendOptions expectVersion(long version) {
        return builder().expectedVersion(version).build();
    }

    /** Shorthand for an idempotent append keyed by {@code eventId}. */
    public static AppendOptions withEventId(String eventId) {
        return builder().eventId(eventId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExpectedVersion expectedVersion() {
        return expectedVersion;
    }

    /** Caller supplied event id, or {@code null} to have one generated. */
    public String eventId() {
        return eventId;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "AppendOptions{expectedVersion=" + expectedVersion +
                ", eventId=" + eventId +
                ", metadata=" + metadata + '}';
    }

    /** Builder for {@link AppendOptions}. */
    public static final class Builder {
        private ExpectedVersion expectedVersion = ExpectedVersion.any();
        private String eventId;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder expectedVersion(ExpectedVersion expectedVersion) {
            this.expectedVersion = Objects.requireNonNull(expectedVersion, "expectedVersion");
            return this;
        }

        public Builder expectedVersion(long version) {
            return expectedVersion(ExpectedVersion.exactly(version));
        }

        /**
         * Sets the idempotency key. A second append with the same id is skipped.
         *
         * @throws IllegalArgumentException if {@code eventId} is blank
         */
        public Builder eventId(String eventId) {
            Objects.requireNonNull(eventId, "eventId");
            if (eventId.isBlank()) {
                throw new IllegalArgumentException("eventId cannot be blank");
            }
            this.eventId = eventId;
            return this;
        }

        public Builder metadata(String key, String value) {
            metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder metadata(Map<String, String> entries) {
            Objects.requireNonNull(entries, "entries").forEach(this::metadata);
            return this;
        }

        public AppendOptions build() {
            return new AppendOptions(this);
        }
    }
}
