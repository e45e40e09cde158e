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
package dev.mars.eventlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for an event store and its journal.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Deventlog.snapshotInterval=50})</li>
 *   <li>Environment variables (e.g., {@code EVENTLOG_SNAPSHOT_INTERVAL})</li>
 *   <li>Properties file ({@code eventlog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>snapshotInterval</td><td>eventlog.snapshotInterval</td><td>EVENTLOG_SNAPSHOT_INTERVAL</td><td>100</td></tr>
 *   <tr><td>subscriberThreads</td><td>eventlog.subscriberThreads</td><td>EVENTLOG_SUBSCRIBER_THREADS</td><td>2</td></tr>
 *   <tr><td>drainTimeoutMs</td><td>eventlog.drainTimeoutMs</td><td>EVENTLOG_DRAIN_TIMEOUT_MS</td><td>5000</td></tr>
 *   <tr><td>dataDir</td><td>eventlog.dataDir</td><td>EVENTLOG_DATA_DIR</td><td>~/.eventlog/data</td></tr>
 *   <tr><td>syncEnabled</td><td>eventlog.syncEnabled</td><td>EVENTLOG_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>maxPayloadSizeMb</td><td>eventlog.maxPayloadSizeMb</td><td>EVENTLOG_MAX_PAYLOAD_SIZE_MB</td><td>16</td></tr>
 * </table>
 * A {@code snapshotInterval} of 0 disables automatic snapshots.
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # eventlog.properties
 * eventlog.snapshotInterval=50
 * eventlog.subscriberThreads=4
 * eventlog.dataDir=/var/lib/eventlog/data
 * eventlog.syncEnabled=true
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * EventStoreConfig config = EventStoreConfig.builder()
 *     .snapshotInterval(20)
 *     .dataDir(Path.of("/var/lib/eventlog"))
 *     .build();
 *
 * EventStore store = DefaultEventStore.builder()
 *     .config(config)
 *     .journal(new FileEventJournal(config))
 *     .build();
 * </pre>
 */
public final class EventStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(EventStoreConfig.class);

    private static final String PROPERTIES_FILE = "eventlog.properties";

    // Property keys
    private static final String PROP_SNAPSHOT_INTERVAL = "eventlog.snapshotInterval";
    private static final String PROP_SUBSCRIBER_THREADS = "eventlog.subscriberThreads";
    private static final String PROP_DRAIN_TIMEOUT_MS = "eventlog.drainTimeoutMs";
    private static final String PROP_DATA_DIR = "eventlog.dataDir";
    private static final String PROP_SYNC_ENABLED = "eventlog.syncEnabled";
    private static final String PROP_MAX_PAYLOAD_SIZE_MB = "eventlog.maxPayloadSizeMb";

    // Environment variable keys
    private static final String ENV_SNAPSHOT_INTERVAL = "EVENTLOG_SNAPSHOT_INTERVAL";
    private static final String ENV_SUBSCRIBER_THREADS = "EVENTLOG_SUBSCRIBER_THREADS";
    private static final String ENV_DRAIN_TIMEOUT_MS = "EVENTLOG_DRAIN_TIMEOUT_MS";
    private static final String ENV_DATA_DIR = "EVENTLOG_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "EVENTLOG_SYNC_ENABLED";
    private static final String ENV_MAX_PAYLOAD_SIZE_MB = "EVENTLOG_MAX_PAYLOAD_SIZE_MB";

    // Defaults
    private static final int DEFAULT_SNAPSHOT_INTERVAL = 100;
    private static final int DEFAULT_SUBSCRIBER_THREADS = 2;
    private static final long DEFAULT_DRAIN_TIMEOUT_MS = 5000L;
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".eventlog", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_MAX_PAYLOAD_SIZE_MB = 16;

    private final int snapshotInterval;
    private final int subscriberThreads;
    private final long drainTimeoutMs;
    private final Path dataDir;
    private final boolean syncEnabled;
    private final int maxPayloadSizeMb;

    private EventStoreConfig(Builder builder) {
        this.snapshotInterval = builder.snapshotInterval;
        this.subscriberThreads = builder.subscriberThreads;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.maxPayloadSizeMb = builder.maxPayloadSizeMb;
    }

    /** Number of versions between automatic snapshots of an aggregate (0 = disabled). */
    public int snapshotInterval() {
        return snapshotInterval;
    }

    /** Whether automatic snapshots are taken at all. */
    public boolean snapshotsEnabled() {
        return snapshotInterval > 0;
    }

    /** Worker threads shared by all subscriber queues. */
    public int subscriberThreads() {
        return subscriberThreads;
    }

    /** How long {@code close()} waits for subscriber queues to drain. */
    public long drainTimeoutMs() {
        return drainTimeoutMs;
    }

    /** Data directory used by the file journal. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether the file journal forces every append to disk. */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Maximum encoded record size in MB accepted by the file journal. */
    public int maxPayloadSizeMb() {
        return maxPayloadSizeMb;
    }

    /** Maximum encoded record size in bytes. */
    public int maxPayloadSizeBytes() {
        return maxPayloadSizeMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "EventStoreConfig{" +
                "snapshotInterval=" + snapshotInterval +
                ", subscriberThreads=" + subscriberThreads +
                ", drainTimeoutMs=" + drainTimeoutMs +
                ", dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", maxPayloadSizeMb=" + maxPayloadSizeMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code EventStoreConfig.builder().build()}.
     */
    public static EventStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link EventStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Integer snapshotInterval;
        private Integer subscriberThreads;
        private Long drainTimeoutMs;
        private Path dataDir;
        private Boolean syncEnabled;
        private Integer maxPayloadSizeMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the snapshot interval in versions; 0 disables automatic snapshots (default: 100). */
        public Builder snapshotInterval(int snapshotInterval) {
            this.snapshotInterval = snapshotInterval;
            return this;
        }

        /** Sets the number of subscriber delivery threads (default: 2). */
        public Builder subscriberThreads(int subscriberThreads) {
            this.subscriberThreads = subscriberThreads;
            return this;
        }

        /** Sets the shutdown drain timeout in milliseconds (default: 5000). */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /** Sets the data directory. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the data directory from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync on append (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets maximum record size in MB (default: 16). */
        public Builder maxPayloadSizeMb(int maxPayloadSizeMb) {
            this.maxPayloadSizeMb = maxPayloadSizeMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public EventStoreConfig build() {
            if (snapshotInterval == null) {
                snapshotInterval = resolve(PROP_SNAPSHOT_INTERVAL, ENV_SNAPSHOT_INTERVAL,
                        Integer::valueOf, DEFAULT_SNAPSHOT_INTERVAL);
            }
            if (subscriberThreads == null) {
                subscriberThreads = resolve(PROP_SUBSCRIBER_THREADS, ENV_SUBSCRIBER_THREADS,
                        Integer::valueOf, DEFAULT_SUBSCRIBER_THREADS);
            }
            if (drainTimeoutMs == null) {
                drainTimeoutMs = resolve(PROP_DRAIN_TIMEOUT_MS, ENV_DRAIN_TIMEOUT_MS,
                        Long::valueOf, DEFAULT_DRAIN_TIMEOUT_MS);
            }
            if (dataDir == null) {
                dataDir = resolve(PROP_DATA_DIR, ENV_DATA_DIR, Path::of, DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED,
                        Boolean::valueOf, DEFAULT_SYNC_ENABLED);
            }
            if (maxPayloadSizeMb == null) {
                maxPayloadSizeMb = resolve(PROP_MAX_PAYLOAD_SIZE_MB, ENV_MAX_PAYLOAD_SIZE_MB,
                        Integer::valueOf, DEFAULT_MAX_PAYLOAD_SIZE_MB);
            }

            if (snapshotInterval < 0) {
                throw new IllegalArgumentException("snapshotInterval must be >= 0, got " + snapshotInterval);
            }
            if (subscriberThreads < 1) {
                throw new IllegalArgumentException("subscriberThreads must be >= 1, got " + subscriberThreads);
            }
            if (drainTimeoutMs < 0) {
                throw new IllegalArgumentException("drainTimeoutMs must be >= 0, got " + drainTimeoutMs);
            }
            if (maxPayloadSizeMb < 1) {
                throw new IllegalArgumentException("maxPayloadSizeMb must be >= 1, got " + maxPayloadSizeMb);
            }

            return new EventStoreConfig(this);
        }

        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            T value = parse(sysProp, "system property", System.getProperty(sysProp), parser);
            if (value == null) {
                value = parse(envVar, "environment variable", System.getenv(envVar), parser);
            }
            if (value == null) {
                value = parse(sysProp, PROPERTIES_FILE, fileProperties.getProperty(sysProp), parser);
            }
            return value != null ? value : defaultValue;
        }

        private static <T> T parse(String key, String source, String raw, Function<String, T> parser) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                return parser.apply(raw.trim());
            } catch (RuntimeException e) {
                LOG.warn("Ignoring invalid value '{}' for {} from {}: {}", raw, key, source, e.getMessage());
                return null;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = EventStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
