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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventStoreConfig resolution: programmatic values, system
 * properties, defaults and validation.
 */
class EventStoreConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("eventlog.snapshotInterval");
        System.clearProperty("eventlog.subscriberThreads");
        System.clearProperty("eventlog.drainTimeoutMs");
        System.clearProperty("eventlog.dataDir");
        System.clearProperty("eventlog.syncEnabled");
        System.clearProperty("eventlog.maxPayloadSizeMb");
    }

    // ========================================================================
    // Defaults
    // ========================================================================

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Unset values resolve to defaults")
        void testDefaults() {
            EventStoreConfig config = EventStoreConfig.builder().build();

            assertEquals(100, config.snapshotInterval());
            assertTrue(config.snapshotsEnabled());
            assertEquals(2, config.subscriberThreads());
            assertEquals(5000L, config.drainTimeoutMs());
            assertTrue(config.syncEnabled());
            assertEquals(16, config.maxPayloadSizeMb());
            assertEquals(16 * 1024 * 1024, config.maxPayloadSizeBytes());
            assertEquals(Path.of(System.getProperty("user.home"), ".eventlog", "data"), config.dataDir());
        }

        @Test
        @DisplayName("load() is equivalent to an empty builder")
        void testLoad() {
            EventStoreConfig config = EventStoreConfig.load();
            assertEquals(100, config.snapshotInterval());
            assertNotNull(config.toString());
        }
    }

    // ========================================================================
    // System Property Resolution
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property snapshotInterval is respected")
        void testSnapshotIntervalSystemProperty() {
            System.setProperty("eventlog.snapshotInterval", "25");
            assertEquals(25, EventStoreConfig.builder().build().snapshotInterval());
        }

        @Test
        @DisplayName("snapshotInterval=0 disables snapshots")
        void testSnapshotIntervalZero() {
            System.setProperty("eventlog.snapshotInterval", "0");
            EventStoreConfig config = EventStoreConfig.builder().build();
            assertEquals(0, config.snapshotInterval());
            assertFalse(config.snapshotsEnabled());
        }

        @Test
        @DisplayName("System property dataDir is respected")
        void testDataDirSystemProperty() {
            Path customDir = tempDir.resolve("custom-data");
            System.setProperty("eventlog.dataDir", customDir.toString());
            assertEquals(customDir, EventStoreConfig.builder().build().dataDir());
        }

        @Test
        @DisplayName("System property syncEnabled=false is respected")
        void testSyncEnabledSystemProperty() {
            System.setProperty("eventlog.syncEnabled", "false");
            assertFalse(EventStoreConfig.builder().build().syncEnabled());
        }

        @Test
        @DisplayName("System properties for subscriber pool are respected")
        void testSubscriberSystemProperties() {
            System.setProperty("eventlog.subscriberThreads", "4");
            System.setProperty("eventlog.drainTimeoutMs", "250");

            EventStoreConfig config = EventStoreConfig.builder().build();
            assertEquals(4, config.subscriberThreads());
            assertEquals(250L, config.drainTimeoutMs());
        }

        @Test
        @DisplayName("Invalid integer system property falls back to default")
        void testInvalidIntSystemProperty() {
            System.setProperty("eventlog.snapshotInterval", "not-a-number");
            assertEquals(100, EventStoreConfig.builder().build().snapshotInterval());
        }

        @Test
        @DisplayName("Blank system property falls back to default")
        void testBlankSystemProperty() {
            System.setProperty("eventlog.maxPayloadSizeMb", "   ");
            assertEquals(16, EventStoreConfig.builder().build().maxPayloadSizeMb());
        }

        @Test
        @DisplayName("Surrounding whitespace is trimmed")
        void testTrimmedSystemProperty() {
            System.setProperty("eventlog.subscriberThreads", " 3 ");
            assertEquals(3, EventStoreConfig.builder().build().subscriberThreads());
        }
    }

    // ========================================================================
    // Programmatic Values
    // ========================================================================

    @Nested
    @DisplayName("Programmatic Values")
    class ProgrammaticTests {

        @Test
        @DisplayName("Builder values take precedence over system properties")
        void testBuilderOverridesSystemProperty() {
            System.setProperty("eventlog.snapshotInterval", "25");
            System.setProperty("eventlog.dataDir", tempDir.resolve("from-prop").toString());

            EventStoreConfig config = EventStoreConfig.builder()
                    .snapshotInterval(7)
                    .dataDir(tempDir.resolve("from-builder"))
                    .build();

            assertEquals(7, config.snapshotInterval());
            assertEquals(tempDir.resolve("from-builder"), config.dataDir());
        }

        @Test
        @DisplayName("dataDir(String) parses a path")
        void testDataDirString() {
            EventStoreConfig config = EventStoreConfig.builder().dataDir(tempDir.toString()).build();
            assertEquals(tempDir, config.dataDir());
        }

        @Test
        @DisplayName("All builder values are kept")
        void testAllBuilderValues() {
            EventStoreConfig config = EventStoreConfig.builder()
                    .snapshotInterval(10)
                    .subscriberThreads(3)
                    .drainTimeoutMs(0)
                    .syncEnabled(false)
                    .maxPayloadSizeMb(1)
                    .build();

            assertEquals(10, config.snapshotInterval());
            assertEquals(3, config.subscriberThreads());
            assertEquals(0L, config.drainTimeoutMs());
            assertFalse(config.syncEnabled());
            assertEquals(1024 * 1024, config.maxPayloadSizeBytes());
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Negative snapshotInterval is rejected")
        void testNegativeSnapshotInterval() {
            assertThrows(IllegalArgumentException.class,
                    () -> EventStoreConfig.builder().snapshotInterval(-1).build());
        }

        @Test
        @DisplayName("Zero subscriber threads is rejected")
        void testZeroSubscriberThreads() {
            assertThrows(IllegalArgumentException.class,
                    () -> EventStoreConfig.builder().subscriberThreads(0).build());
        }

        @Test
        @DisplayName("Negative drain timeout is rejected")
        void testNegativeDrainTimeout() {
            assertThrows(IllegalArgumentException.class,
                    () -> EventStoreConfig.builder().drainTimeoutMs(-5).build());
        }

        @Test
        @DisplayName("Zero maxPayloadSizeMb is rejected")
        void testZeroMaxPayloadSize() {
            assertThrows(IllegalArgumentException.class,
                    () -> EventStoreConfig.builder().maxPayloadSizeMb(0).build());
        }

        @Test
        @DisplayName("Out-of-range system property is rejected at build")
        void testOutOfRangeSystemProperty() {
            System.setProperty("eventlog.subscriberThreads", "0");
            assertThrows(IllegalArgumentException.class, () -> EventStoreConfig.builder().build());
        }
    }
}
