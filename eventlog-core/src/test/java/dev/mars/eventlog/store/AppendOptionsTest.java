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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.eventlog.model.Event;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the write-option value types: ExpectedVersion, AppendOptions
 * and IdempotencyGuard.
 */
class AppendOptionsTest {

    // ========================================================================
    // ExpectedVersion
    // ========================================================================

    @Nested
    @DisplayName("ExpectedVersion")
    class ExpectedVersionTests {

        @Test
        @DisplayName("any() matches every version and has no value")
        void testAny() {
            ExpectedVersion any = ExpectedVersion.any();
            assertTrue(any.isAny());
            assertTrue(any.matches(0));
            assertTrue(any.matches(42));
            assertThrows(IllegalStateException.class, any::value);
        }

        @Test
        @DisplayName("noStream() matches only version 0")
        void testNoStream() {
            ExpectedVersion none = ExpectedVersion.noStream();
            assertFalse(none.isAny());
            assertEquals(0, none.value());
            assertTrue(none.matches(0));
            assertFalse(none.matches(1));
            assertEquals(none, ExpectedVersion.exactly(0));
        }

        @Test
        @DisplayName("exactly(v) matches only v")
        void testExactly() {
            ExpectedVersion three = ExpectedVersion.exactly(3);
            assertTrue(three.matches(3));
            assertFalse(three.matches(2));
            assertEquals(ExpectedVersion.exactly(3), three);
            assertEquals(ExpectedVersion.exactly(3).hashCode(), three.hashCode());
            assertNotEquals(ExpectedVersion.any(), three);
        }

        @Test
        @DisplayName("Negative versions are rejected")
        void testNegative() {
            assertThrows(IllegalArgumentException.class, () -> ExpectedVersion.exactly(-1));
        }

        @Test
        @DisplayName("verify() throws with the aggregate and both versions")
        void testVerify() {
            ConcurrencyException e = assertThrows(ConcurrencyException.class,
                    () -> ExpectedVersion.exactly(2).verify("acct-1", 5));
            assertEquals("acct-1", e.aggregateId());
            assertEquals(2, e.expectedVersion());
            assertEquals(5, e.actualVersion());
            assertTrue(e.getMessage().contains("acct-1"));
            assertDoesNotThrow(() -> ExpectedVersion.any().verify("acct-1", 5));
        }
    }

    // ========================================================================
    // AppendOptions
    // ========================================================================

    @Nested
    @DisplayName("AppendOptions")
    class AppendOptionsTests {

        @Test
        @DisplayName("Defaults: any version, generated id, no metadata")
        void testDefaults() {
            AppendOptions options = AppendOptions.defaults();
            assertTrue(options.expectedVersion().isAny());
            assertNull(options.eventId());
            assertTrue(options.metadata().isEmpty());
        }

        @Test
        @DisplayName("Shorthands set a single option")
        void testShorthands() {
            assertEquals(ExpectedVersion.exactly(4), AppendOptions.expectVersion(4).expectedVersion());
            assertEquals("e-1", AppendOptions.withEventId("e-1").eventId());
        }

        @Test
        @DisplayName("Metadata keeps insertion order and is immutable")
        void testMetadata() {
            AppendOptions options = AppendOptions.builder()
                    .metadata("b", "2")
                    .metadata(Map.of("a", "1"))
                    .build();

            assertEquals(List.of("b", "a"), List.copyOf(options.metadata().keySet()));
            assertThrows(UnsupportedOperationException.class, () -> options.metadata().put("c", "3"));
        }

        @Test
        @DisplayName("Blank event id and null metadata are rejected")
        void testInvalidValues() {
            assertThrows(IllegalArgumentException.class, () -> AppendOptions.builder().eventId(" "));
            assertThrows(NullPointerException.class, () -> AppendOptions.builder().metadata("k", null));
            assertThrows(NullPointerException.class,
                    () -> AppendOptions.builder().expectedVersion((ExpectedVersion) null));
        }
    }

    // ========================================================================
    // IdempotencyGuard
    // ========================================================================

    @Nested
    @DisplayName("IdempotencyGuard")
    class IdempotencyGuardTests {

        @Test
        @DisplayName("tryMark claims an id once; release frees it")
        void testMarkAndRelease() {
            IdempotencyGuard guard = new IdempotencyGuard();
            assertFalse(guard.isProcessed("e-1"));
            assertTrue(guard.tryMark("e-1"));
            assertFalse(guard.tryMark("e-1"));
            assertTrue(guard.isProcessed("e-1"));

            guard.release("e-1");
            assertFalse(guard.isProcessed("e-1"));
            assertEquals(0, guard.size());
        }

        @Test
        @DisplayName("seed marks the ids of stored events")
        void testSeed() {
            IdempotencyGuard guard = new IdempotencyGuard();
            guard.seed(List.of(
                    new Event("e-1", 1, "a", "T", JsonNodeFactory.instance.objectNode(), Map.of(), 1, Instant.EPOCH),
                    new Event("e-2", 2, "a", "T", JsonNodeFactory.instance.objectNode(), Map.of(), 2, Instant.EPOCH)));

            assertEquals(2, guard.size());
            assertTrue(guard.isProcessed("e-2"));
        }
    }
}
