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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link InMemoryEventJournal}: the append contract every journal
 * enforces and the read views it hands out.
 */
class InMemoryEventJournalTest {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private InMemoryEventJournal journal;

    @BeforeEach
    void setUp() {
        journal = new InMemoryEventJournal();
        journal.open();
    }

    private static Event event(long position, String aggregateId, long version) {
        return new Event("e-" + position, position, aggregateId, "T", JSON.objectNode(), Map.of(), version, Instant.EPOCH);
    }

    @Test
    void testEmptyJournal() {
        assertEquals(0, journal.lastPosition());
        assertEquals(0, journal.streamVersion("a"));
        assertTrue(journal.readStream("a", 1).isEmpty());
        assertTrue(journal.readAll(1).isEmpty());
        assertEquals(0, journal.aggregateCount());
    }

    @Test
    void testAppend_InSequence() {
        journal.append(event(1, "a", 1));
        journal.append(event(2, "b", 1));
        journal.append(event(3, "a", 2));

        assertEquals(3, journal.lastPosition());
        assertEquals(2, journal.streamVersion("a"));
        assertEquals(2, journal.aggregateCount());
        assertEquals(List.of("e-2", "e-3"), journal.readAll(2).stream().map(Event::eventId).toList());
        assertEquals(List.of("e-3"), journal.readStream("a", 2).stream().map(Event::eventId).toList());
    }

    @Test
    void testAppend_PositionGapRejected() {
        journal.append(event(1, "a", 1));
        JournalException e = assertThrows(JournalException.class, () -> journal.append(event(3, "a", 2)));
        assertTrue(e.getMessage().contains("3"));
        assertEquals(1, journal.lastPosition());
    }

    @Test
    void testAppend_VersionGapRejected_NoStreamCreated() {
        assertThrows(JournalException.class, () -> journal.append(event(1, "a", 2)));
        assertEquals(0, journal.lastPosition());
        assertEquals(0, journal.aggregateCount());
    }

    @Test
    void testReads_AreSnapshotsNotViews() {
        journal.append(event(1, "a", 1));
        List<Event> before = journal.readAll(1);
        journal.append(event(2, "a", 2));

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(event(9, "z", 1)));
    }

    @Test
    void testReads_BeyondEnd() {
        journal.append(event(1, "a", 1));
        assertTrue(journal.readAll(5).isEmpty());
        assertTrue(journal.readStream("a", 5).isEmpty());
    }

    @Test
    void testSnapshots_NewestWins() {
        journal.saveSnapshot(new Snapshot("a", 1, JSON.objectNode().put("v", 1), Instant.EPOCH));
        journal.saveSnapshot(new Snapshot("a", 3, JSON.objectNode().put("v", 3), Instant.EPOCH));

        assertEquals(3, journal.loadSnapshot("a").orElseThrow().version());
        assertTrue(journal.loadSnapshot("b").isEmpty());
    }

    // ========================================================================
    // Model Records
    // ========================================================================

    @Test
    void testEvent_RejectsInvalidNumbers() {
        assertThrows(IllegalArgumentException.class, () -> event(0, "a", 1));
        assertThrows(IllegalArgumentException.class, () -> event(1, "a", 0));
        assertThrows(NullPointerException.class,
                () -> new Event(null, 1, "a", "T", JSON.objectNode(), Map.of(), 1, Instant.EPOCH));
    }

    @Test
    void testSnapshot_CopiesState() {
        var state = JSON.objectNode().put("v", 1);
        Snapshot snapshot = new Snapshot("a", 0, state, Instant.EPOCH);
        state.put("v", 2);

        assertEquals(1, snapshot.state().get("v").asInt());
        assertThrows(IllegalArgumentException.class, () -> new Snapshot("a", -1, state, Instant.EPOCH));
    }
}
