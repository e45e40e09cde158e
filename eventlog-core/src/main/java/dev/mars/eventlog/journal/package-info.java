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
/**
 * Storage backends for the event store.
 * <p>
 * This package provides the persistence layer behind the store:
 * <ul>
 *   <li>{@link dev.mars.eventlog.journal.EventJournal} - The backend interface</li>
 *   <li>{@link dev.mars.eventlog.journal.InMemoryEventJournal} - Heap-only journal, the default</li>
 *   <li>{@link dev.mars.eventlog.journal.FileEventJournal} - Append-only record file with replay on open</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Append-only:</b> events are never rewritten or removed</li>
 *   <li><b>Sequenced:</b> a journal accepts only the next global position and the next stream version</li>
 *   <li><b>Sequential replay:</b> the file journal rebuilds its read index from the record file on open</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ events.lock  // exclusive lock
 *  └─ events.log   // EVENT and SNAPSHOT records, CRC32C framed
 * </pre>
 *
 * @see dev.mars.eventlog.journal.EventJournal
 */
package dev.mars.eventlog.journal;
