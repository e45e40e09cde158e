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

import dev.mars.eventlog.EventStoreConfig;
import dev.mars.eventlog.model.Event;
import dev.mars.eventlog.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * File-based implementation of {@link EventJournal}.
 * <p>
 * Events and snapshots are written to one append-only record file. All reads
 * are served from an {@link InMemoryEventJournal} index that is rebuilt by
 * replaying the file when the journal is opened.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ events.lock  // exclusive process lock
 *  └─ events.log   // append-only: EVENT and SNAPSHOT records
 * </pre>
 * <p>
 * <b>Record Format:</b>
 * <pre>
 * MAGIC(4) VERSION(2) TYPE(1) SEQUENCE(8) LENGTH(4) BODY(LENGTH) CRC32C(4)
 * </pre>
 * {@code SEQUENCE} is the global position for EVENT records and the stream
 * version for SNAPSHOT records. {@code BODY} is the JSON encoding of the record.
 * <p>
 * <b>Thread Safety:</b>
 * All writes are serialized on a single monitor so the channel position is
 * always consistent. A record is added to the read index only after it has been
 * written (and forced, when sync is enabled).
 * <p>
 * <b>Recovery:</b>
 * A torn or corrupt record at the tail is truncated on open; everything before
 * it is recovered. A snapshot record supersedes earlier snapshots of the same
 * aggregate.
 *
 * @see EventJournal
 */
public final class FileEventJournal implements EventJournal {

    private static final Logger LOG = LoggerFactory.getLogger(FileEventJournal.class);

    /** Magic number: 'EVLG' in ASCII */
    private static final int MAGIC = 0x45564C47;

    /** Record format version */
    private static final short FORMAT_VERSION = 1;

    /** Record type: an appended event */
    private static final byte TYPE_EVENT = 1;

    /** Record type: an aggregate snapshot */
    private static final byte TYPE_SNAPSHOT = 2;

    /** Header size: MAGIC(4) + VERSION(2) + TYPE(1) + SEQUENCE(8) + LENGTH(4) */
    private static final int HEADER_SIZE = 4 + 2 + 1 + 8 + 4;

    private static final int CRC_SIZE = 4;

    private static final String LOCK_FILE = "events.lock";

    private static final String LOG_FILE = "events.log";

    private final Path dataDir;
    private final boolean syncEnabled;
    private final int maxRecordSize;
    private final JournalCodec codec = new JournalCodec();
    private final InMemoryEventJournal index = new InMemoryEventJournal();
    private final Object writeMonitor = new Object();

    private FileChannel logChannel;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private volatile boolean opened = false;
    private volatile boolean closed = false;

    /**
     * Creates a journal using the data directory, sync and size settings of {@code config}.
     *
     * @param config the store configuration
     */
    public FileEventJournal(EventStoreConfig config) {
        this(config.dataDir(), config.syncEnabled(), config.maxPayloadSizeBytes());
    }

    /**
     * Creates a journal in {@code dataDir}.
     *
     * @param dataDir       directory holding the journal files
     * @param syncEnabled   if false, appends are not forced to disk (ONLY for testing!)
     * @param maxRecordSize largest accepted record body in bytes
     */
    public FileEventJournal(Path dataDir, boolean syncEnabled, int maxRecordSize) {
        if (maxRecordSize < 1) {
            throw new IllegalArgumentException("maxRecordSize must be >= 1, got " + maxRecordSize);
        }
        this.dataDir = dataDir;
        this.syncEnabled = syncEnabled;
        this.maxRecordSize = maxRecordSize;

        LOG.info("FileEventJournal initialized: dataDir={}, syncEnabled={}, maxRecordSize={} bytes",
                dataDir, syncEnabled, maxRecordSize);
        if (!syncEnabled) {
            LOG.warn("FileEventJournal created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /** Directory holding the journal files. */
    public Path dataDir() {
        return dataDir;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public void open() {
        synchronized (writeMonitor) {
            if (opened) {
                LOG.debug("Journal already open at {}", dataDir);
                return;
            }
            if (closed) {
                throw new IllegalStateException("Journal at " + dataDir + " has been closed");
            }
            try {
                LOG.info("Opening event journal at: {}", dataDir);
                Files.createDirectories(dataDir);
                acquireExclusiveLock();

                Path logPath = dataDir.resolve(LOG_FILE);
                this.logChannel = FileChannel.open(logPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.READ,
                        StandardOpenOption.WRITE);

                replay();
                logChannel.position(logChannel.size());
                opened = true;
                LOG.info("Event journal opened: path={}, size={} bytes, events={}, aggregates={}",
                        logPath, logChannel.size(), index.lastPosition(), index.aggregateCount());

            } catch (IOException e) {
                LOG.error("Failed to open journal at {}: {}", dataDir, e.getMessage(), e);
                closeQuietly();
                throw new JournalException("Failed to open journal at " + dataDir, e);
            } catch (RuntimeException e) {
                closeQuietly();
                throw e;
            }
        }
    }

    @Override
    public void close() {
        synchronized (writeMonitor) {
            if (closed) {
                LOG.debug("Journal already closed, ignoring duplicate close()");
                return;
            }
            closed = true;
            LOG.info("Closing event journal at: {}", dataDir);
            closeQuietly();
            index.close();
        }
    }

    // ========================================================================
    // Writes
    // ========================================================================

    @Override
    public void append(Event event) {
        byte[] body = codec.encodeEvent(event);
        synchronized (writeMonitor) {
            ensureOpen();
            index.verifyAppendable(event);
            writeRecord(TYPE_EVENT, event.globalPosition(), body);
            index.append(event);
        }
        LOG.debug("Journaled event: position={}, aggregateId={}, version={}, {} bytes",
                event.globalPosition(), event.aggregateId(), event.version(), body.length);
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        byte[] body = codec.encodeSnapshot(snapshot);
        synchronized (writeMonitor) {
            ensureOpen();
            writeRecord(TYPE_SNAPSHOT, snapshot.version(), body);
            index.saveSnapshot(snapshot);
        }
        LOG.debug("Journaled snapshot: aggregateId={}, version={}, {} bytes",
                snapshot.aggregateId(), snapshot.version(), body.length);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public List<Event> readStream(String aggregateId, long fromVersion) {
        return index.readStream(aggregateId, fromVersion);
    }

    @Override
    public List<Event> readAll(long fromPosition) {
        return index.readAll(fromPosition);
    }

    @Override
    public long streamVersion(String aggregateId) {
        return index.streamVersion(aggregateId);
    }

    @Override
    public long lastPosition() {
        return index.lastPosition();
    }

    @Override
    public Optional<Snapshot> loadSnapshot(String aggregateId) {
        return index.loadSnapshot(aggregateId);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Journal at " + dataDir + " has been closed");
        }
        if (!opened) {
            throw new IllegalStateException("Journal at " + dataDir + " is not open");
        }
    }

    /**
     * Writes a single record and forces it when sync is enabled.
     * On failure the file is cut back to where the record started.
     * Must be called holding {@code writeMonitor}.
     */
    private void writeRecord(byte type, long sequence, byte[] body) {
        if (body.length > maxRecordSize) {
            LOG.error("Record too large: {} bytes (max: {})", body.length, maxRecordSize);
            throw new JournalException("Record too large: " + body.length +
                    " bytes (max: " + maxRecordSize + ")");
        }

        int recordSize = HEADER_SIZE + body.length + CRC_SIZE;
        ByteBuffer buf = ByteBuffer.allocate(recordSize);
        buf.putInt(MAGIC);
        buf.putShort(FORMAT_VERSION);
        buf.put(type);
        buf.putLong(sequence);
        buf.putInt(body.length);
        buf.put(body);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + body.length);
        buf.putInt((int) crc.getValue());
        buf.flip();

        long startPosition = -1;
        try {
            startPosition = logChannel.position();
            LOG.trace("Writing record: type={}, sequence={}, {} bytes at position {}",
                    type == TYPE_EVENT ? "EVENT" : "SNAPSHOT", sequence, recordSize, startPosition);
            while (buf.hasRemaining()) {
                logChannel.write(buf);
            }
            if (syncEnabled) {
                logChannel.force(false);
            }
        } catch (IOException e) {
            LOG.error("Failed to write journal record: {}", e.getMessage(), e);
            rollbackTo(startPosition);
            throw new JournalException("Failed to write journal record", e);
        }
    }

    private void rollbackTo(long position) {
        if (position < 0) {
            return;
        }
        try {
            logChannel.truncate(position);
            logChannel.position(position);
        } catch (IOException e) {
            LOG.error("Could not roll back partial record at position {}: {}", position, e.getMessage(), e);
        }
    }

    /**
     * Replays the record file into the read index and truncates a torn tail.
     */
    private void replay() throws IOException {
        long startTime = System.currentTimeMillis();
        long fileSize = logChannel.size();
        long pos = 0;
        int eventCount = 0;
        int snapshotCount = 0;
        ByteBuffer headerBuf = ByteBuffer.allocate(HEADER_SIZE);

        while (true) {
            headerBuf.clear();
            int headerRead = logChannel.read(headerBuf, pos);
            if (headerRead < HEADER_SIZE) {
                if (headerRead > 0) {
                    LOG.debug("Incomplete header at pos {}: read {} bytes, expected {}",
                            pos, headerRead, HEADER_SIZE);
                }
                break;
            }
            headerBuf.flip();

            int magic = headerBuf.getInt();
            short version = headerBuf.getShort();
            byte type = headerBuf.get();
            long sequence = headerBuf.getLong();
            int bodyLen = headerBuf.getInt();

            if (magic != MAGIC || version != FORMAT_VERSION) {
                LOG.warn("Invalid header at pos {}: magic=0x{}, version={}",
                        pos, Integer.toHexString(magic), version);
                break;
            }
            if (bodyLen < 0 || bodyLen > maxRecordSize) {
                LOG.warn("Invalid record length at pos {}: {}", pos, bodyLen);
                break;
            }

            ByteBuffer bodyBuf = ByteBuffer.allocate(bodyLen);
            if (logChannel.read(bodyBuf, pos + HEADER_SIZE) < bodyLen) {
                LOG.debug("Incomplete body at pos {}", pos);
                break;
            }
            bodyBuf.flip();

            ByteBuffer crcBuf = ByteBuffer.allocate(CRC_SIZE);
            if (logChannel.read(crcBuf, pos + HEADER_SIZE + bodyLen) < CRC_SIZE) {
                LOG.debug("Incomplete CRC at pos {}", pos);
                break;
            }
            crcBuf.flip();
            int expectedCrc = crcBuf.getInt();

            CRC32C crc = new CRC32C();
            headerBuf.rewind();
            crc.update(headerBuf);
            crc.update(bodyBuf.duplicate());
            if ((int) crc.getValue() != expectedCrc) {
                LOG.warn("CRC mismatch at pos {}: expected={}, computed={}",
                        pos, expectedCrc, (int) crc.getValue());
                break;
            }

            byte[] body = new byte[bodyLen];
            bodyBuf.get(body);
            if (type == TYPE_EVENT) {
                Event event = decode(() -> codec.decodeEvent(body), pos);
                if (event.globalPosition() != sequence) {
                    throw new JournalException("Corrupt journal at pos " + pos + ": header sequence "
                            + sequence + " does not match event position " + event.globalPosition());
                }
                index.append(event);
                eventCount++;
            } else if (type == TYPE_SNAPSHOT) {
                index.saveSnapshot(decode(() -> codec.decodeSnapshot(body), pos));
                snapshotCount++;
            } else {
                LOG.warn("Unknown record type at pos {}: {}", pos, type);
                break;
            }

            pos = pos + HEADER_SIZE + bodyLen + CRC_SIZE;
        }

        if (pos < fileSize) {
            LOG.warn("Truncating torn tail: {} bytes removed (file was {} bytes, valid data {} bytes)",
                    fileSize - pos, fileSize, pos);
            logChannel.truncate(pos);
        }

        LOG.info("Journal replay complete: {} events, {} snapshot records, {} ms",
                eventCount, snapshotCount, System.currentTimeMillis() - startTime);
    }

    private static <T> T decode(RecordDecoder<T> decoder, long pos) {
        try {
            return decoder.decode();
        } catch (IOException | RuntimeException e) {
            LOG.error("Undecodable record at pos {} with valid CRC: {}", pos, e.getMessage(), e);
            throw new JournalException("Corrupt journal record at pos " + pos, e);
        }
    }

    @FunctionalInterface
    private interface RecordDecoder<T> {
        T decode() throws IOException;
    }

    /**
     * Acquires an exclusive lock on the data directory to prevent multiple writers.
     *
     * @throws JournalException if another process or journal instance holds the lock
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new JournalException(
                        "Cannot acquire exclusive lock on journal directory: " + dataDir +
                        ". Another process may be using this journal.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new JournalException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void closeQuietly() {
        try {
            if (logChannel != null && logChannel.isOpen()) {
                logChannel.close();
                LOG.debug("Log channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing log channel: {}", e.getMessage());
        }
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }
}
