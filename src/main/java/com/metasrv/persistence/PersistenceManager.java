package com.metasrv.persistence;

import com.metasrv.core.NodeId;
import com.metasrv.log.LogEntry;
import com.metasrv.rpc.proto.EntryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32C;

/**
 * Persists the hard state, the commit index and the log of a node.
 *
 * Files:
 * - meta.dat: currentTerm, votedFor and a CRC (replaced atomically on every update)
 * - commit.dat: highest index known committed, used to replay on restart
 * - log.dat: append-only log records, each {@code [length][record][crc]}
 *
 * A record whose CRC does not match is corruption and fails with
 * {@link StorageException}. An incomplete record at the tail is the remains of
 * an interrupted append and is cut off.
 */
public class PersistenceManager {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceManager.class);

    private static final String META_FILE = "meta.dat";
    private static final String COMMIT_FILE = "commit.dat";
    private static final String LOG_FILE = "log.dat";

    private final Path dataDir;
    private final Path metaFile;
    private final Path commitFile;
    private final Path logFile;

    private HardState hardState = HardState.INITIAL;
    private long committed = 0;

    private RandomAccessFile logRaf;

    public PersistenceManager(Path dataDir) {
        this.dataDir = dataDir;
        this.metaFile = dataDir.resolve(META_FILE);
        this.commitFile = dataDir.resolve(COMMIT_FILE);
        this.logFile = dataDir.resolve(LOG_FILE);
    }

    /**
     * Creates the directory if needed and loads hard state and commit index.
     */
    public void init() throws IOException {
        Files.createDirectories(dataDir);

        if (Files.exists(metaFile)) {
            loadMeta();
        }
        if (Files.exists(commitFile)) {
            loadCommitted();
        }

        logRaf = new RandomAccessFile(logFile.toFile(), "rw");

        logger.info("PersistenceManager initialized at {}", dataDir);
    }

    public void close() {
        try {
            if (logRaf != null) {
                logRaf.close();
            }
        } catch (IOException e) {
            logger.warn("Error closing log file", e);
        }
    }

    // ==================== Hard state ====================

    /**
     * Saves term and votedFor atomically. Must complete before answering any RPC
     * that depends on them.
     */
    public synchronized void saveHardState(HardState state) throws IOException {
        Path tempFile = dataDir.resolve(META_FILE + ".tmp");

        try (DataOutputStream dos = new DataOutputStream(
                new BufferedOutputStream(Files.newOutputStream(tempFile)))) {
            byte[] body = encodeHardState(state);
            dos.write(body);
            dos.writeInt(crc(body));
        }

        Files.move(tempFile, metaFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        this.hardState = state;

        logger.debug("Saved hard state: {}", state);
    }

    private void loadMeta() throws IOException {
        byte[] all = Files.readAllBytes(metaFile);
        if (all.length < 4) {
            throw new StorageException("Corrupt " + META_FILE + ": too short (" + all.length + " bytes)");
        }
        int bodyLen = all.length - 4;
        byte[] body = new byte[bodyLen];
        System.arraycopy(all, 0, body, 0, bodyLen);
        int expected = new DataInputStream(new ByteArrayInputStream(all, bodyLen, 4)).readInt();
        if (crc(body) != expected) {
            throw new StorageException("Corrupt " + META_FILE + ": CRC mismatch");
        }

        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(body))) {
            long term = dis.readLong();
            NodeId votedFor = dis.readBoolean() ? NodeId.of(dis.readLong()) : null;
            hardState = new HardState(term, votedFor);
        }

        logger.info("Loaded hard state: {}", hardState);
    }

    private static byte[] encodeHardState(HardState state) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (DataOutputStream dos = new DataOutputStream(bos)) {
            dos.writeLong(state.currentTerm());
            dos.writeBoolean(state.votedFor() != null);
            if (state.votedFor() != null) {
                dos.writeLong(state.votedFor().id());
            }
        }
        return bos.toByteArray();
    }

    public synchronized HardState getHardState() {
        return hardState;
    }

    // ==================== Commit index ====================

    /**
     * Records that everything up to {@code index} is committed. Not fsync'd: a
     * lost update only means fewer entries are replayed locally, the rest
     * arrives again from the leader.
     */
    public synchronized void saveCommitted(long index) throws IOException {
        if (index <= committed) {
            return;
        }
        Path tempFile = dataDir.resolve(COMMIT_FILE + ".tmp");
        try (DataOutputStream dos = new DataOutputStream(
                new BufferedOutputStream(Files.newOutputStream(tempFile)))) {
            dos.writeLong(index);
        }
        Files.move(tempFile, commitFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        committed = index;
    }

    private void loadCommitted() throws IOException {
        try (DataInputStream dis = new DataInputStream(
                new BufferedInputStream(Files.newInputStream(commitFile)))) {
            committed = dis.readLong();
        } catch (EOFException e) {
            throw new StorageException("Corrupt " + COMMIT_FILE, e);
        }
        logger.info("Loaded commit index: {}", committed);
    }

    public synchronized long getCommitted() {
        return committed;
    }

    // ==================== Log ====================

    public void appendLog(LogEntry entry) throws IOException {
        appendLogs(List.of(entry));
    }

    /**
     * Appends entries and fsyncs once for the batch.
     */
    public void appendLogs(List<LogEntry> entries) throws IOException {
        if (entries.isEmpty()) {
            return;
        }

        synchronized (this) {
            logRaf.seek(logRaf.length());
            for (LogEntry entry : entries) {
                writeRecord(logRaf, entry);
            }
            logRaf.getFD().sync();
        }

        logger.trace("Appended {} log entries", entries.size());
    }

    /**
     * Loads all log records in file order.
     *
     * @throws StorageException if a record is corrupt
     */
    public synchronized List<LogEntry> loadLogs() throws IOException {
        List<LogEntry> entries = new ArrayList<>();
        long length = logRaf.length();
        long pos = 0;

        logRaf.seek(0);
        while (pos < length) {
            if (length - pos < 4) {
                break;
            }
            int recordLen = logRaf.readInt();
            if (recordLen < 0) {
                throw new StorageException("Corrupt " + LOG_FILE + ": negative record length at " + pos);
            }
            if (length - pos - 4 < (long) recordLen + 4) {
                break;
            }
            byte[] record = new byte[recordLen];
            logRaf.readFully(record);
            int expected = logRaf.readInt();
            if (crc(record) != expected) {
                throw new StorageException("Corrupt " + LOG_FILE + ": CRC mismatch at offset " + pos);
            }
            LogEntry entry = decodeEntry(record);
            if (!entries.isEmpty() && entry.index() != entries.get(entries.size() - 1).index() + 1) {
                throw new StorageException("Corrupt " + LOG_FILE + ": index " + entry.index()
                        + " follows " + entries.get(entries.size() - 1).index());
            }
            entries.add(entry);
            pos += 4 + recordLen + 4;
        }

        if (pos < length) {
            logger.warn("Discarding incomplete log record at offset {} ({} trailing bytes)", pos, length - pos);
            logRaf.setLength(pos);
        }

        logger.info("Loaded {} log entries from disk", entries.size());
        return entries;
    }

    /**
     * Rewrites the log file with exactly the given entries. Used after
     * truncation on conflict and after compaction.
     */
    public synchronized void rewriteLog(List<LogEntry> entries) throws IOException {
        logRaf.close();

        Path tempFile = dataDir.resolve(LOG_FILE + ".tmp");
        try (RandomAccessFile out = new RandomAccessFile(tempFile.toFile(), "rw")) {
            out.setLength(0);
            for (LogEntry entry : entries) {
                writeRecord(out, entry);
            }
            out.getFD().sync();
        }
        Files.move(tempFile, logFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        logRaf = new RandomAccessFile(logFile.toFile(), "rw");

        logger.debug("Rewrote log with {} entries", entries.size());
    }

    // ==================== Serialization ====================

    private static void writeRecord(RandomAccessFile raf, LogEntry entry) throws IOException {
        byte[] record = encodeEntry(entry);
        raf.writeInt(record.length);
        raf.write(record);
        raf.writeInt(crc(record));
    }

    private static byte[] encodeEntry(LogEntry entry) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (DataOutputStream dos = new DataOutputStream(bos)) {
            dos.writeLong(entry.index());
            dos.writeLong(entry.term());
            dos.writeInt(entry.type().getNumber());
            dos.writeInt(entry.payload().length);
            dos.write(entry.payload());
        }
        return bos.toByteArray();
    }

    private static LogEntry decodeEntry(byte[] record) throws IOException {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(record))) {
            long index = dis.readLong();
            long term = dis.readLong();
            EntryType type = EntryType.forNumber(dis.readInt());
            if (type == null) {
                throw new StorageException("Corrupt " + LOG_FILE + ": unknown entry type at index " + index);
            }
            byte[] payload = new byte[dis.readInt()];
            dis.readFully(payload);
            return new LogEntry(index, term, type, payload);
        }
    }

    private static int crc(byte[] data) {
        CRC32C crc = new CRC32C();
        crc.update(data, 0, data.length);
        return (int) crc.getValue();
    }

    public Path getDataDir() {
        return dataDir;
    }
}
