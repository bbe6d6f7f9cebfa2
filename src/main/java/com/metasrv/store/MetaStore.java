package com.metasrv.store;

import com.metasrv.log.LogEntry;
import com.metasrv.log.LogManager;
import com.metasrv.persistence.HardState;
import com.metasrv.persistence.PersistenceManager;
import com.metasrv.persistence.StorageException;
import com.metasrv.snapshot.Snapshot;
import com.metasrv.snapshot.SnapshotManager;
import com.metasrv.snapshot.SnapshotMeta;
import com.metasrv.statemachine.AppliedState;
import com.metasrv.statemachine.Command;
import com.metasrv.statemachine.MetaStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Durable storage of one meta node: hard state, log, snapshot and the state
 * machine rebuilt from them.
 *
 * <p>The data directory is owned exclusively through a lock file; a second
 * {@code open} of the same directory, from this or another process, fails.
 *
 * <h2>Recovery</h2>
 * <ol>
 *   <li>Load hard state and the persisted commit index</li>
 *   <li>Restore the state machine from the snapshot, if any</li>
 *   <li>Load the log; it must continue right after the snapshot</li>
 *   <li>Re-apply log entries up to the persisted commit index</li>
 * </ol>
 *
 * <p>Any inconsistency found on the way is a {@link StorageException}.
 */
public class MetaStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MetaStore.class);

    private static final String LOCK_FILE = "LOCK";
    private static final String HARD_STATE_FILE = "meta.dat";

    private final Path dataDir;
    private final PersistenceManager persistence;
    private final SnapshotManager snapshots;
    private final LogManager log;
    private final MetaStateMachine stateMachine;

    private FileChannel lockChannel;
    private FileLock exclusiveLock;

    private volatile long lastApplied = 0;
    private volatile boolean closed = false;

    private MetaStore(Path dataDir, LongSupplier clockSeconds) {
        this.dataDir = dataDir;
        this.persistence = new PersistenceManager(dataDir);
        this.log = new LogManager();
        this.stateMachine = new MetaStateMachine(clockSeconds);
        try {
            Files.createDirectories(dataDir);
            acquireExclusiveLock();
            this.snapshots = new SnapshotManager(dataDir);
        } catch (IOException e) {
            releaseExclusiveLock();
            throw new StorageException("Cannot initialize store at " + dataDir, e);
        }
    }

    /**
     * Whether {@code dataDir} holds an initialized store.
     */
    public static boolean exists(Path dataDir) {
        return Files.exists(dataDir.resolve(HARD_STATE_FILE));
    }

    /**
     * Creates an empty store.
     *
     * @throws StorageException if a store already exists or the directory is locked
     */
    public static MetaStore create(Path dataDir) {
        return create(dataDir, MetaStore::systemClockSeconds);
    }

    public static MetaStore create(Path dataDir, LongSupplier clockSeconds) {
        if (exists(dataDir)) {
            throw new StorageException("Store already exists at " + dataDir);
        }
        MetaStore store = new MetaStore(dataDir, clockSeconds);
        try {
            store.persistence.init();
            store.persistence.saveHardState(HardState.INITIAL);
            store.log.load(store.persistence, null);
        } catch (IOException | RuntimeException e) {
            store.close();
            if (e instanceof StorageException se) {
                throw se;
            }
            throw new StorageException("Cannot create store at " + dataDir, e);
        }
        logger.info("Created store at {}", dataDir);
        return store;
    }

    /**
     * Opens an existing store and replays it.
     *
     * @throws StorageException if there is no store, it is locked or it is corrupt
     */
    public static MetaStore open(Path dataDir) {
        return open(dataDir, MetaStore::systemClockSeconds);
    }

    public static MetaStore open(Path dataDir, LongSupplier clockSeconds) {
        if (!exists(dataDir)) {
            throw new StorageException("No store at " + dataDir);
        }
        MetaStore store = new MetaStore(dataDir, clockSeconds);
        try {
            store.recover();
        } catch (IOException | RuntimeException e) {
            store.close();
            if (e instanceof StorageException se) {
                throw se;
            }
            throw new StorageException("Cannot open store at " + dataDir, e);
        }
        return store;
    }

    private static long systemClockSeconds() {
        return System.currentTimeMillis() / 1000;
    }

    private void recover() throws IOException {
        persistence.init();

        SnapshotMeta snapshot = snapshots.getMeta();
        if (snapshot != null) {
            stateMachine.restoreSnapshot(snapshots.loadSnapshot());
            lastApplied = snapshot.lastIncludedIndex();
        }

        log.load(persistence, snapshot);

        long committed = Math.min(persistence.getCommitted(), log.getLastIndex());
        int replayed = 0;
        for (LogEntry entry : log.getEntries(lastApplied + 1, committed)) {
            apply(entry);
            replayed++;
        }

        logger.info("Opened store at {}: hardState={}, snapshot={}, replayed {} entries, lastApplied={}",
                dataDir, persistence.getHardState(), snapshot, replayed, lastApplied);
    }

    // ==================== Lock ====================

    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        try {
            exclusiveLock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            throw new StorageException("Store at " + dataDir + " is already open in this JVM", e);
        }
        if (exclusiveLock == null) {
            lockChannel.close();
            throw new StorageException("Store at " + dataDir + " is locked by another process");
        }
        logger.debug("Acquired lock {}", lockPath);
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
            }
        } catch (IOException e) {
            logger.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            logger.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    // ==================== Apply ====================

    /**
     * Applies one committed entry to the state machine. Must be called in log
     * order from a single thread.
     *
     * @throws StorageException if a command entry cannot be decoded
     */
    public AppliedState apply(LogEntry entry) {
        AppliedState result;
        switch (entry.type()) {
            case NORMAL -> {
                Command command;
                try {
                    command = Command.fromBytes(entry.payload());
                } catch (IllegalArgumentException e) {
                    throw new StorageException("Undecodable command at index " + entry.index(), e);
                }
                result = stateMachine.apply(entry.index(), command);
            }
            default -> {
                stateMachine.applyNothing(entry.index());
                result = AppliedState.NOTHING;
            }
        }
        lastApplied = entry.index();
        return result;
    }

    // ==================== Hard state and commit ====================

    public HardState getHardState() {
        return persistence.getHardState();
    }

    public void saveHardState(HardState state) {
        try {
            persistence.saveHardState(state);
        } catch (IOException e) {
            throw new StorageException("Failed to persist hard state " + state, e);
        }
    }

    /**
     * Records the commit index so that a restart replays up to it.
     */
    public void saveCommitted(long index) {
        try {
            persistence.saveCommitted(index);
        } catch (IOException e) {
            throw new StorageException("Failed to persist commit index " + index, e);
        }
    }

    public long getCommitted() {
        return persistence.getCommitted();
    }

    // ==================== Snapshot ====================

    /**
     * Writes a snapshot taken by this node and purges the log up to
     * {@code purgeUpTo}.
     */
    public void saveSnapshot(SnapshotMeta meta, byte[] data, long purgeUpTo) {
        try {
            if (!snapshots.saveSnapshot(data, meta)) {
                return;
            }
        } catch (IOException e) {
            throw new StorageException("Failed to save snapshot at " + meta.lastIncludedIndex(), e);
        }
        if (purgeUpTo > 0) {
            log.purgeTo(Math.min(purgeUpTo, meta.lastIncludedIndex()));
        }
    }

    /**
     * Replaces state machine and log with a snapshot received from the leader.
     */
    public void installSnapshot(SnapshotMeta meta, byte[] data) {
        stateMachine.restoreSnapshot(data);
        try {
            snapshots.saveSnapshot(data, meta);
        } catch (IOException e) {
            throw new StorageException("Failed to save installed snapshot at " + meta.lastIncludedIndex(), e);
        }
        log.resetToSnapshot(meta);
        saveCommitted(meta.lastIncludedIndex());
        lastApplied = meta.lastIncludedIndex();
        logger.info("Installed snapshot {}", meta);
    }

    public SnapshotMeta getSnapshotMeta() {
        return snapshots.getMeta();
    }

    /**
     * Reads the latest snapshot for sending to a replica, or {@code null}.
     */
    public Snapshot loadSnapshot() {
        try {
            return snapshots.loadLatest();
        } catch (IOException e) {
            throw new StorageException("Failed to read snapshot", e);
        }
    }

    // ==================== Accessors ====================

    public LogManager getLog() {
        return log;
    }

    public MetaStateMachine getStateMachine() {
        return stateMachine;
    }

    /**
     * Index of the last entry applied to the state machine.
     */
    public long getLastApplied() {
        return lastApplied;
    }

    public Path getDataDir() {
        return dataDir;
    }

    /**
     * Returns the entries to be applied after {@code fromIndex}, up to {@code toIndex}.
     */
    public List<LogEntry> entriesToApply(long fromIndex, long toIndex) {
        return log.getEntries(fromIndex + 1, toIndex);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        persistence.close();
        releaseExclusiveLock();
        logger.info("Closed store at {}", dataDir);
    }
}
