package com.metasrv.log;

import com.metasrv.core.Membership;
import com.metasrv.persistence.PersistenceManager;
import com.metasrv.persistence.StorageException;
import com.metasrv.rpc.proto.EntryType;
import com.metasrv.snapshot.SnapshotMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The replicated log of a node.
 *
 * <p>Indices start at 1. Entries up to {@code purgedIndex} have been removed
 * after a snapshot; {@code purgedTerm} and {@code purgedMembership} describe the
 * log position right before the first retained entry, so that log matching and
 * membership lookups keep working across the purge point.
 *
 * <p>The purge point may lag behind the latest snapshot when the node keeps
 * some applied entries around for slow followers.
 *
 * <h2>Index Translation</h2>
 * <pre>
 * arrayIndex = logIndex - purgedIndex
 * </pre>
 *
 * <p>Every mutation is written through to the {@link PersistenceManager} when
 * one is attached. A failing write is fatal and surfaces as
 * {@link StorageException}.
 *
 * @see LogEntry
 */
public class LogManager {

    private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

    // 1-indexed, position 0 is a placeholder for the purge point
    private final List<LogEntry> entries = new ArrayList<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private PersistenceManager persistence;

    private volatile long purgedIndex = 0;
    private volatile long purgedTerm = 0;
    private volatile Membership purgedMembership = Membership.empty();

    // Last MEMBERSHIP entry in the log, or purgedMembership if there is none
    private volatile Membership latestMembership = Membership.empty();

    public LogManager() {
        entries.add(null);
    }

    /**
     * Attaches persistence and loads the log from disk.
     *
     * <p>Entries already covered by {@code snapshot} are dropped. The retained
     * entries must continue right after the snapshot (or start at index 1 when
     * there is no snapshot).
     *
     * @param persistence the persistence manager to use
     * @param snapshot the snapshot the state machine was restored from, or {@code null}
     * @throws StorageException if the log does not fit the snapshot
     */
    public void load(PersistenceManager persistence, SnapshotMeta snapshot) throws IOException {
        this.persistence = persistence;

        List<LogEntry> loaded = persistence.loadLogs();

        lock.writeLock().lock();
        try {
            if (snapshot != null) {
                purgedIndex = snapshot.lastIncludedIndex();
                purgedTerm = snapshot.lastIncludedTerm();
                purgedMembership = snapshot.membership();
            }

            long expected = purgedIndex + 1;
            for (LogEntry entry : loaded) {
                if (entry.index() < expected) {
                    if (entry.index() == purgedIndex && entry.term() != purgedTerm) {
                        throw new StorageException("Log entry " + entry.index() + " has term " + entry.term()
                                + " but snapshot says " + purgedTerm);
                    }
                    continue;
                }
                if (entry.index() != expected) {
                    throw new StorageException("Log gap: expected index " + expected
                            + " but found " + entry.index() + " (purged up to " + purgedIndex + ")");
                }
                entries.add(entry);
                expected++;
            }

            latestMembership = scanMembership(getLastIndexInternal());

            logger.info("Recovered {} log entries, purged={}, lastIndex={}, membership={}",
                    entries.size() - 1, purgedIndex, getLastIndexInternal(), latestMembership);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int toInternalIndex(long absoluteIndex) {
        return (int) (absoluteIndex - purgedIndex);
    }

    private long getLastIndexInternal() {
        return purgedIndex + entries.size() - 1;
    }

    // ==================== Queries ====================

    /**
     * Get the last log index (the purge point if no entries are retained).
     */
    public long getLastIndex() {
        lock.readLock().lock();
        try {
            return getLastIndexInternal();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getLastTerm() {
        lock.readLock().lock();
        try {
            if (entries.size() <= 1) {
                return purgedTerm;
            }
            return entries.get(entries.size() - 1).term();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the term at a specific index: 0 for index 0, for purged entries and
     * for indices past the end.
     */
    public long getTerm(long index) {
        lock.readLock().lock();
        try {
            if (index <= 0) {
                return 0;
            }
            if (index == purgedIndex) {
                return purgedTerm;
            }
            int internalIndex = toInternalIndex(index);
            if (internalIndex <= 0 || internalIndex >= entries.size()) {
                return 0;
            }
            return entries.get(internalIndex).term();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get entry at a specific index (null if out of bounds or purged).
     */
    public LogEntry getEntry(long index) {
        lock.readLock().lock();
        try {
            int internalIndex = toInternalIndex(index);
            if (internalIndex <= 0 || internalIndex >= entries.size()) {
                return null;
            }
            return entries.get(internalIndex);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get entries in the range [startIndex, endIndex]; the purged part of the
     * range is skipped.
     */
    public List<LogEntry> getEntries(long startIndex, long endIndex) {
        lock.readLock().lock();
        try {
            int internalStart = Math.max(1, toInternalIndex(startIndex));
            int internalEnd = (int) Math.min(entries.size(), (long) toInternalIndex(endIndex) + 1);
            if (internalStart >= internalEnd) {
                return Collections.emptyList();
            }
            return new ArrayList<>(entries.subList(internalStart, internalEnd));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<LogEntry> getEntriesFrom(long startIndex) {
        return getEntries(startIndex, Long.MAX_VALUE - 1);
    }

    public boolean containsEntry(long index) {
        lock.readLock().lock();
        try {
            int internalIndex = toInternalIndex(index);
            return internalIndex > 0 && internalIndex < entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Highest index removed from the log; entries after it are retained.
     */
    public long getPurgedIndex() {
        return purgedIndex;
    }

    public long getPurgedTerm() {
        return purgedTerm;
    }

    /**
     * Returns the effective membership: the last membership entry in the log,
     * or the one in effect at the purge point.
     */
    public Membership getLatestMembership() {
        return latestMembership;
    }

    /**
     * Returns the membership in effect at {@code index}.
     */
    public Membership getMembershipAt(long index) {
        lock.readLock().lock();
        try {
            return scanMembership(Math.min(index, getLastIndexInternal()));
        } finally {
            lock.readLock().unlock();
        }
    }

    private Membership scanMembership(long upTo) {
        for (int i = toInternalIndex(upTo); i >= 1; i--) {
            LogEntry entry = entries.get(i);
            if (entry.isMembership()) {
                return entry.membership();
            }
        }
        return purgedMembership;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size() - 1;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public List<LogEntry> getAllEntries() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries.subList(1, entries.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Mutations ====================

    /**
     * Appends a new entry at the end of the log.
     *
     * @return the appended entry with its assigned index
     */
    public LogEntry append(long term, EntryType type, byte[] payload) {
        lock.writeLock().lock();
        try {
            LogEntry entry = LogEntry.of(getLastIndexInternal() + 1, term, type, payload);
            entries.add(entry);
            if (entry.isMembership()) {
                latestMembership = entry.membership();
            }

            if (persistence != null) {
                try {
                    persistence.appendLog(entry);
                } catch (IOException e) {
                    throw new StorageException("Failed to persist log entry " + entry.index(), e);
                }
            }

            logger.debug("Appended {}", entry);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends entries received from the leader, truncating any conflicting
     * suffix.
     *
     * @param prevLogIndex index of entry immediately preceding new entries
     * @param prevLogTerm term of prevLogIndex entry
     * @param newEntries entries to append
     * @return true if successful, false if log doesn't contain prevLogIndex/prevLogTerm
     */
    public boolean appendEntries(long prevLogIndex, long prevLogTerm, List<LogEntry> newEntries) {
        lock.writeLock().lock();
        try {
            if (prevLogIndex > 0) {
                if (prevLogIndex == purgedIndex) {
                    if (purgedTerm != prevLogTerm) {
                        logger.debug("Term mismatch at purge point {}: {} != {}",
                                prevLogIndex, purgedTerm, prevLogTerm);
                        return false;
                    }
                } else if (prevLogIndex > purgedIndex) {
                    int internalPrev = toInternalIndex(prevLogIndex);
                    if (internalPrev >= entries.size()) {
                        logger.debug("Log doesn't contain prevLogIndex {}", prevLogIndex);
                        return false;
                    }
                    long termAtPrev = entries.get(internalPrev).term();
                    if (termAtPrev != prevLogTerm) {
                        logger.debug("Term mismatch at index {}: {} != {}", prevLogIndex, termAtPrev, prevLogTerm);
                        return false;
                    }
                }
                // prevLogIndex < purgedIndex: covered by a snapshot, which only holds committed entries
            }

            List<LogEntry> appended = new ArrayList<>();
            boolean truncated = false;

            for (LogEntry newEntry : newEntries) {
                int internalInsert = toInternalIndex(newEntry.index());

                if (internalInsert <= 0) {
                    continue;
                }
                if (internalInsert < entries.size()) {
                    if (entries.get(internalInsert).term() == newEntry.term()) {
                        continue;
                    }
                    logger.info("Conflict at index {}, truncating", newEntry.index());
                    entries.subList(internalInsert, entries.size()).clear();
                    truncated = true;
                }
                entries.add(newEntry);
                appended.add(newEntry);
            }

            if (truncated || !appended.isEmpty()) {
                latestMembership = scanMembership(getLastIndexInternal());
            }

            if (persistence != null) {
                try {
                    if (truncated) {
                        persistence.rewriteLog(entries.subList(1, entries.size()));
                    } else {
                        persistence.appendLogs(appended);
                    }
                } catch (IOException e) {
                    throw new StorageException("Failed to persist log entries", e);
                }
            }

            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes entries up to and including {@code index}. The term and the
     * membership at {@code index} are remembered as the new purge point.
     */
    public void purgeTo(long index) {
        lock.writeLock().lock();
        try {
            if (index <= purgedIndex) {
                return;
            }
            int internalPurge = toInternalIndex(index);
            if (internalPurge >= entries.size()) {
                logger.warn("Cannot purge to {}, last index is {}", index, getLastIndexInternal());
                return;
            }

            Membership membershipAtPurge = scanMembership(index);
            long termAtPurge = entries.get(internalPurge).term();

            List<LogEntry> remaining = new ArrayList<>(entries.subList(internalPurge + 1, entries.size()));
            entries.clear();
            entries.add(null);
            entries.addAll(remaining);

            purgedIndex = index;
            purgedTerm = termAtPurge;
            purgedMembership = membershipAtPurge;

            logger.info("Purged log up to index {}, {} entries remaining", index, remaining.size());

            if (persistence != null) {
                try {
                    persistence.rewriteLog(remaining);
                } catch (IOException e) {
                    throw new StorageException("Failed to persist log purge", e);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Discards the whole log after a snapshot from the leader was installed.
     */
    public void resetToSnapshot(SnapshotMeta snapshot) {
        lock.writeLock().lock();
        try {
            entries.clear();
            entries.add(null);
            purgedIndex = snapshot.lastIncludedIndex();
            purgedTerm = snapshot.lastIncludedTerm();
            purgedMembership = snapshot.membership();
            latestMembership = purgedMembership;

            logger.info("Reset log to snapshot: index={}, term={}", purgedIndex, purgedTerm);

            if (persistence != null) {
                try {
                    persistence.rewriteLog(Collections.emptyList());
                } catch (IOException e) {
                    throw new StorageException("Failed to clear persisted log", e);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
}
