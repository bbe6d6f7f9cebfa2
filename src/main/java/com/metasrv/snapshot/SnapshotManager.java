package com.metasrv.snapshot;

import com.metasrv.core.Membership;
import com.metasrv.persistence.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.util.zip.CRC32C;

/**
 * Stores the latest state machine snapshot of a node.
 *
 * <h2>Snapshot Files</h2>
 * <ul>
 *   <li><b>snapshot.dat</b> - serialized state machine</li>
 *   <li><b>snapshot.meta</b> - {@link SnapshotMeta} (last included index and
 *       term, membership) followed by the CRC of snapshot.dat</li>
 * </ul>
 *
 * <p>Both files are written to temporaries, fsync'd, then renamed into place;
 * the meta file is renamed last so it never describes a data file that is not
 * there yet.
 *
 * @see com.metasrv.statemachine.StateMachine#takeSnapshot()
 * @see com.metasrv.statemachine.StateMachine#restoreSnapshot(byte[])
 */
public class SnapshotManager {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotManager.class);

    private static final String SNAPSHOT_FILE = "snapshot.dat";
    private static final String META_FILE = "snapshot.meta";

    private final Path dataDir;
    private final Path snapshotFile;
    private final Path metaFile;

    private volatile SnapshotMeta meta;
    private int dataCrc;

    public SnapshotManager(Path dataDir) throws IOException {
        this.dataDir = dataDir;
        this.snapshotFile = dataDir.resolve(SNAPSHOT_FILE);
        this.metaFile = dataDir.resolve(META_FILE);

        Files.createDirectories(dataDir);
        loadMetadata();

        logger.info("SnapshotManager initialized at {}, snapshot={}", dataDir, meta);
    }

    /**
     * Saves a snapshot. Older snapshots are replaced; a snapshot not newer than
     * the current one is ignored.
     *
     * @return {@code true} if the snapshot was written
     */
    public synchronized boolean saveSnapshot(byte[] data, SnapshotMeta snapshotMeta) throws IOException {
        if (meta != null && snapshotMeta.lastIncludedIndex() <= meta.lastIncludedIndex()) {
            logger.debug("Skipping snapshot at {}, already have {}", snapshotMeta.lastIncludedIndex(),
                    meta.lastIncludedIndex());
            return false;
        }

        Path tempSnapshot = dataDir.resolve(SNAPSHOT_FILE + ".tmp");
        Path tempMeta = dataDir.resolve(META_FILE + ".tmp");

        try {
            writeSynced(tempSnapshot, data);

            int crc = crc(data);
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            try (DataOutputStream dos = new DataOutputStream(bos)) {
                dos.writeLong(snapshotMeta.lastIncludedIndex());
                dos.writeLong(snapshotMeta.lastIncludedTerm());
                snapshotMeta.membership().writeTo(dos);
                dos.writeInt(crc);
            }
            writeSynced(tempMeta, bos.toByteArray());

            Files.move(tempSnapshot, snapshotFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            Files.move(tempMeta, metaFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            this.meta = snapshotMeta;
            this.dataCrc = crc;

            logger.info("Saved snapshot: lastIndex={}, lastTerm={}, size={} bytes",
                    snapshotMeta.lastIncludedIndex(), snapshotMeta.lastIncludedTerm(), data.length);
            return true;
        } finally {
            Files.deleteIfExists(tempSnapshot);
            Files.deleteIfExists(tempMeta);
        }
    }

    private static void writeSynced(Path path, byte[] data) throws IOException {
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    /**
     * Loads the snapshot data.
     *
     * @return snapshot data, or null if no snapshot exists
     * @throws StorageException if the data does not match the recorded CRC
     */
    public synchronized byte[] loadSnapshot() throws IOException {
        if (meta == null) {
            return null;
        }
        if (!Files.exists(snapshotFile)) {
            throw new StorageException("Snapshot metadata present but " + SNAPSHOT_FILE + " is missing");
        }

        byte[] data = Files.readAllBytes(snapshotFile);
        if (crc(data) != dataCrc) {
            throw new StorageException("Corrupt " + SNAPSHOT_FILE + ": CRC mismatch");
        }
        logger.debug("Loaded snapshot: {} bytes", data.length);
        return data;
    }

    /**
     * Loads metadata and data of the latest snapshot as one consistent pair.
     *
     * @return the snapshot, or null if none exists
     */
    public synchronized Snapshot loadLatest() throws IOException {
        byte[] data = loadSnapshot();
        return data != null ? new Snapshot(meta, data) : null;
    }

    private void loadMetadata() throws IOException {
        if (!Files.exists(metaFile)) {
            meta = null;
            return;
        }

        try (DataInputStream dis = new DataInputStream(
                new BufferedInputStream(Files.newInputStream(metaFile)))) {
            long lastIndex = dis.readLong();
            long lastTerm = dis.readLong();
            Membership membership = Membership.readFrom(dis);
            dataCrc = dis.readInt();
            meta = new SnapshotMeta(lastIndex, lastTerm, membership);
        } catch (EOFException e) {
            throw new StorageException("Corrupt " + META_FILE, e);
        }

        logger.debug("Loaded snapshot metadata: {}", meta);
    }

    public boolean hasSnapshot() {
        return meta != null;
    }

    /**
     * Returns the metadata of the latest snapshot, or {@code null}.
     */
    public SnapshotMeta getMeta() {
        return meta;
    }

    public long getLastIncludedIndex() {
        SnapshotMeta m = meta;
        return m != null ? m.lastIncludedIndex() : 0;
    }

    public long getSnapshotSize() {
        try {
            return Files.exists(snapshotFile) ? Files.size(snapshotFile) : 0;
        } catch (IOException e) {
            logger.warn("Cannot stat {}", snapshotFile, e);
            return 0;
        }
    }

    private static int crc(byte[] data) {
        CRC32C crc = new CRC32C();
        crc.update(data, 0, data.length);
        return (int) crc.getValue();
    }
}
