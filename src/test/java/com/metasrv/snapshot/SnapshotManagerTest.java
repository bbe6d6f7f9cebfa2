package com.metasrv.snapshot;

import com.metasrv.core.Membership;
import com.metasrv.core.NodeId;
import com.metasrv.persistence.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for snapshot files.
 */
class SnapshotManagerTest {

    @TempDir
    Path dir;

    private static final Membership MEMBERSHIP = new Membership(Set.of(NodeId.of(0)), Set.of(NodeId.of(1)));

    @Test
    @DisplayName("A saved snapshot is found again after restart")
    void testSaveAndReload() throws Exception {
        SnapshotManager manager = new SnapshotManager(dir);
        assertThat(manager.hasSnapshot()).isFalse();
        assertThat(manager.loadLatest()).isNull();

        SnapshotMeta meta = new SnapshotMeta(10, 2, MEMBERSHIP);
        assertThat(manager.saveSnapshot("state".getBytes(), meta)).isTrue();

        SnapshotManager reopened = new SnapshotManager(dir);
        assertThat(reopened.getMeta()).isEqualTo(meta);
        assertThat(reopened.getLastIncludedIndex()).isEqualTo(10);

        Snapshot snapshot = reopened.loadLatest();
        assertThat(snapshot.meta()).isEqualTo(meta);
        assertThat(snapshot.data()).isEqualTo("state".getBytes());
        assertThat(Files.exists(dir.resolve("snapshot.dat.tmp"))).isFalse();
    }

    @Test
    @DisplayName("A snapshot not newer than the current one is ignored")
    void testOlderIgnored() throws Exception {
        SnapshotManager manager = new SnapshotManager(dir);
        manager.saveSnapshot("new".getBytes(), new SnapshotMeta(10, 2, MEMBERSHIP));

        assertThat(manager.saveSnapshot("old".getBytes(), new SnapshotMeta(8, 2, MEMBERSHIP))).isFalse();
        assertThat(manager.loadSnapshot()).isEqualTo("new".getBytes());
    }

    @Test
    @DisplayName("Corrupt snapshot data is detected")
    void testCorruptData() throws Exception {
        SnapshotManager manager = new SnapshotManager(dir);
        manager.saveSnapshot("state".getBytes(), new SnapshotMeta(4, 1, MEMBERSHIP));

        Files.write(dir.resolve("snapshot.dat"), "stale".getBytes());

        SnapshotManager reopened = new SnapshotManager(dir);
        assertThatThrownBy(reopened::loadSnapshot)
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("CRC");
    }
}
