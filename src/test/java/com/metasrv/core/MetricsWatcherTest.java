package com.metasrv.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the metrics stream.
 */
class MetricsWatcherTest {

    private static final NodeId SELF = NodeId.of(0);

    private static RaftMetrics metrics(Role role, long term, long applied) {
        return new RaftMetrics(SELF, role, term, role == Role.LEADER ? SELF : null, applied, applied,
                Membership.ofVoters(Set.of(SELF)), null);
    }

    @Test
    @DisplayName("await returns at once when the condition already holds")
    void testAwaitImmediate() throws Exception {
        MetricsWatcher watcher = new MetricsWatcher(metrics(Role.FOLLOWER, 1, 5));

        RaftMetrics m = watcher.awaitLog(3, Duration.ofMillis(10), "applied");
        assertThat(m.lastApplied()).isEqualTo(5);
    }

    @Test
    @DisplayName("await wakes up on publish")
    void testAwaitWakesOnPublish() throws Exception {
        MetricsWatcher watcher = new MetricsWatcher(metrics(Role.FOLLOWER, 1, 0));

        CompletableFuture<RaftMetrics> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return watcher.awaitLeader(SELF, Duration.ofSeconds(5));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });

        watcher.publish(metrics(Role.CANDIDATE, 2, 0));
        watcher.publish(metrics(Role.LEADER, 2, 0));

        RaftMetrics m = waiter.get(5, TimeUnit.SECONDS);
        assertThat(m.isLeader()).isTrue();
        assertThat(m.currentTerm()).isEqualTo(2);
    }

    @Test
    @DisplayName("await times out with a descriptive message")
    void testAwaitTimeout() {
        MetricsWatcher watcher = new MetricsWatcher(metrics(Role.FOLLOWER, 1, 0));

        assertThatThrownBy(() -> watcher.awaitRole(Role.LEADER, Duration.ofMillis(50)))
                .isInstanceOf(TimeoutException.class)
                .hasMessageContaining("role LEADER");
    }

    @Test
    @DisplayName("Closing fails waiters and ignores later publishes")
    void testClose() throws Exception {
        MetricsWatcher watcher = new MetricsWatcher(metrics(Role.FOLLOWER, 1, 0));

        CompletableFuture<Throwable> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                watcher.awaitRole(Role.LEADER, Duration.ofSeconds(5));
                return null;
            } catch (Exception e) {
                return e;
            }
        });
        Thread.sleep(50);
        watcher.close();

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isInstanceOf(IllegalStateException.class);
        assertThat(watcher.isClosed()).isTrue();

        watcher.publish(metrics(Role.LEADER, 3, 0));
        assertThat(watcher.current().role()).isEqualTo(Role.FOLLOWER);
    }

    @Test
    @DisplayName("Listeners see every change until unsubscribed")
    void testSubscribe() {
        MetricsWatcher watcher = new MetricsWatcher(metrics(Role.FOLLOWER, 1, 0));
        List<Long> seen = new ArrayList<>();

        Runnable unsubscribe = watcher.subscribe(m -> seen.add(m.lastApplied()));
        watcher.publish(metrics(Role.FOLLOWER, 1, 1));
        watcher.publish(metrics(Role.FOLLOWER, 1, 1));
        watcher.publish(metrics(Role.FOLLOWER, 1, 2));
        unsubscribe.run();
        watcher.publish(metrics(Role.FOLLOWER, 1, 3));

        assertThat(seen).containsExactly(1L, 2L);
    }
}
