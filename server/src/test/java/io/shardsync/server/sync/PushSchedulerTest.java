package io.shardsync.server.sync;

import io.shardsync.core.BucketWindow;
import io.shardsync.core.ControlDatabases;
import io.shardsync.core.ShardEvent;
import io.shardsync.core.SyncSettings;
import io.shardsync.server.cluster.FixedMembership;
import io.shardsync.server.cluster.FixedShardDirectory;
import io.shardsync.server.cluster.RecordingPushTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PushScheduler driven by a simulated clock and a recording timer.
 *
 * Cluster: nodes a (local), b, c; b and c live; nextNode() = b.
 */
class PushSchedulerTest {

    private static final String X = "shards/00000000-1fffffff/db1.1700000000";
    private static final String Y = "shards/20000000-3fffffff/db1.1700000000";

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);
    private final AtomicLong lastArm = new AtomicLong(-1);

    private RecordingPushTransport transport;
    private FixedMembership membership;
    private FixedShardDirectory directory;
    private SyncMetrics metrics;

    @BeforeEach
    void setUp() {
        transport = new RecordingPushTransport();
        membership = new FixedMembership(List.of("a", "b", "c"), Set.of("b", "c"), "b");
        directory = new FixedShardDirectory()
                .place(X, "a", "b", "c")
                .place(Y, "a", "b", "c");
        metrics = new SyncMetrics();
    }

    private PushScheduler scheduler(long delay, long frequency) {
        PushExecutor executor = new PushExecutor(directory, membership, transport, Runnable::run, metrics);
        return new PushScheduler(
                SyncSettings.of(delay, frequency),
                new ControlDatabases("nodes", "dbs", "users"),
                membership,
                directory,
                executor,
                lastArm::set,
                nanos::get,
                metrics
        );
    }

    private void advance(long millis) {
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    /** Fire the timer the way the event loop would: wait the armed delay, then check. */
    private void fireTimer(PushScheduler s) {
        advance(lastArm.get());
        s.checkFlush();
    }

    @Test
    void first_check_starts_the_clock_without_flushing() {
        PushScheduler s = scheduler(5000, 500);
        s.checkFlush();

        assertEquals(500L, lastArm.get());
        assertEquals(0L, metrics.flushes());
    }

    @Test
    void repeated_updates_coalesce_into_one_bucket_entry_and_one_push_per_peer() {
        PushScheduler s = scheduler(5000, 500);
        assertEquals(11, s.window().length());

        s.onEvent(ShardEvent.shardUpdated(X));
        s.onEvent(ShardEvent.shardUpdated(X));
        s.onEvent(ShardEvent.shardUpdated(X));

        assertEquals(Set.of(X), s.window().bucket(0));
        assertEquals(1, s.window().pendingCount());
        assertEquals(1L, metrics.shardsQueued());
        assertEquals(2L, metrics.shardsCoalesced());

        for (int i = 0; i < 11; i++) {
            fireTimer(s);
        }

        assertEquals(11L, metrics.flushes());
        assertEquals(2, transport.calls().size());
        assertEquals(1, transport.count(X + "->b"));
        assertEquals(1, transport.count(X + "->c"));
        assertEquals(0, s.window().pendingCount());
    }

    @Test
    void flushes_exactly_once_per_frequency_and_never_early() {
        PushScheduler s = scheduler(1000, 500);
        s.checkFlush(); // clock starts

        advance(499);
        s.checkFlush();
        assertEquals(0L, metrics.flushes());
        assertEquals(1L, lastArm.get(), "timer re-armed for the remaining 1ms");

        advance(1);
        s.checkFlush();
        assertEquals(1L, metrics.flushes());
        assertEquals(500L, lastArm.get());

        // same instant again: nothing more to do
        s.checkFlush();
        assertEquals(1L, metrics.flushes());
        assertEquals(500L, lastArm.get());

        advance(500);
        s.checkFlush();
        assertEquals(2L, metrics.flushes());
    }

    @Test
    void every_event_rearms_the_timer_within_one_frequency() {
        PushScheduler s = scheduler(5000, 500);
        s.onEvent(ShardEvent.ignored());
        for (int i = 0; i < 20; i++) {
            advance(37);
            s.onEvent(ShardEvent.shardUpdated("shards/00000000-1fffffff/burst" + i));
            assertTrue(lastArm.get() > 0 && lastArm.get() <= 500, "armed for " + lastArm.get());
        }
    }

    @Test
    void queued_shard_is_flushed_within_window_length_times_frequency() {
        PushScheduler s = scheduler(1000, 500); // 3 buckets
        s.onEvent(ShardEvent.shardUpdated(X));
        long enqueuedAt = nanos.get();

        while (transport.calls().isEmpty()) {
            fireTimer(s);
            long waited = TimeUnit.NANOSECONDS.toMillis(nanos.get() - enqueuedAt);
            assertTrue(waited <= 3 * 500, "still not pushed after " + waited + "ms");
        }
        assertEquals(1500L, TimeUnit.NANOSECONDS.toMillis(nanos.get() - enqueuedAt));
    }

    @Test
    void users_update_pushes_once_to_next_node_regardless_of_window() {
        PushScheduler s = scheduler(5000, 500);
        s.onEvent(ShardEvent.shardUpdated(X));
        s.onEvent(ShardEvent.shardUpdated(Y));

        s.onEvent(ShardEvent.controlUpdated(ControlDatabases.Kind.USERS));

        assertEquals(List.of("users->b"), transport.calls());
        assertEquals(2, s.window().pendingCount());
        assertEquals(1L, metrics.controlPushes());
    }

    @Test
    void shard_map_update_follows_next_node() {
        PushScheduler s = scheduler(5000, 500);
        membership.setNext("c");
        s.onEvent(ShardEvent.controlUpdated(ControlDatabases.Kind.SHARDS));
        assertEquals(List.of("dbs->c"), transport.calls());
    }

    @Test
    void nodes_update_pushes_to_every_live_configured_node() {
        PushScheduler s = scheduler(5000, 500);
        s.onEvent(ShardEvent.controlUpdated(ControlDatabases.Kind.NODES));
        assertEquals(Set.of("nodes->b", "nodes->c"), Set.copyOf(transport.calls()));
        assertEquals(2, transport.calls().size());

        transport.clear();
        membership.down("c");
        s.onEvent(ShardEvent.controlUpdated(ControlDatabases.Kind.NODES));
        assertEquals(List.of("nodes->b"), transport.calls());
    }

    @Test
    void shard_delete_forgets_placement_and_leaves_window_alone() {
        PushScheduler s = scheduler(5000, 500);
        s.onEvent(ShardEvent.shardUpdated(X));

        s.onEvent(ShardEvent.shardDeleted(Y));

        assertEquals(List.of(Y), directory.forgotten());
        assertEquals(Set.of(X), s.window().pending());
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void vanished_shard_is_skipped_at_flush_time() {
        PushScheduler s = scheduler(0, 500); // single bucket
        s.onEvent(ShardEvent.shardUpdated(X));
        s.onEvent(ShardEvent.shardUpdated(Y));
        directory.remove(Y);

        assertDoesNotThrow(() -> fireTimer(s));

        assertEquals(Set.of(X + "->b", X + "->c"), Set.copyOf(transport.calls()));
        assertEquals(1L, metrics.staleShards());
        assertEquals(0, s.window().pendingCount());
    }

    @Test
    void pushes_skip_replicas_on_dead_nodes() {
        membership.down("c");
        PushScheduler s = scheduler(0, 500);
        s.onEvent(ShardEvent.shardUpdated(X));
        fireTimer(s);
        assertEquals(List.of(X + "->b"), transport.calls());
    }

    @Test
    void shrinking_reconfiguration_merges_oldest_buckets() {
        PushScheduler s = scheduler(5000, 500);
        BucketWindow w = s.window();
        w.add("c");
        w.rotate();
        w.add("b");
        w.rotate();
        w.add("a");
        for (int i = 0; i < 8; i++) {
            w.rotate();
        }
        assertEquals(Set.of("a"), w.bucket(8));

        s.reconfigure(s.settings().withDelay(1000)); // 1000/500 + 1 = 3

        assertEquals(3, w.length());
        assertEquals(Set.of("a", "b", "c"), w.bucket(2));
        assertEquals(1000L, s.settings().delayMillis());
        assertEquals(1L, s.settings().version());
    }

    @Test
    void growing_reconfiguration_keeps_entries_oldest() {
        PushScheduler s = scheduler(1000, 500);
        s.onEvent(ShardEvent.shardUpdated(X));

        s.reconfigure(s.settings().withFrequency(100)); // 1000/100 + 1 = 11

        assertEquals(11, s.window().length());
        assertEquals(Set.of(X), s.window().pending());
    }

    @Test
    void new_frequency_takes_effect_immediately() {
        PushScheduler s = scheduler(1000, 500);
        s.checkFlush();
        advance(200);

        s.reconfigure(s.settings().withFrequency(100));

        assertEquals(1L, metrics.flushes(), "200ms >= new 100ms frequency");
        assertEquals(100L, lastArm.get());
    }

    @Test
    void status_reports_window_shape() {
        PushScheduler s = scheduler(1000, 500);
        assertEquals(-1L, s.status().lastFlushAgeMillis());

        s.onEvent(ShardEvent.shardUpdated(X));
        SyncStatus status = s.status();

        assertEquals(3, status.windowLength());
        assertEquals(List.of(1, 0, 0), status.bucketSizes());
        assertEquals(1, status.pendingShards());
        assertEquals(0L, status.lastFlushAgeMillis());
        assertEquals(1L, status.metrics().get("shardsQueued"));
    }
}
