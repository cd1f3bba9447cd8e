package io.shardsync.server.sync;

import io.shardsync.core.BucketWindow;
import io.shardsync.core.ControlDatabases;
import io.shardsync.core.ShardEvent;
import io.shardsync.core.SyncSettings;
import io.shardsync.server.cluster.Membership;
import io.shardsync.server.cluster.ShardDirectory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Coalesces shard updates into rate-limited pushes.
 *
 * Updated shards go into the newest bucket of a BucketWindow unless they are
 * already waiting. Roughly every frequencyMillis the oldest bucket is flushed
 * to the PushExecutor and the window shifts by one, so a queued shard is
 * pushed within about windowLength * frequency of its first update, and no
 * more than one bucket is flushed per frequency interval however many updates
 * arrive. Control databases and shard deletions skip the window.
 *
 * Every operation ends in checkFlush(), which either flushes or re-arms the
 * timer; that keeps pending shards moving when traffic stops.
 *
 * Not thread-safe: all calls must come from the SyncEventLoop thread (or a
 * single test thread).
 */
public final class PushScheduler {
    private static final Logger log = Logger.getLogger(PushScheduler.class.getName());

    /**
     * One-shot wake-up. Each call replaces the previous request; when it
     * fires, the owner calls checkFlush().
     */
    @FunctionalInterface
    public interface FlushTimer {
        void rearm(long delayMillis);
    }

    private static final long NEVER = Long.MIN_VALUE;

    private final ControlDatabases controlDbs;
    private final Membership membership;
    private final ShardDirectory directory;
    private final PushExecutor pushExecutor;
    private final FlushTimer timer;
    private final LongSupplier nanoClock;
    private final SyncMetrics metrics;

    private SyncSettings settings;
    private final BucketWindow window;
    private long lastFlushNanos = NEVER;

    public PushScheduler(SyncSettings settings,
                         ControlDatabases controlDbs,
                         Membership membership,
                         ShardDirectory directory,
                         PushExecutor pushExecutor,
                         FlushTimer timer,
                         LongSupplier nanoClock,
                         SyncMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.controlDbs = Objects.requireNonNull(controlDbs, "controlDbs");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.pushExecutor = Objects.requireNonNull(pushExecutor, "pushExecutor");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.window = BucketWindow.forSettings(settings);
    }

    /**
     * Apply one classified change notification, then run the flush check.
     */
    public void onEvent(ShardEvent event) {
        switch (event.type()) {
            case CONTROL_UPDATED -> pushControl(event.control());
            case SHARD_DELETED -> directory.forgetShard(event.shard());
            case SHARD_UPDATED -> metrics.recordShardUpdate(window.add(event.shard()));
            case IGNORED -> { }
        }
        checkFlush();
    }

    /**
     * Flush the oldest bucket if at least one frequency interval has passed
     * since the last flush; otherwise re-arm the timer for the remainder.
     * The very first call only starts the clock.
     */
    public void checkFlush() {
        long now = nanoClock.getAsLong();
        long frequencyNanos = TimeUnit.MILLISECONDS.toNanos(settings.frequencyMillis());

        if (lastFlushNanos == NEVER) {
            lastFlushNanos = now;
            timer.rearm(settings.frequencyMillis());
            return;
        }

        long elapsedNanos = now - lastFlushNanos;
        if (elapsedNanos >= frequencyNanos) {
            flushOldest();
            lastFlushNanos = now;
            timer.rearm(settings.frequencyMillis());
        } else {
            timer.rearm(ceilMillis(frequencyNanos - elapsedNanos));
        }
    }

    /**
     * Switch to new tunables. The window is resized to the new length
     * (merging the oldest buckets when it shrinks) before the flush check
     * runs under the new frequency.
     */
    public void reconfigure(SyncSettings next) {
        Objects.requireNonNull(next, "next");
        int before = window.length();
        window.resize(next.windowLength());
        if (before != window.length()) {
            log.info("sync window resized from " + before + " to " + window.length()
                    + " buckets (delay=" + next.delayMillis() + "ms, frequency=" + next.frequencyMillis() + "ms)");
        }
        settings = next;
        checkFlush();
    }

    public SyncSettings settings() {
        return settings;
    }

    public SyncStatus status() {
        long age = lastFlushNanos == NEVER
                ? -1L
                : TimeUnit.NANOSECONDS.toMillis(nanoClock.getAsLong() - lastFlushNanos);
        return new SyncStatus(
                settings.delayMillis(),
                settings.frequencyMillis(),
                settings.version(),
                window.length(),
                window.bucketSizes(),
                window.pendingCount(),
                age,
                metrics.snapshot()
        );
    }

    // Visible for tests.
    BucketWindow window() {
        return window;
    }

    // ---------- internals ----------

    private void pushControl(ControlDatabases.Kind kind) {
        String db = controlDbs.nameOf(kind);
        if (kind == ControlDatabases.Kind.NODES) {
            Set<String> live = membership.liveNodes();
            for (String node : membership.nodes()) {
                if (live.contains(node)) {
                    pushExecutor.pushControl(db, node);
                }
            }
        } else {
            pushExecutor.pushControl(db, membership.nextNode());
        }
    }

    private void flushOldest() {
        Set<String> due = window.rotate();
        metrics.recordFlush(due.size());
        if (due.isEmpty()) {
            return;
        }
        log.fine("flushing " + due.size() + " shard(s)");
        for (String shard : due) {
            pushExecutor.pushShard(shard);
        }
    }

    private static long ceilMillis(long nanos) {
        return (nanos + 999_999L) / 1_000_000L;
    }
}
