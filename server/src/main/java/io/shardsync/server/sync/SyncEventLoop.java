package io.shardsync.server.sync;

import io.shardsync.core.ChangeEvent;
import io.shardsync.core.ShardEventClassifier;
import io.shardsync.core.SyncSettings;
import io.shardsync.server.feed.ChangeFeed;
import io.shardsync.server.feed.ChangeListener;
import io.shardsync.server.feed.ConfigListener;
import io.shardsync.server.feed.ConfigSource;
import io.shardsync.server.feed.Subscription;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded actor that owns the PushScheduler.
 *
 * Responsibilities:
 *  - Subscribe to the change feed and the config source on start().
 *  - Queue every notification, timer firing and reconfiguration as a
 *    SyncMessage and process them one at a time on one thread, so scheduler
 *    state needs no locking.
 *  - Act as the scheduler's FlushTimer: one pending wake-up, replaced on
 *    every re-arm.
 *  - Resubscribe after a fixed backoff when a subscription is lost.
 *
 * Pushes themselves run on the PushExecutor's workers; the loop never waits
 * for them.
 */
public final class SyncEventLoop {
    private static final Logger log = Logger.getLogger(SyncEventLoop.class.getName());

    public static final Duration DEFAULT_RESUBSCRIBE_BACKOFF = Duration.ofSeconds(5);

    private final ShardEventClassifier classifier;
    private final ChangeFeed feed;
    private final ConfigSource config;
    private final Duration resubscribeBackoff;
    private final SyncMetrics metrics;
    private final ScheduledExecutorService exec;
    private final PushScheduler scheduler;
    private final ReconfigurationHandler reconfiguration;

    // loop thread only
    private ScheduledFuture<?> pendingTick;
    private Subscription feedSubscription;
    private Subscription configSubscription;

    private volatile boolean started = false;
    private volatile boolean stopped = false;

    /**
     * @param schedulerFactory   builds the scheduler around the loop's FlushTimer.
     * @param classifier         maps raw notifications to ShardEvents.
     * @param feed               change notification source.
     * @param config             source of sync_delay / sync_frequency changes.
     * @param metrics            shared counters.
     * @param resubscribeBackoff wait before re-subscribing after a lost subscription.
     */
    public SyncEventLoop(Function<PushScheduler.FlushTimer, PushScheduler> schedulerFactory,
                         ShardEventClassifier classifier,
                         ChangeFeed feed,
                         ConfigSource config,
                         SyncMetrics metrics,
                         Duration resubscribeBackoff) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.feed = Objects.requireNonNull(feed, "feed");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.resubscribeBackoff = Objects.requireNonNull(resubscribeBackoff, "resubscribeBackoff");
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-event-loop");
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Objects.requireNonNull(schedulerFactory.apply(this::rearm), "scheduler");
        this.reconfiguration = new ReconfigurationHandler(this::submit, metrics);
    }

    /**
     * Subscribe to the change feed and config source and start the flush clock.
     * No-op once the loop has been stopped; a stopped loop cannot be restarted.
     */
    public void start() {
        if (started || stopped) {
            return;
        }
        started = true;
        exec.execute(() -> {
            subscribeFeed();
            subscribeConfig();
        });
        submit(new SyncMessage.Tick());
    }

    /**
     * Stop processing. Pending (not yet flushed) shards are dropped; the
     * change feed will surface them again through normal replication.
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        try {
            exec.submit(() -> {
                if (pendingTick != null) {
                    pendingTick.cancel(false);
                }
                closeQuietly(feedSubscription);
                closeQuietly(configSubscription);
            }).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.log(Level.WARNING, "sync event loop did not release subscriptions cleanly", e);
        }
        exec.shutdownNow();
    }

    /**
     * Queue a message for the loop. Safe to call from any thread.
     *
     * @return false if the loop has been stopped.
     */
    public boolean submit(SyncMessage message) {
        Objects.requireNonNull(message, "message");
        if (stopped) {
            return false;
        }
        try {
            exec.execute(() -> handle(message));
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    /**
     * Snapshot of scheduler state, taken on the loop thread.
     */
    public SyncStatus status(Duration timeout) throws InterruptedException, TimeoutException {
        CompletableFuture<SyncStatus> reply = new CompletableFuture<>();
        if (!submit(new SyncMessage.StatusQuery(reply))) {
            throw new IllegalStateException("sync event loop is stopped");
        }
        try {
            return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("status query failed", e.getCause());
        }
    }

    public ReconfigurationHandler reconfigurationHandler() {
        return reconfiguration;
    }

    // ---------- loop thread ----------

    private void handle(SyncMessage message) {
        try {
            if (message instanceof SyncMessage.Event ev) {
                metrics.recordEvent();
                scheduler.onEvent(classifier.classify(ev.event()));
            } else if (message instanceof SyncMessage.Tick) {
                scheduler.checkFlush();
            } else if (message instanceof SyncMessage.Reconfigure r) {
                reconfigure(r);
            } else if (message instanceof SyncMessage.StatusQuery q) {
                q.reply().complete(scheduler.status());
                scheduler.checkFlush();
            } else {
                metrics.recordUnexpectedMessage();
                log.info("unexpected message to sync event loop: " + message);
                scheduler.checkFlush();
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "sync event loop failed to process " + message, e);
            if (message instanceof SyncMessage.StatusQuery q) {
                q.reply().completeExceptionally(e);
            }
        }
    }

    private void reconfigure(SyncMessage.Reconfigure r) {
        SyncSettings next;
        try {
            next = r.tunable().applyTo(scheduler.settings(), r.value());
        } catch (IllegalArgumentException rejected) {
            metrics.recordConfigRejected();
            log.warning("ignoring bad value for " + r.tunable().key() + ": " + r.value()
                    + " (" + rejected.getMessage() + ")");
            scheduler.checkFlush();
            return;
        }
        scheduler.reconfigure(next);
    }

    private void rearm(long delayMillis) {
        if (pendingTick != null) {
            pendingTick.cancel(false);
        }
        if (stopped) {
            return;
        }
        try {
            pendingTick = exec.schedule(() -> handle(new SyncMessage.Tick()), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.fine("flush timer not re-armed; loop is shutting down");
        }
    }

    private void subscribeFeed() {
        if (stopped) {
            return;
        }
        try {
            feedSubscription = feed.subscribe(new FeedListener());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "change feed subscription failed, retrying in " + resubscribeBackoff.toMillis() + "ms", e);
            scheduleLater(this::subscribeFeed);
        }
    }

    private void subscribeConfig() {
        if (stopped) {
            return;
        }
        try {
            configSubscription = config.listen(new ConfigWatcher());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "config subscription failed, retrying in " + resubscribeBackoff.toMillis() + "ms", e);
            scheduleLater(this::subscribeConfig);
        }
    }

    private void scheduleLater(Runnable task) {
        if (stopped) {
            return;
        }
        try {
            exec.schedule(task, resubscribeBackoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.fine("resubscription skipped; loop is shutting down");
        }
    }

    private static void closeQuietly(Subscription subscription) {
        if (subscription != null) {
            subscription.close();
        }
    }

    // ---------- listeners (called on producer threads) ----------

    private final class FeedListener implements ChangeListener {
        @Override
        public void onChange(ChangeEvent event) {
            submit(new SyncMessage.Event(event));
        }

        @Override
        public void onTerminated(Throwable cause) {
            log.log(Level.WARNING, "change feed subscription lost, resubscribing in "
                    + resubscribeBackoff.toMillis() + "ms", cause);
            scheduleLater(SyncEventLoop.this::subscribeFeed);
        }
    }

    private final class ConfigWatcher implements ConfigListener {
        @Override
        public void onConfigChange(String key, String value) {
            reconfiguration.onConfigChange(key, value);
        }

        @Override
        public void onTerminated(Throwable cause) {
            log.log(Level.WARNING, "config subscription lost, resubscribing in "
                    + resubscribeBackoff.toMillis() + "ms", cause);
            scheduleLater(SyncEventLoop.this::subscribeConfig);
        }
    }
}
