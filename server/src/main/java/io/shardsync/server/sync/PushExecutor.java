package io.shardsync.server.sync;

import io.shardsync.server.cluster.Membership;
import io.shardsync.server.cluster.PushOutcome;
import io.shardsync.server.cluster.PushTransport;
import io.shardsync.server.cluster.ShardDirectory;
import io.shardsync.server.cluster.ShardNotFoundException;
import io.shardsync.server.cluster.ShardPlacement;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns "push this shard" into one transport call per live replica.
 *
 * Placement and liveness lookups run on the caller's thread (the event
 * loop) and are expected to be fast. Transport calls are handed to the
 * worker executor and never waited on; their outcomes only feed logging
 * and SyncMetrics.
 */
public final class PushExecutor {
    private static final Logger log = Logger.getLogger(PushExecutor.class.getName());

    private final ShardDirectory directory;
    private final Membership membership;
    private final PushTransport transport;
    private final Executor workers;
    private final SyncMetrics metrics;

    public PushExecutor(ShardDirectory directory,
                        Membership membership,
                        PushTransport transport,
                        Executor workers,
                        SyncMetrics metrics) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Push a shard to every live node holding a copy of it.
     *
     * A shard that no longer exists is a benign race with its deletion and
     * results in no calls.
     *
     * @return number of push calls dispatched.
     */
    public int pushShard(String shard) {
        List<ShardPlacement> placements;
        try {
            placements = directory.resolvePlacement(shard);
        } catch (ShardNotFoundException gone) {
            metrics.recordStaleShard();
            log.fine("skipping push of deleted shard " + shard);
            return 0;
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "placement lookup failed for " + shard, e);
            return 0;
        }

        Set<String> live = membership.liveNodes();
        int dispatched = 0;
        for (ShardPlacement p : placements) {
            if (live.contains(p.nodeId()) && dispatch(p.shard(), p.nodeId())) {
                dispatched++;
            }
        }
        return dispatched;
    }

    /** Fire-and-forget push of a control database to one node. */
    public void pushControl(String database, String nodeId) {
        metrics.recordControlPush();
        dispatch(database, nodeId);
    }

    private boolean dispatch(String subject, String nodeId) {
        try {
            workers.execute(() -> {
                PushOutcome outcome;
                try {
                    outcome = transport.push(subject, nodeId);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "push of " + subject + " to " + nodeId + " failed", e);
                    outcome = PushOutcome.FAILED;
                }
                metrics.recordOutcome(outcome);
                if (outcome == PushOutcome.FAILED) {
                    log.fine("push of " + subject + " to " + nodeId + " did not complete");
                }
            });
            return true;
        } catch (RejectedExecutionException rejected) {
            log.warning("push workers rejected " + subject + " -> " + nodeId + " (shutting down?)");
            return false;
        }
    }
}
