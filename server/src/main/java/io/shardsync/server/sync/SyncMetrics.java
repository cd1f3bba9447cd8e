package io.shardsync.server.sync;

import io.shardsync.server.cluster.PushOutcome;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simple in-memory counters for the push scheduler.
 *
 * JVM-local and thread-safe via AtomicLong; push outcomes are recorded from
 * worker threads, everything else from the event loop.
 *
 * Tracked:
 *  - events:          change notifications processed by the loop.
 *  - shardsQueued:    shard updates that entered the window.
 *  - shardsCoalesced: shard updates dropped because the shard was already waiting.
 *  - flushes:         oldest-bucket flushes.
 *  - shardsFlushed:   shards handed to the push executor by flushes.
 *  - controlPushes:   immediate pushes of control databases.
 *  - staleShards:     flushed shards whose placement no longer existed.
 *  - delivered / targetGone / failed: per-call push outcomes.
 *  - configRejected:  unparseable tunable values.
 *  - unexpectedMessages: messages the loop did not understand.
 */
public final class SyncMetrics {

    private final AtomicLong events = new AtomicLong();
    private final AtomicLong shardsQueued = new AtomicLong();
    private final AtomicLong shardsCoalesced = new AtomicLong();
    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong shardsFlushed = new AtomicLong();
    private final AtomicLong controlPushes = new AtomicLong();
    private final AtomicLong staleShards = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong targetGone = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong configRejected = new AtomicLong();
    private final AtomicLong unexpectedMessages = new AtomicLong();

    void recordEvent() { events.incrementAndGet(); }

    void recordShardUpdate(boolean queued) {
        if (queued) {
            shardsQueued.incrementAndGet();
        } else {
            shardsCoalesced.incrementAndGet();
        }
    }

    void recordFlush(int shards) {
        flushes.incrementAndGet();
        shardsFlushed.addAndGet(shards);
    }

    void recordControlPush() { controlPushes.incrementAndGet(); }

    void recordStaleShard() { staleShards.incrementAndGet(); }

    void recordOutcome(PushOutcome outcome) {
        switch (outcome) {
            case DELIVERED -> delivered.incrementAndGet();
            case TARGET_GONE -> targetGone.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
        }
    }

    void recordConfigRejected() { configRejected.incrementAndGet(); }

    void recordUnexpectedMessage() { unexpectedMessages.incrementAndGet(); }

    // --- Read-only views for debugging / the status endpoint ---

    public long events()             { return events.get(); }
    public long shardsQueued()       { return shardsQueued.get(); }
    public long shardsCoalesced()    { return shardsCoalesced.get(); }
    public long flushes()            { return flushes.get(); }
    public long shardsFlushed()      { return shardsFlushed.get(); }
    public long controlPushes()      { return controlPushes.get(); }
    public long staleShards()        { return staleShards.get(); }
    public long delivered()          { return delivered.get(); }
    public long targetGone()         { return targetGone.get(); }
    public long failed()             { return failed.get(); }
    public long configRejected()     { return configRejected.get(); }
    public long unexpectedMessages() { return unexpectedMessages.get(); }

    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("events", events());
        out.put("shardsQueued", shardsQueued());
        out.put("shardsCoalesced", shardsCoalesced());
        out.put("flushes", flushes());
        out.put("shardsFlushed", shardsFlushed());
        out.put("controlPushes", controlPushes());
        out.put("staleShards", staleShards());
        out.put("delivered", delivered());
        out.put("targetGone", targetGone());
        out.put("failed", failed());
        out.put("configRejected", configRejected());
        out.put("unexpectedMessages", unexpectedMessages());
        return out;
    }

    @Override
    public String toString() {
        return "SyncMetrics" + snapshot();
    }
}
