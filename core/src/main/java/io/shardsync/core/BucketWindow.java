package io.shardsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Debounce window of shard names, split into age slots ("buckets").
 *
 * Layout:
 *  - index 0 is the newest bucket; new shards are always added there.
 *  - index length()-1 is the oldest bucket; it is the next one to be flushed.
 *
 * Invariants:
 *  - length() >= 1.
 *  - A shard name is in at most one bucket. Adding a shard that is already
 *    waiting anywhere in the window is a no-op, so a shard is pushed at most
 *    once per full rotation no matter how often it is updated.
 *  - resize() never drops a queued shard: shrinking merges the oldest buckets.
 *
 * Not thread-safe. The owner is expected to confine it to one thread.
 */
public final class BucketWindow {

    // index 0 = newest, last = oldest
    private final List<Set<String>> buckets;

    public BucketWindow(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be >= 1");
        }
        this.buckets = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            buckets.add(new HashSet<>());
        }
    }

    /** Window sized for the given settings: floor(delay / frequency) + 1 buckets. */
    public static BucketWindow forSettings(SyncSettings settings) {
        return new BucketWindow(settings.windowLength());
    }

    public int length() {
        return buckets.size();
    }

    /**
     * Queue a shard in the newest bucket unless it is already waiting.
     *
     * @return true if the shard was added, false if it was already queued.
     */
    public boolean add(String shard) {
        Objects.requireNonNull(shard, "shard");
        if (isWaiting(shard)) {
            return false;
        }
        buckets.get(0).add(shard);
        return true;
    }

    /** True if the shard sits in any bucket of the window. */
    public boolean isWaiting(String shard) {
        for (Set<String> bucket : buckets) {
            if (bucket.contains(shard)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remove the oldest bucket, shift every other bucket one slot older and
     * put a fresh empty bucket at index 0.
     *
     * @return the shards of the removed (oldest) bucket; the caller owns the set.
     */
    public Set<String> rotate() {
        Set<String> oldest = buckets.remove(buckets.size() - 1);
        buckets.add(0, new HashSet<>());
        return oldest;
    }

    /**
     * Change the number of buckets without losing queued shards.
     *
     *  - same length: nothing changes.
     *  - shrink: the oldest (length() - newLength + 1) buckets are merged into a
     *    single bucket that becomes the oldest one; newer buckets keep their slots.
     *  - grow: (newLength - length()) empty buckets are prepended at the new end.
     */
    public void resize(int newLength) {
        if (newLength < 1) {
            throw new IllegalArgumentException("newLength must be >= 1");
        }
        int current = buckets.size();
        if (newLength == current) {
            return;
        }
        if (newLength < current) {
            // Buckets [newLength - 1, current) collapse into one.
            List<Set<String>> tail = buckets.subList(newLength - 1, current);
            Set<String> merged = new HashSet<>();
            for (Set<String> bucket : tail) {
                merged.addAll(bucket);
            }
            tail.clear();
            buckets.add(merged);
        } else {
            List<Set<String>> fresh = new ArrayList<>(newLength - current);
            for (int i = 0; i < newLength - current; i++) {
                fresh.add(new HashSet<>());
            }
            buckets.addAll(0, fresh);
        }
    }

    /** Read-only view of one bucket. */
    public Set<String> bucket(int index) {
        return Collections.unmodifiableSet(buckets.get(index));
    }

    /** Total number of queued shards across all buckets. */
    public int pendingCount() {
        int n = 0;
        for (Set<String> bucket : buckets) {
            n += bucket.size();
        }
        return n;
    }

    /** Union of all buckets, newest first. */
    public Set<String> pending() {
        Set<String> out = new LinkedHashSet<>();
        for (Set<String> bucket : buckets) {
            out.addAll(bucket);
        }
        return out;
    }

    /** Bucket sizes, newest first. */
    public List<Integer> bucketSizes() {
        List<Integer> sizes = new ArrayList<>(buckets.size());
        for (Set<String> bucket : buckets) {
            sizes.add(bucket.size());
        }
        return sizes;
    }

    @Override
    public String toString() {
        return "BucketWindow" + buckets;
    }
}
