package io.shardsync.core;

/**
 * Versioned pair of debounce tunables.
 *
 * delayMillis:     upper bound on how long a queued shard waits before its push.
 * frequencyMillis: minimum spacing between two flushes of the oldest bucket.
 * version:         bumped on every change so callers can tell settings apart.
 *
 * Instances are immutable; use withDelay / withFrequency to derive new ones.
 */
public record SyncSettings(long delayMillis, long frequencyMillis, long version) {

    public static final long DEFAULT_DELAY_MILLIS = 5000L;
    public static final long DEFAULT_FREQUENCY_MILLIS = 500L;

    /** Upper bound on windowLength(); larger delay/frequency ratios are rejected. */
    public static final int MAX_WINDOW_LENGTH = 100_000;

    public SyncSettings {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0");
        }
        if (frequencyMillis <= 0) {
            throw new IllegalArgumentException("frequencyMillis must be > 0");
        }
        if (delayMillis / frequencyMillis >= MAX_WINDOW_LENGTH) {
            throw new IllegalArgumentException(
                    "delay/frequency gives more than " + MAX_WINDOW_LENGTH + " buckets");
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(DEFAULT_DELAY_MILLIS, DEFAULT_FREQUENCY_MILLIS, 0L);
    }

    public static SyncSettings of(long delayMillis, long frequencyMillis) {
        return new SyncSettings(delayMillis, frequencyMillis, 0L);
    }

    /** Number of buckets: floor(delay / frequency) + 1, in [1, MAX_WINDOW_LENGTH]. */
    public int windowLength() {
        return (int) (delayMillis / frequencyMillis + 1);
    }

    public SyncSettings withDelay(long newDelayMillis) {
        return new SyncSettings(newDelayMillis, frequencyMillis, version + 1);
    }

    public SyncSettings withFrequency(long newFrequencyMillis) {
        return new SyncSettings(delayMillis, newFrequencyMillis, version + 1);
    }
}
