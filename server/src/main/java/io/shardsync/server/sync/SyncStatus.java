package io.shardsync.server.sync;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the scheduler, taken on the event loop.
 *
 * lastFlushAgeMillis is -1 before the first flush check.
 */
public record SyncStatus(
        long delayMillis,
        long frequencyMillis,
        long settingsVersion,
        int windowLength,
        List<Integer> bucketSizes,
        int pendingShards,
        long lastFlushAgeMillis,
        Map<String, Long> metrics
) {
}
