package io.shardsync.server.cluster;

/**
 * Result of one push call.
 *
 *  - DELIVERED:   the peer accepted the trigger.
 *  - TARGET_GONE: the peer does not know the subject (deleted concurrently); benign.
 *  - FAILED:      transport or peer error; logged, never retried here.
 */
public enum PushOutcome {
    DELIVERED,
    TARGET_GONE,
    FAILED
}
