package io.shardsync.server.cluster;

/**
 * Transport that asks a peer node to replicate a subject (shard or control
 * database) from this node.
 * <br>
 * Calls may block on the network, so callers run them off the scheduler
 * thread. Retry and backoff, if any, belong to the implementation.
 */
public interface PushTransport {

    /**
     * @param subject shard name or control database name
     * @param nodeId  target peer
     * @return outcome of the call; implementations should not throw for
     *         ordinary transport failures but report FAILED instead.
     */
    PushOutcome push(String subject, String nodeId);
}
