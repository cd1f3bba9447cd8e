package io.shardsync.server.replica;

/**
 * Hook into the node's replication machinery, invoked when a peer pushes.
 */
@FunctionalInterface
public interface ReplicationTrigger {

    /**
     * Start (or enqueue) replication of 'subject' from 'sourceNodeId'.
     *
     * @return false if this node does not know the subject.
     * @throws IllegalArgumentException for malformed requests.
     */
    boolean replicate(String subject, String sourceNodeId);
}
