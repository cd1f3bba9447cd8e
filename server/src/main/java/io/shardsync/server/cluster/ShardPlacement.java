package io.shardsync.server.cluster;

import java.util.Objects;

/**
 * One copy of a shard: the shard name and the node that hosts it.
 */
public record ShardPlacement(String shard, String nodeId) {
    public ShardPlacement {
        Objects.requireNonNull(shard, "shard");
        Objects.requireNonNull(nodeId, "nodeId");
    }
}
