package io.shardsync.server.cluster;

import java.util.List;

/**
 * Resolves shard names to the nodes holding a copy.
 */
public interface ShardDirectory {

    /**
     * Every copy of the named shard, in no particular order.
     *
     * @throws ShardNotFoundException if the shard (or its database) no longer exists.
     */
    List<ShardPlacement> resolvePlacement(String shard) throws ShardNotFoundException;

    /** Drop whatever is tracked for a shard that has been deleted. */
    void forgetShard(String shard);
}
