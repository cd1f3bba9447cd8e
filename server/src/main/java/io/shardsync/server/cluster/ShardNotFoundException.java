package io.shardsync.server.cluster;

/**
 * Thrown when a shard name no longer resolves to any placement, usually
 * because its database was deleted after the update was queued.
 */
public class ShardNotFoundException extends Exception {

    private final String shard;

    public ShardNotFoundException(String shard) {
        super("shard does not exist: " + shard);
        this.shard = shard;
    }

    public ShardNotFoundException(String shard, Throwable cause) {
        super("shard does not exist: " + shard, cause);
        this.shard = shard;
    }

    public String shard() {
        return shard;
    }
}
