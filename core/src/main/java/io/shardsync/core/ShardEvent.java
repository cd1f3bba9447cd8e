package io.shardsync.core;

import java.util.Objects;

/**
 * Classified change notification.
 *
 * type == CONTROL_UPDATED -> control is set, shard is null.
 * type == SHARD_UPDATED / SHARD_DELETED -> shard is set, control is null.
 * type == IGNORED -> both null.
 */
public record ShardEvent(Type type, ControlDatabases.Kind control, String shard) {

    public enum Type {
        CONTROL_UPDATED,
        SHARD_UPDATED,
        SHARD_DELETED,
        IGNORED
    }

    private static final ShardEvent IGNORED_EVENT = new ShardEvent(Type.IGNORED, null, null);

    public ShardEvent {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case CONTROL_UPDATED -> Objects.requireNonNull(control, "control");
            case SHARD_UPDATED, SHARD_DELETED -> Objects.requireNonNull(shard, "shard");
            case IGNORED -> { }
        }
    }

    public static ShardEvent controlUpdated(ControlDatabases.Kind kind) {
        return new ShardEvent(Type.CONTROL_UPDATED, kind, null);
    }

    public static ShardEvent shardUpdated(String shard) {
        return new ShardEvent(Type.SHARD_UPDATED, null, shard);
    }

    public static ShardEvent shardDeleted(String shard) {
        return new ShardEvent(Type.SHARD_DELETED, null, shard);
    }

    public static ShardEvent ignored() {
        return IGNORED_EVENT;
    }
}
