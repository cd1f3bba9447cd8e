package io.shardsync.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Classification of raw change notifications.
 */
class ShardEventClassifierTest {

    private final ShardEventClassifier classifier =
            new ShardEventClassifier(new ControlDatabases("nodes", "dbs", "users"));

    @Test
    void control_database_updates_are_recognised() {
        assertEquals(ShardEvent.controlUpdated(ControlDatabases.Kind.NODES),
                classifier.classify(ChangeEvent.updated("nodes")));
        assertEquals(ShardEvent.controlUpdated(ControlDatabases.Kind.SHARDS),
                classifier.classify(ChangeEvent.updated("dbs")));
        assertEquals(ShardEvent.controlUpdated(ControlDatabases.Kind.USERS),
                classifier.classify(ChangeEvent.updated("users")));
    }

    @Test
    void control_database_deletes_are_ignored() {
        assertEquals(ShardEvent.Type.IGNORED, classifier.classify(ChangeEvent.deleted("users")).type());
        assertEquals(ShardEvent.Type.IGNORED, classifier.classify(ChangeEvent.deleted("nodes")).type());
    }

    @Test
    void shard_update_yields_shard_updated() {
        String name = "shards/00000000-1fffffff/db1.1700000000";
        ShardEvent ev = classifier.classify(ChangeEvent.updated(name));
        assertEquals(ShardEvent.Type.SHARD_UPDATED, ev.type());
        assertEquals(name, ev.shard());
    }

    @Test
    void any_shard_prefixed_update_counts_even_when_short() {
        ShardEvent ev = classifier.classify(ChangeEvent.updated("shards/x"));
        assertEquals(ShardEvent.shardUpdated("shards/x"), ev);
    }

    @Test
    void shard_delete_requires_full_range_prefix() {
        String name = "shards/20000000-3fffffff/db1.1700000000";
        assertEquals(ShardEvent.shardDeleted(name), classifier.classify(ChangeEvent.deleted(name)));

        assertEquals(ShardEvent.ignored(), classifier.classify(ChangeEvent.deleted("shards/20000000-3ff")));
    }

    @Test
    void plain_databases_and_creates_are_ignored() {
        assertEquals(ShardEvent.ignored(), classifier.classify(ChangeEvent.updated("accounts")));
        assertEquals(ShardEvent.ignored(), classifier.classify(ChangeEvent.deleted("accounts")));
        assertEquals(ShardEvent.ignored(), classifier.classify(
                new ChangeEvent("shards/00000000-1fffffff/db1.1", ChangeEvent.Kind.CREATED)));
    }

    @Test
    void kind_parses_wire_names() {
        assertEquals(ChangeEvent.Kind.UPDATED, ChangeEvent.Kind.fromWire("updated"));
        assertEquals(ChangeEvent.Kind.DELETED, ChangeEvent.Kind.fromWire(" Deleted "));
        assertThrows(IllegalArgumentException.class, () -> ChangeEvent.Kind.fromWire("compacted"));
    }

    @Test
    void delete_prefix_length_is_measured_in_utf8_bytes() {
        String multiByte = "shards/" + "\u00e9".repeat(9); // 18 bytes after the prefix
        assertEquals(ShardEvent.Type.SHARD_DELETED, classifier.classify(ChangeEvent.deleted(multiByte)).type());
        assertEquals(ShardEvent.Type.IGNORED,
                classifier.classify(ChangeEvent.deleted("shards/" + "a".repeat(17))).type());
    }
}
