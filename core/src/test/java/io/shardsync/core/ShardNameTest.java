package io.shardsync.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShardNameTest {

    @Test
    void parses_range_and_database() {
        ShardName name = ShardName.parse("shards/00000000-1fffffff/accounts.1700000000");

        assertEquals(new ShardRange(0, 0x1fffffff), name.range());
        assertEquals("accounts.1700000000", name.database());
        assertEquals("accounts", name.logicalDatabase());
    }

    @Test
    void database_may_contain_slashes() {
        ShardName name = ShardName.parse("shards/e0000000-ffffffff/org/team/db.1");
        assertEquals("org/team/db.1", name.database());
        assertEquals("org/team/db", name.logicalDatabase());
        assertTrue(name.range().contains(0xffffffff));
    }

    @Test
    void range_prefix_detection() {
        assertTrue(ShardName.isShard("shards/"));
        assertFalse(ShardName.hasRangePrefix("shards/"));
        assertTrue(ShardName.hasRangePrefix("shards/00000000-1fffffff/"));
        assertFalse(ShardName.isShard("_users"));
        assertFalse(ShardName.isShard(null));
    }

    @Test
    void range_prefix_length_counts_utf8_bytes() {
        String nineTwoByteChars = "\u00e9".repeat(9); // 18 bytes, 9 chars
        assertTrue(ShardName.hasRangePrefix("shards/" + nineTwoByteChars));
        assertFalse(ShardName.hasRangePrefix("shards/" + "\u00e9".repeat(8) + "a"));
        assertThrows(IllegalArgumentException.class, () -> ShardName.parse("shards/" + nineTwoByteChars));
    }

    @Test
    void malformed_names_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ShardName.parse("shards/short"));
        assertThrows(IllegalArgumentException.class, () -> ShardName.parse("shards/0000000g-1fffffff/db"));
        assertThrows(IllegalArgumentException.class, () -> ShardName.parse("shards/00000000-1fffffff/"));
        assertThrows(IllegalArgumentException.class, () -> ShardName.parse("shards/00000000_1fffffff/db"));
        assertThrows(IllegalArgumentException.class, () -> ShardName.parse("shards/20000000-1fffffff/db"));
    }

    @Test
    void formats_back_to_the_same_name() {
        ShardRange range = ShardRange.parse("a0000000-bfffffff");
        assertEquals("shards/a0000000-bfffffff/db.5", ShardName.of(range, "db.5"));
        assertEquals("a0000000-bfffffff", range.format());
    }

    @Test
    void range_contains_uses_unsigned_bounds() {
        ShardRange upper = ShardRange.parse("80000000-ffffffff");
        assertTrue(upper.contains(0x80000000));
        assertTrue(upper.contains(-1));
        assertFalse(upper.contains(0x7fffffff));
    }
}
