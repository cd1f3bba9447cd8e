package io.shardsync.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Parsed shard-replica subject name.
 * <br>
 * Layout: {@code shards/<begin>-<end>/<database>}, for example
 * {@code shards/00000000-1fffffff/accounts.1700000000}. The database part
 * normally carries a creation suffix, so a re-created database yields new names.
 */
public record ShardName(String name, ShardRange range, String database) {

    public static final String PREFIX = "shards/";

    // "xxxxxxxx-yyyyyyyy/" after the prefix
    static final int RANGE_PREFIX_LENGTH = 2 * ShardRange.HEX_DIGITS + 2;

    public ShardName {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(database, "database");
    }

    /** True for any subject in the shard namespace, however short. */
    public static boolean isShard(String subject) {
        return subject != null && subject.startsWith(PREFIX);
    }

    /**
     * True when the subject is long enough to carry a full range prefix,
     * counted in UTF-8 bytes as the name is stored.
     * Deletes of shorter names are not treated as shard deletions.
     */
    public static boolean hasRangePrefix(String subject) {
        return isShard(subject)
                && subject.getBytes(StandardCharsets.UTF_8).length >= PREFIX.length() + RANGE_PREFIX_LENGTH;
    }

    /**
     * @throws IllegalArgumentException if the name is not a well-formed shard name.
     */
    public static ShardName parse(String subject) {
        if (!hasRangePrefix(subject)) {
            throw new IllegalArgumentException("not a shard name: " + subject);
        }
        int slash = PREFIX.length() + RANGE_PREFIX_LENGTH - 1;
        if (subject.length() <= slash || subject.charAt(slash) != '/') {
            throw new IllegalArgumentException("not a shard name: " + subject);
        }
        ShardRange range = ShardRange.parse(subject.substring(PREFIX.length(), slash));
        String database = subject.substring(slash + 1);
        if (database.isBlank()) {
            throw new IllegalArgumentException("shard name has no database: " + subject);
        }
        return new ShardName(subject, range, database);
    }

    /** Database name without the creation suffix ("accounts.1700000000" -> "accounts"). */
    public String logicalDatabase() {
        int dot = database.lastIndexOf('.');
        return dot > 0 ? database.substring(0, dot) : database;
    }

    public static String of(ShardRange range, String database) {
        return PREFIX + range.format() + "/" + database;
    }

    @Override
    public String toString() {
        return name;
    }
}
