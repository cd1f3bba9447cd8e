package io.shardsync.core;

import java.util.Locale;
import java.util.Objects;

/**
 * One database change notification: which database (or shard replica) changed and how.
 */
public record ChangeEvent(String subject, Kind kind) {

    public enum Kind {
        CREATED,
        UPDATED,
        DELETED;

        /**
         * Parse a lowercase wire name ("updated", "deleted", "created").
         *
         * @throws IllegalArgumentException for anything else.
         */
        public static Kind fromWire(String value) {
            if (value == null) {
                throw new IllegalArgumentException("kind must not be null");
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "created" -> CREATED;
                case "updated" -> UPDATED;
                case "deleted" -> DELETED;
                default -> throw new IllegalArgumentException(
                        "kind must be one of: created, updated, deleted");
            };
        }
    }

    public ChangeEvent {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(kind, "kind");
    }

    public static ChangeEvent updated(String subject) {
        return new ChangeEvent(subject, Kind.UPDATED);
    }

    public static ChangeEvent deleted(String subject) {
        return new ChangeEvent(subject, Kind.DELETED);
    }
}
