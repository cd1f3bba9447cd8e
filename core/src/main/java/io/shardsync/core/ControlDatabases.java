package io.shardsync.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Names of the cluster-metadata databases that are pushed immediately
 * instead of going through the debounce window.
 */
public record ControlDatabases(String nodes, String shards, String users) {

    public enum Kind {
        NODES,
        SHARDS,
        USERS
    }

    public ControlDatabases {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(shards, "shards");
        Objects.requireNonNull(users, "users");
        if (nodes.isBlank() || shards.isBlank() || users.isBlank()) {
            throw new IllegalArgumentException("control database names must not be blank");
        }
    }

    public static ControlDatabases defaults() {
        return new ControlDatabases("_nodes", "_dbs", "_users");
    }

    /** Which control database 'subject' names, if any. */
    public Optional<Kind> kindOf(String subject) {
        if (nodes.equals(subject)) return Optional.of(Kind.NODES);
        if (shards.equals(subject)) return Optional.of(Kind.SHARDS);
        if (users.equals(subject)) return Optional.of(Kind.USERS);
        return Optional.empty();
    }

    public String nameOf(Kind kind) {
        return switch (kind) {
            case NODES -> nodes;
            case SHARDS -> shards;
            case USERS -> users;
        };
    }
}
