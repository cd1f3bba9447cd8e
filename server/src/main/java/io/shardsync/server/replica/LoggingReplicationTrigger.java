package io.shardsync.server.replica;

import io.shardsync.core.ShardName;
import io.shardsync.server.cluster.ShardDirectory;
import io.shardsync.server.cluster.ShardNotFoundException;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * ReplicationTrigger that validates the subject against the local shard
 * directory and logs the request. The replication protocol proper lives
 * outside this service.
 */
public final class LoggingReplicationTrigger implements ReplicationTrigger {
    private static final Logger log = Logger.getLogger(LoggingReplicationTrigger.class.getName());

    private final ShardDirectory directory;

    public LoggingReplicationTrigger(ShardDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public boolean replicate(String subject, String sourceNodeId) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be empty");
        }
        if (ShardName.isShard(subject)) {
            try {
                directory.resolvePlacement(subject);
            } catch (ShardNotFoundException e) {
                return false;
            }
        }
        log.info("replication of " + subject + " requested by " + sourceNodeId);
        return true;
    }
}
