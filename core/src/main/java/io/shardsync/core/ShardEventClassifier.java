package io.shardsync.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps raw change notifications to the handful of cases the push scheduler cares about.
 *
 * Rules, first match wins:
 *  - control database updated           -> CONTROL_UPDATED(kind)
 *  - "shards/..." updated               -> SHARD_UPDATED
 *  - "shards/xxxxxxxx-yyyyyyyy/..." deleted -> SHARD_DELETED
 *  - anything else                      -> IGNORED
 *
 * Control database deletes and create events are ignored. Pure; safe to share.
 */
public final class ShardEventClassifier {

    private final ControlDatabases controlDbs;

    public ShardEventClassifier(ControlDatabases controlDbs) {
        this.controlDbs = Objects.requireNonNull(controlDbs, "controlDbs");
    }

    public ShardEvent classify(ChangeEvent event) {
        String subject = event.subject();
        Optional<ControlDatabases.Kind> control = controlDbs.kindOf(subject);

        switch (event.kind()) {
            case UPDATED -> {
                if (control.isPresent()) {
                    return ShardEvent.controlUpdated(control.get());
                }
                if (ShardName.isShard(subject)) {
                    return ShardEvent.shardUpdated(subject);
                }
            }
            case DELETED -> {
                if (control.isEmpty() && ShardName.hasRangePrefix(subject)) {
                    return ShardEvent.shardDeleted(subject);
                }
            }
            case CREATED -> {
                // nothing to push until the first update
            }
        }
        return ShardEvent.ignored();
    }

    public ControlDatabases controlDatabases() {
        return controlDbs;
    }
}
