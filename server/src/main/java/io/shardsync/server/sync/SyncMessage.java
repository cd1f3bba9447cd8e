package io.shardsync.server.sync;

import io.shardsync.core.ChangeEvent;
import io.shardsync.core.SyncSettings;
import io.shardsync.server.feed.SyncConfigStore;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Mailbox entries for the SyncEventLoop.
 */
public interface SyncMessage {

    /** A raw change notification from the change feed. */
    record Event(ChangeEvent event) implements SyncMessage {
        public Event {
            Objects.requireNonNull(event, "event");
        }
    }

    /** The flush timer fired. */
    record Tick() implements SyncMessage {
    }

    /** A validated new value for one tunable. */
    record Reconfigure(Tunable tunable, long value) implements SyncMessage {
        public Reconfigure {
            Objects.requireNonNull(tunable, "tunable");
        }
    }

    /** Request for a status snapshot, completed on the loop thread. */
    record StatusQuery(CompletableFuture<SyncStatus> reply) implements SyncMessage {
        public StatusQuery {
            Objects.requireNonNull(reply, "reply");
        }
    }

    enum Tunable {
        DELAY(SyncConfigStore.SYNC_DELAY),
        FREQUENCY(SyncConfigStore.SYNC_FREQUENCY);

        private final String key;

        Tunable(String key) {
            this.key = key;
        }

        /** Config key this tunable is read from. */
        public String key() {
            return key;
        }

        /**
         * @throws IllegalArgumentException if the result would exceed SyncSettings.MAX_WINDOW_LENGTH.
         */
        SyncSettings applyTo(SyncSettings current, long value) {
            return switch (this) {
                case DELAY -> current.withDelay(value);
                case FREQUENCY -> current.withFrequency(value);
            };
        }
    }
}
