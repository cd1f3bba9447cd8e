package io.shardsync.server.sync;

import io.shardsync.core.SyncSettings;
import io.shardsync.server.feed.ConfigSource;
import io.shardsync.server.feed.SyncConfigStore;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Validates live changes to sync_delay / sync_frequency and forwards the
 * good ones to the event loop, where the window is resized.
 *
 * A value must be a non-negative integer; sync_frequency must also be
 * positive. Anything else is logged and dropped, leaving the previous value
 * in effect. Other keys are ignored. The bucket-count cap depends on both
 * tunables, so the event loop checks it when applying the change.
 */
public final class ReconfigurationHandler {
    private static final Logger log = Logger.getLogger(ReconfigurationHandler.class.getName());

    private final Consumer<SyncMessage> mailbox;
    private final SyncMetrics metrics;

    public ReconfigurationHandler(Consumer<SyncMessage> mailbox, SyncMetrics metrics) {
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return true if a reconfigure message was submitted.
     */
    public boolean onConfigChange(String key, String rawValue) {
        SyncMessage.Tunable tunable;
        if (SyncConfigStore.SYNC_DELAY.equals(key)) {
            tunable = SyncMessage.Tunable.DELAY;
        } else if (SyncConfigStore.SYNC_FREQUENCY.equals(key)) {
            tunable = SyncMessage.Tunable.FREQUENCY;
        } else {
            return false;
        }

        OptionalLong parsed = parse(tunable, rawValue);
        if (parsed.isEmpty()) {
            metrics.recordConfigRejected();
            log.warning("ignoring bad value for " + key + ": " + rawValue);
            return false;
        }
        mailbox.accept(new SyncMessage.Reconfigure(tunable, parsed.getAsLong()));
        return true;
    }

    /**
     * Initial settings from the config source; missing or bad values fall
     * back to the defaults.
     */
    public static SyncSettings readInitial(ConfigSource config) {
        long delay = initialValue(config, SyncConfigStore.SYNC_DELAY,
                SyncMessage.Tunable.DELAY, SyncSettings.DEFAULT_DELAY_MILLIS);
        long frequency = initialValue(config, SyncConfigStore.SYNC_FREQUENCY,
                SyncMessage.Tunable.FREQUENCY, SyncSettings.DEFAULT_FREQUENCY_MILLIS);
        try {
            return SyncSettings.of(delay, frequency);
        } catch (IllegalArgumentException tooManyBuckets) {
            // frequency >= 1, so the default delay always fits
            log.warning("ignoring bad value for " + SyncConfigStore.SYNC_DELAY + ": " + delay
                    + " (" + tooManyBuckets.getMessage() + "), using " + SyncSettings.DEFAULT_DELAY_MILLIS);
            return SyncSettings.of(SyncSettings.DEFAULT_DELAY_MILLIS, frequency);
        }
    }

    private static long initialValue(ConfigSource config, String key, SyncMessage.Tunable tunable, long fallback) {
        Optional<String> raw = config.get(key);
        if (raw.isEmpty()) {
            return fallback;
        }
        OptionalLong parsed = parse(tunable, raw.get());
        if (parsed.isEmpty()) {
            log.warning("ignoring bad value for " + key + ": " + raw.get() + ", using " + fallback);
            return fallback;
        }
        return parsed.getAsLong();
    }

    static OptionalLong parse(SyncMessage.Tunable tunable, String rawValue) {
        if (rawValue == null) {
            return OptionalLong.empty();
        }
        long value;
        try {
            value = Long.parseLong(rawValue.trim());
        } catch (NumberFormatException nfe) {
            return OptionalLong.empty();
        }
        if (value < 0) {
            return OptionalLong.empty();
        }
        if (tunable == SyncMessage.Tunable.FREQUENCY && value == 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(value);
    }
}
