package io.shardsync.server.feed;

import io.shardsync.core.SyncSettings;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory ConfigSource holding the sync tunables as raw strings.
 *
 * Values are stored as given; validating them is the listener's job, so a
 * bad value can sit in the store while the scheduler keeps the old one.
 */
public final class SyncConfigStore implements ConfigSource {
    private static final Logger log = Logger.getLogger(SyncConfigStore.class.getName());

    public static final String SYNC_DELAY = "sync_delay";
    public static final String SYNC_FREQUENCY = "sync_frequency";

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final List<ConfigListener> listeners = new CopyOnWriteArrayList<>();

    public SyncConfigStore(SyncSettings initial) {
        values.put(SYNC_DELAY, Long.toString(initial.delayMillis()));
        values.put(SYNC_FREQUENCY, Long.toString(initial.frequencyMillis()));
    }

    public static boolean isKnownKey(String key) {
        return SYNC_DELAY.equals(key) || SYNC_FREQUENCY.equals(key);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Store 'value' under 'key' and notify listeners.
     *
     * @throws IllegalArgumentException for keys other than sync_delay / sync_frequency.
     */
    public void set(String key, String value) {
        if (!isKnownKey(key)) {
            throw new IllegalArgumentException("unknown config key: " + key);
        }
        Objects.requireNonNull(value, "value");
        values.put(key, value);
        for (ConfigListener l : listeners) {
            try {
                l.onConfigChange(key, value);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "config listener failed on " + key, e);
            }
        }
    }

    @Override
    public Subscription listen(ConfigListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Drop every registration and notify the listeners. */
    public void terminate(Throwable cause) {
        for (ConfigListener l : listeners) {
            listeners.remove(l);
            l.onTerminated(cause);
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
