package io.shardsync.server.feed;

import io.shardsync.core.ChangeEvent;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process ChangeFeed. Producers (the HTTP ingest endpoint, tests) call
 * publish(); every subscribed listener sees each event on the caller's thread.
 */
public final class LocalChangeFeed implements ChangeFeed {
    private static final Logger log = Logger.getLogger(LocalChangeFeed.class.getName());

    private final List<ChangeListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(ChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(ChangeEvent event) {
        Objects.requireNonNull(event, "event");
        for (ChangeListener l : listeners) {
            try {
                l.onChange(event);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "change listener failed on " + event, e);
            }
        }
    }

    /**
     * Drop every subscription and tell the listeners why. Models the loss of
     * the underlying notification channel.
     */
    public void terminate(Throwable cause) {
        for (ChangeListener l : listeners) {
            listeners.remove(l);
            l.onTerminated(cause);
        }
    }

    public int subscriberCount() {
        return listeners.size();
    }
}
