package io.shardsync.server.feed;

import io.shardsync.core.ChangeEvent;

/**
 * Receives database change notifications from a ChangeFeed.
 */
public interface ChangeListener {

    void onChange(ChangeEvent event);

    /**
     * The feed dropped this subscription unexpectedly. No further events
     * arrive until the listener subscribes again.
     */
    void onTerminated(Throwable cause);
}
