package io.shardsync.server.feed;

/**
 * Handle for an active listener registration. Closing it is idempotent and
 * does not fire onTerminated.
 */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
