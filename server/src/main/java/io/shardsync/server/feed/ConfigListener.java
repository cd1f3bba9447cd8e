package io.shardsync.server.feed;

/**
 * Receives configuration changes from a ConfigSource.
 */
public interface ConfigListener {

    /** Raw, unparsed value as stored. */
    void onConfigChange(String key, String value);

    /** The source dropped this registration unexpectedly. */
    void onTerminated(Throwable cause);
}
