package io.shardsync.server.feed;

import java.util.Optional;

/**
 * Key/value configuration with change notification.
 */
public interface ConfigSource {

    Optional<String> get(String key);

    Subscription listen(ConfigListener listener);
}
