package io.shardsync.server.feed;

/**
 * Source of change notifications for every database on this node.
 */
public interface ChangeFeed {

    Subscription subscribe(ChangeListener listener);
}
