package io.shardsync.server.cluster;

import java.util.List;
import java.util.Set;

/**
 * View of cluster membership used when choosing push targets.
 *
 * All methods must be cheap and non-blocking; they are called from the
 * scheduler loop.
 */
public interface Membership {

    /** Every configured cluster member, including the local node. */
    List<String> nodes();

    /** Currently reachable peers. Never contains the local node. */
    Set<String> liveNodes();

    /**
     * Round-robin target for control database pushes: the next live node
     * after the local one. Returns the local node when it is alone.
     */
    String nextNode();
}
