package io.shardsync.server.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Membership backed by the static ClusterConfig plus a live set that an
 * external failure detector (or the admin HTTP API) keeps up to date.
 *
 * Peers start out live; markDown / markUp flip them. The local node is
 * always considered reachable but never reported by liveNodes().
 */
public final class ClusterMembership implements Membership {
    private static final Logger log = Logger.getLogger(ClusterMembership.class.getName());

    private final String localNodeId;
    private final List<String> nodes;
    private final Set<String> live = ConcurrentHashMap.newKeySet();

    public ClusterMembership(ClusterConfig cluster) {
        Objects.requireNonNull(cluster, "cluster");
        this.localNodeId = cluster.localNodeId();
        List<String> ids = new ArrayList<>();
        for (ClusterConfig.Node n : cluster.nodes()) {
            ids.add(n.nodeId());
            if (!n.nodeId().equals(localNodeId)) {
                live.add(n.nodeId());
            }
        }
        this.nodes = List.copyOf(ids);
    }

    @Override
    public List<String> nodes() {
        return nodes;
    }

    @Override
    public Set<String> liveNodes() {
        return Collections.unmodifiableSet(new TreeSet<>(live));
    }

    /**
     * Walk the sorted list of live members (local node included) and return
     * the entry after the local node, wrapping around at the end.
     */
    @Override
    public String nextNode() {
        TreeSet<String> ring = new TreeSet<>(live);
        ring.add(localNodeId);
        String next = ring.higher(localNodeId);
        return next != null ? next : ring.first();
    }

    /** @return true if the peer was down before. */
    public boolean markUp(String nodeId) {
        requireKnownPeer(nodeId);
        boolean changed = live.add(nodeId);
        if (changed) {
            log.info("node " + nodeId + " is up");
        }
        return changed;
    }

    /** @return true if the peer was live before. */
    public boolean markDown(String nodeId) {
        requireKnownPeer(nodeId);
        boolean changed = live.remove(nodeId);
        if (changed) {
            log.info("node " + nodeId + " is down");
        }
        return changed;
    }

    public String localNodeId() {
        return localNodeId;
    }

    private void requireKnownPeer(String nodeId) {
        if (!nodes.contains(nodeId)) {
            throw new IllegalArgumentException("unknown node: " + nodeId);
        }
        if (nodeId.equals(localNodeId)) {
            throw new IllegalArgumentException("cannot change liveness of the local node");
        }
    }
}
