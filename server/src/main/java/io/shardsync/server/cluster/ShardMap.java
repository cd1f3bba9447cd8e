package io.shardsync.server.cluster;

import io.shardsync.core.ShardName;
import io.shardsync.core.ShardRange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * ShardDirectory over the placement table from ClusterConfig.
 *
 * The table is keyed by (database, range). Forgetting a shard removes its
 * entry, so later lookups fail with ShardNotFoundException; names that were
 * never placed leave no state behind. Database names carry a creation
 * suffix, so a re-created database never reuses a forgotten name.
 */
public final class ShardMap implements ShardDirectory {
    private static final Logger log = Logger.getLogger(ShardMap.class.getName());

    private record Key(String database, ShardRange range) {
    }

    private final Map<Key, List<String>> placements = new ConcurrentHashMap<>();

    public ShardMap(ClusterConfig cluster) {
        Objects.requireNonNull(cluster, "cluster");
        Map<Key, Set<String>> merged = new LinkedHashMap<>();
        for (ClusterConfig.Placement p : cluster.placements()) {
            merged.computeIfAbsent(new Key(p.database(), p.range()), k -> new LinkedHashSet<>())
                    .addAll(p.nodeIds());
        }
        merged.forEach((key, nodes) -> placements.put(key, List.copyOf(nodes)));
    }

    @Override
    public List<ShardPlacement> resolvePlacement(String shard) throws ShardNotFoundException {
        ShardName name;
        try {
            name = ShardName.parse(shard);
        } catch (IllegalArgumentException bad) {
            throw new ShardNotFoundException(shard, bad);
        }

        List<String> nodeIds = placements.get(new Key(name.database(), name.range()));
        if (nodeIds == null) {
            throw new ShardNotFoundException(shard);
        }
        List<ShardPlacement> out = new ArrayList<>(nodeIds.size());
        for (String nodeId : nodeIds) {
            out.add(new ShardPlacement(shard, nodeId));
        }
        return out;
    }

    @Override
    public void forgetShard(String shard) {
        ShardName name;
        try {
            name = ShardName.parse(shard);
        } catch (IllegalArgumentException bad) {
            return;
        }
        if (placements.remove(new Key(name.database(), name.range())) != null) {
            log.fine("forgetting deleted shard " + shard);
        }
    }

    /** Number of (database, range) entries still placed. */
    int placedCount() {
        return placements.size();
    }
}
