package io.shardsync.server.cluster;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shardsync.core.ShardRange;
import io.shardsync.server.dto.JsonConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static cluster topology: member nodes plus the shard placement table.
 */
public final class ClusterConfig {

    public record Node(
            String nodeId,
            String host,
            int port
    ) {
        public Node {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(host, "host");
            if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
        }
    }

    /**
     * One database range and the nodes holding a replica of it.
     */
    public record Placement(
            String database,
            ShardRange range,
            List<String> nodeIds
    ) {
        public Placement {
            Objects.requireNonNull(database, "database");
            Objects.requireNonNull(range, "range");
            if (database.isBlank()) throw new IllegalArgumentException("database must not be blank");
            if (nodeIds == null || nodeIds.isEmpty()) throw new IllegalArgumentException("placement needs at least one node");
            nodeIds = List.copyOf(nodeIds);
        }
    }

    private final String localNodeId;
    private final List<Node> nodes;
    private final List<Placement> placements;

    public ClusterConfig(String localNodeId, List<Node> nodes, List<Placement> placements) {
        if (nodes == null || nodes.isEmpty()) throw new IllegalArgumentException("nodes must not be empty");
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.nodes = List.copyOf(nodes);
        this.placements = placements == null ? List.of() : List.copyOf(placements);

        Set<String> ids = new HashSet<>();
        for (Node n : this.nodes) {
            if (!ids.add(n.nodeId())) {
                throw new IllegalArgumentException("duplicate nodeId " + n.nodeId());
            }
        }
        for (Placement p : this.placements) {
            for (String id : p.nodeIds()) {
                if (!ids.contains(id)) {
                    throw new IllegalArgumentException(
                            "placement %s/%s references unknown node %s".formatted(p.range().format(), p.database(), id));
                }
            }
        }
        localNode(); // fail fast if the local node is missing
    }

    public static ClusterConfig fromJsonFile(Path path) {
        return fromJsonFile(path, null);
    }

    /** Load from JSON, optionally overriding localNodeId with the CLI --node-id. */
    public static ClusterConfig fromJsonFile(Path path, String overrideLocalNodeId) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            JsonConfig cfg = mapper.readValue(path.toFile(), JsonConfig.class);
            if (cfg.nodes == null) {
                throw new IllegalArgumentException("cluster config has no nodes: " + path);
            }
            List<Node> nodeList = cfg.nodes.stream()
                    .map(n -> new Node(n.nodeId, n.host, n.grpcPort))
                    .toList();

            List<Placement> placementList = cfg.shards == null ? List.of() : cfg.shards.stream()
                    .map(s -> new Placement(s.database, ShardRange.parse(s.range), s.nodes))
                    .toList();

            String localId = (overrideLocalNodeId != null && !overrideLocalNodeId.isBlank())
                    ? overrideLocalNodeId
                    : cfg.localNodeId;

            return new ClusterConfig(localId, nodeList, placementList);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ClusterConfig from " + path, e);
        }
    }

    /** Single-node cluster without placements, used when no JSON file is given. */
    public static ClusterConfig singleNode(String nodeId, String host, int grpcPort) {
        return new ClusterConfig(nodeId, List.of(new Node(nodeId, host, grpcPort)), List.of());
    }

    public String localNodeId() {
        return localNodeId;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Placement> placements() {
        return placements;
    }

    public Node localNode() {
        return nodes.stream()
                .filter(n -> n.nodeId().equals(localNodeId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "localNodeId %s not present in cluster nodes".formatted(localNodeId)
                ));
    }
}
