package io.shardsync.server.cluster;

import io.shardsync.core.ShardRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies static multi-node topology and shard placement can be loaded from JSON.
 */
class ClusterConfigJsonTest {

    @TempDir
    Path tmp;

    private static final String THREE_NODES = """
            {
              "localNodeId": "node-a",
              "nodes": [
                {"nodeId": "node-a", "host": "localhost", "grpcPort": 50051},
                {"nodeId": "node-b", "host": "localhost", "grpcPort": 50052},
                {"nodeId": "node-c", "host": "localhost", "grpcPort": 50053}
              ],
              "shards": [
                {"database": "accounts.1700000000", "range": "00000000-7fffffff", "nodes": ["node-a", "node-b"]},
                {"database": "accounts.1700000000", "range": "80000000-ffffffff", "nodes": ["node-b", "node-c"]}
              ],
              "comment": "unknown fields are ignored"
            }
            """;

    @Test
    void loads_three_node_cluster_from_json() throws Exception {
        Path cfgPath = tmp.resolve("cluster.json");
        Files.writeString(cfgPath, THREE_NODES);

        ClusterConfig cfg = ClusterConfig.fromJsonFile(cfgPath);

        assertEquals("node-a", cfg.localNodeId());
        assertEquals(3, cfg.nodes().size());
        assertEquals(2, cfg.placements().size());

        var nodeB = cfg.nodes().stream()
                .filter(n -> n.nodeId().equals("node-b"))
                .findFirst()
                .orElseThrow();
        assertEquals("localhost", nodeB.host());
        assertEquals(50052, nodeB.port());

        var second = cfg.placements().get(1);
        assertEquals(ShardRange.parse("80000000-ffffffff"), second.range());
        assertEquals(List.of("node-b", "node-c"), second.nodeIds());
    }

    @Test
    void cli_node_id_overrides_the_file() throws Exception {
        Path cfgPath = tmp.resolve("cluster.json");
        Files.writeString(cfgPath, THREE_NODES);

        ClusterConfig cfg = ClusterConfig.fromJsonFile(cfgPath, "node-c");

        assertEquals("node-c", cfg.localNodeId());
        assertEquals(50053, cfg.localNode().port());
    }

    @Test
    void placement_on_unknown_node_is_rejected() throws Exception {
        Path cfgPath = tmp.resolve("bad.json");
        Files.writeString(cfgPath, """
                {
                  "localNodeId": "node-a",
                  "nodes": [ {"nodeId": "node-a", "host": "localhost", "grpcPort": 50051} ],
                  "shards": [ {"database": "db.1", "range": "00000000-ffffffff", "nodes": ["node-z"]} ]
                }
                """);

        assertThrows(IllegalArgumentException.class, () -> ClusterConfig.fromJsonFile(cfgPath));
    }

    @Test
    void missing_local_node_fails_fast() throws Exception {
        Path cfgPath = tmp.resolve("cluster.json");
        Files.writeString(cfgPath, THREE_NODES);

        assertThrows(IllegalStateException.class, () -> ClusterConfig.fromJsonFile(cfgPath, "node-q"));
    }

    @Test
    void duplicate_node_ids_are_rejected() {
        var a = new ClusterConfig.Node("node-a", "localhost", 50051);
        assertThrows(IllegalArgumentException.class,
                () -> new ClusterConfig("node-a", List.of(a, a), List.of()));
    }
}
