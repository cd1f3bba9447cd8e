package io.shardsync.server.dto;

import java.util.List;

/**
 * Jackson binding for the cluster JSON file.
 * Example:
 *   {
 *     "localNodeId": "node-a",
 *     "nodes": [ {"nodeId": "node-a", "host": "localhost", "grpcPort": 50051} ],
 *     "shards": [ {"database": "accounts.1700000000", "range": "00000000-7fffffff",
 *                  "nodes": ["node-a", "node-b"]} ]
 *   }
 */
public class JsonConfig {
    public String localNodeId;
    public List<NodeEntry> nodes;
    public List<ShardEntry> shards;

    public static class NodeEntry {
        public String nodeId;
        public String host;
        public int grpcPort;
    }

    public static class ShardEntry {
        public String database; // includes the creation suffix
        public String range;    // "xxxxxxxx-yyyyyyyy"
        public List<String> nodes;
    }
}
