package io.shardsync.server;

import io.shardsync.core.ControlDatabases;
import io.shardsync.core.SyncSettings;

/**
 * Per-node server configuration parsed from CLI args.
 *
 * Supports:
 *  - nodeId:            logical node identity (must appear in the cluster config)
 *  - httpPort:          admin / event-ingest HTTP port
 *  - grpcPort:          node-to-node push port (single-node mode only)
 *  - clusterConfigPath: optional JSON cluster config (nodes + shard placements)
 *  - syncDelayMillis:   initial sync_delay
 *  - syncFrequencyMillis: initial sync_frequency
 *  - nodesDb / shardsDb / usersDb: names of the control databases
 */
public record ServerConfig(
        String nodeId,
        int httpPort,
        int grpcPort,
        String clusterConfigPath,
        long syncDelayMillis,
        long syncFrequencyMillis,
        String nodesDb,
        String shardsDb,
        String usersDb
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --node-id,   -n   <id>
     *   --http-port, -p   <port>
     *   --grpc-port, -g   <port>
     *   --cluster-config, -c <path>
     *   --sync-delay      <millis>
     *   --sync-frequency  <millis>
     *   --nodes-db        <name>
     *   --shards-db       <name>
     *   --users-db        <name>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        String nodeId = "node-a";
        int httpPort = 8080;
        int grpcPort = 50051;
        String clusterConfigPath = null;
        long delay = SyncSettings.DEFAULT_DELAY_MILLIS;
        long frequency = SyncSettings.DEFAULT_FREQUENCY_MILLIS;
        ControlDatabases dbs = ControlDatabases.defaults();
        String nodesDb = dbs.nodes();
        String shardsDb = dbs.shards();
        String usersDb = dbs.users();

        // CLIArg Parser
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--node-id", "-n" -> {
                    ensureValue(args, i);
                    nodeId = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseIntOrExit("http-port", args[++i]);
                }

                case "--grpc-port", "-g" -> {
                    ensureValue(args, i);
                    grpcPort = parseIntOrExit("grpc-port", args[++i]);
                }

                case "--cluster-config", "-c" -> {
                    ensureValue(args, i);
                    clusterConfigPath = args[++i];
                }

                case "--sync-delay" -> {
                    ensureValue(args, i);
                    delay = parseIntOrExit("sync-delay", args[++i]);
                }

                case "--sync-frequency" -> {
                    ensureValue(args, i);
                    frequency = parseIntOrExit("sync-frequency", args[++i]);
                }

                case "--nodes-db" -> {
                    ensureValue(args, i);
                    nodesDb = args[++i];
                }

                case "--shards-db" -> {
                    ensureValue(args, i);
                    shardsDb = args[++i];
                }

                case "--users-db" -> {
                    ensureValue(args, i);
                    usersDb = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        validateSyncSettingsOrExit(delay, frequency);
        return new ServerConfig(
                nodeId,
                httpPort,
                grpcPort,
                clusterConfigPath,
                delay,
                frequency,
                nodesDb,
                shardsDb,
                usersDb
        );
    }

    public SyncSettings initialSettings() {
        return SyncSettings.of(syncDelayMillis, syncFrequencyMillis);
    }

    public ControlDatabases controlDatabases() {
        return new ControlDatabases(nodesDb, shardsDb, usersDb);
    }

    private static int parseIntOrExit(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + value);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void validateSyncSettingsOrExit(long delay, long frequency) {
        try {
            SyncSettings.of(delay, frequency);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid sync settings: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --node-id,        -n   Node identifier (default: node-a)
              --http-port,      -p   HTTP port (default: 8080)
              --grpc-port,      -g   gRPC push port without a cluster config (default: 50051)
              --cluster-config, -c   Path to JSON cluster config (optional)
              --sync-delay           Max wait before a queued shard is pushed, ms (default: 5000)
              --sync-frequency       Min spacing between flushes, ms (default: 500)
              --nodes-db             Node list database (default: _nodes)
              --shards-db            Shard map database (default: _dbs)
              --users-db             Users database (default: _users)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
