package io.shardsync.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.shardsync.core.ShardEventClassifier;
import io.shardsync.core.SyncSettings;
import io.shardsync.server.cluster.ClusterConfig;
import io.shardsync.server.cluster.ClusterMembership;
import io.shardsync.server.cluster.GrpcPushTransport;
import io.shardsync.server.cluster.ShardMap;
import io.shardsync.server.feed.LocalChangeFeed;
import io.shardsync.server.feed.SyncConfigStore;
import io.shardsync.server.replica.GrpcShardPushService;
import io.shardsync.server.replica.LoggingReplicationTrigger;
import io.shardsync.server.sync.PushExecutor;
import io.shardsync.server.sync.PushScheduler;
import io.shardsync.server.sync.ReconfigurationHandler;
import io.shardsync.server.sync.SyncEventLoop;
import io.shardsync.server.sync.SyncMetrics;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for a single shard-sync node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Build ClusterConfig, membership, shard map and the gRPC push transport.
 *  - Wire the push executor, scheduler and sync event loop.
 *  - Start the gRPC server that receives pushes from peers.
 *  - Start the HTTP server for event ingest and administration.
 */
public final class Main {

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);

        // ------ Cluster -------
        ClusterConfig clusterConfig = buildClusterConfig(cfg);
        var membership = new ClusterMembership(clusterConfig);
        var shardMap = new ShardMap(clusterConfig);
        var transport = new GrpcPushTransport(clusterConfig, Duration.ofSeconds(5));

        // ------ Collaborators the loop listens to -------
        var feed = new LocalChangeFeed();
        var configStore = new SyncConfigStore(cfg.initialSettings());
        SyncSettings initial = ReconfigurationHandler.readInitial(configStore);

        // ------ Push pipeline -------
        var metrics = new SyncMetrics();
        ExecutorService pushWorkers = Executors.newFixedThreadPool(4, daemonThreads("push-worker"));
        var pushExecutor = new PushExecutor(shardMap, membership, transport, pushWorkers, metrics);

        var loop = new SyncEventLoop(
                timer -> new PushScheduler(
                        initial,
                        cfg.controlDatabases(),
                        membership,
                        shardMap,
                        pushExecutor,
                        timer,
                        System::nanoTime,
                        metrics
                ),
                new ShardEventClassifier(cfg.controlDatabases()),
                feed,
                configStore,
                metrics,
                SyncEventLoop.DEFAULT_RESUBSCRIBE_BACKOFF
        );

        // ------ gRPC push receiver ------
        Server grpcServer = ServerBuilder
                .forPort(clusterConfig.localNode().port())
                .addService(new GrpcShardPushService(new LoggingReplicationTrigger(shardMap)))
                .build();

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), feed, configStore, membership, loop);

        // Start everything
        loop.start();
        web.start();
        try {
            grpcServer.start();
        } catch (IOException e) {
            throw new RuntimeException("Failed to start gRPC server", e);
        }

        System.out.printf(
                "Node %s listening on http://%s:%d (HTTP) and grpc://%s:%d (push); delay=%dms frequency=%dms buckets=%d%n",
                cfg.nodeId(),
                "localhost", cfg.httpPort(),
                clusterConfig.localNode().host(),
                clusterConfig.localNode().port(),
                initial.delayMillis(),
                initial.frequencyMillis(),
                initial.windowLength()
        );

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.stop();
            web.stop();
            grpcServer.shutdown();
            pushWorkers.shutdown();
            transport.shutdown();
        }));
    }

    private static ClusterConfig buildClusterConfig(ServerConfig cfg) {
        if (cfg.clusterConfigPath() != null && !cfg.clusterConfigPath().isBlank()) {
            return ClusterConfig.fromJsonFile(Path.of(cfg.clusterConfigPath()), cfg.nodeId());
        }
        return ClusterConfig.singleNode(cfg.nodeId(), "localhost", cfg.grpcPort());
    }

    private static java.util.concurrent.ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
