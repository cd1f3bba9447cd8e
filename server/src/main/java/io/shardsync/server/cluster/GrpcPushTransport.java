package io.shardsync.server.cluster;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.shardsync.server.replica.ShardPushGrpc;
import io.shardsync.server.replica.ShardPushProto;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * gRPC-based PushTransport.
 *
 * Keeps one channel per remote node. NOT_FOUND from the peer means it no
 * longer has the subject and is reported as TARGET_GONE; every other error
 * is reported as FAILED.
 */
public final class GrpcPushTransport implements PushTransport {
    private static final Logger log = Logger.getLogger(GrpcPushTransport.class.getName());

    private final String localNodeId;
    private final Duration callTimeout;
    private final Map<String, ManagedChannel> channels;
    private final Map<String, ShardPushGrpc.ShardPushBlockingStub> stubs = new HashMap<>();

    /**
     * Production constructor: plaintext channels to every remote node in the cluster.
     */
    public GrpcPushTransport(ClusterConfig cluster, Duration callTimeout) {
        this(cluster.localNodeId(), buildChannels(cluster), callTimeout);
    }

    /**
     * Test-only constructor allowing pre-built channels (e.g., in-process).
     */
    public GrpcPushTransport(String localNodeId, Map<String, ManagedChannel> channels, Duration callTimeout) {
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.channels = Map.copyOf(channels);
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        for (Map.Entry<String, ManagedChannel> e : this.channels.entrySet()) {
            stubs.put(e.getKey(), ShardPushGrpc.newBlockingStub(e.getValue()));
        }
    }

    @Override
    public PushOutcome push(String subject, String nodeId) {
        ShardPushGrpc.ShardPushBlockingStub stub = stubs.get(nodeId);
        if (stub == null) {
            log.warning("no channel for node " + nodeId + ", dropping push of " + subject);
            return PushOutcome.FAILED;
        }
        try {
            ShardPushProto.PushRequest req = ShardPushProto.PushRequest.newBuilder()
                    .setSubject(subject)
                    .setSourceNodeId(localNodeId)
                    .build();

            ShardPushProto.PushResponse resp = stub
                    .withDeadlineAfter(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .push(req);

            return resp.getAccepted() ? PushOutcome.DELIVERED : PushOutcome.FAILED;
        } catch (StatusRuntimeException sre) {
            if (sre.getStatus().getCode() == Status.Code.NOT_FOUND) {
                return PushOutcome.TARGET_GONE;
            }
            log.log(Level.WARNING, "gRPC push of " + subject + " to node " + nodeId + " failed: " + sre.getStatus());
            return PushOutcome.FAILED;
        }
    }

    /**
     * Allow graceful shutdown for tests or node stop.
     */
    public void shutdown() {
        for (ManagedChannel channel : channels.values()) {
            channel.shutdown();
        }
        try {
            for (ManagedChannel channel : channels.values()) {
                channel.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static Map<String, ManagedChannel> buildChannels(ClusterConfig cluster) {
        Map<String, ManagedChannel> out = new HashMap<>();
        for (ClusterConfig.Node n : cluster.nodes()) {
            if (n.nodeId().equals(cluster.localNodeId())) {
                continue;
            }
            out.put(n.nodeId(), ManagedChannelBuilder
                    .forAddress(n.host(), n.port())
                    .usePlaintext() // internal traffic; terminate TLS at edge if needed
                    .build());
        }
        return out;
    }
}
