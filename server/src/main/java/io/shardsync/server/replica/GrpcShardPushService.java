package io.shardsync.server.replica;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import java.util.Objects;

/**
 * Receiving end of node-to-node pushes.
 *
 * Responsibilities:
 *  - Decode PushRequest and hand it to the ReplicationTrigger.
 *  - Map an unknown subject to NOT_FOUND, IllegalArgumentException to
 *    INVALID_ARGUMENT, everything else to INTERNAL.
 */
public final class GrpcShardPushService extends ShardPushGrpc.ShardPushImplBase {

    private final ReplicationTrigger trigger;

    public GrpcShardPushService(ReplicationTrigger trigger) {
        this.trigger = Objects.requireNonNull(trigger, "trigger");
    }

    @Override
    public void push(
            ShardPushProto.PushRequest request,
            StreamObserver<ShardPushProto.PushResponse> responseObserver
    ) {
        try {
            boolean known = trigger.replicate(request.getSubject(), request.getSourceNodeId());
            if (!known) {
                responseObserver.onError(
                        Status.NOT_FOUND
                                .withDescription("unknown subject " + request.getSubject())
                                .asException()
                );
                return;
            }

            responseObserver.onNext(
                    ShardPushProto.PushResponse.newBuilder()
                            .setAccepted(true)
                            .build()
            );
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }
}
