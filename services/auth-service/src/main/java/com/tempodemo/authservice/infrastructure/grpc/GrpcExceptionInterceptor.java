package com.tempodemo.authservice.infrastructure.grpc;

import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC server interceptor that maps exceptions escaping a handler to specific status codes.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} → {@code INVALID_ARGUMENT}
 *   <li>{@link IllegalStateException} → {@code FAILED_PRECONDITION}
 *   <li>{@link StatusRuntimeException} → its own status
 *   <li>anything else → {@code INTERNAL} "Internal server error"
 * </ul>
 *
 * <p>The authorization check never throws, so in practice this only covers unexpected bugs.
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(
                next.startCall(call, headers)) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    call.close(mapException(e), new Metadata());
                }
            }

            @Override
            public void onHalfClose() {
                // unary handlers run here; an escaping exception would otherwise become UNKNOWN
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    call.close(mapException(e), new Metadata());
                }
            }
        };
    }

    /** Maps a Java exception to a gRPC Status. Package-private for testing. */
    Status mapException(Throwable throwable) {
        if (throwable instanceof IllegalArgumentException) {
            log.warn("gRPC bad request: {}", throwable.getMessage());
            return Status.INVALID_ARGUMENT
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof IllegalStateException) {
            log.warn("gRPC failed precondition: {}", throwable.getMessage());
            return Status.FAILED_PRECONDITION
                    .withDescription(throwable.getMessage())
                    .withCause(throwable);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }
}
