package com.tempodemo.authservice.infrastructure.grpc;

import com.tempodemo.observability.CorrelationContext;
import com.tempodemo.observability.CorrelationContextHolder;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * gRPC server interceptor that binds a correlation context for each call.
 *
 * <ol>
 *   <li>Reads {@code x-request-id} from the call metadata (Envoy sets it on every ext_authz call)
 *   <li>Falls back to a new UUID if absent
 *   <li>Binds the context, plus the current trace and span ids, around every listener callback
 * </ol>
 *
 * <p>gRPC may deliver the callbacks of one call on different executor threads, so the thread-local
 * context is set before and cleared after each callback instead of once per call.
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> REQUEST_ID_KEY =
            Metadata.Key.of("x-request-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String requestId = headers.get(REQUEST_ID_KEY);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        CorrelationContext context = withCurrentTrace(CorrelationContext.of(requestId));

        ServerCall.Listener<ReqT> delegate = callInContext(context, () -> next.startCall(call, headers));

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                inContext(context, () -> super.onMessage(message));
            }

            @Override
            public void onHalfClose() {
                inContext(context, super::onHalfClose);
            }

            @Override
            public void onCancel() {
                inContext(context, super::onCancel);
            }

            @Override
            public void onComplete() {
                inContext(context, super::onComplete);
            }

            @Override
            public void onReady() {
                inContext(context, super::onReady);
            }
        };
    }

    private static CorrelationContext withCurrentTrace(CorrelationContext context) {
        SpanContext span = Span.current().getSpanContext();
        return span.isValid() ? context.withTrace(span.getTraceId(), span.getSpanId()) : context;
    }

    private static void inContext(CorrelationContext context, Runnable callback) {
        callInContext(
                context,
                () -> {
                    callback.run();
                    return null;
                });
    }

    private static <T> T callInContext(CorrelationContext context, Supplier<T> callback) {
        CorrelationContextHolder.set(context);
        try {
            return callback.get();
        } finally {
            CorrelationContextHolder.clear();
        }
    }
}
