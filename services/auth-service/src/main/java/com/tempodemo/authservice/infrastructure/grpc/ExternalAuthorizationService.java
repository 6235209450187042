package com.tempodemo.authservice.infrastructure.grpc;

import com.tempodemo.authservice.domain.AuthorizationDecision;
import com.tempodemo.authservice.domain.BasicAuthorizer;
import com.tempodemo.observability.CorrelationContext;
import com.tempodemo.observability.CorrelationContextHolder;
import com.tempodemo.observability.MetricFactory;
import com.tempodemo.observability.SensitiveDataRedactor;
import io.envoyproxy.envoy.service.auth.v3.AttributeContext;
import io.envoyproxy.envoy.service.auth.v3.AuthorizationGrpc;
import io.envoyproxy.envoy.service.auth.v3.CheckRequest;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.grpc.stub.StreamObserver;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import net.devh.boot.grpc.server.service.GrpcService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envoy {@code envoy.service.auth.v3.Authorization} endpoint.
 *
 * <p>Every call gets a response: denials are ordinary {@link CheckResponse}s, not gRPC errors.
 */
@GrpcService
public class ExternalAuthorizationService extends AuthorizationGrpc.AuthorizationImplBase {

    private static final Logger log = LoggerFactory.getLogger(ExternalAuthorizationService.class);

    static final String DECISIONS_METRIC = "authz.decisions";
    static final String CHECK_DURATION_METRIC = "authz.check.duration";

    private final BasicAuthorizer authorizer;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;
    private final Timer checkTimer;

    public ExternalAuthorizationService(
            BasicAuthorizer authorizer, MetricFactory metrics, SensitiveDataRedactor redactor) {
        this.authorizer = authorizer;
        this.metrics = metrics;
        this.redactor = redactor;
        this.checkTimer = metrics.timer(CHECK_DURATION_METRIC, "Time to reach an authorization decision");
    }

    @Override
    public void check(CheckRequest request, StreamObserver<CheckResponse> responseObserver) {
        AttributeContext.HttpRequest http = request.getAttributes().getRequest().getHttp();
        bindRequestId(http.getId());
        Map<String, String> headers = http.getHeadersMap();
        if (log.isDebugEnabled()) {
            log.debug("Check {} {} headers={}", http.getMethod(), http.getPath(), redactor.redact(headers));
        }

        AuthorizationDecision decision = checkTimer.record(() -> authorizer.check(headers));
        recordDecision(decision);

        responseObserver.onNext(CheckResponses.from(decision));
        responseObserver.onCompleted();
    }

    private void recordDecision(AuthorizationDecision decision) {
        if (decision instanceof AuthorizationDecision.Allow allow) {
            allow.headers().stream()
                    .filter(h -> BasicAuthorizer.USER_INFO_HEADER.equals(h.name()))
                    .findFirst()
                    .ifPresent(h -> CorrelationContextHolder.bindUser(h.value()));
            metrics.counter(DECISIONS_METRIC, "Authorization decisions", "outcome", "allow", "reason_kind", "OK")
                    .increment();
        } else {
            var deny = (AuthorizationDecision.Deny) decision;
            metrics.counter(DECISIONS_METRIC, "Authorization decisions",
                            "outcome", "deny", "reason_kind", deny.failureKind().name())
                    .increment();
        }
    }

    /** Envoy's request id names the proxied request; prefer it over the call metadata. */
    private static void bindRequestId(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            return;
        }
        CorrelationContextHolder.get()
                .ifPresent(ctx -> CorrelationContextHolder.set(
                        new CorrelationContext(requestId, ctx.userId(), ctx.traceId(), ctx.spanId())));
    }
}
