package com.tempodemo.authservice.domain;

import io.grpc.Status;
import java.util.List;

/**
 * Outcome of one authorization check: either let the request through with extra upstream headers,
 * or reject it with a reason.
 */
public sealed interface AuthorizationDecision
        permits AuthorizationDecision.Allow, AuthorizationDecision.Deny {

    int HTTP_UNAUTHORIZED = 401;

    static Allow allow(HeaderMutation... headers) {
        return new Allow(List.of(headers));
    }

    static Deny deny(String reason, Status.Code failureKind) {
        return new Deny(HTTP_UNAUTHORIZED, reason, failureKind);
    }

    /** @param headers headers the proxy adds to the upstream request */
    record Allow(List<HeaderMutation> headers) implements AuthorizationDecision {
        public Allow {
            headers = List.copyOf(headers);
        }
    }

    /**
     * @param httpStatus status the proxy answers the client with
     * @param reason human-readable reason, returned to the proxy as the status message
     * @param failureKind what went wrong; {@code UNAUTHENTICATED} for bad or missing credentials,
     *     the store's status code otherwise
     */
    record Deny(int httpStatus, String reason, Status.Code failureKind)
            implements AuthorizationDecision {}

    /** A header the proxy should set on the upstream request. */
    record HeaderMutation(String name, String value, AppendAction action) {}

    /**
     * How a {@link HeaderMutation} combines with a header of the same name already present. Names
     * match Envoy's {@code HeaderValueOption.HeaderAppendAction}.
     */
    enum AppendAction {
        APPEND_IF_EXISTS_OR_ADD
    }
}
