package com.tempodemo.authservice.infrastructure.grpc;

import com.google.rpc.Code;
import com.google.rpc.Status;
import com.tempodemo.authservice.domain.AuthorizationDecision;
import com.tempodemo.authservice.domain.AuthorizationDecision.Allow;
import com.tempodemo.authservice.domain.AuthorizationDecision.Deny;
import com.tempodemo.authservice.domain.AuthorizationDecision.HeaderMutation;
import io.envoyproxy.envoy.config.core.v3.HeaderValue;
import io.envoyproxy.envoy.config.core.v3.HeaderValueOption;
import io.envoyproxy.envoy.config.core.v3.HeaderValueOption.HeaderAppendAction;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.envoyproxy.envoy.service.auth.v3.DeniedHttpResponse;
import io.envoyproxy.envoy.service.auth.v3.OkHttpResponse;
import io.envoyproxy.envoy.type.v3.HttpStatus;
import io.envoyproxy.envoy.type.v3.StatusCode;

/** Maps {@link AuthorizationDecision}s onto Envoy ext_authz v3 responses. */
final class CheckResponses {

    private CheckResponses() {}

    static CheckResponse from(AuthorizationDecision decision) {
        if (decision instanceof Allow allow) {
            return allowed(allow);
        }
        return denied((Deny) decision);
    }

    private static CheckResponse allowed(Allow allow) {
        OkHttpResponse.Builder ok = OkHttpResponse.newBuilder();
        for (HeaderMutation header : allow.headers()) {
            ok.addHeaders(
                    HeaderValueOption.newBuilder()
                            .setHeader(
                                    HeaderValue.newBuilder()
                                            .setKey(header.name())
                                            .setValue(header.value()))
                            .setAppendAction(HeaderAppendAction.valueOf(header.action().name())));
        }
        return CheckResponse.newBuilder()
                .setStatus(Status.newBuilder().setCode(Code.OK_VALUE))
                .setOkResponse(ok)
                .build();
    }

    private static CheckResponse denied(Deny deny) {
        StatusCode httpCode = StatusCode.forNumber(deny.httpStatus());
        if (httpCode == null) {
            httpCode = StatusCode.Unauthorized;
        }
        return CheckResponse.newBuilder()
                .setStatus(
                        Status.newBuilder()
                                .setCode(Code.UNAUTHENTICATED_VALUE)
                                .setMessage(deny.reason()))
                .setDeniedResponse(
                        DeniedHttpResponse.newBuilder()
                                .setStatus(HttpStatus.newBuilder().setCode(httpCode)))
                .build();
    }
}
