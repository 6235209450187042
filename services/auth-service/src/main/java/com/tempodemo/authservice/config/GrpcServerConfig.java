package com.tempodemo.authservice.config;

import com.tempodemo.authservice.infrastructure.grpc.GrpcCorrelationInterceptor;
import com.tempodemo.authservice.infrastructure.grpc.GrpcExceptionInterceptor;
import io.grpc.ServerInterceptor;
import io.opentelemetry.instrumentation.grpc.v1_6.GrpcTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import net.devh.boot.grpc.server.interceptor.GrpcGlobalServerInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

/**
 * Registers the server interceptors applied to every gRPC service.
 *
 * <p>Lower order runs first: the tracing interceptor opens the server span, the correlation
 * interceptor binds the MDC inside it, and the exception interceptor maps failures closest to the
 * handler.
 */
@Configuration(proxyBeanMethods = false)
public class GrpcServerConfig {

    @GrpcGlobalServerInterceptor
    @Order(10)
    ServerInterceptor tracingInterceptor(OpenTelemetrySdk openTelemetry) {
        return GrpcTelemetry.create(openTelemetry).newServerInterceptor();
    }

    @GrpcGlobalServerInterceptor
    @Order(20)
    GrpcCorrelationInterceptor correlationInterceptor() {
        return new GrpcCorrelationInterceptor();
    }

    @GrpcGlobalServerInterceptor
    @Order(30)
    GrpcExceptionInterceptor exceptionInterceptor() {
        return new GrpcExceptionInterceptor();
    }
}
