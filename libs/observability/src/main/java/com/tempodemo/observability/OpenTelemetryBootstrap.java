package com.tempodemo.observability;

import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the process-scoped {@link OpenTelemetrySdk}.
 * <p>
 * The SDK is never registered with {@code GlobalOpenTelemetry}: the caller owns the returned
 * instance, passes it by reference to the components that trace, and closes it exactly once
 * on shutdown. Closing flushes the batch processor and shuts the exporter down.
 * <p>
 * Propagation is W3C trace-context plus W3C baggage, matching what Envoy and the collector
 * expect.
 */
public final class OpenTelemetryBootstrap {

    /** Resource attribute key for the logical service name. */
    public static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);

    private OpenTelemetryBootstrap() {
        // utility class
    }

    /**
     * Creates an SDK exporting over OTLP/gRPC to {@link TracingSettings#endpoint()}.
     * When tracing is disabled the SDK has no span processor, so spans are created but dropped.
     *
     * @param settings tracing settings
     * @return a new SDK instance owned by the caller
     */
    public static OpenTelemetrySdk create(TracingSettings settings) {
        if (!settings.enabled()) {
            log.info("Tracing disabled for service {}", settings.serviceName());
            return create(settings, null);
        }
        SpanExporter exporter = OtlpGrpcSpanExporter.builder()
                .setEndpoint(settings.endpoint())
                .build();
        log.info("Exporting spans for service {} to {}", settings.serviceName(), settings.endpoint());
        return create(settings, exporter);
    }

    /**
     * Creates an SDK exporting to the given exporter, or to nothing when it is null.
     *
     * @param settings tracing settings (service name and batch timeout are used)
     * @param exporter span exporter, nullable
     * @return a new SDK instance owned by the caller
     */
    public static OpenTelemetrySdk create(TracingSettings settings, SpanExporter exporter) {
        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(SERVICE_NAME, settings.serviceName())));

        var tracerProvider = SdkTracerProvider.builder().setResource(resource);
        if (exporter != null) {
            SpanProcessor processor = BatchSpanProcessor.builder(exporter)
                    .setScheduleDelay(settings.batchTimeout())
                    .build();
            tracerProvider.addSpanProcessor(processor);
        }

        return OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider.build())
                .setPropagators(propagators())
                .build();
    }

    /**
     * W3C trace-context and baggage, in that order.
     */
    public static ContextPropagators propagators() {
        return ContextPropagators.create(TextMapPropagator.composite(
                W3CTraceContextPropagator.getInstance(),
                W3CBaggagePropagator.getInstance()));
    }
}
