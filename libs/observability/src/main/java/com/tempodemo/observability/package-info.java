/**
 * Observability building blocks shared by the Tempo services.
 *
 * <ul>
 *   <li>{@link com.tempodemo.observability.CorrelationContextHolder}: request correlation with
 *       SLF4J MDC bridge
 *   <li>{@link com.tempodemo.observability.OpenTelemetryBootstrap}: process-scoped tracing SDK
 *   <li>{@link com.tempodemo.observability.SpanHelper}: span creation with correlation attributes
 *   <li>{@link com.tempodemo.observability.MetricFactory}: service-tagged Micrometer meters
 *   <li>{@link com.tempodemo.observability.SensitiveDataRedactor}: keeps credentials out of logs
 * </ul>
 */
package com.tempodemo.observability;
