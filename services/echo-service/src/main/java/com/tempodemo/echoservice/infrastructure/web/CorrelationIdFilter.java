package com.tempodemo.echoservice.infrastructure.web;

import com.tempodemo.observability.CorrelationContext;
import com.tempodemo.observability.CorrelationContextHolder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The proxy sets {@code x-request-id} on every request it forwards; the same id was used by the
 * authorization check, so log lines of both services line up. Absent the header a new UUID is used.
 * The id is echoed back in the response and, together with the current trace id, bound to the MDC
 * for the duration of the request.
 *
 * <p>Runs just after the OpenTelemetry server filter so the server span is already current.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "x-request-id";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        CorrelationContext context = CorrelationContext.of(requestId);
        SpanContext span = Span.current().getSpanContext();
        if (span.isValid()) {
            context = context.withTrace(span.getTraceId(), span.getSpanId());
        }
        CorrelationContextHolder.set(context);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
