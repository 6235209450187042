package com.tempodemo.echoservice.infrastructure.web;

import io.opentelemetry.context.Context;
import io.opentelemetry.instrumentation.api.semconv.http.HttpServerRoute;
import io.opentelemetry.instrumentation.api.semconv.http.HttpServerRouteSource;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Hands the matched controller pattern to the current server span, which then reports it as
 * {@code http.route} and is renamed to {@code "GET /test"}.
 */
public class RouteTaggingInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern != null) {
            HttpServerRoute.update(Context.current(), HttpServerRouteSource.CONTROLLER, pattern.toString());
        }
        return true;
    }
}
