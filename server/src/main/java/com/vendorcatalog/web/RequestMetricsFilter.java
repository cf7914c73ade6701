package com.vendorcatalog.web;

import com.vendorcatalog.metrics.ObservabilityManager;
import com.vendorcatalog.model.RequestOutcome;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.util.Locale;

@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RequestMetricsFilter extends OncePerRequestFilter {

    private final ObservabilityManager observabilityManager;
    private final DownstreamCallTracker downstreamCallTracker;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        long started = System.nanoTime();
        int statusCode = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        downstreamCallTracker.begin();
        try {
            chain.doFilter(request, response);
            statusCode = response.getStatus();
        } finally {
            double elapsedMs = (System.nanoTime() - started) / 1_000_000.0;
            DownstreamCallTracker.DownstreamTotals downstream = downstreamCallTracker.current();
            downstreamCallTracker.end();

            String route = routeLabel(request);
            observabilityManager.recordRequest(RequestOutcome.builder()
                    .method(request.getMethod())
                    .path(route)
                    .statusCode(statusCode)
                    .elapsedMs(elapsedMs)
                    .dbCalls(downstream.calls())
                    .dbTotalMs(downstream.totalMs())
                    .dbCacheHits(downstream.cacheHits())
                    .dbErrors(downstream.errors())
                    .build());

            if (log.isDebugEnabled()) {
                log.debug("request_perf method={} path={} status={} total_ms={} db_calls={} db_ms={} db_max_ms={}",
                        request.getMethod(), route, statusCode, formatMs(elapsedMs),
                        downstream.calls(), formatMs(downstream.totalMs()),
                        formatMs(downstream.maxMs()));
            }
        }
    }

    static String formatMs(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String routeLabel(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        if (pattern instanceof String route && !route.isBlank()) {
            return route;
        }
        String uri = request.getRequestURI();
        return uri == null || uri.isBlank() ? "/" : uri;
    }
}
