package com.vendorcatalog.api;

import com.vendorcatalog.config.ObservabilitySettings;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Component
@RequiredArgsConstructor
public class MetricsAccessPolicy {

    public static final String TOKEN_HEADER = "X-TVendor-Metrics-Token";

    private static final String BEARER_PREFIX = "bearer ";

    private final ObservabilitySettings settings;

    public boolean isAllowed(HttpServletRequest request) {
        if (settings.isMetricsAllowUnauthenticated()) {
            return true;
        }
        return matchesToken(request, settings.getMetricsAuthToken());
    }

    static boolean matchesToken(HttpServletRequest request, String token) {
        String expected = token == null ? "" : token.strip();
        if (expected.isEmpty()) {
            return false;
        }

        String headerValue = request.getHeader(TOKEN_HEADER);
        if (headerValue != null && !headerValue.isBlank() && constantTimeEquals(headerValue.strip(), expected)) {
            return true;
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null) {
            String auth = authorization.strip();
            if (auth.length() > BEARER_PREFIX.length()
                    && auth.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
                String bearer = auth.substring(BEARER_PREFIX.length()).strip();
                return !bearer.isEmpty() && constantTimeEquals(bearer, expected);
            }
        }
        return false;
    }

    private static boolean constantTimeEquals(String actual, String expected) {
        return MessageDigest.isEqual(actual.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
