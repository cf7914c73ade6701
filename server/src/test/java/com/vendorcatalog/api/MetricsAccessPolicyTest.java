package com.vendorcatalog.api;

import com.vendorcatalog.config.ObservabilitySettings;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsAccessPolicyTest {

    private static MetricsAccessPolicy policy(boolean allowUnauthenticated, String token) {
        return new MetricsAccessPolicy(ObservabilitySettings.builder()
                .metricsAllowUnauthenticated(allowUnauthenticated)
                .metricsAuthToken(token)
                .build());
    }

    @Test
    void unauthenticatedAccessWhenAllowed() {
        assertThat(policy(true, "").isAllowed(new MockHttpServletRequest())).isTrue();
    }

    @Test
    void deniedWithoutConfiguredToken() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(MetricsAccessPolicy.TOKEN_HEADER, "anything");

        assertThat(policy(false, "").isAllowed(request)).isFalse();
    }

    @Test
    void acceptsTokenHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(MetricsAccessPolicy.TOKEN_HEADER, " s3cret ");

        assertThat(policy(false, "s3cret").isAllowed(request)).isTrue();
    }

    @Test
    void acceptsBearerTokenCaseInsensitively() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "bearer s3cret");

        assertThat(policy(false, "s3cret").isAllowed(request)).isTrue();
    }

    @Test
    void rejectsWrongOrMissingToken() {
        MockHttpServletRequest wrong = new MockHttpServletRequest();
        wrong.addHeader(MetricsAccessPolicy.TOKEN_HEADER, "nope");
        MockHttpServletRequest basic = new MockHttpServletRequest();
        basic.addHeader(HttpHeaders.AUTHORIZATION, "Basic s3cret");
        MockHttpServletRequest emptyBearer = new MockHttpServletRequest();
        emptyBearer.addHeader(HttpHeaders.AUTHORIZATION, "Bearer ");

        MetricsAccessPolicy policy = policy(false, "s3cret");

        assertThat(policy.isAllowed(wrong)).isFalse();
        assertThat(policy.isAllowed(basic)).isFalse();
        assertThat(policy.isAllowed(emptyBearer)).isFalse();
        assertThat(policy.isAllowed(new MockHttpServletRequest())).isFalse();
    }

    @Test
    void fallsBackToBearerWhenHeaderDoesNotMatch() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(MetricsAccessPolicy.TOKEN_HEADER, "stale");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer s3cret");

        assertThat(policy(false, "s3cret").isAllowed(request)).isTrue();
    }
}
