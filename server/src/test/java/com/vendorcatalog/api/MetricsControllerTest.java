package com.vendorcatalog.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "tvendor.metrics.auth-token=scrape-token",
        "tvendor.metrics.allow-unauthenticated=false"
})
@AutoConfigureMockMvc
class MetricsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void hidesEndpointWithoutToken() throws Exception {
        mockMvc.perform(get("/api/metrics"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Not found."));
    }

    @Test
    void hidesEndpointWithWrongToken() throws Exception {
        mockMvc.perform(get("/api/metrics").header(MetricsAccessPolicy.TOKEN_HEADER, "guess"))
                .andExpect(status().isNotFound());
    }

    @Test
    void servesExpositionWithTokenHeader() throws Exception {
        mockMvc.perform(get("/api/health/live")).andExpect(status().isOk());

        mockMvc.perform(get("/api/metrics").header(MetricsAccessPolicy.TOKEN_HEADER, "scrape-token"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, startsWith("text/plain")))
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, containsString("version=0.0.4")))
                .andExpect(content().string(containsString("# TYPE tvendor_http_requests_total counter")))
                .andExpect(content().string(containsString(
                        "tvendor_http_requests_total{method=\"GET\",path=\"/api/health/live\",status_class=\"2xx\"}")))
                .andExpect(content().string(containsString("tvendor_uptime_seconds")));
    }

    @Test
    void servesExpositionWithBearerToken() throws Exception {
        mockMvc.perform(get("/api/metrics").header(HttpHeaders.AUTHORIZATION, "Bearer scrape-token"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("tvendor_alert_active{alert=\"request_p95_ms\"} 0")));
    }
}
