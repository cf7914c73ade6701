package com.vendorcatalog.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "tvendor.alert.min-requests=1",
        "tvendor.alert.window-sec=120",
        "tvendor.alert.cooldown-sec=60"
})
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void liveReportsService() throws Exception {
        mockMvc.perform(get("/api/health/live"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.status").value("live"))
                .andExpect(jsonPath("$.service").value("vendor_catalog_app"))
                .andExpect(jsonPath("$.timestamp").isString());
    }

    @Test
    void observabilitySnapshotUsesSnakeCaseKeys() throws Exception {
        mockMvc.perform(get("/api/health/live")).andExpect(status().isOk());

        mockMvc.perform(get("/api/health/observability"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.status").value("observability"))
                .andExpect(jsonPath("$.observability.metrics_enabled").value(true))
                .andExpect(jsonPath("$.observability.prometheus_enabled").value(true))
                .andExpect(jsonPath("$.observability.prometheus_path").value("/api/metrics"))
                .andExpect(jsonPath("$.observability.statsd_enabled").value(false))
                .andExpect(jsonPath("$.observability.alerts_enabled").value(true))
                .andExpect(jsonPath("$.observability.alert_window_sec").value(120))
                .andExpect(jsonPath("$.observability.alert_min_requests").value(1))
                .andExpect(jsonPath("$.observability.alert_cooldown_sec").value(60))
                .andExpect(jsonPath("$.observability.active_alert_count").value(0))
                .andExpect(jsonPath("$.observability.active_alerts").isEmpty())
                .andExpect(jsonPath("$.observability.alert_breaches_total.request_p95_ms").value(0))
                .andExpect(jsonPath("$.observability.alerts[*].name").value(hasItem("error_rate_pct")))
                .andExpect(jsonPath("$.observability.alerts[0].breach_count").value(0))
                .andExpect(jsonPath("$.observability.statsd_dropped_total").value(0))
                .andExpect(jsonPath("$.observability.uptime_seconds").isNumber());
    }

    @Test
    void actuatorHealthIncludesObservabilityComponent() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.observability.status").value("UP"))
                .andExpect(jsonPath("$.components.observability.details.activeAlerts").isArray());
    }
}
