package com.vendorcatalog.api;

import com.vendorcatalog.metrics.ObservabilityManager;
import com.vendorcatalog.model.HealthSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "vendor_catalog_app";

    private final ObservabilityManager observabilityManager;
    private final Clock observabilityClock;

    @GetMapping("/live")
    public ResponseEntity<LiveResponse> live() {
        return ResponseEntity.ok(new LiveResponse(true, "live", SERVICE_NAME, now()));
    }

    @GetMapping("/observability")
    public ResponseEntity<ObservabilityResponse> observability() {
        return ResponseEntity.ok(new ObservabilityResponse(
                true, "observability", now(), observabilityManager.healthSnapshot()));
    }

    private String now() {
        return Instant.now(observabilityClock).toString();
    }

    public record LiveResponse(boolean ok, String status, String service, String timestamp) {}

    public record ObservabilityResponse(boolean ok, String status, String timestamp, HealthSnapshot observability) {}
}
