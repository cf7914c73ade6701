package com.vendorcatalog.api;

import com.vendorcatalog.metrics.ObservabilityManager;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@ConditionalOnExpression("${tvendor.metrics.enabled:true} and ${tvendor.metrics.prometheus-enabled:true}")
public class MetricsController {

    static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType("text/plain;version=0.0.4;charset=utf-8");

    private final ObservabilityManager observabilityManager;
    private final MetricsAccessPolicy accessPolicy;

    @GetMapping("#{@observabilitySettings.prometheusPath}")
    public ResponseEntity<String> scrape(HttpServletRequest request) {
        if (!accessPolicy.isAllowed(request)) {
            log.debug("Rejected metrics scrape without a valid token from {}", request.getRemoteAddr());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Not found.");
        }

        return ResponseEntity.ok()
                .contentType(PROMETHEUS_TEXT)
                .body(observabilityManager.renderPrometheus());
    }
}
