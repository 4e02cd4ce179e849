package org.example.storyteller.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.storyteller.config.RequestCorrelation;
import org.example.storyteller.service.SynthesisMetricsService;
import org.example.storyteller.service.backend.NarrationBackend;
import org.example.storyteller.service.backend.NarrationBackendRegistry;
import org.example.storyteller.service.quota.InMemoryQuotaAuthority;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final NarrationBackendRegistry backendRegistry;
    private final SynthesisMetricsService synthesisMetricsService;
    private final InMemoryQuotaAuthority quotaAuthority;

    public HealthController(
            NarrationBackendRegistry backendRegistry,
            SynthesisMetricsService synthesisMetricsService,
            InMemoryQuotaAuthority quotaAuthority) {
        this.backendRegistry = backendRegistry;
        this.synthesisMetricsService = synthesisMetricsService;
        this.quotaAuthority = quotaAuthority;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    /**
     * "ok" while at least one backend is reachable, otherwise "degraded".
     */
    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        Map<String, Boolean> backends = new LinkedHashMap<>();
        for (NarrationBackend backend : backendRegistry.getBackends()) {
            backends.put(backend.name(), backend.isAvailable());
        }
        boolean anyBackendAvailable = backends.containsValue(Boolean.TRUE);

        return new HealthDetails(
                anyBackendAvailable ? "ok" : "degraded",
                anyBackendAvailable,
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                backends,
                quotaAuthority.usageSnapshot(),
                synthesisMetricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            boolean anyBackendAvailable,
            String requestId,
            LocalDateTime asOf,
            Map<String, Boolean> backends,
            Map<String, Long> quotaUsage,
            Map<String, Object> synthesisMetrics
    ) {
    }
}
