package com.todochat.chatapi.api;

import com.todochat.chatapi.config.ServiceProperties;
import com.todochat.pipeline.ratelimit.RateLimiter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes for the orchestrator. Both paths are exempt from rate limiting
 * under the default configuration.
 */
@RestController
public class ProbeController {

    private final ServiceProperties service;
    private final RateLimiter rateLimiter;

    public ProbeController(ServiceProperties service, RateLimiter rateLimiter) {
        this.service = service;
        this.rateLimiter = rateLimiter;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", service.name());
        return body;
    }

    @GetMapping("/ready")
    public Map<String, Object> ready() {
        Map<String, Object> checks = new LinkedHashMap<>();
        checks.put("rateLimiter", "ok");
        checks.put("trackedClients", rateLimiter.trackedClients());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ready");
        body.put("checks", checks);
        return body;
    }
}
