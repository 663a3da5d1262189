package com.storewatch.monitor.controller;

import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;

import java.util.Map;

/**
 * Liveness endpoint of the monitoring worker, {@code GET /health}.
 *
 * An answer means the process is up and the application context has started.  It is
 * not a readiness check: no dependency is consulted, and a cycle that is failing for
 * every store still reports {@code UP}.  Cycle state is exposed separately
 * under {@code GET /api/cycles/status}.
 */
@Controller("/health")
public class HealthController {

    /**
     * @return {@code {"status":"UP"}}, the body the container's liveness check expects
     */
    @Get
    public Map<String, String> health() {
        return Map.of("status", "UP");
    }
}
