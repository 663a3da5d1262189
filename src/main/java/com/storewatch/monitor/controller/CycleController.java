package com.storewatch.monitor.controller;

import com.storewatch.monitor.model.CycleStatusResponse;
import com.storewatch.monitor.scheduler.MonitorScheduler;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Operator endpoints to run a monitoring cycle out of schedule and to inspect the
 * cycles.
 *
 * Base path: {@code /api/cycles}
 *
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/cycles/visual} – start a visual cycle now (202, or 409 when one is running)</li>
 *   <li>{@code POST /api/cycles/ping}   – start a ping cycle now (202, or 409 when one is running)</li>
 *   <li>{@code GET  /api/cycles/status} – busy flags and last completed run of both cycles</li>
 * </ul>
 */
@Controller("/api/cycles")
public class CycleController {

    private static final Logger log = LoggerFactory.getLogger(CycleController.class);

    @Inject
    private MonitorScheduler monitorScheduler;

    @Post("/visual")
    public HttpResponse<Map<String, String>> triggerVisual() {
        log.info("POST /api/cycles/visual");
        return toResponse("visual", monitorScheduler.triggerVisual());
    }

    @Post("/ping")
    public HttpResponse<Map<String, String>> triggerPing() {
        log.info("POST /api/cycles/ping");
        return toResponse("ping", monitorScheduler.triggerPing());
    }

    @Get("/status")
    public List<CycleStatusResponse> status() {
        return monitorScheduler.status();
    }

    private static HttpResponse<Map<String, String>> toResponse(String cycle, boolean started) {
        if (started) {
            return HttpResponse.<Map<String, String>>accepted().body(Map.of("cycle", cycle, "state", "STARTED"));
        }
        return HttpResponse.<Map<String, String>>status(HttpStatus.CONFLICT)
                .body(Map.of("cycle", cycle, "state", "BUSY"));
    }
}
