package com.whereq.tempo.controller;

import com.whereq.tempo.scheduler.JobSchedulerEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and scheduler status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private JobSchedulerEngine engine;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the scheduler engine are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return engine.start()
                .then(Mono.fromCallable(() -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-tempo");

                    Map<String, String> schedulerInfo = new HashMap<>();
                    schedulerInfo.put("state", engine.getState().name());
                    schedulerInfo.put("pendingTriggers", String.valueOf(engine.pendingCount()));

                    health.put("scheduler", schedulerInfo);
                    return ResponseEntity.ok(health);
                }))
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-tempo");

                    Map<String, String> schedulerInfo = new HashMap<>();
                    schedulerInfo.put("state", engine.getState().name());
                    schedulerInfo.put("error", e.getMessage());
                    health.put("scheduler", schedulerInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }
}
