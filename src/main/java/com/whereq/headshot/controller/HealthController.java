package com.whereq.headshot.controller;

import com.whereq.headshot.config.HeadshotProperties;
import com.whereq.headshot.queue.JobQueue;
import com.whereq.headshot.scheduler.ActiveJobRegistry;
import com.whereq.headshot.scheduler.BatchJobScheduler;
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
    private BatchJobScheduler scheduler;

    @Autowired
    private ActiveJobRegistry activeJobRegistry;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private HeadshotProperties properties;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the batch scheduler are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "headshot-batch");

            Map<String, Object> schedulerInfo = new HashMap<>();
            schedulerInfo.put("status", scheduler.isRunning() ? "RUNNING" : "STOPPED");
            schedulerInfo.put("activeJobs", activeJobRegistry.activeCount());
            schedulerInfo.put("maxConcurrentJobs", activeJobRegistry.getMaxConcurrentJobs());
            schedulerInfo.put("queuedJobs", jobQueue.size());
            schedulerInfo.put("store", properties.getStore().getType());

            health.put("scheduler", schedulerInfo);
            return ResponseEntity.ok(health);
        });
    }
}
