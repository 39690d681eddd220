package com.xksgroup.hlstranscoder.controller;

import com.xksgroup.hlstranscoder.service.queue.WorkQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Reachability of the metadata store and the work queue")
public class HealthController {

    private final JdbcTemplate jdbcTemplate;
    private final WorkQueue workQueue;

    @GetMapping
    @Operation(summary = "Service health")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Database and queue reachable"),
        @ApiResponse(responseCode = "503", description = "At least one backend unreachable")
    })
    public ResponseEntity<Object> healthCheck() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("timestamp", LocalDateTime.now());
        health.put("service", "hls-transcoder");

        long uptime = ManagementFactory.getRuntimeMXBean().getUptime();
        health.put("uptime", String.format("%d hours %d minutes", uptime / 3_600_000, (uptime % 3_600_000) / 60_000));

        Map<String, String> checks = new LinkedHashMap<>();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            checks.put("database", "PASS");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            checks.put("database", "FAIL");
        }
        try {
            health.put("queueDepth", workQueue.size());
            checks.put("queue", "PASS");
        } catch (Exception e) {
            log.warn("Queue health check failed: {}", e.getMessage());
            checks.put("queue", "FAIL");
        }
        health.put("checks", checks);

        boolean healthy = !checks.containsValue("FAIL");
        health.put("status", healthy ? "healthy" : "unhealthy");
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}
