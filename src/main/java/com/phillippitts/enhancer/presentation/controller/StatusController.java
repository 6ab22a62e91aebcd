package com.phillippitts.enhancer.presentation.controller;

import com.phillippitts.enhancer.service.hook.Activity;
import com.phillippitts.enhancer.service.hook.ProcessingStatistics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of {@link ProcessingStatistics} for the status dashboard.
 */
@RestController
@RequestMapping("/api")
class StatusController {

    private final ProcessingStatistics statistics;

    StatusController(ProcessingStatistics statistics) {
        this.statistics = statistics;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        ProcessingStatistics.Snapshot s = statistics.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "running");
        body.put("startTime", s.startTime().toString());
        body.put("uptimeSeconds", s.uptime().toSeconds());
        body.put("imagesProcessed", s.processed());
        body.put("failures", s.failed());
        body.put("activeUsers", s.activeUsers());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/activities")
    ResponseEntity<List<Activity>> activities() {
        return ResponseEntity.ok(statistics.recentActivities());
    }
}
