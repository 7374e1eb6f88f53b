package com.tripmate.routeplanner.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "Health")
@RestController
public class HealthController {

    @Value("${spring.application.name:tripmate-route-planner}")
    private String serviceName;

    @Operation(summary = "Liveness probe")
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", serviceName);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
