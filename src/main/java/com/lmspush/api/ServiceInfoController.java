package com.lmspush.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
public class ServiceInfoController {

    private static final String SERVICE_NAME = "LMS Content Push Service";
    private static final String VERSION = "1.0.0";

    private final Clock clock;

    public ServiceInfoController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, Object> info() {
        return Map.of("message", SERVICE_NAME, "version", VERSION);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "healthy", "timestamp", clock.instant().toString());
    }
}
