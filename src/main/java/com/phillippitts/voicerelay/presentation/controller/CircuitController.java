package com.phillippitts.voicerelay.presentation.controller;

import com.phillippitts.voicerelay.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.voicerelay.service.resilience.CircuitSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of every circuit breaker.
 */
@RestController
class CircuitController {

    private final CircuitBreakerRegistry registry;

    CircuitController(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/api/circuits")
    ResponseEntity<List<CircuitSnapshot>> circuits() {
        return ResponseEntity.ok(registry.snapshots());
    }
}
