package com.humanizer.interfaces.api.health;

import com.humanizer.interfaces.api.dto.HealthResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final HealthResponse HEALTHY = new HealthResponse("healthy", "text-humanizer-api");

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HEALTHY);
    }
}
