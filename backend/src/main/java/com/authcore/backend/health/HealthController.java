package com.authcore.backend.health;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class HealthController {

    private final DependencyHealthChecker healthChecker;

    public HealthController(DependencyHealthChecker healthChecker) {
        this.healthChecker = healthChecker;
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness and dependency check", description = "Pings PostgreSQL and Redis")
    public ResponseEntity<HealthResponse> health() {
        Optional<String> failure = healthChecker.check();
        if (failure.isPresent()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(HealthResponse.fail(failure.get()));
        }
        return ResponseEntity.ok(HealthResponse.pass());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HealthResponse(
            String status, // "pass" | "fail"
            String error
    ) {
        static HealthResponse pass() {
            return new HealthResponse("pass", null);
        }

        static HealthResponse fail(String error) {
            return new HealthResponse("fail", error);
        }
    }
}
