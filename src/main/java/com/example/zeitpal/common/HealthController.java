package com.example.zeitpal.common;

import com.example.zeitpal.config.JurisdictionProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final JurisdictionProperties jurisdictionProperties;

    public HealthController(JurisdictionProperties jurisdictionProperties) {
        this.jurisdictionProperties = jurisdictionProperties;
    }

    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of(
                "status", "UP",
                "jurisdictions", jurisdictionProperties.getJurisdictions().keySet()
        )));
    }
}
