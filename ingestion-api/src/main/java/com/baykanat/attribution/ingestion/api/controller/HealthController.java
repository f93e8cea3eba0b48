package com.baykanat.attribution.ingestion.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** GET /healthz: graph store'a gitmeden canlılık kontrolü. */
@RestController
@Tag(name = "Health")
public class HealthController {

    @GetMapping("/healthz")
    @Operation(summary = "Liveness check")
    public Map<String, Object> health() {
        return Map.of("ok", true);
    }
}
