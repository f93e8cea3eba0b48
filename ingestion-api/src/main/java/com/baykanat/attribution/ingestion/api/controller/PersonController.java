package com.baykanat.attribution.ingestion.api.controller;

import com.baykanat.attribution.ingestion.api.dto.PersonRequest;
import com.baykanat.attribution.ingestion.api.dto.PersonResponse;
import com.baykanat.attribution.ingestion.domain.service.GraphUpsertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /person: Person node upsert. */
@Slf4j
@RestController
@RequestMapping("/person")
@RequiredArgsConstructor
@Tag(name = "Person", description = "Person node upserts")
public class PersonController {

    private final GraphUpsertService graphUpsertService;

    /** Eksik alanlar "Unknown", eksik id türetilir; aynı id ikinci kez gelirse güncellenir. */
    @PostMapping
    @Operation(summary = "Upsert a person", description = "Creates or updates a Person node keyed by its resolved id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Resolved person record"),
            @ApiResponse(responseCode = "400", description = "Malformed payload"),
            @ApiResponse(responseCode = "503", description = "Graph store unavailable")
    })
    public ResponseEntity<PersonResponse> upsertPerson(@Valid @RequestBody PersonRequest request) {
        log.debug("Received person upsert: id={}", request.getId());
        return ResponseEntity.ok(graphUpsertService.upsertPerson(request));
    }
}
