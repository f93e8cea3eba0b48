package com.baykanat.attribution.ingestion.api.controller;

import com.baykanat.attribution.ingestion.api.dto.CampaignRequest;
import com.baykanat.attribution.ingestion.api.dto.CampaignResponse;
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

/** POST /campaign: AdCampaign node upsert. */
@Slf4j
@RestController
@RequestMapping("/campaign")
@RequiredArgsConstructor
@Tag(name = "Campaign", description = "Ad campaign node upserts")
public class CampaignController {

    private final GraphUpsertService graphUpsertService;

    @PostMapping
    @Operation(summary = "Upsert an ad campaign", description = "Creates or updates an AdCampaign node keyed by its resolved id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Resolved campaign record"),
            @ApiResponse(responseCode = "400", description = "Malformed payload"),
            @ApiResponse(responseCode = "503", description = "Graph store unavailable")
    })
    public ResponseEntity<CampaignResponse> upsertCampaign(@Valid @RequestBody CampaignRequest request) {
        log.debug("Received campaign upsert: id={}", request.getId());
        return ResponseEntity.ok(graphUpsertService.upsertCampaign(request));
    }
}
