package com.baykanat.attribution.ingestion.api.controller;

import com.baykanat.attribution.ingestion.api.dto.ClickEventResponse;
import com.baykanat.attribution.ingestion.api.dto.ClickRecordedResponse;
import com.baykanat.attribution.ingestion.api.dto.ClickRequest;
import com.baykanat.attribution.ingestion.domain.service.GraphQueryService;
import com.baykanat.attribution.ingestion.domain.service.GraphUpsertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** POST /clicked_on ve GET /sample. */
@Slf4j
@RestController
@RequiredArgsConstructor
@Validated
@Tag(name = "Clicks", description = "Clicked_on edges between persons and campaigns")
public class ClickController {

    static final int MAX_SAMPLE_LIMIT = 1000;

    private final GraphUpsertService graphUpsertService;
    private final GraphQueryService graphQueryService;

    /** Her çağrı yeni bir edge; eksik uç node'lar placeholder olarak oluşturulur. */
    @PostMapping("/clicked_on")
    @Operation(summary = "Record a click", description = "Appends a Clicked_on edge, creating placeholder endpoints when needed")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Click recorded"),
            @ApiResponse(responseCode = "400", description = "Malformed or empty payload"),
            @ApiResponse(responseCode = "503", description = "Graph store unavailable")
    })
    public ResponseEntity<ClickRecordedResponse> recordClick(@Valid @RequestBody ClickRequest request) {
        log.debug("Received click: person_id={}, campaign_id={}", request.getPersonId(), request.getCampaignId());
        return ResponseEntity.ok(graphUpsertService.recordClick(request));
    }

    /** Salt-okuma; en yeni click'ler. */
    @GetMapping("/sample")
    @Operation(summary = "Sample recent clicks", description = "Returns the most recent clicks, newest first")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recent clicks"),
            @ApiResponse(responseCode = "400", description = "Invalid limit")
    })
    public ResponseEntity<List<ClickEventResponse>> sample(
            @Parameter(description = "Maximum number of clicks (1-1000)", example = "10")
            @RequestParam(value = "limit", required = false, defaultValue = "10")
            @Min(1) @Max(MAX_SAMPLE_LIMIT) int limit
    ) {
        return ResponseEntity.ok(graphQueryService.sampleClicks(limit));
    }
}
