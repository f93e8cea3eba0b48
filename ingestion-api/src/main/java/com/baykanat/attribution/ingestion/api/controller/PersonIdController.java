package com.baykanat.attribution.ingestion.api.controller;

import com.baykanat.attribution.ingestion.api.dto.PersonIdMapPage;
import com.baykanat.attribution.ingestion.api.dto.PersonIdPage;
import com.baykanat.attribution.ingestion.domain.service.GraphQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** GET /ids/person/*: store'un verdiği internal id'leri sayfalı listeler. */
@RestController
@RequestMapping("/ids/person")
@RequiredArgsConstructor
@Validated
@Tag(name = "Person ids", description = "Store-assigned person id listings")
public class PersonIdController {

    static final int DEFAULT_PAGE_LIMIT = 500;
    static final int MAX_PAGE_LIMIT = 2000;

    private final GraphQueryService graphQueryService;

    @GetMapping("/internal")
    @Operation(summary = "List internal person ids", description = "Paginated, ascending by internal id")
    public ResponseEntity<PersonIdPage> internalIds(
            @Parameter(description = "Only persons with at least one click")
            @RequestParam(value = "only_connected", required = false, defaultValue = "false") boolean onlyConnected,

            @RequestParam(value = "skip", required = false, defaultValue = "0") @Min(0) int skip,

            @Parameter(description = "Page size (1-2000)", example = "500")
            @RequestParam(value = "limit", required = false, defaultValue = "" + DEFAULT_PAGE_LIMIT)
            @Min(1) @Max(MAX_PAGE_LIMIT) int limit
    ) {
        return ResponseEntity.ok(graphQueryService.listPersonInternalIds(onlyConnected, skip, limit));
    }

    @GetMapping("/map")
    @Operation(summary = "Map external person ids to internal ids", description = "Paginated, ascending by external id")
    public ResponseEntity<PersonIdMapPage> idMap(
            @RequestParam(value = "skip", required = false, defaultValue = "0") @Min(0) int skip,

            @Parameter(description = "Page size (1-2000)", example = "500")
            @RequestParam(value = "limit", required = false, defaultValue = "" + DEFAULT_PAGE_LIMIT)
            @Min(1) @Max(MAX_PAGE_LIMIT) int limit
    ) {
        return ResponseEntity.ok(graphQueryService.listPersonIdMap(skip, limit));
    }
}
