package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** GET /ids/person/internal sayfası. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Page of store-assigned person ids")
public class PersonIdPage {

    @JsonProperty("items")
    @Schema(description = "Internal ids, ascending", example = "[\"1\", \"2\"]")
    private List<String> items;

    @JsonProperty("next_skip")
    @Schema(description = "Skip value for the next page", example = "500")
    private int nextSkip;
}
