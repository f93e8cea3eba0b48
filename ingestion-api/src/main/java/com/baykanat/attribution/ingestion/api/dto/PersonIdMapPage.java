package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** GET /ids/person/map sayfası: dış id → internal id. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Page of external to internal person id pairs")
public class PersonIdMapPage {

    @JsonProperty("items")
    private List<Item> items;

    @JsonProperty("next_skip")
    @Schema(description = "Skip value for the next page", example = "500")
    private int nextSkip;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Single id pair")
    public static class Item {
        @JsonProperty("external_id")
        @Schema(example = "p_1001")
        private String externalId;

        @JsonProperty("internal_id")
        @Schema(example = "17")
        private String internalId;
    }
}
