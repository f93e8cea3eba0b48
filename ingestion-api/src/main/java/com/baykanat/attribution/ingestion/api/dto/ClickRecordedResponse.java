package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /clicked_on yanıtı: oluşan edge ve bu çağrıda yaratılan node/edge sayıları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of recording a click")
public class ClickRecordedResponse {

    @JsonProperty("ok")
    @Schema(example = "true")
    private boolean ok;

    @JsonProperty("click")
    private ClickEventResponse click;

    @JsonProperty("nodes_created")
    @Schema(description = "Placeholder nodes created for missing endpoints", example = "0")
    private int nodesCreated;

    @JsonProperty("rels_created")
    @Schema(description = "Clicked_on edges created", example = "1")
    private int relsCreated;
}
