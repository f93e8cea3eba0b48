package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Çözümlenmiş AdCampaign kaydı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resolved ad campaign record as stored in the graph")
public class CampaignResponse {

    @JsonProperty("id")
    @Schema(description = "Resolved campaign id", example = "cmp_987")
    private String id;

    @JsonProperty("campaign")
    @Schema(description = "Campaign name or 'Unknown'", example = "Spring Sale 2026")
    private String campaign;
}
