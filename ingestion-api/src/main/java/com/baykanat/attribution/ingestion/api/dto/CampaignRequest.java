package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /campaign payload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial ad campaign payload")
public class CampaignRequest {

    @Size(max = 256, message = "id must be at most 256 characters")
    @JsonProperty("id")
    @Schema(description = "Stable external campaign identifier", example = "cmp_987")
    private String id;

    @Size(max = 512, message = "campaign must be at most 512 characters")
    @JsonProperty("campaign")
    @Schema(description = "Campaign display name", example = "Spring Sale 2026")
    private String campaign;
}
