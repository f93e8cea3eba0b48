package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Çözümlenmiş (fallback sonrası) Person kaydı; oluşturma ve güncellemede aynı şekil. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resolved person record as stored in the graph")
public class PersonResponse {

    @JsonProperty("id")
    @Schema(description = "Resolved person id", example = "p_1001")
    private String id;

    @JsonProperty("name")
    @Schema(description = "Display name or 'Unknown'", example = "Jane Doe")
    private String name;

    @JsonProperty("email")
    @Schema(description = "E-mail or 'Unknown'", example = "jane@example.com")
    private String email;

    @JsonProperty("contact_number")
    @Schema(description = "Phone number or 'Unknown'", example = "+1-555-0100")
    private String contactNumber;
}
