package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /person payload; hiçbir alan tek başına zorunlu değil, eksikler resolver'da doldurulur. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial person payload; missing fields fall back to defaults")
public class PersonRequest {

    @Size(max = 256, message = "id must be at most 256 characters")
    @JsonProperty("id")
    @Schema(description = "Stable external person identifier", example = "p_1001")
    private String id;

    @Size(max = 512, message = "name must be at most 512 characters")
    @JsonProperty("name")
    @Schema(description = "Display name", example = "Jane Doe")
    private String name;

    @Size(max = 512, message = "email must be at most 512 characters")
    @JsonProperty("email")
    @Schema(description = "E-mail address", example = "jane@example.com")
    private String email;

    @Size(max = 64, message = "contact_number must be at most 64 characters")
    @JsonProperty("contact_number")
    @Schema(description = "Phone number", example = "+1-555-0100")
    private String contactNumber;
}
