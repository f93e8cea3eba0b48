package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/** Clicked_on edge'i ve uç node özetleri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Click event with resolved endpoint summaries")
public class ClickEventResponse {

    @JsonProperty("click_id")
    @Schema(description = "Click id", example = "clk_42")
    private String clickId;

    @JsonProperty("person_id")
    @Schema(description = "Person id", example = "p_1001")
    private String personId;

    @JsonProperty("person_name")
    @Schema(description = "Person name", example = "Jane Doe")
    private String personName;

    @JsonProperty("campaign_id")
    @Schema(description = "Campaign id", example = "cmp_987")
    private String campaignId;

    @JsonProperty("campaign")
    @Schema(description = "Campaign name", example = "Spring Sale 2026")
    private String campaign;

    @JsonProperty("content")
    private String content;

    @JsonProperty("source")
    private String source;

    @JsonProperty("medium")
    private String medium;

    @JsonProperty("term")
    private String term;

    @JsonProperty("tag")
    @Schema(description = "Platform tag derived from content", example = "instagram")
    private String tag;

    @JsonProperty("device")
    private String device;

    @JsonProperty("date")
    @Schema(description = "Declared event date", example = "2026-10-18")
    private LocalDate date;

    @JsonProperty("attributes")
    @Schema(description = "Additional free-form attribution fields")
    private Map<String, Object> attributes;

    @JsonProperty("clicked_at")
    @Schema(description = "Server-assigned ingestion timestamp", example = "2026-10-18T09:30:00Z")
    private Instant clickedAt;
}
