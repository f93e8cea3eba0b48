package com.baykanat.attribution.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/** POST /clicked_on payload; bilinmeyen alanlar serbest attribution olarak attributes'a toplanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Click-through attribution payload")
public class ClickRequest {

    @Size(max = 256, message = "person_id must be at most 256 characters")
    @JsonProperty("person_id")
    @Schema(description = "Clicking person id; a placeholder person is created when absent", example = "p_1001")
    private String personId;

    @Size(max = 256, message = "campaign_id must be at most 256 characters")
    @JsonProperty("campaign_id")
    @Schema(description = "Clicked campaign id; a placeholder campaign is created when absent", example = "cmp_987")
    private String campaignId;

    @Size(max = 256, message = "id must be at most 256 characters")
    @JsonProperty("id")
    @Schema(description = "Client supplied click id", example = "clk_42")
    private String id;

    @JsonProperty("content")
    @Schema(description = "Ad content / creative label", example = "instagram_story_v2")
    private String content;

    @JsonProperty("source")
    @Schema(description = "Traffic source", example = "instagram")
    private String source;

    @JsonProperty("medium")
    @Schema(description = "Traffic medium", example = "paid_social")
    private String medium;

    @JsonProperty("term")
    @Schema(description = "Search term / keyword", example = "running shoes")
    private String term;

    @JsonProperty("device")
    @Schema(description = "Device class", example = "mobile")
    private String device;

    @JsonProperty("date")
    @Schema(description = "Event date, YYYY-MM-DD or ISO-8601 date-time", example = "2026-10-18")
    private String date;

    @JsonIgnore
    private Map<String, Object> attributes;

    @JsonAnySetter
    public void putAttribute(String key, Object value) {
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        attributes.put(key, value);
    }

    /** Ne id ne de dolu bir attribution alanı gelmişse true; null/boş ek alanlar sayılmaz. */
    @JsonIgnore
    public boolean isEmpty() {
        boolean noFields = Stream.of(personId, campaignId, id, content, source, medium, term, device, date)
                .allMatch(ClickRequest::isBlank);
        return noFields && (attributes == null || attributes.values().stream().allMatch(ClickRequest::isBlank));
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }
}
