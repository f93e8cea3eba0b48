package com.baykanat.attribution.ingestion.domain.mapper;

import com.baykanat.attribution.ingestion.api.dto.CampaignResponse;
import com.baykanat.attribution.ingestion.api.dto.ClickEventResponse;
import com.baykanat.attribution.ingestion.api.dto.PersonResponse;
import com.baykanat.attribution.ingestion.domain.model.AdCampaign;
import com.baykanat.attribution.ingestion.domain.model.ClickEvent;
import com.baykanat.attribution.ingestion.domain.model.Person;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.util.List;
import java.util.Map;

/** Graph domain modelleri ↔ API yanıtları. MapStruct + attributes JSONB için Jackson. */
@Mapper(componentModel = "spring")
public interface GraphMapper {

    /** JSONB alanları için paylaşılan ObjectMapper. */
    ObjectMapper JSON_MAPPER = new ObjectMapper();

    PersonResponse toPersonResponse(Person person);

    CampaignResponse toCampaignResponse(AdCampaign campaign);

    /** ClickEvent → yanıt; campaignName→campaign, eventDate→date, attributes JSON→Map. */
    @Mapping(target = "campaign", source = "campaignName")
    @Mapping(target = "date", source = "eventDate")
    @Mapping(target = "attributes", source = "attributes", qualifiedByName = "fromJsonString")
    ClickEventResponse toClickEventResponse(ClickEvent click);

    List<ClickEventResponse> toClickEventResponses(List<ClickEvent> clicks);

    /** Serbest attribution map'i → JSON string; boş map null olarak saklanır. */
    @Named("toJsonString")
    default String toJsonString(Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) return null;
        try {
            return JSON_MAPPER.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Click attributes are not serializable", e);
        }
    }

    /** JSONB string → Map. */
    @Named("fromJsonString")
    default Map<String, Object> fromJsonString(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return JSON_MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored click attributes are not valid JSON", e);
        }
    }
}
