package com.baykanat.attribution.ingestion.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/** clicked_on edge'i; okurken iki uç node'un özetiyle (person/campaign adı) birlikte doldurulur. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClickEvent {

    private Long edgeId;
    private String clickId;
    private String personId;
    private String personName;
    private String campaignId;
    private String campaignName;
    private String content;
    private String source;
    private String medium;
    private String term;
    private String tag;
    private String device;
    private LocalDate eventDate;
    private String attributes; // JSONB (String olarak)
    private Instant clickedAt;
}
