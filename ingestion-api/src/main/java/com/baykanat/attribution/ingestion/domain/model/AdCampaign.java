package com.baykanat.attribution.ingestion.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** ad_campaign tablosu satırı; graph'taki AdCampaign node'u. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdCampaign {

    private Long internalId;
    private String id;
    private String campaign;
}
