package com.baykanat.attribution.ingestion.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Dış person id'si ile store'un verdiği internal id eşlemesi. */
@Data
@AllArgsConstructor
public class PersonIdentity {

    private String externalId;
    private long internalId;
}
