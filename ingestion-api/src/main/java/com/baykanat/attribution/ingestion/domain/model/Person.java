package com.baykanat.attribution.ingestion.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** person tablosu satırı; graph'taki Person node'u (JDBC, JPA değil). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Person {

    private Long internalId;
    private String id;
    private String name;
    private String email;
    private String contactNumber;
}
