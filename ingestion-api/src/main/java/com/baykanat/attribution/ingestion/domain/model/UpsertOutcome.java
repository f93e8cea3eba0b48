package com.baykanat.attribution.ingestion.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Upsert sonrası node'un son hali ve satırın bu çağrıda mı oluşturulduğu. */
@Data
@AllArgsConstructor
public class UpsertOutcome<T> {

    private T node;
    private boolean created;
}
