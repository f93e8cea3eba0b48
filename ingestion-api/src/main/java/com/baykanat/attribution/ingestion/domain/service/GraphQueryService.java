package com.baykanat.attribution.ingestion.domain.service;

import com.baykanat.attribution.ingestion.api.dto.ClickEventResponse;
import com.baykanat.attribution.ingestion.api.dto.PersonIdMapPage;
import com.baykanat.attribution.ingestion.api.dto.PersonIdPage;
import com.baykanat.attribution.ingestion.domain.mapper.GraphMapper;
import com.baykanat.attribution.ingestion.infrastructure.persistence.ClickJdbcRepository;
import com.baykanat.attribution.ingestion.infrastructure.persistence.PersonJdbcRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Graph üzerinde salt-okuma sorguları: son click'ler ve person id sayfaları. */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphQueryService {

    private final ClickJdbcRepository clickRepository;
    private final PersonJdbcRepository personRepository;
    private final GraphMapper graphMapper;

    /** En yeni limit kadar click, clicked_at azalan sırada. */
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "graphStore")
    public List<ClickEventResponse> sampleClicks(int limit) {
        log.debug("Sampling {} most recent clicks", limit);
        return graphMapper.toClickEventResponses(clickRepository.findRecent(limit));
    }

    /** internal id sayfası; next_skip = skip + limit. */
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "graphStore")
    public PersonIdPage listPersonInternalIds(boolean onlyConnected, int skip, int limit) {
        List<String> items = personRepository.findInternalIds(onlyConnected, skip, limit).stream()
                .map(String::valueOf)
                .toList();
        return PersonIdPage.builder()
                .items(items)
                .nextSkip(skip + limit)
                .build();
    }

    /** Dış id → internal id sayfası. */
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "graphStore")
    public PersonIdMapPage listPersonIdMap(int skip, int limit) {
        List<PersonIdMapPage.Item> items = personRepository.findIdentities(skip, limit).stream()
                .map(identity -> PersonIdMapPage.Item.builder()
                        .externalId(identity.getExternalId())
                        .internalId(String.valueOf(identity.getInternalId()))
                        .build())
                .toList();
        return PersonIdMapPage.builder()
                .items(items)
                .nextSkip(skip + limit)
                .build();
    }
}
