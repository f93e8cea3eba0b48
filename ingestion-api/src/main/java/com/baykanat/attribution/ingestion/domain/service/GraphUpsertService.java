package com.baykanat.attribution.ingestion.domain.service;

import com.baykanat.attribution.ingestion.api.dto.CampaignRequest;
import com.baykanat.attribution.ingestion.api.dto.CampaignResponse;
import com.baykanat.attribution.ingestion.api.dto.ClickRecordedResponse;
import com.baykanat.attribution.ingestion.api.dto.ClickRequest;
import com.baykanat.attribution.ingestion.api.dto.PersonRequest;
import com.baykanat.attribution.ingestion.api.dto.PersonResponse;
import com.baykanat.attribution.ingestion.domain.exception.InvalidPayloadException;
import com.baykanat.attribution.ingestion.domain.mapper.GraphMapper;
import com.baykanat.attribution.ingestion.domain.model.AdCampaign;
import com.baykanat.attribution.ingestion.domain.model.ClickEvent;
import com.baykanat.attribution.ingestion.domain.model.Person;
import com.baykanat.attribution.ingestion.domain.model.UpsertOutcome;
import com.baykanat.attribution.ingestion.infrastructure.persistence.CampaignJdbcRepository;
import com.baykanat.attribution.ingestion.infrastructure.persistence.ClickJdbcRepository;
import com.baykanat.attribution.ingestion.infrastructure.persistence.PersonJdbcRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Payload → kanonik kayıt → graph store. Node yazımları store'un atomik upsert'ü ile yapılır;
 * click'te uç node'lar ve edge tek transaction'da yazılır, hata olursa hiçbiri kalmaz.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphUpsertService {

    private final PersonJdbcRepository personRepository;
    private final CampaignJdbcRepository campaignRepository;
    private final ClickJdbcRepository clickRepository;
    private final IdentityResolver identityResolver;
    private final AttributionNormalizer attributionNormalizer;
    private final GraphMapper graphMapper;
    private final Clock clock;

    /** Fallback uygulanmış Person'ı id üzerinden merge eder; yeni veya güncel, aynı kaydı döner. */
    @Transactional
    @CircuitBreaker(name = "graphStore")
    public PersonResponse upsertPerson(PersonRequest request) {
        Person resolved = identityResolver.resolvePerson(request);
        UpsertOutcome<Person> outcome = personRepository.upsert(resolved);

        log.debug("Person {} {}", outcome.getNode().getId(), outcome.isCreated() ? "created" : "updated");
        return graphMapper.toPersonResponse(outcome.getNode());
    }

    /** Fallback uygulanmış AdCampaign'i id üzerinden merge eder. */
    @Transactional
    @CircuitBreaker(name = "graphStore")
    public CampaignResponse upsertCampaign(CampaignRequest request) {
        AdCampaign resolved = identityResolver.resolveCampaign(request);
        UpsertOutcome<AdCampaign> outcome = campaignRepository.upsert(resolved);

        log.debug("Campaign {} {}", outcome.getNode().getId(), outcome.isCreated() ? "created" : "updated");
        return graphMapper.toCampaignResponse(outcome.getNode());
    }

    /**
     * Uç node'ları garanti eder (yoksa "Unknown" placeholder, varsa dokunmaz) ve yeni bir
     * Clicked_on edge'i ekler. Tamamen boş payload 400.
     */
    @Transactional
    @CircuitBreaker(name = "graphStore")
    public ClickRecordedResponse recordClick(ClickRequest request) {
        if (request.isEmpty()) {
            throw new InvalidPayloadException("click",
                    "Click payload is empty: at least one of person_id, campaign_id or an attribution field is required");
        }

        // Yazmadan önce tüm doğrulamalar
        Instant clickedAt = clock.instant();
        LocalDate eventDate = attributionNormalizer.parseEventDate(request.getDate(), clickedAt);

        String personId = identityResolver.resolveReferencedId(request.getPersonId(), IdentityResolver.PERSON_PREFIX);
        String campaignId = identityResolver.resolveReferencedId(request.getCampaignId(), IdentityResolver.CAMPAIGN_PREFIX);

        int nodesCreated = 0;
        if (personRepository.insertPlaceholderIfAbsent(personId, IdentityResolver.UNKNOWN)) {
            log.debug("Created placeholder person {}", personId);
            nodesCreated++;
        }
        if (campaignRepository.insertPlaceholderIfAbsent(campaignId, IdentityResolver.UNKNOWN)) {
            log.debug("Created placeholder campaign {}", campaignId);
            nodesCreated++;
        }

        ClickEvent click = ClickEvent.builder()
                .clickId(attributionNormalizer.resolveClickId(request.getId()))
                .personId(personId)
                .campaignId(campaignId)
                .content(attributionNormalizer.blankToNull(request.getContent()))
                .source(attributionNormalizer.blankToNull(request.getSource()))
                .medium(attributionNormalizer.blankToNull(request.getMedium()))
                .term(attributionNormalizer.blankToNull(request.getTerm()))
                .device(attributionNormalizer.blankToNull(request.getDevice()))
                .tag(attributionNormalizer.deriveTag(request.getContent()))
                .eventDate(eventDate)
                .attributes(graphMapper.toJsonString(request.getAttributes()))
                .clickedAt(clickedAt)
                .build();

        long edgeId = clickRepository.insert(click);
        ClickEvent stored = clickRepository.findByEdgeId(edgeId)
                .orElseThrow(() -> new IllegalStateException("Inserted click edge " + edgeId + " not readable"));

        log.info("Recorded click {}: person={}, campaign={}, nodes_created={}",
                stored.getClickId(), personId, campaignId, nodesCreated);

        return ClickRecordedResponse.builder()
                .ok(true)
                .click(graphMapper.toClickEventResponse(stored))
                .nodesCreated(nodesCreated)
                .relsCreated(1)
                .build();
    }
}
