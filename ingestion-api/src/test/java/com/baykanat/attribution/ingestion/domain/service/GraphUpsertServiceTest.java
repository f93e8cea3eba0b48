package com.baykanat.attribution.ingestion.domain.service;

import com.baykanat.attribution.ingestion.api.dto.ClickRecordedResponse;
import com.baykanat.attribution.ingestion.api.dto.ClickRequest;
import com.baykanat.attribution.ingestion.api.dto.PersonRequest;
import com.baykanat.attribution.ingestion.api.dto.PersonResponse;
import com.baykanat.attribution.ingestion.domain.exception.InvalidPayloadException;
import com.baykanat.attribution.ingestion.domain.mapper.GraphMapper;
import com.baykanat.attribution.ingestion.domain.model.ClickEvent;
import com.baykanat.attribution.ingestion.domain.model.Person;
import com.baykanat.attribution.ingestion.domain.model.UpsertOutcome;
import com.baykanat.attribution.ingestion.infrastructure.persistence.CampaignJdbcRepository;
import com.baykanat.attribution.ingestion.infrastructure.persistence.ClickJdbcRepository;
import com.baykanat.attribution.ingestion.infrastructure.persistence.PersonJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GraphUpsertService.
 *
 * <p>Verifies the resolve-then-write flow with mocked repositories:
 * <ul>
 *   <li>Person upserts write the resolved (post-fallback) record</li>
 *   <li>Clicks ensure placeholder endpoints and append exactly one edge</li>
 *   <li>Empty or invalid click payloads are rejected before any write</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class GraphUpsertServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-18T09:30:00Z");

    @Mock
    private PersonJdbcRepository personRepository;

    @Mock
    private CampaignJdbcRepository campaignRepository;

    @Mock
    private ClickJdbcRepository clickRepository;

    private GraphUpsertService service;

    @BeforeEach
    void setUp() {
        service = new GraphUpsertService(personRepository, campaignRepository, clickRepository,
                new IdentityResolver(), new AttributionNormalizer(),
                Mappers.getMapper(GraphMapper.class), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Upsert person - resolved record is written and returned")
    void upsertPersonWritesResolvedRecord() {
        when(personRepository.upsert(any(Person.class)))
                .thenAnswer(invocation -> new UpsertOutcome<>(invocation.getArgument(0), true));

        PersonResponse response = service.upsertPerson(PersonRequest.builder()
                .id("p_1001")
                .name("Jane Doe")
                .build());

        ArgumentCaptor<Person> captor = ArgumentCaptor.forClass(Person.class);
        verify(personRepository).upsert(captor.capture());
        assertThat(captor.getValue().getEmail()).isEqualTo("Unknown");

        assertThat(response.getId()).isEqualTo("p_1001");
        assertThat(response.getName()).isEqualTo("Jane Doe");
        assertThat(response.getEmail()).isEqualTo("Unknown");
        assertThat(response.getContactNumber()).isEqualTo("Unknown");
    }

    @Test
    @DisplayName("Upsert person - created and updated nodes return the same record shape")
    void upsertPersonSameResultWhetherCreatedOrUpdated() {
        PersonRequest request = PersonRequest.builder().id("p_1").name("Jane").build();
        when(personRepository.upsert(any(Person.class)))
                .thenAnswer(invocation -> new UpsertOutcome<>(invocation.getArgument(0), true))
                .thenAnswer(invocation -> new UpsertOutcome<>(invocation.getArgument(0), false));

        PersonResponse created = service.upsertPerson(request);
        PersonResponse updated = service.upsertPerson(request);

        assertThat(created).isEqualTo(updated);
    }

    @Test
    @DisplayName("Record click - blank person id creates one placeholder person and one edge")
    void recordClickCreatesPlaceholderForBlankPerson() {
        when(personRepository.insertPlaceholderIfAbsent(anyString(), eq("Unknown"))).thenReturn(true);
        when(campaignRepository.insertPlaceholderIfAbsent("c1", "Unknown")).thenReturn(false);
        when(clickRepository.insert(any(ClickEvent.class))).thenReturn(7L);
        when(clickRepository.findByEdgeId(7L)).thenAnswer(invocation -> Optional.of(ClickEvent.builder()
                .edgeId(7L)
                .clickId("clk-x")
                .personId("person-generated")
                .personName("Unknown")
                .campaignId("c1")
                .campaignName("Spring Sale")
                .eventDate(LocalDate.of(2026, 10, 18))
                .clickedAt(NOW)
                .build()));

        ClickRecordedResponse response = service.recordClick(ClickRequest.builder()
                .personId("")
                .campaignId("c1")
                .build());

        ArgumentCaptor<ClickEvent> captor = ArgumentCaptor.forClass(ClickEvent.class);
        verify(clickRepository, times(1)).insert(captor.capture());
        ClickEvent written = captor.getValue();
        assertThat(written.getPersonId()).startsWith("person-");
        assertThat(written.getCampaignId()).isEqualTo("c1");
        assertThat(written.getClickedAt()).isEqualTo(NOW);
        assertThat(written.getEventDate()).isEqualTo(LocalDate.of(2026, 10, 18));
        verify(personRepository).insertPlaceholderIfAbsent(written.getPersonId(), "Unknown");

        assertThat(response.isOk()).isTrue();
        assertThat(response.getNodesCreated()).isEqualTo(1);
        assertThat(response.getRelsCreated()).isEqualTo(1);
        assertThat(response.getClick().getCampaign()).isEqualTo("Spring Sale");
        verify(personRepository, never()).upsert(any());
        verify(campaignRepository, never()).upsert(any());
    }

    @Test
    @DisplayName("Record click - attribution fields, tag and extra attributes are carried to the edge")
    void recordClickCarriesAttribution() {
        when(clickRepository.insert(any(ClickEvent.class))).thenReturn(1L);
        when(clickRepository.findByEdgeId(1L)).thenReturn(Optional.of(ClickEvent.builder()
                .edgeId(1L).clickId("clk_42").personId("p1").campaignId("c1")
                .eventDate(LocalDate.of(2026, 3, 1)).clickedAt(NOW).build()));

        ClickRequest request = ClickRequest.builder()
                .personId("p1")
                .campaignId("c1")
                .id("clk_42")
                .content("Instagram story")
                .source("instagram")
                .medium(" ")
                .date("2026-03-01")
                .build();
        request.putAttribute("utm_term", "shoes");

        service.recordClick(request);

        ArgumentCaptor<ClickEvent> captor = ArgumentCaptor.forClass(ClickEvent.class);
        verify(clickRepository).insert(captor.capture());
        ClickEvent written = captor.getValue();
        assertThat(written.getClickId()).isEqualTo("clk_42");
        assertThat(written.getTag()).isEqualTo("instagram");
        assertThat(written.getMedium()).isNull();
        assertThat(written.getEventDate()).isEqualTo(LocalDate.of(2026, 3, 1));
        assertThat(written.getAttributes()).isEqualTo("{\"utm_term\":\"shoes\"}");
    }

    @Test
    @DisplayName("Record click - entirely empty payload is rejected without DB calls")
    void recordClickRejectsEmptyPayload() {
        assertThatThrownBy(() -> service.recordClick(new ClickRequest()))
                .isInstanceOf(InvalidPayloadException.class);

        verifyNoInteractions(personRepository, campaignRepository, clickRepository);
    }

    @Test
    @DisplayName("Record click - extra keys with only null or blank values still count as empty")
    void recordClickRejectsNullOnlyExtraKeys() {
        ClickRequest request = new ClickRequest();
        request.putAttribute("foo", null);
        request.putAttribute("bar", "  ");

        assertThatThrownBy(() -> service.recordClick(request))
                .isInstanceOf(InvalidPayloadException.class);

        verifyNoInteractions(personRepository, campaignRepository, clickRepository);
    }

    @Test
    @DisplayName("Record click - invalid date is rejected before any node is written")
    void recordClickRejectsInvalidDateBeforeWriting() {
        ClickRequest request = ClickRequest.builder().personId("p1").campaignId("c1").date("not-a-date").build();

        assertThatThrownBy(() -> service.recordClick(request))
                .isInstanceOf(InvalidPayloadException.class);

        verifyNoInteractions(personRepository, campaignRepository, clickRepository);
    }

    @Test
    @DisplayName("Record click - store failure on the edge write propagates instead of being dropped")
    void recordClickPropagatesStoreFailure() {
        when(clickRepository.insert(any(ClickEvent.class)))
                .thenThrow(new DataIntegrityViolationException("fk violation"));

        assertThatThrownBy(() -> service.recordClick(ClickRequest.builder().personId("p1").campaignId("c1").build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
