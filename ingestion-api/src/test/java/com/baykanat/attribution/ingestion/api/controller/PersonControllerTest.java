package com.baykanat.attribution.ingestion.api.controller;

import com.baykanat.attribution.ingestion.api.dto.PersonRequest;
import com.baykanat.attribution.ingestion.api.dto.PersonResponse;
import com.baykanat.attribution.ingestion.config.JacksonConfig;
import com.baykanat.attribution.ingestion.domain.service.GraphUpsertService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for PersonController.
 *
 * <p>The upsert service is mocked; these tests cover request parsing, validation
 * and the mapping of graph-store failures to 503.
 */
@WebMvcTest(PersonController.class)
@Import(JacksonConfig.class)
class PersonControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GraphUpsertService graphUpsertService;

    @Test
    @DisplayName("POST /person - returns the resolved person record")
    void upsertReturnsResolvedPerson() throws Exception {
        when(graphUpsertService.upsertPerson(any(PersonRequest.class))).thenReturn(PersonResponse.builder()
                .id("p_1001")
                .name("Jane Doe")
                .email("Unknown")
                .contactNumber("Unknown")
                .build());

        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": "p_1001", "name": "Jane Doe"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("p_1001"))
                .andExpect(jsonPath("$.name").value("Jane Doe"))
                .andExpect(jsonPath("$.email").value("Unknown"))
                .andExpect(jsonPath("$.contact_number").value("Unknown"));
    }

    @Test
    @DisplayName("POST /person - malformed JSON returns 400 without touching the store")
    void malformedJsonReturns400() throws Exception {
        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"p_1\", "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Malformed JSON payload"));

        verifyNoInteractions(graphUpsertService);
    }

    @Test
    @DisplayName("POST /person - non-string field returns 400 naming the field")
    void wrongFieldTypeReturns400() throws Exception {
        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": "p_1", "name": {"first": "Jane"}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for field 'name'"));

        verifyNoInteractions(graphUpsertService);
    }

    @Test
    @DisplayName("POST /person - boolean id is not coerced to text and returns 400")
    void booleanIdReturns400() throws Exception {
        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": true, "name": "Jane"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for field 'id'"));

        verifyNoInteractions(graphUpsertService);
    }

    @Test
    @DisplayName("POST /person - numeric name and email are not coerced to text and return 400")
    void numericFieldsReturn400() throws Exception {
        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": "p_1", "name": 123, "email": 4.5}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for field 'name'"));

        verifyNoInteractions(graphUpsertService);
    }

    @Test
    @DisplayName("POST /person - oversized id returns 400 with field details")
    void oversizedIdReturns400() throws Exception {
        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"" + "x".repeat(300) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details[0].field").value("id"));
    }

    @Test
    @DisplayName("POST /person - unreachable store returns 503 with Retry-After")
    void storeDownReturns503() throws Exception {
        when(graphUpsertService.upsertPerson(any(PersonRequest.class)))
                .thenThrow(new CannotGetJdbcConnectionException("Connection refused"));

        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"p_1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.message").value("Graph store is temporarily unavailable"));
    }

    @Test
    @DisplayName("POST /person - open circuit breaker returns 503")
    void openCircuitReturns503() throws Exception {
        when(graphUpsertService.upsertPerson(any(PersonRequest.class)))
                .thenThrow(CallNotPermittedException.createCallNotPermittedException(
                        CircuitBreaker.ofDefaults("graphStore")));

        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"p_1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().exists("Retry-After"));
    }

    @Test
    @DisplayName("POST /person - unexpected failure returns a generic 500")
    void unexpectedFailureReturns500() throws Exception {
        when(graphUpsertService.upsertPerson(any(PersonRequest.class)))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/person")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"p_1\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
