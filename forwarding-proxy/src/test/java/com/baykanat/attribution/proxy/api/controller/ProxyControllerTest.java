package com.baykanat.attribution.proxy.api.controller;

import com.baykanat.attribution.proxy.credentials.CredentialMintingException;
import com.baykanat.attribution.proxy.service.AuthRejectedException;
import com.baykanat.attribution.proxy.service.ForwardingService;
import com.baykanat.attribution.proxy.service.ProxiedResponse;
import com.baykanat.attribution.proxy.service.UpstreamUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for ProxyController and the proxy's error mapping.
 */
@WebMvcTest(ProxyController.class)
class ProxyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ForwardingService forwardingService;

    @Test
    @DisplayName("Any path - upstream status, headers and body are returned")
    void relaysUpstreamResponse() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Upstream", "ingestion");
        when(forwardingService.forward(any(HttpServletRequest.class), any())).thenReturn(ProxiedResponse.builder()
                .status(200)
                .headers(headers)
                .body("{\"ok\":true}".getBytes(StandardCharsets.UTF_8))
                .build());

        mockMvc.perform(post("/clicked_on")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"person_id\":\"p_1\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Upstream", "ingestion"))
                .andExpect(jsonPath("$.ok").value(true));

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(forwardingService).forward(any(HttpServletRequest.class), body.capture());
        assertThat(new String(body.getValue(), StandardCharsets.UTF_8)).isEqualTo("{\"person_id\":\"p_1\"}");
    }

    @Test
    @DisplayName("Upstream 4xx - relayed with the same status")
    void relaysClientErrors() throws Exception {
        when(forwardingService.forward(any(HttpServletRequest.class), any())).thenReturn(ProxiedResponse.builder()
                .status(400)
                .headers(new HttpHeaders())
                .body("{\"message\":\"Validation failed\"}".getBytes(StandardCharsets.UTF_8))
                .build());

        mockMvc.perform(get("/sample").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("{\"message\":\"Validation failed\"}"));
    }

    @Test
    @DisplayName("Rejected caller - 401")
    void rejectedCallerReturns401() throws Exception {
        when(forwardingService.forward(any(HttpServletRequest.class), any()))
                .thenThrow(new AuthRejectedException("Missing or invalid X-Api-Key"));

        mockMvc.perform(get("/sample"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Missing or invalid X-Api-Key"));
    }

    @Test
    @DisplayName("Token minting failure - 503")
    void mintingFailureReturns503() throws Exception {
        when(forwardingService.forward(any(HttpServletRequest.class), any()))
                .thenThrow(new CredentialMintingException("timed out"));

        mockMvc.perform(get("/sample"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }

    @Test
    @DisplayName("Unreachable upstream - 502")
    void unreachableUpstreamReturns502() throws Exception {
        IOException cause = new ConnectException("Connection refused");
        when(forwardingService.forward(any(HttpServletRequest.class), any()))
                .thenThrow(new UpstreamUnavailableException("Upstream service is unreachable", cause));

        mockMvc.perform(get("/sample"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Upstream service is unreachable"));
    }
}
