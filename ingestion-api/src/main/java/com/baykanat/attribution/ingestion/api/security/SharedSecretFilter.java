package com.baykanat.attribution.ingestion.api.security;

import com.baykanat.attribution.ingestion.api.exception.GlobalExceptionHandler;
import com.baykanat.attribution.ingestion.config.AppProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Proxy'nin eklediği paylaşılan secret header'ını doğrular; eksik/yanlışsa 401 ve istek
 * controller'a ulaşmaz. Kimlik token'ı platform (IAM) tarafından doğrulanır.
 */
@Slf4j
public class SharedSecretFilter extends OncePerRequestFilter {

    private final AppProperties.SecurityProperties security;
    private final ObjectMapper objectMapper;

    public SharedSecretFilter(AppProperties.SecurityProperties security, ObjectMapper objectMapper) {
        this.security = security;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String secret = security.getSharedSecret();
        if (secret == null || secret.isBlank()) {
            return true;
        }
        String path = request.getRequestURI();
        return security.getExemptPaths().stream().anyMatch(exempt -> isUnder(path, exempt));
    }

    /** Tam eşleşme ya da alt path; "/healthz" için "/healthzX" muaf değildir. */
    private static boolean isUnder(String path, String exempt) {
        return path.equals(exempt) || path.startsWith(exempt.endsWith("/") ? exempt : exempt + "/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String presented = request.getHeader(security.getHeader());
        if (presented == null || !constantTimeEquals(presented, security.getSharedSecret())) {
            log.warn("Rejected {} {}: {} header {}", request.getMethod(), request.getRequestURI(),
                    security.getHeader(), presented == null ? "missing" : "invalid");

            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), GlobalExceptionHandler.errorBody(
                    HttpStatus.UNAUTHORIZED, "Missing or invalid " + security.getHeader(), null));
            return;
        }
        chain.doFilter(request, response);
    }

    private static boolean constantTimeEquals(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
