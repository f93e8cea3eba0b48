package com.baykanat.attribution.proxy.service;

import com.baykanat.attribution.proxy.config.ProxyProperties;
import com.baykanat.attribution.proxy.credentials.IdTokenSource;
import com.baykanat.attribution.proxy.credentials.MintedToken;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;

/**
 * Gelen isteği doğrular, audience'a özel kimlik token'ı ve statik secret ekleyerek
 * ingestion API'ye aynen iletir; cevabı aynen döner. Retry ve redirect takibi yok.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForwardingService {

    /** Hop-by-hop ve proxy'nin kendisinin belirlediği header'lar; upstream'e kopyalanmaz. */
    private static final Set<String> DROPPED_REQUEST_HEADERS = Set.of(
            "host", "authorization", "content-length", "accept-encoding",
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade");

    /** Servlet container'ın yeniden hesapladığı header'lar; çağırana kopyalanmaz. */
    private static final Set<String> DROPPED_RESPONSE_HEADERS = Set.of(
            "content-length", "transfer-encoding", "content-encoding", "connection");

    private static final Set<String> BODYLESS_METHODS = Set.of("GET", "HEAD");

    private static final Set<String> BODY_REQUIRED_METHODS = Set.of("POST", "PUT", "PATCH");

    private final ProxyProperties properties;
    private final IdTokenSource idTokenSource;
    private final OkHttpClient upstreamHttpClient;

    public ProxiedResponse forward(HttpServletRequest inbound, byte[] body) {
        verifyInboundKey(inbound);

        // token yoksa istek hiç gönderilmez
        MintedToken token = idTokenSource.mint(properties.resolvedAudience());

        Request outbound = buildOutboundRequest(inbound, body, token);
        try (Response response = upstreamHttpClient.newCall(outbound).execute()) {
            ResponseBody responseBody = response.body();
            byte[] bytes = responseBody != null ? responseBody.bytes() : new byte[0];
            log.info("{} {} -> {}", inbound.getMethod(), inbound.getRequestURI(), response.code());

            return ProxiedResponse.builder()
                    .status(response.code())
                    .headers(copyResponseHeaders(response.headers()))
                    .body(bytes)
                    .build();
        } catch (IOException e) {
            log.error("Upstream call failed for {} {}: {}", inbound.getMethod(), inbound.getRequestURI(), e.getMessage());
            throw new UpstreamUnavailableException("Upstream service is unreachable", e);
        }
    }

    private void verifyInboundKey(HttpServletRequest inbound) {
        String presented = inbound.getHeader(properties.getSharedSecretHeader());
        String expected = properties.resolvedInboundApiKey();
        if (presented == null || !MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected {} {}: {} header {}", inbound.getMethod(), inbound.getRequestURI(),
                    properties.getSharedSecretHeader(), presented == null ? "missing" : "invalid");
            throw new AuthRejectedException("Missing or invalid " + properties.getSharedSecretHeader());
        }
    }

    Request buildOutboundRequest(HttpServletRequest inbound, byte[] body, MintedToken token) {
        String query = inbound.getQueryString();
        String url = properties.targetBaseUrl() + inbound.getRequestURI() + (query != null ? "?" + query : "");

        Headers.Builder headers = new Headers.Builder();
        String secretHeader = properties.getSharedSecretHeader().toLowerCase(Locale.ROOT);
        for (String name : Collections.list(inbound.getHeaderNames())) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (DROPPED_REQUEST_HEADERS.contains(lower) || lower.equals(secretHeader)) {
                continue;
            }
            for (String value : Collections.list(inbound.getHeaders(name))) {
                headers.addUnsafeNonAscii(name, value);
            }
        }
        headers.set("Authorization", "Bearer " + token.getTokenValue());
        headers.set(properties.getSharedSecretHeader(), properties.getSharedSecret());

        String method = inbound.getMethod().toUpperCase(Locale.ROOT);
        return new Request.Builder()
                .url(url)
                .headers(headers.build())
                .method(method, requestBody(method, body, inbound.getContentType()))
                .build();
    }

    private static RequestBody requestBody(String method, byte[] body, String contentType) {
        boolean hasBody = body != null && body.length > 0;
        if (BODYLESS_METHODS.contains(method) || (!hasBody && !BODY_REQUIRED_METHODS.contains(method))) {
            return null;
        }
        MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
        return RequestBody.create(hasBody ? body : new byte[0], mediaType);
    }

    private static HttpHeaders copyResponseHeaders(Headers upstream) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : upstream.names()) {
            if (!DROPPED_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                headers.put(name, upstream.values(name));
            }
        }
        return headers;
    }
}
