package com.baykanat.attribution.proxy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/** proxy.* için tip güvenli configuration; eksik hedef ya da secret ile uygulama açılmaz. */
@Configuration
@ConfigurationProperties(prefix = "proxy")
@Validated
@Getter
@Setter
public class ProxyProperties {

    /** Ingestion API'nin kök URL'i. */
    @NotBlank
    private String targetUrl;

    /** Her giden isteğe eklenen statik secret. */
    @NotBlank
    private String sharedSecret;

    private String sharedSecretHeader = "X-Api-Key";

    /** Çağıranın göndermesi gereken anahtar; boşsa sharedSecret kullanılır. */
    private String inboundApiKey;

    /** Kimlik token'ının audience'ı; boşsa targetUrl. */
    private String audience;

    @Valid
    private CredentialsProperties credentials = new CredentialsProperties();

    @Valid
    private HttpProperties http = new HttpProperties();

    public String resolvedAudience() {
        return isBlank(audience) ? stripTrailingSlash(targetUrl) : audience;
    }

    public String resolvedInboundApiKey() {
        return isBlank(inboundApiKey) ? sharedSecret : inboundApiKey;
    }

    public String targetBaseUrl() {
        return stripTrailingSlash(targetUrl);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Getter
    @Setter
    public static class CredentialsProperties {
        /** Token basımı bu süreyi aşarsa istek 503 ile reddedilir. */
        @NotNull
        private Duration mintTimeout = Duration.ofSeconds(10);
        /** Cache'teki token, son kullanma zamanından bu kadar önce yenilenir. */
        @NotNull
        private Duration refreshSkew = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class HttpProperties {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        /** Tüm çağrı için üst sınır (bağlantı + gövde). */
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(60);
    }
}
