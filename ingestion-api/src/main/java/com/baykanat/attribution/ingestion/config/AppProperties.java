package com.baykanat.attribution.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/** app.* için tip güvenli configuration (paylaşılan secret kontrolü). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private SecurityProperties security = new SecurityProperties();

    @Getter
    @Setter
    public static class SecurityProperties {
        /** Proxy'nin eklediği header adı. */
        private String header = "X-Api-Key";
        /** Boşsa kontrol kapalı (yerel geliştirme). */
        private String sharedSecret = "";
        /** Secret istemeyen path'ler; alt path'leri de kapsar. */
        private List<String> exemptPaths = new ArrayList<>(List.of("/healthz", "/v3/api-docs", "/swagger-ui", "/swagger-ui.html"));
    }
}
