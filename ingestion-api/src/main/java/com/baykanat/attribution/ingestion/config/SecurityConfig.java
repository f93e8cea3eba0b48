package com.baykanat.attribution.ingestion.config;

import com.baykanat.attribution.ingestion.api.security.SharedSecretFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/** Paylaşılan secret filtresini tüm path'lere, controller'lardan önce kaydeder. */
@Slf4j
@Configuration
public class SecurityConfig {

    @Bean
    public FilterRegistrationBean<SharedSecretFilter> sharedSecretFilter(AppProperties appProperties,
                                                                        ObjectMapper objectMapper) {
        AppProperties.SecurityProperties security = appProperties.getSecurity();
        if (security.getSharedSecret() == null || security.getSharedSecret().isBlank()) {
            log.warn("app.security.shared-secret is not set; shared-secret check is DISABLED");
        }

        FilterRegistrationBean<SharedSecretFilter> registration =
                new FilterRegistrationBean<>(new SharedSecretFilter(security, objectMapper));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
