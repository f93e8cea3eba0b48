package com.baykanat.attribution.proxy.config;

import com.baykanat.attribution.proxy.credentials.CachingIdTokenSource;
import com.baykanat.attribution.proxy.credentials.GoogleIdTokenSource;
import com.baykanat.attribution.proxy.credentials.IdTokenSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/** Google application-default credentials üzerinden, audience başına cache'lenen token kaynağı. */
@Configuration
public class CredentialsConfig {

    @Bean(destroyMethod = "close")
    public GoogleIdTokenSource googleIdTokenSource(ProxyProperties properties) {
        return new GoogleIdTokenSource(properties.getCredentials().getMintTimeout());
    }

    @Bean
    @Primary
    public IdTokenSource idTokenSource(GoogleIdTokenSource googleIdTokenSource, ProxyProperties properties) {
        return new CachingIdTokenSource(googleIdTokenSource, Clock.systemUTC(),
                properties.getCredentials().getRefreshSkew());
    }
}
