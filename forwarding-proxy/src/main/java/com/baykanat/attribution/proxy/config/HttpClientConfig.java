package com.baykanat.attribution.proxy.config;

import com.baykanat.attribution.proxy.http.LoggingInterceptor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Ingestion API'ye giden OkHttp client'ı: açık timeout'lar, retry ve redirect yok. */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient upstreamHttpClient(ProxyProperties properties) {
        ProxyProperties.HttpProperties http = properties.getHttp();
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .callTimeout(http.getCallTimeout())
                .retryOnConnectionFailure(false)
                .followRedirects(false)
                .followSslRedirects(false)
                .addInterceptor(new LoggingInterceptor(properties.getSharedSecretHeader()))
                .build();
    }
}
