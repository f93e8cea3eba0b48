package com.baykanat.attribution.ingestion.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI attributionGraphOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Attribution Graph - Ingestion API")
                        .description("""
                                Ingests people, ad campaigns and click-throughs into the attribution graph. \
                                Person and campaign writes are idempotent upserts keyed by a resolved id; \
                                clicks are append-only edges whose missing endpoints become placeholder nodes.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
