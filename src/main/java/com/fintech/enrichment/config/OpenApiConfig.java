package com.fintech.enrichment.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI merchantEnrichmentOpenAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Merchant Enrichment Service API")
                        .description("Control surface for the resumable merchant enrichment job: start, pause, resume and stop a batch that resolves raw merchant names into verified websites or social profiles.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Data Operations Team")
                                .email("data-ops@example.com")))
                .tags(List.of(new Tag()
                        .name("Enrichment Jobs")
                        .description("One job per process. Stopped jobs resume from <input>.checkpoint.json on the next start.")))
                .externalDocs(new ExternalDocumentation()
                        .description("Job metrics")
                        .url("http://localhost:" + port + "/actuator/metrics"))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local server")
                ));
    }
}
