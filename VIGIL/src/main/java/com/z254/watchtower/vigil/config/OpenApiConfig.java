package com.z254.watchtower.vigil.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for VIGIL service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI vigilOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("VIGIL Incident Service API")
                        .description("""
                                VIGIL tracks operational incidents from report to closure.
                                
                                ## Features
                                
                                - **Lifecycle**: Validated status transitions and milestone timestamps
                                - **Timeline**: Append-only audit trail of every change
                                - **Reports**: KPIs, breakdowns, trends, CSV and document exports
                                
                                ## Conventions
                                
                                Mutating calls identify the acting user through the `X-User-Id` header.
                                Errors carry a stable `errorCode`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Watchtower Team")
                                .email("watchtower@254studioz.com")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://vigil-service:8090")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Incidents")
                                .description("Incident lifecycle, comments and timeline"),
                        new Tag()
                                .name("Reports")
                                .description("Operational metrics and exports")
                ));
    }
}
