package com.z254.butterfly.scout.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for SCOUT service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI scoutOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SCOUT API")
                        .description("""
                                SCOUT - Repository Audit Coordination for the BUTTERFLY Ecosystem.
                                
                                Runs a pipeline of audit agents against a repository and exposes the
                                progress and results of each run.
                                
                                ## Features
                                - **Orchestration**: agents start when their predecessors and context dependencies are met
                                - **Shared Context**: per-run namespace of intermediate results
                                - **Lifecycle**: per-agent status while the run is in flight
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("254STUDIOZ Engineering")
                                .email("engineering@254carbon.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://254carbon.com/licenses")))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8091").description("Local development")
                ));
    }
}
