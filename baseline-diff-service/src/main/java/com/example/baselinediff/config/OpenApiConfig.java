package com.example.baselinediff.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the Baseline Diff Service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Baseline Diff Service API")
                        .version("1.0.0")
                        .description("""
                            Compares an upstream and a vendor repo tree and classifies every
                            commit by its Change-Id trailer.

                            ## Classifications
                            - **shared**: the Change-Id appears in both trees
                            - **upstream_only**: only in the upstream tree
                            - **vendor_only**: only in the vendor tree

                            ## Typical flow
                            1. `POST /api/scans` with both tree roots, or `POST /api/commits/bulk` followed by `POST /api/classify`
                            2. `GET /api/commits` with filters
                            """)
                        .contact(new Contact()
                                .name("Baseline Diff Team")
                                .email("baseline-diff@example.com")));
    }
}
