package com.ofdtext.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "basic-auth";

    @Bean
    public OpenAPI textExtractorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("OFD Text Extractor API")
                        .description("Turns OFD receipt pages and articles into clean text plus the receipt PDF / FNS check links.")
                        .version("v1")
                )
                // HTTP Basic, same credentials as BASIC_AUTH_USERNAME / BASIC_AUTH_PASSWORD
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("basic")
                        )
                )
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
