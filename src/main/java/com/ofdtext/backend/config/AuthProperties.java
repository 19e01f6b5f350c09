package com.ofdtext.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Basic auth credentials for the extraction endpoint (BASIC_AUTH_USERNAME / BASIC_AUTH_PASSWORD).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    @NotBlank
    private String username = "admin";

    @NotBlank
    private String password = "password";

    /**
     * Realm announced in the WWW-Authenticate header.
     */
    @NotBlank
    private String realm = "Login Required";
}
