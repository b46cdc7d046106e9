package com.example.automationscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Base URLs and timeouts of the HTTP collaborators
 */
@Data
@Validated
@ConfigurationProperties(prefix = "external-services")
public class ExternalServiceProperties {

    @Valid
    private Endpoint automationRegistry = new Endpoint();

    @Valid
    private Endpoint marketData = new Endpoint();

    @Valid
    private Endpoint exchangeGateway = new Endpoint();

    @Data
    public static class Endpoint {
        @NotBlank
        private String baseUrl = "http://localhost";
        private int timeoutSeconds = 10;
    }
}
