package com.example.automationscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Slack configuration properties
 */
@Data
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#automation-alerts";
    private boolean enabled = true;
    private String dashboardBaseUrl = "http://localhost:8080/api/v1";
}
