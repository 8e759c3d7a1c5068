package com.example.cronscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * GitHub issue tracker connection properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "github")
public class GitHubProperties {
    @NotBlank
    private String baseUrl = "https://api.github.com";
    private String token;
    private String owner;
    private String repo;
    private int timeoutSeconds = 30;

    public boolean isConfigured() {
        return token != null && !token.isBlank();
    }
}
