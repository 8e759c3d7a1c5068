package com.example.cronscheduler.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Idempotent incident dispatch configuration
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    /**
     * Deployment environment, part of the fingerprint and of the issue labels
     */
    @NotBlank
    private String environment = "dev";

    private String buildVersion = "dev-local";

    /**
     * Namespace prefix of idempotency keys
     */
    @NotBlank
    private String keyPrefix = "github:issue:";

    /**
     * How long a dispatched fingerprint suppresses duplicates
     */
    @NotNull
    private Duration retention = Duration.ofHours(24);

    /**
     * Whether the in-memory idempotency store is used. When off, every dispatch goes out.
     */
    private boolean idempotencyEnabled = true;

    /**
     * Retries after the initial attempt
     */
    @Min(0)
    private int maxRetries = 3;

    @NotNull
    private Duration initialDelay = Duration.ofSeconds(1);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.3;
}
