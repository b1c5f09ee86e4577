package com.approvalgate.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Staging window and backing store for pending confirmations.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "approval-gate.confirmation")
public class ConfirmationProperties {

    /**
     * How long a proposal waits for human approval before it expires.
     */
    @NotNull
    private Duration ttl = Duration.ofSeconds(300);

    @NotBlank
    private String keyPrefix = "pending:";

    /**
     * {@code redis} for a store shared by all instances; {@code memory} for a
     * single-node deployment or local development.
     */
    @NotBlank
    private String store = "redis";

    @Min(1)
    private long memoryMaxEntries = 10_000;
}
