package com.approvalgate.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for RLS-bound database sessions.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "approval-gate.session")
public class SessionProperties {

    /**
     * Upper bound on one RLS-bound unit of work.
     */
    @NotNull
    private Duration transactionTimeout = Duration.ofSeconds(10);

    /**
     * Namespace of the session variables read by the row-level-security policies.
     */
    @NotBlank
    private String variablePrefix = "app.";
}
