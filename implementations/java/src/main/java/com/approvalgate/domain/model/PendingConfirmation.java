package com.approvalgate.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A proposed mutation staged for human approval.
 *
 * <p>Created once per successful proposal and held only in the confirmation
 * store. {@code capturedStatus} is the entity status read at proposal time; the
 * execution-time write is conditioned on it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingConfirmation {

    private String confirmationId;
    private String action;
    private String targetServer;
    private String issuedBy;
    private Instant issuedAt;
    private String targetEntityId;
    private String capturedStatus;
    private Map<String, String> userSuppliedFields;

    /** Entity columns shown to the approver; informational only. */
    private Map<String, Object> entity;
}
