package com.approvalgate.infrastructure.audit;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * One entry in the approval audit trail.
 *
 * <p>{@code action} is the tool wire name. {@code resourceId} is the
 * confirmation id for {@link AuditCategory#CONFIRMATION} events and the entity
 * id for {@link AuditCategory#EXECUTION} events; authorization denials have
 * none. {@code detail} never carries user-supplied text.
 */
@Value
@Builder
public class AuditEvent {
    AuditCategory category;
    String outcome;
    String action;
    String resourceId;
    String principalId;
    UUID requestId;
    String detail;
}
