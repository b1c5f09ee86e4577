package com.approvalgate.infrastructure.audit;

/**
 * Records security-relevant events: staged proposals, execution outcomes,
 * cancellations and authorization denials.
 *
 * <p>Implementations must never fail the calling flow.
 */
public interface AuditService {
    void record(AuditEvent event);
}
