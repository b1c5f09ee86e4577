package com.approvalgate.infrastructure.audit;

/**
 * Stage of the confirmation protocol an audit event belongs to.
 */
public enum AuditCategory {
    /** Role policy decisions. Only denials are recorded. */
    AUTHORIZATION,
    /** A confirmation was staged or cancelled. */
    CONFIRMATION,
    /** A guarded write was attempted after approval. */
    EXECUTION
}
