package com.approvalgate.infrastructure.persistence;

/**
 * The caller's identity could not be bound into the database session. The
 * surrounding transaction is rolled back; no statement runs without RLS context.
 */
public class RlsBindingException extends RuntimeException {

    public RlsBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
