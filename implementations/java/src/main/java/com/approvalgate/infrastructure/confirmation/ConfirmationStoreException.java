package com.approvalgate.infrastructure.confirmation;

/**
 * The confirmation store is unreachable or returned an unreadable payload.
 */
public class ConfirmationStoreException extends RuntimeException {

    public ConfirmationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
