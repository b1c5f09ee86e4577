package com.approvalgate.application;

/**
 * Error codes shared by every tool. Entity-specific codes
 * ({@code EXPENSE_REPORT_NOT_FOUND}, {@code INVALID_INVOICE_STATUS}, ...) are
 * declared on {@code EntityType}.
 */
public final class ErrorCodes {

    /** No trusted identity on the request. Not retryable. */
    public static final String MISSING_USER_CONTEXT = "MISSING_USER_CONTEXT";
    public static final String INSUFFICIENT_PERMISSIONS = "INSUFFICIENT_PERMISSIONS";
    public static final String INVALID_INPUT = "INVALID_INPUT";
    public static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";
    public static final String CONFIRMATION_NOT_FOUND = "CONFIRMATION_NOT_FOUND";
    /** Storage or transport failure during a proposal. */
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    /** Any unexpected failure during execution. */
    public static final String EXECUTION_FAILED = "EXECUTION_FAILED";

    private ErrorCodes() {}
}
