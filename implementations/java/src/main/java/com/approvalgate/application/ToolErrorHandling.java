package com.approvalgate.application;

import com.approvalgate.infrastructure.security.InsufficientPermissionsException;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import jakarta.persistence.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The one place thrown failures become tool responses.
 *
 * <p>Authorization and input failures become their structured codes. Anything
 * else is logged with its stack trace and reported opaquely as
 * {@code INTERNAL_ERROR}, or {@code EXECUTION_FAILED} for {@code execute_*}
 * actions, flagged retryable when it was a timeout or a failure to obtain a
 * connection. Nothing here retries.
 */
@Slf4j
public final class ToolErrorHandling {

    static final String EXECUTE_PREFIX = "execute_";

    private ToolErrorHandling() {}

    public static ToolResponse withErrorHandling(String actionName, Supplier<ToolResponse> work) {
        try {
            return work.get();
        } catch (InsufficientPermissionsException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("requiredRoles", new ArrayList<>(e.getRequiredRoles()));
            details.put("userRoles", new ArrayList<>(e.getUserRoles()));
            return ToolResponse.error(
                ErrorCodes.INSUFFICIENT_PERMISSIONS,
                e.getMessage(),
                "Contact your administrator to request one of the required roles.",
                details);
        } catch (InvalidActionInputException e) {
            log.debug("Invalid input for {}: field={}", actionName, e.getField());
            return ToolErrors.invalidInput(e.getField(), e.getMessage());
        } catch (RuntimeException e) {
            boolean retryable = isRetryable(e);
            boolean executing = actionName.startsWith(EXECUTE_PREFIX);

            log.error("Tool {} failed (retryable={}): {}", actionName, retryable, e.getMessage(), e);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("retryable", retryable);
            return ToolResponse.error(
                executing ? ErrorCodes.EXECUTION_FAILED : ErrorCodes.INTERNAL_ERROR,
                executing
                    ? "The action could not be completed. No changes were made."
                    : "An internal error occurred while preparing the action.",
                retryable
                    ? "The system is temporarily busy. Please try again in a moment."
                    : "Please try again later or contact support if the problem persists.",
                details);
        }
    }

    /**
     * Timeouts and connection-acquisition failures anywhere in the cause chain.
     */
    static boolean isRetryable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TransientDataAccessException
                || t instanceof CannotCreateTransactionException
                || t instanceof TransactionTimedOutException
                || t instanceof SQLTransientException
                || t instanceof jakarta.persistence.QueryTimeoutException
                || t instanceof LockTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
