package com.approvalgate.application;

import com.approvalgate.interfaces.api.dto.ToolResponse;
import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class ToolErrorHandlingTest {

    @Test
    void successful_work_passes_through() {
        ToolResponse ok = ToolResponse.success("done");

        assertSame(ok, ToolErrorHandling.withErrorHandling("approve_invoice", () -> ok));
    }

    @Test
    void unexpected_failure_while_proposing_is_internal_error() {
        ToolResponse response = ToolErrorHandling.withErrorHandling("approve_invoice", () -> {
            throw new IllegalStateException("password=hunter2");
        });

        assertEquals("INTERNAL_ERROR", response.getCode());
        assertFalse(response.getMessage().contains("hunter2"));
        assertEquals(false, response.getDetails().get("retryable"));
    }

    @Test
    void unexpected_failure_while_executing_is_execution_failed() {
        ToolResponse response = ToolErrorHandling.withErrorHandling("execute_approve_invoice", () -> {
            throw new DataIntegrityViolationException("constraint");
        });

        assertEquals("EXECUTION_FAILED", response.getCode());
        assertEquals("The action could not be completed. No changes were made.", response.getMessage());
    }

    @Test
    void connection_failure_is_retryable() {
        ToolResponse response = ToolErrorHandling.withErrorHandling("execute_pay_invoice", () -> {
            throw new CannotCreateTransactionException("pool exhausted");
        });

        assertEquals(true, response.getDetails().get("retryable"));
        assertTrue(response.getSuggestedAction().contains("try again"));
    }

    @Test
    void retryable_cause_is_found_deep_in_the_chain() {
        RuntimeException wrapped = new PersistenceException("flush failed",
            new RuntimeException("driver", new SQLTransientConnectionException("timeout")));

        assertTrue(ToolErrorHandling.isRetryable(wrapped));
        assertFalse(ToolErrorHandling.isRetryable(new PersistenceException("constraint")));
    }

    @Test
    void invalid_input_names_the_field() {
        ToolResponse response = ToolErrorHandling.withErrorHandling("reject_budget", () -> {
            throw new InvalidActionInputException("rejectionReason", "Rejection Reason must be at least 10 characters");
        });

        assertEquals("INVALID_INPUT", response.getCode());
        assertEquals("rejectionReason", response.getDetails().get("field"));
        assertEquals("Rejection Reason must be at least 10 characters", response.getMessage());
    }
}
