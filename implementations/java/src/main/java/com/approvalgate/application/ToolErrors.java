package com.approvalgate.application;

import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.policy.PreconditionViolation;
import com.approvalgate.interfaces.api.dto.ToolResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factories for the structured error responses shared by all tools.
 */
public final class ToolErrors {

    private ToolErrors() {}

    public static ToolResponse missingUserContext() {
        return ToolResponse.error(
            ErrorCodes.MISSING_USER_CONTEXT,
            "User context is required. The request did not carry a user id and at least one role.",
            "Sign in again. If the problem persists, the gateway is not forwarding user identity.");
    }

    /**
     * Same response whether the row is absent, hidden by RLS, or (at execute time)
     * no longer in the expected status.
     */
    public static ToolResponse notFound(EntityType type, String entityId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(type.getIdField(), entityId);
        return ToolResponse.error(
            type.getNotFoundCode(),
            type.getTitle() + " with ID \"" + entityId + "\" not found",
            "Verify the " + type.getLabel() + " ID. Use " + type.getListTool()
                + " to find valid " + type.getLabel() + " IDs.",
            details);
    }

    public static ToolResponse fromViolation(PreconditionViolation violation) {
        return ToolResponse.error(
            violation.getCode(),
            violation.getMessage(),
            violation.getSuggestedAction(),
            violation.getDetails());
    }

    public static ToolResponse invalidInput(String field, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        return ToolResponse.error(
            ErrorCodes.INVALID_INPUT,
            message,
            "Correct the " + field + " value and try again.",
            details);
    }

    public static ToolResponse unknownAction(String action) {
        return ToolResponse.error(
            ErrorCodes.UNKNOWN_ACTION,
            "Unknown action: " + action,
            "Check the action name. The confirmation may have been created by an unsupported tool.");
    }

    public static ToolResponse confirmationNotFound(String confirmationId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("confirmationId", confirmationId);
        return ToolResponse.error(
            ErrorCodes.CONFIRMATION_NOT_FOUND,
            "Confirmation \"" + confirmationId + "\" not found or has expired",
            "Confirmations expire after a few minutes. Ask for the action again to get a new confirmation.",
            details);
    }
}
