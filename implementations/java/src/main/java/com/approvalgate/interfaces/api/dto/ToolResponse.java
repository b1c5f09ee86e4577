package com.approvalgate.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * The single response envelope for every tool, execute and confirm call.
 *
 * <p>Exactly one of three shapes is ever produced:
 * <pre>
 * { status: "success", data }
 * { status: "error", code, message, suggestedAction, details? }
 * { status: "pending_confirmation", confirmationId, message, confirmationData }
 * </pre>
 * Consumers (the UI renderer and the AI agent) dispatch on {@code status} and,
 * for errors, on {@code code}; they never parse {@code message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Canonical tool response")
public class ToolResponse {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String PENDING_CONFIRMATION = "pending_confirmation";

    @Schema(allowableValues = {SUCCESS, ERROR, PENDING_CONFIRMATION})
    private String status;

    private Object data;

    private String code;
    private String message;
    private String suggestedAction;
    private Map<String, Object> details;

    private String confirmationId;
    private Object confirmationData;

    public static ToolResponse success(Object data) {
        return ToolResponse.builder()
            .status(SUCCESS)
            .data(data)
            .build();
    }

    public static ToolResponse error(String code, String message, String suggestedAction) {
        return error(code, message, suggestedAction, null);
    }

    public static ToolResponse error(String code, String message, String suggestedAction,
                                     Map<String, Object> details) {
        return ToolResponse.builder()
            .status(ERROR)
            .code(code)
            .message(message)
            .suggestedAction(suggestedAction)
            .details(details)
            .build();
    }

    public static ToolResponse pendingConfirmation(String confirmationId, String message, Object confirmationData) {
        return ToolResponse.builder()
            .status(PENDING_CONFIRMATION)
            .confirmationId(confirmationId)
            .message(message)
            .confirmationData(confirmationData)
            .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR.equals(status);
    }

    @JsonIgnore
    public boolean isPendingConfirmation() {
        return PENDING_CONFIRMATION.equals(status);
    }
}
