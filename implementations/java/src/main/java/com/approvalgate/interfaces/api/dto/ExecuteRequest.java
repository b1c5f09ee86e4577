package com.approvalgate.interfaces.api.dto;

import com.approvalgate.domain.model.PendingConfirmation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Execution of an approved confirmation, dispatched by {@code action}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRequest {

    private String action;

    /** The staged confirmation payload. */
    private PendingConfirmation data;

    private UserContextDto userContext;
}
