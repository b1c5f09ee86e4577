package com.approvalgate.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The human's decision on a staged confirmation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmRequest {

    @NotNull(message = "approved is required")
    private Boolean approved;

    private UserContextDto userContext;
}
