package com.approvalgate.interfaces.api;

import com.approvalgate.application.ErrorCodes;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * HTTP status mapping for tool responses. Domain outcomes, errors included, are
 * delivered as 200 so consumers always read the canonical body; only a request
 * without identity is rejected at the HTTP level.
 */
final class ToolResponses {

    private ToolResponses() {}

    static ResponseEntity<ToolResponse> toEntity(ToolResponse response) {
        if (ErrorCodes.MISSING_USER_CONTEXT.equals(response.getCode())) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
