package com.approvalgate.interfaces.api;

import com.approvalgate.application.ConfirmationService;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.ConfirmRequest;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * The human approval step: approve or cancel a staged confirmation by id.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Confirmations", description = "Approve or cancel staged actions")
public class ConfirmationController {

    private final ConfirmationService confirmationService;
    private final CallerContextResolver callerContextResolver;

    @PostMapping(
        value = "/confirm/{confirmationId}",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Approve or cancel a confirmation",
        description = "Approval consumes the confirmation and executes it; cancellation discards it"
    )
    @ApiResponse(
        responseCode = "200",
        description = "success, or a structured error",
        content = @Content(schema = @Schema(implementation = ToolResponse.class))
    )
    public ResponseEntity<ToolResponse> confirm(
            @PathVariable String confirmationId,
            @Valid @RequestBody ConfirmRequest request,
            @RequestHeader HttpHeaders headers) {

        CallerContext caller = callerContextResolver.resolve(request.getUserContext(), headers);

        if (log.isInfoEnabled()) {
            log.info("Confirmation decision: id={}, approved={}, user={}",
                confirmationId, request.getApproved(), caller == null ? null : caller.getUserId());
        }

        return ToolResponses.toEntity(
            confirmationService.confirm(confirmationId, request.getApproved(), caller));
    }
}
