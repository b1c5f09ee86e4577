package com.approvalgate.interfaces.api;

import com.approvalgate.application.ConfirmationService;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.ExecuteRequest;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Execution of an approved confirmation payload, called by the approval gateway.
 * The payload is honoured only while the confirmation it names is still staged.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Execution", description = "Apply approved actions")
public class ExecuteController {

    private final ConfirmationService confirmationService;
    private final CallerContextResolver callerContextResolver;

    @PostMapping(
        value = "/execute",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Execute an approved action",
        description = "Consumes the staged confirmation, re-authorizes and applies a conditional write guarded by the status captured at proposal time"
    )
    @ApiResponse(
        responseCode = "200",
        description = "success, or a structured error",
        content = @Content(schema = @Schema(implementation = ToolResponse.class))
    )
    public ResponseEntity<ToolResponse> execute(
            @RequestBody ExecuteRequest request,
            @RequestHeader HttpHeaders headers) {

        CallerContext caller = callerContextResolver.resolve(request.getUserContext(), headers);

        if (log.isInfoEnabled()) {
            log.info("Execute requested: action={}, confirmationId={}, user={}",
                request.getAction(),
                request.getData() == null ? null : request.getData().getConfirmationId(),
                caller == null ? null : caller.getUserId());
        }

        return ToolResponses.toEntity(confirmationService.executeStaged(request.getAction(), request.getData(), caller));
    }
}
