package com.approvalgate.interfaces.api;

import com.approvalgate.application.MutationProposalService;
import com.approvalgate.application.ToolErrors;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import com.approvalgate.interfaces.api.dto.UserContextDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutating tools invoked by the AI layer or directly by the UI.
 *
 * <p>Every tool only proposes: the response is a {@code pending_confirmation}
 * (or a structured error) and nothing is written until a human approves.
 */
@RestController
@RequestMapping("/tools")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tools", description = "Propose state-changing actions for human approval")
public class ToolController {

    static final String USER_CONTEXT = "userContext";

    private final MutationProposalService proposalService;
    private final CallerContextResolver callerContextResolver;
    private final ObjectMapper objectMapper;

    /**
     * Propose an action.
     *
     * @param action tool name, e.g. {@code reimburse_expense_report}
     * @param body   {@code userContext} plus the action's own fields
     */
    @PostMapping(
        value = "/{action}",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Propose an action",
        description = "Authorizes, validates the entity's current status and stages a confirmation"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "pending_confirmation, or a structured error",
            content = @Content(schema = @Schema(implementation = ToolResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "No user context on the request, or a malformed one",
            content = @Content(schema = @Schema(implementation = ToolResponse.class))
        )
    })
    public ResponseEntity<ToolResponse> invoke(
            @PathVariable String action,
            @RequestBody(required = false) Map<String, Object> body,
            @RequestHeader HttpHeaders headers) {

        Map<String, Object> input = body == null ? new HashMap<>() : new HashMap<>(body);
        UserContextDto userContext;
        try {
            userContext = Optional.ofNullable(input.remove(USER_CONTEXT))
                .map(raw -> objectMapper.convertValue(raw, UserContextDto.class))
                .orElse(null);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed userContext on tool {}: {}", action, e.getMessage());
            return ResponseEntity.badRequest().body(ToolErrors.invalidInput(USER_CONTEXT,
                "userContext must be an object with a userId string and a roles array"));
        }
        CallerContext caller = callerContextResolver.resolve(userContext, headers);

        Optional<MutationAction> resolved = MutationAction.fromWireName(action);
        if (resolved.isEmpty()) {
            log.warn("Unknown tool requested: {}", action);
            return ToolResponses.toEntity(ToolErrors.unknownAction(action));
        }

        if (log.isInfoEnabled()) {
            log.info("Tool invoked: action={}, user={}", action, caller == null ? null : caller.getUserId());
        }

        return ToolResponses.toEntity(proposalService.propose(resolved.get(), input, caller));
    }
}
