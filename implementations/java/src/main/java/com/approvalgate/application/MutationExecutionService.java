package com.approvalgate.application;

import com.approvalgate.config.PerformanceConfiguration.BusinessMetrics;
import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.PendingConfirmation;
import com.approvalgate.domain.policy.PreconditionValidator;
import com.approvalgate.domain.policy.PreconditionViolation;
import com.approvalgate.domain.repository.MutableEntityRepository;
import com.approvalgate.infrastructure.audit.AuditCategory;
import com.approvalgate.infrastructure.audit.AuditEvent;
import com.approvalgate.infrastructure.audit.AuditService;
import com.approvalgate.infrastructure.security.AuthorizationGuard;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Execute phase of the confirmation protocol.
 *
 * <p>Runs only after a human approved the confirmation. Authorization is checked
 * again with the same policy as the proposal, and the staged status is checked
 * against the transition table so a tampered payload cannot name an arbitrary
 * source status. The write itself is one conditional statement; when it
 * matches no row the entity is reported as not found, whatever the cause.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MutationExecutionService {

    private final AuthorizationGuard authorizationGuard;
    private final MutableEntityRepository entityRepository;
    private final PreconditionValidator preconditionValidator;
    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;

    public ToolResponse execute(String actionName, PendingConfirmation confirmation, CallerContext context) {
        if (context == null || !context.isComplete()) {
            log.warn("Execution rejected, no user context: action={}", actionName);
            return ToolErrors.missingUserContext();
        }

        Optional<MutationAction> resolved = MutationAction.fromWireName(actionName);
        if (resolved.isEmpty()) {
            log.warn("Execution rejected, unknown action: action={}, user={}", actionName, context.getUserId());
            return ToolErrors.unknownAction(actionName);
        }
        MutationAction action = resolved.get();

        ToolResponse response = ToolErrorHandling.withErrorHandling(
            ToolErrorHandling.EXECUTE_PREFIX + action.getWireName(),
            () -> doExecute(action, confirmation, context));

        businessMetrics.recordExecution(action.getWireName(), outcomeOf(action, response));
        return response;
    }

    private ToolResponse doExecute(MutationAction action, PendingConfirmation confirmation, CallerContext context) {
        authorizationGuard.authorize(action, context);

        EntityType type = action.getEntityType();
        checkPayload(action, confirmation);
        String entityId = confirmation.getTargetEntityId();

        Optional<PreconditionViolation> violation =
            preconditionValidator.validate(action, entityId, confirmation.getCapturedStatus());
        if (violation.isPresent()) {
            log.warn("Execution rejected by precondition: action={}, {}={}, capturedStatus={}, user={}",
                action, type.getIdField(), entityId, confirmation.getCapturedStatus(), context.getUserId());
            return ToolErrors.fromViolation(violation.get());
        }

        Optional<Map<String, Object>> row = entityRepository.applyTransition(action, confirmation, context);

        if (row.isEmpty()) {
            auditExecution(action, confirmation, context, "NOT_FOUND");
            return ToolErrors.notFound(type, entityId);
        }

        Map<String, Object> written = row.get();
        auditExecution(action, confirmation, context, "APPLIED");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("success", true);
        data.put("message", type.describe(written) + " has been " + action.getOutcome());
        data.put(type.getIdField(), written.getOrDefault("id", entityId));
        if (action.isDeletion()) {
            data.put("deleted", true);
        } else {
            data.put("newStatus", action.getTransition().getToStatus());
        }
        return ToolResponse.success(data);
    }

    private void auditExecution(MutationAction action, PendingConfirmation confirmation,
                                CallerContext context, String outcome) {
        auditService.record(AuditEvent.builder()
            .category(AuditCategory.EXECUTION)
            .outcome(outcome)
            .action(action.getWireName())
            .resourceId(confirmation.getTargetEntityId())
            .principalId(context.getUserId())
            .requestId(context.getRequestId())
            .detail("confirmation=" + confirmation.getConfirmationId()
                + " expectedStatus=" + confirmation.getCapturedStatus())
            .build());
    }

    private static void checkPayload(MutationAction action, PendingConfirmation confirmation) {
        if (confirmation == null) {
            throw new InvalidActionInputException("data", "Confirmation data is required");
        }
        if (confirmation.getAction() != null && !confirmation.getAction().equals(action.getWireName())) {
            throw new InvalidActionInputException("action",
                "Confirmation was issued for " + confirmation.getAction() + ", not " + action.getWireName());
        }
        String entityId = confirmation.getTargetEntityId();
        try {
            if (entityId == null || !UUID.fromString(entityId).toString().equalsIgnoreCase(entityId)) {
                throw new InvalidActionInputException("targetEntityId", "targetEntityId must be a valid UUID");
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidActionInputException("targetEntityId", "targetEntityId must be a valid UUID");
        }
        if (confirmation.getCapturedStatus() == null || confirmation.getCapturedStatus().isBlank()) {
            throw new InvalidActionInputException("capturedStatus", "capturedStatus is required");
        }
    }

    private static String outcomeOf(MutationAction action, ToolResponse response) {
        if (response.isSuccess()) {
            return "success";
        }
        if (action.getEntityType().getNotFoundCode().equals(response.getCode())) {
            return "not_found";
        }
        if (ErrorCodes.EXECUTION_FAILED.equals(response.getCode())) {
            return "failed";
        }
        return "rejected";
    }
}
