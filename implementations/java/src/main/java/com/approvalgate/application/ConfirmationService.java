package com.approvalgate.application;

import com.approvalgate.config.ConfirmationProperties;
import com.approvalgate.config.PerformanceConfiguration.BusinessMetrics;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.PendingConfirmation;
import com.approvalgate.infrastructure.audit.AuditCategory;
import com.approvalgate.infrastructure.audit.AuditEvent;
import com.approvalgate.infrastructure.audit.AuditService;
import com.approvalgate.infrastructure.confirmation.ConfirmationStore;
import com.approvalgate.infrastructure.confirmation.ConfirmationStoreException;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies a human's decision to a staged confirmation.
 *
 * <p>A confirmation can only be decided by the user it was issued to. Approval
 * consumes it atomically before execution, so a replayed or concurrent approval
 * of the same id finds nothing. Unknown, expired and foreign ids all yield the
 * same not-found response. When the write itself fails the confirmation is put
 * back for the rest of its staging window so the approval can be retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfirmationService {

    static final String OPERATION = "confirm_action";

    private final ConfirmationStore confirmationStore;
    private final MutationExecutionService executionService;
    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;
    private final ConfirmationProperties confirmationProperties;
    private final Clock clock;

    /**
     * Approve or cancel by confirmation id ({@code POST /confirm/{id}}).
     */
    public ToolResponse confirm(String confirmationId, boolean approved, CallerContext context) {
        if (context == null || !context.isComplete()) {
            log.warn("Confirmation rejected, no user context: id={}", confirmationId);
            return ToolErrors.missingUserContext();
        }

        return ToolErrorHandling.withErrorHandling(OPERATION, () -> {
            Optional<PendingConfirmation> staged = confirmationStore.get(confirmationId)
                .filter(confirmation -> context.getUserId().equals(confirmation.getIssuedBy()));
            if (staged.isEmpty()) {
                log.info("Confirmation not found or not owned: id={}, user={}", confirmationId, context.getUserId());
                return ToolErrors.confirmationNotFound(confirmationId);
            }

            if (!approved) {
                return cancel(staged.get(), context);
            }

            Optional<PendingConfirmation> consumed = confirmationStore.take(confirmationId);
            if (consumed.isEmpty()) {
                log.info("Confirmation consumed concurrently: id={}, user={}", confirmationId, context.getUserId());
                return ToolErrors.confirmationNotFound(confirmationId);
            }

            PendingConfirmation confirmation = consumed.get();
            log.info("Confirmation approved: id={}, action={}, user={}",
                confirmationId, confirmation.getAction(), context.getUserId());
            return executeConsumed(confirmation, context);
        });
    }

    /**
     * Execute an approved confirmation payload ({@code POST /execute}).
     *
     * <p>The payload only names the confirmation. It runs only if the store still
     * holds a record staged for this caller with the same action, entity and
     * captured status, and that record is what gets executed. Anything else,
     * including an expired or already executed confirmation, is reported as the
     * entity not being found.
     */
    public ToolResponse executeStaged(String actionName, PendingConfirmation payload, CallerContext context) {
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

        if (payload == null) {
            return ToolErrors.invalidInput("data", "Confirmation data is required");
        }
        if (payload.getConfirmationId() == null || payload.getConfirmationId().isBlank()) {
            return ToolErrors.invalidInput("confirmationId", "confirmationId is required");
        }
        String confirmationId = payload.getConfirmationId();

        return ToolErrorHandling.withErrorHandling(ToolErrorHandling.EXECUTE_PREFIX + action.getWireName(), () -> {
            Optional<PendingConfirmation> staged = confirmationStore.get(confirmationId)
                .filter(confirmation -> matches(confirmation, payload, action, context));
            if (staged.isEmpty()) {
                log.warn("Execution rejected, no matching staged confirmation: id={}, action={}, user={}",
                    confirmationId, action, context.getUserId());
                businessMetrics.recordExecution(action.getWireName(), "not_found");
                return ToolErrors.notFound(action.getEntityType(), payload.getTargetEntityId());
            }

            Optional<PendingConfirmation> consumed = confirmationStore.take(confirmationId);
            if (consumed.isEmpty()) {
                log.info("Confirmation consumed concurrently: id={}, user={}", confirmationId, context.getUserId());
                businessMetrics.recordExecution(action.getWireName(), "not_found");
                return ToolErrors.notFound(action.getEntityType(), payload.getTargetEntityId());
            }
            return executeConsumed(consumed.get(), context);
        });
    }

    private static boolean matches(PendingConfirmation staged, PendingConfirmation payload,
                                   MutationAction action, CallerContext context) {
        return action.getWireName().equals(staged.getAction())
            && context.getUserId().equals(staged.getIssuedBy())
            && Objects.equals(staged.getIssuedBy(), payload.getIssuedBy())
            && Objects.equals(staged.getTargetEntityId(), payload.getTargetEntityId())
            && Objects.equals(staged.getCapturedStatus(), payload.getCapturedStatus());
    }

    private ToolResponse executeConsumed(PendingConfirmation confirmation, CallerContext context) {
        ToolResponse response = executionService.execute(confirmation.getAction(), confirmation, context);
        if (ErrorCodes.EXECUTION_FAILED.equals(response.getCode())) {
            restore(confirmation);
        }
        return response;
    }

    /**
     * Puts a consumed confirmation back after a failed write. The compare-and-swap
     * still admits at most one successful execution.
     */
    private void restore(PendingConfirmation confirmation) {
        Instant expiresAt = confirmation.getIssuedAt() == null
            ? Instant.EPOCH
            : confirmation.getIssuedAt().plus(confirmationProperties.getTtl());
        Duration remaining = Duration.between(Instant.now(clock), expiresAt);
        if (remaining.isNegative() || remaining.isZero()) {
            log.info("Failed confirmation not restored, staging window over: id={}", confirmation.getConfirmationId());
            return;
        }
        try {
            confirmationStore.put(confirmation, remaining);
            log.info("Confirmation restored after failed execution: id={}, remaining={}s",
                confirmation.getConfirmationId(), remaining.toSeconds());
        } catch (ConfirmationStoreException e) {
            log.error("Could not restore confirmation {} after failed execution; it cannot be retried",
                confirmation.getConfirmationId(), e);
        }
    }

    private ToolResponse cancel(PendingConfirmation confirmation, CallerContext context) {
        confirmationStore.remove(confirmation.getConfirmationId());

        log.info("Confirmation cancelled: id={}, action={}, user={}",
            confirmation.getConfirmationId(), confirmation.getAction(), context.getUserId());
        businessMetrics.recordCancellation(confirmation.getAction());
        auditService.record(AuditEvent.builder()
            .category(AuditCategory.CONFIRMATION)
            .outcome("CANCELLED")
            .action(confirmation.getAction())
            .resourceId(confirmation.getConfirmationId())
            .principalId(context.getUserId())
            .requestId(context.getRequestId())
            .detail("targetEntityId=" + confirmation.getTargetEntityId())
            .build());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "cancelled");
        data.put("confirmationId", confirmation.getConfirmationId());
        data.put("message", "Action cancelled. No changes were made.");
        return ToolResponse.success(data);
    }
}
