package com.approvalgate.application;

import com.approvalgate.config.ConfirmationProperties;
import com.approvalgate.config.PerformanceConfiguration.BusinessMetrics;
import com.approvalgate.domain.model.EntitySnapshot;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.PendingConfirmation;
import com.approvalgate.domain.policy.PreconditionValidator;
import com.approvalgate.domain.policy.PreconditionViolation;
import com.approvalgate.domain.repository.MutableEntityRepository;
import com.approvalgate.infrastructure.audit.AuditCategory;
import com.approvalgate.infrastructure.audit.AuditEvent;
import com.approvalgate.infrastructure.audit.AuditService;
import com.approvalgate.infrastructure.confirmation.ConfirmationStore;
import com.approvalgate.infrastructure.security.AuthorizationGuard;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Propose phase of the confirmation protocol, shared by every mutating tool.
 *
 * <p>Sequence:
 * <ol>
 *   <li>authorize the caller for the action</li>
 *   <li>validate the tool input</li>
 *   <li>load the entity inside an RLS-bound read</li>
 *   <li>check the entity's status against the transition table</li>
 *   <li>stage a {@link PendingConfirmation} under a fresh random id</li>
 *   <li>return a {@code pending_confirmation} response describing the change</li>
 * </ol>
 *
 * <p>Nothing is written to the business tables here. A failure at any step
 * stages nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MutationProposalService {

    private final AuthorizationGuard authorizationGuard;
    private final MutableEntityRepository entityRepository;
    private final PreconditionValidator preconditionValidator;
    private final ConfirmationStore confirmationStore;
    private final ConfirmationSummaryFormatter summaryFormatter;
    private final ConfirmationProperties confirmationProperties;
    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    public ToolResponse propose(MutationAction action, Map<String, Object> input, CallerContext context) {
        if (context == null || !context.isComplete()) {
            log.warn("Proposal rejected, no user context: action={}", action);
            return ToolErrors.missingUserContext();
        }

        return ToolErrorHandling.withErrorHandling(action.getWireName(), () -> {
            authorizationGuard.authorize(action, context);

            ActionInput actionInput = ActionInput.parse(action, input);
            UUID entityId = actionInput.getEntityId();

            Optional<EntitySnapshot> loaded = entityRepository.findById(action.getEntityType(), entityId, context);
            if (loaded.isEmpty()) {
                log.info("Proposal target not found: action={}, {}={}, user={}",
                    action, action.getEntityType().getIdField(), entityId, context.getUserId());
                return ToolErrors.notFound(action.getEntityType(), entityId.toString());
            }
            EntitySnapshot entity = loaded.get();

            Optional<PreconditionViolation> violation =
                preconditionValidator.validate(action, entityId.toString(), entity.getStatus());
            if (violation.isPresent()) {
                log.info("Proposal rejected by precondition: action={}, {}={}, status={}",
                    action, action.getEntityType().getIdField(), entityId, entity.getStatus());
                return ToolErrors.fromViolation(violation.get());
            }

            PendingConfirmation confirmation = PendingConfirmation.builder()
                .confirmationId(UUID.randomUUID().toString())
                .action(action.getWireName())
                .targetServer(action.getTargetServer())
                .issuedBy(context.getUserId())
                .issuedAt(Instant.now(clock))
                .targetEntityId(entityId.toString())
                .capturedStatus(entity.getStatus())
                .userSuppliedFields(actionInput.getUserSuppliedFields())
                .entity(entity.getColumns())
                .build();

            confirmationStore.put(confirmation, confirmationProperties.getTtl());

            log.info("Confirmation staged: id={}, action={}, {}={}, capturedStatus={}, user={}",
                confirmation.getConfirmationId(), action, action.getEntityType().getIdField(),
                entityId, entity.getStatus(), context.getUserId());
            businessMetrics.recordProposalStaged(action.getWireName());
            auditService.record(AuditEvent.builder()
                .category(AuditCategory.CONFIRMATION)
                .outcome("STAGED")
                .action(action.getWireName())
                .resourceId(confirmation.getConfirmationId())
                .principalId(context.getUserId())
                .requestId(context.getRequestId())
                .detail(action.getEntityType().getIdField() + "=" + entityId
                    + " capturedStatus=" + entity.getStatus())
                .build());

            return ToolResponse.pendingConfirmation(
                confirmation.getConfirmationId(),
                summaryFormatter.format(action, entity, actionInput.getUserSuppliedFields()),
                confirmation);
        });
    }
}
