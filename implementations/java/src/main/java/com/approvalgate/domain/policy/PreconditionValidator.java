package com.approvalgate.domain.policy;

import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.StatusTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks an entity's current status against the transition table.
 *
 * <p>The same predicate is applied when a mutation is proposed and again before
 * it is executed; the guarded write then enforces it transactionally.
 */
@Component
@Slf4j
public class PreconditionValidator {

    /**
     * @param action        requested action
     * @param entityId      id of the target entity, echoed in the violation
     * @param currentStatus status as last read
     * @return the violation, or empty when the action may proceed
     */
    public Optional<PreconditionViolation> validate(MutationAction action, String entityId, String currentStatus) {
        StatusTransition transition = TransitionTable.transitionFor(action);
        if (transition.allows(currentStatus)) {
            return Optional.empty();
        }

        EntityType type = action.getEntityType();

        if (log.isDebugEnabled()) {
            log.debug("Precondition failed: action={}, {}={}, currentStatus={}, allowed={}",
                action, type.getIdField(), entityId, currentStatus, transition.getFromStatuses());
        }

        List<String> allowed = transition.getFromStatuses().stream()
            .sorted()
            .collect(Collectors.toList());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(type.getIdField(), entityId);
        details.put("currentStatus", currentStatus);
        if (transition.isDeletion() || allowed.size() > 1) {
            details.put("allowedStatuses", allowed);
        } else {
            details.put("requiredStatus", allowed.get(0));
        }

        String code = transition.isDeletion() ? type.getCannotDeleteCode() : type.getInvalidStatusCode();
        String message = String.format("Cannot %s %s \"%s\" because it is in \"%s\" status",
            action.getVerb(), type.getLabel(), entityId, currentStatus);

        return Optional.of(new PreconditionViolation(
            code, message, TransitionTable.suggestionFor(action, currentStatus), details));
    }
}
