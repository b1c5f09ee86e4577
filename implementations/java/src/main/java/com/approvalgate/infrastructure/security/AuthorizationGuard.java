package com.approvalgate.infrastructure.security;

import com.approvalgate.domain.model.MutationAction;

import java.util.Set;

/**
 * Role-based gate in front of every proposal and execution.
 *
 * <p>Consulted before any entity is loaded. Both phases use the same policy.
 */
public interface AuthorizationGuard {

    /**
     * Pure policy lookup with no side effects.
     */
    AuthorizationDecision check(MutationAction action, Set<String> roles);

    /**
     * Enforce the policy for a caller, recording the decision.
     *
     * @throws InsufficientPermissionsException if none of the caller's roles is permitted
     */
    void authorize(MutationAction action, CallerContext context);
}
