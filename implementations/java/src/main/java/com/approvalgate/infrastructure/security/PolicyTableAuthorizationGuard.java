package com.approvalgate.infrastructure.security;

import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.infrastructure.audit.AuditCategory;
import com.approvalgate.infrastructure.audit.AuditEvent;
import com.approvalgate.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Set;

/**
 * Central authorization enforcement point for mutating tools.
 *
 * <p>Every decision is made from {@link ActionPermissionPolicy}; there are no
 * per-action permission checks anywhere else. Grants and denials are logged and
 * written to the audit trail so the permission matrix can be reviewed from
 * production traffic.
 *
 * <p>Security-critical: changes to this class or to the policy table need a
 * security review.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyTableAuthorizationGuard implements AuthorizationGuard {

    private final AuditService auditService;

    @Override
    public AuthorizationDecision check(MutationAction action, Set<String> roles) {
        Set<String> required = ActionPermissionPolicy.permittedRoles(action);
        boolean allowed = roles.stream().anyMatch(required::contains);
        return new AuthorizationDecision(allowed, required, roles);
    }

    @Override
    public void authorize(MutationAction action, CallerContext context) {
        log.debug("Authorization check [{}]: user={}, action={}, roles={}",
            context.getRequestId(), context.getUserId(), action, context.getRoles());

        AuthorizationDecision decision = check(action, context.getRoles());

        if (!decision.isAllowed()) {
            log.warn("AUTHORIZATION DENIED [{}]: Role check failed - user={}, action={}, required={}, actual={}",
                context.getRequestId(), context.getUserId(), action,
                decision.getRequiredRoles(), decision.getUserRoles());

            auditAuthorizationDenial(context, action, decision);

            throw new InsufficientPermissionsException(decision.getRequiredRoles(), decision.getUserRoles());
        }

        log.info("AUTHORIZATION GRANTED [{}]: user={}, action={}",
            context.getRequestId(), context.getUserId(), action);
    }

    /**
     * Denials go to the audit trail with the full role picture.
     */
    private void auditAuthorizationDenial(CallerContext context, MutationAction action, AuthorizationDecision decision) {
        log.warn("AUDIT: Authorization denied - user={}, action={}, requestId={}, timestamp={}",
            context.getUserId(), action, context.getRequestId(), Instant.now());

        auditService.record(AuditEvent.builder()
            .category(AuditCategory.AUTHORIZATION)
            .outcome("DENIED")
            .action(action.getWireName())
            .principalId(context.getUserId())
            .requestId(context.getRequestId())
            .detail("required=" + ActionPermissionPolicy.describe(decision.getRequiredRoles())
                + "; actual=" + context.rolesAsCsv())
            .build());
    }
}
