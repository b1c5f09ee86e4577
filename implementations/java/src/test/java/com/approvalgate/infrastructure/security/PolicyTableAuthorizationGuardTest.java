package com.approvalgate.infrastructure.security;

import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.infrastructure.audit.AuditCategory;
import com.approvalgate.infrastructure.audit.AuditEvent;
import com.approvalgate.infrastructure.audit.AuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PolicyTableAuthorizationGuardTest {

    @Mock
    AuditService auditService;

    PolicyTableAuthorizationGuard guard;

    @BeforeEach
    void setUp() {
        guard = new PolicyTableAuthorizationGuard(auditService);
    }

    private CallerContext caller(String... roles) {
        return CallerContext.builder()
            .requestId(UUID.randomUUID())
            .userId("user-1")
            .username("jdoe")
            .roles(Set.of(roles))
            .build();
    }

    @Test
    void finance_write_may_invoke_every_finance_action() {
        for (MutationAction action : MutationAction.values()) {
            boolean finance = "finance".equals(action.getTargetServer());
            assertEquals(finance, guard.check(action, Set.of(Roles.FINANCE_WRITE)).isAllowed(), action.toString());
        }
    }

    @Test
    void executive_may_invoke_every_action() {
        for (MutationAction action : MutationAction.values()) {
            assertTrue(guard.check(action, Set.of(Roles.EXECUTIVE)).isAllowed(), action.toString());
        }
    }

    @Test
    void read_roles_may_invoke_nothing() {
        for (MutationAction action : MutationAction.values()) {
            assertFalse(guard.check(action, Set.of(Roles.FINANCE_READ, Roles.HR_READ)).isAllowed(), action.toString());
        }
    }

    @Test
    void hr_write_is_limited_to_time_off() {
        assertTrue(guard.check(MutationAction.APPROVE_TIME_OFF_REQUEST, Set.of(Roles.HR_WRITE)).isAllowed());
        assertFalse(guard.check(MutationAction.APPROVE_EXPENSE_REPORT, Set.of(Roles.HR_WRITE)).isAllowed());
    }

    @Test
    void denial_names_required_and_actual_roles() {
        InsufficientPermissionsException ex = assertThrows(InsufficientPermissionsException.class,
            () -> guard.authorize(MutationAction.APPROVE_EXPENSE_REPORT, caller(Roles.FINANCE_READ)));

        assertEquals("Access denied. This operation requires finance-write or executive role. You have: finance-read",
            ex.getMessage());
        assertEquals(Set.of(Roles.FINANCE_WRITE, Roles.EXECUTIVE), ex.getRequiredRoles());
        assertEquals(Set.of(Roles.FINANCE_READ), ex.getUserRoles());
        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditService).record(event.capture());
        assertEquals(AuditCategory.AUTHORIZATION, event.getValue().getCategory());
        assertEquals("DENIED", event.getValue().getOutcome());
        assertEquals("approve_expense_report", event.getValue().getAction());
        assertEquals("user-1", event.getValue().getPrincipalId());
        assertEquals("required=finance-write or executive; actual=finance-read", event.getValue().getDetail());
    }

    @Test
    void grant_is_not_written_to_audit_trail() {
        assertDoesNotThrow(() -> guard.authorize(MutationAction.PAY_INVOICE, caller(Roles.FINANCE_WRITE)));
        verify(auditService, never()).record(any());
    }
}
