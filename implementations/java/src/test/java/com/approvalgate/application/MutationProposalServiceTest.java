package com.approvalgate.application;

import com.approvalgate.config.ConfirmationProperties;
import com.approvalgate.config.PerformanceConfiguration.BusinessMetrics;
import com.approvalgate.domain.model.EntitySnapshot;
import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.PendingConfirmation;
import com.approvalgate.domain.policy.PreconditionValidator;
import com.approvalgate.domain.repository.MutableEntityRepository;
import com.approvalgate.infrastructure.audit.AuditService;
import com.approvalgate.infrastructure.confirmation.ConfirmationStore;
import com.approvalgate.infrastructure.confirmation.ConfirmationStoreException;
import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.infrastructure.security.PolicyTableAuthorizationGuard;
import com.approvalgate.interfaces.api.dto.ToolResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MutationProposalServiceTest {

    private static final UUID EXPENSE_ID = UUID.fromString("550e8400-e29b-41d4-a716-446655440000");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    MutableEntityRepository entityRepository;

    @Mock
    ConfirmationStore confirmationStore;

    @Mock
    AuditService auditService;

    @Mock
    BusinessMetrics businessMetrics;

    MutationProposalService service;

    @BeforeEach
    void setUp() {
        service = new MutationProposalService(
            new PolicyTableAuthorizationGuard(auditService),
            entityRepository,
            new PreconditionValidator(),
            confirmationStore,
            new ConfirmationSummaryFormatter(),
            new ConfirmationProperties(),
            auditService,
            businessMetrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CallerContext caller(String... roles) {
        return CallerContext.builder()
            .requestId(UUID.randomUUID())
            .userId("user-42")
            .username("fin.approver")
            .roles(Set.of(roles))
            .email("approver@example.com")
            .build();
    }

    private static EntitySnapshot expense(String status) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", EXPENSE_ID.toString());
        columns.put("employee_id", "emp-7");
        columns.put("expense_date", "2024-04-20");
        columns.put("category", "TRAVEL");
        columns.put("description", "Flight to Denver");
        columns.put("amount", new BigDecimal("1250.50"));
        columns.put("status", status);
        return new EntitySnapshot(EntityType.EXPENSE_REPORT, EXPENSE_ID, status, columns);
    }

    private static Map<String, Object> input(Object... keyValues) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("expenseId", EXPENSE_ID.toString());
        for (int i = 0; i < keyValues.length; i += 2) {
            input.put((String) keyValues[i], keyValues[i + 1]);
        }
        return input;
    }

    @Test
    void approved_expense_reimbursement_is_staged_for_confirmation() {
        CallerContext caller = caller("finance-write");
        when(entityRepository.findById(EntityType.EXPENSE_REPORT, EXPENSE_ID, caller))
            .thenReturn(Optional.of(expense("APPROVED")));

        ToolResponse response = service.propose(MutationAction.REIMBURSE_EXPENSE_REPORT,
            input("paymentReference", "ACH-2291"), caller);

        assertTrue(response.isPendingConfirmation());
        assertTrue(response.getMessage().contains("APPROVED to REIMBURSED"));
        assertTrue(response.getMessage().contains("**Amount:** $1,250.5"));
        assertTrue(response.getMessage().contains("**Payment Reference:** ACH-2291"));

        ArgumentCaptor<PendingConfirmation> staged = ArgumentCaptor.forClass(PendingConfirmation.class);
        verify(confirmationStore).put(staged.capture(), eq(Duration.ofSeconds(300)));

        PendingConfirmation confirmation = staged.getValue();
        assertEquals(response.getConfirmationId(), confirmation.getConfirmationId());
        assertDoesNotThrow(() -> UUID.fromString(confirmation.getConfirmationId()));
        assertEquals("reimburse_expense_report", confirmation.getAction());
        assertEquals("finance", confirmation.getTargetServer());
        assertEquals("user-42", confirmation.getIssuedBy());
        assertEquals(NOW, confirmation.getIssuedAt());
        assertEquals(EXPENSE_ID.toString(), confirmation.getTargetEntityId());
        assertEquals("APPROVED", confirmation.getCapturedStatus());
        assertEquals(Map.of("paymentReference", "ACH-2291"), confirmation.getUserSuppliedFields());
        assertSame(confirmation, response.getConfirmationData());

        verify(businessMetrics).recordProposalStaged("reimburse_expense_report");
    }

    @Test
    void pending_expense_reimbursement_is_rejected_without_staging() {
        CallerContext caller = caller("finance-write");
        when(entityRepository.findById(EntityType.EXPENSE_REPORT, EXPENSE_ID, caller))
            .thenReturn(Optional.of(expense("PENDING")));

        ToolResponse response = service.propose(MutationAction.REIMBURSE_EXPENSE_REPORT, input(), caller);

        assertTrue(response.isError());
        assertEquals("INVALID_EXPENSE_STATUS", response.getCode());
        assertEquals("This expense must be approved first. Use approve_expense_report.",
            response.getSuggestedAction());
        verifyNoInteractions(confirmationStore);
    }

    @Test
    void reimbursed_expense_cannot_be_deleted() {
        CallerContext caller = caller("executive");
        when(entityRepository.findById(EntityType.EXPENSE_REPORT, EXPENSE_ID, caller))
            .thenReturn(Optional.of(expense("REIMBURSED")));

        ToolResponse response = service.propose(MutationAction.DELETE_EXPENSE_REPORT, input(), caller);

        assertEquals("CANNOT_DELETE_EXPENSE", response.getCode());
        assertTrue(response.getSuggestedAction().contains("kept for audit purposes"));
        verifyNoInteractions(confirmationStore);
    }

    @Test
    void read_only_role_is_denied_before_any_load() {
        ToolResponse response = service.propose(MutationAction.APPROVE_EXPENSE_REPORT, input(), caller("finance-read"));

        assertEquals("INSUFFICIENT_PERMISSIONS", response.getCode());
        assertTrue(response.getMessage().contains("finance-write or executive"));
        assertEquals(List.of("finance-write", "executive"), response.getDetails().get("requiredRoles"));
        assertEquals(List.of("finance-read"), response.getDetails().get("userRoles"));
        verifyNoInteractions(entityRepository, confirmationStore);
    }

    @Test
    void denied_for_every_action_outside_role_set() {
        CallerContext caller = caller("hr-write");
        for (MutationAction action : MutationAction.values()) {
            if (!"finance".equals(action.getTargetServer())) {
                continue;
            }
            ToolResponse response = service.propose(action, Map.of(), caller);
            assertEquals("INSUFFICIENT_PERMISSIONS", response.getCode(), action.toString());
        }
        verifyNoInteractions(entityRepository, confirmationStore);
    }

    @Test
    void missing_entity_reports_entity_not_found() {
        CallerContext caller = caller("finance-write");
        when(entityRepository.findById(EntityType.EXPENSE_REPORT, EXPENSE_ID, caller)).thenReturn(Optional.empty());

        ToolResponse response = service.propose(MutationAction.APPROVE_EXPENSE_REPORT, input(), caller);

        assertEquals("EXPENSE_REPORT_NOT_FOUND", response.getCode());
        assertEquals(EXPENSE_ID.toString(), response.getDetails().get("expenseId"));
        assertTrue(response.getSuggestedAction().contains("list_expense_reports"));
        verifyNoInteractions(confirmationStore);
    }

    @Test
    void missing_user_id_or_roles_is_missing_user_context() {
        CallerContext noRoles = CallerContext.builder().userId("user-42").build();

        assertEquals("MISSING_USER_CONTEXT",
            service.propose(MutationAction.APPROVE_INVOICE, input(), noRoles).getCode());
        assertEquals("MISSING_USER_CONTEXT",
            service.propose(MutationAction.APPROVE_INVOICE, input(), null).getCode());
        verifyNoInteractions(entityRepository, confirmationStore);
    }

    @Test
    void invalid_input_is_reported_before_loading() {
        ToolResponse response = service.propose(MutationAction.REJECT_EXPENSE_REPORT,
            input("rejectionReason", "short"), caller("finance-write"));

        assertEquals("INVALID_INPUT", response.getCode());
        assertEquals("rejectionReason", response.getDetails().get("field"));
        verifyNoInteractions(entityRepository, confirmationStore);
    }

    @Test
    void store_failure_fails_closed_as_internal_error() {
        CallerContext caller = caller("finance-write");
        when(entityRepository.findById(EntityType.EXPENSE_REPORT, EXPENSE_ID, caller))
            .thenReturn(Optional.of(expense("PENDING")));
        doThrow(new ConfirmationStoreException("down", new DataAccessResourceFailureException("refused")))
            .when(confirmationStore).put(any(), any());

        ToolResponse response = service.propose(MutationAction.APPROVE_EXPENSE_REPORT, input(), caller);

        assertEquals("INTERNAL_ERROR", response.getCode());
        assertNull(response.getConfirmationId());
        verify(businessMetrics, never()).recordProposalStaged(any());
    }

    @Test
    void each_proposal_gets_a_distinct_confirmation_id() {
        CallerContext caller = caller("finance-write");
        when(entityRepository.findById(EntityType.EXPENSE_REPORT, EXPENSE_ID, caller))
            .thenReturn(Optional.of(expense("PENDING")));

        ToolResponse first = service.propose(MutationAction.APPROVE_EXPENSE_REPORT, input(), caller);
        ToolResponse second = service.propose(MutationAction.APPROVE_EXPENSE_REPORT, input(), caller);

        assertNotEquals(first.getConfirmationId(), second.getConfirmationId());
    }
}
