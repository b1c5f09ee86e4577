package com.approvalgate.domain.policy;

import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.StatusTransition;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransitionTableTest {

    @Test
    void expense_machine_contains_every_expense_action() {
        Map<MutationAction, StatusTransition> machine = TransitionTable.machineFor(EntityType.EXPENSE_REPORT);

        assertEquals(Set.of(
            MutationAction.APPROVE_EXPENSE_REPORT,
            MutationAction.REJECT_EXPENSE_REPORT,
            MutationAction.REIMBURSE_EXPENSE_REPORT,
            MutationAction.DELETE_EXPENSE_REPORT), machine.keySet());
        assertEquals("REIMBURSED", machine.get(MutationAction.REIMBURSE_EXPENSE_REPORT).getToStatus());
        assertEquals(Set.of("APPROVED"), machine.get(MutationAction.REIMBURSE_EXPENSE_REPORT).getFromStatuses());
    }

    @Test
    void every_action_belongs_to_exactly_one_machine() {
        int total = 0;
        for (EntityType type : EntityType.values()) {
            total += TransitionTable.machineFor(type).size();
        }
        assertEquals(MutationAction.values().length, total);
    }

    @Test
    void deletions_have_no_target_status() {
        assertTrue(TransitionTable.transitionFor(MutationAction.DELETE_EXPENSE_REPORT).isDeletion());
        assertTrue(TransitionTable.transitionFor(MutationAction.DELETE_INVOICE).isDeletion());
        assertTrue(TransitionTable.transitionFor(MutationAction.DELETE_BUDGET).isDeletion());
        assertFalse(TransitionTable.transitionFor(MutationAction.PAY_INVOICE).isDeletion());
    }

    @Test
    void reimburse_from_pending_suggests_approving_first() {
        assertEquals("This expense must be approved first. Use approve_expense_report.",
            TransitionTable.suggestionFor(MutationAction.REIMBURSE_EXPENSE_REPORT, "PENDING"));
    }

    @Test
    void unlisted_status_falls_back_to_allowed_statuses() {
        assertEquals("Only PENDING or REJECTED expenses can be deleted.",
            TransitionTable.suggestionFor(MutationAction.DELETE_EXPENSE_REPORT, "ARCHIVED"));
        assertEquals("Only APPROVED invoices can be marked as paid.",
            TransitionTable.suggestionFor(MutationAction.PAY_INVOICE, "VOID"));
    }
}
