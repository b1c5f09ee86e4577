package com.approvalgate.domain.policy;

import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import com.approvalgate.domain.model.StatusTransition;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-entity status machines and the guidance returned when an action is
 * attempted from a status it does not accept.
 *
 * <p>The transitions themselves come from the {@link MutationAction} catalogue;
 * this table indexes them by entity type and adds the human-readable
 * suggestions for each rejected (action, current status) pair.
 */
public final class TransitionTable {

    private static final Map<EntityType, Map<MutationAction, StatusTransition>> MACHINES;

    private static final Map<MutationAction, Map<String, String>> SUGGESTIONS = new EnumMap<>(MutationAction.class);

    static {
        Map<EntityType, Map<MutationAction, StatusTransition>> machines = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            machines.put(type, Collections.unmodifiableMap(
                Arrays.stream(MutationAction.values())
                    .filter(action -> action.getEntityType() == type)
                    .collect(Collectors.toMap(
                        action -> action,
                        MutationAction::getTransition,
                        (a, b) -> a,
                        () -> new EnumMap<>(MutationAction.class)))));
        }
        MACHINES = Collections.unmodifiableMap(machines);

        // Expense reports
        suggest(MutationAction.APPROVE_EXPENSE_REPORT, "APPROVED",
            "This expense has already been approved. Use reimburse_expense_report to mark it as reimbursed.");
        suggest(MutationAction.APPROVE_EXPENSE_REPORT, "REIMBURSED",
            "This expense has already been reimbursed.");
        suggest(MutationAction.APPROVE_EXPENSE_REPORT, "REJECTED",
            "This expense was rejected. The employee must submit a new expense report.");

        suggest(MutationAction.REJECT_EXPENSE_REPORT, "APPROVED",
            "This expense has already been approved and cannot be rejected.");
        suggest(MutationAction.REJECT_EXPENSE_REPORT, "REIMBURSED",
            "This expense has been reimbursed and cannot be rejected.");
        suggest(MutationAction.REJECT_EXPENSE_REPORT, "REJECTED",
            "This expense has already been rejected.");

        suggest(MutationAction.REIMBURSE_EXPENSE_REPORT, "PENDING",
            "This expense must be approved first. Use approve_expense_report.");
        suggest(MutationAction.REIMBURSE_EXPENSE_REPORT, "REJECTED",
            "This expense was rejected and cannot be reimbursed.");
        suggest(MutationAction.REIMBURSE_EXPENSE_REPORT, "REIMBURSED",
            "This expense has already been reimbursed.");

        suggest(MutationAction.DELETE_EXPENSE_REPORT, "APPROVED",
            "Approved expenses cannot be deleted. They must be reimbursed or archived.");
        suggest(MutationAction.DELETE_EXPENSE_REPORT, "REIMBURSED",
            "Reimbursed expenses cannot be deleted. They are kept for audit purposes.");

        // Invoices
        suggest(MutationAction.APPROVE_INVOICE, "APPROVED",
            "This invoice has already been approved. Use pay_invoice to mark it as paid.");
        suggest(MutationAction.APPROVE_INVOICE, "PAID",
            "This invoice has already been paid.");

        suggest(MutationAction.PAY_INVOICE, "PENDING",
            "This invoice must be approved first. Use approve_invoice.");
        suggest(MutationAction.PAY_INVOICE, "PAID",
            "This invoice has already been paid.");

        suggest(MutationAction.DELETE_INVOICE, "APPROVED",
            "Approved invoices cannot be deleted. They must be paid or cancelled by the vendor.");
        suggest(MutationAction.DELETE_INVOICE, "PAID",
            "Paid invoices cannot be deleted. They are kept for audit purposes.");

        // Budgets
        suggest(MutationAction.APPROVE_BUDGET, "DRAFT",
            "This budget is still a draft. It must be submitted for approval first.");
        suggest(MutationAction.APPROVE_BUDGET, "APPROVED",
            "This budget has already been approved.");
        suggest(MutationAction.APPROVE_BUDGET, "REJECTED",
            "This budget was rejected. It must be revised and resubmitted.");

        suggest(MutationAction.REJECT_BUDGET, "DRAFT",
            "This budget is still a draft and has not been submitted for approval.");
        suggest(MutationAction.REJECT_BUDGET, "APPROVED",
            "This budget has already been approved and cannot be rejected.");
        suggest(MutationAction.REJECT_BUDGET, "REJECTED",
            "This budget has already been rejected.");

        suggest(MutationAction.DELETE_BUDGET, "PENDING_APPROVAL",
            "Budgets awaiting approval cannot be deleted. Use reject_budget instead.");
        suggest(MutationAction.DELETE_BUDGET, "APPROVED",
            "Approved budgets cannot be deleted. They are kept for audit purposes.");

        // Time-off requests
        suggest(MutationAction.APPROVE_TIME_OFF_REQUEST, "APPROVED",
            "This time-off request has already been approved.");
        suggest(MutationAction.APPROVE_TIME_OFF_REQUEST, "REJECTED",
            "This time-off request was rejected. The employee must submit a new request.");
        suggest(MutationAction.APPROVE_TIME_OFF_REQUEST, "CANCELLED",
            "This time-off request was cancelled by the employee.");

        suggest(MutationAction.REJECT_TIME_OFF_REQUEST, "APPROVED",
            "This time-off request has already been approved and cannot be rejected.");
        suggest(MutationAction.REJECT_TIME_OFF_REQUEST, "REJECTED",
            "This time-off request has already been rejected.");
        suggest(MutationAction.REJECT_TIME_OFF_REQUEST, "CANCELLED",
            "This time-off request was cancelled by the employee.");
    }

    private TransitionTable() {}

    private static void suggest(MutationAction action, String currentStatus, String suggestion) {
        SUGGESTIONS.computeIfAbsent(action, key -> new HashMap<>()).put(currentStatus, suggestion);
    }

    /**
     * All actions defined for an entity type, with their transitions.
     */
    public static Map<MutationAction, StatusTransition> machineFor(EntityType type) {
        return MACHINES.get(type);
    }

    public static StatusTransition transitionFor(MutationAction action) {
        return MACHINES.get(action.getEntityType()).get(action);
    }

    /**
     * Guidance for attempting {@code action} from {@code currentStatus}. Falls back
     * to a sentence naming the statuses the action does accept.
     */
    public static String suggestionFor(MutationAction action, String currentStatus) {
        return Optional.ofNullable(SUGGESTIONS.get(action))
            .map(byStatus -> byStatus.get(currentStatus))
            .orElseGet(() -> defaultSuggestion(action));
    }

    static String defaultSuggestion(MutationAction action) {
        String allowed = action.getTransition().getFromStatuses().stream()
            .sorted()
            .collect(Collectors.joining(" or "));
        return "Only " + allowed + " " + action.getEntityType().getLabel() + "s can be "
            + action.getOutcome() + ".";
    }
}
