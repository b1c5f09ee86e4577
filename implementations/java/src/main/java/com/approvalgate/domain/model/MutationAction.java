package com.approvalgate.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.approvalgate.domain.model.ColumnAssignment.callerId;
import static com.approvalgate.domain.model.ColumnAssignment.fromInput;
import static com.approvalgate.domain.model.ColumnAssignment.now;
import static com.approvalgate.domain.model.ColumnAssignment.today;
import static com.approvalgate.domain.model.InputField.entityId;
import static com.approvalgate.domain.model.InputField.optionalText;
import static com.approvalgate.domain.model.InputField.requiredText;

/**
 * Catalogue of every state-changing tool.
 *
 * <p>Each action is declared exactly once: the entity it targets, the domain
 * server that owns it, the status transition it applies, the input it accepts
 * and the extra columns its guarded write sets. Handlers never branch on the
 * action name; everything they need is read from here.
 */
public enum MutationAction {

    APPROVE_EXPENSE_REPORT(
        "approve_expense_report", EntityType.EXPENSE_REPORT, "finance",
        "approve", "approved", "✅ **Approve Expense Report?**",
        StatusTransition.to("APPROVED", "PENDING"),
        List.of(entityId("expenseId"), optionalText("approverNotes", "Approver Notes", 500)),
        List.of(callerId("approved_by"), now("approved_at"))),

    REJECT_EXPENSE_REPORT(
        "reject_expense_report", EntityType.EXPENSE_REPORT, "finance",
        "reject", "rejected", "❌ **Reject Expense Report?**",
        StatusTransition.to("REJECTED", "PENDING"),
        List.of(entityId("expenseId"), requiredText("rejectionReason", "Rejection Reason", 10, 500)),
        List.of(fromInput("rejection_reason", "rejectionReason"))),

    REIMBURSE_EXPENSE_REPORT(
        "reimburse_expense_report", EntityType.EXPENSE_REPORT, "finance",
        "reimburse", "marked as reimbursed", "💰 **Mark Expense as Reimbursed?**",
        StatusTransition.to("REIMBURSED", "APPROVED"),
        List.of(entityId("expenseId"),
            optionalText("paymentReference", "Payment Reference", 100),
            optionalText("paymentNotes", "Notes", 500)),
        List.of()),

    DELETE_EXPENSE_REPORT(
        "delete_expense_report", EntityType.EXPENSE_REPORT, "finance",
        "delete", "deleted", "🗑️ **Delete Expense Report?**",
        StatusTransition.deletion("PENDING", "REJECTED"),
        List.of(entityId("expenseId"), optionalText("reason", "Reason", 500)),
        List.of()),

    APPROVE_INVOICE(
        "approve_invoice", EntityType.INVOICE, "finance",
        "approve", "approved", "✅ **Approve Invoice?**",
        StatusTransition.to("APPROVED", "PENDING"),
        List.of(entityId("invoiceId"), optionalText("approverNotes", "Approver Notes", 500)),
        List.of(callerId("approved_by"), now("approved_at"))),

    PAY_INVOICE(
        "pay_invoice", EntityType.INVOICE, "finance",
        "pay", "marked as paid", "💳 **Mark Invoice as Paid?**",
        StatusTransition.to("PAID", "APPROVED"),
        List.of(entityId("invoiceId"),
            optionalText("paymentReference", "Payment Reference", 100),
            optionalText("paymentNotes", "Notes", 500)),
        List.of(today("paid_date"), fromInput("payment_reference", "paymentReference"))),

    DELETE_INVOICE(
        "delete_invoice", EntityType.INVOICE, "finance",
        "delete", "deleted", "🗑️ **Delete Invoice?**",
        StatusTransition.deletion("PENDING"),
        List.of(entityId("invoiceId"), optionalText("reason", "Reason", 500)),
        List.of()),

    APPROVE_BUDGET(
        "approve_budget", EntityType.BUDGET, "finance",
        "approve", "approved", "✅ **Approve Budget?**",
        StatusTransition.to("APPROVED", "PENDING_APPROVAL"),
        List.of(entityId("budgetId"), optionalText("approverNotes", "Approver Notes", 500)),
        List.of(callerId("approved_by"), now("approved_at"))),

    REJECT_BUDGET(
        "reject_budget", EntityType.BUDGET, "finance",
        "reject", "rejected", "❌ **Reject Budget?**",
        StatusTransition.to("REJECTED", "PENDING_APPROVAL"),
        List.of(entityId("budgetId"), requiredText("rejectionReason", "Rejection Reason", 10, 500)),
        List.of(fromInput("rejection_reason", "rejectionReason"))),

    DELETE_BUDGET(
        "delete_budget", EntityType.BUDGET, "finance",
        "delete", "deleted", "🗑️ **Delete Budget?**",
        StatusTransition.deletion("DRAFT"),
        List.of(entityId("budgetId"), optionalText("reason", "Reason", 500)),
        List.of()),

    APPROVE_TIME_OFF_REQUEST(
        "approve_time_off_request", EntityType.TIME_OFF_REQUEST, "hr",
        "approve", "approved", "✅ **Approve Time-Off Request?**",
        StatusTransition.to("APPROVED", "PENDING"),
        List.of(entityId("requestId"), optionalText("approverNotes", "Approver Notes", 500)),
        List.of(callerId("approver_id"), now("approved_at"))),

    REJECT_TIME_OFF_REQUEST(
        "reject_time_off_request", EntityType.TIME_OFF_REQUEST, "hr",
        "reject", "rejected", "❌ **Reject Time-Off Request?**",
        StatusTransition.to("REJECTED", "PENDING"),
        List.of(entityId("requestId"), requiredText("rejectionReason", "Rejection Reason", 10, 500)),
        List.of(callerId("approver_id"), fromInput("rejection_reason", "rejectionReason")));

    private static final Map<String, MutationAction> BY_WIRE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(MutationAction::getWireName, Function.identity()));

    private final String wireName;
    private final EntityType entityType;
    private final String targetServer;
    private final String verb;
    private final String outcome;
    private final String heading;
    private final StatusTransition transition;
    private final List<InputField> inputFields;
    private final List<ColumnAssignment> assignments;

    MutationAction(String wireName, EntityType entityType, String targetServer, String verb,
                   String outcome, String heading, StatusTransition transition,
                   List<InputField> inputFields, List<ColumnAssignment> assignments) {
        this.wireName = wireName;
        this.entityType = entityType;
        this.targetServer = targetServer;
        this.verb = verb;
        this.outcome = outcome;
        this.heading = heading;
        this.transition = transition;
        this.inputFields = inputFields;
        this.assignments = assignments;
    }

    /**
     * Resolve a tool name such as {@code reimburse_expense_report}.
     */
    public static Optional<MutationAction> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    public String getWireName() {
        return wireName;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getTargetServer() {
        return targetServer;
    }

    /** Imperative verb used in error messages ("Cannot reimburse expense ..."). */
    public String getVerb() {
        return verb;
    }

    /** Past-tense outcome used in success messages ("has been marked as reimbursed"). */
    public String getOutcome() {
        return outcome;
    }

    public String getHeading() {
        return heading;
    }

    public StatusTransition getTransition() {
        return transition;
    }

    public List<InputField> getInputFields() {
        return inputFields;
    }

    public List<ColumnAssignment> getAssignments() {
        return assignments;
    }

    public boolean isDeletion() {
        return transition.isDeletion();
    }

    /** Input fields other than the entity id. */
    public List<InputField> getUserSuppliedFields() {
        return inputFields.stream()
            .filter(field -> field.getKind() == InputField.Kind.TEXT)
            .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return wireName;
    }
}
