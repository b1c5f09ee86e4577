package com.approvalgate.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.util.List;
import java.util.Map;

/**
 * Row-level-secured business records that can be mutated through the
 * propose/execute protocol.
 *
 * <p>Each type knows its table, the columns loaded for a snapshot, the fields
 * rendered in a confirmation summary and the error codes reported for it.
 * Table and column names are constants; they are the only identifiers ever
 * concatenated into SQL.
 */
public enum EntityType {

    EXPENSE_REPORT(
        "expense",
        "Expense",
        "finance.expenses",
        "expenseId",
        "EXPENSE_REPORT_NOT_FOUND",
        "INVALID_EXPENSE_STATUS",
        "CANNOT_DELETE_EXPENSE",
        "list_expense_reports",
        List.of("id", "employee_id", "department_id", "expense_date", "category",
            "description", "amount", "status", "approved_by", "approved_at"),
        List.of(
            new SummaryField("Category", "category", false),
            new SummaryField("Description", "description", false),
            new SummaryField("Amount", "amount", true),
            new SummaryField("Date", "expense_date", false)
        )
    ) {
        @Override
        public String describe(Map<String, Object> row) {
            return "Expense for " + row.get("description") + " (" + formatMoney(row.get("amount")) + ")";
        }
    },

    INVOICE(
        "invoice",
        "Invoice",
        "finance.invoices",
        "invoiceId",
        "INVOICE_NOT_FOUND",
        "INVALID_INVOICE_STATUS",
        "CANNOT_DELETE_INVOICE",
        "list_invoices",
        List.of("id", "vendor_name", "invoice_number", "amount", "due_date",
            "department_code", "status", "approved_by", "approved_at", "paid_date"),
        List.of(
            new SummaryField("Vendor", "vendor_name", false),
            new SummaryField("Invoice Number", "invoice_number", false),
            new SummaryField("Amount", "amount", true),
            new SummaryField("Due Date", "due_date", false)
        )
    ) {
        @Override
        public String describe(Map<String, Object> row) {
            return "Invoice " + row.get("invoice_number") + " from " + row.get("vendor_name")
                + " (" + formatMoney(row.get("amount")) + ")";
        }
    },

    BUDGET(
        "budget",
        "Budget",
        "finance.department_budgets",
        "budgetId",
        "BUDGET_NOT_FOUND",
        "INVALID_BUDGET_STATUS",
        "CANNOT_DELETE_BUDGET",
        "list_budgets",
        List.of("id", "department_code", "fiscal_year", "category_name",
            "budgeted_amount", "status", "approved_by", "approved_at"),
        List.of(
            new SummaryField("Department", "department_code", false),
            new SummaryField("Fiscal Year", "fiscal_year", false),
            new SummaryField("Category", "category_name", false),
            new SummaryField("Budgeted Amount", "budgeted_amount", true)
        )
    ) {
        @Override
        public String describe(Map<String, Object> row) {
            return "Budget for " + row.get("department_code") + " FY" + row.get("fiscal_year")
                + " (" + formatMoney(row.get("budgeted_amount")) + ")";
        }
    },

    TIME_OFF_REQUEST(
        "time-off request",
        "Time-Off Request",
        "hr.time_off_requests",
        "requestId",
        "TIME_OFF_REQUEST_NOT_FOUND",
        "INVALID_TIME_OFF_STATUS",
        "CANNOT_DELETE_TIME_OFF_REQUEST",
        "list_time_off_requests",
        List.of("id", "employee_id", "type_code", "start_date", "end_date",
            "total_days", "status", "approver_id", "approved_at"),
        List.of(
            new SummaryField("Type", "type_code", false),
            new SummaryField("Start Date", "start_date", false),
            new SummaryField("End Date", "end_date", false),
            new SummaryField("Total Days", "total_days", false)
        )
    ) {
        @Override
        public String describe(Map<String, Object> row) {
            return "Time-off request (" + row.get("type_code") + ", " + row.get("start_date")
                + " to " + row.get("end_date") + ")";
        }
    };

    private final String label;
    private final String title;
    private final String table;
    private final String idField;
    private final String notFoundCode;
    private final String invalidStatusCode;
    private final String cannotDeleteCode;
    private final String listTool;
    private final List<String> columns;
    private final List<SummaryField> summaryFields;

    EntityType(String label, String title, String table, String idField, String notFoundCode,
               String invalidStatusCode, String cannotDeleteCode, String listTool,
               List<String> columns, List<SummaryField> summaryFields) {
        this.label = label;
        this.title = title;
        this.table = table;
        this.idField = idField;
        this.notFoundCode = notFoundCode;
        this.invalidStatusCode = invalidStatusCode;
        this.cannotDeleteCode = cannotDeleteCode;
        this.listTool = listTool;
        this.columns = columns;
        this.summaryFields = summaryFields;
    }

    /**
     * One-line human description of a loaded or returned row, used in success messages.
     */
    public abstract String describe(Map<String, Object> row);

    /** Lower-case noun used in sentences ("expense", "invoice"). */
    public String getLabel() {
        return label;
    }

    /** Capitalised noun used in headings. */
    public String getTitle() {
        return title;
    }

    public String getTable() {
        return table;
    }

    /** Name of the input/output field carrying the entity id, e.g. {@code expenseId}. */
    public String getIdField() {
        return idField;
    }

    public String getNotFoundCode() {
        return notFoundCode;
    }

    public String getInvalidStatusCode() {
        return invalidStatusCode;
    }

    public String getCannotDeleteCode() {
        return cannotDeleteCode;
    }

    public String getListTool() {
        return listTool;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<SummaryField> getSummaryFields() {
        return summaryFields;
    }

    /**
     * Formats an amount the way the UI shows it: {@code $1,234.5}.
     */
    public static String formatMoney(Object amount) {
        if (amount == null) {
            return "$0";
        }
        BigDecimal value = amount instanceof BigDecimal
            ? (BigDecimal) amount
            : new BigDecimal(amount.toString());
        return "$" + new DecimalFormat("#,##0.##").format(value);
    }

    /**
     * A labelled column shown in the confirmation summary.
     */
    @Value
    public static class SummaryField {
        String label;
        String column;
        boolean money;
    }
}
