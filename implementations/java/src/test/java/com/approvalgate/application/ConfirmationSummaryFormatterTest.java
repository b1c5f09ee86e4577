package com.approvalgate.application;

import com.approvalgate.domain.model.EntitySnapshot;
import com.approvalgate.domain.model.EntityType;
import com.approvalgate.domain.model.MutationAction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ConfirmationSummaryFormatterTest {

    private final ConfirmationSummaryFormatter formatter = new ConfirmationSummaryFormatter();

    private static EntitySnapshot invoice(String status) {
        UUID id = UUID.fromString("7d0f5e8a-2222-4b3c-8d4e-000000000002");
        Map<String, Object> columns = new HashMap<>();
        columns.put("vendor_name", "Acme Supplies");
        columns.put("invoice_number", "INV-2024-118");
        columns.put("amount", new BigDecimal("12000.00"));
        columns.put("due_date", null);
        columns.put("status", status);
        return new EntitySnapshot(EntityType.INVOICE, id, status, columns);
    }

    @Test
    void transition_summary_names_both_statuses() {
        String summary = formatter.format(MutationAction.PAY_INVOICE, invoice("APPROVED"),
            Map.of("paymentReference", "WIRE-77"));

        assertTrue(summary.startsWith("💳 **Mark Invoice as Paid?**"));
        assertTrue(summary.contains("**Invoice ID:** 7d0f5e8a-2222-4b3c-8d4e-000000000002"));
        assertTrue(summary.contains("**Vendor:** Acme Supplies"));
        assertTrue(summary.contains("**Amount:** $12,000"));
        assertTrue(summary.contains("**Due Date:** N/A"));
        assertTrue(summary.contains("**Payment Reference:** WIRE-77"));
        assertTrue(summary.endsWith("This will change the invoice status from APPROVED to PAID."));
    }

    @Test
    void deletion_summary_warns_it_cannot_be_undone() {
        String summary = formatter.format(MutationAction.DELETE_INVOICE, invoice("PENDING"), Map.of());

        assertTrue(summary.endsWith("This action will permanently delete this invoice and cannot be undone."));
        assertFalse(summary.contains("**Reason:**"));
    }
}
