package com.approvalgate.infrastructure.security;

import com.approvalgate.domain.model.MutationAction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.approvalgate.infrastructure.security.Roles.EXECUTIVE;
import static com.approvalgate.infrastructure.security.Roles.FINANCE_WRITE;
import static com.approvalgate.infrastructure.security.Roles.HR_WRITE;

/**
 * The action to permitted-role-set matrix. A caller may invoke an action when
 * it holds at least one of the listed roles.
 */
public final class ActionPermissionPolicy {

    private static final Map<MutationAction, Set<String>> PERMITTED_ROLES;

    static {
        Map<MutationAction, Set<String>> table = new EnumMap<>(MutationAction.class);

        Set<String> financeWriters = roles(FINANCE_WRITE, EXECUTIVE);
        table.put(MutationAction.APPROVE_EXPENSE_REPORT, financeWriters);
        table.put(MutationAction.REJECT_EXPENSE_REPORT, financeWriters);
        table.put(MutationAction.REIMBURSE_EXPENSE_REPORT, financeWriters);
        table.put(MutationAction.DELETE_EXPENSE_REPORT, financeWriters);
        table.put(MutationAction.APPROVE_INVOICE, financeWriters);
        table.put(MutationAction.PAY_INVOICE, financeWriters);
        table.put(MutationAction.DELETE_INVOICE, financeWriters);
        table.put(MutationAction.APPROVE_BUDGET, financeWriters);
        table.put(MutationAction.REJECT_BUDGET, financeWriters);
        table.put(MutationAction.DELETE_BUDGET, financeWriters);

        Set<String> hrWriters = roles(HR_WRITE, EXECUTIVE);
        table.put(MutationAction.APPROVE_TIME_OFF_REQUEST, hrWriters);
        table.put(MutationAction.REJECT_TIME_OFF_REQUEST, hrWriters);

        PERMITTED_ROLES = Collections.unmodifiableMap(table);
    }

    private ActionPermissionPolicy() {}

    /**
     * Roles permitted to invoke the action; empty for an action nobody may invoke.
     */
    public static Set<String> permittedRoles(MutationAction action) {
        return PERMITTED_ROLES.getOrDefault(action, Set.of());
    }

    /**
     * Renders a role set the way denial messages phrase it: "finance-write or executive".
     */
    public static String describe(Set<String> roles) {
        return String.join(" or ", roles);
    }

    private static Set<String> roles(String... names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(names)));
    }
}
