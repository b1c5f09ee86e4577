package com.approvalgate.domain.model;

import lombok.Value;

import java.util.Set;

/**
 * A legal move in an entity's status machine: from any of {@code fromStatuses}
 * to {@code toStatus}. A transition with no target status removes the row.
 */
@Value
public class StatusTransition {

    Set<String> fromStatuses;
    String toStatus;

    public static StatusTransition to(String toStatus, String... fromStatuses) {
        return new StatusTransition(Set.of(fromStatuses), toStatus);
    }

    public static StatusTransition deletion(String... fromStatuses) {
        return new StatusTransition(Set.of(fromStatuses), null);
    }

    public boolean isDeletion() {
        return toStatus == null;
    }

    public boolean allows(String currentStatus) {
        return currentStatus != null && fromStatuses.contains(currentStatus);
    }
}
