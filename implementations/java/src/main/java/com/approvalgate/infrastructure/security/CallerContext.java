package com.approvalgate.infrastructure.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Immutable identity of the caller for one request.
 *
 * <p>Resolved once at the API edge from trusted gateway input and passed by
 * value through the guard, the session binder and the handlers. Never persisted.
 */
@Value
@Builder
public class CallerContext {
    UUID requestId;
    String userId;
    String username;
    @Singular
    Set<String> roles;
    String email;
    String departmentId;
    String managerId;

    /**
     * A context without a user id or without any role is not trusted.
     */
    public boolean isComplete() {
        return userId != null && !userId.isBlank() && roles != null && !roles.isEmpty();
    }

    public boolean hasAnyRole(Set<String> candidates) {
        return roles.stream().anyMatch(candidates::contains);
    }

    /**
     * Roles joined with commas, in a stable order, as bound into the database session.
     */
    public String rolesAsCsv() {
        return String.join(",", new TreeSet<>(roles));
    }
}
