package com.approvalgate.infrastructure.security;

import lombok.Getter;

import java.util.Set;

/**
 * Thrown when the caller's roles do not include any role permitted for an action.
 */
@Getter
public class InsufficientPermissionsException extends RuntimeException {

    private final Set<String> requiredRoles;
    private final Set<String> userRoles;

    public InsufficientPermissionsException(Set<String> requiredRoles, Set<String> userRoles) {
        super("Access denied. This operation requires " + ActionPermissionPolicy.describe(requiredRoles)
            + " role. You have: " + (userRoles.isEmpty() ? "no roles" : String.join(", ", userRoles)));
        this.requiredRoles = requiredRoles;
        this.userRoles = userRoles;
    }
}
