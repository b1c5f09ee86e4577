package com.approvalgate.infrastructure.security;

import lombok.Value;

import java.util.Set;

@Value
public class AuthorizationDecision {
    boolean allowed;
    Set<String> requiredRoles;
    Set<String> userRoles;
}
