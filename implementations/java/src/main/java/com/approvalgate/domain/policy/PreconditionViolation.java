package com.approvalgate.domain.policy;

import lombok.Value;

import java.util.Map;

/**
 * Why an action cannot be applied to an entity in its current status.
 */
@Value
public class PreconditionViolation {
    String code;
    String message;
    String suggestedAction;
    Map<String, Object> details;
}
