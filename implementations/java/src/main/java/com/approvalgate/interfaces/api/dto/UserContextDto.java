package com.approvalgate.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Caller identity as forwarded by the gateway in a request body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserContextDto {
    private String userId;
    private String username;
    private List<String> roles;
    private String email;
    private String departmentId;
    private String managerId;
}
