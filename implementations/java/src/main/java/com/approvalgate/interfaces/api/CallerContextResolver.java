package com.approvalgate.interfaces.api;

import com.approvalgate.infrastructure.security.CallerContext;
import com.approvalgate.interfaces.api.dto.UserContextDto;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds the {@link CallerContext} for a request from what the trusted gateway
 * forwarded: the body's {@code userContext}, or the {@code X-User-*} headers
 * when the body carries none.
 *
 * <p>Returns {@code null} when neither source names a user. Completeness (user
 * id and at least one role) is checked by the handlers.
 */
@Component
public class CallerContextResolver {

    public static final String USER_ID = "X-User-Id";
    public static final String USERNAME = "X-User-Username";
    public static final String EMAIL = "X-User-Email";
    public static final String ROLES = "X-User-Roles";
    public static final String DEPARTMENT_ID = "X-User-Department-Id";
    public static final String MANAGER_ID = "X-User-Manager-Id";

    public CallerContext resolve(UserContextDto body, HttpHeaders headers) {
        if (body != null && hasText(body.getUserId())) {
            return CallerContext.builder()
                .requestId(UUID.randomUUID())
                .userId(body.getUserId().trim())
                .username(body.getUsername())
                .roles(cleanRoles(body.getRoles()))
                .email(body.getEmail())
                .departmentId(body.getDepartmentId())
                .managerId(body.getManagerId())
                .build();
        }

        String userId = headers == null ? null : headers.getFirst(USER_ID);
        if (!hasText(userId)) {
            return null;
        }

        String roles = headers.getFirst(ROLES);
        return CallerContext.builder()
            .requestId(UUID.randomUUID())
            .userId(userId.trim())
            .username(headers.getFirst(USERNAME))
            .roles(cleanRoles(roles == null ? List.of() : Arrays.asList(roles.split(","))))
            .email(headers.getFirst(EMAIL))
            .departmentId(headers.getFirst(DEPARTMENT_ID))
            .managerId(headers.getFirst(MANAGER_ID))
            .build();
    }

    private static List<String> cleanRoles(Collection<String> roles) {
        if (roles == null) {
            return List.of();
        }
        return roles.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(role -> !role.isEmpty())
            .distinct()
            .collect(Collectors.toList());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
