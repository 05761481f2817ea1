package com.contentdesk.backend.modules.authorization.infrastructure.security;

import com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement;

import org.springframework.http.HttpMethod;

/**
 * One protected route: HTTP method and path pattern, the requirement, and what the audit trail
 * calls the operation. {@code idVariable} names the path variable holding the resource id.
 */
public record RouteRule(
        HttpMethod method,
        String pattern,
        AuthorizationRequirement requirement,
        String resource,
        String action,
        String idVariable
) {

    public static RouteRule of(HttpMethod method, String pattern, AuthorizationRequirement requirement,
                               String resource, String action) {
        return new RouteRule(method, pattern, requirement, resource, action, null);
    }

    public static RouteRule onInstance(HttpMethod method, String pattern, AuthorizationRequirement requirement,
                                       String resource, String action) {
        return new RouteRule(method, pattern, requirement, resource, action, "id");
    }
}
