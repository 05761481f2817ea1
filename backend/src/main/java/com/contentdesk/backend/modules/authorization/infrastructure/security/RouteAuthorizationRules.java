package com.contentdesk.backend.modules.authorization.infrastructure.security;

import static com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement.authenticated;
import static com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement.publicAccess;
import static com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement.requireAll;
import static com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement.requireAny;

import java.util.ArrayList;
import java.util.List;

import com.contentdesk.backend.modules.audit.application.AuthorizationAuditRecorder;
import com.contentdesk.backend.modules.authorization.application.AuthorizationDecisionEngine;
import com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement;
import com.contentdesk.backend.modules.permission.domain.OwnedResourceType;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;

import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AuthorizeHttpRequestsConfigurer;
import org.springframework.stereotype.Component;

/**
 * Requirement table for every protected route. Rules are matched top to bottom, so literal paths
 * precede the {@code {id}} patterns that would otherwise swallow them.
 */
@Component
public class RouteAuthorizationRules {

    private static final String PERMISSIONS = "permissions";
    private static final String ROLES = "roles";
    private static final String USERS = "users";
    private static final String ASSIGN_PERMISSIONS = "roles:assign_permissions";

    private final AuthorizationDecisionEngine decisionEngine;
    private final AuthorizationAuditRecorder auditRecorder;
    private final List<RouteRule> rules;

    public RouteAuthorizationRules(AuthorizationDecisionEngine decisionEngine, AuthorizationAuditRecorder auditRecorder) {
        this.decisionEngine = decisionEngine;
        this.auditRecorder = auditRecorder;
        this.rules = buildRules();
    }

    public List<RouteRule> rules() {
        return rules;
    }

    public void apply(AuthorizeHttpRequestsConfigurer<HttpSecurity>.AuthorizationManagerRequestMatcherRegistry registry) {
        for (RouteRule rule : rules) {
            registry.requestMatchers(rule.method(), rule.pattern()).access(managerFor(rule));
        }
        registry.anyRequest().access(managerFor(RouteRule.of(null, "/**", authenticated(), "request", "access")));
    }

    public RequirementAuthorizationManager managerFor(RouteRule rule) {
        return new RequirementAuthorizationManager(decisionEngine, auditRecorder, rule);
    }

    private static List<RouteRule> buildRules() {
        List<RouteRule> rules = new ArrayList<>();
        String superAdmin = PermissionCatalog.SUPER_ADMIN;

        // permission catalog management
        rules.add(RouteRule.of(HttpMethod.GET, "/permissions/options", publicAccess(), PERMISSIONS, "options"));
        rules.add(RouteRule.of(HttpMethod.GET, "/permissions/deleted", requireAll("roles:read"), PERMISSIONS, "view_deleted"));
        rules.add(RouteRule.of(HttpMethod.GET, "/permissions/stats", requireAll("roles:read"), PERMISSIONS, "stats"));
        rules.add(RouteRule.of(HttpMethod.GET, "/permissions/by-category", requireAll("permissions:read"), PERMISSIONS, "read"));
        rules.add(RouteRule.of(HttpMethod.GET, "/permissions/summary", requireAll(superAdmin), PERMISSIONS, "stats"));
        rules.add(RouteRule.of(HttpMethod.GET, "/permissions/holders/{permissionName}", requireAll(superAdmin), PERMISSIONS, "read"));
        rules.add(RouteRule.of(HttpMethod.POST, "/permissions/sync", requireAll(superAdmin), PERMISSIONS, "sync"));
        rules.add(RouteRule.of(HttpMethod.POST, "/permissions/bulk/delete", requireAll("roles:full_access"), PERMISSIONS, "bulk_delete"));
        rules.add(RouteRule.of(HttpMethod.POST, "/permissions/bulk/restore", requireAll("roles:full_access"), PERMISSIONS, "bulk_restore"));
        rules.add(RouteRule.of(HttpMethod.POST, "/permissions/bulk/permanent-delete", requireAll("roles:full_access"), PERMISSIONS, "bulk_permanent_delete"));
        rules.add(RouteRule.of(HttpMethod.GET, "/permissions", requireAll("roles:read"), PERMISSIONS, "read"));
        rules.add(RouteRule.of(HttpMethod.POST, "/permissions", requireAll("roles:create"), PERMISSIONS, "create"));
        rules.add(RouteRule.onInstance(HttpMethod.GET, "/permissions/{id}", requireAll("roles:read"), PERMISSIONS, "read"));
        rules.add(RouteRule.onInstance(HttpMethod.PATCH, "/permissions/{id}", requireAll("roles:update"), PERMISSIONS, "update"));
        rules.add(RouteRule.onInstance(HttpMethod.DELETE, "/permissions/{id}", requireAll("roles:delete"), PERMISSIONS, "delete"));
        rules.add(RouteRule.onInstance(HttpMethod.POST, "/permissions/{id}/restore", requireAll("roles:restore"), PERMISSIONS, "restore"));
        rules.add(RouteRule.onInstance(HttpMethod.DELETE, "/permissions/{id}/permanent", requireAll("roles:full_access"), PERMISSIONS, "permanent_delete"));

        // role permission assignment
        rules.add(RouteRule.of(HttpMethod.GET, "/roles/permissions", requireAll("roles:read"), ROLES, "read"));
        rules.add(RouteRule.onInstance(HttpMethod.GET, "/roles/{id}/permissions", requireAll("roles:read"), ROLES, "read"));
        rules.add(RouteRule.onInstance(HttpMethod.PUT, "/roles/{id}/permissions", requireAny(ASSIGN_PERMISSIONS, "roles:full_access"), ROLES, "assign_permissions"));
        rules.add(RouteRule.onInstance(HttpMethod.POST, "/roles/{id}/permissions/remove", requireAny(ASSIGN_PERMISSIONS, "roles:full_access"), ROLES, "remove_permissions"));

        // user permission lookup
        rules.add(RouteRule.of(HttpMethod.GET, "/me/permissions", authenticated(), USERS, "read_self"));
        rules.add(RouteRule.onInstance(HttpMethod.GET, "/users/{id}/permissions", requireAll("users:read"), USERS, "read"));
        rules.add(RouteRule.onInstance(HttpMethod.GET, "/users/{id}/permissions/check", requireAll("users:read"), USERS, "read"));

        // access checks for the current caller
        rules.add(RouteRule.of(HttpMethod.GET, "/access/{resourceType}/{resourceId}", authenticated(), "access", "check"));
        rules.add(RouteRule.of(HttpMethod.POST, "/access/{resourceType}/bulk", authenticated(), "access", "check_bulk"));

        // content routes served by the content modules; ownership is an alternative to the blanket permission
        for (OwnedResourceType type : OwnedResourceType.values()) {
            String tag = type.tag();
            String instance = "/" + tag + "/{id}";
            rules.add(RouteRule.onInstance(HttpMethod.PATCH, instance, ownedOrPermitted(tag, "update"), tag, "update"));
            rules.add(RouteRule.onInstance(HttpMethod.PUT, instance, ownedOrPermitted(tag, "update"), tag, "update"));
            rules.add(RouteRule.onInstance(HttpMethod.DELETE, instance, ownedOrPermitted(tag, "delete"), tag, "delete"));
            rules.add(RouteRule.onInstance(HttpMethod.POST, instance + "/restore", ownedOrPermitted(tag, "restore"), tag, "restore"));
        }

        rules.add(RouteRule.of(HttpMethod.GET, "/actuator/**", requireAll(superAdmin), "actuator", "read"));
        return List.copyOf(rules);
    }

    private static AuthorizationRequirement ownedOrPermitted(String resourceType, String action) {
        return requireAll(PermissionCatalog.name(resourceType, action)).orOwnership(resourceType);
    }
}
