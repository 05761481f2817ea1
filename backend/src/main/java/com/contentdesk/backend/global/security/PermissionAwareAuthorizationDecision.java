package com.contentdesk.backend.global.security;

import java.util.List;

import org.springframework.security.authorization.AuthorizationDecision;

/**
 * Spring Security decision that keeps the permissions a denied caller was missing, so the 403
 * response can list them.
 */
public class PermissionAwareAuthorizationDecision extends AuthorizationDecision {

    private final List<String> missingPermissions;

    public PermissionAwareAuthorizationDecision(boolean granted, List<String> missingPermissions) {
        super(granted);
        this.missingPermissions = missingPermissions == null ? List.of() : List.copyOf(missingPermissions);
    }

    public List<String> getMissingPermissions() {
        return missingPermissions;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [granted=" + isGranted() + ", missing=" + missingPermissions + "]";
    }
}
