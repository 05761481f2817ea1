package com.contentdesk.backend.modules.authorization.domain;

import java.util.List;

/**
 * Outcome of one authorization check. A denial lists the permissions that were required but not
 * held; it never says whether an ownership path was attempted.
 */
public record AccessDecision(boolean granted, GrantPath grantedBy, List<String> missingPermissions) {

    public AccessDecision {
        missingPermissions = missingPermissions == null ? List.of() : List.copyOf(missingPermissions);
    }

    public static AccessDecision grant(GrantPath path) {
        return new AccessDecision(true, path, List.of());
    }

    public static AccessDecision deny(List<String> missingPermissions) {
        return new AccessDecision(false, null, missingPermissions);
    }
}
