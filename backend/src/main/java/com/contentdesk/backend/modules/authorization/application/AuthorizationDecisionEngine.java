package com.contentdesk.backend.modules.authorization.application;

import java.util.ArrayList;
import java.util.List;

import com.contentdesk.backend.global.security.AuthenticatedUser;
import com.contentdesk.backend.modules.authorization.domain.AccessDecision;
import com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement;
import com.contentdesk.backend.modules.authorization.domain.GrantPath;
import com.contentdesk.backend.modules.authorization.domain.ResourceTarget;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;

import org.springframework.stereotype.Component;

/**
 * Decides a single protected operation.
 *
 * <ol>
 *   <li>{@code admin:full_access} allows everything, ownership restrictions included.</li>
 *   <li>A public requirement allows.</li>
 *   <li>Holding every all-of permission allows.</li>
 *   <li>Holding any any-of permission allows.</li>
 *   <li>For an ownership requirement, the type's manage-all permission allows, otherwise the
 *       caller must be the resolved owner.</li>
 *   <li>Otherwise deny, listing the missing permissions.</li>
 * </ol>
 *
 * Paths 3 to 5 are alternatives: failing one falls through to the next. The engine has no side
 * effects.
 */
@Component
public class AuthorizationDecisionEngine {

    private final ResourceOwnershipResolver ownershipResolver;

    public AuthorizationDecisionEngine(ResourceOwnershipResolver ownershipResolver) {
        this.ownershipResolver = ownershipResolver;
    }

    public AccessDecision decide(AuthenticatedUser user, AuthorizationRequirement requirement, ResourceTarget target) {
        if (user != null && user.holds(PermissionCatalog.SUPER_ADMIN)) {
            return AccessDecision.grant(GrantPath.SUPER_ADMIN);
        }
        if (requirement.isPublic()) {
            return AccessDecision.grant(GrantPath.PUBLIC);
        }
        if (user == null) {
            return AccessDecision.deny(missingPermissions(null, requirement));
        }
        if (requirement.isAuthenticatedOnly()) {
            return AccessDecision.grant(GrantPath.AUTHENTICATED);
        }
        if (!requirement.allOf().isEmpty() && user.holdsAll(requirement.allOf())) {
            return AccessDecision.grant(GrantPath.ALL_OF);
        }
        if (!requirement.anyOf().isEmpty() && user.holdsAny(requirement.anyOf())) {
            return AccessDecision.grant(GrantPath.ANY_OF);
        }
        if (requirement.requiresOwnership()) {
            String resourceType = requirement.ownershipType();
            if (ownershipResolver.hasManageAll(user, resourceType)) {
                return AccessDecision.grant(GrantPath.MANAGE_ALL);
            }
            String resourceId = target != null ? target.resourceId() : null;
            if (ownershipResolver.isOwnedBy(resourceType, resourceId, user.userId())) {
                return AccessDecision.grant(GrantPath.OWNERSHIP);
            }
        }
        return AccessDecision.deny(missingPermissions(user, requirement));
    }

    public AccessDecision decide(AuthenticatedUser user, AuthorizationRequirement requirement) {
        return decide(user, requirement, null);
    }

    private List<String> missingPermissions(AuthenticatedUser user, AuthorizationRequirement requirement) {
        List<String> missing = new ArrayList<>();
        for (String permission : requirement.allOf()) {
            if (user == null || !user.holds(permission)) {
                missing.add(permission);
            }
        }
        for (String permission : requirement.anyOf()) {
            if (!missing.contains(permission)) {
                missing.add(permission);
            }
        }
        return missing;
    }
}
