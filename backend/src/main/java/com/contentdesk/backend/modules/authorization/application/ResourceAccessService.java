package com.contentdesk.backend.modules.authorization.application;

import java.util.Collections;
import java.util.List;

import com.contentdesk.backend.global.error.PermissionDeniedException;
import com.contentdesk.backend.global.security.AuthenticatedUser;
import com.contentdesk.backend.modules.authorization.domain.AccessDecision;
import com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement;
import com.contentdesk.backend.modules.authorization.domain.OwnershipScope;
import com.contentdesk.backend.modules.authorization.domain.ResourceTarget;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;

import org.springframework.stereotype.Service;

/**
 * Entry point for content services that check access on a single resource instance.
 */
@Service
public class ResourceAccessService {

    private final AuthorizationDecisionEngine decisionEngine;
    private final ResourceOwnershipResolver ownershipResolver;

    public ResourceAccessService(
            AuthorizationDecisionEngine decisionEngine,
            ResourceOwnershipResolver ownershipResolver
    ) {
        this.decisionEngine = decisionEngine;
        this.ownershipResolver = ownershipResolver;
    }

    public AccessDecision evaluate(AuthenticatedUser user, String requestedType, String resourceId, String action) {
        String resourceType = ownershipResolver.canonicalType(requestedType);
        AuthorizationRequirement requirement = AuthorizationRequirement.requireAll(PermissionCatalog.name(resourceType, action));
        if (ownershipResolver.isOwnershipAction(resourceType, action)) {
            requirement = requirement.orOwnership(resourceType);
        }
        return decisionEngine.decide(user, requirement, new ResourceTarget(resourceType, resourceId));
    }

    public boolean canAccess(AuthenticatedUser user, String resourceType, String resourceId, String action) {
        return evaluate(user, resourceType, resourceId, action).granted();
    }

    public void requireAccess(AuthenticatedUser user, String resourceType, String resourceId, String action) {
        AccessDecision decision = evaluate(user, resourceType, resourceId, action);
        if (!decision.granted()) {
            throw new PermissionDeniedException(decision.missingPermissions());
        }
    }

    /**
     * Bulk form of {@link #canAccess}, positionally aligned with {@code resourceIds}. Holding the
     * blanket {@code type:action} permission grants every item without any owner lookup.
     */
    public List<Boolean> canAccessEach(AuthenticatedUser user, String requestedType, String action, List<String> resourceIds) {
        String resourceType = ownershipResolver.canonicalType(requestedType);
        if (!resourceIds.isEmpty() && user.holds(PermissionCatalog.name(resourceType, action))) {
            return Collections.nCopies(resourceIds.size(), Boolean.TRUE);
        }
        return ownershipResolver.resolveBulk(user, resourceType, action, resourceIds);
    }

    public OwnershipScope scopeFor(AuthenticatedUser user, String resourceType) {
        return ownershipResolver.scopeFor(user, resourceType);
    }
}
