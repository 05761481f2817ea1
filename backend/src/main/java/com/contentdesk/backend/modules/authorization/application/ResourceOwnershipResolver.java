package com.contentdesk.backend.modules.authorization.application;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import com.contentdesk.backend.global.config.AsyncConfig;
import com.contentdesk.backend.global.security.AuthenticatedUser;
import com.contentdesk.backend.modules.authorization.domain.OwnershipScope;
import com.contentdesk.backend.modules.authorization.infrastructure.persistence.OwnerLookupRepository;
import com.contentdesk.backend.modules.permission.domain.OwnedResourceType;
import com.contentdesk.backend.modules.permission.domain.PermissionCatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Resolves resource owners for ownership-gated operations. Every failure mode (unknown type,
 * malformed id, missing row, lookup error) resolves to "not owned".
 */
@Service
public class ResourceOwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(ResourceOwnershipResolver.class);

    private final OwnedResourceRegistry registry;
    private final OwnerLookupRepository ownerLookupRepository;
    private final Executor lookupExecutor;

    public ResourceOwnershipResolver(
            OwnedResourceRegistry registry,
            OwnerLookupRepository ownerLookupRepository,
            @Qualifier(AsyncConfig.OWNERSHIP_EXECUTOR) Executor lookupExecutor
    ) {
        this.registry = registry;
        this.ownerLookupRepository = ownerLookupRepository;
        this.lookupExecutor = lookupExecutor;
    }

    public Optional<Long> resolveOwner(String resourceType, String resourceId) {
        Optional<OwnedResourceType> type = registry.find(resourceType);
        Optional<Long> id = parseId(resourceId);
        if (type.isEmpty() || id.isEmpty()) {
            return Optional.empty();
        }
        try {
            return ownerLookupRepository.findOwnerId(type.get(), id.get());
        } catch (DataAccessException ex) {
            log.warn("Owner lookup failed for {}#{}; treating as not owned", resourceType, resourceId, ex);
            return Optional.empty();
        }
    }

    public boolean isOwnedBy(String resourceType, String resourceId, Long userId) {
        if (userId == null) {
            return false;
        }
        return resolveOwner(resourceType, resourceId).map(userId::equals).orElse(false);
    }

    public String canonicalType(String resourceType) {
        return registry.canonicalTag(resourceType);
    }

    public boolean isOwnershipAction(String resourceType, String action) {
        return registry.isOwnershipAction(resourceType, action);
    }

    public boolean hasManageAll(AuthenticatedUser user, String resourceType) {
        return registry.manageAllPermission(resourceType).map(user::holds).orElse(false);
    }

    /**
     * Per-item access for a bulk operation, positionally aligned with {@code resourceIds}.
     *
     * <p>Super admin and manage-all holders get all {@code true} without any lookup. For an
     * ownership-eligible action each id is checked on its own; lookups run concurrently and all of
     * them complete before the result is returned. Any other action is a plain permission check
     * applied uniformly to every item.
     */
    public List<Boolean> resolveBulk(AuthenticatedUser user, String resourceType, String action, List<String> resourceIds) {
        if (resourceIds.isEmpty()) {
            return List.of();
        }
        if (user.holds(PermissionCatalog.SUPER_ADMIN) || hasManageAll(user, resourceType)) {
            return Collections.nCopies(resourceIds.size(), Boolean.TRUE);
        }
        if (!isOwnershipAction(resourceType, action)) {
            boolean permitted = user.holds(PermissionCatalog.name(resourceType, action));
            return Collections.nCopies(resourceIds.size(), permitted);
        }

        List<CompletableFuture<Boolean>> lookups = resourceIds.stream()
                .map(id -> CompletableFuture
                        .supplyAsync(() -> isOwnedBy(resourceType, id, user.userId()), lookupExecutor)
                        .exceptionally(ex -> {
                            log.warn("Bulk owner lookup failed for {}#{}", resourceType, id, ex);
                            return Boolean.FALSE;
                        }))
                .toList();
        CompletableFuture.allOf(lookups.toArray(CompletableFuture[]::new)).join();
        return lookups.stream().map(CompletableFuture::join).toList();
    }

    /**
     * Listing scope for the user: everything for super admin or manage-all, own rows for a known
     * type, nothing for a type without ownership semantics.
     */
    public OwnershipScope scopeFor(AuthenticatedUser user, String resourceType) {
        if (user.holds(PermissionCatalog.SUPER_ADMIN) || hasManageAll(user, resourceType)) {
            return OwnershipScope.unrestricted();
        }
        return registry.find(resourceType)
                .map(type -> OwnershipScope.ownedBy(type.ownerColumn(), user.userId()))
                .orElseGet(OwnershipScope::nothing);
    }

    private Optional<Long> parseId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(resourceId.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
