package com.contentdesk.backend.modules.authorization.application;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.contentdesk.backend.modules.permission.domain.OwnedResourceType;

import org.springframework.stereotype.Component;

/**
 * Single lookup point from a resource type tag to its ownership definition. Tags match
 * case-insensitively and include each type's aliases; tags that are not registered have no
 * ownership semantics.
 */
@Component
public class OwnedResourceRegistry {

    private final Map<String, OwnedResourceType> byTag = indexByTag();

    public Optional<OwnedResourceType> find(String resourceType) {
        if (resourceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byTag.get(resourceType.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Canonical tag for a registered type or alias, otherwise the input unchanged.
     */
    public String canonicalTag(String resourceType) {
        return find(resourceType).map(OwnedResourceType::tag).orElse(resourceType);
    }

    public boolean isOwnershipAction(String resourceType, String action) {
        return find(resourceType).map(type -> type.isOwnershipAction(action)).orElse(false);
    }

    public Optional<String> manageAllPermission(String resourceType) {
        return find(resourceType).map(OwnedResourceType::manageAllPermission);
    }

    private static Map<String, OwnedResourceType> indexByTag() {
        Map<String, OwnedResourceType> index = new HashMap<>();
        for (OwnedResourceType type : OwnedResourceType.values()) {
            index.put(type.tag(), type);
            type.aliases().forEach(alias -> index.put(alias, type));
        }
        return Map.copyOf(index);
    }
}
