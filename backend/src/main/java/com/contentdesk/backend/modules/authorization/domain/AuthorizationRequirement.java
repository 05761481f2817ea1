package com.contentdesk.backend.modules.authorization.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static access contract declared on a protected operation.
 *
 * <p>The populated paths are alternatives: holding every {@link #allOf()} permission, holding any
 * {@link #anyOf()} permission, or owning the targeted {@link #ownershipType()} resource each suffice
 * on their own. A requirement with no path at all is public.
 */
public final class AuthorizationRequirement {

    private static final AuthorizationRequirement PUBLIC = new AuthorizationRequirement(List.of(), List.of(), null, true);
    private static final AuthorizationRequirement AUTHENTICATED = new AuthorizationRequirement(List.of(), List.of(), null, false);

    private final List<String> allOf;
    private final List<String> anyOf;
    private final String ownershipType;
    private final boolean publicAccess;

    private AuthorizationRequirement(List<String> allOf, List<String> anyOf, String ownershipType, boolean publicAccess) {
        this.allOf = List.copyOf(allOf);
        this.anyOf = List.copyOf(anyOf);
        this.ownershipType = ownershipType;
        this.publicAccess = publicAccess;
    }

    public static AuthorizationRequirement publicAccess() {
        return PUBLIC;
    }

    /**
     * Any verified identity passes; no permission is checked.
     */
    public static AuthorizationRequirement authenticated() {
        return AUTHENTICATED;
    }

    public static AuthorizationRequirement requireAll(String... permissions) {
        return new AuthorizationRequirement(nonEmpty(permissions), List.of(), null, false);
    }

    public static AuthorizationRequirement requireAny(String... permissions) {
        return new AuthorizationRequirement(List.of(), nonEmpty(permissions), null, false);
    }

    public static AuthorizationRequirement requireOwnership(String resourceType) {
        return new AuthorizationRequirement(List.of(), List.of(), requireType(resourceType), false);
    }

    public AuthorizationRequirement orAny(String... permissions) {
        return new AuthorizationRequirement(allOf, nonEmpty(permissions), ownershipType, false);
    }

    public AuthorizationRequirement orOwnership(String resourceType) {
        return new AuthorizationRequirement(allOf, anyOf, requireType(resourceType), false);
    }

    public List<String> allOf() {
        return allOf;
    }

    public List<String> anyOf() {
        return anyOf;
    }

    public String ownershipType() {
        return ownershipType;
    }

    public boolean isPublic() {
        return publicAccess;
    }

    public boolean requiresOwnership() {
        return ownershipType != null;
    }

    /**
     * No permission and no ownership path; only an identity is needed.
     */
    public boolean isAuthenticatedOnly() {
        return !publicAccess && allOf.isEmpty() && anyOf.isEmpty() && ownershipType == null;
    }

    private static List<String> nonEmpty(String... permissions) {
        if (permissions == null || permissions.length == 0) {
            throw new IllegalArgumentException("At least one permission must be declared");
        }
        return Arrays.stream(permissions).map(Objects::requireNonNull).toList();
    }

    private static String requireType(String resourceType) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("Ownership requirement needs a resource type");
        }
        return resourceType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuthorizationRequirement that)) {
            return false;
        }
        return publicAccess == that.publicAccess
                && allOf.equals(that.allOf)
                && anyOf.equals(that.anyOf)
                && Objects.equals(ownershipType, that.ownershipType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allOf, anyOf, ownershipType, publicAccess);
    }

    @Override
    public String toString() {
        if (publicAccess) {
            return "public";
        }
        return "AuthorizationRequirement{allOf=" + allOf + ", anyOf=" + anyOf + ", ownership=" + ownershipType + "}";
    }
}
