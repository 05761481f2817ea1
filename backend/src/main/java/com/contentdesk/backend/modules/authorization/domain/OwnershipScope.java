package com.contentdesk.backend.modules.authorization.domain;

import java.util.List;

/**
 * Row filter restricting a listing to what the user may see.
 */
public record OwnershipScope(Kind kind, String ownerColumn, Long ownerId) {

    public enum Kind {
        UNRESTRICTED,
        OWNED_BY,
        NOTHING
    }

    public static OwnershipScope unrestricted() {
        return new OwnershipScope(Kind.UNRESTRICTED, null, null);
    }

    public static OwnershipScope ownedBy(String ownerColumn, Long ownerId) {
        return new OwnershipScope(Kind.OWNED_BY, ownerColumn, ownerId);
    }

    public static OwnershipScope nothing() {
        return new OwnershipScope(Kind.NOTHING, null, null);
    }

    /**
     * SQL predicate for a {@code WHERE} clause; bind {@link #parameters()} in order.
     */
    public String toSqlPredicate() {
        return switch (kind) {
            case UNRESTRICTED -> "1 = 1";
            case OWNED_BY -> ownerColumn + " = ?";
            case NOTHING -> "1 = 0";
        };
    }

    public List<Object> parameters() {
        return kind == Kind.OWNED_BY ? List.of(ownerId) : List.of();
    }
}
