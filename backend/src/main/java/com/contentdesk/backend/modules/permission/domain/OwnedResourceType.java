package com.contentdesk.backend.modules.permission.domain;

import java.util.Set;

/**
 * 소유권 기반 인가를 지원하는 리소스 종류와 소유자 컬럼.
 */
public enum OwnedResourceType {

    BLOGS("blogs", "blog", "author_id"),
    MEDIA("media", "media", "uploaded_by_id"),
    RECRUITMENT("recruitment", "recruitment_posts", "author_id"),
    COMMENTS("comments", "blog_comments", "author_id", "blogcomments");

    private static final Set<String> OWNERSHIP_ACTIONS = Set.of("update", "delete", "restore");

    private final String tag;
    private final String table;
    private final String ownerColumn;
    private final Set<String> aliases;

    OwnedResourceType(String tag, String table, String ownerColumn, String... aliases) {
        this.tag = tag;
        this.table = table;
        this.ownerColumn = ownerColumn;
        this.aliases = Set.of(aliases);
    }

    public String tag() {
        return tag;
    }

    public String table() {
        return table;
    }

    public String ownerColumn() {
        return ownerColumn;
    }

    /** Alternative tags older clients send for the same resource type. */
    public Set<String> aliases() {
        return aliases;
    }

    public String manageAllPermission() {
        return PermissionCatalog.manageAll(tag);
    }

    public Set<String> ownershipActions() {
        return OWNERSHIP_ACTIONS;
    }

    public boolean isOwnershipAction(String action) {
        return action != null && OWNERSHIP_ACTIONS.contains(action);
    }
}
