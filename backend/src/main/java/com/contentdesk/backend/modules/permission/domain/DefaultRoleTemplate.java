package com.contentdesk.backend.modules.permission.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * 초기 역할 템플릿. 역할 이름과 표시 그룹, 기본으로 부여되는 권한 목록으로 구성된다.
 */
public record DefaultRoleTemplate(String name, String description, String group, List<String> permissions) {

    public static final String SUPER_ADMIN = "Super Admin";
    public static final String ADMIN = "Admin";
    public static final String EDITOR = "Editor";
    public static final String AUTHOR = "Author";
    public static final String VIEWER = "Viewer";

    private static final List<String> EDITORIAL_RESOURCES = List.of("blogs", "categories", "tags", "media", "comments");

    public DefaultRoleTemplate {
        permissions = List.copyOf(permissions);
    }

    public static List<DefaultRoleTemplate> defaults() {
        return List.of(
                new DefaultRoleTemplate(SUPER_ADMIN, "Unrestricted access to every operation", "admin",
                        List.of(PermissionCatalog.SUPER_ADMIN)),
                new DefaultRoleTemplate(ADMIN, "Manages every resource without the super admin bypass", "admin",
                        adminPermissions()),
                new DefaultRoleTemplate(EDITOR, "Edits and moderates all editorial content", "content",
                        editorPermissions()),
                new DefaultRoleTemplate(AUTHOR, "Writes blogs and uploads media, edits own content", "content",
                        authorPermissions()),
                new DefaultRoleTemplate(VIEWER, "Reads published content", "content",
                        viewerPermissions())
        );
    }

    private static List<String> adminPermissions() {
        return PermissionCatalog.allPermissions().stream()
                .filter(name -> !PermissionCatalog.isReserved(name))
                .toList();
    }

    private static List<String> editorPermissions() {
        List<String> names = new ArrayList<>();
        for (String resource : EDITORIAL_RESOURCES) {
            for (String action : List.of("create", "read", "update", "delete", "restore", "view_deleted")) {
                names.add(PermissionCatalog.name(resource, action));
            }
        }
        names.add("blogs:publish");
        names.add("blogs:unpublish");
        names.add(PermissionCatalog.manageAll("blogs"));
        names.add(PermissionCatalog.manageAll("media"));
        names.add(PermissionCatalog.manageAll("comments"));
        names.add("content_types:create");
        names.add("content_types:read");
        names.add("media:upload");
        names.add("status:read");
        return names;
    }

    private static List<String> authorPermissions() {
        return List.of(
                "blogs:create",
                "blogs:read",
                "media:create",
                "media:upload",
                "media:read",
                "content_types:read",
                "categories:read",
                "tags:read",
                "comments:create",
                "comments:read"
        );
    }

    private static List<String> viewerPermissions() {
        return List.of(
                "blogs:read",
                "blogs:like",
                "blogs:bookmark",
                "categories:read",
                "tags:read",
                "media:read",
                "recruitment:read",
                "recruitment:apply",
                "services:read"
        );
    }
}
