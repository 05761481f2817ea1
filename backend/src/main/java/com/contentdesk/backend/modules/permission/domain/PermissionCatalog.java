package com.contentdesk.backend.modules.permission.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 시스템이 인식하는 모든 권한 이름의 고정 목록.
 * 권한 이름은 항상 {@code resource:action} 형식을 따른다.
 */
public final class PermissionCatalog {

    public static final String SEPARATOR = ":";

    /** 모든 검사를 통과시키는 예약 권한. 일반 권한 부여 흐름으로는 할당할 수 없다. */
    public static final String SUPER_ADMIN = "admin:full_access";

    public static final String MANAGE_ALL_ACTION = "manage_all";

    public static final List<String> STANDARD_ACTIONS = List.of(
            "create",
            "read",
            "update",
            "delete",
            "restore",
            "view_deleted",
            "permanent_delete",
            "bulk_delete",
            "bulk_restore",
            "bulk_permanent_delete",
            "full_access"
    );

    public static final List<String> RESOURCE_GROUPS = List.of(
            "users",
            "roles",
            "permissions",
            "blogs",
            "categories",
            "tags",
            "content_types",
            "status",
            "media",
            "recruitment",
            "services",
            "contacts",
            "comments",
            "analytics",
            "settings"
    );

    /** Groups that carry their own action list instead of {@link #STANDARD_ACTIONS}. */
    private static final Map<String, List<String>> RESTRICTED_ACTIONS = Map.of(
            "content_types", List.of("create", "read", "update", "delete", "restore", "full_access")
    );

    private static final Map<String, List<String>> EXTRA_ACTIONS = Map.of(
            "users", List.of(MANAGE_ALL_ACTION),
            "roles", List.of("assign_permissions"),
            "blogs", List.of(MANAGE_ALL_ACTION, "publish", "unpublish", "like", "bookmark"),
            "media", List.of(MANAGE_ALL_ACTION, "upload"),
            "recruitment", List.of(MANAGE_ALL_ACTION, "apply"),
            "services", List.of(MANAGE_ALL_ACTION),
            "comments", List.of(MANAGE_ALL_ACTION)
    );

    private static final Map<String, List<String>> PERMISSIONS_BY_GROUP = buildGroups();
    private static final Set<String> ALL_PERMISSIONS = flatten(PERMISSIONS_BY_GROUP);

    private PermissionCatalog() {
    }

    public static String name(String resource, String action) {
        return resource + SEPARATOR + action;
    }

    public static String manageAll(String resource) {
        return name(resource, MANAGE_ALL_ACTION);
    }

    /**
     * Every catalog permission keyed by resource group, in declaration order. The {@code admin}
     * group holds only the reserved {@link #SUPER_ADMIN} permission.
     */
    public static Map<String, List<String>> permissionsByGroup() {
        return PERMISSIONS_BY_GROUP;
    }

    public static Set<String> allPermissions() {
        return ALL_PERMISSIONS;
    }

    public static List<String> permissionsOf(String resource) {
        return PERMISSIONS_BY_GROUP.getOrDefault(resource, List.of());
    }

    public static boolean contains(String permissionName) {
        return ALL_PERMISSIONS.contains(permissionName);
    }

    public static boolean isReserved(String permissionName) {
        return SUPER_ADMIN.equals(permissionName);
    }

    public static boolean isWellFormed(String permissionName) {
        if (permissionName == null) {
            return false;
        }
        int index = permissionName.indexOf(SEPARATOR);
        return index > 0 && index < permissionName.length() - 1;
    }

    public static String resourceOf(String permissionName) {
        int index = permissionName.indexOf(SEPARATOR);
        return index < 0 ? permissionName : permissionName.substring(0, index);
    }

    public static String actionOf(String permissionName) {
        int index = permissionName.indexOf(SEPARATOR);
        return index < 0 ? "" : permissionName.substring(index + 1);
    }

    /**
     * Display group shown in option pickers: resource part title-cased, e.g. {@code blogs:update -> Blogs}.
     */
    public static String displayGroupOf(String permissionName) {
        String resource = resourceOf(permissionName);
        if (resource.isEmpty()) {
            return resource;
        }
        return resource.substring(0, 1).toUpperCase(Locale.ROOT) + resource.substring(1);
    }

    public static String defaultDescription(String permissionName) {
        return "Permission to " + resourceOf(permissionName) + " " + actionOf(permissionName);
    }

    private static Map<String, List<String>> buildGroups() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        groups.put("admin", List.of(SUPER_ADMIN));
        for (String resource : RESOURCE_GROUPS) {
            List<String> names = new ArrayList<>();
            RESTRICTED_ACTIONS.getOrDefault(resource, STANDARD_ACTIONS)
                    .forEach(action -> names.add(name(resource, action)));
            EXTRA_ACTIONS.getOrDefault(resource, List.of()).forEach(action -> names.add(name(resource, action)));
            groups.put(resource, List.copyOf(names));
        }
        return Collections.unmodifiableMap(groups);
    }

    private static Set<String> flatten(Map<String, List<String>> groups) {
        Set<String> names = new LinkedHashSet<>();
        groups.values().forEach(names::addAll);
        return Collections.unmodifiableSet(names);
    }
}
