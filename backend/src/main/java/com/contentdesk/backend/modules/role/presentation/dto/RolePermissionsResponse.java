package com.contentdesk.backend.modules.role.presentation.dto;

import java.util.List;

public record RolePermissionsResponse(
        Long id,
        String name,
        String description,
        List<PermissionItem> permissions,
        long userCount
) {

    public record PermissionItem(Long id, String name, String description) {
    }
}
