package com.contentdesk.backend.modules.permission.presentation.dto;

import java.util.Map;

public record PermissionSummaryResponse(
        long totalPermissions,
        long totalRoles,
        long totalUsers,
        Map<String, Long> permissionsPerCategory,
        long rolesWithoutPermissions,
        long usersWithoutRoles
) {
}
