package com.contentdesk.backend.modules.user.presentation.dto;

import java.util.List;

public record UserPermissionsResponse(Long userId, String roleName, List<String> permissions) {
}
