package com.contentdesk.backend.modules.user.presentation.dto;

import java.util.List;

public record PermissionCheckResponse(Long userId, List<String> permissions, String mode, boolean granted) {
}
