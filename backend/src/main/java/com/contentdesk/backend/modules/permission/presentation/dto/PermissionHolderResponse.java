package com.contentdesk.backend.modules.permission.presentation.dto;

public record PermissionHolderResponse(Long userId, String email, String name, String roleName) {
}
