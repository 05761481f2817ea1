package com.contentdesk.backend.modules.role.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record RolePermissionChangeRequest(@NotEmpty List<@NotNull Long> permissionIds) {
}
