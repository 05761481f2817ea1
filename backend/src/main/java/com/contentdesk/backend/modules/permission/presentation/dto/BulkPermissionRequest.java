package com.contentdesk.backend.modules.permission.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

public record BulkPermissionRequest(@NotNull List<Long> ids) {
}
