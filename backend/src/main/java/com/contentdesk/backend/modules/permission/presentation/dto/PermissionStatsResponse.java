package com.contentdesk.backend.modules.permission.presentation.dto;

public record PermissionStatsResponse(long total, long active, long deleted) {
}
