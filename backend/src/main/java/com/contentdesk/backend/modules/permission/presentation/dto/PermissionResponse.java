package com.contentdesk.backend.modules.permission.presentation.dto;

import java.time.OffsetDateTime;

import com.contentdesk.backend.modules.permission.domain.Permission;

public record PermissionResponse(
        Long id,
        String name,
        String description,
        String metaTitle,
        String metaDescription,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt
) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getName(),
                permission.getDescription(),
                permission.getMetaTitle(),
                permission.getMetaDescription(),
                permission.getCreatedAt(),
                permission.getUpdatedAt(),
                permission.getDeletedAt()
        );
    }
}
