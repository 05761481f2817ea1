package com.contentdesk.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdatePermissionRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 255) String description,
        @Size(max = 255) String metaTitle,
        @Size(max = 500) String metaDescription
) {
}
