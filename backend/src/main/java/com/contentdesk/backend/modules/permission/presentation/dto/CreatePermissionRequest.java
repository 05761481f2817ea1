package com.contentdesk.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 255) String description,
        @Size(max = 255) String metaTitle,
        @Size(max = 500) String metaDescription
) {
}
