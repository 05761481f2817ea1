package com.contentdesk.backend.modules.authorization.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BulkAccessRequest(
        @NotBlank String action,
        @NotNull @Size(max = 100) List<@NotBlank String> resourceIds
) {
}
