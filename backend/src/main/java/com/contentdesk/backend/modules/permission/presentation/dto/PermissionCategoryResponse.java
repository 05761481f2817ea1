package com.contentdesk.backend.modules.permission.presentation.dto;

import java.util.List;

public record PermissionCategoryResponse(String category, List<Item> permissions) {

    public record Item(Long id, String name, String description, long roleCount) {
    }
}
