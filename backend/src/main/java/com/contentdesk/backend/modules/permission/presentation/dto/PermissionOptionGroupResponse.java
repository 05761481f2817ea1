package com.contentdesk.backend.modules.permission.presentation.dto;

import java.util.List;

public record PermissionOptionGroupResponse(String group, List<Option> options) {

    public record Option(Long value, String label) {
    }
}
