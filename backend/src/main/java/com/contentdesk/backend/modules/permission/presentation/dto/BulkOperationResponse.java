package com.contentdesk.backend.modules.permission.presentation.dto;

import java.util.List;

public record BulkOperationResponse(
        int requested,
        List<Long> succeeded,
        List<Failure> failed
) {

    public record Failure(Long id, String code, String reason) {
    }
}
