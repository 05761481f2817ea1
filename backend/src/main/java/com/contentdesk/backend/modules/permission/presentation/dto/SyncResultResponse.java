package com.contentdesk.backend.modules.permission.presentation.dto;

import java.util.List;

public record SyncResultResponse(int created, int updated, List<String> errors, int rolesProvisioned) {
}
