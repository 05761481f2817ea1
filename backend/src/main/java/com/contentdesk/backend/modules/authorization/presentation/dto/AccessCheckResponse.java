package com.contentdesk.backend.modules.authorization.presentation.dto;

import java.util.List;

import com.contentdesk.backend.modules.authorization.domain.AccessDecision;
import com.contentdesk.backend.modules.authorization.domain.GrantPath;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessCheckResponse(
        String resourceType,
        String resourceId,
        String action,
        boolean granted,
        GrantPath grantedBy,
        List<String> missingPermissions
) {

    public static AccessCheckResponse from(String resourceType, String resourceId, String action, AccessDecision decision) {
        return new AccessCheckResponse(
                resourceType,
                resourceId,
                action,
                decision.granted(),
                decision.grantedBy(),
                decision.granted() ? null : decision.missingPermissions()
        );
    }
}
