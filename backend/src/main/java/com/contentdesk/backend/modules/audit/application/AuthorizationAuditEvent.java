package com.contentdesk.backend.modules.audit.application;

import java.util.Map;

import com.contentdesk.backend.modules.audit.domain.AuditStatus;

/**
 * Outcome of one authorization check, as handed to {@link AuthorizationAuditRecorder}.
 *
 * @param userId     caller, {@code null} when anonymous
 * @param action     operation verb, e.g. {@code update} or {@code bulk_delete}
 * @param resource   resource group, e.g. {@code blogs}
 * @param resourceId addressed instance, {@code null} for collection operations
 * @param detail     free-form extra data such as the route or the grant path
 */
public record AuthorizationAuditEvent(
        Long userId,
        String action,
        String resource,
        String resourceId,
        AuditStatus status,
        long durationMs,
        String correlationId,
        Map<String, Object> detail
) {
}
