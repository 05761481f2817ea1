package com.contentdesk.backend.modules.audit.application;

import com.contentdesk.backend.global.config.AsyncConfig;
import com.contentdesk.backend.modules.audit.application.AuditLogService.AuditLogCommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget sink for authorization outcomes. A failed write is logged and dropped; it never
 * reaches the request that triggered it.
 */
@Component
public class AuthorizationAuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationAuditRecorder.class);
    private static final String COLLECTION_KEY = "*";

    private final AuditLogService auditLogService;

    public AuthorizationAuditRecorder(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Async(AsyncConfig.AUDIT_EXECUTOR)
    public void record(AuthorizationAuditEvent event) {
        try {
            auditLogService.record(new AuditLogCommand(
                    event.action(),
                    event.resource(),
                    event.resourceId() != null ? event.resourceId() : COLLECTION_KEY,
                    event.userId(),
                    event.status(),
                    event.durationMs(),
                    event.correlationId(),
                    event.detail()
            ));
            log.debug("AUDIT user={} {} {}#{} - {} ({}ms)", event.userId(), event.action(), event.resource(),
                    event.resourceId(), event.status(), event.durationMs());
        } catch (RuntimeException ex) {
            log.warn("Failed to record audit event {} {} for user {}", event.action(), event.resource(), event.userId(), ex);
        }
    }
}
