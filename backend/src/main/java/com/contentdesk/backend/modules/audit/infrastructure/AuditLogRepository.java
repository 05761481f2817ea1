package com.contentdesk.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.contentdesk.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByCorrelationIdOrderByCreatedAtAsc(String correlationId);
}
