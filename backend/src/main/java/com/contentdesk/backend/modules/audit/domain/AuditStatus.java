package com.contentdesk.backend.modules.audit.domain;

public enum AuditStatus {
    SUCCESS,
    DENIED,
    ERROR
}
