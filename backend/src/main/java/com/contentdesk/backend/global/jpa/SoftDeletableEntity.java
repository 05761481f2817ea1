package com.contentdesk.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * deleted_at 컬럼 기반 소프트 삭제를 지원하는 엔터티.
 */
@MappedSuperclass
public abstract class SoftDeletableEntity extends AbstractTimestampedEntity {

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public void markDeleted(OffsetDateTime now) {
        this.deletedAt = now;
    }

    public void restore() {
        this.deletedAt = null;
    }
}
