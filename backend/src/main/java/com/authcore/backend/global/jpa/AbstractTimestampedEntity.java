package com.authcore.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * created_at / updated_at columns shared by mutable entities.
 * Values are stamped by the application from the injected UTC clock, not by the
 * database, so that tests with a fixed clock see deterministic timestamps.
 */
@MappedSuperclass
public abstract class AbstractTimestampedEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public void stampCreated(OffsetDateTime now) {
        this.createdAt = now;
        this.updatedAt = now;
    }
}
