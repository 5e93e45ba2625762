package com.mobifone.broker.entity;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.FieldDefaults;
import org.springframework.data.annotation.CreatedBy;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedBy;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.io.Serializable;
import java.time.Instant;

/**
 * Audit and soft-delete columns shared by users, services, transports and instances.
 * Rows with {@code is_deleted = 1} are filtered out by each entity's {@code @Where} clause.
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
@FieldDefaults(level = AccessLevel.PRIVATE)
public abstract class AbstractAuditingEntity<T> implements Serializable {

    public abstract T getId();

    @CreatedBy
    @Column(name = "created_by", updatable = false)
    String createdBy;

    @CreatedDate
    @Column(name = "created_date", updatable = false)
    Instant createdDate;

    @LastModifiedBy
    @Column(name = "updated_by")
    String updatedBy;

    @LastModifiedDate
    @Column(name = "updated_date")
    Instant updatedDate;

    @Column(name = "is_deleted", nullable = false)
    boolean deleted;

    @Column(name = "version")
    long version;

    @PrePersist
    void onInsert() {
        version = 1L;
    }

    @PreUpdate
    void onUpdate() {
        version++;
    }
}
