package com.whereq.tempo.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Persisted unit of work and its outcome.
 */
@Entity
@Table(name = "job", indexes = {
    @Index(name = "idx_job_user_id", columnList = "user_id"),
    @Index(name = "idx_job_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "result")
public class Job {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    /**
     * Serialized task return value, set only on COMPLETED
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result")
    private JsonNode result;

    /**
     * String form of the task exception, set only on FAILED
     */
    @Column(name = "error", length = 4000)
    private String error;

    @Column(name = "flow_id", length = 64)
    private String flowId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onPersist() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isOwnedBy(String ownerId) {
        return ownerId == null || ownerId.equals(userId);
    }
}
