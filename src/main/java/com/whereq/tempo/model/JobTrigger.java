package com.whereq.tempo.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Durable mirror of a not-yet-fired trigger, reloaded when the scheduler
 * engine starts.
 */
@Entity
@Table(name = "job_trigger")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobTrigger {

    @Id
    @Column(name = "job_id", nullable = false, updatable = false, length = 64)
    private String jobId;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Registered task name; null when the task was supplied as an instance
     */
    @Column(name = "task_name")
    private String taskName;

    /**
     * Null means run immediately
     */
    @Column(name = "fire_time")
    private Instant fireTime;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "args")
    private JsonNode args;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "kwargs")
    private JsonNode kwargs;

    /**
     * Registration time of the trigger this row mirrors
     */
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onPersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
