package com.numera.backend.entities;

import java.time.LocalDateTime;
import java.util.UUID;

import com.numera.backend.enums.IngestionOutcome;
import com.numera.backend.enums.IngestionSource;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One row per ingestion run, written whatever the outcome.
 */
@Entity
@Table(name = "ingestion_audit_events", indexes = {
        @Index(name = "idx_ingestion_audit_user_id", columnList = "user_id"),
        @Index(name = "idx_ingestion_audit_timestamp", columnList = "occurred_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionAuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private IngestionSource source;

    @Column(name = "account_id", updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private IngestionOutcome outcome;

    @Column(name = "created_count", updatable = false)
    private int createdCount;

    @Column(name = "skipped_count", updatable = false)
    private int skippedCount;

    @Column(name = "error_count", updatable = false)
    private int errorCount;

    @Column(name = "failure_reason", updatable = false, length = 100)
    private String failureReason;

    @Column(name = "diagnostic_excerpt", updatable = false, length = 400)
    private String diagnosticExcerpt;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = LocalDateTime.now();
        }
    }
}
