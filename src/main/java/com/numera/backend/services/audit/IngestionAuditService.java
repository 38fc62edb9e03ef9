package com.numera.backend.services.audit;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.numera.backend.entities.IngestionAuditEvent;
import com.numera.backend.enums.IngestionOutcome;
import com.numera.backend.enums.IngestionSource;
import com.numera.backend.exceptions.AuthorizationException;
import com.numera.backend.exceptions.IngestionException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.repositories.IngestionAuditEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionAuditService {

    private final IngestionAuditEventRepository auditEventRepository;

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logEvent(IngestionAuditEvent event) {
        try {
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.error("[IngestionAudit] failed to save audit event source={} outcome={}", event.getSource(), event.getOutcome(), e);
        }
    }

    public IngestionAuditEvent runEvent(
            UUID userId,
            IngestionSource source,
            UUID accountId,
            IngestionOutcome outcome,
            int created,
            int skipped,
            int errors
    ) {
        return IngestionAuditEvent.builder()
                .timestamp(LocalDateTime.now())
                .userId(userId)
                .source(source)
                .accountId(accountId)
                .outcome(outcome)
                .createdCount(created)
                .skippedCount(skipped)
                .errorCount(errors)
                .build();
    }

    public IngestionAuditEvent failureEvent(UUID userId, IngestionSource source, UUID accountId, IngestionException failure) {
        return IngestionAuditEvent.builder()
                .timestamp(LocalDateTime.now())
                .userId(userId)
                .source(source)
                .accountId(accountId)
                .outcome(isRejection(failure) ? IngestionOutcome.REJECTED : IngestionOutcome.FAILED)
                .failureReason(failure.getReason())
                .diagnosticExcerpt(failure.getDiagnosticExcerpt())
                .build();
    }

    private static boolean isRejection(IngestionException failure) {
        return failure instanceof InputRejectedException || failure instanceof AuthorizationException;
    }
}
