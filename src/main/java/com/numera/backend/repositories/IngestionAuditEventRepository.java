package com.numera.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.numera.backend.entities.IngestionAuditEvent;

public interface IngestionAuditEventRepository extends JpaRepository<IngestionAuditEvent, UUID> {
}
