package com.numera.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.numera.backend.entities.Integration;
import com.numera.backend.enums.IntegrationProvider;

public interface IntegrationRepository extends JpaRepository<Integration, UUID> {

    Optional<Integration> findByUserIdAndProvider(UUID userId, IntegrationProvider provider);

    List<Integration> findByUserIdOrderByCreatedAtAsc(UUID userId);
}
