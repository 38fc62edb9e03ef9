package com.numera.backend.repositories;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.numera.backend.entities.Company;

public interface CompanyRepository extends JpaRepository<Company, UUID> {

    Optional<Company> findFirstByOwnerUserIdOrderByCreatedAtAsc(UUID ownerUserId);
}
