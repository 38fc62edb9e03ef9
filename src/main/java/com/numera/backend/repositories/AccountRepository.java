package com.numera.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.numera.backend.entities.Account;
import com.numera.backend.enums.AccountOrigin;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findFirstByUserIdAndOriginAndNameIgnoreCase(UUID userId, AccountOrigin origin, String name);

    Optional<Account> findByExternalItemId(String externalItemId);

    List<Account> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
