package com.numera.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.numera.backend.entities.FinancialTransaction;

public interface FinancialTransactionRepository extends JpaRepository<FinancialTransaction, UUID> {

    boolean existsByExternalId(String externalId);

    long countByExternalId(String externalId);

    @Modifying
    @Query("UPDATE FinancialTransaction t SET t.accountId = NULL WHERE t.accountId = :accountId")
    int detachAccount(@Param("accountId") UUID accountId);
}
