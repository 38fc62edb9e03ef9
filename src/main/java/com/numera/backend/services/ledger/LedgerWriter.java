package com.numera.backend.services.ledger;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.numera.backend.entities.FinancialTransaction;
import com.numera.backend.exceptions.ReconciliationException;
import com.numera.backend.repositories.FinancialTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Inserts one ledger row per call, each in its own transaction, so a failing record never
 * rolls back the ones written before it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerWriter {

    public enum WriteOutcome {
        CREATED,
        DUPLICATE
    }

    private final FinancialTransactionRepository transactionRepository;

    /**
     * @throws ReconciliationException when the row could not be stored for any reason other
     *                                 than an already existing external id
     */
    public WriteOutcome write(FinancialTransaction transaction) {
        String externalId = transaction.getExternalId();
        if (externalId != null && transactionRepository.existsByExternalId(externalId)) {
            return WriteOutcome.DUPLICATE;
        }

        try {
            transactionRepository.saveAndFlush(transaction);
            return WriteOutcome.CREATED;
        } catch (DataIntegrityViolationException e) {
            // a concurrent run inserted the same external id between the check and the insert
            if (externalId != null && transactionRepository.existsByExternalId(externalId)) {
                log.info("[LedgerWriter] lost insert race on externalId={}, treating as duplicate", externalId);
                return WriteOutcome.DUPLICATE;
            }
            throw new ReconciliationException("rejected by a ledger constraint", e);
        } catch (RuntimeException e) {
            throw new ReconciliationException("could not be persisted (" + e.getClass().getSimpleName() + ")", e);
        }
    }
}
