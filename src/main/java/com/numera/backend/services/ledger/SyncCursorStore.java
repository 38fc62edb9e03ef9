package com.numera.backend.services.ledger;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.numera.backend.entities.Account;
import com.numera.backend.repositories.AccountRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the aggregator position of each account. The cursor only moves forward; the single
 * way back to null is a re-issued credential.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncCursorStore {

    private final AccountRepository accountRepository;

    public String currentCursor(Account account) {
        return account.getSyncCursor();
    }

    /**
     * Stores the cursor reached by a run. Call only after every item of the run is written.
     */
    @Transactional
    public Account advance(UUID accountId, String cursor, LocalDateTime syncedAt) {
        if (cursor == null || cursor.isBlank()) {
            throw new IllegalArgumentException("cursor is required; use resetForReissuedCredential to clear it");
        }

        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new IllegalArgumentException("Account not found: " + accountId));
        account.setSyncCursor(cursor);
        account.setLastSyncedAt(syncedAt);
        Account saved = accountRepository.save(account);

        log.info("[SyncCursor] account={} advanced", accountId);
        return saved;
    }

    @Transactional
    public Account resetForReissuedCredential(Account account, String newAccessToken) {
        if (newAccessToken == null || newAccessToken.isBlank()) {
            throw new IllegalArgumentException("newAccessToken is required");
        }

        account.setAccessToken(newAccessToken);
        account.setSyncCursor(null);
        Account saved = accountRepository.save(account);

        log.info("[SyncCursor] account={} credential re-issued, cursor reset for full backfill", account.getId());
        return saved;
    }
}
