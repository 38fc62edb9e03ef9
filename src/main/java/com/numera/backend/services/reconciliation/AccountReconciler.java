package com.numera.backend.services.reconciliation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.numera.backend.entities.Account;
import com.numera.backend.enums.AccountOrigin;
import com.numera.backend.repositories.AccountRepository;
import com.numera.backend.services.extraction.ExtractedAccount;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Matches extracted balances against the user's manual accounts by name. Each account is
 * saved on its own; one failure does not stop the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountReconciler {

    private final AccountRepository accountRepository;

    public AccountReconciliation reconcile(UUID userId, List<ExtractedAccount> accounts) {
        if (accounts == null || accounts.isEmpty()) {
            return AccountReconciliation.empty();
        }

        int created = 0;
        int updated = 0;
        UUID defaultAccountId = null;
        List<String> errors = new ArrayList<>();

        for (ExtractedAccount extracted : accounts) {
            try {
                Optional<Account> existing = accountRepository
                        .findFirstByUserIdAndOriginAndNameIgnoreCase(userId, AccountOrigin.MANUAL, extracted.name().trim());

                Account saved;
                if (existing.isPresent()) {
                    Account account = existing.get();
                    account.setCurrentBalance(extracted.balance());
                    account.setCurrency(extracted.currency());
                    saved = accountRepository.save(account);
                    updated++;
                } else {
                    saved = accountRepository.save(Account.builder()
                            .userId(userId)
                            .name(extracted.name().trim())
                            .currency(extracted.currency())
                            .currentBalance(extracted.balance())
                            .origin(AccountOrigin.MANUAL)
                            .build());
                    created++;
                }

                if (defaultAccountId == null) {
                    defaultAccountId = saved.getId();
                }
            } catch (RuntimeException e) {
                log.warn("[AccountReconciler] account '{}' not reconciled: {}", extracted.name(), e.getMessage());
                errors.add("account '" + extracted.name() + "' could not be saved");
            }
        }

        log.info("[AccountReconciler] user={} created={} updated={} failed={}", userId, created, updated, errors.size());
        return new AccountReconciliation(created, updated, defaultAccountId, errors);
    }
}
