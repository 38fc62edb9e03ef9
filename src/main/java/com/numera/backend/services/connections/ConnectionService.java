package com.numera.backend.services.connections;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.numera.backend.dto.AccountResponseDTO;
import com.numera.backend.dto.IntegrationResponseDTO;
import com.numera.backend.entities.Account;
import com.numera.backend.entities.Integration;
import com.numera.backend.enums.IntegrationProvider;
import com.numera.backend.exceptions.AuthorizationException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.repositories.AccountRepository;
import com.numera.backend.repositories.FinancialTransactionRepository;
import com.numera.backend.repositories.IntegrationRepository;
import com.numera.backend.services.processor.ProcessorLedgerAdapter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Manages the sources a user has connected: payment processor keys and ledger accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionService {

    private final IntegrationRepository integrationRepository;
    private final AccountRepository accountRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final ProcessorLedgerAdapter processorLedgerAdapter;

    /**
     * Verifies the key against the processor, then stores it. Replacing a key clears the last
     * sync time since the new key may point at another processor account.
     */
    public IntegrationResponseDTO registerProcessorKey(UUID userId, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new InputRejectedException("processor-key-missing", "An API key is required");
        }
        String key = apiKey.trim();
        String processorAccountId = processorLedgerAdapter.verifyKey(key);

        Integration integration = integrationRepository.findByUserIdAndProvider(userId, IntegrationProvider.STRIPE)
                .orElse(null);
        boolean replaced = integration != null;
        if (integration == null) {
            integration = Integration.builder()
                    .userId(userId)
                    .provider(IntegrationProvider.STRIPE)
                    .build();
        }
        integration.setApiKey(key);
        integration.setExternalAccountId(processorAccountId);
        integration.setLastSyncedAt(null);

        Integration saved = integrationRepository.save(integration);
        log.info("[Connections] processor key {} for user={} integration={}",
                replaced ? "replaced" : "stored", userId, saved.getId());
        return IntegrationResponseDTO.from(saved);
    }

    public void disconnectProcessor(UUID userId) {
        Integration integration = integrationRepository.findByUserIdAndProvider(userId, IntegrationProvider.STRIPE)
                .orElseThrow(() -> new InputRejectedException("processor-not-connected", "No payment processor is connected"));
        integrationRepository.delete(integration);
        log.info("[Connections] processor integration={} removed for user={}", integration.getId(), userId);
    }

    public List<IntegrationResponseDTO> listIntegrations(UUID userId) {
        return integrationRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
                .map(IntegrationResponseDTO::from)
                .toList();
    }

    public List<AccountResponseDTO> listAccounts(UUID userId) {
        return accountRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(AccountResponseDTO::from)
                .toList();
    }

    /**
     * Removes an account owned by the caller. Ledger rows imported into it are kept and
     * detached from the account.
     */
    @Transactional
    public void deleteAccount(UUID userId, UUID accountId) {
        Account account = accountRepository.findById(accountId)
                .filter(a -> a.isOwnedBy(userId))
                .orElseThrow(() -> new AuthorizationException("Account not found for the current user"));

        int detached = transactionRepository.detachAccount(account.getId());
        accountRepository.delete(account);
        log.info("[Connections] account={} deleted for user={} ({} ledger rows detached)", accountId, userId, detached);
    }
}
