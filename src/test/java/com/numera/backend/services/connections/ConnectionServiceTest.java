package com.numera.backend.services.connections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.numera.backend.dto.AccountResponseDTO;
import com.numera.backend.dto.IntegrationResponseDTO;
import com.numera.backend.entities.Account;
import com.numera.backend.entities.Integration;
import com.numera.backend.enums.AccountOrigin;
import com.numera.backend.enums.IntegrationProvider;
import com.numera.backend.exceptions.AuthorizationException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.repositories.AccountRepository;
import com.numera.backend.repositories.FinancialTransactionRepository;
import com.numera.backend.repositories.IntegrationRepository;
import com.numera.backend.services.processor.ProcessorLedgerAdapter;

@ExtendWith(MockitoExtension.class)
class ConnectionServiceTest {

    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    private IntegrationRepository integrationRepository;

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private FinancialTransactionRepository transactionRepository;

    @Mock
    private ProcessorLedgerAdapter processorLedgerAdapter;

    @InjectMocks
    private ConnectionService service;

    private static Account account(UUID owner) {
        return Account.builder()
                .id(UUID.randomUUID())
                .userId(owner)
                .name("Checking")
                .currency("EUR")
                .origin(AccountOrigin.MANUAL)
                .build();
    }

    @Test
    void registerProcessorKey_verifiesKeyThenStoresIt() {
        when(processorLedgerAdapter.verifyKey("sk_test_123")).thenReturn("acct_1");
        when(integrationRepository.findByUserIdAndProvider(USER_ID, IntegrationProvider.STRIPE)).thenReturn(Optional.empty());
        when(integrationRepository.save(any(Integration.class))).thenAnswer(inv -> inv.getArgument(0));

        IntegrationResponseDTO result = service.registerProcessorKey(USER_ID, "  sk_test_123 ");

        assertEquals(IntegrationProvider.STRIPE, result.getProvider());
        assertEquals("acct_1", result.getAccountId());
        assertTrue(result.isConnected());

        InOrder order = inOrder(processorLedgerAdapter, integrationRepository);
        order.verify(processorLedgerAdapter).verifyKey("sk_test_123");
        order.verify(integrationRepository).save(any(Integration.class));
    }

    @Test
    void registerProcessorKey_replacingKeyClearsLastSync() {
        Integration existing = Integration.builder()
                .id(UUID.randomUUID())
                .userId(USER_ID)
                .provider(IntegrationProvider.STRIPE)
                .apiKey("sk_old")
                .externalAccountId("acct_old")
                .lastSyncedAt(LocalDateTime.of(2024, 12, 1, 10, 0))
                .build();
        when(processorLedgerAdapter.verifyKey("sk_new")).thenReturn(null);
        when(integrationRepository.findByUserIdAndProvider(USER_ID, IntegrationProvider.STRIPE)).thenReturn(Optional.of(existing));
        when(integrationRepository.save(existing)).thenReturn(existing);

        IntegrationResponseDTO result = service.registerProcessorKey(USER_ID, "sk_new");

        assertEquals("sk_new", existing.getApiKey());
        assertNull(existing.getLastSyncedAt());
        assertNull(existing.getExternalAccountId());
        assertEquals(existing.getId(), result.getId());
    }

    @Test
    void registerProcessorKey_rejectedKeyIsNotStored() {
        when(processorLedgerAdapter.verifyKey("sk_bad"))
                .thenThrow(new InputRejectedException("processor-key-invalid", "The payment processor rejected the API key"));

        InputRejectedException ex = assertThrows(InputRejectedException.class,
                () -> service.registerProcessorKey(USER_ID, "sk_bad"));

        assertEquals("processor-key-invalid", ex.getReason());
        verify(integrationRepository, never()).save(any());
    }

    @Test
    void registerProcessorKey_requiresKey() {
        InputRejectedException ex = assertThrows(InputRejectedException.class,
                () -> service.registerProcessorKey(USER_ID, "  "));

        assertEquals("processor-key-missing", ex.getReason());
        verifyNoInteractions(processorLedgerAdapter, integrationRepository);
    }

    @Test
    void disconnectProcessor_deletesStoredIntegration() {
        Integration existing = Integration.builder().id(UUID.randomUUID()).userId(USER_ID)
                .provider(IntegrationProvider.STRIPE).apiKey("sk_live").build();
        when(integrationRepository.findByUserIdAndProvider(USER_ID, IntegrationProvider.STRIPE)).thenReturn(Optional.of(existing));

        service.disconnectProcessor(USER_ID);

        verify(integrationRepository).delete(existing);
    }

    @Test
    void disconnectProcessor_withoutIntegrationIsRejected() {
        when(integrationRepository.findByUserIdAndProvider(USER_ID, IntegrationProvider.STRIPE)).thenReturn(Optional.empty());

        InputRejectedException ex = assertThrows(InputRejectedException.class, () -> service.disconnectProcessor(USER_ID));

        assertEquals("processor-not-connected", ex.getReason());
        verify(integrationRepository, never()).delete(any());
    }

    @Test
    void listIntegrations_neverExposesKey() {
        Integration existing = Integration.builder().id(UUID.randomUUID()).userId(USER_ID)
                .provider(IntegrationProvider.STRIPE).apiKey("sk_live_secret").externalAccountId("acct_9").build();
        when(integrationRepository.findByUserIdOrderByCreatedAtAsc(USER_ID)).thenReturn(List.of(existing));

        List<IntegrationResponseDTO> result = service.listIntegrations(USER_ID);

        assertEquals(1, result.size());
        assertEquals("acct_9", result.get(0).getAccountId());
        assertTrue(result.get(0).isConnected());
        assertFalse(result.get(0).toString().contains("sk_live_secret"));
    }

    @Test
    void listAccounts_returnsCallerAccounts() {
        Account first = account(USER_ID);
        when(accountRepository.findByUserIdOrderByCreatedAtDesc(USER_ID)).thenReturn(List.of(first));

        List<AccountResponseDTO> result = service.listAccounts(USER_ID);

        assertEquals(1, result.size());
        assertEquals(first.getId(), result.get(0).getId());
    }

    @Test
    void deleteAccount_detachesLedgerRowsThenDeletes() {
        Account owned = account(USER_ID);
        when(accountRepository.findById(owned.getId())).thenReturn(Optional.of(owned));
        when(transactionRepository.detachAccount(owned.getId())).thenReturn(3);

        service.deleteAccount(USER_ID, owned.getId());

        InOrder order = inOrder(transactionRepository, accountRepository);
        order.verify(transactionRepository).detachAccount(owned.getId());
        order.verify(accountRepository).delete(owned);
    }

    @Test
    void deleteAccount_ofAnotherUserIsForbidden() {
        Account foreign = account(UUID.randomUUID());
        when(accountRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThrows(AuthorizationException.class, () -> service.deleteAccount(USER_ID, foreign.getId()));

        verify(accountRepository, never()).delete(any());
        verifyNoInteractions(transactionRepository);
    }
}
