package com.numera.backend.services.connections;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.numera.backend.entities.Account;
import com.numera.backend.entities.FinancialTransaction;
import com.numera.backend.enums.AccountOrigin;
import com.numera.backend.enums.IngestionSource;
import com.numera.backend.enums.TransactionCategory;
import com.numera.backend.enums.TransactionStatus;
import com.numera.backend.enums.TransactionType;
import com.numera.backend.repositories.AccountRepository;
import com.numera.backend.repositories.FinancialTransactionRepository;

@SpringBootTest
class ConnectionServiceIntegrationTest {

    private static final UUID USER_ID = UUID.randomUUID();

    @Autowired
    private ConnectionService connectionService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private FinancialTransactionRepository transactionRepository;

    @AfterEach
    void cleanUp() {
        transactionRepository.deleteAll();
        accountRepository.deleteAll();
    }

    @Test
    void deleteAccount_keepsLedgerRowsWithoutAccount() {
        Account account = accountRepository.saveAndFlush(Account.builder()
                .userId(USER_ID)
                .name("Checking")
                .currency("EUR")
                .origin(AccountOrigin.MANUAL)
                .build());
        FinancialTransaction row = transactionRepository.saveAndFlush(FinancialTransaction.builder()
                .amount(new BigDecimal("42.00"))
                .type(TransactionType.EXPENSE)
                .description("Office chairs")
                .transactionDate(LocalDate.of(2024, 12, 14))
                .category(TransactionCategory.SUPPLIES)
                .status(TransactionStatus.COMPLETED)
                .companyId(UUID.randomUUID())
                .accountId(account.getId())
                .source(IngestionSource.SPREADSHEET)
                .currency("EUR")
                .build());

        connectionService.deleteAccount(USER_ID, account.getId());

        assertFalse(accountRepository.existsById(account.getId()));
        assertNull(transactionRepository.findById(row.getId()).orElseThrow().getAccountId());
    }
}
