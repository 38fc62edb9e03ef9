package com.numera.backend.services.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;

import com.numera.backend.entities.FinancialTransaction;
import com.numera.backend.enums.IngestionSource;
import com.numera.backend.enums.TransactionCategory;
import com.numera.backend.enums.TransactionStatus;
import com.numera.backend.enums.TransactionType;
import com.numera.backend.exceptions.ReconciliationException;
import com.numera.backend.repositories.FinancialTransactionRepository;
import com.numera.backend.services.ledger.LedgerWriter.WriteOutcome;

@SpringBootTest
class LedgerWriterIntegrationTest {

    private static final UUID COMPANY_ID = UUID.randomUUID();

    @Autowired
    private LedgerWriter ledgerWriter;

    @Autowired
    private FinancialTransactionRepository transactionRepository;

    @AfterEach
    void cleanUp() {
        transactionRepository.deleteAll();
    }

    private static FinancialTransaction row(String externalId, String description) {
        return FinancialTransaction.builder()
                .amount(new BigDecimal("23.50"))
                .type(TransactionType.EXPENSE)
                .description(description)
                .transactionDate(LocalDate.of(2024, 12, 14))
                .category(TransactionCategory.TRANSPORT)
                .status(TransactionStatus.COMPLETED)
                .companyId(COMPANY_ID)
                .externalId(externalId)
                .source(IngestionSource.AGGREGATOR)
                .currency("EUR")
                .build();
    }

    @Test
    void write_sameExternalIdTwiceKeepsSingleRow() {
        assertEquals(WriteOutcome.CREATED, ledgerWriter.write(row("plaid-tx-1", "UBER TRIP")));
        assertEquals(WriteOutcome.DUPLICATE, ledgerWriter.write(row("plaid-tx-1", "UBER TRIP")));

        assertEquals(1, transactionRepository.countByExternalId("plaid-tx-1"));
    }

    @Test
    void schemaRejectsSecondRowWithSameExternalId() {
        transactionRepository.saveAndFlush(row("plaid-tx-1", "UBER TRIP"));

        assertThrows(DataIntegrityViolationException.class,
                () -> transactionRepository.saveAndFlush(row("plaid-tx-1", "UBER TRIP")));

        assertEquals(1, transactionRepository.countByExternalId("plaid-tx-1"));
    }

    @Test
    void write_insertRacingPastStalePreCheckIsDuplicate() {
        transactionRepository.saveAndFlush(row("plaid-tx-1", "UBER TRIP"));

        // the first existence check answers as if the concurrent insert had not committed yet
        FinancialTransactionRepository stale = mock(FinancialTransactionRepository.class, delegatesTo(transactionRepository));
        boolean[] checked = {false};
        doAnswer(inv -> {
            if (!checked[0]) {
                checked[0] = true;
                return false;
            }
            return transactionRepository.existsByExternalId(inv.getArgument(0));
        }).when(stale).existsByExternalId("plaid-tx-1");

        LedgerWriter racingWriter = new LedgerWriter(stale);

        assertEquals(WriteOutcome.DUPLICATE, racingWriter.write(row("plaid-tx-1", "UBER TRIP")));
        assertEquals(1, transactionRepository.countByExternalId("plaid-tx-1"));
    }

    @Test
    void write_rowsWithoutExternalIdAreNeverDeduplicated() {
        FinancialTransaction first = row(null, "Coffee");
        first.setSource(IngestionSource.SPREADSHEET);
        FinancialTransaction second = row(null, "Coffee");
        second.setSource(IngestionSource.SPREADSHEET);

        assertEquals(WriteOutcome.CREATED, ledgerWriter.write(first));
        assertEquals(WriteOutcome.CREATED, ledgerWriter.write(second));

        assertEquals(2, transactionRepository.count());
    }

    @Test
    void write_constraintViolationIsReportedAndLeavesOtherRowsIntact() {
        ledgerWriter.write(row("plaid-tx-1", "UBER TRIP"));

        assertThrows(ReconciliationException.class, () -> ledgerWriter.write(row("plaid-tx-2", null)));

        FinancialTransaction negative = row("plaid-tx-3", "Refund");
        negative.setAmount(new BigDecimal("-1.00"));
        assertThrows(ReconciliationException.class, () -> ledgerWriter.write(negative));

        assertEquals(1, transactionRepository.count());
    }
}
