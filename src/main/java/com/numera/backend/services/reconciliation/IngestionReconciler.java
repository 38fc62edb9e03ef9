package com.numera.backend.services.reconciliation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numera.backend.classification.TransactionCategorizer;
import com.numera.backend.config.IngestionProperties;
import com.numera.backend.dto.AccountResponseDTO;
import com.numera.backend.dto.CandidateTransactionDTO;
import com.numera.backend.dto.ExtractedAccountDTO;
import com.numera.backend.dto.ExtractionPreviewDTO;
import com.numera.backend.dto.ImportConfirmRequestDTO;
import com.numera.backend.dto.IngestionRunSummaryDTO;
import com.numera.backend.dto.LinkAccountRequestDTO;
import com.numera.backend.entities.Account;
import com.numera.backend.entities.Company;
import com.numera.backend.entities.FinancialTransaction;
import com.numera.backend.entities.Integration;
import com.numera.backend.enums.AccountOrigin;
import com.numera.backend.enums.IngestionOutcome;
import com.numera.backend.enums.IngestionSource;
import com.numera.backend.enums.IntegrationProvider;
import com.numera.backend.enums.TransactionStatus;
import com.numera.backend.enums.TransactionType;
import com.numera.backend.exceptions.AuthorizationException;
import com.numera.backend.exceptions.IngestionException;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.exceptions.ReconciliationException;
import com.numera.backend.repositories.AccountRepository;
import com.numera.backend.repositories.CompanyRepository;
import com.numera.backend.repositories.IntegrationRepository;
import com.numera.backend.services.aggregator.AggregatorFetch;
import com.numera.backend.services.aggregator.AggregatorSyncAdapter;
import com.numera.backend.services.aggregator.AggregatorTransaction;
import com.numera.backend.services.ai.LlmCompletion;
import com.numera.backend.services.audit.IngestionAuditService;
import com.numera.backend.services.documents.DocumentStatementAdapter;
import com.numera.backend.services.extraction.CandidateTransaction;
import com.numera.backend.services.extraction.CandidateValidator;
import com.numera.backend.services.extraction.CandidateValidator.Validated;
import com.numera.backend.services.extraction.ExtractedAccount;
import com.numera.backend.services.extraction.ExtractionBatch;
import com.numera.backend.services.extraction.ExtractionNormalizer;
import com.numera.backend.services.extraction.ExtractionResponseParser;
import com.numera.backend.services.extraction.RecordRepairer;
import com.numera.backend.services.ledger.LedgerWriter;
import com.numera.backend.services.ledger.LedgerWriter.WriteOutcome;
import com.numera.backend.services.ledger.SyncCursorStore;
import com.numera.backend.services.processor.ProcessorLedgerAdapter;
import com.numera.backend.services.processor.ProcessorLedgerAdapter.ProcessorEntry;
import com.numera.backend.services.spreadsheets.SpreadsheetStatementAdapter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of every ingestion run: source adapter, normalizer, repair pipeline,
 * categorizer, then one ledger write per record.
 *
 * <p>Not transactional. Each write commits on its own; a failing record is reported in the
 * run summary and the rows already written stay.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionReconciler {

    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final DocumentStatementAdapter documentAdapter;
    private final SpreadsheetStatementAdapter spreadsheetAdapter;
    private final AggregatorSyncAdapter aggregatorSyncAdapter;
    private final ProcessorLedgerAdapter processorLedgerAdapter;
    private final ExtractionNormalizer normalizer;
    private final ExtractionResponseParser responseParser;
    private final CandidateValidator candidateValidator;
    private final TransactionCategorizer categorizer;
    private final AccountReconciler accountReconciler;
    private final LedgerWriter ledgerWriter;
    private final SyncCursorStore cursorStore;
    private final AccountRepository accountRepository;
    private final CompanyRepository companyRepository;
    private final IntegrationRepository integrationRepository;
    private final IngestionAuditService auditService;
    private final IngestionProperties properties;
    private final ObjectMapper objectMapper;

    // Statement extraction (preview, then explicit confirmation)

    public ExtractionPreviewDTO previewDocument(UUID userId, byte[] bytes, String mimeType, String filename) {
        return preview(userId, IngestionSource.DOCUMENT, () -> documentAdapter.extract(bytes, mimeType, filename));
    }

    public ExtractionPreviewDTO previewSpreadsheet(UUID userId, String content) {
        return preview(userId, IngestionSource.SPREADSHEET, () -> spreadsheetAdapter.extract(content));
    }

    private ExtractionPreviewDTO preview(UUID userId, IngestionSource source, Supplier<LlmCompletion> extraction) {
        try {
            String text = normalizer.normalize(extraction.get());
            ExtractionBatch batch = responseParser.parse(text);

            log.info("[Ingestion] {} preview user={} transactions={} accounts={} dropped={}",
                    source, userId, batch.transactions().size(), batch.accounts().size(), batch.droppedRecords());
            auditService.logEvent(auditService.runEvent(userId, source, null, IngestionOutcome.PREVIEWED,
                    0, batch.droppedRecords(), 0));
            return ExtractionPreviewDTO.from(source, batch);
        } catch (IngestionException e) {
            logFailure(source, userId, e);
            auditService.logEvent(auditService.failureEvent(userId, source, null, e));
            throw e;
        }
    }

    /**
     * Persists a previewed extraction after the user confirmed it. No content-based dedup:
     * importing the same statement twice creates its rows twice.
     */
    public IngestionRunSummaryDTO confirmImport(UUID userId, ImportConfirmRequestDTO request) {
        IngestionSource source = request.source();
        if (source != IngestionSource.DOCUMENT && source != IngestionSource.SPREADSHEET) {
            throw new InputRejectedException("unsupported-source", "Only document and spreadsheet extractions can be imported");
        }

        Company company = requireCompany(userId);
        Account explicitAccount = request.accountId() == null ? null : requireOwnedAccount(userId, request.accountId());

        List<String> errors = new ArrayList<>();

        List<ExtractedAccount> accounts = new ArrayList<>();
        int accountIndex = 0;
        for (ExtractedAccountDTO dto : request.accountsOrEmpty()) {
            accountIndex++;
            Validated<ExtractedAccount> v = candidateValidator.validateAccount(objectMapper.valueToTree(dto));
            if (v.isValid()) {
                accounts.add(v.value());
            } else {
                errors.add("account " + accountIndex + ": " + v.rejection());
            }
        }

        AccountReconciliation accountResult = accountReconciler.reconcile(userId, accounts);
        errors.addAll(accountResult.errors());

        UUID accountId = explicitAccount != null ? explicitAccount.getId() : accountResult.defaultAccountId();
        String currency = explicitAccount != null
                ? explicitAccount.getCurrency()
                : accounts.isEmpty() ? properties.getDefaultCurrency() : accounts.get(0).currency();

        int count = 0;
        int skipped = 0;
        int index = 0;
        for (CandidateTransactionDTO dto : request.transactionsOrEmpty()) {
            index++;
            Validated<CandidateTransaction> v = candidateValidator.validateTransaction(objectMapper.valueToTree(dto));
            if (!v.isValid()) {
                log.warn("[Ingestion] import record {} rejected: {}", index, v.rejection());
                errors.add("record " + index + ": " + v.rejection());
                continue;
            }

            FinancialTransaction row = fromCandidate(v.value(), company.getId(), accountId, source, currency);
            try {
                if (ledgerWriter.write(row) == WriteOutcome.CREATED) count++;
                else skipped++;
            } catch (ReconciliationException e) {
                log.warn("[Ingestion] import record {} not persisted: {}", index, e.getMessage(), e);
                errors.add("record " + index + ": " + e.getMessage());
            }
        }

        log.info("[Ingestion] {} import user={} created={} skipped={} errors={} accountsCreated={} accountsUpdated={}",
                source, userId, count, skipped, errors.size(), accountResult.created(), accountResult.updated());
        auditService.logEvent(auditService.runEvent(userId, source, accountId, outcome(errors), count, skipped, errors.size()));

        return summary(count, skipped, errors, accountResult.created(), accountResult.updated());
    }

    // Bank aggregator

    public AccountResponseDTO linkAggregatorAccount(UUID userId, LinkAccountRequestDTO request) {
        String itemId = request.itemId().trim();
        Optional<Account> existing = accountRepository.findByExternalItemId(itemId);

        if (existing.isPresent()) {
            Account account = existing.get();
            if (!account.isOwnedBy(userId)) {
                throw new AuthorizationException("The aggregator item is linked to another user");
            }
            if (!request.accessToken().equals(account.getAccessToken())) {
                account = cursorStore.resetForReissuedCredential(account, request.accessToken());
            }
            account.setName(request.name().trim());
            if (request.mask() != null) account.setMask(request.mask());
            if (request.institutionName() != null) account.setInstitutionName(request.institutionName());
            if (request.currentBalance() != null) account.setCurrentBalance(request.currentBalance());
            return AccountResponseDTO.from(accountRepository.save(account));
        }

        Account created = accountRepository.save(Account.builder()
                .userId(userId)
                .name(request.name().trim())
                .externalItemId(itemId)
                .accessToken(request.accessToken())
                .currency(request.currency() == null ? properties.getDefaultCurrency() : request.currency().toUpperCase(Locale.ROOT))
                .currentBalance(request.currentBalance())
                .mask(request.mask())
                .institutionName(request.institutionName())
                .origin(AccountOrigin.AGGREGATOR)
                .build());

        log.info("[AggregatorSync] linked account={} for user={}", created.getId(), userId);
        return AccountResponseDTO.from(created);
    }

    /**
     * Pulls new items for one linked account. The cursor moves only when every fetched item
     * was either written or recognised as a duplicate.
     */
    public IngestionRunSummaryDTO syncAggregatorAccount(UUID userId, UUID accountId) {
        Account account = requireOwnedAccount(userId, accountId);
        if (account.getOrigin() != AccountOrigin.AGGREGATOR) {
            throw new InputRejectedException("not-aggregator-account", "The account is not linked to the bank aggregator");
        }
        Company company = requireCompany(userId);

        AggregatorFetch fetch;
        try {
            fetch = aggregatorSyncAdapter.fetch(account);
        } catch (IngestionException e) {
            logFailure(IngestionSource.AGGREGATOR, userId, e);
            auditService.logEvent(auditService.failureEvent(userId, IngestionSource.AGGREGATOR, accountId, e));
            throw e;
        }

        int count = 0;
        int skipped = 0;
        boolean persistenceFailed = false;
        List<String> errors = new ArrayList<>();

        for (AggregatorTransaction item : fetch.added()) {
            FinancialTransaction row;
            try {
                row = fromAggregator(item, company.getId(), account);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.warn("[AggregatorSync] item {} unusable: {}", item.transactionId(), e.getMessage());
                errors.add("item " + item.transactionId() + ": " + e.getMessage());
                continue;
            }

            try {
                if (ledgerWriter.write(row) == WriteOutcome.CREATED) count++;
                else skipped++;
            } catch (ReconciliationException e) {
                persistenceFailed = true;
                log.warn("[AggregatorSync] item {} not persisted: {}", item.transactionId(), e.getMessage(), e);
                errors.add("item " + item.transactionId() + ": " + e.getMessage());
            }
        }

        if (persistenceFailed) {
            log.warn("[AggregatorSync] account={} cursor kept; {} items will be fetched again next run", accountId, fetch.added().size());
        } else if (fetch.nextCursor() != null) {
            cursorStore.advance(account.getId(), fetch.nextCursor(), LocalDateTime.now());
        }

        log.info("[AggregatorSync] account={} created={} skipped={} errors={} complete={}",
                accountId, count, skipped, errors.size(), fetch.complete());
        auditService.logEvent(auditService.runEvent(userId, IngestionSource.AGGREGATOR, accountId, outcome(errors), count, skipped, errors.size()));

        return summary(count, skipped, errors, 0, 0);
    }

    // Payment processor

    public IngestionRunSummaryDTO syncProcessor(UUID userId) {
        Integration integration = integrationRepository.findByUserIdAndProvider(userId, IntegrationProvider.STRIPE)
                .orElseThrow(() -> new InputRejectedException("processor-not-connected", "No payment processor API key is registered"));
        Company company = requireCompany(userId);

        List<ProcessorEntry> entries;
        try {
            entries = processorLedgerAdapter.fetch(integration.getApiKey());
        } catch (IngestionException e) {
            logFailure(IngestionSource.PROCESSOR, userId, e);
            auditService.logEvent(auditService.failureEvent(userId, IngestionSource.PROCESSOR, null, e));
            throw e;
        }

        int count = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();

        for (ProcessorEntry entry : entries) {
            FinancialTransaction row = FinancialTransaction.builder()
                    .amount(entry.amount())
                    .type(entry.type())
                    .description(truncate(entry.description()))
                    .transactionDate(entry.date())
                    .category(entry.category())
                    .status(TransactionStatus.COMPLETED)
                    .companyId(company.getId())
                    .externalId(entry.externalId())
                    .source(IngestionSource.PROCESSOR)
                    .currency(entry.currency())
                    .build();
            try {
                if (ledgerWriter.write(row) == WriteOutcome.CREATED) count++;
                else skipped++;
            } catch (ReconciliationException e) {
                log.warn("[ProcessorSync] record {} not persisted: {}", entry.externalId(), e.getMessage(), e);
                errors.add("record " + entry.externalId() + ": " + e.getMessage());
            }
        }

        integration.setLastSyncedAt(LocalDateTime.now());
        integrationRepository.save(integration);

        log.info("[ProcessorSync] user={} created={} skipped={} errors={}", userId, count, skipped, errors.size());
        auditService.logEvent(auditService.runEvent(userId, IngestionSource.PROCESSOR, null, outcome(errors), count, skipped, errors.size()));

        return summary(count, skipped, errors, 0, 0);
    }

    private Company requireCompany(UUID userId) {
        return companyRepository.findFirstByOwnerUserIdOrderByCreatedAtAsc(userId)
                .orElseThrow(() -> new AuthorizationException("No company found for the current user"));
    }

    private Account requireOwnedAccount(UUID userId, UUID accountId) {
        return accountRepository.findById(accountId)
                .filter(a -> a.isOwnedBy(userId))
                .orElseThrow(() -> new AuthorizationException("Account not found for the current user"));
    }

    static FinancialTransaction fromCandidate(CandidateTransaction candidate, UUID companyId, UUID accountId,
                                              IngestionSource source, String currency) {
        BigDecimal amount = candidate.amount();
        return FinancialTransaction.builder()
                .amount(amount.abs())
                .type(amount.signum() < 0 ? TransactionType.EXPENSE : TransactionType.INCOME)
                .description(truncate(candidate.description()))
                .transactionDate(candidate.date())
                .category(candidate.category())
                .status(TransactionStatus.COMPLETED)
                .companyId(companyId)
                .accountId(accountId)
                .source(source)
                .currency(currency)
                .build();
    }

    private FinancialTransaction fromAggregator(AggregatorTransaction item, UUID companyId, Account account) {
        if (item.transactionId() == null || item.transactionId().isBlank()) {
            throw new IllegalArgumentException("missing transaction id");
        }
        if (item.amount() == null) {
            throw new IllegalArgumentException("missing amount");
        }
        LocalDate date = item.dateAsLocalDate();
        if (date == null) {
            throw new IllegalArgumentException("missing date");
        }

        String description = item.name();
        if (description == null || description.isBlank()) description = item.merchantName();
        if (description == null || description.isBlank()) description = RecordRepairer.DESCRIPTION_PLACEHOLDER;

        String currency = item.currencyCode() != null ? item.currencyCode() : account.getCurrency();

        // aggregator convention: positive amounts leave the account
        return FinancialTransaction.builder()
                .amount(item.amount().abs())
                .type(item.amount().signum() > 0 ? TransactionType.EXPENSE : TransactionType.INCOME)
                .description(truncate(description.trim()))
                .transactionDate(date)
                .category(categorizer.categorize(item.categoryHint()))
                .status(item.isPending() ? TransactionStatus.PENDING : TransactionStatus.COMPLETED)
                .companyId(companyId)
                .accountId(account.getId())
                .externalId(item.transactionId())
                .source(IngestionSource.AGGREGATOR)
                .currency(currency)
                .build();
    }

    private static String truncate(String description) {
        if (description == null || description.length() <= MAX_DESCRIPTION_LENGTH) return description;
        return description.substring(0, MAX_DESCRIPTION_LENGTH);
    }

    private static IngestionOutcome outcome(List<String> errors) {
        return errors.isEmpty() ? IngestionOutcome.COMPLETED : IngestionOutcome.COMPLETED_WITH_ERRORS;
    }

    private static IngestionRunSummaryDTO summary(int count, int skipped, List<String> errors, int accountsCreated, int accountsUpdated) {
        return IngestionRunSummaryDTO.builder()
                .success(true)
                .count(count)
                .skipped(skipped)
                .errors(List.copyOf(errors))
                .accountsCreated(accountsCreated)
                .accountsUpdated(accountsUpdated)
                .build();
    }

    private static void logFailure(IngestionSource source, UUID userId, IngestionException e) {
        log.warn("[Ingestion] {} run aborted user={} reason={} excerpt='{}'",
                source, userId, e.getReason(), e.getDiagnosticExcerpt());
    }
}
