package com.numera.backend.services.processor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.numera.backend.config.ProcessorProperties;
import com.numera.backend.enums.TransactionCategory;
import com.numera.backend.enums.TransactionType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls processor balance transactions and maps them to ledger entries. Capped per run; no
 * cursor is kept because every record carries a stable id used for dedup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProcessorLedgerAdapter {

    private static final Set<String> OUTFLOW_TYPES = Set.of("stripe_fee", "payout", "refund", "adjustment");

    // ISO 4217 currencies the processor bills without a minor unit
    private static final Set<String> ZERO_DECIMAL_CURRENCIES = Set.of(
            "bif", "clp", "djf", "gnf", "jpy", "kmf", "krw", "mga", "pyg", "rwf",
            "ugx", "vnd", "vuv", "xaf", "xof", "xpf");

    private final PaymentProcessorClient client;
    private final ProcessorProperties properties;

    /**
     * @return the processor account id behind the key, null when it is not readable
     */
    public String verifyKey(String apiKey) {
        String accountId = client.verifyApiKey(apiKey);
        log.info("[ProcessorSync] API key accepted (account={})", accountId == null ? "n/a" : accountId);
        return accountId;
    }

    public List<ProcessorEntry> fetch(String apiKey) {
        int cap = Math.max(1, properties.getMaxRecordsPerRun());
        int pageSize = Math.max(1, Math.min(properties.getPageSize(), cap));

        List<ProcessorEntry> entries = new ArrayList<>();
        String startingAfter = null;
        int pages = 0;

        while (entries.size() < cap) {
            ProcessorPage page = client.listBalanceTransactions(apiKey, startingAfter, pageSize);
            pages++;

            for (ProcessorRecord record : page.records()) {
                if (entries.size() >= cap) break;
                entries.add(map(record));
            }
            if (!page.hasMore() || page.records().isEmpty() || page.records().size() < pageSize) break;
            startingAfter = page.records().get(page.records().size() - 1).id();
        }

        log.info("[ProcessorSync] fetched {} records in {} pages (cap={})", entries.size(), pages, cap);
        return entries;
    }

    ProcessorEntry map(ProcessorRecord record) {
        String type = record.type() == null ? "" : record.type().toLowerCase(Locale.ROOT);
        TransactionType direction = OUTFLOW_TYPES.contains(type) ? TransactionType.EXPENSE : TransactionType.INCOME;

        String description = record.description();
        if (description == null || description.isBlank()) {
            String id = record.id() == null ? "" : record.id();
            description = type + " - " + id.substring(0, Math.min(8, id.length()));
        }

        return new ProcessorEntry(
                record.id(),
                toMajorUnits(record.amount(), record.currency()),
                direction,
                categorize(type, description, direction),
                description,
                Instant.ofEpochSecond(record.created()).atZone(ZoneOffset.UTC).toLocalDate(),
                record.currency() == null ? null : record.currency().toUpperCase(Locale.ROOT)
        );
    }

    private static TransactionCategory categorize(String type, String description, TransactionType direction) {
        if ("stripe_fee".equals(type) || description.toLowerCase(Locale.ROOT).contains("stripe fee")) {
            return TransactionCategory.TAX;
        }
        if (direction == TransactionType.INCOME) {
            return TransactionCategory.SERVICES;
        }
        return TransactionCategory.OTHER;
    }

    static BigDecimal toMajorUnits(long minorUnits, String currency) {
        BigDecimal abs = BigDecimal.valueOf(Math.abs(minorUnits));
        if (currency != null && ZERO_DECIMAL_CURRENCIES.contains(currency.toLowerCase(Locale.ROOT))) {
            return abs.setScale(2);
        }
        return abs.movePointLeft(2);
    }

    /**
     * Processor record mapped to ledger terms. Amount is unsigned.
     */
    public record ProcessorEntry(
            String externalId,
            BigDecimal amount,
            TransactionType type,
            TransactionCategory category,
            String description,
            LocalDate date,
            String currency
    ) {
    }
}
