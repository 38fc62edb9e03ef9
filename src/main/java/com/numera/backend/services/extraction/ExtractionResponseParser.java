package com.numera.backend.services.extraction;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numera.backend.exceptions.ValidationFailureException;
import com.numera.backend.services.extraction.CandidateValidator.Validated;
import com.numera.backend.services.extraction.repair.RepairChain;
import com.numera.backend.services.extraction.repair.ResponseSlicer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Model response text to validated candidates: slice, repair chain, then per-record
 * classification, repair and validation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionResponseParser {

    private final RepairChain repairChain;
    private final RecordClassifier classifier;
    private final RecordRepairer repairer;
    private final CandidateValidator validator;

    public ExtractionBatch parse(String raw) {
        String sliced = ResponseSlicer.slice(raw);
        RepairChain.Result parsed = repairChain.run(sliced);

        List<CandidateTransaction> transactions = new ArrayList<>();
        List<ExtractedAccount> accounts = new ArrayList<>();
        int dropped = 0;

        int index = 0;
        for (ObjectNode record : parsed.records()) {
            index++;
            switch (classifier.classify(record)) {
                case ACCOUNT -> {
                    Validated<ExtractedAccount> v = validator.validateAccount(repairer.repairAccount(record));
                    if (v.isValid()) {
                        accounts.add(v.value());
                    } else {
                        dropped++;
                        log.warn("[RepairPipeline] dropped account record #{}: {}", index, v.rejection());
                    }
                }
                case TRANSACTION -> {
                    Validated<CandidateTransaction> v = validator.validateTransaction(repairer.repairTransaction(record));
                    if (v.isValid()) {
                        transactions.add(v.value());
                    } else {
                        dropped++;
                        log.warn("[RepairPipeline] dropped transaction record #{}: {}", index, v.rejection());
                    }
                }
                default -> {
                    dropped++;
                    log.warn("[RepairPipeline] dropped record #{}: neither transaction nor account (keys={})",
                            index, fieldNames(record));
                }
            }
        }

        ExtractionBatch batch = new ExtractionBatch(transactions, accounts, dropped, parsed.stage());
        if (batch.isEmpty()) {
            throw new ValidationFailureException("No usable record in the extraction response", sliced);
        }

        log.info("[RepairPipeline] accepted {} transactions, {} accounts, dropped {} (stage={})",
                transactions.size(), accounts.size(), dropped, parsed.stage());
        return batch;
    }

    private static List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
