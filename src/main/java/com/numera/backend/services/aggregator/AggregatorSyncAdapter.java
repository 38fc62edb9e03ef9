package com.numera.backend.services.aggregator;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.numera.backend.config.AggregatorProperties;
import com.numera.backend.entities.Account;
import com.numera.backend.exceptions.InputRejectedException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains the incremental feed of one linked account, page after page. Never writes the cursor:
 * a failure on any page propagates and the stored position stays where it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregatorSyncAdapter {

    private final AggregatorClient client;
    private final AggregatorProperties properties;

    public AggregatorFetch fetch(Account account) {
        String accessToken = account.getAccessToken();
        if (accessToken == null || accessToken.isBlank()) {
            throw new InputRejectedException("credential-missing", "The account has no stored aggregator credential");
        }

        String cursor = account.getSyncCursor();
        int cap = Math.max(1, properties.getMaxRecordsPerRun());
        int pageSize = Math.max(1, properties.getPageSize());
        int maxPages = Math.max(1, properties.getMaxPagesPerRun());

        List<AggregatorTransaction> added = new ArrayList<>();
        int modified = 0;
        int removed = 0;
        int pages = 0;
        boolean hasMore = true;

        while (hasMore && added.size() < cap && pages < maxPages) {
            AggregatorSyncResponse page = client.syncPage(accessToken, cursor, pageSize);
            pages++;

            added.addAll(page.addedOrEmpty());
            modified += page.modifiedCount();
            removed += page.removedCount();
            if (page.nextCursor() != null && !page.nextCursor().isBlank()) {
                cursor = page.nextCursor();
            }
            hasMore = page.hasMore();
        }

        if (hasMore && pages >= maxPages) {
            log.warn("[AggregatorSync] account={} page limit of {} reached with {} records; remainder left for the next run",
                    account.getId(), maxPages, added.size());
        } else if (hasMore) {
            log.info("[AggregatorSync] account={} cap of {} records reached after {} pages; remainder left for the next run",
                    account.getId(), cap, pages);
        }
        if (modified > 0 || removed > 0) {
            // ledger rows are immutable here; upstream edits are only reported
            log.info("[AggregatorSync] account={} ignored modified={} removed={}", account.getId(), modified, removed);
        }
        log.info("[AggregatorSync] account={} pages={} added={}", account.getId(), pages, added.size());

        return new AggregatorFetch(added, cursor, !hasMore, modified, removed, pages);
    }
}
