package com.numera.backend.services.aggregator;

import java.util.List;

/**
 * Everything one sync run pulled from the feed.
 *
 * @param nextCursor cursor after the last fetched page; stored only once the items are written
 * @param complete   false when the per-run cap stopped the loop before the feed was drained
 */
public record AggregatorFetch(
        List<AggregatorTransaction> added,
        String nextCursor,
        boolean complete,
        int modifiedCount,
        int removedCount,
        int pages
) {
    public AggregatorFetch {
        added = added == null ? List.of() : List.copyOf(added);
    }
}
