package com.numera.backend.services.aggregator;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregatorSyncResponse(
        List<AggregatorTransaction> added,
        List<AggregatorTransaction> modified,
        List<RemovedTransaction> removed,
        @JsonProperty("next_cursor") String nextCursor,
        @JsonProperty("has_more") boolean hasMore,
        @JsonProperty("request_id") String requestId
) {

    public List<AggregatorTransaction> addedOrEmpty() {
        return added == null ? List.of() : added;
    }

    public int modifiedCount() {
        return modified == null ? 0 : modified.size();
    }

    public int removedCount() {
        return removed == null ? 0 : removed.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RemovedTransaction(@JsonProperty("transaction_id") String transactionId) {
    }
}
