package com.numera.backend.services.processor;

import java.util.List;

public record ProcessorPage(List<ProcessorRecord> records, boolean hasMore) {

    public ProcessorPage {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
