package com.numera.backend.services.processor;

/**
 * Raw balance-transaction as listed by the processor.
 *
 * @param amount  signed, in the currency's minor unit
 * @param created epoch seconds
 */
public record ProcessorRecord(
        String id,
        long amount,
        String currency,
        String type,
        String description,
        long created
) {
}
