package com.numera.backend.services.processor;

/**
 * Offset-paginated ledger query of the payment processor. The API key is passed on every
 * call; implementations keep no credential of their own.
 */
public interface PaymentProcessorClient {

    /**
     * @param startingAfter id of the last record of the previous page, null for the first page
     */
    ProcessorPage listBalanceTransactions(String apiKey, String startingAfter, int limit);

    /**
     * Checks that the processor accepts the key.
     *
     * @return the processor account id, or null when the key can read the balance but not the account
     * @throws com.numera.backend.exceptions.InputRejectedException when the key is refused
     */
    String verifyApiKey(String apiKey);
}
