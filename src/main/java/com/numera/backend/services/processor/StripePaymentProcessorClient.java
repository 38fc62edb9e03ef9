package com.numera.backend.services.processor;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.numera.backend.config.ProcessorProperties;
import com.numera.backend.exceptions.InputRejectedException;
import com.numera.backend.exceptions.UpstreamServiceException;
import com.stripe.exception.AuthenticationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Account;
import com.stripe.model.Balance;
import com.stripe.model.BalanceTransaction;
import com.stripe.model.BalanceTransactionCollection;
import com.stripe.net.RequestOptions;
import com.stripe.param.BalanceTransactionListParams;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class StripePaymentProcessorClient implements PaymentProcessorClient {

    private final ProcessorProperties properties;

    @Override
    public ProcessorPage listBalanceTransactions(String apiKey, String startingAfter, int limit) {
        BalanceTransactionListParams.Builder params = BalanceTransactionListParams.builder()
                .setLimit((long) limit);
        if (startingAfter != null) {
            params.setStartingAfter(startingAfter);
        }

        try {
            BalanceTransactionCollection page = BalanceTransaction.list(params.build(), options(apiKey));
            List<ProcessorRecord> records = new ArrayList<>();
            for (BalanceTransaction tx : page.getData()) {
                records.add(new ProcessorRecord(
                        tx.getId(),
                        tx.getAmount() == null ? 0L : tx.getAmount(),
                        tx.getCurrency(),
                        tx.getType(),
                        tx.getDescription(),
                        tx.getCreated() == null ? 0L : tx.getCreated()
                ));
            }
            return new ProcessorPage(records, Boolean.TRUE.equals(page.getHasMore()));
        } catch (AuthenticationException e) {
            log.warn("[Stripe] API key rejected: {}", e.getMessage());
            throw new UpstreamServiceException("processor-auth-failed", "The payment processor rejected the stored API key", null, e);
        } catch (StripeException e) {
            log.error("[Stripe] balance transaction listing failed (requestId={} code={}): {}",
                    e.getRequestId(), e.getCode(), e.getMessage());
            throw new UpstreamServiceException("processor-error", "The payment processor returned an error", e.getMessage(), e);
        }
    }

    @Override
    public String verifyApiKey(String apiKey) {
        RequestOptions options = options(apiKey);
        try {
            return Account.retrieve(options).getId();
        } catch (StripeException e) {
            // restricted and test keys may lack account read access
            log.info("[Stripe] account lookup refused ({}), checking balance access", e.getClass().getSimpleName());
        }

        try {
            Balance.retrieve(options);
            return null;
        } catch (AuthenticationException e) {
            log.warn("[Stripe] API key refused during verification: {}", e.getMessage());
            throw new InputRejectedException("processor-key-invalid", "The payment processor rejected the API key");
        } catch (StripeException e) {
            log.error("[Stripe] key verification failed (requestId={} code={}): {}",
                    e.getRequestId(), e.getCode(), e.getMessage());
            throw new UpstreamServiceException("processor-error", "The payment processor returned an error", e.getMessage(), e);
        }
    }

    private RequestOptions options(String apiKey) {
        int timeoutMillis = Math.max(1, properties.getTimeoutSeconds()) * 1000;
        // per-call options; the global Stripe.apiKey is never set
        return RequestOptions.builder()
                .setApiKey(apiKey)
                .setConnectTimeout(timeoutMillis)
                .setReadTimeout(timeoutMillis)
                .setMaxNetworkRetries(0)
                .build();
    }
}
