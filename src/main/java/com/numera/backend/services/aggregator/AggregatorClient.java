package com.numera.backend.services.aggregator;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import com.numera.backend.config.AggregatorProperties;
import com.numera.backend.exceptions.UpstreamServiceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Thin HTTP client for the aggregator's incremental transactions/sync endpoint. One call, one page.
 */
@Component
@Slf4j
public class AggregatorClient {

    private final RestTemplate restTemplate;
    private final AggregatorProperties properties;
    private final String baseUrl;

    public AggregatorClient(RestTemplate aggregatorRestTemplate, AggregatorProperties properties) {
        this.restTemplate = aggregatorRestTemplate;
        this.properties = properties;
        this.baseUrl = properties.resolveBaseUrl();
        log.info("[AggregatorClient] Configured baseUrl={}", this.baseUrl);
    }

    /**
     * @param cursor null on the very first sync of an item
     */
    public AggregatorSyncResponse syncPage(String accessToken, String cursor, int count) {
        Map<String, Object> body = new HashMap<>();
        body.put("client_id", properties.getClientId());
        body.put("secret", properties.getSecret());
        body.put("access_token", accessToken);
        body.put("count", count);
        if (cursor != null) body.put("cursor", cursor);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<AggregatorSyncResponse> response = restTemplate.postForEntity(
                    baseUrl + "/transactions/sync", new HttpEntity<>(body, headers), AggregatorSyncResponse.class);
            AggregatorSyncResponse page = response.getBody();
            if (page == null) {
                throw new UpstreamServiceException("aggregator-error", "The bank aggregator returned an empty page", null, null);
            }
            return page;
        } catch (HttpStatusCodeException e) {
            String payload = e.getResponseBodyAsString();
            log.error("[AggregatorClient] sync failed status={}", e.getStatusCode());
            throw new UpstreamServiceException("aggregator-error",
                    "The bank aggregator rejected the sync request (status " + e.getStatusCode().value() + ")", payload, e);
        } catch (ResourceAccessException e) {
            log.error("[AggregatorClient] aggregator unreachable: {}", e.getMessage());
            throw new UpstreamServiceException("aggregator-unreachable", "The bank aggregator could not be reached", null, e);
        }
    }
}
