package com.numera.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "numera.aggregator")
public class AggregatorProperties {
    private String clientId = "";
    private String secret = "";
    private String env = "sandbox";
    private String baseUrl;
    private int pageSize = 500;
    private int maxRecordsPerRun = 5000;
    private int maxPagesPerRun = 50;
    private int connectTimeoutMillis = 5000;
    private int readTimeoutMillis = 30000;

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            String url = baseUrl.trim();
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
        return switch (env == null ? "" : env.toLowerCase()) {
            case "production" -> "https://production.plaid.com";
            case "development" -> "https://development.plaid.com";
            default -> "https://sandbox.plaid.com";
        };
    }
}
