package com.numera.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate used by the bank aggregator client.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate aggregatorRestTemplate(RestTemplateBuilder builder, AggregatorProperties aggregatorProperties) {
        int connectMillis = aggregatorProperties.getConnectTimeoutMillis() > 0 ? aggregatorProperties.getConnectTimeoutMillis() : 5000;
        int readMillis = aggregatorProperties.getReadTimeoutMillis() > 0 ? aggregatorProperties.getReadTimeoutMillis() : 30000;

        return builder
                .setConnectTimeout(Duration.ofMillis(connectMillis))
                .setReadTimeout(Duration.ofMillis(readMillis))
                .build();
    }
}
