package com.numera.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "numera.processor")
public class ProcessorProperties {
    private int pageSize = 100;
    private int maxRecordsPerRun = 100;
    private int timeoutSeconds = 30;
}
