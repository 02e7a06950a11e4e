package com.docverify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "extraction")
public class ExtractionConfig {

    // Endpoint of the AI extraction service (receives the document and returns the verdict JSON).
    private String serviceUrl = "http://localhost:8090/v1/extract";
    private String apiKey;
    private long requestTimeoutMs = 120000;
    private long downloadTimeoutMs = 30000;
    private long maxDocumentBytes = 20L * 1024 * 1024;
    private String userAgent = "DocumentVerificationService/1.0";
}
