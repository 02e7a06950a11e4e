package com.docverify.client;

import com.docverify.config.ExtractionConfig;
import com.docverify.exception.ExtractionException;
import com.docverify.exception.TransientExtractionException;
import com.docverify.model.DocumentTypeConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the AI extraction collaborator: downloads the document, posts it with the type's
 * required fields, validation rules and the client metadata, and parses the verdict.
 *
 * Network failures, timeouts, 429 and 5xx surface as {@link TransientExtractionException};
 * an unusable answer as {@link com.docverify.exception.MalformedExtractionResponseException}.
 */
@Component
public class ExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(ExtractionClient.class);

    private final HttpClient httpClient;
    private final DocumentDownloader downloader;
    private final ExtractionResponseParser parser;
    private final ExtractionConfig config;
    private final ObjectMapper objectMapper;

    public ExtractionClient(HttpClient httpClient, DocumentDownloader downloader,
                            ExtractionResponseParser parser, ExtractionConfig config) {
        this.httpClient = httpClient;
        this.downloader = downloader;
        this.parser = parser;
        this.config = config;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @param typeConfig document type configuration, or null for an unconfigured type
     */
    @Observed(name = "extraction.extract", contextualName = "extract-document")
    public ExtractionOutcome extract(String fileUrl, String documentType,
                                     DocumentTypeConfig typeConfig, Map<String, String> metadata) {
        DownloadedDocument document = downloader.download(fileUrl);

        ExtractionRequest body = ExtractionRequest.builder()
                .documentType(documentType)
                .mediaType(document.mediaType())
                .documentBase64(Base64.getEncoder().encodeToString(document.content()))
                .requiredFields(typeConfig != null ? typeConfig.getRequiredFields() : List.of())
                .validationRules(typeConfig != null ? typeConfig.getValidationRules() : new LinkedHashMap<>())
                .metadata(metadata != null ? metadata : new LinkedHashMap<>())
                .build();

        String responseBody = post(body);
        ExtractionOutcome outcome = parser.parse(responseBody);
        log.debug("Extraction for {} document returned status={}, confidence={}, risk={}",
                documentType, outcome.result().getStatus(), outcome.result().getConfidence(),
                outcome.result().getRiskScore());
        return outcome;
    }

    private String post(ExtractionRequest body) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(config.getServiceUrl()))
                    .header("Content-Type", "application/json")
                    .header("User-Agent", config.getUserAgent())
                    .timeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                    .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)));
            if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
                builder.header("Authorization", "Bearer " + config.getApiKey());
            }
            request = builder.build();
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Failed to serialize extraction request", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientExtractionException("Extraction service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExtractionException("Interrupted while waiting for extraction service", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientExtractionException("Extraction service returned HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new ExtractionException("Extraction service rejected the request: HTTP " + status);
        }
        return response.body();
    }
}
