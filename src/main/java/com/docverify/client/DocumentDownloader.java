package com.docverify.client;

import com.docverify.config.ExtractionConfig;
import com.docverify.exception.ExtractionException;
import com.docverify.exception.TransientExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Fetches the submitted document. The URL is assumed to have passed SSRF validation upstream.
 */
@Component
public class DocumentDownloader {

    private static final Logger log = LoggerFactory.getLogger(DocumentDownloader.class);

    private static final String DEFAULT_MEDIA_TYPE = "image/jpeg";
    private static final Map<String, String> MEDIA_TYPES_BY_EXTENSION = Map.of(
            "pdf", "application/pdf",
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "webp", "image/webp");

    private final HttpClient httpClient;
    private final ExtractionConfig config;

    public DocumentDownloader(HttpClient httpClient, ExtractionConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    public DownloadedDocument download(String fileUrl) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(fileUrl))
                    .header("User-Agent", config.getUserAgent())
                    .timeout(Duration.ofMillis(config.getDownloadTimeoutMs()))
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ExtractionException("Invalid document URL: " + fileUrl, e);
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new TransientExtractionException("Failed to download document: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExtractionException("Interrupted while downloading document", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            closeQuietly(response.body());
            throw new TransientExtractionException("Document host returned HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            closeQuietly(response.body());
            throw new ExtractionException("Document download failed with HTTP " + status);
        }

        byte[] content = readCapped(response.body());
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        String mediaType = detectMediaType(contentType, fileUrl);
        log.debug("Downloaded document {} ({} bytes, {})", fileUrl, content.length, mediaType);
        return new DownloadedDocument(content, mediaType);
    }

    private byte[] readCapped(InputStream body) {
        long limit = config.getMaxDocumentBytes();
        try (InputStream in = body) {
            byte[] content = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 1, limit + 1));
            if (content.length > limit) {
                throw new ExtractionException(String.format(
                        "Document exceeds maximum size of %d bytes", limit));
            }
            return content;
        } catch (IOException e) {
            throw new TransientExtractionException("Failed to read document body: " + e.getMessage(), e);
        }
    }

    /**
     * Media type from the Content-Type header when it names a supported type, else from the URL
     * extension, else image/jpeg.
     */
    static String detectMediaType(String contentType, String url) {
        if (contentType != null) {
            String lower = contentType.toLowerCase(Locale.ROOT);
            if (lower.contains("pdf")) return "application/pdf";
            if (lower.contains("png")) return "image/png";
            if (lower.contains("gif")) return "image/gif";
            if (lower.contains("webp")) return "image/webp";
            if (lower.contains("jpeg") || lower.contains("jpg")) return "image/jpeg";
        }
        String path = url.split("\\?")[0];
        int dot = path.lastIndexOf('.');
        if (dot < 0) return DEFAULT_MEDIA_TYPE;
        String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return MEDIA_TYPES_BY_EXTENSION.getOrDefault(extension, DEFAULT_MEDIA_TYPE);
    }

    private static void closeQuietly(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Failed to close response body: {}", e.getMessage());
        }
    }
}
