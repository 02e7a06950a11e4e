package com.docverify.client;

import com.docverify.config.ExtractionConfig;
import com.docverify.exception.ExtractionException;
import com.docverify.exception.TransientExtractionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentDownloaderTest {

    private static final String URL = "https://files.example.com/doc.png";

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<InputStream> response;

    private ExtractionConfig config;
    private DocumentDownloader downloader;

    @BeforeEach
    void setUp() {
        config = new ExtractionConfig();
        downloader = new DocumentDownloader(httpClient, config);
    }

    private void givenResponse(int status, byte[] body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(new ByteArrayInputStream(body));
        when(httpClient.<InputStream>send(any(HttpRequest.class), any())).thenReturn(response);
    }

    @Test
    void download_ok_returnsContentAndHeaderMediaType() throws Exception {
        givenResponse(200, new byte[]{1, 2, 3});
        when(response.headers()).thenReturn(HttpHeaders.of(
                Map.of("Content-Type", List.of("application/pdf")), (name, value) -> true));

        DownloadedDocument document = downloader.download(URL);

        assertThat(document.content()).containsExactly(1, 2, 3);
        assertThat(document.mediaType()).isEqualTo("application/pdf");
        assertThat(document.size()).isEqualTo(3);
    }

    @Test
    void download_serverError_transient() throws Exception {
        givenResponse(503, new byte[0]);

        assertThatThrownBy(() -> downloader.download(URL))
                .isInstanceOf(TransientExtractionException.class)
                .hasMessage("Document host returned HTTP 503");
    }

    @Test
    void download_notFound_permanent() throws Exception {
        givenResponse(404, new byte[0]);

        assertThatThrownBy(() -> downloader.download(URL))
                .isInstanceOf(ExtractionException.class)
                .isNotInstanceOf(TransientExtractionException.class);
    }

    @Test
    void download_connectionRefused_transient() throws Exception {
        when(httpClient.<InputStream>send(any(HttpRequest.class), any()))
                .thenThrow(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> downloader.download(URL))
                .isInstanceOf(TransientExtractionException.class)
                .hasMessageContaining("Connection refused");
    }

    @Test
    void download_tooLarge_rejected() throws Exception {
        config.setMaxDocumentBytes(4);
        givenResponse(200, new byte[]{1, 2, 3, 4, 5});

        assertThatThrownBy(() -> downloader.download(URL))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Document exceeds maximum size of 4 bytes");
    }

    @Test
    void download_invalidUrl_rejected() {
        assertThatThrownBy(() -> downloader.download("not a url"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageStartingWith("Invalid document URL");
    }

    @Test
    void detectMediaType_headerThenExtensionThenDefault() {
        assertThat(DocumentDownloader.detectMediaType("image/PNG; charset=binary", URL)).isEqualTo("image/png");
        assertThat(DocumentDownloader.detectMediaType("application/octet-stream", "https://x.io/a.pdf?sig=1"))
                .isEqualTo("application/pdf");
        assertThat(DocumentDownloader.detectMediaType(null, "https://x.io/scan.WEBP")).isEqualTo("image/webp");
        assertThat(DocumentDownloader.detectMediaType(null, "https://x.io/download")).isEqualTo("image/jpeg");
        assertThat(DocumentDownloader.detectMediaType(null, "https://x.io/a.tiff")).isEqualTo("image/jpeg");
    }
}
