package io.github.drompincen.payverify.runtime.verification.ocr;

import io.github.drompincen.payverify.runtime.verification.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

@Component
public class DocumentContentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentContentLoader.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public DocumentContentLoader(@Value("${payverify.ocr.download-timeout:30s}") Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public byte[] load(String storageUri) {
        if (storageUri == null || storageUri.isBlank()) {
            throw new ExtractionException("Document has no storage location");
        }
        String lower = storageUri.toLowerCase(Locale.ROOT);
        try {
            if (lower.startsWith("http://") || lower.startsWith("https://")) {
                return download(storageUri);
            }
            Path path = lower.startsWith("file:") ? Path.of(URI.create(storageUri)) : Path.of(storageUri);
            log.debug("Reading document from {}", path);
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ExtractionException("Failed to load document from " + storageUri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while downloading " + storageUri, e);
        }
    }

    private byte[] download(String url) throws IOException, InterruptedException {
        log.info("Downloading document from {}", url);
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("HTTP " + response.statusCode());
        }
        return response.body();
    }
}
