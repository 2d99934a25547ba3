package com.trace.export.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.trace.export.wire.Batch;
import com.trace.export.wire.BatchJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link Uploader} that posts each batch as JSON to an HTTP collector.
 *
 * <pre>
 * HttpCollectorUploader uploader = HttpCollectorUploader.builder()
 *     .collectorUrl("http://localhost:14268/api/traces")
 *     .header("Authorization", "Bearer " + token)
 *     .build();
 * </pre>
 */
public class HttpCollectorUploader implements Uploader {
    private static final Logger log = LoggerFactory.getLogger(HttpCollectorUploader.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final URI collectorUri;
    private final Duration timeout;
    private final Map<String, String> headers;
    private final HttpClient httpClient;
    private final BatchJsonCodec codec;

    private HttpCollectorUploader(Builder builder, URI collectorUri) {
        this.collectorUri = collectorUri;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.headers = Map.copyOf(builder.headers);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.codec = new BatchJsonCodec();
    }

    @Override
    public void upload(Batch batch) throws UploadException {
        byte[] body;
        try {
            body = codec.encode(batch);
        } catch (JsonProcessingException e) {
            throw new UploadException("Failed to encode batch: " + e.getMessage(), e);
        }

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(collectorUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(requestBuilder::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UploadException("Failed to send batch to " + collectorUri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadException("Interrupted while sending batch to " + collectorUri, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new UploadException("Collector returned status " + status + ": " + response.body(), status);
        }
        log.debug("Uploaded {} spans ({} bytes) to {}", batch.size(), body.length, collectorUri);
    }

    public URI getCollectorUri() {
        return collectorUri;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String collectorUrl;
        private Duration timeout;
        private final Map<String, String> headers = new LinkedHashMap<>();

        public Builder collectorUrl(String collectorUrl) {
            this.collectorUrl = collectorUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new ExporterConfigurationException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Adds a header sent with every upload, e.g. for authentication.
         */
        public Builder header(String name, String value) {
            if (name == null || name.isBlank() || value == null) {
                throw new ExporterConfigurationException("header name and value are required");
            }
            headers.put(name, value);
            return this;
        }

        /**
         * @throws ExporterConfigurationException if the collector URL is missing or not an absolute http(s) URL
         */
        public HttpCollectorUploader build() {
            if (collectorUrl == null || collectorUrl.isBlank()) {
                throw new ExporterConfigurationException("collectorUrl is required");
            }
            URI uri;
            try {
                uri = URI.create(collectorUrl);
            } catch (IllegalArgumentException e) {
                throw new ExporterConfigurationException("Invalid collector URL: " + collectorUrl, e);
            }
            String scheme = uri.getScheme();
            if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
                throw new ExporterConfigurationException(
                        "Collector URL must be an absolute http or https URL: " + collectorUrl);
            }
            return new HttpCollectorUploader(this, uri);
        }
    }
}
