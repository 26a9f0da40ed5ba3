package com.address.resolution.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.zip.GZIPInputStream;

/**
 * {@link LookupClient} for the OGCIO Address Lookup Service.
 *
 * <p>Sends {@code GET <baseUrl>?q=<address>&n=<maxSuggestions>} and parses the JSON body.</p>
 *
 * <pre>
 * LookupClient client = OgcioLookupClient.builder()
 *     .baseUrl("https://www.als.gov.hk/lookup")
 *     .maxSuggestions(1)
 *     .build();
 * </pre>
 */
public class OgcioLookupClient implements LookupClient {
    private static final Logger log = LoggerFactory.getLogger(OgcioLookupClient.class);

    public static final String DEFAULT_BASE_URL = "https://www.als.gov.hk/lookup";
    private static final int DEFAULT_MAX_SUGGESTIONS = 1;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final int maxSuggestions;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OgcioLookupClient(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.maxSuggestions = builder.maxSuggestions;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public JsonNode lookup(String query) throws LookupException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(buildUri(query))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("Accept-Language", "en,zh-Hant")
                .header("Accept-Encoding", "gzip")
                .GET()
                .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new LookupException("Lookup request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LookupException("Interrupted during lookup request", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new LookupException("Lookup service returned status " + status, status);
        }

        try (InputStream body = decode(response)) {
            JsonNode json = objectMapper.readTree(body);
            if (json == null || json.isMissingNode()) {
                throw new LookupException("Lookup service returned an empty body", status);
            }
            log.debug("lookup.response query='{}' bytes={}", query, response.body().length);
            return json;
        } catch (JsonProcessingException e) {
            throw new LookupException("Malformed lookup response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LookupException("Unreadable lookup response: " + e.getMessage(), e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    URI buildUri(String query) {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator
                + "q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&n=" + maxSuggestions);
    }

    private static InputStream decode(HttpResponse<byte[]> response) throws IOException {
        InputStream raw = new ByteArrayInputStream(response.body());
        boolean gzipped = response.headers().firstValue("Content-Encoding")
                .map(enc -> enc.equalsIgnoreCase("gzip"))
                .orElse(false);
        return gzipped ? new GZIPInputStream(raw) : raw;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a client for the public OGCIO endpoint with default settings.
     */
    public static OgcioLookupClient createDefault() {
        return builder().build();
    }

    public static class Builder {
        private String baseUrl;
        private int maxSuggestions = DEFAULT_MAX_SUGGESTIONS;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder maxSuggestions(int maxSuggestions) {
            if (maxSuggestions <= 0) {
                throw new IllegalArgumentException("maxSuggestions must be > 0");
            }
            this.maxSuggestions = maxSuggestions;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OgcioLookupClient build() {
            return new OgcioLookupClient(this);
        }
    }
}
